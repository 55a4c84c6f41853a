package com.sds.phucth.sessioncontext.consts;

public interface ContextConstants {
    interface KeyFormat {
        String RECORD = "ctx:record:%s";
        String APPENDS = "ctx:appends:%s";
        String META = "ctx:meta:%s";
    }

    interface MetaField {
        String REVISION = "revision";
        String LAST_UPDATED = "lastUpdated";
        String EXPIRES_AT = "expiresAt";
    }

    interface Source {
        String ORCHESTRATOR = "orchestrator";
    }

    interface Limits {
        int MAX_SESSION_ID_LENGTH = 128;
        int MAX_SOURCE_LENGTH = 64;
        int MAX_PAGE_SIZE = 200;
        int MAX_PAYLOAD_BYTES = 1_000_000;
    }
}
