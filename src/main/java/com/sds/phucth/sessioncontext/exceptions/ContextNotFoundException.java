package com.sds.phucth.sessioncontext.exceptions;

public class ContextNotFoundException extends BaseException {

    public ContextNotFoundException(String sessionId) {
        super(ErrorCode.NOT_FOUND, String.format("No context found for session: %s", sessionId));
    }
}
