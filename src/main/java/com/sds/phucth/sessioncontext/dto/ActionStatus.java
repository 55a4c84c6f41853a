package com.sds.phucth.sessioncontext.dto;

public enum ActionStatus {
    PROPOSED,
    EDITED,
    APPROVED,
    REJECTED,
    DISPATCHED,
    EXPIRED
}
