package com.sds.phucth.sessioncontext.dto;

public enum ResolutionOutcome {
    REJECTED,
    DISPATCHED,
    DISPATCH_FAILED
}
