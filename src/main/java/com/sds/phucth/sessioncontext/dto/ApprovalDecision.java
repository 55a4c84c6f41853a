package com.sds.phucth.sessioncontext.dto;

public enum ApprovalDecision {
    APPROVE,
    REJECT,
    NONE
}
