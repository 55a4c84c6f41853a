package com.sds.phucth.sessioncontext.dto;

/**
 * How a classified chat turn is handled.
 */
public enum HandlingMode {
    /** Result delivered immediately; the approval flow is bypassed. */
    DIRECT_EXECUTE,
    /** Always proposed and held until the user approves or rejects. */
    REQUIRES_APPROVAL,
    /** Content is produced once and shown as the chat summary and held as the proposal. */
    SEQUENTIAL_BOTH_STAGES
}
