package com.sds.phucth.sessioncontext.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    INVALID_PAYLOAD("INVALID_PAYLOAD", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    NOTHING_TO_APPROVE("NOTHING_TO_APPROVE", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    STORAGE_UNAVAILABLE("STORAGE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
