package com.sds.phucth.sessioncontext.exceptions;

import lombok.Getter;

/**
 * The durable store could not complete an operation. The message is generic on purpose;
 * driver detail only travels in the cause.
 */
@Getter
public class StorageUnavailableException extends BaseException {

    private final String operation;

    public StorageUnavailableException(String operation, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, "Storage is temporarily unavailable, please try again.", cause);
        this.operation = operation;
    }
}
