package com.sds.phucth.sessioncontext.exceptions;

import java.util.Map;

public class InvalidPayloadException extends BaseException {

    public InvalidPayloadException(String field, String problem) {
        super(ErrorCode.INVALID_PAYLOAD, "Invalid payload: " + field + " " + problem, Map.of(field, problem));
    }
}
