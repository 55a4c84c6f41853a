package com.sds.phucth.sessioncontext.exceptions;

import com.sds.phucth.sessioncontext.consts.ApprovalConstants;

import java.util.Map;

/**
 * Nothing is awaiting approval for the session. Informational for the user, not a failure.
 */
public class PendingActionNotFoundException extends BaseException {

    public PendingActionNotFoundException(String sessionId) {
        super(ErrorCode.NOTHING_TO_APPROVE, ApprovalConstants.Messages.NOTHING_TO_APPROVE, Map.of("sessionId", sessionId));
    }
}
