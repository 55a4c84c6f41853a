package com.sds.phucth.sessioncontext.consts;

import java.util.List;

public interface ApprovalConstants {
    interface Phrases {
        List<String> APPROVAL = List.of("send it", "send", "approve", "yes", "confirm", "go ahead", "submit");
        List<String> REJECTION = List.of("cancel", "no", "reject", "stop", "don't", "abort");
    }

    interface AuditStatus {
        String DISPATCHED = "Dispatched";
        String DISPATCH_FAILED = "DispatchFailed";
    }

    interface Messages {
        String NOTHING_TO_APPROVE = "There is no pending action to approve for this conversation.";
        String REJECTED = "Okay, the action was cancelled and nothing was sent.";
        String DISPATCHED = "Done! Your action was approved and sent.";
        String DISPATCH_FAILED = "Your action was approved but delivery failed. You can ask me to prepare it again.";
        String APPROVAL_HINT = "Reply 'send it' to approve, or 'cancel' to discard.";
    }
}
