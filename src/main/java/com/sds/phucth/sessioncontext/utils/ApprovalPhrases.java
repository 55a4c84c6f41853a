package com.sds.phucth.sessioncontext.utils;

import com.sds.phucth.sessioncontext.consts.ApprovalConstants;
import com.sds.phucth.sessioncontext.dto.ApprovalDecision;

import java.util.List;
import java.util.Locale;

/**
 * Maps free chat text onto an approval decision using the fixed phrase tables in
 * {@link ApprovalConstants.Phrases}. Matching is case-insensitive substring matching and a
 * rejection phrase always wins over an approval phrase.
 */
public final class ApprovalPhrases {

    private ApprovalPhrases() {
    }

    public static ApprovalDecision classify(String text) {
        if (text == null || text.isBlank()) {
            return ApprovalDecision.NONE;
        }
        String normalized = text.toLowerCase(Locale.ROOT).replace('’', '\'').strip();
        if (containsAny(normalized, ApprovalConstants.Phrases.REJECTION)) {
            return ApprovalDecision.REJECT;
        }
        if (containsAny(normalized, ApprovalConstants.Phrases.APPROVAL)) {
            return ApprovalDecision.APPROVE;
        }
        return ApprovalDecision.NONE;
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
