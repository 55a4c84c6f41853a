package com.sds.phucth.sessioncontext.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sds.phucth.sessioncontext.consts.ApprovalConstants;
import com.sds.phucth.sessioncontext.dto.HandlingMode;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Renders the chat-visible summary of an action from the exact payload that will be sent.
 */
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ActionSummaryRenderer {

    ObjectMapper objectMapper;

    public String render(String intent, Map<String, Object> payload, HandlingMode mode) {
        StringBuilder sb = new StringBuilder();
        String title = humanize(intent);
        switch (mode) {
            case REQUIRES_APPROVAL -> sb.append("**Approval needed: ").append(title).append("**");
            case SEQUENTIAL_BOTH_STAGES -> sb.append("**Draft ready: ").append(title).append("**");
            default -> sb.append("**").append(title).append("**");
        }

        payload.forEach((field, value) -> sb.append("\n- ").append(field).append(": ").append(renderValue(value)));

        if (mode != HandlingMode.DIRECT_EXECUTE) {
            sb.append("\n\n").append(ApprovalConstants.Messages.APPROVAL_HINT);
        }
        return sb.toString();
    }

    private String renderValue(Object value) {
        if (value == null) {
            return "(empty)";
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    // send_email -> Send email
    private static String humanize(String intent) {
        String spaced = intent.replace('_', ' ').replace('-', ' ').strip();
        if (spaced.isEmpty()) {
            return intent;
        }
        return spaced.substring(0, 1).toUpperCase(Locale.ROOT) + spaced.substring(1);
    }
}
