package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.dto.DispatchResult;

import java.util.Map;

/**
 * Delivers an approved action to the automation system. Implementations report failure in
 * the returned result instead of throwing.
 */
public interface ActionDispatcher {

    DispatchResult send(String sessionId, String intent, Map<String, Object> payload);
}
