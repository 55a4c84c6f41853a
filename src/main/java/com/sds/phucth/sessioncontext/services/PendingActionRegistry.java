package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.dto.PendingAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory map of the single pending action per session.
 *
 * <p>Every read-decide-write sequence on a session must run inside
 * {@link #withSessionLock(String, Supplier)}. Locks are striped, so unrelated sessions
 * rarely contend and the lock table never grows.
 */
@Component
public class PendingActionRegistry {

    private static final int LOCK_STRIPES = 64;

    private final Map<String, PendingAction> actions = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public PendingActionRegistry() {
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withSessionLock(String sessionId, Supplier<T> work) {
        ReentrantLock lock = locks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public Optional<PendingAction> find(String sessionId) {
        return Optional.ofNullable(actions.get(sessionId));
    }

    /**
     * @return the action this one replaced, if any
     */
    public Optional<PendingAction> put(PendingAction action) {
        return Optional.ofNullable(actions.put(action.getSessionId(), action));
    }

    public Optional<PendingAction> remove(String sessionId) {
        return Optional.ofNullable(actions.remove(sessionId));
    }

    public List<PendingAction> snapshot() {
        return List.copyOf(actions.values());
    }

    public int size() {
        return actions.size();
    }
}
