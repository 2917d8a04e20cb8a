package com.workflowplatform.orchestrator.risk;

import com.workflowplatform.common.risk.UserRiskState;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-wide per-user risk state.
 *
 * <p>Every mutation goes through {@link #update}, which runs under the map's per-key lock,
 * so concurrent executions for the same user never lose an update.
 */
public class UserRiskStateStore {

    private final ConcurrentHashMap<String, UserRiskState> states = new ConcurrentHashMap<>();

    /**
     * Atomically replaces the user's state with {@code fn(current)}; {@code current} is
     * {@code null} for a user seen for the first time. {@code fn} must be side-effect free
     * apart from capturing its own result.
     */
    public UserRiskState update(String userId, UnaryOperator<UserRiskState> fn) {
        return states.compute(userId, (id, current) -> fn.apply(current));
    }

    /** Applies {@code fn} only to users already present. */
    public UserRiskState updateIfPresent(String userId, UnaryOperator<UserRiskState> fn) {
        return states.computeIfPresent(userId, (id, current) -> fn.apply(current));
    }

    public UserRiskState get(String userId) {
        return states.get(userId);
    }

    public Set<String> userIds() {
        return Set.copyOf(states.keySet());
    }

    public List<UserRiskState> snapshot() {
        return List.copyOf(states.values());
    }

    public int size() {
        return states.size();
    }

    public void clear() {
        states.clear();
    }
}
