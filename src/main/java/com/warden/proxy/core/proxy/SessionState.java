package com.warden.proxy.core.proxy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of one client connection.
 */
public enum SessionState {
    ACCEPTED,
    PARSING,
    MALFORMED,
    CLASSIFIED,
    POLICY_CHECK,
    BLOCKED,
    RATE_LIMITED,
    AUTHORIZED,
    CONNECTING,
    CONNECT_FAILED,
    CONNECTED,
    FORWARDING,
    TUNNELING,
    COMPLETED,
    FAILED;

    private static final Map<SessionState, Set<SessionState>> TRANSITIONS = new EnumMap<>(SessionState.class);

    static {
        TRANSITIONS.put(ACCEPTED, EnumSet.of(PARSING));
        TRANSITIONS.put(PARSING, EnumSet.of(MALFORMED, CLASSIFIED));
        TRANSITIONS.put(CLASSIFIED, EnumSet.of(POLICY_CHECK));
        TRANSITIONS.put(POLICY_CHECK, EnumSet.of(BLOCKED, RATE_LIMITED, AUTHORIZED));
        TRANSITIONS.put(AUTHORIZED, EnumSet.of(CONNECTING));
        TRANSITIONS.put(CONNECTING, EnumSet.of(CONNECT_FAILED, CONNECTED));
        TRANSITIONS.put(CONNECTED, EnumSet.of(FORWARDING, TUNNELING));
        TRANSITIONS.put(FORWARDING, EnumSet.of(COMPLETED, FAILED));
        TRANSITIONS.put(TUNNELING, EnumSet.of(COMPLETED, FAILED));
        for (SessionState state : values()) {
            TRANSITIONS.putIfAbsent(state, EnumSet.noneOf(SessionState.class));
        }
    }

    /**
     * @return States reachable from this one in a single step.
     */
    public Set<SessionState> successors() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(SessionState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /**
     * Terminal states have no successors; reaching one ends the session.
     */
    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
