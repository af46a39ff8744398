package com.warden.proxy.core.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of an access check. Produced once per request and never modified.
 */
public final class AccessDecision {

    /**
     * What the proxy does with the request.
     */
    public enum Verdict {
        ALLOWED,
        BLOCKED,
        RATE_LIMITED
    }

    private static final AccessDecision ALLOWED = new AccessDecision(Verdict.ALLOWED, null, null, 0);

    private final Verdict verdict;
    private final String matchedPattern;
    private final Duration window;
    private final int limit;

    private AccessDecision(Verdict verdict, String matchedPattern, Duration window, int limit) {
        this.verdict = verdict;
        this.matchedPattern = matchedPattern;
        this.window = window;
        this.limit = limit;
    }

    public static AccessDecision allowed() {
        return ALLOWED;
    }

    /**
     * @param pattern The block pattern that matched.
     * @return A BLOCKED decision.
     */
    public static AccessDecision blocked(String pattern) {
        return new AccessDecision(Verdict.BLOCKED, Objects.requireNonNull(pattern, "pattern"), null, 0);
    }

    /**
     * @param window The rate window length.
     * @param limit  Requests admitted per window.
     * @return A RATE_LIMITED decision.
     */
    public static AccessDecision rateLimited(Duration window, int limit) {
        return new AccessDecision(Verdict.RATE_LIMITED, null, Objects.requireNonNull(window, "window"), limit);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isAllowed() {
        return verdict == Verdict.ALLOWED;
    }

    /** Pattern that caused a BLOCKED verdict, otherwise null. */
    public String getMatchedPattern() {
        return matchedPattern;
    }

    /** Window length of a RATE_LIMITED verdict, otherwise null. */
    public Duration getWindow() {
        return window;
    }

    /** Request limit of a RATE_LIMITED verdict, otherwise 0. */
    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return switch (verdict) {
            case ALLOWED -> "Allowed";
            case BLOCKED -> "Blocked(" + matchedPattern + ")";
            case RATE_LIMITED -> "RateLimited(" + limit + "/" + window.toSeconds() + "s)";
        };
    }
}
