package com.warden.proxy.core.policy;

import java.util.Locale;

import com.warden.proxy.core.exceptions.ConfigException;

/**
 * A single domain blocking rule.
 * <p>
 * {@code *.example.com} matches {@code example.com} itself and every host
 * ending in {@code .example.com}. A pattern without the {@code *.} prefix
 * matches only that exact host. Matching is case-insensitive and works on
 * whole labels, so {@code *.example.com} does not match {@code badexample.com}.
 */
public final class BlockPattern {
    private static final String WILDCARD_PREFIX = "*.";

    private final String pattern;
    private final String domain;
    private final String suffix;
    private final boolean wildcard;

    private BlockPattern(String pattern, String domain, boolean wildcard) {
        this.pattern = pattern;
        this.domain = domain;
        this.wildcard = wildcard;
        this.suffix = "." + domain;
    }

    /**
     * Parses a pattern string.
     *
     * @param raw Pattern such as {@code *.youtube.com} or {@code ads.example.org}.
     * @return The compiled pattern.
     * @throws ConfigException If the pattern is blank, bare {@code *}, or contains
     *                         whitespace or an embedded wildcard.
     */
    public static BlockPattern parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigException("Block pattern must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        boolean wildcard = normalized.startsWith(WILDCARD_PREFIX);
        String domain = wildcard ? normalized.substring(WILDCARD_PREFIX.length()) : normalized;
        while (domain.endsWith(".")) {
            domain = domain.substring(0, domain.length() - 1);
        }

        if (domain.isEmpty() || domain.indexOf('*') >= 0 || domain.startsWith(".")) {
            throw new ConfigException("Invalid block pattern: '" + raw + "'");
        }
        for (int i = 0; i < domain.length(); i++) {
            if (Character.isWhitespace(domain.charAt(i))) {
                throw new ConfigException("Block pattern contains whitespace: '" + raw + "'");
            }
        }
        return new BlockPattern(normalized, domain, wildcard);
    }

    /**
     * Tests a host against this rule.
     *
     * @param host Lower-cased host name without port.
     * @return true if the host is covered by this rule.
     */
    public boolean matches(String host) {
        if (host.equals(domain)) {
            return true;
        }
        return wildcard && host.endsWith(suffix);
    }

    public boolean isWildcard() {
        return wildcard;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
