package com.warden.proxy.core.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates target hosts against the domain blocklist.
 * <p>
 * The pattern list is an immutable snapshot read without locks by every
 * session. {@link #update(Collection)} compiles a complete new list and swaps
 * it in with a single reference write, so a reader sees either the old or the
 * new blocklist, never a mix.
 */
public class AccessPolicy {
    private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

    private final AtomicReference<List<BlockPattern>> patterns;

    /**
     * Creates a policy from raw pattern strings.
     *
     * @param rawPatterns Patterns such as {@code *.youtube.com}; may be empty.
     * @throws com.warden.proxy.core.exceptions.ConfigException If any pattern is
     *                                                         invalid.
     */
    public AccessPolicy(Collection<String> rawPatterns) {
        this.patterns = new AtomicReference<>(compile(rawPatterns));
    }

    /**
     * Decides whether requests to a host are allowed. The first matching pattern
     * wins.
     *
     * @param host Target host, any case, without port.
     * @return {@link AccessDecision#allowed()} or a BLOCKED decision naming the
     *         pattern.
     */
    public AccessDecision evaluate(String host) {
        String normalized = normalize(host);
        for (BlockPattern pattern : patterns.get()) {
            if (pattern.matches(normalized)) {
                return AccessDecision.blocked(pattern.toString());
            }
        }
        return AccessDecision.allowed();
    }

    /**
     * Replaces the blocklist. All patterns are validated first; if any is invalid
     * the current snapshot stays in place.
     *
     * @param rawPatterns The complete new pattern set.
     */
    public void update(Collection<String> rawPatterns) {
        List<BlockPattern> compiled = compile(rawPatterns);
        List<BlockPattern> previous = patterns.getAndSet(compiled);
        log.info("Blocklist updated: {} -> {} patterns", previous.size(), compiled.size());
    }

    /**
     * @return The current pattern snapshot.
     */
    public List<BlockPattern> getPatterns() {
        return patterns.get();
    }

    private static List<BlockPattern> compile(Collection<String> rawPatterns) {
        if (rawPatterns == null || rawPatterns.isEmpty()) {
            return List.of();
        }
        List<BlockPattern> compiled = new ArrayList<>(rawPatterns.size());
        for (String raw : rawPatterns) {
            compiled.add(BlockPattern.parse(raw));
        }
        return Collections.unmodifiableList(compiled);
    }

    private static String normalize(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        // "example.com." is the same host as "example.com"
        return h.endsWith(".") ? h.substring(0, h.length() - 1) : h;
    }
}
