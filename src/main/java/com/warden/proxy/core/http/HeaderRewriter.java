package com.warden.proxy.core.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import com.warden.proxy.core.constants.HeaderConstants;

/**
 * Produces the header block sent upstream for a forwarded request. Pure
 * functions over header field lists; the input is never modified.
 */
public final class HeaderRewriter {

    private HeaderRewriter() {
        // Utility class
    }

    /** Headers that only concern the client-to-proxy hop. */
    private static final Set<String> HOP_BY_HOP_HEADERS;

    static {
        Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.add(HeaderConstants.CONNECTION.getValue());
        set.add(HeaderConstants.PROXY_CONNECTION.getValue());
        set.add(HeaderConstants.PROXY_AUTHORIZATION.getValue());
        set.add(HeaderConstants.KEEP_ALIVE.getValue());
        set.add(HeaderConstants.TE.getValue());
        set.add(HeaderConstants.UPGRADE.getValue());
        HOP_BY_HOP_HEADERS = Collections.unmodifiableSet(set);
    }

    /**
     * Rewrites the headers of a parsed request for the upstream hop.
     *
     * @param request The parsed client request.
     * @return Header fields to send upstream.
     */
    public static List<HeaderField> forUpstream(ParsedRequest request) {
        return forUpstream(request.getHeaders(), request.getAuthority(), request.isAbsoluteForm());
    }

    /**
     * Removes hop-by-hop headers and every header named in {@code Connection},
     * makes sure a {@code Host} header is present and appends
     * {@code Connection: close}.
     *
     * @param fields      Client header fields in arrival order.
     * @param authority   Value for a Host header.
     * @param replaceHost Whether an existing Host header is replaced by
     *                    {@code authority}, as required for absolute-form
     *                    requests.
     * @return A new list of header fields.
     */
    public static List<HeaderField> forUpstream(List<HeaderField> fields, String authority, boolean replaceHost) {
        Set<String> dropped = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        dropped.addAll(HOP_BY_HOP_HEADERS);
        dropped.addAll(connectionTokens(fields));

        List<HeaderField> result = new ArrayList<>(fields.size() + 2);
        boolean hasHost = false;
        for (HeaderField field : fields) {
            if (dropped.contains(field.name())) {
                continue;
            }
            if (field.hasName(HeaderConstants.HOST.getValue())) {
                if (replaceHost || hasHost) {
                    continue;
                }
                hasHost = true;
            }
            result.add(field);
        }
        if (!hasHost) {
            result.add(0, new HeaderField(HeaderConstants.HOST.getValue(), authority));
        }
        result.add(new HeaderField(HeaderConstants.CONNECTION.getValue(), "close"));
        return result;
    }

    /**
     * Collects the header names listed in every Connection header.
     */
    static Set<String> connectionTokens(List<HeaderField> fields) {
        Set<String> tokens = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (HeaderField field : fields) {
            if (!field.hasName(HeaderConstants.CONNECTION.getValue())
                    && !field.hasName(HeaderConstants.PROXY_CONNECTION.getValue())) {
                continue;
            }
            for (String token : field.value().split(",")) {
                String name = token.trim();
                if (!name.isEmpty() && !"close".equals(name.toLowerCase(Locale.ROOT))) {
                    tokens.add(name);
                }
            }
        }
        return tokens;
    }
}
