package com.warden.proxy.core.http;

import java.util.Objects;

/**
 * One header line as received, name spelling preserved.
 *
 * @param name  Header name.
 * @param value Header value with surrounding whitespace removed.
 */
public record HeaderField(String name, String value) {

    public HeaderField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public boolean hasName(String other) {
        return name.equalsIgnoreCase(other);
    }

    /**
     * @return The header as it appears on the wire, without line terminator.
     */
    @Override
    public String toString() {
        return name + ": " + value;
    }
}
