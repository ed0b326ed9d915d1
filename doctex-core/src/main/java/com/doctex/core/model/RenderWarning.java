package com.doctex.core.model;

import java.util.Objects;

/**
 * A non-fatal condition met while rendering. The render keeps going.
 *
 * @param type warning category
 * @param message human readable description
 */
public record RenderWarning(Type type, String message) {

    /**
     * Warning categories.
     */
    public enum Type {
        QUOTE_MISMATCH,
        UNKNOWN_TOC,
        MISSING_TEMPLATE,
        UNKNOWN_SNIPPET
    }

    /**
     * Compact constructor with validation.
     */
    public RenderWarning {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
