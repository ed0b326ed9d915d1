package com.doctex.core.reference;

import java.util.Objects;

/**
 * Opaque identifier bound to exactly one node instance for the lifetime of a render.
 *
 * @param id identifier text, unique within one render
 */
public record Reference(String id) {

    /**
     * Compact constructor with validation.
     */
    public Reference {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public String toString() {
        return id;
    }
}
