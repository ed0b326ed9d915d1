package com.doctex.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of a complete render: the ConTeXt artifact and the warnings collected on the way.
 *
 * @param text rendered document
 * @param warnings non-fatal warnings in the order they occurred
 */
public record RenderedDocument(String text, List<RenderWarning> warnings) {

    /**
     * Compact constructor with validation.
     */
    public RenderedDocument {
        Objects.requireNonNull(text, "text must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
