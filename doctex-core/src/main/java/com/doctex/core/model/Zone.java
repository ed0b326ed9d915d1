package com.doctex.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Named document regions that top-level headings can be routed into.
 *
 * <p>A heading carries at most one zone marker (its {@code zone} property). Headings
 * without a marker stay in {@link #BODY}.
 */
public enum Zone {
    BODY("body"),
    FRONTMATTER("frontmatter"),
    BACKMATTER("backmatter"),
    APPENDIX("appendix"),
    COPYING("copying"),
    INDEX("index");

    private final String placeholder;

    Zone(String placeholder) {
        this.placeholder = placeholder;
    }

    /**
     * Returns the template placeholder key this zone is substituted into.
     *
     * @return placeholder key, e.g. {@code "appendix"}
     */
    public String placeholder() {
        return placeholder;
    }

    /**
     * Parses a zone marker value. Blank or unknown values yield empty.
     *
     * @param marker marker value from a heading property
     * @return parsed zone
     */
    public static Optional<Zone> fromMarker(String marker) {
        if (marker == null || marker.isBlank()) {
            return Optional.empty();
        }
        String key = marker.trim().toLowerCase(Locale.ROOT);
        for (Zone zone : values()) {
            if (zone.placeholder.equals(key)) {
                return Optional.of(zone);
            }
        }
        // "appendices" is how ConTeXt spells the environment
        if ("appendices".equals(key)) {
            return Optional.of(APPENDIX);
        }
        return Optional.empty();
    }
}
