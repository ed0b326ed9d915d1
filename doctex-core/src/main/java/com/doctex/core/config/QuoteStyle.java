package com.doctex.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Smart-quote delimiters for one language.
 *
 * <p>Primary quotes are the outer (double) quotes, secondary quotes the nested (single)
 * ones. The ConTeXt defaults use {@code \quotation} and {@code \quote}, which localize the
 * actual glyphs to the main language.
 *
 * @param primaryOpen opening marker for double quotes
 * @param primaryClose closing marker for double quotes
 * @param secondaryOpen opening marker for single quotes
 * @param secondaryClose closing marker for single quotes
 * @param apostrophe replacement for an apostrophe inside a word
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuoteStyle(
    @JsonProperty("primaryOpen") String primaryOpen,
    @JsonProperty("primaryClose") String primaryClose,
    @JsonProperty("secondaryOpen") String secondaryOpen,
    @JsonProperty("secondaryClose") String secondaryClose,
    @JsonProperty("apostrophe") String apostrophe
) {
    /**
     * Compact constructor with validation.
     */
    public QuoteStyle {
        Objects.requireNonNull(primaryOpen, "primaryOpen must not be null");
        Objects.requireNonNull(primaryClose, "primaryClose must not be null");
        Objects.requireNonNull(secondaryOpen, "secondaryOpen must not be null");
        Objects.requireNonNull(secondaryClose, "secondaryClose must not be null");
        if (apostrophe == null) {
            apostrophe = "'";
        }
    }

    /**
     * Returns the ConTeXt quotation macros.
     *
     * @return default quote style
     */
    public static QuoteStyle contextDefault() {
        return new QuoteStyle("\\quotation{", "}", "\\quote{", "}", "'");
    }
}
