package com.doctex.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of document tree node kinds understood by the renderer.
 *
 * <p>Kinds are either <em>elements</em> (block-level: paragraphs, tables, headings) or
 * <em>inline objects</em> (text, markup, links). The distinction decides whether a node's
 * trailing blank count is rendered as newlines or as spaces.
 *
 * <p>In JSON input the kinds are written in lower case with hyphens, e.g.
 * {@code "table-cell"} or {@code "footnote-reference"}.
 */
public enum NodeKind {
    DOCUMENT(false),
    SECTION(false),
    HEADING(false),
    PARAGRAPH(false),
    PLAIN_LIST(false),
    ITEM(false),
    TABLE(false),
    TABLE_ROW(false),
    TABLE_CELL(true),
    QUOTE_BLOCK(false),
    VERSE_BLOCK(false),
    CENTER_BLOCK(false),
    SPECIAL_BLOCK(false),
    EXAMPLE_BLOCK(false),
    SRC_BLOCK(false),
    FIXED_WIDTH(false),
    EXPORT_BLOCK(false),
    LATEX_ENVIRONMENT(false),
    KEYWORD(false),
    HORIZONTAL_RULE(false),
    FOOTNOTE_DEFINITION(false),
    LINK(true),
    IMAGE(true),
    FOOTNOTE_REFERENCE(true),
    TIMESTAMP(true),
    PLAIN_TEXT(true),
    BOLD(true),
    ITALIC(true),
    UNDERLINE(true),
    STRIKE_THROUGH(true),
    CODE(true),
    VERBATIM(true),
    SUBSCRIPT(true),
    SUPERSCRIPT(true),
    LINE_BREAK(true),
    TARGET(true),
    RADIO_TARGET(true),
    LATEX_FRAGMENT(true),
    EXPORT_SNIPPET(true),
    MATH_RUN(true);

    private final boolean inline;

    NodeKind(boolean inline) {
        this.inline = inline;
    }

    /**
     * Returns whether this kind is an inline object rather than a block element.
     *
     * @return true for inline kinds
     */
    public boolean isInline() {
        return inline;
    }

    /**
     * Returns the external (JSON) name of this kind.
     *
     * @return lower-case hyphenated name
     */
    @JsonValue
    public String externalName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Resolves a kind from its external name. Upper-case and underscore spellings are
     * accepted as well.
     *
     * @param name external name
     * @return the matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    @JsonCreator
    public static NodeKind fromExternalName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node kind must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node kind: " + name, e);
        }
    }
}
