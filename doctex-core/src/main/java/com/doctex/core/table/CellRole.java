package com.doctex.core.table;

/**
 * Structural role of a table cell, in priority order: corners beat edge columns, which
 * beat column-group boundaries.
 */
public enum CellRole {
    TOP_LEFT("top-left", "OrgTableTopLeftCell"),
    TOP_RIGHT("top-right", "OrgTableTopRightCell"),
    BOTTOM_LEFT("bottom-left", "OrgTableBottomLeftCell"),
    BOTTOM_RIGHT("bottom-right", "OrgTableBottomRightCell"),
    LEFT("left", "OrgTableLeftCol"),
    RIGHT("right", "OrgTableRightCol"),
    COLGROUP_START("colgroup-start", "OrgTableColGroupLeftCol"),
    COLGROUP_END("colgroup-end", "OrgTableColGroupRightCol"),
    NONE("", "");

    private final String key;
    private final String defaultStyle;

    CellRole(String key, String defaultStyle) {
        this.key = key;
        this.defaultStyle = defaultStyle;
    }

    public String key() {
        return key;
    }

    public String defaultStyle() {
        return defaultStyle;
    }

    public boolean isCorner() {
        return this == TOP_LEFT || this == TOP_RIGHT || this == BOTTOM_LEFT || this == BOTTOM_RIGHT;
    }
}
