package com.doctex.core.table;

/**
 * Structural role of a table row, in priority order: when a row qualifies for several
 * roles, the one declared first wins.
 *
 * <p>Each role has a configuration key (used for per-table and per-configuration style
 * overrides) and a default ConTeXt setups name.
 */
public enum RowRole {
    HEADER_SINGLE("header-row", "OrgTableHeader"),
    FOOTER_SINGLE("footer-row", "OrgTableFooter"),
    HEADER_TOP("header-top", "OrgTableHeaderTopRow"),
    FOOTER_TOP("footer-top", "OrgTableFooterTopRow"),
    HEADER_BOTTOM("header-bottom", "OrgTableHeaderBottomRow"),
    FOOTER_BOTTOM("footer-bottom", "OrgTableFooterBottomRow"),
    HEADER_MID("header-mid", "OrgTableHeaderMidRow"),
    FOOTER_MID("footer-mid", "OrgTableFooterMidRow"),
    FIRST("first-row", "OrgTableTopRow"),
    LAST("last-row", "OrgTableBottomRow"),
    GROUP_START("group-start", "OrgTableRowGroupTopRow"),
    GROUP_END("group-end", "OrgTableRowGroupBottomRow"),
    NONE("", "");

    private final String key;
    private final String defaultStyle;

    RowRole(String key, String defaultStyle) {
        this.key = key;
        this.defaultStyle = defaultStyle;
    }

    public String key() {
        return key;
    }

    public String defaultStyle() {
        return defaultStyle;
    }
}
