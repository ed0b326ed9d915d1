package com.doctex.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Table styling options.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * table:
 *   headerMode: auto
 *   footerStyle: "OrgTableFooter"
 *   styles:
 *     top-left: "MyCornerCell"
 *     header-top: "MyHeaderTopRow"
 * }</pre>
 *
 * @param styles style names keyed by row or cell role key (see {@code RowRole#key()} and
 *               {@code CellRole#key()}); these are the per-position overrides
 * @param footerStyle global footer style; non-empty enables footers on tables with more
 *                    than two row groups
 * @param footerContent global footer content; non-empty also enables footers
 * @param headerMode {@code auto}, {@code yes} or {@code no}, used when a table does not say
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableStyleConfig(
    @JsonProperty("styles") Map<String, String> styles,
    @JsonProperty("footerStyle") String footerStyle,
    @JsonProperty("footerContent") String footerContent,
    @JsonProperty("headerMode") String headerMode
) {
    public static final String HEADER_AUTO = "auto";

    /**
     * Compact constructor applying defaults.
     */
    public TableStyleConfig {
        styles = styles == null ? Map.of() : Map.copyOf(styles);
        footerStyle = footerStyle == null ? "" : footerStyle;
        footerContent = footerContent == null ? "" : footerContent;
        headerMode = headerMode == null || headerMode.isBlank() ? HEADER_AUTO : headerMode;
    }

    public static TableStyleConfig defaults() {
        return new TableStyleConfig(Map.of(), "", "", HEADER_AUTO);
    }

    /**
     * Returns whether any global footer source is configured.
     *
     * @return true when footer style or footer content is non-empty
     */
    public boolean hasGlobalFooter() {
        return !footerStyle.isBlank() || !footerContent.isBlank();
    }

    /**
     * Looks up a configured style by role key.
     *
     * @param roleKey role key
     * @return style name or null
     */
    public String styleFor(String roleKey) {
        return styles.get(roleKey);
    }
}
