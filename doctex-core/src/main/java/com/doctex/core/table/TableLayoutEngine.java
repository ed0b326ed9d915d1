package com.doctex.core.table;

import com.doctex.core.config.TableStyleConfig;
import com.doctex.core.model.Node;
import com.doctex.core.table.TableGeometry.RowRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides the structure of tables: which rows form the header and footer, and which
 * style each row and cell gets.
 *
 * <h2>Header</h2>
 * <p>The table's {@code header} property, or {@link TableStyleConfig#headerMode()} when
 * the table has none:
 * <ul>
 *   <li>{@code no} - no header</li>
 *   <li>{@code yes} - the first row group when there are at least two, otherwise the
 *       first row of a multi-row table</li>
 *   <li>{@code auto} - the first row group when there are at least two</li>
 * </ul>
 *
 * <h2>Footer</h2>
 * <p>The last row group is a footer iff the table has more than two row groups and a
 * footer source exists: a {@code footer} property on the table, a global footer style or
 * global footer content. A three-group table with none of them has no footer.
 *
 * <h2>Styles</h2>
 * <p>A role's style comes from the table property named by the role key, then from the
 * configured styles, then from the role's default.
 *
 * <p>One engine serves one render pass and caches the layout of every table it sees.
 */
public class TableLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(TableLayoutEngine.class);

    public static final String HEADER_PROPERTY = "header";
    public static final String FOOTER_PROPERTY = "footer";

    private static final Set<String> HEADER_OFF = Set.of("no", "nil", "false", "none");
    private static final Set<String> HEADER_ON = Set.of("yes", "t", "true", "repeat");

    private final TableStyleConfig config;
    private final Map<Node, TableLayout> layouts = new IdentityHashMap<>();

    public TableLayoutEngine(TableStyleConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Returns the layout of a table, computing it on first request.
     *
     * @param table table node
     * @return layout
     */
    public TableLayout layout(Node table) {
        return layouts.computeIfAbsent(table, this::compute);
    }

    /**
     * Returns the style name for a row role of a table.
     *
     * @param table table node
     * @param role row role
     * @return style name, empty for {@link RowRole#NONE}
     */
    public String rowStyle(Node table, RowRole role) {
        return role == RowRole.NONE ? "" : style(table, role.key(), role.defaultStyle());
    }

    /**
     * Returns the style name for a cell role of a table.
     *
     * @param table table node
     * @param role cell role
     * @return style name, empty for {@link CellRole#NONE}
     */
    public String cellStyle(Node table, CellRole role) {
        return role == CellRole.NONE ? "" : style(table, role.key(), role.defaultStyle());
    }

    /**
     * Returns the footer style: the table's {@code footer} property, else the global
     * footer style.
     *
     * @param table table node
     * @return footer style, possibly empty
     */
    public String footerStyle(Node table) {
        String own = table.stringProperty(FOOTER_PROPERTY);
        return own != null && !own.isBlank() ? own : config.footerStyle();
    }

    public TableStyleConfig config() {
        return config;
    }

    private String style(Node table, String key, String defaultStyle) {
        String own = table.stringProperty(key);
        if (own != null && !own.isBlank()) {
            return own;
        }
        String configured = config.styleFor(key);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return defaultStyle;
    }

    private TableLayout compute(Node table) {
        TableGeometry geometry = TableGeometry.of(table);
        RowRange header = header(table, geometry);
        RowRange footer = footer(table, geometry);
        log.debug("Table layout: {} rows, {} columns, {} row groups, header={}, footer={}",
            geometry.rowCount(), geometry.columnCount(), geometry.rowGroups().size(), header, footer);
        return new TableLayout(table, geometry, header, footer);
    }

    private RowRange header(Node table, TableGeometry geometry) {
        String mode = table.stringProperty(HEADER_PROPERTY, config.headerMode()).trim().toLowerCase(Locale.ROOT);
        List<RowRange> groups = geometry.rowGroups();
        if (HEADER_OFF.contains(mode) || groups.isEmpty()) {
            return null;
        }
        if (groups.size() >= 2) {
            return groups.get(0);
        }
        if (HEADER_ON.contains(mode) && geometry.rowCount() > 1) {
            return new RowRange(0, 0);
        }
        return null;
    }

    private RowRange footer(Node table, TableGeometry geometry) {
        List<RowRange> groups = geometry.rowGroups();
        if (groups.size() <= 2) {
            return null;
        }
        boolean footerSource = table.hasProperty(FOOTER_PROPERTY) || config.hasGlobalFooter();
        return footerSource ? groups.get(groups.size() - 1) : null;
    }
}
