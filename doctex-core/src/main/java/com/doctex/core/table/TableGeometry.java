package com.doctex.core.table;

import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Geometry derived from a table node. Never stored in the tree, computed per render.
 *
 * <p>Rows of a table are {@link NodeKind#TABLE_ROW} children with a {@code type}
 * property:
 * <ul>
 *   <li>{@code standard} (or absent) - a data row</li>
 *   <li>{@code rule} - a separator; row groups are the maximal runs of data rows between
 *       separators</li>
 *   <li>{@code colgroup} - column group markers; each cell holds {@code <} (group
 *       start), {@code >} (group end), {@code <>} (both) or nothing</li>
 * </ul>
 *
 * @param dataRows data rows in order
 * @param columnCount number of columns (widest data row)
 * @param rowGroups row groups, as data-row index ranges
 * @param columnGroupStarts column indices starting a column group
 * @param columnGroupEnds column indices ending a column group
 * @param columnWidths width per column from the first data row, 0 when not set
 */
public record TableGeometry(
    List<Node> dataRows,
    int columnCount,
    List<RowRange> rowGroups,
    Set<Integer> columnGroupStarts,
    Set<Integer> columnGroupEnds,
    List<Integer> columnWidths
) {
    public static final String ROW_TYPE = "type";
    public static final String RULE_ROW = "rule";
    public static final String COLGROUP_ROW = "colgroup";
    public static final String CELL_WIDTH = "width";

    /**
     * Inclusive range of data-row indices.
     *
     * @param first first index
     * @param last last index
     */
    public record RowRange(int first, int last) {
        public RowRange {
            if (first < 0 || last < first) {
                throw new IllegalArgumentException("Invalid row range: " + first + ".." + last);
            }
        }

        public boolean contains(int row) {
            return row >= first && row <= last;
        }

        public int size() {
            return last - first + 1;
        }
    }

    /**
     * Compact constructor with validation.
     */
    public TableGeometry {
        dataRows = List.copyOf(dataRows);
        rowGroups = List.copyOf(rowGroups);
        columnGroupStarts = Set.copyOf(columnGroupStarts);
        columnGroupEnds = Set.copyOf(columnGroupEnds);
        columnWidths = List.copyOf(columnWidths);
    }

    /**
     * Computes the geometry of a table.
     *
     * @param table table node
     * @return geometry
     * @throws IllegalArgumentException if the node is not a table
     */
    public static TableGeometry of(Node table) {
        Objects.requireNonNull(table, "table must not be null");
        if (!table.is(NodeKind.TABLE)) {
            throw new IllegalArgumentException("Expected a table node, got " + table.kind());
        }

        List<Node> dataRows = new ArrayList<>();
        List<RowRange> groups = new ArrayList<>();
        Set<Integer> starts = new TreeSet<>();
        Set<Integer> ends = new TreeSet<>();
        boolean columnGroupsSeen = false;
        int groupStart = -1;
        int columnCount = 0;

        for (Node row : table.children()) {
            if (!row.is(NodeKind.TABLE_ROW)) {
                continue;
            }
            String type = rowType(row);
            if (RULE_ROW.equals(type)) {
                if (groupStart >= 0) {
                    groups.add(new RowRange(groupStart, dataRows.size() - 1));
                    groupStart = -1;
                }
                continue;
            }
            if (COLGROUP_ROW.equals(type)) {
                if (!columnGroupsSeen) {
                    readColumnGroups(row, starts, ends);
                    columnGroupsSeen = true;
                }
                continue;
            }
            if (groupStart < 0) {
                groupStart = dataRows.size();
            }
            dataRows.add(row);
            columnCount = Math.max(columnCount, cellsOf(row).size());
        }
        if (groupStart >= 0) {
            groups.add(new RowRange(groupStart, dataRows.size() - 1));
        }

        List<Integer> widths = new ArrayList<>(columnCount);
        for (int c = 0; c < columnCount; c++) {
            widths.add(0);
        }
        if (!dataRows.isEmpty()) {
            List<Node> cells = cellsOf(dataRows.get(0));
            for (int c = 0; c < cells.size(); c++) {
                widths.set(c, Math.max(0, cells.get(c).intProperty(CELL_WIDTH, 0)));
            }
        }

        return new TableGeometry(dataRows, columnCount, groups, starts, ends, widths);
    }

    public int rowCount() {
        return dataRows.size();
    }

    public boolean hasColumnWidths() {
        return columnWidths.stream().anyMatch(width -> width > 0);
    }

    /**
     * Returns the row type of a table row, defaulting to {@code standard}.
     *
     * @param row table row
     * @return lower-case row type
     */
    public static String rowType(Node row) {
        return row.stringProperty(ROW_TYPE, "standard").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the cell children of a row.
     *
     * @param row table row
     * @return cells in order
     */
    public static List<Node> cellsOf(Node row) {
        List<Node> cells = new ArrayList<>(row.children().size());
        for (Node child : row.children()) {
            if (child.is(NodeKind.TABLE_CELL)) {
                cells.add(child);
            }
        }
        return cells;
    }

    private static void readColumnGroups(Node row, Set<Integer> starts, Set<Integer> ends) {
        List<Node> cells = cellsOf(row);
        for (int c = 0; c < cells.size(); c++) {
            String marker = cells.get(c).rawText().trim();
            if (marker.startsWith("<")) {
                starts.add(c);
            }
            if (marker.endsWith(">")) {
                ends.add(c);
            }
        }
    }
}
