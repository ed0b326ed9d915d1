package com.doctex.core.table;

import com.doctex.core.model.Node;
import com.doctex.core.table.TableGeometry.RowRange;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Structural decisions for one table: header and footer ranges, row roles, cell roles.
 *
 * <p>Instances are created by {@link TableLayoutEngine}. Row lookups are by node identity.
 */
public final class TableLayout {

    private final Node table;
    private final TableGeometry geometry;
    private final RowRange header;
    private final RowRange footer;
    private final Map<Node, Integer> rowIndex = new IdentityHashMap<>();

    TableLayout(Node table, TableGeometry geometry, RowRange header, RowRange footer) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.geometry = Objects.requireNonNull(geometry, "geometry must not be null");
        this.header = header;
        this.footer = footer;
        List<Node> rows = geometry.dataRows();
        for (int i = 0; i < rows.size(); i++) {
            rowIndex.put(rows.get(i), i);
        }
    }

    public Node table() {
        return table;
    }

    public TableGeometry geometry() {
        return geometry;
    }

    public boolean hasHeader() {
        return header != null;
    }

    public boolean hasFooter() {
        return footer != null;
    }

    public RowRange header() {
        return header;
    }

    public RowRange footer() {
        return footer;
    }

    /**
     * Returns the data-row index of a row node.
     *
     * @param row row node
     * @return index, empty for rule and column-group rows
     */
    public OptionalInt rowIndexOf(Node row) {
        Integer index = rowIndex.get(row);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Returns the column index of a cell within its row.
     *
     * @param row row node
     * @param cell cell node
     * @return index, empty if the cell is not in the row
     */
    public static OptionalInt columnIndexOf(Node row, Node cell) {
        List<Node> cells = TableGeometry.cellsOf(row);
        for (int c = 0; c < cells.size(); c++) {
            if (cells.get(c) == cell) {
                return OptionalInt.of(c);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Returns the section a data row belongs to.
     *
     * @param row data-row index
     * @return head, body or foot
     */
    public TableSection sectionOf(int row) {
        if (header != null && header.contains(row)) {
            return TableSection.HEAD;
        }
        if (footer != null && footer.contains(row)) {
            return TableSection.FOOT;
        }
        return TableSection.BODY;
    }

    /**
     * Returns the role of a data row. Header and footer boundaries beat table edges,
     * which beat row-group boundaries.
     *
     * @param row data-row index
     * @return row role
     */
    public RowRole rowRole(int row) {
        if (header != null && header.contains(row)) {
            return sectionRole(header, row, RowRole.HEADER_SINGLE, RowRole.HEADER_TOP,
                RowRole.HEADER_BOTTOM, RowRole.HEADER_MID);
        }
        if (footer != null && footer.contains(row)) {
            return sectionRole(footer, row, RowRole.FOOTER_SINGLE, RowRole.FOOTER_TOP,
                RowRole.FOOTER_BOTTOM, RowRole.FOOTER_MID);
        }
        if (row == 0) {
            return RowRole.FIRST;
        }
        if (row == geometry.rowCount() - 1) {
            return RowRole.LAST;
        }
        for (RowRange group : geometry.rowGroups()) {
            if (group.first() == row) {
                return RowRole.GROUP_START;
            }
        }
        for (RowRange group : geometry.rowGroups()) {
            if (group.last() == row) {
                return RowRole.GROUP_END;
            }
        }
        return RowRole.NONE;
    }

    /**
     * Returns the role of the cell at a position. Corners beat edge columns, which beat
     * column-group boundaries.
     *
     * @param row data-row index
     * @param column column index
     * @return cell role
     */
    public CellRole cellRole(int row, int column) {
        boolean firstRow = row == 0;
        boolean lastRow = row == geometry.rowCount() - 1;
        boolean firstColumn = column == 0;
        boolean lastColumn = column == geometry.columnCount() - 1;

        if (firstRow && firstColumn) {
            return CellRole.TOP_LEFT;
        }
        if (firstRow && lastColumn) {
            return CellRole.TOP_RIGHT;
        }
        if (lastRow && firstColumn) {
            return CellRole.BOTTOM_LEFT;
        }
        if (lastRow && lastColumn) {
            return CellRole.BOTTOM_RIGHT;
        }
        if (firstColumn) {
            return CellRole.LEFT;
        }
        if (lastColumn) {
            return CellRole.RIGHT;
        }
        if (geometry.columnGroupStarts().contains(column)) {
            return CellRole.COLGROUP_START;
        }
        if (geometry.columnGroupEnds().contains(column)) {
            return CellRole.COLGROUP_END;
        }
        return CellRole.NONE;
    }

    private static RowRole sectionRole(RowRange range, int row, RowRole single, RowRole top,
                                       RowRole bottom, RowRole mid) {
        if (range.size() == 1) {
            return single;
        }
        if (row == range.first()) {
            return top;
        }
        if (row == range.last()) {
            return bottom;
        }
        return mid;
    }
}
