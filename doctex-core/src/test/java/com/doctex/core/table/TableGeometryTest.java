package com.doctex.core.table;

import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.table.TableGeometry.RowRange;
import org.junit.jupiter.api.Test;

import static com.doctex.core.table.TableFixtures.colgroup;
import static com.doctex.core.table.TableFixtures.row;
import static com.doctex.core.table.TableFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TableGeometry}.
 */
class TableGeometryTest {

    @Test
    void of_rulesSplitRowGroups() {
        // Given
        Node table = table("h1|h2", "-", "a|b", "c|d", "-", "e|f");

        // When
        TableGeometry geometry = TableGeometry.of(table);

        // Then
        assertThat(geometry.rowCount()).isEqualTo(4);
        assertThat(geometry.columnCount()).isEqualTo(2);
        assertThat(geometry.rowGroups()).containsExactly(
            new RowRange(0, 0), new RowRange(1, 2), new RowRange(3, 3));
    }

    @Test
    void of_leadingAndTrailingRules_createNoEmptyGroups() {
        TableGeometry geometry = TableGeometry.of(table("-", "a", "b", "-"));

        assertThat(geometry.rowGroups()).containsExactly(new RowRange(0, 1));
    }

    @Test
    void of_raggedRows_useWidestRow() {
        TableGeometry geometry = TableGeometry.of(table("a", "b|c|d", "e|f"));

        assertThat(geometry.columnCount()).isEqualTo(3);
    }

    @Test
    void of_colgroupRow_readsMarkersAndIsNotData() {
        // Given
        Node table = Node.builder(NodeKind.TABLE)
            .children(colgroup("", "<", ">", "<>"), row("a", "b", "c", "d"))
            .build();

        // When
        TableGeometry geometry = TableGeometry.of(table);

        // Then
        assertThat(geometry.rowCount()).isEqualTo(1);
        assertThat(geometry.columnGroupStarts()).containsExactlyInAnyOrder(1, 3);
        assertThat(geometry.columnGroupEnds()).containsExactlyInAnyOrder(2, 3);
    }

    @Test
    void of_widthsFromFirstDataRow() {
        // Given
        Node first = Node.builder(NodeKind.TABLE_ROW)
            .child(Node.builder(NodeKind.TABLE_CELL).property(TableGeometry.CELL_WIDTH, 5).build())
            .child(Node.builder(NodeKind.TABLE_CELL).build())
            .build();
        Node table = Node.builder(NodeKind.TABLE).children(first, row("x", "y")).build();

        // When
        TableGeometry geometry = TableGeometry.of(table);

        // Then
        assertThat(geometry.columnWidths()).containsExactly(5, 0);
        assertThat(geometry.hasColumnWidths()).isTrue();
    }

    @Test
    void of_emptyTable_hasNoRowsOrGroups() {
        TableGeometry geometry = TableGeometry.of(Node.of(NodeKind.TABLE));

        assertThat(geometry.rowCount()).isZero();
        assertThat(geometry.rowGroups()).isEmpty();
        assertThat(geometry.hasColumnWidths()).isFalse();
    }

    @Test
    void of_nonTable_throwsException() {
        assertThatThrownBy(() -> TableGeometry.of(Node.of(NodeKind.PARAGRAPH)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rowRange_invalidBounds_throwsException() {
        assertThatThrownBy(() -> new RowRange(3, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
