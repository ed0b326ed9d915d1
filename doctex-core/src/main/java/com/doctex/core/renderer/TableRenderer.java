package com.doctex.core.renderer;

import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.table.CellRole;
import com.doctex.core.table.RowRole;
import com.doctex.core.table.TableGeometry;
import com.doctex.core.table.TableLayout;
import com.doctex.core.table.TableLayoutEngine;
import com.doctex.core.table.TableSection;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static com.doctex.core.format.ArgumentFormatter.arg;
import static com.doctex.core.format.ArgumentFormatter.bracketed;

/**
 * Renders tables as ConTeXt extreme tables ({@code xtable}).
 *
 * <p>Rows are distributed over {@code xtablehead}, {@code xtablebody} and
 * {@code xtablefoot} according to the {@link TableLayout}. Every row and cell gets the
 * style of its role. When the first data row declares column widths, a zero-height
 * sizing row opens the body.
 *
 * <pre>{@code
 * \startplacetable[title={Results},reference={tab:results}]
 * \startxtable[OrgTable]
 * \startxtablehead
 * \startxrow[OrgTableHeader]
 * \startxcell[OrgTableTopLeftCell] Name \stopxcell
 * ...
 * }</pre>
 *
 * <p>Tables with neither caption nor label are not wrapped in {@code \startplacetable}.
 */
class TableRenderer {

    private final DispatchRenderer dispatcher;

    TableRenderer(DispatchRenderer dispatcher) {
        this.dispatcher = dispatcher;
    }

    Optional<String> table(Node table, ChildOutputs children, RenderContext ctx) {
        TableLayoutEngine engine = ctx.tables();
        TableLayout layout = engine.layout(table);
        ctx.useEnvironment(Environments.TABLE, Environments.TABLE_DEFINITION);

        Map<TableSection, StringBuilder> sections = new EnumMap<>(TableSection.class);
        for (TableSection section : TableSection.values()) {
            sections.put(section, new StringBuilder());
        }
        if (layout.geometry().hasColumnWidths()) {
            sections.get(TableSection.BODY).append(sizingRow(layout.geometry()));
        }
        List<Node> rows = table.children();
        for (int i = 0; i < rows.size(); i++) {
            Optional<String> output = children.get(i);
            OptionalInt index = layout.rowIndexOf(rows.get(i));
            if (output.isPresent() && index.isPresent()) {
                sections.get(layout.sectionOf(index.getAsInt())).append(output.get());
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("\\startxtable[").append(Environments.TABLE).append("]\n");
        appendSection(sb, TableSection.HEAD, "", sections.get(TableSection.HEAD));
        appendSection(sb, TableSection.BODY, "", sections.get(TableSection.BODY));
        if (layout.hasFooter()) {
            String footer = engine.footerStyle(table);
            if (!footer.isBlank()) {
                ctx.useEnvironment(footer, Environments.tableStyle(footer));
            }
            StringBuilder foot = new StringBuilder(engine.config().footerContent().isBlank()
                ? "" : engine.config().footerContent().strip() + "\n");
            foot.append(sections.get(TableSection.FOOT));
            appendSection(sb, TableSection.FOOT, footer.isBlank() ? "" : "[" + footer + "]", foot);
        }
        sb.append("\\stopxtable\n");

        String caption = dispatcher.renderObjects(table.caption(), ctx).strip();
        Optional<String> label = ctx.resolver().getLabel(table, false);
        if (caption.isEmpty() && label.isEmpty()) {
            return Optional.of(sb.toString());
        }
        return Optional.of("\\startplacetable"
            + bracketed(List.of(arg("title", caption), arg("reference", label.orElse(""))), false) + "\n"
            + sb
            + "\\stopplacetable\n");
    }

    private static void appendSection(StringBuilder sb, TableSection section, String arguments,
                                      CharSequence rows) {
        if (rows.length() == 0) {
            return;
        }
        sb.append("\\start").append(section.environment()).append(arguments).append('\n')
            .append(rows)
            .append("\\stop").append(section.environment()).append('\n');
    }

    private static String sizingRow(TableGeometry geometry) {
        StringBuilder sb = new StringBuilder("\\startxrow[height=0pt]\n");
        for (int width : geometry.columnWidths()) {
            String arguments = width > 0 ? "[width=" + width + "em]" : "";
            sb.append("\\startxcell").append(arguments).append(" \\stopxcell\n");
        }
        return sb.append("\\stopxrow\n").toString();
    }

    Optional<String> row(Node row, ChildOutputs children, RenderContext ctx) {
        Optional<Node> table = ctx.parent().filter(parent -> parent.is(NodeKind.TABLE));
        if (table.isEmpty()) {
            return Optional.empty();
        }
        TableLayout layout = ctx.tables().layout(table.get());
        OptionalInt index = layout.rowIndexOf(row);
        if (index.isEmpty()) {
            // rule and column group rows only shape the layout
            return Optional.empty();
        }
        RowRole role = layout.rowRole(index.getAsInt());
        String style = styleArgument(ctx.tables().rowStyle(table.get(), role), ctx);
        return Optional.of("\\startxrow" + style + "\n" + children.joined() + "\\stopxrow\n");
    }

    Optional<String> cell(Node cell, ChildOutputs children, RenderContext ctx) {
        Optional<Node> row = ctx.parent();
        Optional<Node> table = ctx.nearest(NodeKind.TABLE);
        if (row.isEmpty() || table.isEmpty()) {
            return Optional.empty();
        }
        TableLayout layout = ctx.tables().layout(table.get());
        OptionalInt rowIndex = layout.rowIndexOf(row.get());
        OptionalInt column = TableLayout.columnIndexOf(row.get(), cell);
        if (rowIndex.isEmpty() || column.isEmpty()) {
            return Optional.empty();
        }
        CellRole role = layout.cellRole(rowIndex.getAsInt(), column.getAsInt());
        String style = styleArgument(ctx.tables().cellStyle(table.get(), role), ctx);
        return Optional.of("\\startxcell" + style + " " + children.joined().strip() + " \\stopxcell\n");
    }

    private static String styleArgument(String style, RenderContext ctx) {
        if (style.isBlank()) {
            return "";
        }
        ctx.useEnvironment(style, Environments.tableStyle(style));
        return "[" + style + "]";
    }
}
