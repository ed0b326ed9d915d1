package com.doctex.core.renderer;

import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-kind transcoder from document nodes to ConTeXt.
 *
 * <p>Traversal is strict post-order: all children of a node are rendered first, then the
 * node's handler receives their outputs ({@link ChildOutputs}) and decides how to combine
 * them. Handlers may re-wrap or ignore child output but never reorder siblings.
 *
 * <h2>Whitespace</h2>
 * <p>A node that produces output gets its trailing blank count appended: spaces for
 * inline kinds, newlines for elements. A node without output contributes nothing.
 *
 * <h2>Dispatch</h2>
 * <p>The handler table is an exhaustive {@code switch} over {@link NodeKind}; adding a kind
 * without a handler does not compile. Handlers are grouped by concern:
 * <ul>
 *   <li>{@link HeadingRenderer} - headings, zones, keywords</li>
 *   <li>{@link BlockRenderer} - paragraphs, lists, blocks, math environments</li>
 *   <li>{@link InlineRenderer} - text, markup, links, footnotes, math fragments</li>
 *   <li>{@link TableRenderer} - tables, rows, cells</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext ctx = new RenderContext(RenderConfig.defaults(), root);
 * String body = new DispatchRenderer().render(root, ctx).orElse("");
 * }</pre>
 */
public class DispatchRenderer {

    private static final Logger log = LoggerFactory.getLogger(DispatchRenderer.class);

    private final HeadingRenderer headings;
    private final BlockRenderer blocks;
    private final InlineRenderer inlines;
    private final TableRenderer tables;

    public DispatchRenderer() {
        this.headings = new HeadingRenderer(this);
        this.blocks = new BlockRenderer(this);
        this.inlines = new InlineRenderer(this);
        this.tables = new TableRenderer(this);
    }

    /**
     * Renders a node and its subtree.
     *
     * @param node node to render
     * @param ctx render context of the current pass
     * @return rendered text including trailing blanks, or empty when the node renders nothing
     */
    public Optional<String> render(Node node, RenderContext ctx) {
        if (node.is(NodeKind.FOOTNOTE_DEFINITION)) {
            // definitions are rendered where they are referenced
            return Optional.empty();
        }
        ChildOutputs children = renderChildren(node, ctx);
        Optional<String> output = dispatch(node, children, ctx);
        if (output.isEmpty()) {
            log.trace("{} rendered nothing", node.kind());
            return output;
        }
        return Optional.of(output.get() + trailingBlanks(node));
    }

    /**
     * Renders a sequence of inline objects (a title, a caption) and concatenates them.
     *
     * @param objects objects in order
     * @param ctx render context
     * @return combined text
     */
    public String renderObjects(List<Node> objects, RenderContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (Node object : objects) {
            render(object, ctx).ifPresent(sb::append);
        }
        return sb.toString();
    }

    private ChildOutputs renderChildren(Node node, RenderContext ctx) {
        if (node.children().isEmpty()) {
            return ChildOutputs.none();
        }
        List<Optional<String>> outputs = new ArrayList<>(node.children().size());
        ctx.enter(node);
        try {
            for (Node child : node.children()) {
                outputs.add(render(child, ctx));
            }
        } finally {
            ctx.leave();
        }
        return new ChildOutputs(outputs);
    }

    private Optional<String> dispatch(Node node, ChildOutputs children, RenderContext ctx) {
        return switch (node.kind()) {
            case DOCUMENT, SECTION -> blocks.container(children);
            case HEADING -> headings.heading(node, children, ctx);
            case KEYWORD -> headings.keyword(node, ctx);
            case PARAGRAPH -> blocks.paragraph(node, children, ctx);
            case PLAIN_LIST -> blocks.plainList(node, children);
            case ITEM -> blocks.item(node, children, ctx);
            case QUOTE_BLOCK -> blocks.quoteBlock(children, ctx);
            case VERSE_BLOCK -> blocks.verseBlock(children, ctx);
            case CENTER_BLOCK -> blocks.centerBlock(children);
            case SPECIAL_BLOCK -> blocks.specialBlock(node, children, ctx);
            case EXAMPLE_BLOCK -> blocks.exampleBlock(node, ctx);
            case SRC_BLOCK -> blocks.srcBlock(node, ctx);
            case FIXED_WIDTH -> blocks.fixedWidth(node, ctx);
            case EXPORT_BLOCK -> blocks.exportBlock(node, ctx);
            case LATEX_ENVIRONMENT -> blocks.latexEnvironment(node, ctx);
            case HORIZONTAL_RULE -> blocks.horizontalRule(ctx);
            case FOOTNOTE_DEFINITION -> Optional.empty();
            case TABLE -> tables.table(node, children, ctx);
            case TABLE_ROW -> tables.row(node, children, ctx);
            case TABLE_CELL -> tables.cell(node, children, ctx);
            case LINK -> inlines.link(node, children, ctx);
            case IMAGE -> inlines.image(node);
            case FOOTNOTE_REFERENCE -> inlines.footnoteReference(node, children, ctx);
            case TIMESTAMP -> inlines.timestamp(node);
            case PLAIN_TEXT -> inlines.plainText(node, ctx);
            case BOLD -> inlines.markup("bold", children, ctx);
            case ITALIC -> inlines.markup("italic", children, ctx);
            case UNDERLINE -> inlines.markup("underline", children, ctx);
            case STRIKE_THROUGH -> inlines.markup("strike-through", children, ctx);
            case CODE, VERBATIM -> inlines.verbatim(node);
            case SUBSCRIPT -> inlines.script(node, "subscript", "_", children, ctx);
            case SUPERSCRIPT -> inlines.script(node, "superscript", "^", children, ctx);
            case LINE_BREAK -> inlines.lineBreak(ctx);
            case TARGET -> inlines.target(node, ctx);
            case RADIO_TARGET -> inlines.radioTarget(node, children, ctx);
            case LATEX_FRAGMENT -> inlines.latexFragment(node, ctx);
            case EXPORT_SNIPPET -> inlines.exportSnippet(node, ctx);
            case MATH_RUN -> inlines.mathRun(children);
        };
    }

    private static String trailingBlanks(Node node) {
        int count = node.postBlank();
        if (count == 0) {
            return "";
        }
        return node.kind().isInline() ? " ".repeat(count) : "\n".repeat(count);
    }
}
