package com.doctex.core.renderer;

import com.doctex.core.config.QuoteStyle;
import com.doctex.core.format.QuoteMismatchException;
import com.doctex.core.format.QuoteProcessor;
import com.doctex.core.format.QuoteProcessor.Segment;
import com.doctex.core.format.TextEscaper;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.model.RenderWarning;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Smart-quote conversion planned per quote scope rather than per text object.
 *
 * <p>A scope is one run of inline objects: the inline children of an element, a title or
 * a caption. All plain-text objects of a scope, including those nested in markup or link
 * descriptions, are balanced together, so a quote opened before {@code *bold*} can close
 * after it. Table cells and footnote references start scopes of their own. Math runs,
 * code and other leaf objects are opaque: they take part only as a placeholder character.
 *
 * <p>An unbalanced scope records one {@link RenderWarning.Type#QUOTE_MISMATCH} warning
 * and its text objects fall back to plain escaping.
 */
final class SmartQuotes {

    // stands in for an opaque object when deciding whether a quote opens or closes
    private static final String OPAQUE = "x";

    private final QuoteStyle style;
    private final BiConsumer<RenderWarning.Type, String> warnings;
    private final Map<Node, String> converted = new IdentityHashMap<>();

    private SmartQuotes(QuoteStyle style, BiConsumer<RenderWarning.Type, String> warnings) {
        this.style = style;
        this.warnings = warnings;
    }

    /**
     * Plans every quote scope of a document.
     *
     * @param root document root
     * @param style quote markers of the document language
     * @param warnings sink for mismatch warnings
     * @return the plan
     */
    static SmartQuotes plan(Node root, QuoteStyle style, BiConsumer<RenderWarning.Type, String> warnings) {
        SmartQuotes quotes = new SmartQuotes(style, warnings);
        quotes.scopeRoot(root);
        return quotes;
    }

    /**
     * Returns the planned output of a plain-text object.
     *
     * @param text plain-text node
     * @return converted text, empty when the node was not part of the planned tree
     */
    Optional<String> converted(Node text) {
        return Optional.ofNullable(converted.get(text));
    }

    private void scopeRoot(Node node) {
        List<Node> nested = new ArrayList<>();
        scope(node.title(), nested);
        scope(node.caption(), nested);

        List<Node> inlineChildren = new ArrayList<>();
        for (Node child : node.children()) {
            if (startsScope(child)) {
                nested.add(child);
            } else {
                inlineChildren.add(child);
            }
        }
        scope(inlineChildren, nested);

        for (Node child : nested) {
            scopeRoot(child);
        }
    }

    private void scope(List<Node> objects, List<Node> nested) {
        if (objects.isEmpty()) {
            return;
        }
        List<Node> texts = new ArrayList<>();
        List<Segment> segments = new ArrayList<>();
        gather(objects, texts, segments, new StringBuilder(), nested);
        if (texts.isEmpty()) {
            return;
        }

        try {
            List<String> outputs = QuoteProcessor.process(segments, style, TextEscaper::escape);
            for (int i = 0; i < texts.size(); i++) {
                converted.put(texts.get(i), outputs.get(i));
            }
        } catch (QuoteMismatchException e) {
            StringBuilder raw = new StringBuilder();
            for (Segment segment : segments) {
                raw.append(segment.text());
            }
            warnings.accept(RenderWarning.Type.QUOTE_MISMATCH,
                "Unbalanced quotes in \"" + raw.toString().strip() + "\": " + e.getMessage());
            for (Node text : texts) {
                converted.put(text, TextEscaper.escape(text.value()));
            }
        }
    }

    private void gather(List<Node> objects, List<Node> texts, List<Segment> segments,
                        StringBuilder context, List<Node> nested) {
        for (Node object : objects) {
            if (startsScope(object)) {
                nested.add(object);
                context.append(OPAQUE);
            } else if (object.is(NodeKind.PLAIN_TEXT)) {
                segments.add(new Segment(context.toString(), object.value()));
                texts.add(object);
                context.setLength(0);
            } else if (object.is(NodeKind.LINE_BREAK)) {
                context.append('\n');
            } else if (object.is(NodeKind.MATH_RUN) || object.children().isEmpty()) {
                context.append(OPAQUE);
            } else {
                gather(object.children(), texts, segments, context, nested);
            }
            context.append(" ".repeat(object.postBlank()));
        }
    }

    private static boolean startsScope(Node node) {
        return !node.kind().isInline()
            || node.is(NodeKind.TABLE_CELL)
            || node.is(NodeKind.FOOTNOTE_REFERENCE);
    }
}
