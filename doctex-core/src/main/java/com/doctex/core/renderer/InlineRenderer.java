package com.doctex.core.renderer;

import com.doctex.core.format.QuoteMismatchException;
import com.doctex.core.format.QuoteProcessor;
import com.doctex.core.format.TextEscaper;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.reference.MathEnvironments;
import com.doctex.core.reference.ReferenceResolver;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.doctex.core.format.ArgumentFormatter.arg;
import static com.doctex.core.format.ArgumentFormatter.bracketed;

/**
 * Renders inline objects: text, markup, links, footnotes, timestamps and math.
 *
 * <h2>Text</h2>
 * <p>Plain text is escaped and, when smart quotes are on, converted with the quote style
 * of the document language. Unbalanced quotes fall back to escaped text and a warning.
 *
 * <h2>Links</h2>
 * <ul>
 *   <li>{@code custom-id}, {@code id}, {@code fuzzy}, {@code radio} - resolved inside the
 *       document; {@code \goto{text}[label]} with a description, {@code \in[label]} for
 *       numbered targets without one</li>
 *   <li>{@code coderef} - the code reference label, checked against the source blocks</li>
 *   <li>anything else - an external URL</li>
 * </ul>
 *
 * <h2>Math</h2>
 * <p>Inside a math run, fragments lose their delimiters and sub/superscripts become
 * {@code _{}}/{@code ^{}}, so the whole run typesets as one {@code \m{...}}.
 */
class InlineRenderer {

    static final String LINK_TYPE = "type";
    static final String LINK_PATH = "path";
    static final String RAW_LINK = "raw-link";
    static final String FOOTNOTE_LABEL = "label";
    static final String BACKEND = "backend";

    private static final String FOOTNOTE_PREFIX = "fn:";

    private static final Set<String> INTERNAL_LINKS = Set.of("custom-id", "id", "fuzzy", "radio");
    private static final Set<String> LOCAL_LINKS = Set.of("file");

    private final DispatchRenderer dispatcher;

    InlineRenderer(DispatchRenderer dispatcher) {
        this.dispatcher = dispatcher;
    }

    Optional<String> plainText(Node text, RenderContext ctx) {
        String value = text.value();
        if (!ctx.config().smartQuotes() || ctx.within(NodeKind.MATH_RUN)) {
            return Optional.of(TextEscaper.escape(value));
        }
        Optional<String> planned = ctx.smartQuoted(text);
        if (planned.isPresent()) {
            return planned;
        }
        try {
            return Optional.of(QuoteProcessor.process(value, ctx.config().quoteStyleFor(ctx.language()),
                TextEscaper::escape));
        } catch (QuoteMismatchException e) {
            ctx.warn(RenderWarning.Type.QUOTE_MISMATCH,
                "Unbalanced quotes in \"" + value.strip() + "\": " + e.getMessage());
            return Optional.of(TextEscaper.escape(value));
        }
    }

    Optional<String> markup(String key, ChildOutputs children, RenderContext ctx) {
        String format = ctx.config().markupFor(key);
        String contents = children.joined();
        return Optional.of(format == null ? contents : format.replace("%s", contents));
    }

    Optional<String> verbatim(Node node) {
        return Optional.of(TextEscaper.verbatim(node.value()));
    }

    Optional<String> script(Node node, String key, String mathOperator, ChildOutputs children,
                            RenderContext ctx) {
        if (ctx.within(NodeKind.MATH_RUN)) {
            return Optional.of(mathOperator + "{" + node.rawText().strip() + "}");
        }
        return markup(key, children, ctx);
    }

    Optional<String> lineBreak(RenderContext ctx) {
        return Optional.of(ctx.config().markupFor("line-break") + "\n");
    }

    Optional<String> target(Node target, RenderContext ctx) {
        return Optional.of("\\pagereference[" + ctx.resolver().getLabel(target, true).orElseThrow() + "]");
    }

    Optional<String> radioTarget(Node target, ChildOutputs children, RenderContext ctx) {
        return Optional.of("\\pagereference[" + ctx.resolver().getLabel(target, true).orElseThrow() + "]"
            + children.joined());
    }

    Optional<String> latexFragment(Node fragment, RenderContext ctx) {
        String value = fragment.value();
        if (ctx.within(NodeKind.MATH_RUN)) {
            return Optional.of(MathEnvironments.stripInlineDelimiters(value));
        }
        if (!MathEnvironments.isDelimitedMath(value)) {
            return Optional.of(value);
        }
        String math = MathEnvironments.stripInlineDelimiters(value).strip();
        if (MathEnvironments.isDisplayMath(value)) {
            return Optional.of("\\startformula " + math + " \\stopformula");
        }
        return Optional.of("\\m{" + math + "}");
    }

    Optional<String> mathRun(ChildOutputs members) {
        return Optional.of("\\m{" + members.joined().strip() + "}");
    }

    Optional<String> exportSnippet(Node snippet, RenderContext ctx) {
        if (!ctx.config().isRawBackend(snippet.stringProperty(BACKEND))) {
            return Optional.empty();
        }
        return Optional.of(snippet.value());
    }

    Optional<String> link(Node link, ChildOutputs children, RenderContext ctx) {
        String type = link.stringProperty(LINK_TYPE, "fuzzy").trim().toLowerCase(Locale.ROOT);
        String description = children.joined().strip();
        if (INTERNAL_LINKS.contains(type)) {
            return Optional.of(internalLink(link, description, ctx));
        }
        if (type.equals("coderef")) {
            String label = link.stringProperty(LINK_PATH, "");
            ctx.resolver().codeBlockFor(label);
            return Optional.of(description.isEmpty() ? TextEscaper.escape(label) : description);
        }
        return Optional.of(externalLink(link, type, description));
    }

    private String internalLink(Node link, String description, RenderContext ctx) {
        Node target = ctx.resolver().resolveLink(link);
        String label = ctx.resolver().getLabel(target, true).orElseThrow();
        if (!description.isEmpty()) {
            return "\\goto{" + description + "}[" + label + "]";
        }
        if (isNumbered(target)) {
            return "\\in[" + label + "]";
        }
        String text = target.is(NodeKind.HEADING) ? target.rawTitle() : target.rawText().strip();
        return "\\goto{" + TextEscaper.escape(text.isEmpty() ? label : text) + "}[" + label + "]";
    }

    private static boolean isNumbered(Node target) {
        return switch (target.kind()) {
            case HEADING -> !target.flag(HeadingRenderer.UNNUMBERED_PROPERTY);
            case TABLE -> target.hasCaption();
            case PARAGRAPH -> ReferenceResolver.isFigure(target);
            case LATEX_ENVIRONMENT -> MathEnvironments.environmentName(target.value())
                .map(MathEnvironments::isNumbered)
                .orElse(false);
            case SRC_BLOCK -> target.hasCaption();
            default -> false;
        };
    }

    private static String externalLink(Node link, String type, String description) {
        String path = link.stringProperty(LINK_PATH, "");
        String url = LOCAL_LINKS.contains(type) ? path : link.stringProperty(RAW_LINK, type + ":" + path);
        String escaped = TextEscaper.escapeUrl(url);
        if (description.isEmpty()) {
            return "\\hyphenatedurl{" + escaped + "}";
        }
        return "\\goto{" + description + "}[url(" + escaped + ")]";
    }

    Optional<String> image(Node image) {
        String path = image.stringProperty(LINK_PATH, "");
        String options = bracketed(List.of(
            arg("width", image.stringProperty("width")),
            arg("height", image.stringProperty("height")),
            arg("scale", image.stringProperty("scale"))), true);
        return Optional.of("\\externalfigure[" + path + "]" + options);
    }

    Optional<String> footnoteReference(Node reference, ChildOutputs children, RenderContext ctx) {
        String label = reference.stringProperty(FOOTNOTE_LABEL, "").trim();
        if (label.isEmpty()) {
            ctx.countInlineFootnote();
            return Optional.of("\\footnote{" + children.joined().strip() + "}");
        }
        String id = FOOTNOTE_PREFIX + TextEscaper.sanitizeLabel(label);
        if (!ctx.markFootnoteEmitted(label)) {
            return Optional.of("\\note[" + id + "]");
        }
        String text = children.isBlank()
            ? dispatcher.renderObjects(ctx.resolver().footnoteDefinition(label).children(), ctx).strip()
            : children.joined().strip();
        return Optional.of("\\footnote[" + id + "]{" + text + "}");
    }

    Optional<String> timestamp(Node timestamp) {
        if (!timestamp.hasProperty("year-start")) {
            return Optional.of(TextEscaper.escape(timestamp.value().strip()));
        }
        String start = date(timestamp, "start");
        if (!timestamp.hasProperty("year-end")) {
            return Optional.of(start);
        }
        String end = date(timestamp, "end");
        return Optional.of(start.equals(end) ? start : start + "\\endash{}" + end);
    }

    private static String date(Node timestamp, String side) {
        String date = "\\date" + bracketed(List.of(
            arg("d", timestamp.stringProperty("day-" + side)),
            arg("m", timestamp.stringProperty("month-" + side)),
            arg("y", timestamp.stringProperty("year-" + side))), true);
        if (!timestamp.hasProperty("hour-" + side)) {
            return date;
        }
        int hour = timestamp.intProperty("hour-" + side, 0);
        int minute = timestamp.intProperty("minute-" + side, 0);
        return date + String.format(Locale.ROOT, " %02d:%02d", hour, minute);
    }
}
