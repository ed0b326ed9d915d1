package com.doctex.core.renderer;

import com.doctex.core.format.ArgumentFormatter.Argument;
import com.doctex.core.model.Node;
import com.doctex.core.reference.MathEnvironments;
import com.doctex.core.reference.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.doctex.core.format.ArgumentFormatter.arg;
import static com.doctex.core.format.ArgumentFormatter.bracketed;

/**
 * Renders block-level elements: paragraphs and figures, lists, the various blocks,
 * source code and math environments.
 *
 * <h2>Source blocks</h2>
 * <p>Source code goes into a typing environment named after the translated language
 * ({@code OrgSrcPython} for {@code python}), highlighted through the vim module. The
 * {@code number-lines} property ({@code new} or {@code continued}) numbers lines;
 * continued blocks pick up after the last numbered block. Code reference markers are
 * stripped when {@code remove-labels} is set.
 *
 * <h2>Math environments</h2>
 * <p>Known math environments become {@code \startformula}; numbered ones are preceded by
 * {@code \placeformula}, carrying the label when the environment is named. Align-like
 * environments are laid out with {@code \NC}/{@code \NR} rows. Other environments are
 * passed through unchanged.
 */
class BlockRenderer {

    private static final Logger log = LoggerFactory.getLogger(BlockRenderer.class);

    static final String LIST_TYPE = "type";
    static final String CHECKBOX = "checkbox";
    static final String LANGUAGE = "language";
    static final String NUMBER_LINES = "number-lines";
    static final String NUMBER_OFFSET = "number-offset";
    static final String REMOVE_LABELS = "remove-labels";
    static final String BACKEND = "backend";
    static final String BLOCK_TYPE = "type";

    private static final Pattern ROW_SEPARATOR = Pattern.compile("\\\\\\\\");
    private static final Pattern EQUATION_NOISE = Pattern.compile("\\\\(label\\{[^}]*\\}|nonumber|notag)");

    private final DispatchRenderer dispatcher;

    BlockRenderer(DispatchRenderer dispatcher) {
        this.dispatcher = dispatcher;
    }

    Optional<String> container(ChildOutputs children) {
        String contents = children.joined();
        return contents.isEmpty() ? Optional.empty() : Optional.of(contents);
    }

    Optional<String> paragraph(Node paragraph, ChildOutputs children, RenderContext ctx) {
        String contents = children.joined().strip();
        if (ReferenceResolver.isFigure(paragraph)) {
            return Optional.of(figure(paragraph, contents, ctx));
        }
        if (contents.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(anchor(paragraph, ctx) + contents + "\n");
    }

    private String figure(Node paragraph, String image, RenderContext ctx) {
        String caption = dispatcher.renderObjects(paragraph.caption(), ctx).strip();
        String label = ctx.resolver().getLabel(paragraph, false).orElse("");
        return "\\startplacefigure" + bracketed(List.of(arg("title", caption), arg("reference", label)), false) + "\n"
            + image + "\n"
            + "\\stopplacefigure\n";
    }

    Optional<String> plainList(Node list, ChildOutputs children) {
        String items = children.joined().stripTrailing();
        return switch (listType(list)) {
            case "ordered" -> Optional.of("\\startitemize[n]\n" + items + "\n\\stopitemize\n");
            case "descriptive" -> Optional.of(items + "\n");
            default -> Optional.of("\\startitemize\n" + items + "\n\\stopitemize\n");
        };
    }

    Optional<String> item(Node item, ChildOutputs children, RenderContext ctx) {
        String contents = children.joined().strip();
        boolean descriptive = ctx.parent().map(BlockRenderer::listType).orElse("").equals("descriptive");
        if (descriptive) {
            ctx.useEnvironment(Environments.DESCRIPTION, Environments.DESCRIPTION_DEFINITION);
            String tag = dispatcher.renderObjects(item.title(), ctx).strip();
            return Optional.of("\\start" + Environments.DESCRIPTION + "{" + tag + "}\n"
                + contents + "\n\\stop" + Environments.DESCRIPTION + "\n");
        }
        return Optional.of(checkbox(item) + contents + "\n");
    }

    private static String checkbox(Node item) {
        String state = item.stringProperty(CHECKBOX, "").trim().toLowerCase(Locale.ROOT);
        return switch (state) {
            case "on" -> "\\sym{$\\boxtimes$} ";
            case "off" -> "\\sym{$\\square$} ";
            case "trans" -> "\\sym{$\\boxminus$} ";
            default -> "\\item ";
        };
    }

    private static String listType(Node list) {
        return list.stringProperty(LIST_TYPE, "unordered").trim().toLowerCase(Locale.ROOT);
    }

    Optional<String> quoteBlock(ChildOutputs children, RenderContext ctx) {
        ctx.useEnvironment(Environments.BLOCK_QUOTE, Environments.BLOCK_QUOTE_DEFINITION);
        return Optional.of(wrap(Environments.BLOCK_QUOTE, children.joined()));
    }

    Optional<String> verseBlock(ChildOutputs children, RenderContext ctx) {
        ctx.useEnvironment(Environments.VERSE, Environments.VERSE_DEFINITION);
        return Optional.of(wrap(Environments.VERSE, children.joined()));
    }

    Optional<String> centerBlock(ChildOutputs children) {
        return Optional.of("\\startalignment[middle]\n" + children.joined().strip() + "\n\\stopalignment\n");
    }

    Optional<String> specialBlock(Node block, ChildOutputs children, RenderContext ctx) {
        String name = Environments.lowerName(block.stringProperty(BLOCK_TYPE, ""));
        if (name.isEmpty()) {
            return container(children);
        }
        ctx.useEnvironment(name, Environments.specialBlock(name));
        return Optional.of(wrap(name, children.joined()));
    }

    Optional<String> exampleBlock(Node block, RenderContext ctx) {
        ctx.useEnvironment(Environments.EXAMPLE, Environments.EXAMPLE_DEFINITION);
        return Optional.of(wrapVerbatim(Environments.EXAMPLE, codeText(block)));
    }

    Optional<String> fixedWidth(Node block, RenderContext ctx) {
        ctx.useEnvironment(Environments.FIXED_WIDTH, Environments.FIXED_WIDTH_DEFINITION);
        return Optional.of(wrapVerbatim(Environments.FIXED_WIDTH, stripFinalNewline(block.value())));
    }

    Optional<String> srcBlock(Node block, RenderContext ctx) {
        String environment = sourceEnvironment(block, ctx);
        String code = codeText(block);
        String arguments = bracketed(numbering(block, code, ctx), true);

        String typing = "\\start" + environment + arguments + "\n" + code + "\n\\stop" + environment + "\n";
        if (block.hasCaption()) {
            ctx.useEnvironment(Environments.LISTING, Environments.LISTING_DEFINITION);
            String caption = dispatcher.renderObjects(block.caption(), ctx).strip();
            String label = ctx.resolver().getLabel(block, false).orElse("");
            return Optional.of("\\startplacelisting"
                + bracketed(List.of(arg("title", caption), arg("reference", label)), false) + "\n"
                + typing
                + "\\stopplacelisting\n");
        }
        return Optional.of(anchor(block, ctx) + typing);
    }

    private static String sourceEnvironment(Node block, RenderContext ctx) {
        String prefix = ctx.config().srcEnvironmentPrefix();
        String language = block.stringProperty(LANGUAGE, "");
        if (language.isBlank()) {
            ctx.useEnvironment(prefix, Environments.plainSource(prefix));
            return prefix;
        }
        String syntax = ctx.translateLanguage(language);
        String environment = prefix + Environments.commandName(syntax);
        ctx.useEnvironment(Environments.VIM_MODULE, Environments.VIM_MODULE_DEFINITION);
        ctx.useEnvironment(environment, Environments.highlightedSource(environment, syntax));
        return environment;
    }

    private static List<Argument> numbering(Node block, String code, RenderContext ctx) {
        String mode = block.stringProperty(NUMBER_LINES, "").trim().toLowerCase(Locale.ROOT);
        if (!mode.equals("new") && !mode.equals("continued")) {
            return List.of();
        }
        int offset = block.intProperty(NUMBER_OFFSET, 0);
        int start = (mode.equals("continued") ? ctx.lastCodeLine() : 0) + offset + 1;
        int lines = code.split("\n", -1).length;
        ctx.setLastCodeLine(start + lines - 1);
        log.debug("Numbering source lines {}..{}", start, start + lines - 1);
        return List.of(arg("numbering", "yes"), arg("numberstart", String.valueOf(start)));
    }

    private static String codeText(Node block) {
        String code = stripFinalNewline(block.value());
        if (!block.flag(REMOVE_LABELS)) {
            return code;
        }
        return markerPattern(block).matcher(code).replaceAll("");
    }

    /**
     * Builds the pattern matching any code reference marker of a block, with the blanks in
     * front of it.
     */
    static Pattern markerPattern(Node block) {
        String marker = ReferenceResolver.codeRefMarker(block, "\u0000");
        int hole = marker.indexOf('\u0000');
        if (hole < 0) {
            return Pattern.compile("[ \\t]*" + Pattern.quote(marker));
        }
        String before = marker.substring(0, hole);
        String after = marker.substring(hole + 1);
        return Pattern.compile("[ \\t]*" + Pattern.quote(before) + "[-\\w ]+?" + Pattern.quote(after));
    }

    Optional<String> exportBlock(Node block, RenderContext ctx) {
        if (!ctx.config().isRawBackend(block.stringProperty(BACKEND))) {
            return Optional.empty();
        }
        return Optional.of(stripFinalNewline(block.value()) + "\n");
    }

    Optional<String> latexEnvironment(Node environment, RenderContext ctx) {
        String value = environment.value();
        Optional<String> name = MathEnvironments.environmentName(value).filter(MathEnvironments::isMathEnvironment);
        if (name.isEmpty()) {
            return Optional.of(stripFinalNewline(value) + "\n");
        }
        String body = MathEnvironments.body(value, name.get());
        String inner = MathEnvironments.isAligned(name.get()) ? alignedRows(body) : clean(body);
        String formula = "\\startformula\n" + inner + "\n\\stopformula\n";
        if (!MathEnvironments.isNumbered(name.get())) {
            return Optional.of(formula);
        }
        String place = ctx.resolver().getLabel(environment, false)
            .map(label -> "\\placeformula[" + label + "]")
            .orElse("\\placeformula");
        return Optional.of(place + "\n" + formula);
    }

    private static String alignedRows(String body) {
        List<String> rows = new ArrayList<>();
        for (String row : ROW_SEPARATOR.split(body)) {
            String cleaned = clean(row);
            if (cleaned.isEmpty()) {
                continue;
            }
            StringBuilder sb = new StringBuilder();
            for (String cell : cleaned.split("&")) {
                sb.append("\\NC ").append(cell.strip()).append(' ');
            }
            rows.add(sb.append("\\NR").toString());
        }
        return "\\startalign\n" + String.join("\n", rows) + "\n\\stopalign";
    }

    private static String clean(String math) {
        Matcher matcher = EQUATION_NOISE.matcher(math);
        return matcher.replaceAll("").strip();
    }

    Optional<String> horizontalRule(RenderContext ctx) {
        return Optional.of(ctx.config().markupFor("horizontal-rule") + "\n");
    }

    /**
     * Returns a page reference for a named element that has no other way to carry its
     * label, so links by name still land somewhere.
     */
    private static String anchor(Node node, RenderContext ctx) {
        if (node.explicitName().isEmpty() && node.customId().isEmpty()) {
            return "";
        }
        return ctx.resolver().getLabel(node, false)
            .map(label -> "\\pagereference[" + label + "]\n")
            .orElse("");
    }

    private static String wrap(String environment, String contents) {
        return "\\start" + environment + "\n" + contents.strip() + "\n\\stop" + environment + "\n";
    }

    private static String wrapVerbatim(String environment, String text) {
        return "\\start" + environment + "\n" + text + "\n\\stop" + environment + "\n";
    }

    private static String stripFinalNewline(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }
}
