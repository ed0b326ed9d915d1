package com.doctex.core.renderer;

import com.doctex.core.format.TextEscaper;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.doctex.core.format.ArgumentFormatter.arg;
import static com.doctex.core.format.ArgumentFormatter.bracketed;

/**
 * Renders headings, routes zone-marked headings into their zone buffers and handles
 * document keywords.
 *
 * <h2>Headings</h2>
 * <p>A heading becomes a {@code \start<command>[title=...,reference=...]} ...
 * {@code \stop<command>} pair. The command comes from the configured heading commands by
 * level, from the unnumbered list when the heading has the {@code unnumbered} flag.
 * Levels deeper than the list reuse its last command.
 *
 * <h2>Zones</h2>
 * <p>A heading whose {@code zone} property names a zone other than the body renders into
 * that zone's buffer and contributes nothing to its parent. Index headings are followed
 * by {@code \placeindex}; copying headings keep their contents only. A zone-marked
 * heading below another routed heading renders in place as part of that heading.
 *
 * <h2>Keywords</h2>
 * <ul>
 *   <li>{@code TOC} - {@code headlines [depth]}, {@code tables}, {@code figures},
 *       {@code listings}, {@code equations}; anything else renders nothing and warns</li>
 *   <li>{@code INDEX} - an index entry</li>
 *   <li>{@code CONTEXT} - raw ConTeXt passed through</li>
 * </ul>
 * Other keywords carry document metadata and render nothing.
 */
class HeadingRenderer {

    private static final Logger log = LoggerFactory.getLogger(HeadingRenderer.class);

    static final String LEVEL_PROPERTY = "level";
    static final String ZONE_PROPERTY = "zone";
    static final String UNNUMBERED_PROPERTY = "unnumbered";
    static final String KEY_PROPERTY = "key";

    private static final String PLACE_INDEX = "\\placeindex";

    private final DispatchRenderer dispatcher;

    HeadingRenderer(DispatchRenderer dispatcher) {
        this.dispatcher = dispatcher;
    }

    Optional<String> heading(Node heading, ChildOutputs children, RenderContext ctx) {
        Optional<Zone> zone = routedZone(heading);
        if (zone.isPresent() && ctx.anyAncestor(HeadingRenderer::isRouted)) {
            // the routed ancestor carries this heading along inside its own section
            log.debug("Heading '{}' stays inside its routed parent", heading.rawTitle());
            zone = Optional.empty();
        }
        String contents = children.joined();

        if (zone.isPresent() && zone.get() == Zone.COPYING) {
            ctx.appendToZone(Zone.COPYING, contents.strip() + "\n");
            return Optional.empty();
        }

        String command = command(heading, ctx);
        String title = dispatcher.renderObjects(heading.title(), ctx).strip();
        String label = ctx.resolver().getLabel(heading, true).orElseThrow();
        String arguments = bracketed(List.of(arg("title", title), arg("reference", label)), false);

        StringBuilder sb = new StringBuilder();
        sb.append("\\start").append(command).append(arguments).append('\n');
        if (!contents.isBlank()) {
            sb.append(contents.stripTrailing()).append('\n');
        }
        if (zone.isPresent() && zone.get() == Zone.INDEX) {
            sb.append(PLACE_INDEX).append('\n');
        }
        sb.append("\\stop").append(command).append('\n');

        if (zone.isPresent()) {
            ctx.appendToZone(zone.get(), sb.toString());
            return Optional.empty();
        }
        return Optional.of(sb.toString());
    }

    private static Optional<Zone> routedZone(Node heading) {
        return Zone.fromMarker(heading.stringProperty(ZONE_PROPERTY)).filter(z -> z != Zone.BODY);
    }

    private static boolean isRouted(Node node) {
        return node.is(NodeKind.HEADING) && routedZone(node).isPresent();
    }

    Optional<String> keyword(Node keyword, RenderContext ctx) {
        String key = keyword.stringProperty(KEY_PROPERTY, "").trim().toUpperCase(Locale.ROOT);
        String value = keyword.value().trim();
        return switch (key) {
            case "TOC" -> tableOfContents(value, ctx);
            case "INDEX" -> value.isEmpty()
                ? Optional.empty()
                : Optional.of("\\index{" + TextEscaper.escape(value) + "}\n");
            case "CONTEXT" -> Optional.of(value + "\n");
            default -> {
                log.debug("Keyword {} renders nothing", key);
                yield Optional.empty();
            }
        };
    }

    private Optional<String> tableOfContents(String value, RenderContext ctx) {
        String[] parts = value.toLowerCase(Locale.ROOT).split("\\s+");
        return switch (parts[0]) {
            case "headlines" -> Optional.of(contents(parts, ctx));
            case "tables" -> Optional.of("\\placelistoftables\n");
            case "figures" -> Optional.of("\\placelistoffigures\n");
            case "listings" -> {
                ctx.useEnvironment(Environments.LISTING, Environments.LISTING_DEFINITION);
                yield Optional.of("\\placelistoflistings\n");
            }
            case "equations" -> Optional.of("\\placelist[formula][criterium=all]\n");
            default -> {
                ctx.warn(RenderWarning.Type.UNKNOWN_TOC, "Unknown TOC directive: " + value);
                yield Optional.empty();
            }
        };
    }

    private static String contents(String[] parts, RenderContext ctx) {
        if (parts.length < 2) {
            return "\\placecontent\n";
        }
        int depth;
        try {
            depth = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return "\\placecontent\n";
        }
        List<String> commands = ctx.config().headingCommands();
        int count = Math.max(1, Math.min(depth, commands.size()));
        return "\\placecontent[list={" + String.join(",", commands.subList(0, count)) + "}]\n";
    }

    private static String command(Node heading, RenderContext ctx) {
        List<String> commands = heading.flag(UNNUMBERED_PROPERTY)
            ? ctx.config().unnumberedHeadingCommands()
            : ctx.config().headingCommands();
        int level = Math.max(1, heading.intProperty(LEVEL_PROPERTY, 1));
        return commands.get(Math.min(level, commands.size()) - 1);
    }
}
