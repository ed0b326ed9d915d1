package com.doctex.core.reference;

import com.doctex.core.error.CodeRefNotFoundException;
import com.doctex.core.error.ReferenceNotFoundException;
import com.doctex.core.format.TextEscaper;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns stable references and labels to nodes and resolves cross-references.
 *
 * <p>One resolver lives inside one render context. It indexes the document once at
 * construction (custom ids, ids, names, targets, radio targets, heading titles,
 * footnote definitions, code blocks) and then answers lookups.
 *
 * <h2>References</h2>
 * <p>{@link #getReference(Node)} allocates {@code ref1}, {@code ref2}, ... lazily, keyed by
 * node identity. Repeated lookups for the same instance return the identical
 * {@link Reference}; two equal-looking nodes still get different references.
 *
 * <h2>Labels</h2>
 * <p>{@link #getLabel(Node, boolean)} returns a label only when the node has a custom id,
 * an explicit name or a caption, or when {@code force} is set. The label is prefixed by
 * {@link #labelPrefix(Node)}, which depends on node kind and content only. Labels are
 * unique within a document: explicit labels are reserved in document order at indexing
 * time, and a label already taken gets a {@code -2}, {@code -3}, ... suffix.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    public static final String SECTION_PREFIX = "sec:";
    public static final String TABLE_PREFIX = "tab:";
    public static final String EQUATION_PREFIX = "eq:";
    public static final String FIGURE_PREFIX = "fig:";

    static final String DEFAULT_CODEREF_FORMAT = "(ref:%s)";

    private final Map<Node, Reference> references = new IdentityHashMap<>();
    private int nextReference = 1;

    private final Map<String, Node> byCustomId = new HashMap<>();
    private final Map<String, Node> byId = new HashMap<>();
    private final Map<String, Node> byName = new HashMap<>();
    private final Map<String, Node> targets = new HashMap<>();
    private final Map<String, Node> radioTargets = new HashMap<>();
    private final Map<String, Node> headingsByTitle = new HashMap<>();
    private final Map<String, Node> footnoteDefinitions = new HashMap<>();
    private final List<Node> codeBlocks = new ArrayList<>();

    private final Map<Node, String> labels = new IdentityHashMap<>();
    private final Set<String> issuedLabels = new HashSet<>();

    /**
     * Indexes a document.
     *
     * @param root document root
     */
    public ReferenceResolver(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        index(root);
        log.debug("Indexed {} custom ids, {} names, {} targets, {} headings, {} footnote definitions",
            byCustomId.size(), byName.size(), targets.size(), headingsByTitle.size(), footnoteDefinitions.size());
    }

    /**
     * Returns the reference bound to a node, allocating it on first use.
     *
     * @param node node instance
     * @return the node's reference
     */
    public Reference getReference(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        return references.computeIfAbsent(node, n -> new Reference("ref" + nextReference++));
    }

    /**
     * Returns the label of a node.
     *
     * @param node node instance
     * @param force create a label even without custom id, name or caption
     * @return prefixed label, or empty
     */
    public Optional<String> getLabel(Node node, boolean force) {
        Optional<String> explicit = explicitLabel(node);
        if (explicit.isPresent()) {
            return Optional.of(issue(node, explicit.get()));
        }
        if (node.hasCaption() || force) {
            return Optional.of(issue(node, labelPrefix(node) + getReference(node).id()));
        }
        return Optional.empty();
    }

    private static Optional<String> explicitLabel(Node node) {
        String prefix = labelPrefix(node);
        return node.customId().or(node::explicitName)
            .map(TextEscaper::sanitizeLabel)
            .map(label -> label.startsWith(prefix) ? label : prefix + label);
    }

    private String issue(Node node, String candidate) {
        String issued = labels.get(node);
        if (issued != null) {
            return issued;
        }
        String label = candidate;
        for (int n = 2; !issuedLabels.add(label); n++) {
            label = candidate + "-" + n;
        }
        if (!label.equals(candidate)) {
            log.debug("Label '{}' already taken, using '{}'", candidate, label);
        }
        labels.put(node, label);
        return label;
    }

    /**
     * Returns the label prefix for a node: {@code sec:} for headings, {@code tab:} for
     * tables, {@code eq:} for math environments, {@code fig:} for captioned figure
     * paragraphs and the empty string otherwise.
     *
     * @param node node
     * @return prefix
     */
    public static String labelPrefix(Node node) {
        return switch (node.kind()) {
            case HEADING -> SECTION_PREFIX;
            case TABLE -> TABLE_PREFIX;
            case LATEX_ENVIRONMENT -> MathEnvironments.environmentName(node.value())
                .filter(MathEnvironments::isMathEnvironment)
                .map(name -> EQUATION_PREFIX)
                .orElse("");
            case PARAGRAPH -> isFigure(node) ? FIGURE_PREFIX : "";
            default -> "";
        };
    }

    /**
     * Returns whether a paragraph is a captioned figure: it has a caption and its only
     * non-blank child is an image.
     *
     * @param paragraph paragraph node
     * @return true for figure paragraphs
     */
    public static boolean isFigure(Node paragraph) {
        if (!paragraph.is(NodeKind.PARAGRAPH) || !paragraph.hasCaption()) {
            return false;
        }
        return figureImage(paragraph).isPresent();
    }

    /**
     * Returns the single image of a paragraph, ignoring whitespace-only text.
     *
     * @param paragraph paragraph node
     * @return image node, or empty when the paragraph has other content
     */
    public static Optional<Node> figureImage(Node paragraph) {
        Node image = null;
        for (Node child : paragraph.children()) {
            if (child.is(NodeKind.PLAIN_TEXT) && child.value().isBlank()) {
                continue;
            }
            if (child.is(NodeKind.IMAGE) && image == null) {
                image = child;
            } else {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(image);
    }

    /**
     * Resolves an internal link to its target node.
     *
     * @param link link node with {@code type} and {@code path} properties
     * @return target node
     * @throws ReferenceNotFoundException if nothing matches
     */
    public Node resolveLink(Node link) {
        String type = link.stringProperty("type", "fuzzy").toLowerCase(Locale.ROOT);
        String path = link.stringProperty("path", "");
        Node target = switch (type) {
            case "custom-id" -> byCustomId.get(path.startsWith("#") ? path.substring(1) : path);
            case "id" -> byId.get(path);
            case "radio" -> radioTargets.get(normalize(path));
            case "fuzzy" -> resolveFuzzy(path);
            default -> null;
        };
        if (target == null) {
            throw new ReferenceNotFoundException(type, path);
        }
        return target;
    }

    /**
     * Returns the footnote definition for a label.
     *
     * @param label footnote label
     * @return definition node
     * @throws ReferenceNotFoundException if the label has no definition
     */
    public Node footnoteDefinition(String label) {
        Node definition = footnoteDefinitions.get(label);
        if (definition == null) {
            throw new ReferenceNotFoundException("footnote", label);
        }
        return definition;
    }

    /**
     * Finds the code block containing a code reference marker.
     *
     * @param label code reference label
     * @return block whose source contains the marker
     * @throws CodeRefNotFoundException if no block contains it
     */
    public Node codeBlockFor(String label) {
        for (Node block : codeBlocks) {
            if (block.value().contains(codeRefMarker(block, label))) {
                return block;
            }
        }
        throw new CodeRefNotFoundException(label, DEFAULT_CODEREF_FORMAT.replace("%s", label));
    }

    /**
     * Returns the marker text a code block uses for a label.
     *
     * @param block source or example block
     * @param label code reference label
     * @return marker, e.g. {@code (ref:loop)}; only {@code %s} in the format is replaced
     */
    public static String codeRefMarker(Node block, String label) {
        String format = block.stringProperty("label-format", DEFAULT_CODEREF_FORMAT);
        return format.replace("%s", label);
    }

    private Node resolveFuzzy(String path) {
        if (path.startsWith("*")) {
            return headingsByTitle.get(normalize(path.substring(1)));
        }
        String key = normalize(path);
        Node target = targets.get(key);
        if (target == null) {
            target = byName.get(path.trim());
        }
        if (target == null) {
            target = headingsByTitle.get(key);
        }
        return target;
    }

    private void index(Node node) {
        node.customId().ifPresent(id -> byCustomId.putIfAbsent(id, node));
        explicitLabel(node).ifPresent(label -> issue(node, label));
        String id = node.stringProperty(Node.ID);
        if (id != null && !id.isBlank()) {
            byId.putIfAbsent(id, node);
        }
        node.explicitName().ifPresent(name -> byName.putIfAbsent(name.trim(), node));

        switch (node.kind()) {
            case TARGET -> targets.putIfAbsent(normalize(node.value()), node);
            case RADIO_TARGET -> radioTargets.putIfAbsent(normalize(node.rawText()), node);
            case HEADING -> headingsByTitle.putIfAbsent(normalize(node.rawTitle()), node);
            case FOOTNOTE_DEFINITION -> footnoteDefinitions.putIfAbsent(node.stringProperty("label", ""), node);
            case SRC_BLOCK, EXAMPLE_BLOCK -> codeBlocks.add(node);
            default -> {
                // not indexed
            }
        }

        for (Node child : node.title()) {
            index(child);
        }
        for (Node child : node.caption()) {
            index(child);
        }
        for (Node child : node.children()) {
            index(child);
        }
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
