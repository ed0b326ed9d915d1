package com.doctex.core.renderer;

import com.doctex.core.config.RenderConfig;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.Zone;
import com.doctex.core.reference.ReferenceResolver;
import com.doctex.core.table.TableLayoutEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Mutable state of one render pass.
 *
 * <p>A context is created for one document, threaded through every renderer call and
 * discarded once the assembler has consumed it. It is not thread-safe and is never shared
 * between passes, which is what makes two renders of the same tree byte-identical.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li><b>Configuration:</b> the injected {@link RenderConfig} and the document language</li>
 *   <li><b>Registries:</b> the {@link ReferenceResolver} and the {@link TableLayoutEngine}</li>
 *   <li><b>Zone buffers:</b> rendered text of zone-marked headings, in traversal order</li>
 *   <li><b>Counters:</b> footnotes already emitted and the continued code line number</li>
 *   <li><b>Smart quotes:</b> quote conversion planned per paragraph, title and caption</li>
 *   <li><b>Preamble:</b> environment definitions used so far, in first-use order</li>
 *   <li><b>Ancestors:</b> the nodes above the one being rendered</li>
 * </ul>
 */
public class RenderContext {

    private static final Logger log = LoggerFactory.getLogger(RenderContext.class);

    public static final String LANGUAGE_PROPERTY = "language";

    private final RenderConfig config;
    private final String language;
    private final ReferenceResolver resolver;
    private final TableLayoutEngine tables;
    private final SmartQuotes smartQuotes;

    private final Map<Zone, List<String>> zones = new EnumMap<>(Zone.class);
    private final Map<String, String> languageCache = new HashMap<>();
    private final Set<String> emittedFootnotes = new HashSet<>();
    private final Map<String, String> usedEnvironments = new LinkedHashMap<>();
    private final List<RenderWarning> warnings = new ArrayList<>();
    private final Deque<Node> ancestors = new ArrayDeque<>();

    private int footnoteCount;
    private int lastCodeLine;

    /**
     * Creates the context for rendering one document.
     *
     * @param config render configuration
     * @param root rewritten document root, indexed for reference resolution
     */
    public RenderContext(RenderConfig config, Node root) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(root, "root must not be null");
        this.language = root.stringProperty(LANGUAGE_PROPERTY, config.language());
        this.resolver = new ReferenceResolver(root);
        this.tables = new TableLayoutEngine(config.table());
        for (Zone zone : Zone.values()) {
            zones.put(zone, new ArrayList<>());
        }
        this.smartQuotes = config.smartQuotes()
            ? SmartQuotes.plan(root, config.quoteStyleFor(language), this::warn)
            : null;
    }

    public RenderConfig config() {
        return config;
    }

    public String language() {
        return language;
    }

    public ReferenceResolver resolver() {
        return resolver;
    }

    public TableLayoutEngine tables() {
        return tables;
    }

    /**
     * Appends rendered text to a zone buffer.
     *
     * @param zone target zone
     * @param text rendered text
     */
    public void appendToZone(Zone zone, String text) {
        zones.get(zone).add(text);
        log.debug("Routed {} characters to zone {}", text.length(), zone);
    }

    /**
     * Returns the zone buffers, each in traversal order.
     *
     * @return read-only view of every zone buffer
     */
    public Map<Zone, List<String>> zoneBuffers() {
        Map<Zone, List<String>> view = new EnumMap<>(Zone.class);
        zones.forEach((zone, buffer) -> view.put(zone, Collections.unmodifiableList(buffer)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Translates a source language name to the highlighter's name, caching the result.
     *
     * @param sourceLanguage language as written in the document
     * @return translated lower-case name
     */
    public String translateLanguage(String sourceLanguage) {
        String key = sourceLanguage.trim().toLowerCase(Locale.ROOT);
        return languageCache.computeIfAbsent(key, k -> config.languages().getOrDefault(k, k));
    }

    /**
     * Marks a footnote label as emitted.
     *
     * @param label footnote label
     * @return true the first time a label is seen
     */
    public boolean markFootnoteEmitted(String label) {
        boolean first = emittedFootnotes.add(label);
        if (first) {
            footnoteCount++;
        }
        return first;
    }

    /**
     * Counts an anonymous (inline) footnote.
     */
    public void countInlineFootnote() {
        footnoteCount++;
    }

    public int footnoteCount() {
        return footnoteCount;
    }

    /**
     * Returns the last code line number emitted by a numbered block, 0 before any.
     *
     * @return last line number
     */
    public int lastCodeLine() {
        return lastCodeLine;
    }

    public void setLastCodeLine(int line) {
        this.lastCodeLine = line;
    }

    /**
     * Records that an environment is used. A configured definition with the same name
     * replaces the built-in one. The first registration wins.
     *
     * @param name environment name
     * @param defaultDefinition built-in definition
     */
    public void useEnvironment(String name, String defaultDefinition) {
        if (!usedEnvironments.containsKey(name)) {
            usedEnvironments.put(name, config.environments().getOrDefault(name, defaultDefinition));
        }
    }

    /**
     * Returns the definitions of used environments in first-use order.
     *
     * @return name to definition
     */
    public Map<String, String> usedEnvironments() {
        return Collections.unmodifiableMap(usedEnvironments);
    }

    /**
     * Returns the smart-quoted output planned for a plain-text object, balanced over its
     * whole paragraph, title or caption.
     *
     * @param text plain-text node
     * @return planned output, empty when smart quotes are off or the node is not in the tree
     */
    Optional<String> smartQuoted(Node text) {
        return smartQuotes == null ? Optional.empty() : smartQuotes.converted(text);
    }

    public void warn(RenderWarning.Type type, String message) {
        log.warn("{}", message);
        warnings.add(new RenderWarning(type, message));
    }

    public List<RenderWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    void enter(Node node) {
        ancestors.push(node);
    }

    void leave() {
        ancestors.pop();
    }

    /**
     * Returns the direct parent of the node being rendered.
     *
     * @return parent, empty at the root
     */
    public Optional<Node> parent() {
        return Optional.ofNullable(ancestors.peek());
    }

    /**
     * Returns the nearest ancestor of a kind.
     *
     * @param kind ancestor kind
     * @return nearest matching ancestor
     */
    public Optional<Node> nearest(NodeKind kind) {
        Iterator<Node> it = ancestors.iterator();
        while (it.hasNext()) {
            Node node = it.next();
            if (node.is(kind)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns whether any ancestor of the node being rendered matches.
     *
     * @param test ancestor predicate
     * @return true when an ancestor matches
     */
    public boolean anyAncestor(Predicate<Node> test) {
        for (Node node : ancestors) {
            if (test.test(node)) {
                return true;
            }
        }
        return false;
    }

    public boolean within(NodeKind kind) {
        return nearest(kind).isPresent();
    }
}
