package com.doctex.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One element of the input document tree.
 *
 * <p>Nodes are immutable. Two nodes with equal content are still distinct nodes: anything
 * that attaches state to a node (references, table layouts, footnote numbering) keys on
 * instance identity, never on {@link #equals(Object)}.
 *
 * <p><b>JSON form:</b>
 * <pre>{@code
 * {
 *   "kind": "heading",
 *   "properties": { "level": 1, "CUSTOM_ID": "intro" },
 *   "title": [ { "kind": "plain-text", "properties": { "value": "Introduction" } } ],
 *   "children": [ ... ]
 * }
 * }</pre>
 *
 * @param kind node kind
 * @param properties property name to value (strings, numbers, flags, lists)
 * @param caption caption objects, empty when uncaptioned
 * @param title heading title or list item tag objects, empty when absent
 * @param name explicit element name, or null
 * @param children ordered child nodes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Node(
    @JsonProperty("kind") NodeKind kind,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("caption") List<Node> caption,
    @JsonProperty("title") List<Node> title,
    @JsonProperty("name") String name,
    @JsonProperty("children") List<Node> children
) {
    public static final String VALUE = "value";
    public static final String POST_BLANK = "postBlank";
    public static final String CUSTOM_ID = "CUSTOM_ID";
    public static final String ID = "ID";

    /**
     * Compact constructor with validation.
     */
    public Node {
        Objects.requireNonNull(kind, "kind must not be null");
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        caption = caption == null ? List.of() : List.copyOf(caption);
        title = title == null ? List.of() : List.copyOf(title);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a node without properties.
     *
     * @param kind node kind
     * @param children child nodes
     * @return new node
     */
    public static Node of(NodeKind kind, Node... children) {
        return new Node(kind, Map.of(), List.of(), List.of(), null, Arrays.asList(children));
    }

    /**
     * Creates a plain text node.
     *
     * @param value text
     * @return new plain text node
     */
    public static Node text(String value) {
        return builder(NodeKind.PLAIN_TEXT).property(VALUE, value).build();
    }

    /**
     * Starts building a node of the given kind.
     *
     * @param kind node kind
     * @return builder
     */
    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    /**
     * Returns a builder pre-filled with this node's content.
     *
     * @return builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder(kind);
        builder.properties.putAll(properties);
        builder.caption.addAll(caption);
        builder.title.addAll(title);
        builder.name = name;
        builder.children.addAll(children);
        return builder;
    }

    /**
     * Returns a copy of this node with other children.
     *
     * @param newChildren replacement children
     * @return new node
     */
    public Node withChildren(List<Node> newChildren) {
        return new Node(kind, properties, caption, title, name, newChildren);
    }

    /**
     * Returns a copy of this node with one property replaced.
     *
     * @param key property name
     * @param value property value
     * @return new node
     */
    public Node withProperty(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(properties);
        copy.put(key, value);
        return new Node(kind, copy, caption, title, name, children);
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public boolean hasProperty(String key) {
        return properties.containsKey(key);
    }

    /**
     * Returns a property rendered as a string.
     *
     * @param key property name
     * @return string value or null when absent
     */
    public String stringProperty(String key) {
        Object value = properties.get(key);
        return value == null ? null : value.toString();
    }

    public String stringProperty(String key, String defaultValue) {
        String value = stringProperty(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns a numeric property, accepting numbers and numeric strings.
     *
     * @param key property name
     * @param defaultValue value used when absent or not numeric
     * @return integer value
     */
    public int intProperty(String key, int defaultValue) {
        Object value = properties.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Returns a flag property. Booleans are taken as is; strings {@code "t"}, {@code "yes"}
     * and {@code "true"} count as set.
     *
     * @param key property name
     * @return true when set
     */
    public boolean flag(String key) {
        Object value = properties.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("t") || normalized.equals("yes") || normalized.equals("true");
        }
        return false;
    }

    /**
     * Returns a list property as strings. A single value becomes a one-element list.
     *
     * @param key property name
     * @return values, empty when absent
     */
    public List<String> listProperty(String key) {
        Object value = properties.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return List.of(value.toString());
    }

    public String value() {
        return stringProperty(VALUE, "");
    }

    /**
     * Returns the number of blank characters (inline) or blank lines (element) following
     * this node in the source.
     *
     * @return trailing blank count, never negative
     */
    public int postBlank() {
        return Math.max(0, intProperty(POST_BLANK, 0));
    }

    public Optional<String> customId() {
        String id = stringProperty(CUSTOM_ID);
        return id == null || id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    public Optional<String> explicitName() {
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(name);
    }

    public boolean hasCaption() {
        return !caption.isEmpty();
    }

    /**
     * Concatenates the raw text of this node's title, ignoring markup.
     *
     * @return plain title text
     */
    public String rawTitle() {
        StringBuilder sb = new StringBuilder();
        for (Node node : title) {
            appendRawText(node, sb);
        }
        return sb.toString().trim();
    }

    /**
     * Concatenates the raw text of this node and its descendants, ignoring markup.
     *
     * @return plain text
     */
    public String rawText() {
        StringBuilder sb = new StringBuilder();
        appendRawText(this, sb);
        return sb.toString();
    }

    private static void appendRawText(Node node, StringBuilder sb) {
        if (node.hasProperty(VALUE) && node.children.isEmpty()) {
            sb.append(node.value());
        }
        for (Node child : node.children) {
            appendRawText(child, sb);
        }
        if (node.kind.isInline()) {
            sb.append(" ".repeat(node.postBlank()));
        }
    }

    /**
     * Mutable builder for {@link Node}.
     */
    public static final class Builder {
        private final NodeKind kind;
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private final List<Node> caption = new ArrayList<>();
        private final List<Node> title = new ArrayList<>();
        private final List<Node> children = new ArrayList<>();
        private String name;

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder property(String key, Object value) {
            properties.put(key, value);
            return this;
        }

        public Builder postBlank(int count) {
            properties.put(POST_BLANK, count);
            return this;
        }

        public Builder caption(Node... nodes) {
            caption.addAll(Arrays.asList(nodes));
            return this;
        }

        public Builder title(Node... nodes) {
            title.addAll(Arrays.asList(nodes));
            return this;
        }

        public Builder name(String value) {
            this.name = value;
            return this;
        }

        public Builder child(Node node) {
            children.add(node);
            return this;
        }

        public Builder children(Node... nodes) {
            children.addAll(Arrays.asList(nodes));
            return this;
        }

        public Builder children(List<Node> nodes) {
            children.addAll(nodes);
            return this;
        }

        public Node build() {
            return new Node(kind, properties, caption, title, name, children);
        }
    }
}
