package com.doctex.core.util;

import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a document tree from its JSON (or YAML) form.
 *
 * <p>Files ending in {@code .yaml} or {@code .yml} are read as YAML, everything else as
 * JSON. Unknown node kinds fail the load; unknown fields are ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Node root = NodeTreeLoader.load(Path.of("report.json"));
 * }</pre>
 */
public final class NodeTreeLoader {

    private static final Logger log = LoggerFactory.getLogger(NodeTreeLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private NodeTreeLoader() {
        // Utility class
    }

    /**
     * Loads a document tree from a file.
     *
     * @param path JSON or YAML file
     * @return root node
     * @throws IOException if the file cannot be read or is not a valid tree
     */
    public static Node load(Path path) throws IOException {
        ObjectMapper mapper = isYaml(path) ? YAML_MAPPER : JSON_MAPPER;
        log.debug("Loading document tree from: {}", path);
        Node root = mapper.readValue(Files.readString(path), Node.class);
        if (root == null) {
            throw new IOException("Document tree is empty: " + path);
        }
        log.debug("Loaded {} tree from {}", root.kind().externalName(), path);
        return root;
    }

    /**
     * Parses a document tree from JSON text.
     *
     * @param json JSON text
     * @return root node
     * @throws IllegalArgumentException if the text is not a valid tree
     */
    public static Node parse(String json) {
        try {
            Node root = JSON_MAPPER.readValue(json, Node.class);
            if (root == null) {
                throw new IllegalArgumentException("Document tree is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid document tree: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Returns whether a document root is usable: it must be a {@link NodeKind#DOCUMENT}.
     *
     * @param root loaded root
     * @return true for a document node
     */
    public static boolean isDocument(Node root) {
        return root != null && root.is(NodeKind.DOCUMENT);
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
