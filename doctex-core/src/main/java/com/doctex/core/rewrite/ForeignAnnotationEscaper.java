package com.doctex.core.rewrite;

import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips Texinfo-style {@code @command{text}} annotations from document metadata.
 *
 * <p>Documents written for a Texinfo export often carry markup such as
 * {@code @code{foo}} or {@code @emph{bar}} in their title, subtitle or description. The
 * {@code @} and braces collide with ConTeXt syntax, so the wrapper is removed and the
 * inner text kept: {@code "Using @code{doctex} @emph{well}"} becomes
 * {@code "Using doctex well"}. Nested annotations are unwrapped innermost first.
 *
 * <p>Only the metadata fields listed in {@link #FIELDS} of {@link NodeKind#DOCUMENT} nodes
 * are touched. Text without annotations is returned unchanged, so the pass is idempotent.
 */
public class ForeignAnnotationEscaper implements TreeRewritePass {

    private static final Logger log = LoggerFactory.getLogger(ForeignAnnotationEscaper.class);

    static final List<String> FIELDS = List.of("title", "subtitle", "author", "description", "keywords", "date");

    private static final Pattern ANNOTATION = Pattern.compile(
        "@(code|samp|var|emph|strong|file|env|command|option|kbd|key|dfn|cite|acronym"
            + "|sc|r|i|b|t|w|url|email)\\{([^{}]*)\\}");

    @Override
    public String getId() {
        return "foreign-annotation-escaper";
    }

    @Override
    public Node apply(Node root) {
        if (!root.is(NodeKind.DOCUMENT)) {
            return root;
        }
        Map<String, Object> properties = null;
        for (String field : FIELDS) {
            Object value = root.properties().get(field);
            Object stripped = stripValue(value);
            if (stripped != value) {
                if (properties == null) {
                    properties = new LinkedHashMap<>(root.properties());
                }
                properties.put(field, stripped);
                log.debug("Stripped foreign annotations from document field '{}'", field);
            }
        }
        if (properties == null) {
            return root;
        }
        return new Node(root.kind(), properties, root.caption(), root.title(), root.name(), root.children());
    }

    /**
     * Removes every supported annotation wrapper from a string.
     *
     * @param text text possibly containing annotations
     * @return text without annotation wrappers; the same instance when there were none
     */
    public static String strip(String text) {
        if (text == null || text.indexOf('@') < 0) {
            return text;
        }
        String current = text;
        Matcher matcher = ANNOTATION.matcher(current);
        while (matcher.find()) {
            current = matcher.replaceAll(result -> Matcher.quoteReplacement(result.group(2)));
            matcher = ANNOTATION.matcher(current);
        }
        return current.equals(text) ? text : current;
    }

    private static Object stripValue(Object value) {
        if (value instanceof String text) {
            return strip(text);
        }
        if (value instanceof List<?> list) {
            List<Object> stripped = new ArrayList<>(list.size());
            boolean changed = false;
            for (Object item : list) {
                Object result = stripValue(item);
                changed |= result != item;
                stripped.add(result);
            }
            return changed ? stripped : value;
        }
        return value;
    }
}
