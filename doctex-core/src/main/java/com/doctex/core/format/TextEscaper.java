package com.doctex.core.format;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pure string transforms protecting text from ConTeXt syntax.
 *
 * <h2>Text escapes</h2>
 * <table>
 *   <caption>Characters rewritten by {@link #escape(String)}</caption>
 *   <tr><th>Input</th><th>Output</th></tr>
 *   <tr><td>{@code \}</td><td>{@code \backslash{}}</td></tr>
 *   <tr><td>{@code { }}</td><td>{@code \{ \}}</td></tr>
 *   <tr><td>{@code # $ % & _}</td><td>{@code \# \$ \% \& \_}</td></tr>
 *   <tr><td>{@code ^}</td><td>{@code \letterhat{}}</td></tr>
 *   <tr><td>{@code ~}</td><td>{@code \lettertilde{}}</td></tr>
 *   <tr><td>{@code |}</td><td>{@code \letterbar{}}</td></tr>
 * </table>
 *
 * <h2>URL escapes</h2>
 * <p>{@link #escapeUrl(String)} only protects {@code \ # %}, which ConTeXt would otherwise
 * read as a macro, a parameter or a comment inside {@code url(...)}.
 *
 * <h2>Labels</h2>
 * <p>{@link #sanitizeLabel(String)} keeps {@code [A-Za-z0-9:._-]} and maps every other
 * character to {@code -}; brackets, commas and braces would break reference arguments.
 */
public final class TextEscaper {

    private static final Map<Character, String> TEXT_ESCAPES = Map.ofEntries(
        Map.entry('\\', "\\backslash{}"),
        Map.entry('{', "\\{"),
        Map.entry('}', "\\}"),
        Map.entry('#', "\\#"),
        Map.entry('$', "\\$"),
        Map.entry('%', "\\%"),
        Map.entry('&', "\\&"),
        Map.entry('_', "\\_"),
        Map.entry('^', "\\letterhat{}"),
        Map.entry('~', "\\lettertilde{}"),
        Map.entry('|', "\\letterbar{}")
    );

    private static final Map<Character, String> URL_ESCAPES = Map.of(
        '\\', "\\letterbackslash{}",
        '#', "\\#",
        '%', "\\%"
    );

    private static final String VERBATIM_DELIMITERS = "|+!/=;:@\"'";

    private static final Pattern LABEL_UNSAFE = Pattern.compile("[^A-Za-z0-9:._-]");

    private TextEscaper() {
        // Utility class
    }

    /**
     * Escapes ConTeXt special characters in running text.
     *
     * @param text raw text, may be null
     * @return escaped text, empty for null
     */
    public static String escape(String text) {
        return replaceChars(text, TEXT_ESCAPES);
    }

    /**
     * Escapes the characters that are unsafe inside {@code url(...)}.
     *
     * @param url raw URL
     * @return escaped URL
     */
    public static String escapeUrl(String url) {
        return replaceChars(url, URL_ESCAPES);
    }

    /**
     * Wraps text in {@code \type}. Braces are used as delimiters when the text is brace
     * balanced, otherwise the first delimiter character absent from the text.
     *
     * @param text verbatim text
     * @return {@code \type} invocation
     */
    public static String verbatim(String text) {
        String content = text == null ? "" : text.replace('\n', ' ');
        if (isBraceBalanced(content)) {
            return "\\type{" + content + "}";
        }
        for (char delimiter : VERBATIM_DELIMITERS.toCharArray()) {
            if (content.indexOf(delimiter) < 0) {
                return "\\type" + delimiter + content + delimiter;
            }
        }
        // every delimiter occurs: fall back to escaped text in a monospace switch
        return "{\\tt " + escape(content) + "}";
    }

    /**
     * Maps characters that are not allowed in a ConTeXt reference to {@code -}.
     *
     * @param label raw label
     * @return safe label
     */
    public static String sanitizeLabel(String label) {
        if (label == null) {
            return "";
        }
        return LABEL_UNSAFE.matcher(label.trim()).replaceAll("-");
    }

    static boolean isBraceBalanced(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static String replaceChars(String text, Map<Character, String> table) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement = table.get(c);
            if (replacement != null) {
                sb.append(replacement);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
