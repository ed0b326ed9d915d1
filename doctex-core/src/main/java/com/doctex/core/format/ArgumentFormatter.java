package com.doctex.core.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serializes key/value option lists into ConTeXt setup argument strings.
 *
 * <p>Pairs whose value is null or empty are dropped; the rest are written as
 * {@code key={value}} in input order.
 *
 * <pre>{@code
 * ArgumentFormatter.formatArgs(List.of(arg("a", "1"), arg("b", "")), true);   // "a={1}"
 * ArgumentFormatter.formatArgs(List.of(arg("a", "1"), arg("c", "2")), false);  // "a={1},\n   c={2}"
 * }</pre>
 */
public final class ArgumentFormatter {

    static final String MULTILINE_SEPARATOR = ",\n   ";
    static final String ONELINE_SEPARATOR = ",";

    private ArgumentFormatter() {
        // Utility class
    }

    /**
     * One key/value pair.
     *
     * @param key option key
     * @param value option value, may be null
     */
    public record Argument(String key, String value) {
        public Argument {
            Objects.requireNonNull(key, "key must not be null");
        }

        boolean isPresent() {
            return value != null && !value.isEmpty();
        }
    }

    public static Argument arg(String key, String value) {
        return new Argument(key, value);
    }

    /**
     * Formats an ordered list of pairs.
     *
     * @param pairs pairs in output order
     * @param oneline join with {@code ","} instead of {@code ",\n   "}
     * @return formatted arguments, empty when every value is empty
     */
    public static String formatArgs(List<Argument> pairs, boolean oneline) {
        List<String> rendered = new ArrayList<>(pairs.size());
        for (Argument pair : pairs) {
            if (pair.isPresent()) {
                rendered.add(pair.key() + "={" + pair.value() + "}");
            }
        }
        return String.join(oneline ? ONELINE_SEPARATOR : MULTILINE_SEPARATOR, rendered);
    }

    /**
     * Formats pairs and wraps them in brackets, ready to follow a command name.
     *
     * @param pairs pairs in output order
     * @param oneline join on one line
     * @return {@code [args]}, or the empty string when nothing survives
     */
    public static String bracketed(List<Argument> pairs, boolean oneline) {
        String args = formatArgs(pairs, oneline);
        return args.isEmpty() ? "" : "[" + args + "]";
    }
}
