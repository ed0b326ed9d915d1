package com.doctex.core.reference;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes LaTeX math environments and inline math delimiters.
 *
 * <p>The environment set is fixed and compared case-insensitively. A trailing {@code *}
 * marks the unnumbered variant: {@code align*} is math, but gets no equation number.
 */
public final class MathEnvironments {

    private static final Set<String> ENVIRONMENTS = Set.of(
        "equation", "align", "gather", "multline", "flalign", "alignat",
        "eqnarray", "displaymath", "math", "subequations", "dmath", "dgroup");

    private static final Set<String> UNNUMBERED = Set.of("displaymath", "math");

    private static final Set<String> ALIGNED = Set.of("align", "flalign", "alignat", "eqnarray");

    private static final Pattern BEGIN = Pattern.compile("\\\\begin\\{([A-Za-z]+\\*?)\\}");

    private MathEnvironments() {
        // Utility class
    }

    /**
     * Extracts the name of the first {@code \begin{...}} in a LaTeX environment value.
     *
     * @param value raw environment text
     * @return environment name including any star
     */
    public static Optional<String> environmentName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = BEGIN.matcher(value);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Returns whether the name (with or without star) is a known math environment.
     *
     * @param name environment name
     * @return true for math environments
     */
    public static boolean isMathEnvironment(String name) {
        return name != null && ENVIRONMENTS.contains(baseName(name));
    }

    /**
     * Returns whether a math environment is auto-numbered.
     *
     * @param name environment name
     * @return false for starred and inherently unnumbered environments
     */
    public static boolean isNumbered(String name) {
        return isMathEnvironment(name) && !name.trim().endsWith("*") && !UNNUMBERED.contains(baseName(name));
    }

    /**
     * Returns whether the environment lays out several aligned rows.
     *
     * @param name environment name
     * @return true for align-like environments
     */
    public static boolean isAligned(String name) {
        return name != null && ALIGNED.contains(baseName(name));
    }

    /**
     * Removes the body of an environment from its {@code \begin}/{@code \end} wrapper.
     *
     * @param value raw environment text
     * @param name environment name
     * @return inner body, trimmed
     */
    public static String body(String value, String name) {
        String begin = "\\begin{" + name + "}";
        String end = "\\end{" + name + "}";
        int start = value.indexOf(begin);
        int stop = value.lastIndexOf(end);
        if (start < 0 || stop < start) {
            return value.trim();
        }
        String inner = value.substring(start + begin.length(), stop);
        // alignat carries a column count argument
        if (inner.startsWith("{")) {
            int close = inner.indexOf('}');
            if (close > 0 && inner.substring(1, close).chars().allMatch(Character::isDigit)) {
                inner = inner.substring(close + 1);
            }
        }
        return inner.trim();
    }

    /**
     * Strips inline math delimiters: {@code $x$}, {@code $$x$$}, {@code \(x\)} and
     * {@code \[x\]}.
     *
     * @param value fragment text
     * @return math content, or the value itself when it is not delimited math
     */
    public static String stripInlineDelimiters(String value) {
        String v = value == null ? "" : value.trim();
        if (v.startsWith("$$") && v.endsWith("$$") && v.length() >= 4) {
            return v.substring(2, v.length() - 2);
        }
        if (v.startsWith("$") && v.endsWith("$") && v.length() >= 2) {
            return v.substring(1, v.length() - 1);
        }
        if ((v.startsWith("\\(") && v.endsWith("\\)")) || (v.startsWith("\\[") && v.endsWith("\\]"))) {
            return v.length() >= 4 ? v.substring(2, v.length() - 2) : "";
        }
        return v;
    }

    /**
     * Returns whether a fragment is delimited math rather than a bare LaTeX command.
     *
     * @param value fragment text
     * @return true for {@code $...$}, {@code \(...\)} and {@code \[...\]}
     */
    public static boolean isDelimitedMath(String value) {
        String v = value == null ? "" : value.trim();
        return (v.startsWith("$") && v.endsWith("$") && v.length() >= 2)
            || (v.startsWith("\\(") && v.endsWith("\\)"))
            || (v.startsWith("\\[") && v.endsWith("\\]"));
    }

    /**
     * Returns whether a fragment is display math ({@code $$...$$} or {@code \[...\]}).
     *
     * @param value fragment text
     * @return true for display math
     */
    public static boolean isDisplayMath(String value) {
        String v = value == null ? "" : value.trim();
        return (v.startsWith("$$") && v.endsWith("$$") && v.length() >= 4)
            || (v.startsWith("\\[") && v.endsWith("\\]"));
    }

    private static String baseName(String name) {
        String trimmed = name.trim().toLowerCase(Locale.ROOT);
        return trimmed.endsWith("*") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
