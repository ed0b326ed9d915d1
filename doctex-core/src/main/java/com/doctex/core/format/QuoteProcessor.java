package com.doctex.core.format;

import com.doctex.core.config.QuoteStyle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Converts straight quotes into nested smart-quote markers.
 *
 * <p>A quote character opens when it starts the text or follows whitespace, an opening
 * bracket or another opening quote; otherwise it closes, and must close the innermost
 * open quote of the same kind; a quote directly after an opener of its own kind closes
 * it. A single quote between two letters is an apostrophe.
 * Any imbalance, including quotes left open at the end, raises
 * {@link QuoteMismatchException}.
 *
 * <pre>{@code
 * "outer 'inner' outer"  ->  \quotation{outer \quote{inner} outer}
 * "a' b"                 ->  QuoteMismatchException
 * }</pre>
 */
public final class QuoteProcessor {

    private static final String OPENING_PRECEDERS = "([{<-/—–";

    private enum Quote { DOUBLE, SINGLE }

    private QuoteProcessor() {
        // Utility class
    }

    /**
     * A run of text taking part in quote balancing.
     *
     * @param context characters between the previous segment and this one that are not
     *                rendered here (inter-object spacing, placeholders for opaque objects);
     *                they only decide whether a quote opens or closes
     * @param text the text to convert
     */
    public record Segment(String context, String text) {

        /**
         * Compact constructor with validation.
         */
        public Segment {
            context = context == null ? "" : context;
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * Replaces quotes in {@code text} with the markers of {@code style}. Text between
     * markers is passed through {@code escaper}.
     *
     * @param text raw text
     * @param style quote markers
     * @param escaper escaping applied to non-quote text
     * @return text with smart quotes
     * @throws QuoteMismatchException if quotes are not balanced
     */
    public static String process(String text, QuoteStyle style, UnaryOperator<String> escaper)
            throws QuoteMismatchException {
        return process(List.of(new Segment("", text)), style, escaper).get(0);
    }

    /**
     * Converts quotes across several segments that share one nesting stack, such as the
     * text objects of a paragraph split by inline markup. A quote may open in one segment
     * and close in another.
     *
     * @param segments segments in reading order
     * @param style quote markers
     * @param escaper escaping applied to non-quote text
     * @return converted text of each segment, in the same order
     * @throws QuoteMismatchException if quotes are not balanced over all segments
     */
    public static List<String> process(List<Segment> segments, QuoteStyle style, UnaryOperator<String> escaper)
            throws QuoteMismatchException {
        StringBuilder joined = new StringBuilder();
        int[] starts = new int[segments.size()];
        int[] ends = new int[segments.size()];
        for (int s = 0; s < segments.size(); s++) {
            joined.append(segments.get(s).context());
            starts[s] = joined.length();
            joined.append(segments.get(s).text());
            ends[s] = joined.length();
        }
        String text = joined.toString();

        List<String> outputs = new ArrayList<>(segments.size());
        Deque<Quote> stack = new ArrayDeque<>();
        boolean previousOpened = false;

        for (int s = 0; s < segments.size(); s++) {
            StringBuilder out = new StringBuilder(ends[s] - starts[s] + 16);
            StringBuilder pending = new StringBuilder();
            if (!segments.get(s).context().isEmpty()) {
                previousOpened = false;
            }

            for (int i = starts[s]; i < ends[s]; i++) {
                char c = text.charAt(i);
                if (c != '"' && c != '\'') {
                    pending.append(c);
                    previousOpened = false;
                    continue;
                }

                if (c == '\'' && isApostrophe(text, i)) {
                    flush(out, pending, escaper);
                    out.append(style.apostrophe());
                    previousOpened = false;
                    continue;
                }

                Quote kind = c == '"' ? Quote.DOUBLE : Quote.SINGLE;
                // a quote right after an opener of its own kind closes it: "" is empty, not nested
                boolean closesEmpty = previousOpened && kind == stack.peek();
                boolean opening = !closesEmpty && (previousOpened || isOpeningPosition(text, i));
                flush(out, pending, escaper);
                if (!opening && kind == stack.peek()) {
                    stack.pop();
                    out.append(kind == Quote.DOUBLE ? style.primaryClose() : style.secondaryClose());
                    previousOpened = false;
                } else if (opening) {
                    stack.push(kind);
                    out.append(kind == Quote.DOUBLE ? style.primaryOpen() : style.secondaryOpen());
                    previousOpened = true;
                } else {
                    throw new QuoteMismatchException(
                        "Closing " + kind.name().toLowerCase(Locale.ROOT) + " quote without opening", i);
                }
            }
            flush(out, pending, escaper);
            outputs.add(out.toString());
        }

        if (!stack.isEmpty()) {
            throw new QuoteMismatchException(stack.size() + " quote(s) left open", text.length());
        }
        return outputs;
    }

    private static boolean isOpeningPosition(String text, int index) {
        if (index == 0) {
            return true;
        }
        char previous = text.charAt(index - 1);
        return Character.isWhitespace(previous) || OPENING_PRECEDERS.indexOf(previous) >= 0;
    }

    private static boolean isApostrophe(String text, int index) {
        if (index == 0 || index == text.length() - 1) {
            return false;
        }
        return Character.isLetterOrDigit(text.charAt(index - 1))
            && Character.isLetter(text.charAt(index + 1));
    }

    private static void flush(StringBuilder out, StringBuilder pending, UnaryOperator<String> escaper) {
        if (pending.length() > 0) {
            out.append(escaper.apply(pending.toString()));
            pending.setLength(0);
        }
    }
}
