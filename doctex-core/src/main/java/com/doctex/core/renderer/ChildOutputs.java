package com.doctex.core.renderer;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rendered outputs of a node's children, aligned with {@link com.doctex.core.model.Node#children()}.
 *
 * <p>A child without output is an empty {@link Optional}; it contributes nothing to
 * {@link #joined()}, not even whitespace.
 *
 * @param outputs one entry per child, in source order
 */
public record ChildOutputs(List<Optional<String>> outputs) {

    private static final ChildOutputs NONE = new ChildOutputs(List.of());

    /**
     * Compact constructor with validation.
     */
    public ChildOutputs {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public static ChildOutputs none() {
        return NONE;
    }

    /**
     * Returns the output of one child.
     *
     * @param index child index
     * @return output, empty when the child rendered nothing
     */
    public Optional<String> get(int index) {
        return outputs.get(index);
    }

    public int size() {
        return outputs.size();
    }

    /**
     * Concatenates the present outputs in source order.
     *
     * @return combined text, empty when no child produced output
     */
    public String joined() {
        return outputs.stream()
            .flatMap(Optional::stream)
            .collect(Collectors.joining());
    }

    public boolean isBlank() {
        return joined().isBlank();
    }
}
