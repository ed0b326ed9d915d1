package com.doctex.core.rewrite;

import com.doctex.core.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the rewrite passes once, in a fixed order, before any rendering starts.
 */
public class RewritePipeline {

    private static final Logger log = LoggerFactory.getLogger(RewritePipeline.class);

    private final List<TreeRewritePass> passes;

    public RewritePipeline(List<TreeRewritePass> passes) {
        this.passes = List.copyOf(Objects.requireNonNull(passes, "passes must not be null"));
    }

    /**
     * Creates the standard pipeline: math-run merging, then foreign-annotation escaping.
     *
     * @return default pipeline
     */
    public static RewritePipeline defaults() {
        return new RewritePipeline(List.of(new MathRunMerger(), new ForeignAnnotationEscaper()));
    }

    public List<TreeRewritePass> passes() {
        return passes;
    }

    /**
     * Applies every pass in order.
     *
     * @param root input tree
     * @return rewritten tree
     */
    public Node apply(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        Node current = root;
        for (TreeRewritePass pass : passes) {
            Node next = pass.apply(current);
            log.debug("Rewrite pass {} {}", pass.getId(), next == current ? "left the tree unchanged" : "rewrote the tree");
            current = next;
        }
        return current;
    }
}
