package com.doctex.core.rewrite;

import com.doctex.core.model.Node;

/**
 * A pure tree-to-tree transform run before rendering.
 *
 * <p>Implementations must not mutate their input (nodes are immutable anyway), must
 * return the very same instance for subtrees they leave unchanged, and must be
 * idempotent: applying a pass to its own output returns an equal tree.
 *
 * <p>Passes are run by {@link RewritePipeline} in a fixed order.
 */
public interface TreeRewritePass {

    /**
     * Returns unique identifier for this pass, used in logs.
     *
     * @return pass identifier
     */
    String getId();

    /**
     * Rewrites a tree.
     *
     * @param root root of the tree to rewrite
     * @return rewritten tree, {@code root} itself when nothing changed
     */
    Node apply(Node root);
}
