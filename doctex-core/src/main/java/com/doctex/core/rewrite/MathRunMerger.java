package com.doctex.core.rewrite;

import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Wraps adjacent inline math objects into a single {@link NodeKind#MATH_RUN}.
 *
 * <p>Math-like objects are LaTeX fragments, subscripts and superscripts. A run is a
 * maximal sequence of at least two math-like siblings where every member but the last
 * has no trailing blank. The synthetic container keeps the members in order and takes
 * the trailing blank of its last member, so {@code $a$$b$ $c$} becomes
 * {@code MATH_RUN($a$, $b$)} followed by {@code $c$}.
 *
 * <p>Existing math runs are left alone and not descended into, which makes the pass
 * idempotent. Heading titles, item tags and captions are merged as well as children.
 */
public class MathRunMerger implements TreeRewritePass {

    private static final Logger log = LoggerFactory.getLogger(MathRunMerger.class);

    private static final Set<NodeKind> MATH_LIKE =
        EnumSet.of(NodeKind.LATEX_FRAGMENT, NodeKind.SUBSCRIPT, NodeKind.SUPERSCRIPT);

    @Override
    public String getId() {
        return "math-run-merger";
    }

    @Override
    public Node apply(Node root) {
        return rewrite(root);
    }

    static boolean isMathLike(Node node) {
        return MATH_LIKE.contains(node.kind());
    }

    private Node rewrite(Node node) {
        if (node.is(NodeKind.MATH_RUN)) {
            return node;
        }
        List<Node> children = mergeRuns(rewriteAll(node.children()));
        List<Node> title = mergeRuns(rewriteAll(node.title()));
        List<Node> caption = mergeRuns(rewriteAll(node.caption()));

        if (sameInstances(children, node.children())
                && sameInstances(title, node.title())
                && sameInstances(caption, node.caption())) {
            return node;
        }
        return new Node(node.kind(), node.properties(), caption, title, node.name(), children);
    }

    private List<Node> rewriteAll(List<Node> nodes) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node child : nodes) {
            result.add(rewrite(child));
        }
        return result;
    }

    private List<Node> mergeRuns(List<Node> siblings) {
        List<Node> result = new ArrayList<>(siblings.size());
        int i = 0;
        while (i < siblings.size()) {
            Node current = siblings.get(i);
            if (!isMathLike(current)) {
                result.add(current);
                i++;
                continue;
            }
            int end = i + 1;
            while (end < siblings.size()
                    && siblings.get(end - 1).postBlank() == 0
                    && isMathLike(siblings.get(end))) {
                end++;
            }
            if (end - i >= 2) {
                List<Node> members = siblings.subList(i, end);
                Node last = members.get(members.size() - 1);
                result.add(Node.builder(NodeKind.MATH_RUN)
                    .postBlank(last.postBlank())
                    .children(new ArrayList<>(members))
                    .build());
                log.debug("Merged {} math objects into one run", members.size());
            } else {
                result.add(current);
            }
            i = end;
        }
        return result;
    }

    private static boolean sameInstances(List<Node> a, List<Node> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }
}
