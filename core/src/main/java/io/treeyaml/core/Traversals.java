// file: src/main/java/io/treeyaml/core/Traversals.java
package io.treeyaml.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Pure readers over a tree snapshot.
 * <p>
 * Results are fresh immutable lists; recomputing is cheap and there is no
 * caching. Sequences follow structural position: after an editValue that
 * broke the ordering, an in-order walk is no longer guaranteed to be sorted.
 */
public final class Traversals {

    private Traversals() {}

    /** Values in the requested order. Empty list for the empty tree. */
    public static List<Integer> traverse(TreeNode root, TraversalOrder order) {
        Objects.requireNonNull(order, "order");
        if (root == null) return List.of();
        return switch (order) {
            case IN_ORDER -> inOrder(root);
            case PRE_ORDER -> preOrder(root);
            case POST_ORDER -> postOrder(root);
        };
    }

    /**
     * Ascending values {@code v} with {@code min <= v <= max}.
     * <p>
     * Walks in order and skips a left subtree when the node is already
     * {@code <= min}, a right subtree when the node is already {@code >= max}.
     * The pruning is only exact while the BST invariant holds; on a tree broken
     * by editValue the result reflects structural position.
     * <p>
     * {@code min > max} yields an empty list.
     */
    public static List<Integer> rangeQuery(TreeNode root, int min, int max) {
        if (root == null || min > max) return List.of();

        List<Integer> out = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        TreeNode cur = root;
        while (cur != null || !stack.isEmpty()) {
            while (cur != null) {
                stack.push(cur);
                cur = cur.value() > min ? cur.left() : null;
            }
            TreeNode n = stack.pop();
            if (n.value() >= min && n.value() <= max) {
                out.add(n.value());
            }
            cur = n.value() < max ? n.right() : null;
        }
        return Collections.unmodifiableList(out);
    }

    // ---------- walks ----------

    private static List<Integer> inOrder(TreeNode root) {
        List<Integer> out = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        TreeNode cur = root;
        while (cur != null || !stack.isEmpty()) {
            while (cur != null) {
                stack.push(cur);
                cur = cur.left();
            }
            TreeNode n = stack.pop();
            out.add(n.value());
            cur = n.right();
        }
        return Collections.unmodifiableList(out);
    }

    private static List<Integer> preOrder(TreeNode root) {
        List<Integer> out = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            out.add(n.value());
            if (n.right() != null) stack.push(n.right());
            if (n.left() != null) stack.push(n.left());
        }
        return Collections.unmodifiableList(out);
    }

    private static List<Integer> postOrder(TreeNode root) {
        // self, right, left collected then reversed == left, right, self
        List<Integer> out = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            out.add(n.value());
            if (n.left() != null) stack.push(n.left());
            if (n.right() != null) stack.push(n.right());
        }
        Collections.reverse(out);
        return Collections.unmodifiableList(out);
    }
}
