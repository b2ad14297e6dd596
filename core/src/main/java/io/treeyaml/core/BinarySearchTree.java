// file: src/main/java/io/treeyaml/core/BinarySearchTree.java
package io.treeyaml.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Structural operations over a binary search tree keyed by int value.
 * <p>
 * Every operation is a pure function from an input tree to a new tree:
 *  - the input is never mutated,
 *  - the output is a fresh deep copy (whole-tree copy-on-write, no node sharing),
 *  - ids survive the copy unchanged.
 * <p>
 * Ordering:
 *  - insert and delete maintain "left subtree strictly less, right subtree
 *    strictly greater" as long as the input satisfies it.
 *  - editValue relabels a node in place and may break the ordering on purpose.
 *    Use {@link #isValidBst(TreeNode)} to find out whether it currently holds.
 * <p>
 * Walks use explicit stacks so degenerate trees (sorted insertion) of any
 * depth are handled without growing the Java call stack.
 */
public final class BinarySearchTree {

    private final NodeIdAllocator ids;

    /** Tree operations allocating ids from {@link NodeIdAllocator#shared()}. */
    public BinarySearchTree() {
        this(NodeIdAllocator.shared());
    }

    public BinarySearchTree(NodeIdAllocator ids) {
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    /**
     * Deep copy preserving every value and id.
     * Null in, null out.
     */
    public static TreeNode cloneTree(TreeNode root) {
        if (root == null) return null;

        TreeNode copy = new TreeNode(root.value(), root.id());
        Deque<CopyStep> stack = new ArrayDeque<>();
        stack.push(new CopyStep(root, copy));

        while (!stack.isEmpty()) {
            CopyStep step = stack.pop();
            TreeNode src = step.source();
            if (src.left() != null) {
                TreeNode c = new TreeNode(src.left().value(), src.left().id());
                step.copy().setLeft(c);
                stack.push(new CopyStep(src.left(), c));
            }
            if (src.right() != null) {
                TreeNode c = new TreeNode(src.right().value(), src.right().id());
                step.copy().setRight(c);
                stack.push(new CopyStep(src.right(), c));
            }
        }
        return copy;
    }

    /**
     * Insert {@code value} by BST descent.
     * <p>
     * If the value is already on the descent path the copy is returned
     * unchanged and no id is allocated.
     */
    public TreeNode insert(TreeNode root, int value) {
        TreeNode copy = cloneTree(root);
        if (copy == null) {
            return new TreeNode(value, ids.newId());
        }

        TreeNode cur = copy;
        while (true) {
            if (value < cur.value()) {
                if (cur.left() == null) {
                    cur.setLeft(new TreeNode(value, ids.newId()));
                    return copy;
                }
                cur = cur.left();
            } else if (value > cur.value()) {
                if (cur.right() == null) {
                    cur.setRight(new TreeNode(value, ids.newId()));
                    return copy;
                }
                cur = cur.right();
            } else {
                return copy;
            }
        }
    }

    /**
     * Remove the node holding {@code value}, found by BST descent.
     * <p>
     * Cases:
     *  - leaf: dropped.
     *  - one child: the child (keeping its own id) takes the removed position.
     *  - two children: the position keeps its id and adopts the in-order
     *    successor's value; the successor value is then removed from the right
     *    subtree by the same rules.
     * <p>
     * Missing value: the copy is returned unchanged.
     */
    public TreeNode delete(TreeNode root, int value) {
        TreeNode copy = cloneTree(root);

        TreeNode parent = null;
        TreeNode cur = copy;
        int target = value;
        while (true) {
            while (cur != null && cur.value() != target) {
                parent = cur;
                cur = target < cur.value() ? cur.left() : cur.right();
            }
            if (cur == null) {
                return copy;
            }

            if (cur.left() != null && cur.right() != null) {
                TreeNode successor = cur.right();
                while (successor.left() != null) {
                    successor = successor.left();
                }
                cur.setValue(successor.value());
                // Continue as a delete of the successor value inside the right subtree.
                target = successor.value();
                parent = cur;
                cur = cur.right();
                continue;
            }

            TreeNode child = cur.left() != null ? cur.left() : cur.right();
            if (parent == null) {
                return child;
            }
            if (parent.left() == cur) {
                parent.setLeft(child);
            } else {
                parent.setRight(child);
            }
            return copy;
        }
    }

    /**
     * Relabel the node with the given id.
     * <p>
     * The search is by identity, not by value, and the new value is written
     * without re-validating or restructuring the tree. Unknown id: the copy is
     * returned unchanged.
     */
    public TreeNode editValue(TreeNode root, NodeId id, int newValue) {
        Objects.requireNonNull(id, "id");
        TreeNode copy = cloneTree(root);
        TreeNode target = findById(copy, id);
        if (target != null) {
            target.setValue(newValue);
        }
        return copy;
    }

    // ---------- read-only queries ----------

    /** Node with the given id, or null. Identity search over the whole tree. */
    public static TreeNode findById(TreeNode root, NodeId id) {
        if (root == null || id == null) return null;
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            if (n.id().equals(id)) return n;
            if (n.right() != null) stack.push(n.right());
            if (n.left() != null) stack.push(n.left());
        }
        return null;
    }

    /** Whether BST descent finds {@code value}. */
    public static boolean contains(TreeNode root, int value) {
        TreeNode cur = root;
        while (cur != null) {
            if (value == cur.value()) return true;
            cur = value < cur.value() ? cur.left() : cur.right();
        }
        return false;
    }

    public static int size(TreeNode root) {
        if (root == null) return 0;
        int count = 0;
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            count++;
            if (n.left() != null) stack.push(n.left());
            if (n.right() != null) stack.push(n.right());
        }
        return count;
    }

    /** Number of nodes on the longest root-to-leaf path; 0 for the empty tree. */
    public static int height(TreeNode root) {
        if (root == null) return 0;
        int max = 0;
        Deque<Depth> stack = new ArrayDeque<>();
        stack.push(new Depth(root, 1));
        while (!stack.isEmpty()) {
            Depth d = stack.pop();
            max = Math.max(max, d.depth());
            if (d.node().left() != null) stack.push(new Depth(d.node().left(), d.depth() + 1));
            if (d.node().right() != null) stack.push(new Depth(d.node().right(), d.depth() + 1));
        }
        return max;
    }

    /**
     * Whether the strict ordering invariant holds at every node.
     * False after an editValue that moved a value out of its structural range.
     */
    public static boolean isValidBst(TreeNode root) {
        if (root == null) return true;
        Deque<Bounds> stack = new ArrayDeque<>();
        // long bounds so Integer.MIN_VALUE / MAX_VALUE stay representable as exclusive limits
        stack.push(new Bounds(root, Long.MIN_VALUE, Long.MAX_VALUE));
        while (!stack.isEmpty()) {
            Bounds b = stack.pop();
            long v = b.node().value();
            if (v <= b.lowExclusive() || v >= b.highExclusive()) return false;
            if (b.node().left() != null) stack.push(new Bounds(b.node().left(), b.lowExclusive(), v));
            if (b.node().right() != null) stack.push(new Bounds(b.node().right(), v, b.highExclusive()));
        }
        return true;
    }

    /**
     * Whether both trees hold the same values at the same structural positions.
     * Ids are ignored.
     */
    public static boolean sameShape(TreeNode a, TreeNode b) {
        Deque<TreeNode[]> stack = new ArrayDeque<>();
        stack.push(new TreeNode[]{a, b});
        while (!stack.isEmpty()) {
            TreeNode[] pair = stack.pop();
            TreeNode x = pair[0];
            TreeNode y = pair[1];
            if (x == null || y == null) {
                if (x != y) return false;
                continue;
            }
            if (x.value() != y.value()) return false;
            stack.push(new TreeNode[]{x.left(), y.left()});
            stack.push(new TreeNode[]{x.right(), y.right()});
        }
        return true;
    }

    // ---------- helpers ----------

    private record CopyStep(TreeNode source, TreeNode copy) {}

    private record Depth(TreeNode node, int depth) {}

    private record Bounds(TreeNode node, long lowExclusive, long highExclusive) {}
}
