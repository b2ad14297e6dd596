// file: src/main/java/io/treeyaml/core/TreeNode.java
package io.treeyaml.core;

import java.util.Objects;

/**
 * A node of the binary search tree.
 * <p>
 * Fields:
 *  - value: signed integer key.
 *  - id:    stable identity, see {@link NodeId}.
 *  - left / right: exclusively owned children, null when absent.
 * <p>
 * Snapshot semantics:
 *  - There are no public mutators. A tree handed out by {@link BinarySearchTree}
 *    can be held as an independent snapshot for as long as the caller wants.
 *  - The only mutations happen inside this package, on copies that
 *    {@link BinarySearchTree} has just cloned and not yet returned.
 * <p>
 * The tree as a whole is a nullable root reference; null is the empty tree.
 */
public final class TreeNode {
    private int value;
    private final NodeId id;
    private TreeNode left;
    private TreeNode right;

    /**
     * Build a node with the given children. The children become owned by the
     * new node and must not be attached anywhere else.
     */
    public TreeNode(int value, NodeId id, TreeNode left, TreeNode right) {
        this.value = value;
        this.id = Objects.requireNonNull(id, "id");
        this.left = left;
        this.right = right;
    }

    public TreeNode(int value, NodeId id) {
        this(value, id, null, null);
    }

    public int value() { return value; }

    public NodeId id() { return id; }

    public TreeNode left() { return left; }

    public TreeNode right() { return right; }

    // ---------- package-private mutators (fresh copies only) ----------

    void setValue(int value) { this.value = value; }

    void setLeft(TreeNode left) { this.left = left; }

    void setRight(TreeNode right) { this.right = right; }

    @Override public String toString() {
        return "TreeNode{value=" + value + ", id=" + id + "}";
    }
}
