package io.treeyaml.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of the structural operations: ordering, copy-on-write snapshots
 * and id preservation.
 */
class BinarySearchTreeTest {

    private final BinarySearchTree bst = new BinarySearchTree(NodeIdAllocator.sequential("t"));

    private TreeNode build(int... values) {
        TreeNode root = null;
        for (int v : values) {
            root = bst.insert(root, v);
        }
        return root;
    }

    @Test
    void distinct_inserts_come_back_sorted_in_order() {
        var rnd = new Random(42);
        var expected = new TreeSet<Integer>();
        TreeNode root = null;
        for (int i = 0; i < 500; i++) {
            int v = rnd.nextInt(10_000) - 5_000;
            expected.add(v);
            root = bst.insert(root, v);
        }
        assertEquals(new ArrayList<>(expected), Traversals.traverse(root, TraversalOrder.IN_ORDER));
        assertTrue(BinarySearchTree.isValidBst(root));
        assertEquals(expected.size(), BinarySearchTree.size(root));
    }

    @Test
    void insert_places_values_by_comparison() {
        TreeNode root = build(10, 5, 15, 12);
        assertEquals(10, root.value());
        assertEquals(5, root.left().value());
        assertEquals(15, root.right().value());
        assertEquals(12, root.right().left().value());
    }

    @Test
    void duplicate_insert_keeps_shape_and_allocates_no_id() {
        var ids = new CountingAllocator();
        var tree = new BinarySearchTree(ids);
        TreeNode root = tree.insert(tree.insert(null, 10), 5);
        int issued = ids.issued;

        TreeNode again = tree.insert(root, 5);

        assertEquals(issued, ids.issued, "no id for a value already present");
        assertTrue(BinarySearchTree.sameShape(root, again));
        assertEquals(root.left().id(), again.left().id());
    }

    @Test
    void operations_never_mutate_their_input() {
        TreeNode before = build(50, 30, 70, 20, 40, 60, 80);
        List<Integer> snapshot = Traversals.traverse(before, TraversalOrder.PRE_ORDER);

        bst.insert(before, 65);
        bst.delete(before, 30);
        bst.delete(before, 50);
        bst.editValue(before, before.left().id(), 999);

        assertEquals(snapshot, Traversals.traverse(before, TraversalOrder.PRE_ORDER));
        assertEquals(30, before.left().value());
    }

    @Test
    void clone_is_deep_and_preserves_values_and_ids() {
        TreeNode root = build(8, 4, 12, 2, 6);
        TreeNode copy = BinarySearchTree.cloneTree(root);

        assertNotSame(root, copy);
        assertNotSame(root.left(), copy.left());
        assertTrue(BinarySearchTree.sameShape(root, copy));
        assertEquals(root.id(), copy.id());
        assertEquals(root.left().right().id(), copy.left().right().id());
        assertNull(BinarySearchTree.cloneTree(null));
    }

    @Test
    void delete_leaf_drops_it() {
        TreeNode root = build(10, 5, 15);
        TreeNode after = bst.delete(root, 5);
        assertNull(after.left());
        assertEquals(List.of(10, 15), Traversals.traverse(after, TraversalOrder.IN_ORDER));
    }

    @Test
    void delete_with_one_child_splices_child_and_keeps_its_id() {
        TreeNode root = build(10, 5, 3);
        var childId = root.left().left().id();

        TreeNode after = bst.delete(root, 5);

        assertEquals(3, after.left().value());
        assertEquals(childId, after.left().id());
    }

    @Test
    void delete_with_two_children_keeps_position_id_and_adopts_successor_value() {
        TreeNode root = build(50, 30, 70, 60, 80, 65);
        var positionId = root.right().id();   // node 70
        var sixtyId = root.right().left().id();
        var eightyId = root.right().right().id();

        TreeNode after = bst.delete(root, 70);

        assertEquals(positionId, after.right().id(), "position keeps its id");
        assertEquals(80, after.right().value(), "in-order successor of 70 is 80");
        assertNull(after.right().right(), "successor removed from the right subtree");
        assertEquals(sixtyId, after.right().left().id());
        assertNull(BinarySearchTree.findById(after, eightyId), "successor's own id is gone");
        assertEquals(List.of(30, 50, 60, 65, 80), Traversals.traverse(after, TraversalOrder.IN_ORDER));
    }

    @Test
    void delete_root_with_two_children_uses_leftmost_of_right_subtree() {
        TreeNode root = build(50, 30, 70, 60, 55, 80);
        var rootId = root.id();

        TreeNode after = bst.delete(root, 50);

        assertEquals(55, after.value());
        assertEquals(rootId, after.id());
        assertEquals(List.of(30, 55, 60, 70, 80), Traversals.traverse(after, TraversalOrder.IN_ORDER));
        assertTrue(BinarySearchTree.isValidBst(after));
    }

    @Test
    void delete_single_root_yields_empty_tree() {
        assertNull(bst.delete(build(7), 7));
        assertNull(bst.delete(null, 7));
    }

    @Test
    void delete_missing_value_is_a_no_op() {
        TreeNode root = build(10, 5, 15);
        TreeNode after = bst.delete(root, 42);
        assertTrue(BinarySearchTree.sameShape(root, after));
    }

    @Test
    void insert_then_delete_restores_in_order_sequence() {
        TreeNode root = build(40, 20, 60, 10, 30, 50, 70);
        List<Integer> before = Traversals.traverse(root, TraversalOrder.IN_ORDER);
        for (int v : new int[]{35, 5, 75, 45}) {
            TreeNode after = bst.delete(bst.insert(root, v), v);
            assertEquals(before, Traversals.traverse(after, TraversalOrder.IN_ORDER), "value " + v);
        }
    }

    @Test
    void edit_value_changes_only_that_node_even_when_ordering_breaks() {
        TreeNode root = build(10, 5, 15);
        var leftId = root.left().id();

        TreeNode after = bst.editValue(root, leftId, 99);

        assertEquals(99, after.left().value());
        assertEquals(leftId, after.left().id());
        assertEquals(root.id(), after.id());
        assertEquals(root.right().id(), after.right().id());
        assertEquals(10, after.value());
        assertEquals(15, after.right().value());
        assertFalse(BinarySearchTree.isValidBst(after));
        // traversal follows structure, not sorted order
        assertEquals(List.of(99, 10, 15), Traversals.traverse(after, TraversalOrder.IN_ORDER));
    }

    @Test
    void edit_value_with_unknown_id_is_a_no_op() {
        TreeNode root = build(10, 5);
        TreeNode after = bst.editValue(root, new NodeId("missing"), 1);
        assertTrue(BinarySearchTree.sameShape(root, after));
    }

    @Test
    void contains_size_and_height() {
        TreeNode root = build(10, 5, 15, 1);
        assertTrue(BinarySearchTree.contains(root, 1));
        assertFalse(BinarySearchTree.contains(root, 2));
        assertEquals(4, BinarySearchTree.size(root));
        assertEquals(3, BinarySearchTree.height(root));
        assertEquals(0, BinarySearchTree.height(null));
        assertEquals(0, BinarySearchTree.size(null));
    }

    @Test
    void degenerate_sorted_insertion_does_not_overflow() {
        TreeNode root = null;
        for (int i = 0; i < 5_000; i++) {
            root = bst.insert(root, i);
        }
        assertEquals(5_000, BinarySearchTree.height(root));
        assertEquals(5_000, Traversals.traverse(root, TraversalOrder.POST_ORDER).size());
        assertEquals(4_999, BinarySearchTree.size(bst.delete(root, 0)));
    }

    @Test
    void extreme_values_are_valid_keys() {
        TreeNode root = build(0, Integer.MIN_VALUE, Integer.MAX_VALUE);
        assertTrue(BinarySearchTree.isValidBst(root));
        assertEquals(List.of(Integer.MIN_VALUE, 0, Integer.MAX_VALUE),
                Traversals.traverse(root, TraversalOrder.IN_ORDER));
    }

    private static final class CountingAllocator implements NodeIdAllocator {
        int issued;

        @Override public NodeId newId() {
            return new NodeId("c-" + (++issued));
        }
    }
}
