package io.treeyaml.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraversalsTest {

    private final BinarySearchTree bst = new BinarySearchTree(NodeIdAllocator.sequential("tr"));

    private TreeNode sample() {
        //        50
        //      /    \
        //    30      70
        //   /  \    /  \
        //  20  40  60  80
        TreeNode root = null;
        for (int v : new int[]{50, 30, 70, 20, 40, 60, 80}) {
            root = bst.insert(root, v);
        }
        return root;
    }

    @Test
    void three_orders_follow_standard_definitions() {
        TreeNode root = sample();
        assertEquals(List.of(20, 30, 40, 50, 60, 70, 80), Traversals.traverse(root, TraversalOrder.IN_ORDER));
        assertEquals(List.of(50, 30, 20, 40, 70, 60, 80), Traversals.traverse(root, TraversalOrder.PRE_ORDER));
        assertEquals(List.of(20, 40, 30, 60, 80, 70, 50), Traversals.traverse(root, TraversalOrder.POST_ORDER));
    }

    @Test
    void empty_tree_yields_empty_sequences() {
        for (TraversalOrder o : TraversalOrder.values()) {
            assertEquals(List.of(), Traversals.traverse(null, o));
        }
        assertEquals(List.of(), Traversals.rangeQuery(null, 0, 100));
    }

    @Test
    void results_are_immutable() {
        var inOrder = Traversals.traverse(sample(), TraversalOrder.IN_ORDER);
        assertThrows(UnsupportedOperationException.class, () -> inOrder.add(1));
    }

    @Test
    void range_is_inclusive_and_ascending() {
        TreeNode root = sample();
        assertEquals(List.of(30, 40, 50, 60), Traversals.rangeQuery(root, 30, 60));
        assertEquals(List.of(40, 50), Traversals.rangeQuery(root, 35, 55));
        assertEquals(List.of(80), Traversals.rangeQuery(root, 80, 1000));
        assertEquals(List.of(), Traversals.rangeQuery(root, 81, 1000));
        assertEquals(List.of(50), Traversals.rangeQuery(root, 50, 50));
    }

    @Test
    void inverted_range_is_empty() {
        assertEquals(List.of(), Traversals.rangeQuery(sample(), 60, 30));
    }

    @Test
    void full_integer_range_equals_in_order() {
        TreeNode root = sample();
        assertEquals(Traversals.traverse(root, TraversalOrder.IN_ORDER),
                Traversals.rangeQuery(root, Integer.MIN_VALUE, Integer.MAX_VALUE));
    }

    @Test
    void range_on_broken_ordering_follows_structure() {
        TreeNode root = sample();
        // 20 relabelled to 90: it still sits left of 30, so pruning at 30 skips it
        TreeNode broken = bst.editValue(root, root.left().left().id(), 90);
        assertEquals(List.of(40, 50, 60, 70, 80), Traversals.rangeQuery(broken, 35, 95));
        assertEquals(List.of(90, 30, 40, 50, 60, 70, 80), Traversals.traverse(broken, TraversalOrder.IN_ORDER));
    }

    @Test
    void order_tokens_accept_common_spellings() {
        assertEquals(TraversalOrder.IN_ORDER, TraversalOrder.fromToken("inorder"));
        assertEquals(TraversalOrder.IN_ORDER, TraversalOrder.fromToken("In-Order"));
        assertEquals(TraversalOrder.PRE_ORDER, TraversalOrder.fromToken("PRE_ORDER"));
        assertEquals(TraversalOrder.POST_ORDER, TraversalOrder.fromToken(" postorder "));
        assertThrows(IllegalArgumentException.class, () -> TraversalOrder.fromToken("levelorder"));
    }
}
