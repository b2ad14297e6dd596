package io.treeyaml.notation;

import io.treeyaml.core.BinarySearchTree;
import io.treeyaml.core.NodeIdAllocator;
import io.treeyaml.core.TraversalOrder;
import io.treeyaml.core.Traversals;
import io.treeyaml.core.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Serialization layout and the parse(serialize(tree)) round trip.
 */
class NotationCodecTest {

    private final BinarySearchTree bst = new BinarySearchTree(NodeIdAllocator.sequential("codec"));

    private TreeNode build(int... values) {
        TreeNode root = null;
        for (int v : values) {
            root = bst.insert(root, v);
        }
        return root;
    }

    static TreeNode parsed(ParseResult r) {
        assertTrue(r.isSuccess(), () -> "expected success, got " + r);
        return ((ParseResult.Success) r).root();
    }

    @Test
    void empty_tree_serializes_to_empty_text() {
        assertEquals("", NotationCodec.treeToNotation(null));
    }

    @Test
    void layout_nests_children_under_introducers() {
        String text = NotationCodec.treeToNotation(build(10, 5, 15, 12, 3));
        assertEquals("""
                value: 10
                left:
                  value: 5
                  left:
                    value: 3
                right:
                  value: 15
                  left:
                    value: 12
                """, text);
    }

    @Test
    void only_right_child_emits_only_right_introducer() {
        assertEquals("value: 1\nright:\n  value: 2\n", NotationCodec.treeToNotation(build(1, 2)));
    }

    @Test
    void negative_values_are_written_as_decimal() {
        assertEquals("value: -7\n", NotationCodec.treeToNotation(build(-7)));
    }

    @Test
    void reference_example_parses_to_three_nodes() {
        TreeNode root = parsed(NotationCodec.notationToTree("value: 10\nleft:\n  value: 5\nright:\n  value: 15"));

        assertEquals(10, root.value());
        assertEquals(5, root.left().value());
        assertEquals(15, root.right().value());
        assertEquals(List.of(5, 10, 15), Traversals.traverse(root, TraversalOrder.IN_ORDER));
    }

    @Test
    void round_trip_preserves_shape_with_fresh_ids() {
        var rnd = new Random(7);
        for (int round = 0; round < 20; round++) {
            TreeNode root = null;
            for (int i = 0; i < 60; i++) {
                root = bst.insert(root, rnd.nextInt(1000) - 500);
            }
            TreeNode back = parsed(NotationCodec.notationToTree(NotationCodec.treeToNotation(root)));

            assertTrue(BinarySearchTree.sameShape(root, back));
            assertEquals(Traversals.traverse(root, TraversalOrder.IN_ORDER),
                    Traversals.traverse(back, TraversalOrder.IN_ORDER));
            assertNotEquals(root.id(), back.id(), "parsing allocates new ids");
        }
    }

    @Test
    void every_parse_is_a_fresh_construction() {
        String text = NotationCodec.treeToNotation(build(2, 1, 3));
        TreeNode a = parsed(NotationCodec.notationToTree(text));
        TreeNode b = parsed(NotationCodec.notationToTree(text));

        var ids = new HashSet<>(List.of(a.id(), a.left().id(), a.right().id()));
        assertFalse(ids.contains(b.id()));
        assertFalse(ids.contains(b.left().id()));
        assertFalse(ids.contains(b.right().id()));
    }

    @Test
    void deep_chain_round_trips() {
        TreeNode root = null;
        for (int i = 0; i < 3_000; i++) {
            root = bst.insert(root, -i);
        }
        TreeNode back = parsed(NotationCodec.notationToTree(NotationCodec.treeToNotation(root)));
        assertEquals(3_000, BinarySearchTree.height(back));
    }
}
