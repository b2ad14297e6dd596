// file: src/main/java/io/treeyaml/notation/NotationCodec.java
package io.treeyaml.notation;

import io.treeyaml.core.NodeIdAllocator;
import io.treeyaml.core.TreeNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Text framing for trees.
 * <p>
 * Layout of one node at nesting level d (indent = 2 * d spaces):
 * <pre>
 *   value: 10
 *   left:
 *     value: 5
 *   right:
 *     value: 15
 * </pre>
 *  - "value: &lt;int&gt;" comes first,
 *  - "left:" then "right:" follow at the same level, only for present children,
 *  - a child's lines sit one unit deeper than its introducer.
 * <p>
 * The empty tree is the empty string. Non-empty text ends with a newline.
 * Round trip: parsing the output of {@link #treeToNotation} rebuilds the same
 * shape with fresh ids.
 */
public final class NotationCodec {

    /** Spaces per nesting level. */
    public static final int INDENT_UNIT = 2;

    private NotationCodec() {}

    /** Serialize a tree. Never fails. */
    public static String treeToNotation(TreeNode root) {
        if (root == null) return "";

        StringBuilder sb = new StringBuilder();
        Deque<Emit> stack = new ArrayDeque<>();
        stack.push(new Emit(root, 0, null));

        while (!stack.isEmpty()) {
            Emit e = stack.pop();
            if (e.key() != null) {
                sb.append(indent(e.level() - 1)).append(e.key()).append(":\n");
            }
            sb.append(indent(e.level())).append("value: ").append(e.node().value()).append('\n');

            // right pushed first so the whole left subtree is written before it
            if (e.node().right() != null) stack.push(new Emit(e.node().right(), e.level() + 1, "right"));
            if (e.node().left() != null) stack.push(new Emit(e.node().left(), e.level() + 1, "left"));
        }
        return sb.toString();
    }

    /** Parse with ids from {@link NodeIdAllocator#shared()}. */
    public static ParseResult notationToTree(String text) {
        return notationToTree(text, NodeIdAllocator.shared());
    }

    public static ParseResult notationToTree(String text, NodeIdAllocator ids) {
        return new NotationParser(ids).parse(text);
    }

    static String indent(int level) {
        return " ".repeat(level * INDENT_UNIT);
    }

    private record Emit(TreeNode node, int level, String key) {}
}
