// file: src/main/java/io/treeyaml/notation/NotationParser.java
package io.treeyaml.notation;

import io.treeyaml.core.NodeId;
import io.treeyaml.core.NodeIdAllocator;
import io.treeyaml.core.TreeNode;
import io.treeyaml.notation.NotationLine.Kind;
import io.treeyaml.notation.ParseError.Category;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Indentation-driven parser for the tree notation.
 * <p>
 * Grammar, one item per non-blank line:
 * <pre>
 *   value: &lt;int&gt;        starts a node
 *   left:               opens the left child block, one unit (two spaces) deeper
 *   right:              opens the right child block, one unit deeper
 *   left: null | ~      declares the left child absent (same for right)
 *   # ...               comment, ignored like a blank line
 * </pre>
 * <p>
 * Parsing keeps an explicit stack of open frames, one per node on the path
 * from the root to the node currently being filled. Frame depths are always
 * 0, 1, 2, ... so a shallower line closes exactly the frames deeper than it
 * and continues the node left on top. The first problem found is returned as
 * a {@link ParseResult.Failure}; ids are drawn from the allocator for every
 * node built, so a parse never reuses ids of an earlier tree.
 * <p>
 * Instances hold no per-parse state and may be reused.
 */
public final class NotationParser {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?\\d+");

    private final NodeIdAllocator ids;

    public NotationParser(NodeIdAllocator ids) {
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public ParseResult parse(String text) {
        Objects.requireNonNull(text, "text");

        List<Frame> created = new ArrayList<>();
        Deque<Frame> open = new ArrayDeque<>();
        Pending pending = null;

        for (NotationLine line : NotationLine.split(text)) {
            if (!line.isStructural()) continue;

            // ---- indentation ----
            int irregular = line.irregularIndentAt();
            if (irregular >= 0) {
                char c = line.leading().charAt(irregular);
                return fail(line, Category.BAD_INDENTATION, c == '\t'
                        ? "tab character in indentation"
                        : "non-space character U+%04X in indentation".formatted((int) c));
            }
            int width = line.leading().length();
            if (width % NotationCodec.INDENT_UNIT != 0) {
                return fail(line, Category.BAD_INDENTATION, "%d spaces is not a multiple of %d"
                        .formatted(width, NotationCodec.INDENT_UNIT));
            }
            int depth = width / NotationCodec.INDENT_UNIT;

            // ---- line form ----
            if (line.kind() == Kind.OTHER) {
                return fail(line, Category.INVALID_LINE, "expected 'value: <int>', 'left:' or 'right:'");
            }
            if (line.isIntroducer() && !line.opensBlock() && !line.declaresAbsent()) {
                return fail(line, Category.INVALID_LINE, "'%s:' must be followed by an indented block or null"
                        .formatted(line.key()));
            }

            // ---- first line of a child block ----
            if (pending != null) {
                int expected = pending.parent().depth + 1;
                if (depth > expected) {
                    return fail(line, Category.UNEXPECTED_INDENT, "expected depth %d under '%s:' on line %d, found %d"
                            .formatted(expected, pending.introducer().key(), pending.introducer().number(), depth));
                }
                if (depth < expected) {
                    return fail(pending.introducer(), Category.EMPTY_BLOCK, "'%s:' has no indented 'value:' line"
                            .formatted(pending.introducer().key()));
                }
                if (line.kind() != Kind.VALUE) {
                    return fail(line, Category.EMPTY_BLOCK, "block under '%s:' on line %d must start with 'value:'"
                            .formatted(pending.introducer().key(), pending.introducer().number()));
                }
                Integer value = parseValue(line);
                if (value == null) return invalidInteger(line);

                Frame child = new Frame(depth, value, ids.newId(), line.number());
                if (pending.leftSide()) {
                    pending.parent().left = child;
                } else {
                    pending.parent().right = child;
                }
                created.add(child);
                open.push(child);
                pending = null;
                continue;
            }

            // ---- root ----
            if (open.isEmpty()) {
                if (depth != 0) {
                    return fail(line, Category.UNEXPECTED_INDENT, "the root node must start at column 0");
                }
                if (line.kind() != Kind.VALUE) {
                    return fail(line, Category.EMPTY_BLOCK, "node has no 'value:' line before '%s:'"
                            .formatted(line.key()));
                }
                Integer value = parseValue(line);
                if (value == null) return invalidInteger(line);

                Frame root = new Frame(0, value, ids.newId(), line.number());
                created.add(root);
                open.push(root);
                continue;
            }

            // ---- continuation of an open node ----
            Frame top = open.peek();
            if (depth > top.depth) {
                return fail(line, Category.UNEXPECTED_INDENT, "depth %d but the open node on line %d is at depth %d"
                        .formatted(depth, top.line, top.depth));
            }
            while (top.depth > depth) {
                open.pop();
                top = open.peek();
            }

            if (line.kind() == Kind.VALUE) {
                return fail(line, Category.DUPLICATE_KEY, "'value' already given on line %d".formatted(top.line));
            }
            boolean leftSide = line.kind() == Kind.LEFT;
            if (leftSide ? top.hasLeft : top.hasRight) {
                return fail(line, Category.DUPLICATE_KEY, "'%s' already given for the node on line %d"
                        .formatted(line.key(), top.line));
            }
            if (leftSide) {
                top.hasLeft = true;
            } else {
                top.hasRight = true;
            }
            if (line.opensBlock()) {
                pending = new Pending(top, leftSide, line);
            }
        }

        if (pending != null) {
            return fail(pending.introducer(), Category.EMPTY_BLOCK, "'%s:' has no indented 'value:' line"
                    .formatted(pending.introducer().key()));
        }
        if (created.isEmpty()) {
            return new ParseResult.Success(null);
        }
        return new ParseResult.Success(build(created));
    }

    // ---------- helpers ----------

    /**
     * Frames were created parent-before-child, so walking the list backwards
     * builds every child before the node that owns it.
     */
    private static TreeNode build(List<Frame> created) {
        for (int i = created.size() - 1; i >= 0; i--) {
            Frame f = created.get(i);
            f.built = new TreeNode(
                    f.value,
                    f.id,
                    f.left == null ? null : f.left.built,
                    f.right == null ? null : f.right.built
            );
        }
        return created.get(0).built;
    }

    private static Integer parseValue(NotationLine line) {
        String payload = line.payload();
        if (!DECIMAL.matcher(payload).matches()) return null;
        try {
            return Integer.parseInt(payload);
        } catch (NumberFormatException overflow) {
            return null;
        }
    }

    private static ParseResult invalidInteger(NotationLine line) {
        String detail = line.payload().isEmpty()
                ? "'value:' needs an integer"
                : "'%s' is not a 32-bit integer".formatted(line.payload());
        return fail(line, Category.INVALID_INTEGER, detail);
    }

    private static ParseResult fail(NotationLine line, Category category, String detail) {
        String message = category.label() + ": " + detail;
        return new ParseResult.Failure(new ParseError(line.number(), message, category, line.raw()));
    }

    /** A node under construction. */
    private static final class Frame {
        final int depth;
        final int value;
        final NodeId id;
        final int line;
        Frame left;
        Frame right;
        boolean hasLeft;
        boolean hasRight;
        TreeNode built;

        Frame(int depth, int value, NodeId id, int line) {
            this.depth = depth;
            this.value = value;
            this.id = id;
            this.line = line;
        }
    }

    /** An introducer whose block has not started yet. */
    private record Pending(Frame parent, boolean leftSide, NotationLine introducer) {}
}
