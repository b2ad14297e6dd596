// file: src/main/java/io/treeyaml/editor/TreeEditor.java
package io.treeyaml.editor;

import io.treeyaml.core.BinarySearchTree;
import io.treeyaml.core.NodeId;
import io.treeyaml.core.TraversalOrder;
import io.treeyaml.core.Traversals;
import io.treeyaml.core.TreeNode;
import io.treeyaml.editor.dto.TreeView;
import io.treeyaml.notation.IndentationRepair;
import io.treeyaml.notation.NotationCodec;
import io.treeyaml.notation.NotationParser;
import io.treeyaml.notation.ParseError;
import io.treeyaml.notation.ParseResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Application service for one editing session.
 *
 * Responsibilities:
 *  - Own the current tree snapshot and swap it for a new one on every edit.
 *  - Keep the selection, notation draft, last parse error and last message in
 *    step with the tree.
 *  - Log every command through {@link CommandLogger}.
 *
 * State rules:
 *  - Snapshots are never mutated; readers may hold on to {@link #root()}.
 *  - Any change of the tree regenerates the draft from it and clears the parse error.
 *  - After each replacement the selection is looked up by id in the new tree:
 *    it follows its node's new value, or is dropped when the node is gone.
 *  - A rejected notation leaves tree and selection untouched.
 *
 * Not thread-safe; one session belongs to one console.
 */
public class TreeEditor {

    public static final String WELCOME = "Welcome to TreeYAML Architect";

    private final EditorConfig config;
    private final BinarySearchTree bst;
    private final NotationParser parser;

    private TreeNode root;
    private Selection selection;
    private String draft = "";
    private ParseError lastError;
    private String lastMessage = WELCOME;

    public TreeEditor() {
        this(EditorConfig.defaults());
    }

    public TreeEditor(EditorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        var ids = config.newAllocator();
        this.bst = new BinarySearchTree(ids);
        this.parser = new NotationParser(ids);
    }

    // ---------- tree edits ----------

    public CommandResult insert(int value) {
        if (BinarySearchTree.contains(root, value)) {
            return logged("insert", value, CommandResult.unchanged("Node " + value + " already present"));
        }
        replaceTree(bst.insert(root, value));
        return logged("insert", value, CommandResult.applied("Inserted node " + value));
    }

    public CommandResult delete(int value) {
        if (!BinarySearchTree.contains(root, value)) {
            return logged("delete", value, CommandResult.unchanged("Node " + value + " not found"));
        }
        if (selection != null && selection.value() == value) {
            selection = null;
        }
        replaceTree(bst.delete(root, value));
        return logged("delete", value, CommandResult.applied("Deleted node " + value));
    }

    /** Delete the value held by the selected node. */
    public CommandResult deleteSelected() {
        if (selection == null) {
            return logged("delete", null, CommandResult.unchanged("No node selected"));
        }
        return delete(selection.value());
    }

    /**
     * Relabel a node in place. The tree is not re-sorted, so the result may no
     * longer be a valid BST; {@link #view()} reports that.
     */
    public CommandResult editValue(NodeId id, int newValue) {
        Objects.requireNonNull(id, "id");
        if (BinarySearchTree.findById(root, id) == null) {
            return logged("edit", id + " " + newValue, CommandResult.unchanged("Node " + id + " not found"));
        }
        replaceTree(bst.editValue(root, id, newValue));
        return logged("edit", id + " " + newValue, CommandResult.applied("Updated node to " + newValue));
    }

    public CommandResult editSelected(int newValue) {
        if (selection == null) {
            return logged("edit", newValue, CommandResult.unchanged("No node selected"));
        }
        return editValue(selection.id(), newValue);
    }

    public CommandResult clear() {
        selection = null;
        replaceTree(null);
        return logged("clear", null, CommandResult.applied("Tree cleared"));
    }

    // ---------- selection ----------

    /** Select the node with {@code id}; false (and no change) when the tree has no such node. */
    public boolean select(NodeId id) {
        TreeNode node = BinarySearchTree.findById(root, id);
        if (node == null) return false;
        selection = new Selection(node.id(), node.value());
        return true;
    }

    public void clearSelection() {
        selection = null;
    }

    // ---------- notation ----------

    /**
     * Take {@code text} as the new draft and try to build a tree from it.
     * On success the tree is replaced and the selection dropped (parsed trees
     * carry fresh ids); the draft is then regenerated in canonical form.
     */
    public CommandResult parseNotation(String text) {
        Objects.requireNonNull(text, "text");
        draft = text;
        ParseResult result = parser.parse(text);
        if (result instanceof ParseResult.Failure failure) {
            lastError = failure.error();
            return logged("parse", null, CommandResult.failed(failure.error().describe(), failure.error()));
        }
        selection = null;
        replaceTree(((ParseResult.Success) result).root());
        return logged("parse", null, CommandResult.applied("Notation synced successfully"));
    }

    /**
     * Normalize the indentation of {@code text} into the draft and check it
     * with the parser. The tree itself is left alone; follow with
     * {@link #syncDraft()} to adopt the repaired notation.
     */
    public CommandResult repairNotation(String text) {
        Objects.requireNonNull(text, "text");
        draft = IndentationRepair.repairIndentation(text);
        ParseResult check = parser.parse(draft);
        if (check instanceof ParseResult.Failure failure) {
            lastError = failure.error();
            return logged("repair", null,
                    CommandResult.failed("Repair incomplete: " + failure.error().describe(), failure.error()));
        }
        lastError = null;
        return logged("repair", null, CommandResult.applied("Notation structure repaired"));
    }

    public CommandResult syncDraft() {
        return parseNotation(draft);
    }

    public CommandResult repairDraft() {
        return repairNotation(draft);
    }

    // ---------- queries ----------

    public List<Integer> traverse(TraversalOrder order) {
        return Traversals.traverse(root, order);
    }

    public List<Integer> rangeQuery(int min, int max) {
        return Traversals.rangeQuery(root, min, max);
    }

    /** Every traversal of the current tree, with the range taken from the config. */
    public TraversalSnapshot traversals() {
        return new TraversalSnapshot(
                traverse(TraversalOrder.IN_ORDER),
                traverse(TraversalOrder.PRE_ORDER),
                traverse(TraversalOrder.POST_ORDER),
                config.rangeMin(),
                config.rangeMax(),
                rangeQuery(config.rangeMin(), config.rangeMax())
        );
    }

    public TreeView view() {
        return TreeView.of(root, selection != null ? selection.id() : null);
    }

    public String viewJson() {
        return EditorJson.write(view());
    }

    // ---------- state ----------

    public TreeNode root() { return root; }

    public int size() { return BinarySearchTree.size(root); }

    public Optional<Selection> selection() { return Optional.ofNullable(selection); }

    public String draft() { return draft; }

    public Optional<ParseError> lastError() { return Optional.ofNullable(lastError); }

    public String lastMessage() { return lastMessage; }

    public EditorConfig config() { return config; }

    // ---------- helpers ----------

    private void replaceTree(TreeNode next) {
        root = next;
        draft = NotationCodec.treeToNotation(next);
        lastError = null;
        if (selection != null) {
            TreeNode node = BinarySearchTree.findById(next, selection.id());
            selection = node == null ? null : new Selection(node.id(), node.value());
        }
    }

    private CommandResult logged(String command, Object arg, CommandResult result) {
        lastMessage = result.message();
        CommandLogger.logCommand(command, arg, result, size());
        return result;
    }
}
