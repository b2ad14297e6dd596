// file: src/main/java/io/treeyaml/editor/dto/TreeView.java
package io.treeyaml.editor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.treeyaml.core.BinarySearchTree;
import io.treeyaml.core.NodeId;
import io.treeyaml.core.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Render view of a tree snapshot. Nodes are listed flat in pre-order (root
 * first) and link to their children by id, so the JSON nesting depth does not
 * grow with the height of the tree:
 *   {
 *     "size": 3,
 *     "height": 2,
 *     "validBst": true,
 *     "rootId": "node-1",
 *     "selectedId": "node-2",
 *     "nodes": [
 *       { "id": "node-1", "value": 10, "selected": false, "leftId": "node-2", "rightId": "node-3" },
 *       { "id": "node-2", "value": 5,  "selected": true },
 *       { "id": "node-3", "value": 15, "selected": false }
 *     ]
 *   }
 * For the empty tree {@code rootId} and {@code selectedId} are omitted and {@code nodes} is empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TreeView {
    public int size;
    public int height;
    public boolean validBst;
    public String rootId;
    public String selectedId;
    public List<NodeView> nodes = new ArrayList<>();

    /**
     * Build the view for {@code root}, flagging the node with {@code selectedId}.
     * The selection is dropped from the view when no node carries that id.
     */
    public static TreeView of(TreeNode root, NodeId selectedId) {
        TreeView view = new TreeView();
        view.size = BinarySearchTree.size(root);
        view.height = BinarySearchTree.height(root);
        view.validBst = BinarySearchTree.isValidBst(root);
        if (root == null) return view;

        view.rootId = root.id().token();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            NodeView v = new NodeView();
            v.id = node.id().token();
            v.value = node.value();
            v.selected = node.id().equals(selectedId);
            if (node.left() != null) v.leftId = node.left().id().token();
            if (node.right() != null) v.rightId = node.right().id().token();
            if (v.selected) view.selectedId = v.id;
            view.nodes.add(v);

            if (node.right() != null) stack.push(node.right());
            if (node.left() != null) stack.push(node.left());
        }
        return view;
    }
}
