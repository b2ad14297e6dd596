// file: src/main/java/io/treeyaml/editor/TraversalSnapshot.java
package io.treeyaml.editor;

import java.util.List;

/**
 * All traversal outputs for one tree snapshot, as shown side by side in the
 * editor: the three depth-first orders plus the values inside the configured
 * range window.
 */
public record TraversalSnapshot(
        List<Integer> inOrder,
        List<Integer> preOrder,
        List<Integer> postOrder,
        int rangeMin,
        int rangeMax,
        List<Integer> range
) {
    public TraversalSnapshot {
        inOrder = List.copyOf(inOrder);
        preOrder = List.copyOf(preOrder);
        postOrder = List.copyOf(postOrder);
        range = List.copyOf(range);
    }
}
