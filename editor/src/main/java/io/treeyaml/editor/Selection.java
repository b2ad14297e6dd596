// file: src/main/java/io/treeyaml/editor/Selection.java
package io.treeyaml.editor;

import io.treeyaml.core.NodeId;

import java.util.Objects;

/**
 * The node the user is pointing at: its identity and the value it held when
 * the current tree snapshot was produced.
 */
public record Selection(NodeId id, int value) {
    public Selection {
        Objects.requireNonNull(id, "id");
    }
}
