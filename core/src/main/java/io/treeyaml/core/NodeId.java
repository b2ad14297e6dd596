// file: src/main/java/io/treeyaml/core/NodeId.java
package io.treeyaml.core;

/**
 * Opaque, stable identity of a tree node.
 * <p>
 * Identity is independent of the node's value:
 *  - renderers use it to track "the same node" across structural edits,
 *  - clones copy it verbatim, so selection state stays valid,
 *  - a value edit never changes it.
 * <p>
 * Tokens are only meaningful within one process; they are not persisted.
 */
public record NodeId(String token) {
    public NodeId {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token");
        }
    }

    @Override public String toString() { return token; }
}
