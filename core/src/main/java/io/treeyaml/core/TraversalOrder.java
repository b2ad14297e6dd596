// file: src/main/java/io/treeyaml/core/TraversalOrder.java
package io.treeyaml.core;

import java.util.Locale;

/**
 * Depth-first visiting orders.
 * <p>
 *  - IN_ORDER:   left, self, right. Ascending on a valid BST.
 *  - PRE_ORDER:  self, left, right.
 *  - POST_ORDER: left, right, self.
 */
public enum TraversalOrder {
    IN_ORDER("inorder"), PRE_ORDER("preorder"), POST_ORDER("postorder");

    private final String token;

    TraversalOrder(String token) {
        this.token = token;
    }

    /** Short lowercase name, e.g. "inorder". */
    public String token() { return token; }

    /**
     * Parse a user-supplied order name. Case-insensitive; '-' and '_' are
     * ignored, so "inorder", "in-order" and "IN_ORDER" are all accepted.
     */
    public static TraversalOrder fromToken(String raw) {
        if (raw == null) throw new IllegalArgumentException("order must not be null");
        String norm = raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (TraversalOrder o : values()) {
            if (o.token.equals(norm)) return o;
        }
        throw new IllegalArgumentException("unknown traversal order: " + raw
                + " (expected inorder, preorder or postorder)");
    }
}
