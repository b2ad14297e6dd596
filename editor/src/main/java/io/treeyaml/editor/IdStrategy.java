// file: src/main/java/io/treeyaml/editor/IdStrategy.java
package io.treeyaml.editor;

import io.treeyaml.core.NodeIdAllocator;

import java.util.Locale;

/** How an editor session mints node ids. */
public enum IdStrategy {
    /** {@code prefix-1, prefix-2, ...}; readable, stable across a session. */
    SEQUENTIAL("sequential"),
    /** Random UUIDs; the prefix is ignored. */
    RANDOM("random");

    private final String token;

    IdStrategy(String token) {
        this.token = token;
    }

    public NodeIdAllocator allocator(String prefix) {
        return switch (this) {
            case SEQUENTIAL -> NodeIdAllocator.sequential(prefix);
            case RANDOM -> NodeIdAllocator.random();
        };
    }

    public static IdStrategy fromToken(String raw) {
        if (raw != null) {
            String norm = raw.trim().toLowerCase(Locale.ROOT);
            for (IdStrategy s : values()) {
                if (s.token.equals(norm)) return s;
            }
        }
        throw new IllegalArgumentException("unknown id strategy: " + raw + " (expected sequential or random)");
    }
}
