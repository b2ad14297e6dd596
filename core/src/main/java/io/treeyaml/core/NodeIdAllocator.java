// file: src/main/java/io/treeyaml/core/NodeIdAllocator.java
package io.treeyaml.core;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of fresh node identities.
 * <p>
 * Contract: every id returned by {@link #newId()} is distinct from every id
 * previously returned by the same allocator for the lifetime of the process.
 * Ids are never recycled, even when the node they were issued for is deleted.
 */
public interface NodeIdAllocator {

    NodeId newId();

    /**
     * Process-wide sequential allocator. This is the default everywhere an
     * allocator is not passed explicitly, so ids from different trees built in
     * the same process never collide.
     */
    static NodeIdAllocator shared() { return Sequential.SHARED; }

    /** Independent sequential allocator issuing {@code prefix-1, prefix-2, ...}. */
    static NodeIdAllocator sequential(String prefix) { return new Sequential(prefix); }

    /** Allocator issuing random UUID tokens. */
    static NodeIdAllocator random() { return new RandomUuid(); }

    /**
     * Monotonic counter with a fixed prefix.
     * Uniqueness holds per instance; two instances with the same prefix will
     * issue the same tokens.
     */
    final class Sequential implements NodeIdAllocator {
        static final Sequential SHARED = new Sequential("n");

        private final String prefix;
        private final AtomicLong counter = new AtomicLong();

        Sequential(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix");
            }
            this.prefix = prefix;
        }

        @Override public NodeId newId() {
            return new NodeId(prefix + "-" + counter.incrementAndGet());
        }
    }

    /** UUID tokens; unique across instances as well. */
    final class RandomUuid implements NodeIdAllocator {
        @Override public NodeId newId() {
            return new NodeId(UUID.randomUUID().toString());
        }
    }
}
