// file: src/main/java/io/treeyaml/notation/ParseResult.java
package io.treeyaml.notation;

import io.treeyaml.core.TreeNode;

import java.util.Objects;

/**
 * Outcome of parsing notation text. Parse failures are values, never thrown.
 *  - Success: the freshly built tree (root is null for empty input).
 *  - Failure: the first error found; nothing was built.
 */
public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {

    record Success(TreeNode root) implements ParseResult {}

    record Failure(ParseError error) implements ParseResult {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
