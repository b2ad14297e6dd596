// file: src/main/java/io/treeyaml/editor/CommandResult.java
package io.treeyaml.editor;

import io.treeyaml.notation.ParseError;

import java.util.Objects;

/**
 * Outcome of one editor command.
 *
 * Status:
 *  - APPLIED:   the command took effect (tree, selection or draft changed).
 *  - UNCHANGED: nothing to do, e.g. inserting a value that is already present.
 *  - FAILED:    the command was rejected; {@code error} is set for notation failures.
 */
public record CommandResult(Status status, String message, ParseError error) {

    public enum Status { APPLIED, UNCHANGED, FAILED }

    public CommandResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
    }

    public static CommandResult applied(String message) {
        return new CommandResult(Status.APPLIED, message, null);
    }

    public static CommandResult unchanged(String message) {
        return new CommandResult(Status.UNCHANGED, message, null);
    }

    public static CommandResult failed(String message, ParseError error) {
        return new CommandResult(Status.FAILED, message, error);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
