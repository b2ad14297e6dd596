// file: src/main/java/io/treeyaml/notation/ParseError.java
package io.treeyaml.notation;

import java.util.Objects;

/**
 * Position-aware description of why notation text was rejected.
 * <p>
 * Fields:
 *  - line:     1-based number of the offending line.
 *  - message:  human-readable text, starting with the category label.
 *  - category: machine-readable kind of failure.
 *  - text:     the offending line as written (without its terminator).
 */
public record ParseError(int line, String message, Category category, String text) {

    public ParseError {
        if (line < 1) throw new IllegalArgumentException("line must be >= 1");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(text, "text");
    }

    public enum Category {
        /** Tab in the indentation, or a width that is not a multiple of the unit. */
        BAD_INDENTATION("bad indentation"),
        /** Second "value:", "left:" or "right:" within one node. */
        DUPLICATE_KEY("duplicated mapping key"),
        /** "value:" payload that is not a 32-bit decimal integer. */
        INVALID_INTEGER("invalid integer"),
        /** A node or child block without its leading "value:" line. */
        EMPTY_BLOCK("empty child block"),
        /** A line deeper than anything it could continue. */
        UNEXPECTED_INDENT("unexpected indentation"),
        /** A line that is none of the recognised forms. */
        INVALID_LINE("invalid line");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public String label() { return label; }
    }

    /** One-line rendering for status bars and logs, e.g. {@code line 4: duplicated mapping key 'left' [left:]}. */
    public String describe() {
        return "line " + line + ": " + message + " [" + text.strip() + "]";
    }

    @Override public String toString() { return describe(); }
}
