// file: src/main/java/io/treeyaml/notation/NotationLine.java
package io.treeyaml.notation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical view of one line of notation text, shared by the parser and the
 * indentation repair pass.
 * <p>
 * Fields:
 *  - number:  1-based line number in the original text.
 *  - raw:     the line without its terminator (a trailing '\r' is dropped).
 *  - leading: the leading run of whitespace (spaces, tabs and any Unicode
 *             space), untouched.
 *  - content: the rest of the line with surrounding whitespace stripped.
 *  - kind:    what the content looks like.
 *  - payload: text after "key:" for VALUE / LEFT / RIGHT, with any trailing
 *             " # comment" removed; empty otherwise.
 */
record NotationLine(int number, String raw, String leading, String content, Kind kind, String payload) {

    enum Kind { BLANK, COMMENT, VALUE, LEFT, RIGHT, OTHER }

    // "key:" alone or "key:" + whitespace + payload. "value:5" is not a key line.
    private static final Pattern KEY_LINE = Pattern.compile("(value|left|right):(?:\\s+(.*))?");

    /** Split on '\n' keeping every line, including a trailing empty one. */
    static List<NotationLine> split(String text) {
        String[] parts = text.split("\n", -1);
        List<NotationLine> out = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            out.add(lex(i + 1, parts[i]));
        }
        return out;
    }

    static NotationLine lex(int number, String line) {
        String raw = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;

        int i = 0;
        while (i < raw.length() && isIndentChar(raw.charAt(i))) {
            i++;
        }
        String leading = raw.substring(0, i);
        String content = raw.substring(i).strip();

        if (content.isEmpty()) {
            return new NotationLine(number, raw, leading, content, Kind.BLANK, "");
        }
        if (content.startsWith("#")) {
            return new NotationLine(number, raw, leading, content, Kind.COMMENT, "");
        }

        Matcher m = KEY_LINE.matcher(content);
        if (!m.matches()) {
            return new NotationLine(number, raw, leading, content, Kind.OTHER, "");
        }
        Kind kind = switch (m.group(1)) {
            case "value" -> Kind.VALUE;
            case "left" -> Kind.LEFT;
            default -> Kind.RIGHT;
        };
        return new NotationLine(number, raw, leading, content, kind, stripComment(m.group(2)));
    }

    /** Lines that take part in the tree structure (everything but blanks and comments). */
    boolean isStructural() {
        return kind != Kind.BLANK && kind != Kind.COMMENT;
    }

    boolean isIntroducer() {
        return kind == Kind.LEFT || kind == Kind.RIGHT;
    }

    /** "left:" / "right:" with nothing after it: a child block must follow. */
    boolean opensBlock() {
        return isIntroducer() && payload.isEmpty();
    }

    /** "left: null" / "left: ~": the child is declared absent. */
    boolean declaresAbsent() {
        return isIntroducer() && (payload.equals("null") || payload.equals("~"));
    }

    /** Index of the first character in {@code leading} that is not a plain space, or -1. */
    int irregularIndentAt() {
        for (int i = 0; i < leading.length(); i++) {
            if (leading.charAt(i) != ' ') return i;
        }
        return -1;
    }

    /** The mapping key as written: "value", "left" or "right". */
    String key() {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    private static boolean isIndentChar(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static String stripComment(String payload) {
        if (payload == null || payload.startsWith("#")) return "";
        int hash = payload.indexOf(" #");
        return (hash >= 0 ? payload.substring(0, hash) : payload).strip();
    }
}
