// file: src/main/java/io/treeyaml/notation/IndentationRepair.java
package io.treeyaml.notation;

import io.treeyaml.notation.NotationLine.Kind;

import java.util.List;
import java.util.Objects;

/**
 * Best-effort normalizer for hand-edited notation.
 * <p>
 * Targets the usual editing mistakes:
 *  - indent widths other than two spaces (e.g. four, or three),
 *  - tabs in the indentation,
 *  - trailing whitespace,
 *  - a child "value:" left flush with its "left:"/"right:" line, which the
 *    parser reports as a duplicated mapping key.
 * <p>
 * Algorithm:
 *  1) Tabs in the leading whitespace expand to {@value #TAB_WIDTH} columns;
 *     any other whitespace character (e.g. U+00A0, U+2003) counts as one space.
 *  2) The indentation step is the smallest non-zero leading width of any
 *     structural line (1 when everything is flush left).
 *  3) Each line's observed level is round(width / step).
 *  4) The observed level is snapped to the nearest level that is valid after
 *     the preceding structural line:
 *       - first line:                        0
 *       - after "left:"/"right:", a value:   exactly one deeper
 *       - after "left:"/"right:", otherwise: at most one deeper
 *       - after anything else:               at most the same level
 *  5) Lines are re-emitted with two spaces per level. Blank lines are kept
 *     (emptied) so line numbers still match; comments take the level of the
 *     next structural line.
 * <p>
 * The result is advisory: it is not guaranteed to parse. Callers feed it back
 * through {@link NotationParser} and report whatever error remains.
 */
public final class IndentationRepair {

    static final int TAB_WIDTH = 4;

    private IndentationRepair() {}

    public static String repairIndentation(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) return text;

        List<NotationLine> lines = NotationLine.split(text);
        int n = lines.size();

        int[] widths = new int[n];
        int step = 0;
        for (int i = 0; i < n; i++) {
            NotationLine line = lines.get(i);
            widths[i] = visualWidth(line.leading());
            if (line.isStructural() && widths[i] > 0) {
                step = step == 0 ? widths[i] : Math.min(step, widths[i]);
            }
        }
        if (step == 0) step = 1;

        int[] levels = new int[n];
        int prevLevel = -1;
        boolean prevOpens = false;
        for (int i = 0; i < n; i++) {
            NotationLine line = lines.get(i);
            if (!line.isStructural()) continue;

            int observed = (int) Math.round(widths[i] / (double) step);
            int level;
            if (prevLevel < 0) {
                level = 0;
            } else if (prevOpens) {
                level = line.kind() == Kind.VALUE ? prevLevel + 1 : Math.min(observed, prevLevel + 1);
            } else {
                level = Math.min(observed, prevLevel);
            }
            levels[i] = level;
            prevLevel = level;
            prevOpens = line.opensBlock();
        }

        // comments follow the next structural line; trailing comments go to column 0
        int next = 0;
        for (int i = n - 1; i >= 0; i--) {
            NotationLine line = lines.get(i);
            if (line.isStructural()) {
                next = levels[i];
            } else if (line.kind() == Kind.COMMENT) {
                levels[i] = next;
            }
        }

        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < n; i++) {
            if (i > 0) out.append('\n');
            NotationLine line = lines.get(i);
            if (line.kind() != Kind.BLANK) {
                out.append(NotationCodec.indent(levels[i])).append(line.content());
            }
        }
        return out.toString();
    }

    private static int visualWidth(String leading) {
        int w = 0;
        for (int i = 0; i < leading.length(); i++) {
            if (leading.charAt(i) == '\t') {
                w += TAB_WIDTH - (w % TAB_WIDTH);
            } else {
                w++;
            }
        }
        return w;
    }
}
