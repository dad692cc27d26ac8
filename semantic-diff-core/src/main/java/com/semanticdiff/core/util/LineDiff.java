package com.semanticdiff.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Line-based diff using the longest common subsequence of two line lists,
 * with unified-format output.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String patch = LineDiff.unified(
 *     List.of("a", "b", "c"),
 *     List.of("a", "c", "d"),
 *     "old", "new", 3);
 * // --- old
 * // +++ new
 * // @@ -1,3 +1,3 @@
 * //  a
 * // -b
 * //  c
 * // +d
 * }</pre>
 */
public final class LineDiff {

    /** Default number of context lines around a change. */
    public static final int DEFAULT_CONTEXT = 3;

    private LineDiff() {
        // Utility class
    }

    /**
     * Edit operation of a single line.
     */
    public enum Operation {
        EQUAL(' '),
        DELETE('-'),
        INSERT('+');

        private final char prefix;

        Operation(char prefix) {
            this.prefix = prefix;
        }

        public char prefix() {
            return prefix;
        }
    }

    /**
     * One line of an edit script.
     *
     * @param operation edit operation
     * @param line line text
     */
    public record Edit(Operation operation, String line) {
        public Edit {
            Objects.requireNonNull(operation, "operation must not be null");
            Objects.requireNonNull(line, "line must not be null");
        }
    }

    /**
     * Computes the shortest edit script turning {@code source} into {@code target}.
     * Deletions are listed before insertions at the same position.
     *
     * @param source source lines
     * @param target target lines
     * @return edit script covering every line of both inputs
     */
    public static List<Edit> diff(List<String> source, List<String> target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        int n = source.size();
        int m = target.size();
        // lcs[i][j] = LCS length of source[i..] and target[j..]
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = source.get(i).equals(target.get(j))
                    ? lcs[i + 1][j + 1] + 1
                    : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }

        List<Edit> edits = new ArrayList<>(n + m);
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (source.get(i).equals(target.get(j))) {
                edits.add(new Edit(Operation.EQUAL, source.get(i)));
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                edits.add(new Edit(Operation.DELETE, source.get(i++)));
            } else {
                edits.add(new Edit(Operation.INSERT, target.get(j++)));
            }
        }
        while (i < n) {
            edits.add(new Edit(Operation.DELETE, source.get(i++)));
        }
        while (j < m) {
            edits.add(new Edit(Operation.INSERT, target.get(j++)));
        }
        return edits;
    }

    /**
     * Renders the diff of two line lists in unified format.
     *
     * @param source source lines
     * @param target target lines
     * @param fromLabel label of the source ({@code ---} header)
     * @param toLabel label of the target ({@code +++} header)
     * @param context number of unchanged lines shown around each change
     * @return unified diff, or an empty string when the inputs are equal
     */
    public static String unified(List<String> source, List<String> target,
                                 String fromLabel, String toLabel, int context) {
        List<Edit> edits = diff(source, target);

        List<Integer> changed = new ArrayList<>();
        for (int k = 0; k < edits.size(); k++) {
            if (edits.get(k).operation() != Operation.EQUAL) {
                changed.add(k);
            }
        }
        if (changed.isEmpty()) {
            return "";
        }

        // sourceBefore[k] / targetBefore[k] = lines of each side consumed before edit k
        int[] sourceBefore = new int[edits.size() + 1];
        int[] targetBefore = new int[edits.size() + 1];
        for (int k = 0; k < edits.size(); k++) {
            Operation op = edits.get(k).operation();
            sourceBefore[k + 1] = sourceBefore[k] + (op == Operation.INSERT ? 0 : 1);
            targetBefore[k + 1] = targetBefore[k] + (op == Operation.DELETE ? 0 : 1);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(fromLabel).append('\n');
        sb.append("+++ ").append(toLabel).append('\n');

        int index = 0;
        while (index < changed.size()) {
            int first = changed.get(index);
            int last = first;
            while (index + 1 < changed.size() && changed.get(index + 1) - last - 1 <= 2 * context) {
                last = changed.get(++index);
            }
            index++;

            int start = Math.max(0, first - context);
            int end = Math.min(edits.size(), last + context + 1);

            sb.append("@@ -")
                .append(range(sourceBefore[start], sourceBefore[end] - sourceBefore[start]))
                .append(" +")
                .append(range(targetBefore[start], targetBefore[end] - targetBefore[start]))
                .append(" @@\n");
            for (int k = start; k < end; k++) {
                Edit edit = edits.get(k);
                sb.append(edit.operation().prefix()).append(edit.line()).append('\n');
            }
        }
        return sb.toString();
    }

    private static String range(int start, int length) {
        if (length == 1) {
            return String.valueOf(start + 1);
        }
        // an empty range points at the line before it
        return (length == 0 ? start : start + 1) + "," + length;
    }
}
