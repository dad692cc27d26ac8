package com.semanticdiff.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LineDiff}.
 */
class LineDiffTest {

    @Test
    void diff_deletionsPrecedeInsertions() {
        List<LineDiff.Edit> edits = LineDiff.diff(List.of("a", "b", "c"), List.of("a", "x", "c"));

        assertThat(edits).containsExactly(
            new LineDiff.Edit(LineDiff.Operation.EQUAL, "a"),
            new LineDiff.Edit(LineDiff.Operation.DELETE, "b"),
            new LineDiff.Edit(LineDiff.Operation.INSERT, "x"),
            new LineDiff.Edit(LineDiff.Operation.EQUAL, "c"));
    }

    @Test
    void unified_equalInputs_isEmpty() {
        assertThat(LineDiff.unified(List.of("a"), List.of("a"), "old", "new", 3)).isEmpty();
    }

    @Test
    void unified_singleHunk() {
        String patch = LineDiff.unified(List.of("a", "b", "c"), List.of("a", "c", "d"), "old", "new", 3);

        assertThat(patch).isEqualTo("""
            --- old
            +++ new
            @@ -1,3 +1,3 @@
             a
            -b
             c
            +d
            """);
    }

    @Test
    void unified_emptySource_usesZeroLengthRange() {
        String patch = LineDiff.unified(List.of(), List.of("x", "y"), "old", "new", 3);

        assertThat(patch).contains("@@ -0,0 +1,2 @@\n+x\n+y\n");
    }

    @Test
    void unified_distantChanges_splitIntoHunks() {
        List<String> source = IntStream.rangeClosed(1, 20).mapToObj(i -> "line" + i).toList();
        List<String> target = source.stream()
            .map(line -> line.equals("line2") ? "LINE2" : line.equals("line19") ? "LINE19" : line)
            .toList();

        String patch = LineDiff.unified(source, target, "old", "new", 3);

        assertThat(patch).contains("@@ -1,5 +1,5 @@", "@@ -16,5 +16,5 @@");
        assertThat(patch.lines().filter(line -> line.startsWith("@@"))).hasSize(2);
    }
}
