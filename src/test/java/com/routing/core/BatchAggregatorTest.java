package com.routing.core;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchAggregatorTest {

    private static BestResult run(String input) throws IOException {
        return run(new CycleFinder(), input);
    }

    private static BestResult run(CycleFinder finder, String input) throws IOException {
        BatchAggregator aggregator = new BatchAggregator(finder, 100_000, ProgressListener.NONE);
        return aggregator.aggregate(new BufferedReader(new StringReader(input)));
    }

    @Test
    void emptyInputHasNoResult() throws IOException {
        BestResult best = run("");

        assertTrue(best.isEmpty());
        assertEquals("0,0,0", best.format());
    }

    @Test
    void singleEdgeHasNoResult() throws IOException {
        assertEquals("0,0,0", run("A|B|1|2\n").format());
    }

    @Test
    void selfLoopCounts() throws IOException {
        assertEquals("1,2,1", run("A|A|1|2\n").format());
    }

    @Test
    void findsLongestGroupInSample() throws IOException {
        String input = "Epic|Availity|123|197\n"
            + "Availity|Optum|123|197\n"
            + "Optum|Epic|123|197\n"
            + "Epic|Availity|891|45\n"
            + "Availity|Epic|891|45\n";

        assertEquals("123,197,3", run(input).format());
    }

    @Test
    void unsortedInputIsGroupedCorrectly() throws IOException {
        String input = "P|Q|g2|s2\n"
            + "A|B|g1|s1\n"
            + "Q|R|g2|s2\n"
            + "B|A|g1|s1\n"
            + "R|P|g2|s2\n";

        assertEquals("g2,s2,3", run(input).format());
    }

    @Test
    void tieGoesToSmallestKey() throws IOException {
        String input = "X|Y|b|1\nY|X|b|1\nX|Y|a|1\nY|X|a|1\nX|Y|a|2\nY|X|a|2\n";

        assertEquals("a,1,2", run(input).format());
    }

    @Test
    void malformedAndEmptyLinesAreSkipped() throws IOException {
        String clean = "A|B|1|2\nC|D|1|2\nD|C|1|2\n";
        String noisy = "\n\nA|B|1|2\nbad\n\nC|D|1|2\nx|y|z\nD|C|1|2|extra\nD|C|1|2\n\n";

        assertEquals(run(clean).format(), run(noisy).format());
        assertEquals("1,2,2", run(noisy).format());
    }

    @Test
    void sameNodeNamesInDifferentGroupsDoNotConnect() throws IOException {
        // A->B in group 1 and B->A in group 2 are not a cycle
        assertEquals("0,0,0", run("A|B|1|1\nB|A|1|2\n").format());
    }

    @Test
    void reportsProgressWithTotal() throws IOException {
        List<long[]> notices = new ArrayList<>();
        BatchAggregator aggregator = new BatchAggregator(new CycleFinder(), 2,
            (processed, total) -> notices.add(new long[] {processed, total}));
        String input = "A|B|1|1\nA|B|1|2\nA|B|1|3\nA|B|1|4\nB|A|1|5\nA|B|1|5\n";

        BestResult best = aggregator.aggregate(new BufferedReader(new StringReader(input)));

        assertEquals("1,5,2", best.format());
        assertEquals(2, notices.size());
        assertArrayEquals(new long[] {2, 5}, notices.get(0));
        assertArrayEquals(new long[] {4, 5}, notices.get(1));
    }

    @Test
    void rejectsNonPositiveProgressInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> new BatchAggregator(new CycleFinder(), 0, ProgressListener.NONE));
    }

    @Test
    void tieBreaksByCodePoint() throws IOException {
        String input = "X|Y|\uD83D\uDE00|1\nY|X|\uD83D\uDE00|1\nX|Y|\uFFFF|1\nY|X|\uFFFF|1\n";

        assertEquals("\uFFFF,1,2", run(input).format());
    }

    @Test
    void groupsWithFewerEdgesThanBestAreNotSearched() throws IOException {
        RecordingCycleFinder finder = new RecordingCycleFinder();
        String input = "A|B|a|1\nB|C|a|1\nC|A|a|1\n"
            + "A|B|b|1\nB|A|b|1\n"
            + "A|B|c|1\n"
            + "A|B|d|1\nB|C|d|1\nC|A|d|1\n";

        BestResult best = run(finder, input);

        assertEquals("a,1,3", best.format());
        // Every search saw at least as many edges as the best length known at that time
        int known = 0;
        for (int[] call : finder.calls) {
            assertTrue(call[0] >= known, "searched a group with " + call[0] + " edges after best " + known);
            known = Math.max(known, call[1]);
        }
        // Groups run in first-sighting order: b and c are skipped once a is searched
        assertEquals(2, finder.calls.size());
    }

    private static final class RecordingCycleFinder extends CycleFinder {
        final List<int[]> calls = new ArrayList<>();

        @Override
        public int findLongestCycle(Collection<Edge> edges) {
            int length = super.findLongestCycle(edges);
            calls.add(new int[] {edges.size(), length});
            return length;
        }
    }
}
