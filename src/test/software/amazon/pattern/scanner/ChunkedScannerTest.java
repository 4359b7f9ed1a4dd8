package software.amazon.pattern.scanner;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;
import software.amazon.pattern.scanner.input.InvalidAlphabetSymbolException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ChunkedScannerTest {

    private static ExecutorService executor;

    @BeforeClass
    public static void startWorkers() {
        executor = Workers.newFixedPool(8, "scanner-test");
    }

    @AfterClass
    public static void stopWorkers() {
        executor.shutdownNow();
    }

    private static Automaton automaton(String... patterns) {
        return Automaton.builder().addPatterns(Arrays.asList(patterns)).build();
    }

    @Test
    public void matchCrossingAChunkBoundaryIsReportedOnceByItsOwner() {
        // chunk size 6 with two workers; "abcdef" starts at 4 in chunk 0 and ends at 9 in chunk 1
        Automaton automaton = automaton("abcdef");
        ChunkedScanner scanner = new ChunkedScanner(automaton, 2, executor);

        List<List<MatchRecord>> perChunk = scanner.scan("xxxxabcdefxx");

        assertEquals(2, perChunk.size());
        assertEquals(Collections.singletonList(new MatchRecord(0, 4, 9)), perChunk.get(0));
        assertTrue(perChunk.get(1).isEmpty());
    }

    @Test
    public void matchEndingOnTheLastSymbolOfTheWindowIsFound() {
        // chunk 0 owns [0, 4) and reads up to 7; "dxyz" starts at 3 and ends at 6
        Automaton automaton = automaton("dxyz", "ab");
        ChunkedScanner scanner = new ChunkedScanner(automaton, 3, executor);

        List<List<MatchRecord>> perChunk = scanner.scan("abcdxyzqab");

        assertEquals(3, perChunk.size());
        assertEquals(Arrays.asList(new MatchRecord(1, 0, 1), new MatchRecord(0, 3, 6)), perChunk.get(0));
        assertTrue(perChunk.get(1).isEmpty());
        assertEquals(Collections.singletonList(new MatchRecord(1, 8, 9)), perChunk.get(2));
    }

    @Test
    public void matchStartingExactlyAtAChunkStartBelongsToThatChunk() {
        Automaton automaton = automaton("ef", "def");
        ChunkedScanner scanner = new ChunkedScanner(automaton, 2, executor);

        List<List<MatchRecord>> perChunk = scanner.scan("abcdef");

        // chunk 1 owns [3, 6): "def" starts at 3 and "ef" at 4
        assertTrue(perChunk.get(0).isEmpty());
        assertEquals(Arrays.asList(new MatchRecord(1, 3, 5), new MatchRecord(0, 4, 5)), perChunk.get(1));
    }

    @Test
    public void everyIdOfANodeIsEmitted() {
        Automaton automaton = automaton("his", "is", "his", "s");
        ChunkedScanner scanner = new ChunkedScanner(automaton, 1, null);

        List<List<MatchRecord>> perChunk = scanner.scan("his");

        assertEquals(Arrays.asList(
                new MatchRecord(0, 0, 2),
                new MatchRecord(2, 0, 2),
                new MatchRecord(1, 1, 2),
                new MatchRecord(3, 2, 2)), perChunk.get(0));
    }

    @Test
    public void invalidTextSymbolFailsBeforeAnyChunkIsScanned() {
        ChunkedScanner scanner = new ChunkedScanner(automaton("he"), 4, executor);
        try {
            scanner.scan("the quick");
            fail("expected InvalidAlphabetSymbolException");
        } catch (InvalidAlphabetSymbolException e) {
            assertTrue(e.isInText());
            assertEquals(3, e.getPosition());
        }
    }

    @Test
    public void emptyTextHasNoChunks() {
        assertTrue(new ChunkedScanner(automaton("a"), 4, executor).scan("").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void parallelScannerNeedsAnExecutor() {
        new ChunkedScanner(automaton("a"), 2, null);
    }

    @Test(expected = InvalidWorkerCountException.class)
    public void negativeWorkerCountIsRejected() {
        new ChunkedScanner(automaton("a"), -3, executor);
    }
}
