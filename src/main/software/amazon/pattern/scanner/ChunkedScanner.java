package software.amazon.pattern.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Finds every occurrence of every pattern of an automaton in a text, optionally splitting the work over several
 * workers.
 *
 * The text is cut into {@link Chunk}s. Each worker replays the automaton over its chunk's window starting from the
 * root, and keeps only the matches that start inside the chunk's owned range. Starting from the root loses nothing:
 * recognizing a match that starts at or after the chunk start only ever depends on the symbols from there on. Since
 * owned ranges are disjoint and cover the text, each match is reported by exactly one worker.
 *
 * Each worker writes to its own result list, handed back through its own future; nothing is shared between workers
 * but the read-only automaton and text.
 */
@ThreadSafe
final class ChunkedScanner {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedScanner.class);

    private final Automaton automaton;
    private final int workerCount;

    /**
     * Null when scanning sequentially on the caller's thread.
     */
    private final ExecutorService executor;

    ChunkedScanner(@Nonnull final Automaton automaton, final int workerCount, final ExecutorService executor) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.workerCount = InvalidWorkerCountException.check("searchWorkerCount", workerCount);
        if (workerCount > 1 && executor == null) {
            throw new IllegalArgumentException("An executor is needed for more than one search worker");
        }
        this.executor = executor;
    }

    /**
     * Scans a text and returns the matches of each chunk, in chunk order.
     *
     * @throws software.amazon.pattern.scanner.input.InvalidAlphabetSymbolException if the text holds a symbol
     *         outside the automaton's alphabet; no chunk is scanned in that case
     */
    List<List<MatchRecord>> scan(@Nonnull final CharSequence text) {
        final int[] symbols = automaton.getAlphabet().encodeText(text);
        final List<Chunk> chunks = Chunk.partition(symbols.length, workerCount, automaton.maxPatternLength());
        logger.debug("Scanning {} symbols in {} chunk(s)", symbols.length, chunks.size());

        if (chunks.isEmpty()) {
            return Collections.emptyList();
        }
        if (chunks.size() == 1) {
            return Collections.singletonList(scanChunk(automaton, symbols, chunks.get(0)));
        }

        final List<Callable<List<MatchRecord>>> tasks = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            tasks.add(() -> scanChunk(automaton, symbols, chunk));
        }
        return Workers.invokeAll(executor, tasks);
    }

    /**
     * Replays the automaton over one chunk's window and returns the matches the chunk owns, in discovery order.
     */
    static List<MatchRecord> scanChunk(final Automaton automaton, final int[] symbols, final Chunk chunk) {
        final List<MatchRecord> matches = new ArrayList<>();
        int state = Automaton.ROOT;
        for (int i = chunk.getStart(); i < chunk.getWindowEnd(); i++) {
            state = automaton.next(state, symbols[i]);
            for (int patternId : automaton.outputArray(state)) {
                final int start = i - automaton.getPattern(patternId).length() + 1;
                if (chunk.owns(start)) {
                    matches.add(new MatchRecord(patternId, start, i));
                }
            }
        }
        return matches;
    }
}
