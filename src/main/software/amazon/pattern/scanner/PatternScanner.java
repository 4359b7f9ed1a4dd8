package software.amazon.pattern.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The core idea of the scanner is to find every occurrence of a whole dictionary of patterns in a text in a single
 *  pass, at a rate that's independent of the number of patterns. This is achieved by compiling the patterns into an
 *  Aho-Corasick automaton up front.
 * A scanner is compiled once from a fixed list of patterns and a {@link ScannerConfiguration}, and can then scan any
 *  number of texts, from any number of threads. Scans are split over the configured number of search workers; the
 *  result is the same for every worker count.
 * A scanner with more than one search worker holds a thread pool and should be closed when no longer needed. A closed
 *  scanner refuses to scan, whatever its worker count.
 */
@ThreadSafe
public class PatternScanner implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PatternScanner.class);

    private final Automaton automaton;
    private final ScannerConfiguration configuration;
    private final ExecutorService executor;
    private final ChunkedScanner scanner;
    private final AtomicBoolean closed = new AtomicBoolean();

    private PatternScanner(final Automaton automaton, final ScannerConfiguration configuration) {
        this.automaton = automaton;
        this.configuration = configuration;
        this.executor = configuration.getSearchWorkerCount() > 1
                ? Workers.newFixedPool(configuration.getSearchWorkerCount(), "pattern-scan") : null;
        this.scanner = new ChunkedScanner(automaton, configuration.getSearchWorkerCount(), executor);
    }

    /**
     * Compile a list of patterns into a scanner. Pattern ids are positions in the list.
     *
     * @param patterns the dictionary; every pattern must be non-empty and spelled in the configured alphabet
     * @param configuration alphabet, worker counts and result order
     * @return the scanner
     * @throws EmptyPatternException if a pattern is empty
     * @throws software.amazon.pattern.scanner.input.InvalidAlphabetSymbolException if a pattern holds a symbol
     *         outside the alphabet
     */
    public static PatternScanner compile(@Nonnull final Collection<String> patterns,
                                         @Nonnull final ScannerConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        final Automaton automaton = Automaton.builder()
                .withAlphabet(configuration.getAlphabet())
                .withBuildWorkerCount(configuration.getBuildWorkerCount())
                .addPatterns(Objects.requireNonNull(patterns, "patterns"))
                .build();
        logger.debug("Compiled {} patterns with {}", automaton.patternCount(), configuration);
        return new PatternScanner(automaton, configuration);
    }

    public static PatternScanner compile(@Nonnull final Collection<String> patterns) {
        return compile(patterns, ScannerConfiguration.defaults());
    }

    /**
     * Return every occurrence of every pattern in a text, sequentially and with the default configuration. This is
     * a thin wrapper around compile and scan.
     *
     * @param patterns the dictionary
     * @param text the text, over the lower-case Latin alphabet
     * @return the matches, in discovery order
     */
    public static List<MatchRecord> findAll(@Nonnull final Collection<String> patterns,
                                            @Nonnull final CharSequence text) {
        try (PatternScanner scanner = compile(patterns)) {
            return scanner.scan(text);
        }
    }

    /**
     * Return every occurrence of every pattern in the text.
     *
     * @param text the text; every symbol must be in the configured alphabet
     * @return the matches, ordered as configured. The list may be empty but never null.
     * @throws software.amazon.pattern.scanner.input.InvalidAlphabetSymbolException if the text holds a symbol
     *         outside the alphabet
     * @throws IllegalStateException if the scanner has been closed
     */
    public List<MatchRecord> scan(@Nonnull final CharSequence text) {
        Objects.requireNonNull(text, "text");
        if (closed.get()) {
            throw new IllegalStateException("Scanner is closed");
        }
        return ResultAggregator.aggregate(scanner.scan(text), configuration.getMatchOrder());
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public ScannerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Releases the search workers. Every later call to {@link #scan} fails with an IllegalStateException; scans
     * already running finish normally. Closing twice has no further effect.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && executor != null) {
            executor.shutdown();
        }
    }
}
