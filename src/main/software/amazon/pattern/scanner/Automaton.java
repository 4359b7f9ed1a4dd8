package software.amazon.pattern.scanner;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.pattern.scanner.input.Alphabet;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 *  An Aho-Corasick automaton over a fixed dictionary of patterns. States are node indices into a single arena; the
 *  root is {@link #ROOT}. Three functions are exposed:
 *  <ul>
 *  <li>goto ({@link #next}): total, every state has a next state for every symbol of the alphabet. It follows the
 *  explicit trie edge if there is one, and otherwise goes where the failure links would lead.</li>
 *  <li>failure ({@link #failure}): the state for the longest proper suffix of this state's string that is also a
 *  prefix of some pattern.</li>
 *  <li>output ({@link #outputs}): the ids of the patterns ending at this state, including the ones inherited along
 *  the failure links.</li>
 *  </ul>
 *  The automaton is never modified after it is built, so any number of threads can scan with it concurrently without
 *  any locking.
 */
@Immutable
@ThreadSafe
public final class Automaton {

    public static final int ROOT = NodeArena.ROOT;
    public static final int NO_NODE = NodeArena.NO_NODE;

    private static final Logger logger = LoggerFactory.getLogger(Automaton.class);

    private final Alphabet alphabet;
    private final List<Pattern> patterns;
    private final int alphabetSize;
    private final int maxPatternLength;

    private final int[] children;
    private final int[] transitions;
    private final int[] failureLinks;
    private final int[] depths;
    private final int[][] localOutputs;
    private final int[][] outputs;

    private Automaton(final Alphabet alphabet, final List<Pattern> patterns, final NodeArena arena) {
        this.alphabet = alphabet;
        this.patterns = patterns;
        this.alphabetSize = alphabet.size();
        int longest = 0;
        for (Pattern pattern : patterns) {
            longest = Math.max(longest, pattern.length());
        }
        this.maxPatternLength = longest;
        this.children = arena.childrenTable();
        this.transitions = arena.transitions();
        this.failureLinks = arena.failureLinks();
        this.depths = arena.depthTable();
        this.localOutputs = arena.localOutputTable();
        this.outputs = arena.outputs();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The next state from {@code state} on the symbol with index {@code symbol}. Defined for every state and symbol.
     */
    public int next(final int state, final int symbol) {
        return transitions[state * alphabetSize + symbol];
    }

    /**
     * The explicit trie child of {@code state} on {@code symbol}, or {@link #NO_NODE}.
     */
    public int child(final int state, final int symbol) {
        return children[state * alphabetSize + symbol];
    }

    public int failure(final int state) {
        return failureLinks[state];
    }

    /**
     * Distance from the root, which is also the length of the string this state stands for.
     */
    public int depth(final int state) {
        return depths[state];
    }

    /**
     * Ids of the patterns ending at {@code state}, including those inherited via failure links. Local ids come first,
     * in insertion order.
     */
    public IntList outputs(final int state) {
        return IntLists.unmodifiable(IntArrayList.wrap(outputs[state]));
    }

    /**
     * Ids of the patterns whose last symbol is exactly this state.
     */
    public IntList localOutputs(final int state) {
        return IntLists.unmodifiable(IntArrayList.wrap(localOutputs[state]));
    }

    /*
     * Scanning hot path, no wrapping. Callers must not modify the array.
     */
    int[] outputArray(final int state) {
        return outputs[state];
    }

    public int nodeCount() {
        return depths.length;
    }

    public Pattern getPattern(final int patternId) {
        return patterns.get(patternId);
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    public int patternCount() {
        return patterns.size();
    }

    public int maxPatternLength() {
        return maxPatternLength;
    }

    public Alphabet getAlphabet() {
        return alphabet;
    }

    public static class Builder {

        private Alphabet alphabet = Alphabet.lowercaseLatin();
        private int buildWorkerCount = 1;
        private final List<String> patterns = new ArrayList<>();

        Builder() {}

        public Builder withAlphabet(@Nonnull Alphabet alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
            return this;
        }

        /**
         * Number of workers resolving each level of the trie. One means fully sequential; any count builds the same
         * automaton.
         */
        public Builder withBuildWorkerCount(int buildWorkerCount) {
            this.buildWorkerCount = InvalidWorkerCountException.check("buildWorkerCount", buildWorkerCount);
            return this;
        }

        /**
         * Appends a pattern. Its id is the number of patterns added before it.
         */
        public Builder addPattern(@Nonnull String pattern) {
            patterns.add(Objects.requireNonNull(pattern, "pattern"));
            return this;
        }

        public Builder addPatterns(@Nonnull Collection<String> patterns) {
            for (String pattern : patterns) {
                addPattern(pattern);
            }
            return this;
        }

        /**
         * Builds the automaton. Validation happens before any node is created.
         *
         * @throws EmptyPatternException if a pattern is empty
         * @throws software.amazon.pattern.scanner.input.InvalidAlphabetSymbolException if a pattern holds a symbol
         *         outside the alphabet
         */
        public Automaton build() {
            final List<Pattern> dictionary = new ArrayList<>(patterns.size());
            for (int id = 0; id < patterns.size(); id++) {
                dictionary.add(new Pattern(id, patterns.get(id)));
            }

            final NodeArena arena = TrieBuilder.build(alphabet, dictionary);
            new FailureLinkPropagator(buildWorkerCount).propagate(arena);

            logger.debug("Built automaton with {} patterns, {} nodes over {}",
                    dictionary.size(), arena.nodeCount(), alphabet);
            return new Automaton(alphabet, Collections.unmodifiableList(dictionary), arena);
        }
    }
}
