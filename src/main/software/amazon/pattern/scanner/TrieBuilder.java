package software.amazon.pattern.scanner;

import software.amazon.pattern.scanner.input.Alphabet;

import java.util.List;

/**
 * Inserts a dictionary into a prefix tree. Patterns sharing a prefix share the corresponding path, and the node where
 * a pattern ends records the pattern's id in its local output.
 */
final class TrieBuilder {

    private TrieBuilder() { }

    /**
     * Builds the trie. Every pattern is validated before the first insertion, so a rejected dictionary leaves nothing
     * behind.
     *
     * @param alphabet the alphabet patterns are encoded with
     * @param patterns the dictionary, in id order
     * @return an arena holding the trie
     * @throws EmptyPatternException if a pattern has no symbols
     * @throws software.amazon.pattern.scanner.input.InvalidAlphabetSymbolException if a pattern holds a symbol the
     *         alphabet does not declare
     */
    static NodeArena build(final Alphabet alphabet, final List<Pattern> patterns) {
        final int[][] encoded = new int[patterns.size()][];
        for (Pattern pattern : patterns) {
            if (pattern.length() == 0) {
                throw new EmptyPatternException(pattern.getId());
            }
            encoded[pattern.getId()] = alphabet.encodePattern(pattern.getId(), pattern.getText());
        }

        final NodeArena arena = new NodeArena(alphabet.size());
        for (int id = 0; id < encoded.length; id++) {
            insert(arena, encoded[id], id);
        }
        return arena;
    }

    private static void insert(final NodeArena arena, final int[] symbols, final int patternId) {
        int node = NodeArena.ROOT;
        for (int depth = 0; depth < symbols.length; depth++) {
            int next = arena.child(node, symbols[depth]);
            if (next == NodeArena.NO_NODE) {
                next = arena.addNode(depth + 1);
                arena.setChild(node, symbols[depth], next);
            }
            node = next;
        }
        arena.addLocalOutput(node, patternId);
    }
}
