package software.amazon.pattern.scanner;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * The mutable node store an {@link Automaton} is built in. Nodes are addressed by index, the root is node 0, and each
 * node owns one row of {@code alphabetSize} entries in the children table. An entry holds the index of the explicit
 * trie child on that symbol, or {@link #NO_NODE}.
 *
 * The trie builder is the only writer of the children table, the depths and the local outputs. The failure-link
 * propagator then fills the goto table, the failure links and the effective outputs, after which the arena is frozen
 * into an Automaton and dropped.
 */
final class NodeArena {

    static final int ROOT = 0;
    static final int NO_NODE = -1;

    private static final int[] NO_OUTPUT = new int[0];

    private final int alphabetSize;

    private final IntArrayList children = new IntArrayList();
    private final IntArrayList depths = new IntArrayList();

    /**
     * Pattern ids ending exactly at a node, in insertion order. Only terminal nodes have an entry.
     */
    private final Int2ObjectOpenHashMap<IntArrayList> localOutputs = new Int2ObjectOpenHashMap<>();

    // filled in by FailureLinkPropagator
    private int[] transitions;
    private int[] failureLinks;
    private int[][] outputs;

    NodeArena(final int alphabetSize) {
        this.alphabetSize = alphabetSize;
        addNode(0);
    }

    int alphabetSize() {
        return alphabetSize;
    }

    int nodeCount() {
        return depths.size();
    }

    int addNode(final int depth) {
        final int node = depths.size();
        depths.add(depth);
        for (int i = 0; i < alphabetSize; i++) {
            children.add(NO_NODE);
        }
        return node;
    }

    int child(final int node, final int symbol) {
        return children.getInt(node * alphabetSize + symbol);
    }

    void setChild(final int node, final int symbol, final int child) {
        children.set(node * alphabetSize + symbol, child);
    }

    int depth(final int node) {
        return depths.getInt(node);
    }

    void addLocalOutput(final int node, final int patternId) {
        IntArrayList ids = localOutputs.get(node);
        if (ids == null) {
            ids = new IntArrayList(1);
            localOutputs.put(node, ids);
        }
        ids.add(patternId);
    }

    int[] localOutputs(final int node) {
        final IntArrayList ids = localOutputs.get(node);
        return ids == null ? NO_OUTPUT : ids.toIntArray();
    }

    int[] childrenTable() {
        return children.toIntArray();
    }

    int[] depthTable() {
        return depths.toIntArray();
    }

    /**
     * Allocates the tables the propagator writes. The goto table starts as a copy of the children table.
     */
    void prepareForPropagation() {
        transitions = children.toIntArray();
        failureLinks = new int[nodeCount()];
        outputs = new int[nodeCount()][];
    }

    int[] transitions() {
        return transitions;
    }

    int[] failureLinks() {
        return failureLinks;
    }

    int[][] outputs() {
        return outputs;
    }

    int[][] localOutputTable() {
        final int[][] table = new int[nodeCount()][];
        for (int node = 0; node < table.length; node++) {
            table[node] = localOutputs(node);
        }
        return table;
    }
}
