package software.amazon.pattern.scanner;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Turns a trie into an automaton: assigns every node its failure link and effective output, and completes the goto
 * table so that every node has a next node for every symbol.
 *
 * Nodes are resolved level by level. Resolving node n writes the failure links and effective outputs of n's explicit
 * children and the missing entries of n's own goto row. All of that reads only nodes shallower than n's children,
 * which were resolved while processing an earlier level, so the nodes of one level are independent of each other.
 * With more than one worker, each level's frontier is cut into contiguous slices, one per worker. A worker collects
 * the children it discovers in a private buffer and the buffers are concatenated in slice order once the whole level
 * is done. That gives the same next frontier, in the same order, as a single worker.
 */
final class FailureLinkPropagator {

    private static final Logger logger = LoggerFactory.getLogger(FailureLinkPropagator.class);

    private final int workerCount;

    FailureLinkPropagator(final int workerCount) {
        this.workerCount = InvalidWorkerCountException.check("buildWorkerCount", workerCount);
    }

    void propagate(final NodeArena arena) {
        arena.prepareForPropagation();
        totalizeRoot(arena);

        final ExecutorService executor = workerCount > 1
                ? Workers.newFixedPool(workerCount, "automaton-build") : null;
        try {
            IntArrayList frontier = IntArrayList.wrap(new int[] { NodeArena.ROOT });
            int level = 0;
            while (!frontier.isEmpty()) {
                if (logger.isTraceEnabled()) {
                    logger.trace("Resolving level {} with {} nodes", level, frontier.size());
                }
                frontier = executor == null || frontier.size() < 2
                        ? resolveSlice(arena, frontier, 0, frontier.size())
                        : resolveLevelInParallel(arena, frontier, executor);
                level++;
            }
            logger.debug("Propagated failure links over {} nodes and {} levels with {} worker(s)",
                    arena.nodeCount(), level, workerCount);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    /*
     * The root is its own failure link, and every symbol without an explicit child loops back to the root. This is
     * what stops every failure-chain walk at the root.
     */
    private static void totalizeRoot(final NodeArena arena) {
        final int[] transitions = arena.transitions();
        for (int symbol = 0; symbol < arena.alphabetSize(); symbol++) {
            if (transitions[symbol] == NodeArena.NO_NODE) {
                transitions[symbol] = NodeArena.ROOT;
            }
        }
        arena.failureLinks()[NodeArena.ROOT] = NodeArena.ROOT;
        arena.outputs()[NodeArena.ROOT] = arena.localOutputs(NodeArena.ROOT);
    }

    private IntArrayList resolveLevelInParallel(final NodeArena arena, final IntArrayList frontier,
                                                final ExecutorService executor) {
        final int slices = Math.min(workerCount, frontier.size());
        final int sliceSize = (frontier.size() + slices - 1) / slices;

        final List<Callable<IntArrayList>> tasks = new ArrayList<>(slices);
        for (int from = 0; from < frontier.size(); from += sliceSize) {
            final int start = from;
            final int end = Math.min(from + sliceSize, frontier.size());
            tasks.add(() -> resolveSlice(arena, frontier, start, end));
        }

        // barrier: the next level starts only once every slice of this one is resolved
        final List<IntArrayList> discovered = Workers.invokeAll(executor, tasks);

        int total = 0;
        for (IntArrayList buffer : discovered) {
            total += buffer.size();
        }
        final IntArrayList next = new IntArrayList(total);
        for (IntArrayList buffer : discovered) {
            next.addAll(buffer);
        }
        return next;
    }

    /**
     * Resolves the nodes {@code frontier[from, to)} and returns their explicit children, in discovery order.
     */
    private static IntArrayList resolveSlice(final NodeArena arena, final IntArrayList frontier,
                                             final int from, final int to) {
        final IntArrayList discovered = new IntArrayList();
        for (int i = from; i < to; i++) {
            resolve(arena, frontier.getInt(i), discovered);
        }
        return discovered;
    }

    private static void resolve(final NodeArena arena, final int node, final IntArrayList discovered) {
        final int alphabetSize = arena.alphabetSize();
        final int[] transitions = arena.transitions();
        final int[] failureLinks = arena.failureLinks();
        final int[][] outputs = arena.outputs();
        final int row = node * alphabetSize;
        final int failureRow = failureLinks[node] * alphabetSize;

        for (int symbol = 0; symbol < alphabetSize; symbol++) {
            final int child = arena.child(node, symbol);
            if (child != NodeArena.NO_NODE) {
                final int failure = node == NodeArena.ROOT
                        ? NodeArena.ROOT
                        : followFailureChain(arena, failureLinks[node], symbol);
                failureLinks[child] = failure;
                outputs[child] = union(arena.localOutputs(child), outputs[failure]);
                discovered.add(child);
            } else if (node != NodeArena.ROOT) {
                // the failure node is shallower, its row is already complete
                transitions[row + symbol] = transitions[failureRow + symbol];
            }
        }
    }

    /**
     * Walks a resolved failure chain, starting at {@code state}, until a node with an explicit child on
     * {@code symbol} is found, and returns that child. The totalized root row ends every walk.
     */
    private static int followFailureChain(final NodeArena arena, int state, final int symbol) {
        while (state != NodeArena.ROOT) {
            final int child = arena.child(state, symbol);
            if (child != NodeArena.NO_NODE) {
                return child;
            }
            state = arena.failureLinks()[state];
        }
        return arena.transitions()[symbol];
    }

    /*
     * A pattern id is only ever output at nodes as deep as the pattern is long, and a failure target is always
     * shallower than its source, so local and inherited ids never overlap.
     */
    private static int[] union(final int[] local, final int[] inherited) {
        if (inherited.length == 0) {
            return local;
        }
        if (local.length == 0) {
            return inherited;
        }
        final int[] union = new int[local.length + inherited.length];
        System.arraycopy(local, 0, union, 0, local.length);
        System.arraycopy(inherited, 0, union, local.length, inherited.length);
        return union;
    }
}
