package software.amazon.pattern.scanner;

/**
 * How the aggregated match list is ordered.
 */
public enum MatchOrder {
    /**
     * Chunk order, and within a chunk the order in which matches were discovered (by end index, then by the order of
     * the ids in the node's output).
     */
    DISCOVERY,

    /**
     * Stable sort of the discovery order by start index, then by pattern id.
     */
    START_THEN_PATTERN
}
