package software.amazon.pattern.scanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges per-chunk match lists into one result.
 */
final class ResultAggregator {

    private ResultAggregator() { }

    /**
     * Concatenates the chunk lists in chunk order, keeping each chunk's discovery order, then applies {@code order}.
     * The sort for {@link MatchOrder#START_THEN_PATTERN} is stable.
     */
    static List<MatchRecord> aggregate(final List<List<MatchRecord>> perChunk, final MatchOrder order) {
        int total = 0;
        for (List<MatchRecord> matches : perChunk) {
            total += matches.size();
        }
        final List<MatchRecord> result = new ArrayList<>(total);
        for (List<MatchRecord> matches : perChunk) {
            result.addAll(matches);
        }
        if (order == MatchOrder.START_THEN_PATTERN) {
            result.sort(MatchRecord.BY_START_THEN_PATTERN);
        }
        return result;
    }
}
