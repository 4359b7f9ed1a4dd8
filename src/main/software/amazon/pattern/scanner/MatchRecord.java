package software.amazon.pattern.scanner;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Comparator;

/**
 * One occurrence of a pattern in a scanned text. Indices are 0-based and the end index is inclusive.
 */
@Immutable
@ThreadSafe
public final class MatchRecord {

    /**
     * Orders by start index, then by pattern id.
     */
    public static final Comparator<MatchRecord> BY_START_THEN_PATTERN =
            Comparator.comparingInt(MatchRecord::getStartIndex).thenComparingInt(MatchRecord::getPatternId);

    private final int patternId;
    private final int startIndex;
    private final int endIndex;

    public MatchRecord(final int patternId, final int startIndex, final int endIndex) {
        this.patternId = patternId;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
    }

    public int getPatternId() {
        return patternId;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public int length() {
        return endIndex - startIndex + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MatchRecord that = (MatchRecord) o;
        return patternId == that.patternId && startIndex == that.startIndex && endIndex == that.endIndex;
    }

    @Override
    public int hashCode() {
        int result = patternId;
        result = 31 * result + startIndex;
        result = 31 * result + endIndex;
        return result;
    }

    @Override
    public String toString() {
        return "MatchRecord{patternId=" + patternId + ", start=" + startIndex + ", end=" + endIndex + "}";
    }
}
