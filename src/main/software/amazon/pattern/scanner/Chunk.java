package software.amazon.pattern.scanner;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

/**
 * The span of text one scan worker is responsible for. A chunk owns {@code [start, ownedEnd)}: it reports exactly the
 * matches whose start index falls in there. It reads further, up to {@code windowEnd}, so that a match starting near
 * the end of the owned range can still be completed.
 */
@Immutable
@ThreadSafe
public final class Chunk {

    private final int index;
    private final int start;
    private final int ownedEnd;
    private final int windowEnd;

    Chunk(final int index, final int start, final int ownedEnd, final int windowEnd) {
        this.index = index;
        this.start = start;
        this.ownedEnd = ownedEnd;
        this.windowEnd = windowEnd;
    }

    /**
     * Cuts {@code [0, textLength)} into {@code workerCount} contiguous chunks of nominal size
     * {@code ceil(textLength / workerCount)}. Each chunk reads {@code maxPatternLength - 1} symbols past the end of
     * what it owns, clipped to the text. Chunks that would start at or beyond the end of the text are left out, so
     * short texts get fewer chunks than workers, and an empty text gets none.
     *
     * @param textLength number of symbols in the text
     * @param workerCount number of workers, at least 1
     * @param maxPatternLength length of the longest pattern
     * @return the chunks, in text order
     */
    public static List<Chunk> partition(final int textLength, final int workerCount, final int maxPatternLength) {
        InvalidWorkerCountException.check("searchWorkerCount", workerCount);
        if (textLength < 0) {
            throw new IllegalArgumentException("textLength must not be negative");
        }
        final List<Chunk> chunks = new ArrayList<>(workerCount);
        if (textLength == 0) {
            return chunks;
        }

        final int chunkSize = (int) (((long) textLength + workerCount - 1) / workerCount);
        final int overlap = Math.max(maxPatternLength - 1, 0);
        for (int i = 0; i < workerCount; i++) {
            final long start = (long) i * chunkSize;
            if (start >= textLength) {
                break;
            }
            final int ownedEnd = (int) Math.min(start + chunkSize, textLength);
            final int windowEnd = (int) Math.min(start + chunkSize + overlap, textLength);
            chunks.add(new Chunk(i, (int) start, ownedEnd, windowEnd));
        }
        return chunks;
    }

    public int getIndex() {
        return index;
    }

    public int getStart() {
        return start;
    }

    public int getOwnedEnd() {
        return ownedEnd;
    }

    public int getWindowEnd() {
        return windowEnd;
    }

    public boolean owns(final int position) {
        return position >= start && position < ownedEnd;
    }

    @Override
    public String toString() {
        return "Chunk{" + index + ": owns [" + start + ", " + ownedEnd + "), reads to " + windowEnd + "}";
    }
}
