package software.amazon.pattern.scanner;

/**
 * A RuntimeException that indicates a build or search worker count below one. Worker counts are never clamped.
 */
public class InvalidWorkerCountException extends IllegalArgumentException {

    private final int workerCount;

    public InvalidWorkerCountException(final String name, final int workerCount) {
        super(name + " must be at least 1, got " + workerCount);
        this.workerCount = workerCount;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    static int check(final String name, final int workerCount) {
        if (workerCount < 1) {
            throw new InvalidWorkerCountException(name, workerCount);
        }
        return workerCount;
    }
}
