package software.amazon.pattern.scanner;

/**
 * A RuntimeException that indicates a zero-length pattern was offered to the trie builder.
 */
public class EmptyPatternException extends IllegalArgumentException {

    private final int patternId;

    public EmptyPatternException(final int patternId) {
        super("Pattern " + patternId + " is empty");
        this.patternId = patternId;
    }

    public int getPatternId() {
        return patternId;
    }
}
