package software.amazon.pattern.scanner.input;

/**
 * A RuntimeException that indicates a pattern or a text contains a symbol the configured alphabet does not declare.
 */
public class InvalidAlphabetSymbolException extends IllegalArgumentException {

    /**
     * Source id used when the offending symbol comes from the scanned text rather than from a pattern.
     */
    public static final int TEXT = -1;

    /**
     * Source id used when a single symbol was looked up outside of any pattern or text.
     */
    public static final int LOOKUP = -2;

    /**
     * Position reported for a single-symbol lookup.
     */
    public static final int NO_POSITION = -1;

    private final char symbol;
    private final int position;
    private final int patternId;

    public InvalidAlphabetSymbolException(final char symbol, final int position, final int patternId) {
        super(describe(symbol, position, patternId));
        this.symbol = symbol;
        this.position = position;
        this.patternId = patternId;
    }

    /**
     * For a symbol looked up on its own, with no pattern or text around it.
     */
    public InvalidAlphabetSymbolException(final char symbol) {
        super(String.format("Symbol '%s' (U+%04X) is not in the alphabet", symbol, (int) symbol));
        this.symbol = symbol;
        this.position = NO_POSITION;
        this.patternId = LOOKUP;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * @return the offset of the symbol inside the pattern or text it was found in, or {@link #NO_POSITION} for a
     *         single-symbol lookup
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the id of the offending pattern, {@link #TEXT} when the symbol was found in the scanned text, or
     *         {@link #LOOKUP} for a single-symbol lookup
     */
    public int getPatternId() {
        return patternId;
    }

    public boolean isInText() {
        return patternId == TEXT;
    }

    private static String describe(final char symbol, final int position, final int patternId) {
        final String source = patternId == TEXT ? "text" : "pattern " + patternId;
        return String.format("Symbol '%s' (U+%04X) at position %d of %s is not in the alphabet",
                symbol, (int) symbol, position, source);
    }
}
