package software.amazon.pattern.scanner.input;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Objects;

/**
 * Maps the symbols of a finite, explicitly declared alphabet to the dense index range {@code [0, size)}. Indices are
 * assigned in declaration order. Lookups are bounds-checked: a symbol the alphabet does not declare is rejected with an
 * {@link InvalidAlphabetSymbolException} rather than being folded into some other index.
 */
@Immutable
@ThreadSafe
public final class Alphabet {

    public static final int NOT_IN_ALPHABET = -1;

    private static final Alphabet LOWERCASE_LATIN = of("abcdefghijklmnopqrstuvwxyz");

    private final String symbols;

    /**
     * Indexed by char value, sized to the highest declared symbol. Holds NOT_IN_ALPHABET for undeclared chars.
     */
    private final int[] indexBySymbol;

    private Alphabet(final String symbols, final int[] indexBySymbol) {
        this.symbols = symbols;
        this.indexBySymbol = indexBySymbol;
    }

    /**
     * The 26-symbol alphabet {@code a..z}.
     */
    public static Alphabet lowercaseLatin() {
        return LOWERCASE_LATIN;
    }

    /**
     * Creates an alphabet from its symbols, in index order.
     *
     * @param symbols the symbols; must be non-empty and free of duplicates
     * @return the alphabet
     * @throws IllegalArgumentException if {@code symbols} is empty or declares a symbol twice
     */
    public static Alphabet of(@Nonnull final String symbols) {
        Objects.requireNonNull(symbols, "symbols");
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("An alphabet needs at least one symbol");
        }

        char highest = 0;
        for (int i = 0; i < symbols.length(); i++) {
            highest = (char) Math.max(highest, symbols.charAt(i));
        }

        final int[] indexBySymbol = new int[highest + 1];
        Arrays.fill(indexBySymbol, NOT_IN_ALPHABET);
        for (int i = 0; i < symbols.length(); i++) {
            final char symbol = symbols.charAt(i);
            if (indexBySymbol[symbol] != NOT_IN_ALPHABET) {
                throw new IllegalArgumentException("Symbol '" + symbol + "' is declared more than once");
            }
            indexBySymbol[symbol] = i;
        }
        return new Alphabet(symbols, indexBySymbol);
    }

    public int size() {
        return symbols.length();
    }

    public boolean contains(final char symbol) {
        return symbol < indexBySymbol.length && indexBySymbol[symbol] != NOT_IN_ALPHABET;
    }

    /**
     * Returns the dense index of a symbol.
     *
     * @param symbol the symbol to look up
     * @return its index in {@code [0, size)}
     * @throws InvalidAlphabetSymbolException if the alphabet does not declare {@code symbol}
     */
    public int indexOf(final char symbol) {
        final int index = lookup(symbol);
        if (index == NOT_IN_ALPHABET) {
            throw new InvalidAlphabetSymbolException(symbol);
        }
        return index;
    }

    public char symbolAt(final int index) {
        return symbols.charAt(index);
    }

    public String getSymbols() {
        return symbols;
    }

    /**
     * Encodes a pattern into symbol indices.
     *
     * @param patternId the id reported if the pattern holds an undeclared symbol
     * @param pattern the pattern text
     * @return one index per symbol
     * @throws InvalidAlphabetSymbolException at the first undeclared symbol
     */
    public int[] encodePattern(final int patternId, @Nonnull final CharSequence pattern) {
        return encode(pattern, patternId);
    }

    /**
     * Encodes a text into symbol indices.
     *
     * @param text the text to scan
     * @return one index per symbol
     * @throws InvalidAlphabetSymbolException at the first undeclared symbol
     */
    public int[] encodeText(@Nonnull final CharSequence text) {
        return encode(text, InvalidAlphabetSymbolException.TEXT);
    }

    private int[] encode(final CharSequence sequence, final int patternId) {
        final int[] encoded = new int[sequence.length()];
        for (int i = 0; i < encoded.length; i++) {
            final char symbol = sequence.charAt(i);
            final int index = lookup(symbol);
            if (index == NOT_IN_ALPHABET) {
                throw new InvalidAlphabetSymbolException(symbol, i, patternId);
            }
            encoded[i] = index;
        }
        return encoded;
    }

    private int lookup(final char symbol) {
        return symbol < indexBySymbol.length ? indexBySymbol[symbol] : NOT_IN_ALPHABET;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return symbols.equals(((Alphabet) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "Alphabet{" + symbols + "}";
    }
}
