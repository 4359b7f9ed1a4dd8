package software.amazon.pattern.scanner.input;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Prepares raw text for scanning. A character the alphabet declares is kept as is, a letter the alphabet only declares
 * in lower case is lower-cased, and anything else (digits, punctuation, whitespace, line breaks) is dropped. The result
 * is safe to hand to a scanner built over the same alphabet. Note that dropping characters shifts offsets, so match
 * positions refer to the normalized text.
 */
@Immutable
@ThreadSafe
public final class TextNormalizer {

    private static final int BUFFER_SIZE = 8192;

    private final Alphabet alphabet;

    public TextNormalizer(@Nonnull final Alphabet alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
    }

    public String normalize(@Nonnull final CharSequence raw) {
        final StringBuilder sb = new StringBuilder(raw.length());
        append(raw, 0, raw.length(), sb);
        return sb.toString();
    }

    public String normalize(@Nonnull final Reader reader) throws IOException {
        final StringBuilder sb = new StringBuilder();
        final char[] buffer = new char[BUFFER_SIZE];
        int read;
        while ((read = reader.read(buffer)) != -1) {
            append(CharBuffer.wrap(buffer), 0, read, sb);
        }
        return sb.toString();
    }

    /**
     * Reads and normalizes a UTF-8 file.
     */
    public String normalize(@Nonnull final Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return normalize(reader);
        }
    }

    private void append(final CharSequence chars, final int from, final int to, final StringBuilder sb) {
        for (int i = from; i < to; i++) {
            final char c = chars.charAt(i);
            if (alphabet.contains(c)) {
                sb.append(c);
            } else {
                final char lower = Character.toLowerCase(c);
                if (lower != c && alphabet.contains(lower)) {
                    sb.append(lower);
                }
            }
        }
    }
}
