package software.amazon.pattern.scanner.jmh;

import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A fixed pseudo-random dictionary and text over a four letter alphabet, so that matches are dense.
 */
@State(Scope.Benchmark)
public class CorpusState {

    public static final String SYMBOLS = "acgt";
    public static final int PATTERN_COUNT = 10_000;
    public static final int MAX_PATTERN_LENGTH = 12;
    public static final int TEXT_LENGTH = 4_000_000;

    private static final List<String> patterns = new ArrayList<>(PATTERN_COUNT);
    private static final String text;

    static {
        Random random = new Random(20240601L);
        for (int i = 0; i < PATTERN_COUNT; i++) {
            patterns.add(randomString(random, 4 + random.nextInt(MAX_PATTERN_LENGTH - 3)));
        }
        text = randomString(random, TEXT_LENGTH);
    }

    private static String randomString(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(SYMBOLS.charAt(random.nextInt(SYMBOLS.length())));
        }
        return sb.toString();
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public String getText() {
        return text;
    }
}
