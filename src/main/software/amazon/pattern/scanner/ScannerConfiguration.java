package software.amazon.pattern.scanner;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import software.amazon.pattern.scanner.input.Alphabet;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Configuration for a PatternScanner.
 */
@Immutable
public class ScannerConfiguration {

    static final String ALPHABET = "alphabet";
    static final String BUILD_WORKER_COUNT = "buildWorkerCount";
    static final String SEARCH_WORKER_COUNT = "searchWorkerCount";
    static final String MATCH_ORDER = "matchOrder";

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private final Alphabet alphabet;

    /**
     * Workers resolving one trie level at a time while the automaton is built.
     */
    private final int buildWorkerCount;

    /**
     * Workers scanning chunks of the text. The scanner keeps a pool of this many threads.
     */
    private final int searchWorkerCount;

    private final MatchOrder matchOrder;

    private ScannerConfiguration(Alphabet alphabet, int buildWorkerCount, int searchWorkerCount,
                                 MatchOrder matchOrder) {
        this.alphabet = alphabet;
        this.buildWorkerCount = buildWorkerCount;
        this.searchWorkerCount = searchWorkerCount;
        this.matchOrder = matchOrder;
    }

    public static ScannerConfiguration defaults() {
        return new Builder().build();
    }

    /**
     * Reads a configuration from a JSON object such as
     * <pre>
     * {@code
     *   { "alphabet": "acgt", "buildWorkerCount": 2, "searchWorkerCount": 8, "matchOrder": "START_THEN_PATTERN" }
     * }
     * </pre>
     * Every field is optional; missing fields keep their defaults. Unknown fields are rejected.
     *
     * @param json the configuration
     * @return the configuration
     * @throws IOException if the JSON is malformed or holds an unknown field or a value of the wrong type
     * @throws InvalidWorkerCountException if a worker count is below one
     */
    public static ScannerConfiguration fromJson(@Nonnull final String json) throws IOException {
        return parse(JSON_FACTORY.createParser(json));
    }

    public static ScannerConfiguration fromJson(@Nonnull final Reader json) throws IOException {
        return parse(JSON_FACTORY.createParser(json));
    }

    private static ScannerConfiguration parse(final JsonParser parser) throws IOException {
        final Builder builder = new Builder();
        try (JsonParser p = parser) {
            if (p.nextToken() != JsonToken.START_OBJECT) {
                barf(p, "Configuration is not an object");
            }
            while (p.nextToken() != JsonToken.END_OBJECT) {
                final String field = p.getCurrentName();
                final JsonToken value = p.nextToken();
                switch (field) {
                case ALPHABET:
                    expect(p, value, JsonToken.VALUE_STRING, field);
                    try {
                        builder.withAlphabet(Alphabet.of(p.getText()));
                    } catch (IllegalArgumentException e) {
                        barf(p, e.getMessage());
                    }
                    break;
                case BUILD_WORKER_COUNT:
                    expect(p, value, JsonToken.VALUE_NUMBER_INT, field);
                    builder.withBuildWorkerCount(p.getIntValue());
                    break;
                case SEARCH_WORKER_COUNT:
                    expect(p, value, JsonToken.VALUE_NUMBER_INT, field);
                    builder.withSearchWorkerCount(p.getIntValue());
                    break;
                case MATCH_ORDER:
                    expect(p, value, JsonToken.VALUE_STRING, field);
                    try {
                        builder.withMatchOrder(MatchOrder.valueOf(p.getText()));
                    } catch (IllegalArgumentException e) {
                        barf(p, "Unknown match order: " + p.getText());
                    }
                    break;
                default:
                    barf(p, "Unknown configuration field: " + field);
                }
            }
        }
        return builder.build();
    }

    private static void expect(final JsonParser parser, final JsonToken actual, final JsonToken expected,
                               final String field) throws JsonParseException {
        if (actual != expected) {
            barf(parser, "\"" + field + "\" must be " + (expected == JsonToken.VALUE_STRING ? "a string" : "an integer"));
        }
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }

    public Alphabet getAlphabet() {
        return alphabet;
    }

    public int getBuildWorkerCount() {
        return buildWorkerCount;
    }

    public int getSearchWorkerCount() {
        return searchWorkerCount;
    }

    public MatchOrder getMatchOrder() {
        return matchOrder;
    }

    @Override
    public String toString() {
        return "ScannerConfiguration{alphabet=" + alphabet.getSymbols() + ", buildWorkerCount=" + buildWorkerCount
                + ", searchWorkerCount=" + searchWorkerCount + ", matchOrder=" + matchOrder + "}";
    }

    public static class Builder {

        private Alphabet alphabet = Alphabet.lowercaseLatin();
        private int buildWorkerCount = 1;
        private int searchWorkerCount = 1;
        private MatchOrder matchOrder = MatchOrder.DISCOVERY;

        public Builder withAlphabet(@Nonnull Alphabet alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
            return this;
        }

        public Builder withBuildWorkerCount(int buildWorkerCount) {
            this.buildWorkerCount = InvalidWorkerCountException.check(BUILD_WORKER_COUNT, buildWorkerCount);
            return this;
        }

        public Builder withSearchWorkerCount(int searchWorkerCount) {
            this.searchWorkerCount = InvalidWorkerCountException.check(SEARCH_WORKER_COUNT, searchWorkerCount);
            return this;
        }

        public Builder withMatchOrder(@Nonnull MatchOrder matchOrder) {
            this.matchOrder = Objects.requireNonNull(matchOrder, "matchOrder");
            return this;
        }

        public ScannerConfiguration build() {
            return new ScannerConfiguration(alphabet, buildWorkerCount, searchWorkerCount, matchOrder);
        }
    }
}
