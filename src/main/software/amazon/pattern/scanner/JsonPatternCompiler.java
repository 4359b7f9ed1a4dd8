package software.amazon.pattern.scanner;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a pattern dictionary from JSON. Two forms are accepted, a bare array of strings:
 * <pre>
 *   [ "he", "she", "his", "hers" ]
 * </pre>
 * or an object whose "patterns" field holds that array:
 * <pre>
 *   { "patterns": [ "he", "she", "his", "hers" ] }
 * </pre>
 * The order of the array is the order of the pattern ids. Only the JSON shape is checked here; empty patterns and
 * symbols outside the alphabet are rejected when the automaton is built.
 */
public class JsonPatternCompiler {

    static final String PATTERNS = "patterns";

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a pattern list
     * @param source pattern list, as a String
     * @return null if the list is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern list from its JSON form.
     *
     * @param source pattern list, as a String
     * @return the patterns, in id order
     * @throws IOException if the list isn't syntactically valid
     */
    public static List<String> compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static List<String> doCompile(final JsonParser parser) throws IOException {
        final List<String> patterns;
        try (JsonParser p = parser) {
            final JsonToken first = p.nextToken();
            if (first == JsonToken.START_ARRAY) {
                patterns = parseArray(p);
            } else if (first == JsonToken.START_OBJECT) {
                patterns = parseObject(p);
            } else {
                barf(p, "Pattern list is neither an array nor an object");
                return null;
            }
            if (p.nextToken() != null) {
                barf(p, "Unexpected content after the pattern list");
            }
        }
        return patterns;
    }

    private static List<String> parseObject(final JsonParser parser) throws IOException {
        List<String> patterns = null;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String field = parser.getCurrentName();
            if (!PATTERNS.equals(field)) {
                barf(parser, "Unknown field: " + field);
            }
            if (patterns != null) {
                barf(parser, "\"" + PATTERNS + "\" appears more than once");
            }
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                barf(parser, "\"" + PATTERNS + "\" must be an array");
            }
            patterns = parseArray(parser);
        }
        if (patterns == null) {
            barf(parser, "Missing \"" + PATTERNS + "\" field");
        }
        return patterns;
    }

    private static List<String> parseArray(final JsonParser parser) throws IOException {
        final List<String> patterns = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.VALUE_STRING) {
                barf(parser, "Pattern " + patterns.size() + " is not a string");
            }
            patterns.add(parser.getText());
        }
        return patterns;
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
