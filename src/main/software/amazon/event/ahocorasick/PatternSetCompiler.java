package software.amazon.event.ahocorasick;

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
 * Compiles a pattern set described by a JSON document into an {@link Automaton}. The document looks like:
 * <pre>
 * {@code
 *   {
 *     "caseInsensitive": true,
 *     "pruneFailureLinks": true,
 *     "patterns": [ "he", "she", { "pattern": "hers", "payload": "tag-1" } ]
 *   }
 * }
 * </pre>
 * Only "patterns" is required; it must be a non-empty array whose elements are either pattern strings or objects with
 * a "pattern" string and an optional "payload" string. Pattern strings are encoded as UTF-8. The returned automaton is
 * compiled.
 */
public class PatternSetCompiler {

    static final String CASE_INSENSITIVE = "caseInsensitive";
    static final String PRUNE_FAILURE_LINKS = "pruneFailureLinks";
    static final String PATTERNS = "patterns";
    static final String PATTERN = "pattern";
    static final String PAYLOAD = "payload";

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private PatternSetCompiler() { }

    /**
     * Verify the syntax of a pattern set.
     * @param source pattern set, as a String
     * @return null if the pattern set is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern set from its JSON form.
     *
     * @param source pattern set, as a String
     * @return the compiled automaton
     * @throws IOException if the pattern set isn't syntactically valid
     */
    public static Automaton compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static Automaton compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static Automaton compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static Automaton compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static Automaton doCompile(final JsonParser parser) throws IOException {
        final Automaton.Builder builder = Automaton.builder();
        final List<String> patterns = new ArrayList<>();
        final List<String> payloads = new ArrayList<>();
        boolean patternsPresent = false;

        if (parser.nextToken() != JsonToken.START_OBJECT) {
            barf(parser, "Pattern set is not an object");
        }
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String key = parser.getCurrentName();
            final JsonToken value = parser.nextToken();
            switch (key) {
                case CASE_INSENSITIVE:
                    builder.withCaseInsensitive(readBoolean(parser, value, key));
                    break;
                case PRUNE_FAILURE_LINKS:
                    builder.withFailureLinkPruning(readBoolean(parser, value, key));
                    break;
                case PATTERNS:
                    if (patternsPresent) {
                        barf(parser, String.format("\"%s\" cannot be given more than once", PATTERNS));
                    }
                    patternsPresent = true;
                    parsePatterns(parser, value, patterns, payloads);
                    break;
                default:
                    barf(parser, String.format("Unknown key \"%s\"", key));
            }
        }
        if (!patternsPresent) {
            barf(parser, String.format("\"%s\" is required", PATTERNS));
        }
        parser.close();

        final Automaton automaton = builder.build();
        for (int i = 0; i < patterns.size(); i++) {
            automaton.addPattern(patterns.get(i), null, payloads.get(i));
        }
        automaton.build();
        return automaton;
    }

    private static void parsePatterns(final JsonParser parser, final JsonToken value,
                                      final List<String> patterns, final List<String> payloads) throws IOException {
        if (value != JsonToken.START_ARRAY) {
            barf(parser, String.format("\"%s\" must be an array", PATTERNS));
        }
        boolean elementsPresent = false;
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elementsPresent = true;
            switch (token) {
                case VALUE_STRING:
                    patterns.add(readPattern(parser));
                    payloads.add(null);
                    break;
                case START_OBJECT:
                    parsePatternObject(parser, patterns, payloads);
                    break;
                default:
                    barf(parser, "Pattern must be a string or an object");
            }
        }
        if (!elementsPresent) {
            barf(parser, "Empty arrays are not allowed");
        }
    }

    private static void parsePatternObject(final JsonParser parser, final List<String> patterns,
                                           final List<String> payloads) throws IOException {
        String pattern = null;
        String payload = null;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String key = parser.getCurrentName();
            final JsonToken value = parser.nextToken();
            if (PATTERN.equals(key)) {
                if (value != JsonToken.VALUE_STRING) {
                    barf(parser, String.format("\"%s\" must be a string", PATTERN));
                }
                pattern = readPattern(parser);
            } else if (PAYLOAD.equals(key)) {
                if (value != JsonToken.VALUE_STRING && value != JsonToken.VALUE_NULL) {
                    barf(parser, String.format("\"%s\" must be a string or null", PAYLOAD));
                }
                payload = value == JsonToken.VALUE_NULL ? null : parser.getText();
            } else {
                barf(parser, String.format("Unknown key \"%s\" in pattern object", key));
            }
        }
        if (pattern == null) {
            barf(parser, String.format("Pattern object must have a \"%s\"", PATTERN));
        }
        patterns.add(pattern);
        payloads.add(payload);
    }

    private static String readPattern(final JsonParser parser) throws IOException {
        final String pattern = parser.getText();
        if (pattern.isEmpty()) {
            barf(parser, "Empty patterns are not allowed");
        }
        return pattern;
    }

    private static boolean readBoolean(final JsonParser parser, final JsonToken value, final String key)
            throws IOException {
        if (value != JsonToken.VALUE_TRUE && value != JsonToken.VALUE_FALSE) {
            barf(parser, String.format("\"%s\" must be true or false", key));
        }
        return value == JsonToken.VALUE_TRUE;
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
