package software.fieldmatch.automaton;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import software.fieldmatch.automaton.input.ParseException;
import software.fieldmatch.automaton.input.WildcardParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles value patterns, expressed in JSON, into Patterns grouped by field. A document looks like
 * <pre>
 *     { "source": [ "a", { "prefix": "b" } ], "detail": { "state": [ { "wildcard": "run*ing" } ] } }
 * </pre>
 * Nested objects are flattened into "."-separated field names. String values are quoted, the way string field
 * values are presented for matching.
 *
 * Is public so clients can call the check() method to syntax-check pattern documents.
 */
public final class PatternCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private static final WildcardParser WILDCARD_PARSER = new WildcardParser();

    private PatternCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Verify the syntax of a pattern document
     * @param source patterns, as a String
     * @return null if the document is valid, otherwise an error message
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

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern document from its JSON form to a Map of field name to Patterns (elements are surrounded by
     * quotes).
     *
     * @param source patterns, as a String
     * @return field names mapped to their patterns, in document order
     * @throws IOException if the document isn't syntactically valid
     */
    public static Map<String, List<Patterns>> compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static Map<String, List<Patterns>> compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static Map<String, List<Patterns>> compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static Map<String, List<Patterns>> compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static Map<String, List<Patterns>> doCompile(final JsonParser parser) throws IOException {
        final Deque<String> path = new ArrayDeque<>();
        final Map<String, List<Patterns>> patterns = new LinkedHashMap<>();
        try {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                barf(parser, "Pattern document is not an object");
            }
            parseObject(patterns, path, parser);
        } finally {
            parser.close();
        }
        return patterns;
    }

    private static void parseObject(final Map<String, List<Patterns>> patterns,
                                    final Deque<String> path,
                                    final JsonParser parser) throws IOException {

        boolean fieldsPresent = false;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            fieldsPresent = true;

            // field name
            final String stepName = parser.getCurrentName();

            switch (parser.nextToken()) {
            case START_OBJECT:
                path.addLast(stepName);
                parseObject(patterns, path, parser);
                path.removeLast();
                break;

            case START_ARRAY:
                writePatterns(patterns, fieldName(path, stepName), parser);
                break;

            default:
                barf(parser, String.format("\"%s\" must be an object or an array", stepName));
            }
        }
        if (!fieldsPresent) {
            barf(parser, "Empty objects are not allowed");
        }
    }

    private static String fieldName(final Deque<String> path, final String stepName) {
        if (path.isEmpty()) {
            return stepName;
        }
        return String.join(".", path) + "." + stepName;
    }

    private static void writePatterns(final Map<String, List<Patterns>> patterns,
                                      final String name,
                                      final JsonParser parser) throws IOException {
        JsonToken token;
        final List<Patterns> values = new ArrayList<>();

        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            switch (token) {
            case START_OBJECT:
                values.add(processMatchExpression(parser));
                break;

            case VALUE_STRING:
                values.add(Patterns.exactMatch('"' + parser.getText() + '"'));
                break;

            case VALUE_NUMBER_FLOAT:
            case VALUE_NUMBER_INT:
            case VALUE_NULL:
            case VALUE_TRUE:
            case VALUE_FALSE:
                values.add(Patterns.exactMatch(parser.getText()));
                break;

            default:
                barf(parser, "Match value must be String, number, true, false, or null");
            }
        }
        if (values.isEmpty()) {
            barf(parser, "Empty arrays are not allowed");
        }
        if (patterns.containsKey(name)) {
            barf(parser, String.format("Path `%s` cannot be allowed multiple times", name));
        }
        patterns.put(name, values);
    }

    // A match expression is an object with exactly one key naming the match type, e.g. { "prefix": "foo" }
    private static Patterns processMatchExpression(final JsonParser parser) throws IOException {
        final JsonToken matchTypeToken = parser.nextToken();
        if (matchTypeToken != JsonToken.FIELD_NAME) {
            barf(parser, "Match expression name not found");
        }
        final String matchTypeName = parser.getCurrentName();
        if (parser.nextToken() != JsonToken.VALUE_STRING) {
            barf(parser, matchTypeName + " match pattern must be a string");
        }
        final String text = parser.getText();

        final Patterns pattern;
        if (Constants.EXACT_MATCH.equals(matchTypeName)) {
            pattern = Patterns.exactMatch('"' + text + '"');
        } else if (Constants.PREFIX_MATCH.equals(matchTypeName)) {
            pattern = Patterns.prefixMatch('"' + text); // note no trailing quote
        } else if (Constants.SUFFIX_MATCH.equals(matchTypeName)) {
            pattern = Patterns.suffixMatch(text + '"'); // note no leading quote
        } else if (Constants.WILDCARD.equals(matchTypeName)) {
            final String value = '"' + text + '"';
            try {
                WILDCARD_PARSER.parse(value);
            } catch (ParseException e) {
                barf(parser, e.getLocalizedMessage());
            }
            pattern = Patterns.wildcardMatch(value);
        } else if (Constants.SHELLSTYLE.equals(matchTypeName)) {
            final String value = '"' + text + '"';
            if (ShellStyleMatcher.tryBuild(value) == null) {
                barf(parser, "shellstyle match pattern must be non-empty and may only contain text and '*'");
            }
            pattern = Patterns.wildcardMatch(value);
        } else {
            barf(parser, "Unrecognized match type " + matchTypeName);
            return null; // unreachable statement, but java can't see that?
        }

        if (parser.nextToken() != JsonToken.END_OBJECT) {
            barf(parser, "Only one key allowed in match expression");
        }
        return pattern;
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
