package software.fieldmatch.automaton.input;

/**
 * Thrown when a pattern's text cannot be parsed.
 */
public class ParseException extends RuntimeException {

    public ParseException(String msg) {
        super(msg);
    }
}
