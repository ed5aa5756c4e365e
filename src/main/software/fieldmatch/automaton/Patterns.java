package software.fieldmatch.automaton;

/**
 * The Patterns deal pre-processing of value patterns for the eventual matching against field values.
 * This class acts as the factory for building patterns, which is useful if you have values in hand and would like
 * to add them to a ByteMachine directly instead of going through the JSON pattern compiler.
 *
 * String values are matched byte for byte, so a pattern meant for a JSON string must carry the same quotes the field
 * value will carry, e.g. "\"foo\"". The PatternCompiler takes care of this.
 */
public abstract class Patterns {

    private final MatchType type;

    Patterns(final MatchType type) {
        this.type = type;
    }

    public MatchType type() {
        return type;
    }

    /**
     * @return the pattern text, quoted the way values are presented
     */
    public abstract String pattern();

    public static ValuePatterns exactMatch(final String value) {
        return new ValuePatterns(MatchType.EXACT, value);
    }

    // prefixes of string values keep the opening " but not the closing one, like so: "\"foo". A closing quote
    //  would only ever match values that end right after the prefix.
    public static ValuePatterns prefixMatch(final String prefix) {
        return new ValuePatterns(MatchType.PREFIX, prefix);
    }

    // the mirror image of prefixMatch: keep the closing " and drop the opening one.
    public static ValuePatterns suffixMatch(final String suffix) {
        return new ValuePatterns(MatchType.SUFFIX, suffix);
    }

    /**
     * A pattern in which each unescaped '*' matches zero or more bytes. A '*' or '\' meant literally is escaped
     * with '\'.
     */
    public static ValuePatterns wildcardMatch(final String value) {
        return new ValuePatterns(MatchType.WILDCARD, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }

        Patterns patterns = (Patterns) o;

        return type == patterns.type;
    }

    @Override
    public int hashCode() {
        return type != null ? type.hashCode() : 0;
    }

    @Override
    public String toString() {
        return "T:" + type;
    }
}
