package software.fieldmatch.automaton;

/**
 * The types of value matches a ByteMachine supports
 */
public enum MatchType {
    EXACT,               // exact string
    PREFIX,              // string prefix
    SUFFIX,              // string suffix
    WILDCARD,            // string match using '*' wildcards, each standing for zero or more bytes
}
