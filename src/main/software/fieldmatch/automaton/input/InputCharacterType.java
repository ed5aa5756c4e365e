package software.fieldmatch.automaton.input;

/**
 * The kinds of InputCharacter a pattern's text is parsed into before it is built into automaton states.
 */
public enum InputCharacterType {
    BYTE,
    WILDCARD
}
