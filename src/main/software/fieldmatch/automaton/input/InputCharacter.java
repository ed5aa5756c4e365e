package software.fieldmatch.automaton.input;

/**
 * One unit of a parsed pattern: either a literal byte or a wildcard.
 */
public abstract class InputCharacter {

    InputCharacter() { }

    public abstract InputCharacterType getType();
}
