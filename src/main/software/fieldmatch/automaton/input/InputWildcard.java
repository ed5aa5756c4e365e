package software.fieldmatch.automaton.input;

import static software.fieldmatch.automaton.input.InputCharacterType.WILDCARD;

/**
 * An InputCharacter that matches any run of bytes, including none.
 */
public class InputWildcard extends InputCharacter {

    InputWildcard() { }

    @Override
    public InputCharacterType getType() {
        return WILDCARD;
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass();
    }

    @Override
    public int hashCode() {
        return InputWildcard.class.hashCode();
    }

    @Override
    public String toString() {
        return "*";
    }
}
