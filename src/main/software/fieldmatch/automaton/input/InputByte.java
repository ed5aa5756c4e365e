package software.fieldmatch.automaton.input;

import java.nio.charset.StandardCharsets;

import static software.fieldmatch.automaton.input.InputCharacterType.BYTE;

/**
 * An InputCharacter that must match one byte exactly.
 */
public class InputByte extends InputCharacter {

    private final byte b;

    InputByte(final byte b) {
        this.b = b;
    }

    public static InputByte cast(InputCharacter character) {
        return (InputByte) character;
    }

    public byte getByte() {
        return b;
    }

    /**
     * @return the byte as an unsigned symbol value in 0..255
     */
    public int getSymbol() {
        return b & 0xFF;
    }

    @Override
    public InputCharacterType getType() {
        return BYTE;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return ((InputByte) o).b == b;
    }

    @Override
    public int hashCode() {
        return Byte.hashCode(b);
    }

    @Override
    public String toString() {
        return new String(new byte[] { b }, StandardCharsets.UTF_8);
    }
}
