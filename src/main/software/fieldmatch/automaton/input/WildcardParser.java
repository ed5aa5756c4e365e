package software.fieldmatch.automaton.input;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses wildcard pattern text into InputCharacters. '*' is a wildcard and a run of them is the same as one.
 * A backslash escapes a following '*' or backslash; any other use of a backslash is an error.
 */
public class WildcardParser {

    static final byte ASTERISK_BYTE = (byte) '*';
    static final byte BACKSLASH_BYTE = (byte) '\\';

    public WildcardParser() { }

    public InputCharacter[] parse(final String value) {
        final byte[] utf8Bytes = value.getBytes(StandardCharsets.UTF_8);
        final List<InputCharacter> result = new ArrayList<>(utf8Bytes.length);
        for (int i = 0; i < utf8Bytes.length; i++) {
            byte utf8byte = utf8Bytes[i];
            if (utf8byte == ASTERISK_BYTE) {
                if (result.isEmpty() || result.get(result.size() - 1).getType() != InputCharacterType.WILDCARD) {
                    result.add(new InputWildcard());
                }
            } else if (utf8byte == BACKSLASH_BYTE) {
                if (i + 1 < utf8Bytes.length) {
                    byte nextUtf8byte = utf8Bytes[i + 1];
                    if (nextUtf8byte == ASTERISK_BYTE || nextUtf8byte == BACKSLASH_BYTE) {
                        result.add(new InputByte(nextUtf8byte));
                        i++;
                        continue;
                    }
                }
                throw new ParseException("Invalid escape character at pos " + i);
            } else {
                result.add(new InputByte(utf8byte));
            }
        }
        return result.toArray(new InputCharacter[0]);
    }

    /**
     * Builds literal InputCharacters for text with no wildcards or escapes.
     */
    public static InputCharacter[] literal(final String value) {
        final byte[] utf8Bytes = value.getBytes(StandardCharsets.UTF_8);
        final InputCharacter[] result = new InputCharacter[utf8Bytes.length];
        for (int i = 0; i < utf8Bytes.length; i++) {
            result[i] = new InputByte(utf8Bytes[i]);
        }
        return result;
    }
}
