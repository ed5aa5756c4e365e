package software.fieldmatch.automaton;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Matches values against a shell-style pattern, one made only of literal text and '*', without an automaton.
 * The literals between the stars must appear in the value in order and without overlapping; the first is anchored
 * at the start of the value unless the pattern starts with '*', the last at the end unless it ends with '*'.
 *
 * Matching is on raw bytes: the value passed to {@link #match(byte[])} carries no quotes and no terminator.
 */
@Immutable
public final class ShellStyleMatcher {

    private static final byte WILDCARD_BYTE = '*';

    private final List<byte[]> literals;
    private final boolean startsWild;
    private final boolean endsWild;
    private final int literalLength;

    private ShellStyleMatcher(final List<byte[]> literals, final boolean startsWild, final boolean endsWild) {
        this.literals = literals;
        this.startsWild = startsWild;
        this.endsWild = endsWild;
        int length = 0;
        for (byte[] literal : literals) {
            length += literal.length;
        }
        this.literalLength = length;
    }

    /**
     * Compiles a quoted pattern if it is one this matcher can handle.
     *
     * @param quotedPatternText the pattern, including its enclosing double quotes
     * @return the matcher, or null if the text is not quoted, has an empty body, or contains '?', '[' or '\'
     */
    @Nullable
    public static ShellStyleMatcher tryBuild(@Nullable final String quotedPatternText) {
        if (quotedPatternText == null || quotedPatternText.length() < 3
                || quotedPatternText.charAt(0) != '"'
                || quotedPatternText.charAt(quotedPatternText.length() - 1) != '"') {
            return null;
        }
        final String body = quotedPatternText.substring(1, quotedPatternText.length() - 1);
        for (int i = 0; i < body.length(); i++) {
            final char c = body.charAt(i);
            if (c == '?' || c == '[' || c == '\\') {
                return null;
            }
        }

        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        final List<byte[]> literals = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= bytes.length; i++) {
            if (i == bytes.length || bytes[i] == WILDCARD_BYTE) {
                if (i > start) {
                    literals.add(Arrays.copyOfRange(bytes, start, i));
                }
                start = i + 1;
            }
        }

        if (literals.isEmpty()) {
            return new ShellStyleMatcher(Collections.emptyList(), true, true);
        }
        final boolean startsWild = bytes[0] == WILDCARD_BYTE;
        final boolean endsWild = bytes[bytes.length - 1] == WILDCARD_BYTE;
        return new ShellStyleMatcher(Collections.unmodifiableList(literals), startsWild, endsWild);
    }

    public boolean match(@Nonnull final String value) {
        return match(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @param value the raw value, without quotes
     * @return true if the value matches this pattern
     */
    public boolean match(@Nonnull final byte[] value) {
        return match(value, 0, value.length);
    }

    /**
     * Matches the bytes of value in [from, to).
     */
    boolean match(final byte[] value, final int from, final int to) {
        if (to - from < literalLength) {
            return false;
        }
        if (literals.isEmpty()) {
            return true;
        }

        int position = from;
        int first = 0;
        if (!startsWild) {
            final byte[] literal = literals.get(0);
            if (!regionMatches(value, from, to, literal)) {
                return false;
            }
            position = from + literal.length;
            first = 1;
            if (literals.size() == 1 && !endsWild) {
                // no stars at all
                return position == to;
            }
        }

        final int last = endsWild ? literals.size() : literals.size() - 1;
        for (int i = first; i < last; i++) {
            final byte[] literal = literals.get(i);
            final int found = indexOf(value, to, literal, position);
            if (found < 0) {
                return false;
            }
            position = found + literal.length;
        }

        if (endsWild) {
            return true;
        }
        final byte[] literal = literals.get(literals.size() - 1);
        final int suffixStart = to - literal.length;
        return suffixStart >= position && regionMatches(value, suffixStart, to, literal);
    }

    private static boolean regionMatches(final byte[] value, final int offset, final int to, final byte[] literal) {
        if (offset + literal.length > to) {
            return false;
        }
        for (int i = 0; i < literal.length; i++) {
            if (value[offset + i] != literal[i]) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(final byte[] value, final int to, final byte[] literal, final int from) {
        final int limit = to - literal.length;
        outer:
        for (int i = from; i <= limit; i++) {
            for (int j = 0; j < literal.length; j++) {
                if (value[i + j] != literal[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    List<byte[]> getLiterals() {
        return literals;
    }

    boolean startsWild() {
        return startsWild;
    }

    boolean endsWild() {
        return endsWild;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SSM:");
        if (startsWild) {
            sb.append('*');
        }
        for (int i = 0; i < literals.size(); i++) {
            if (i > 0) {
                sb.append('*');
            }
            sb.append(new String(literals.get(i), StandardCharsets.UTF_8));
        }
        if (endsWild && !literals.isEmpty()) {
            sb.append('*');
        }
        return sb.toString();
    }
}
