package software.fieldmatch.automaton;

import software.fieldmatch.automaton.input.InputByte;
import software.fieldmatch.automaton.input.InputCharacter;
import software.fieldmatch.automaton.input.WildcardParser;

import javax.annotation.Nonnull;

import static software.fieldmatch.automaton.Constants.VALUE_TERMINATOR;

/**
 * Builds the automaton fragment for a single value pattern. A fragment is a chain of fresh states, shared with
 * nothing, that ends in a state carrying the pattern's NameState; it is then merged into a field's machine.
 *
 * A wildcard becomes a spinner, a state stepping to itself on every byte. The spinner is entered from the state
 * before it and left to the state after it through epsilon edges, so it may consume no bytes at all.
 */
final class FragmentBuilder {

    private static final WildcardParser WILDCARD_PARSER = new WildcardParser();

    private FragmentBuilder() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * @param pattern the pattern to build, its text in the same quoted form values are presented in
     * @param nameState the NameState reached when the pattern matches
     * @return the start state of the new fragment
     */
    static ByteState build(@Nonnull final Patterns pattern, @Nonnull final NameState nameState) {
        final String text = pattern.pattern();
        final ByteState start = new ByteState();
        switch (pattern.type()) {
            case EXACT:
                terminate(addCharacters(start, WildcardParser.literal(text)), nameState);
                break;
            case PREFIX:
                addCharacters(start, WildcardParser.literal(text)).addFieldTransition(nameState);
                break;
            case SUFFIX:
                terminate(addCharacters(addSpinner(start), WildcardParser.literal(text)), nameState);
                break;
            case WILDCARD:
                terminate(addCharacters(start, WILDCARD_PARSER.parse(text)), nameState);
                break;
            default:
                throw new AssertionError(pattern + " is not implemented yet");
        }
        return start;
    }

    private static ByteState addCharacters(final ByteState start, final InputCharacter[] characters) {
        ByteState current = start;
        for (InputCharacter character : characters) {
            switch (character.getType()) {
                case BYTE:
                    ByteState next = new ByteState();
                    current.putStep(InputByte.cast(character).getSymbol(), next);
                    current = next;
                    break;
                case WILDCARD:
                    current = addSpinner(current);
                    break;
                default:
                    throw new AssertionError(character.getType() + " is not implemented yet");
            }
        }
        return current;
    }

    /**
     * Hangs a spinner off the given state.
     *
     * @return the state following the spinner
     */
    private static ByteState addSpinner(final ByteState current) {
        final ByteState spinner = new ByteState();
        spinner.putStepForAllBytes(spinner);
        final ByteState after = new ByteState();
        current.addEpsilon(spinner);
        spinner.addEpsilon(after);
        return after;
    }

    private static void terminate(final ByteState last, final NameState nameState) {
        final ByteState end = new ByteState();
        end.addFieldTransition(nameState);
        last.putStep(VALUE_TERMINATOR, end);
    }
}
