package software.fieldmatch.automaton;

import javax.annotation.Nonnull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static software.fieldmatch.automaton.Constants.VALUE_TERMINATOR;

/**
 * Runs a value through an automaton by tracking every state it could be in at once. Each step moves the whole set of
 * current states on one symbol, then widens the result by the epsilon closure of each state reached. The value is
 * followed by the value terminator, so anchored patterns only match at the end of the value.
 */
final class NfaTraversal {

    private static final Comparator<ByteState> BY_ID = Comparator.comparingInt(ByteState::getId);

    private NfaTraversal() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Finds the NameStates reached while consuming a value.
     *
     * @param root the start state of the automaton
     * @param value the value's bytes, not including any terminator
     * @param incoming NameStates already matched, copied into the result
     * @param configuration supplies the de-duplication threshold
     * @return incoming plus the field transitions of every state reached, including those of the start closure
     */
    static Set<NameState> traverse(@Nonnull final ByteState root, @Nonnull final byte[] value,
                                   @Nonnull final Set<NameState> incoming,
                                   @Nonnull final Configuration configuration) {
        final Set<NameState> transitions = new HashSet<>(incoming);
        final int threshold = configuration.getDedupeSortThreshold();

        List<ByteState> states = root.getEpsilonClosure();
        addFieldTransitions(states, transitions);

        for (int i = 0; i <= value.length && !states.isEmpty(); i++) {
            final int symbol = i == value.length ? VALUE_TERMINATOR : (value[i] & 0xFF);
            states = stepStates(states, symbol, threshold);
            addFieldTransitions(states, transitions);
        }
        return transitions;
    }

    /**
     * Moves a set of states on one symbol.
     *
     * @param states the current epsilon-closed states
     * @param symbol a byte value in 0..255 or the value terminator
     * @param dedupeSortThreshold below this many gathered states duplicates are removed by scanning, at or above it
     *                            by sorting
     * @return the de-duplicated, epsilon-closed states reached, empty if none
     */
    static List<ByteState> stepStates(final List<ByteState> states, final int symbol, final int dedupeSortThreshold) {
        List<ByteState> next = null;
        for (ByteState state : states) {
            ByteState step = state.step(symbol);
            if (step == null) {
                continue;
            }
            if (next == null) {
                next = new ArrayList<>();
            }
            next.addAll(step.getEpsilonClosure());
        }
        if (next == null) {
            return Collections.emptyList();
        }
        return dedupe(next, dedupeSortThreshold);
    }

    static List<ByteState> dedupe(final List<ByteState> states, final int dedupeSortThreshold) {
        if (states.size() < 2) {
            return states;
        }
        if (states.size() < dedupeSortThreshold) {
            final List<ByteState> unique = new ArrayList<>(states.size());
            for (ByteState state : states) {
                if (!containsIdentity(unique, state)) {
                    unique.add(state);
                }
            }
            return unique;
        }

        final List<ByteState> sorted = new ArrayList<>(states);
        sorted.sort(BY_ID);
        final List<ByteState> unique = new ArrayList<>(sorted.size());
        ByteState previous = null;
        for (ByteState state : sorted) {
            if (state != previous) {
                unique.add(state);
                previous = state;
            }
        }
        return unique;
    }

    static void addFieldTransitions(final List<ByteState> states, final Set<NameState> transitions) {
        for (ByteState state : states) {
            transitions.addAll(state.getFieldTransitions());
        }
    }

    private static boolean containsIdentity(final List<ByteState> states, final ByteState state) {
        for (ByteState each : states) {
            if (each == state) {
                return true;
            }
        }
        return false;
    }
}
