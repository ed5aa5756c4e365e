package software.fieldmatch.automaton;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.List;

import static software.fieldmatch.automaton.Constants.ALPHABET_SIZE;

/**
 * Unions two automata into one that accepts the union of their languages. The result shares every state the inputs
 * do not disagree on, and the inputs themselves are left untouched, so a machine that is being read concurrently can
 * be merged into and then republished.
 *
 * Where both inputs step on the same symbol, the two successors are merged in turn. Each pair of states is merged at
 * most once: the combined state is remembered before its successors are computed, which is also what makes the
 * self-referential wildcard states terminate.
 */
@NotThreadSafe
final class StateMerger {

    private static final Logger logger = LoggerFactory.getLogger(StateMerger.class);

    private final Long2ObjectMap<ByteState> combinedStates = new Long2ObjectOpenHashMap<>();

    private StateMerger() { }

    /**
     * Merges a pattern fragment into an existing automaton.
     *
     * @param existingRoot the start state of the automaton built so far, or null if there is none yet
     * @param fragmentRoot the start state of the fragment to add, or null to add nothing
     * @return the start state of an automaton accepting both, which may be one of the arguments
     */
    static ByteState merge(@Nullable final ByteState existingRoot, @Nullable final ByteState fragmentRoot) {
        if (existingRoot == null) {
            return fragmentRoot;
        }
        if (fragmentRoot == null) {
            return existingRoot;
        }
        StateMerger merger = new StateMerger();
        ByteState merged = merger.mergeStates(existingRoot, fragmentRoot);
        logger.debug("Merged fragment {} into {}, {} combined states created", fragmentRoot.getId(),
                existingRoot.getId(), merger.combinedStates.size());
        return merged;
    }

    private ByteState mergeStates(final ByteState state1, final ByteState state2) {
        if (state1 == state2) {
            return state1;
        }
        final long key = ((long) state1.getId() << 32) | (state2.getId() & 0xFFFFFFFFL);
        ByteState combined = combinedStates.get(key);
        if (combined != null) {
            return combined;
        }
        combined = new ByteState();
        combinedStates.put(key, combined);

        final ByteState[] unpacked1 = state1.getMap().unpack();
        final ByteState[] unpacked2 = state2.getMap().unpack();
        final ByteState[] combinedSteps = new ByteState[ALPHABET_SIZE];
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            final ByteState next1 = unpacked1[i];
            final ByteState next2 = unpacked2[i];
            if (next1 == null) {
                combinedSteps[i] = next2;
            } else if (next2 == null) {
                combinedSteps[i] = next1;
            } else if (i > 0 && next1 == unpacked1[i - 1] && next2 == unpacked2[i - 1]) {
                // same pair as the previous symbol, most often a wildcard range
                combinedSteps[i] = combinedSteps[i - 1];
            } else {
                combinedSteps[i] = mergeStates(next1, next2);
            }
        }
        combined.getMap().putSteps(combinedSteps);

        final List<ByteState> epsilons = new ArrayList<>(state1.getEpsilons());
        epsilons.addAll(state2.getEpsilons());
        combined.addEpsilons(epsilons);

        final List<NameState> fieldTransitions = new ArrayList<>(state1.getFieldTransitions());
        fieldTransitions.addAll(state2.getFieldTransitions());
        combined.addFieldTransitions(fieldTransitions);
        return combined;
    }
}
