package software.fieldmatch.automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import static software.fieldmatch.automaton.Constants.ALPHABET_SIZE;

/**
 * Evaluates the complexity of machines.
 */
public class MachineComplexityEvaluator {

    private static final int DEFAULT_MAX_VISITED_SETS = 10_000;

    /**
     * Cap evaluation of complexity at this threshold.
     */
    private final int maxComplexity;

    /**
     * Stop exploring after this many distinct state sets.
     */
    private final int maxVisitedSets;

    public MachineComplexityEvaluator(int maxComplexity) {
        this(maxComplexity, DEFAULT_MAX_VISITED_SETS);
    }

    public MachineComplexityEvaluator(int maxComplexity, int maxVisitedSets) {
        if (maxComplexity < 1 || maxVisitedSets < 1) {
            throw new IllegalArgumentException("maxComplexity and maxVisitedSets must be positive");
        }
        this.maxComplexity = maxComplexity;
        this.maxVisitedSets = maxVisitedSets;
    }

    int getMaxComplexity() {
        return maxComplexity;
    }

    /**
     * Returns the largest number of states a traversal of the machine beginning with the given state could be in at
     * once. The state sets are explored breadth first, one representative symbol per range on which all states of a
     * set agree, so each set is visited once. Evaluation stops early at maxComplexity, and after maxVisitedSets sets,
     * in which case the largest size seen so far is returned.
     *
     * @param state Evaluates a machine beginning at this state.
     * @return The lesser of maxComplexity and the largest simultaneous state set found.
     */
    int evaluate(ByteState state) {
        final Set<IntArrayList> visited = new HashSet<>();
        final Queue<List<ByteState>> toVisit = new ArrayDeque<>();
        final List<ByteState> start = state.getEpsilonClosure();
        visited.add(keyFor(start));
        toVisit.add(start);

        int maxSize = 0;
        while (!toVisit.isEmpty()) {
            final List<ByteState> states = toVisit.remove();
            if (states.size() >= maxComplexity) {
                return maxComplexity;
            }
            maxSize = Math.max(maxSize, states.size());

            for (int symbol : representativeSymbols(states)) {
                final List<ByteState> next = NfaTraversal.stepStates(states, symbol, Integer.MAX_VALUE);
                if (next.isEmpty()) {
                    continue;
                }
                if (visited.size() >= maxVisitedSets) {
                    return maxSize;
                }
                if (visited.add(keyFor(next))) {
                    toVisit.add(next);
                }
            }
        }
        return maxSize;
    }

    /**
     * The floor of every range bounded by a ceiling of any of the states. Within each such range every state steps
     * the same way, so one symbol stands for the whole range.
     */
    private static IntArrayList representativeSymbols(final List<ByteState> states) {
        final boolean[] isFloor = new boolean[ALPHABET_SIZE];
        isFloor[0] = true;
        for (ByteState each : states) {
            for (int ceiling : each.getMap().getCeilings()) {
                if (ceiling < ALPHABET_SIZE) {
                    isFloor[ceiling] = true;
                }
            }
        }
        final IntArrayList symbols = new IntArrayList();
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            if (isFloor[i]) {
                symbols.add(i);
            }
        }
        return symbols;
    }

    private static IntArrayList keyFor(final List<ByteState> states) {
        final IntArrayList key = new IntArrayList(states.size());
        for (ByteState each : states) {
            key.add(each.getId());
        }
        key.sort(null);
        return key;
    }
}
