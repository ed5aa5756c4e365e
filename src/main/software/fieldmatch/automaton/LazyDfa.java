package software.fieldmatch.automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Subset construction done on demand. Each set of automaton states a traversal passes through becomes one
 * LazyDfaState, found again by the sorted ids of its members, and each transition between them is computed once.
 *
 * The number of states is bounded. When a traversal needs a state beyond the bound the cache is disabled and stays
 * disabled; the caller is expected to fall back to plain NFA traversal. States already built are never evicted.
 */
@NotThreadSafe
class LazyDfa {

    private static final Logger logger = LoggerFactory.getLogger(LazyDfa.class);

    private final Map<IntArrayList, LazyDfaState> states = new HashMap<>();

    private final Map<ByteState, LazyDfaState> startStates = new IdentityHashMap<>();

    private final int maxStates;

    private final int dedupeSortThreshold;

    private boolean disabled;

    private long stateCreates;
    private long hits;
    private long misses;

    LazyDfa(final int maxStates, final int dedupeSortThreshold) {
        this.maxStates = maxStates;
        this.dedupeSortThreshold = dedupeSortThreshold;
    }

    /**
     * Returns the state for the epsilon closure of an automaton's start state.
     *
     * @return the start state, or null if the cache is or has just become disabled
     */
    @Nullable
    LazyDfaState startState(final ByteState root) {
        LazyDfaState start = startStates.get(root);
        if (start != null) {
            hits++;
            return start;
        }
        misses++;
        start = getOrCreateState(root.getEpsilonClosure());
        if (start != null) {
            startStates.put(root, start);
        }
        return start;
    }

    /**
     * Follows one symbol from a state, computing and caching the transition on first use.
     *
     * @return the next state, {@link LazyDfaState#DEAD} if the symbol leads nowhere, or null if the cache is or has
     *         just become disabled
     */
    @Nullable
    LazyDfaState transition(final LazyDfaState from, final int symbol) {
        LazyDfaState next = from.getTransition(symbol);
        if (next != null) {
            hits++;
            return next;
        }
        misses++;
        final List<ByteState> nfaStates = NfaTraversal.stepStates(from.getNfaStates(), symbol, dedupeSortThreshold);
        if (nfaStates.isEmpty()) {
            next = LazyDfaState.DEAD;
        } else {
            next = getOrCreateState(nfaStates);
            if (next == null) {
                return null;
            }
        }
        from.setTransition(symbol, next);
        return next;
    }

    @Nullable
    private LazyDfaState getOrCreateState(final List<ByteState> nfaStates) {
        if (disabled) {
            return null;
        }
        final IntArrayList key = keyFor(nfaStates);
        LazyDfaState state = states.get(key);
        if (state != null) {
            return state;
        }
        if (states.size() >= maxStates) {
            disabled = true;
            logger.debug("Lazy DFA cache reached {} states and is disabled, falling back to NFA traversal",
                    maxStates);
            return null;
        }
        state = new LazyDfaState(nfaStates);
        states.put(key, state);
        stateCreates++;
        return state;
    }

    private static IntArrayList keyFor(final List<ByteState> nfaStates) {
        final IntArrayList key = new IntArrayList(nfaStates.size());
        for (ByteState state : nfaStates) {
            key.add(state.getId());
        }
        key.sort(null);
        return key;
    }

    boolean isDisabled() {
        return disabled;
    }

    int size() {
        return states.size();
    }

    CacheStats getStats() {
        return new CacheStats(states.size(), stateCreates, hits, misses, disabled);
    }
}
