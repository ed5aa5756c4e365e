package software.fieldmatch.automaton;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.HashSet;
import java.util.Set;

import static software.fieldmatch.automaton.Constants.VALUE_TERMINATOR;

/**
 * Per-caller state for matching values: owns a lazily built, bounded DFA cache that is kept from one call to the
 * next, so values that walk the same state sets get cheaper over time. A context must not be shared between threads;
 * give each worker its own.
 *
 * The cache is keyed by automaton state ids, so one context can be used with several machines, and with a machine
 * before and after patterns are added to it.
 */
@NotThreadSafe
public class TraversalContext {

    private final Configuration configuration;

    private LazyDfa lazyDfa;

    public TraversalContext() {
        this(Configuration.DEFAULT);
    }

    public TraversalContext(@Nonnull final Configuration configuration) {
        this.configuration = configuration;
        this.lazyDfa = newLazyDfa();
    }

    /**
     * Finds the NameStates reached while consuming a value, with the same result as
     * {@link NfaTraversal#traverse(ByteState, byte[], Set, Configuration)}.
     *
     * @param root the start state of the automaton
     * @param value the value's bytes
     * @param incoming NameStates already matched, copied into the result
     * @return incoming plus every field transition reached
     */
    Set<NameState> traverseWithCache(@Nonnull final ByteState root, @Nonnull final byte[] value,
                                     @Nonnull final Set<NameState> incoming) {
        if (!configuration.isLazyDfaEnabled() || lazyDfa.isDisabled()) {
            return NfaTraversal.traverse(root, value, incoming, configuration);
        }

        LazyDfaState state = lazyDfa.startState(root);
        if (state == null) {
            return NfaTraversal.traverse(root, value, incoming, configuration);
        }
        final Set<NameState> transitions = new HashSet<>(incoming);
        transitions.addAll(state.getFieldTransitions());

        for (int i = 0; i <= value.length; i++) {
            final int symbol = i == value.length ? VALUE_TERMINATOR : (value[i] & 0xFF);
            state = lazyDfa.transition(state, symbol);
            if (state == null) {
                // the cache filled up mid-value, start this one over without it
                return NfaTraversal.traverse(root, value, incoming, configuration);
            }
            if (state.isDead()) {
                break;
            }
            transitions.addAll(state.getFieldTransitions());
        }
        return transitions;
    }

    /**
     * Discards every cached state and re-enables the cache.
     */
    public void reset() {
        lazyDfa = newLazyDfa();
    }

    public boolean isCacheDisabled() {
        return lazyDfa.isDisabled();
    }

    public CacheStats getStats() {
        return lazyDfa.getStats();
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    private LazyDfa newLazyDfa() {
        return new LazyDfa(configuration.getLazyDfaMaxStates(), configuration.getDedupeSortThreshold());
    }
}
