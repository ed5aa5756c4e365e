package software.fieldmatch.automaton;

import javax.annotation.concurrent.Immutable;

/**
 * Configuration for a ByteMachine and the TraversalContexts used with it.
 */
@Immutable
public class Configuration {

    public static final int DEFAULT_DEDUPE_SORT_THRESHOLD = 500;
    public static final int DEFAULT_LAZY_DFA_MAX_STATES = 1000;

    public static final Configuration DEFAULT = builder().build();

    /**
     * During NFA traversal the states reached on one byte are gathered from every active state and may contain
     * duplicates. Below this many states, duplicates are removed by a linear scan; at or above it, the states are
     * sorted by id and de-duplicated in one pass, which bounds the cost when a single byte fans out to very many
     * states.
     */
    private final int dedupeSortThreshold;

    /**
     * The most cached states a TraversalContext will hold. When a traversal needs one more, the cache stops growing
     * for good and the context falls back to plain NFA traversal.
     */
    private final int lazyDfaMaxStates;

    /**
     * Whether TraversalContexts cache state sets at all. When false, cached traversal is plain NFA traversal.
     */
    private final boolean lazyDfaEnabled;

    /**
     * Whether wildcard patterns made only of literals and '*' are matched by a ShellStyleMatcher instead of being
     * merged into the automaton.
     */
    private final boolean shellStyleFastPathEnabled;

    private Configuration(int dedupeSortThreshold, int lazyDfaMaxStates, boolean lazyDfaEnabled,
                          boolean shellStyleFastPathEnabled) {
        this.dedupeSortThreshold = dedupeSortThreshold;
        this.lazyDfaMaxStates = lazyDfaMaxStates;
        this.lazyDfaEnabled = lazyDfaEnabled;
        this.shellStyleFastPathEnabled = shellStyleFastPathEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getDedupeSortThreshold() {
        return dedupeSortThreshold;
    }

    public int getLazyDfaMaxStates() {
        return lazyDfaMaxStates;
    }

    public boolean isLazyDfaEnabled() {
        return lazyDfaEnabled;
    }

    public boolean isShellStyleFastPathEnabled() {
        return shellStyleFastPathEnabled;
    }

    @Override
    public String toString() {
        return "Configuration{" +
                "dedupeSortThreshold=" + dedupeSortThreshold +
                ", lazyDfaMaxStates=" + lazyDfaMaxStates +
                ", lazyDfaEnabled=" + lazyDfaEnabled +
                ", shellStyleFastPathEnabled=" + shellStyleFastPathEnabled +
                '}';
    }

    public static class Builder {

        private int dedupeSortThreshold = DEFAULT_DEDUPE_SORT_THRESHOLD;
        private int lazyDfaMaxStates = DEFAULT_LAZY_DFA_MAX_STATES;
        private boolean lazyDfaEnabled = true;
        private boolean shellStyleFastPathEnabled = true;

        Builder() { }

        public Builder withDedupeSortThreshold(int dedupeSortThreshold) {
            this.dedupeSortThreshold = dedupeSortThreshold;
            return this;
        }

        public Builder withLazyDfaMaxStates(int lazyDfaMaxStates) {
            this.lazyDfaMaxStates = lazyDfaMaxStates;
            return this;
        }

        public Builder withLazyDfaEnabled(boolean lazyDfaEnabled) {
            this.lazyDfaEnabled = lazyDfaEnabled;
            return this;
        }

        public Builder withShellStyleFastPathEnabled(boolean shellStyleFastPathEnabled) {
            this.shellStyleFastPathEnabled = shellStyleFastPathEnabled;
            return this;
        }

        public Configuration build() {
            if (dedupeSortThreshold < 1) {
                throw new IllegalArgumentException("dedupeSortThreshold must be positive: " + dedupeSortThreshold);
            }
            if (lazyDfaMaxStates < 1) {
                throw new IllegalArgumentException("lazyDfaMaxStates must be positive: " + lazyDfaMaxStates);
            }
            return new Configuration(dedupeSortThreshold, lazyDfaMaxStates, lazyDfaEnabled,
                    shellStyleFastPathEnabled);
        }
    }
}
