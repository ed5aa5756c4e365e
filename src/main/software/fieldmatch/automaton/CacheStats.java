package software.fieldmatch.automaton;

import javax.annotation.concurrent.Immutable;

/**
 * A snapshot of a TraversalContext's cache counters. For diagnostics only.
 */
@Immutable
public final class CacheStats {

    private final int stateCount;
    private final long stateCreates;
    private final long hits;
    private final long misses;
    private final boolean disabled;

    CacheStats(final int stateCount, final long stateCreates, final long hits, final long misses,
               final boolean disabled) {
        this.stateCount = stateCount;
        this.stateCreates = stateCreates;
        this.hits = hits;
        this.misses = misses;
        this.disabled = disabled;
    }

    /** Number of cached states currently held. */
    public int getStateCount() {
        return stateCount;
    }

    public long getStateCreates() {
        return stateCreates;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public boolean isDisabled() {
        return disabled;
    }

    /**
     * @return hits over lookups, or 0 when there have been none
     */
    public double hitRate() {
        final long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    @Override
    public String toString() {
        return "CacheStats{states=" + stateCount + ", creates=" + stateCreates + ", hits=" + hits +
                ", misses=" + misses + ", disabled=" + disabled + '}';
    }
}
