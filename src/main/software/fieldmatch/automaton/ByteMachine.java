package software.fieldmatch.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static software.fieldmatch.automaton.Constants.QUOTE_BYTE;

/**
 * Matches one field's values against every pattern registered for that field. Patterns are compiled into a single
 * automaton over UTF-8 bytes by building a fragment per pattern and merging it in. A shell-style wildcard pattern
 * that is the field's only pattern is matched literally instead; once a second pattern arrives it is built into
 * the automaton like any other, so matching cost does not grow with the number of patterns.
 *
 * Adding patterns is serialized. Each addition builds new states next to the published ones and then publishes a
 * new start state, so matching never locks and always sees a complete automaton.
 */
@ThreadSafe
public class ByteMachine {

    private static final Logger logger = LoggerFactory.getLogger(ByteMachine.class);

    private final Configuration configuration;

    private volatile ByteState startState;

    private volatile FastPathPattern fastPathPattern;

    // guarded by this
    private int patternCount;

    public ByteMachine() {
        this(Configuration.DEFAULT);
    }

    public ByteMachine(@Nonnull final Configuration configuration) {
        this.configuration = configuration;
    }

    /**
     * Registers a pattern with a fresh NameState.
     *
     * @return the NameState reached when the pattern matches
     */
    public NameState addPattern(@Nonnull final Patterns pattern) {
        return addPattern(pattern, new NameState(pattern.pattern()));
    }

    /**
     * Registers a pattern so that values matching it lead to the given NameState.
     *
     * @param pattern the pattern, its text quoted the way values will be presented
     * @param nameState the NameState reached when the pattern matches
     * @return nameState
     */
    public synchronized NameState addPattern(@Nonnull final Patterns pattern, @Nonnull final NameState nameState) {
        if (patternCount == 0 && pattern.type() == MatchType.WILDCARD
                && configuration.isShellStyleFastPathEnabled()) {
            final ShellStyleMatcher matcher = ShellStyleMatcher.tryBuild(pattern.pattern());
            if (matcher != null) {
                logger.trace("Pattern {} matched literally by {}", pattern, matcher);
                patternCount++;
                fastPathPattern = new FastPathPattern(pattern, matcher, nameState);
                return nameState;
            }
            logger.trace("Pattern {} needs the automaton", pattern);
        }
        mergeFragment(FragmentBuilder.build(pattern, nameState));
        return nameState;
    }

    /**
     * Merges an automaton fragment into this machine and publishes the result. The fragment's states may be
     * shared with the machine afterwards and must not be changed. A pattern being matched literally is built into
     * the automaton in the same step, since it is no longer the field's only pattern.
     *
     * @param fragmentRoot the start state of the fragment
     */
    synchronized void mergeFragment(@Nonnull final ByteState fragmentRoot) {
        patternCount++;
        ByteState root = startState;
        final FastPathPattern fast = fastPathPattern;
        if (fast != null) {
            logger.trace("Moving pattern {} into the automaton", fast.pattern);
            root = StateMerger.merge(root, FragmentBuilder.build(fast.pattern, fast.nameState));
        }
        startState = StateMerger.merge(root, fragmentRoot);
        // cleared after publishing, so a reader in between sees the pattern twice rather than not at all
        fastPathPattern = null;
    }

    /**
     * Finds the NameStates for a value without caching.
     *
     * @param value the value as presented, strings including their quotes
     * @return every NameState whose pattern the value matches, empty if none
     */
    public Set<NameState> transitionOn(@Nonnull final String value) {
        return transitionOn(value.getBytes(StandardCharsets.UTF_8));
    }

    public Set<NameState> transitionOn(@Nonnull final byte[] value) {
        // read before the root: once the fast-path pattern is gone, the root that replaced it is visible
        final FastPathPattern fast = fastPathPattern;
        final ByteState root = startState;
        final Set<NameState> transitionTo = root == null
                ? new HashSet<>()
                : NfaTraversal.traverse(root, value, Collections.emptySet(), configuration);
        addFastPathMatch(fast, value, transitionTo);
        return transitionTo;
    }

    /**
     * Finds the NameStates for a value using the given context's cache. The result is the same as
     * {@link #transitionOn(byte[])}.
     */
    public Set<NameState> transitionOn(@Nonnull final byte[] value, @Nonnull final TraversalContext context) {
        final FastPathPattern fast = fastPathPattern;
        final ByteState root = startState;
        final Set<NameState> transitionTo = root == null
                ? new HashSet<>()
                : context.traverseWithCache(root, value, Collections.emptySet());
        addFastPathMatch(fast, value, transitionTo);
        return transitionTo;
    }

    public Set<NameState> transitionOn(@Nonnull final String value, @Nonnull final TraversalContext context) {
        return transitionOn(value.getBytes(StandardCharsets.UTF_8), context);
    }

    // The fast-path pattern was written quoted, so only quoted values can match it.
    private static void addFastPathMatch(@Nullable final FastPathPattern fast, final byte[] value,
                                         final Set<NameState> transitionTo) {
        if (fast == null || value.length < 2
                || value[0] != QUOTE_BYTE || value[value.length - 1] != QUOTE_BYTE) {
            return;
        }
        if (fast.matcher.match(value, 1, value.length - 1)) {
            transitionTo.add(fast.nameState);
        }
    }

    /**
     * A context whose cache is sized by this machine's configuration.
     */
    public TraversalContext newContext() {
        return new TraversalContext(configuration);
    }

    /**
     * @return the size of the largest set of states a traversal could be in, capped by the evaluator
     */
    public int evaluateComplexity(@Nonnull final MachineComplexityEvaluator evaluator) {
        final ByteState root = startState;
        return root == null ? 0 : evaluator.evaluate(root);
    }

    public boolean isEmpty() {
        final ByteState root = startState;
        return (root == null || (root.hasNoTransitions() && root.getFieldTransitions().isEmpty()))
                && fastPathPattern == null;
    }

    @Nullable
    ByteState getStartState() {
        return startState;
    }

    @Nullable
    ShellStyleMatcher getFastPathMatcher() {
        final FastPathPattern fast = fastPathPattern;
        return fast == null ? null : fast.matcher;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    @Override
    public String toString() {
        final ByteState root = startState;
        final FastPathPattern fast = fastPathPattern;
        return "ByteMachine{startState=" + (root == null ? "none" : "BS#" + root.getId()) +
                ", fastPath=" + (fast == null ? "none" : fast.matcher) + '}';
    }

    private static final class FastPathPattern {
        private final Patterns pattern;
        private final ShellStyleMatcher matcher;
        private final NameState nameState;

        private FastPathPattern(final Patterns pattern, final ShellStyleMatcher matcher, final NameState nameState) {
            this.pattern = pattern;
            this.matcher = matcher;
            this.nameState = nameState;
        }
    }
}
