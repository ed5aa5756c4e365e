package software.fieldmatch.automaton;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static software.fieldmatch.automaton.Constants.ALPHABET_SIZE;

/**
 * Represents a state in a value automaton. A state maps each symbol to at most one next state through its ByteMap,
 * can move to further states without consuming a symbol through its epsilon edges, and carries the NameStates a
 * traversal hands off to once it reaches this state. Reaching several states at once through epsilon edges is what
 * makes the machine an NFA as opposed to a DFA.
 *
 * States are shared between many patterns once fragments have been merged, so a state is identified by the
 * object itself; {@link #getId()} is a stable integer form of that identity used to key sets of states.
 */
@ThreadSafe
class ByteState {

    private static final AtomicInteger ID_GENERATOR = new AtomicInteger();

    private final int id = ID_GENERATOR.incrementAndGet();

    private final ByteMap map;

    private volatile List<ByteState> epsilons = Collections.emptyList();

    private volatile List<NameState> fieldTransitions = Collections.emptyList();

    // Memoized on first use. Closures are only read on published states, which never gain edges; an edge added to
    //  this state drops its own memo, edges added further along do not.
    private volatile List<ByteState> epsilonClosure;

    ByteState() {
        this(new ByteMap());
    }

    ByteState(@Nonnull final ByteMap map) {
        this.map = map;
    }

    int getId() {
        return id;
    }

    /**
     * Returns the state the given symbol leads to.
     *
     * @param symbol a byte value in 0..255 or the value terminator
     * @return the next state, or {@code null} if this state has no step for the symbol
     */
    ByteState step(final int symbol) {
        if (symbol < 0 || symbol >= ALPHABET_SIZE) {
            throw new IllegalArgumentException("Symbol out of range: " + symbol);
        }
        return map.getStep(symbol);
    }

    ByteMap getMap() {
        return map;
    }

    /**
     * Associates the given symbol with the given next state, replacing any previous step for the symbol.
     */
    void putStep(final int symbol, @Nonnull final ByteState nextState) {
        map.putStep(symbol, nextState);
    }

    /**
     * Associates every byte value (never the terminator) with the given next state.
     */
    void putStepForAllBytes(@Nonnull final ByteState nextState) {
        map.putStepForAllBytes(nextState);
    }

    List<ByteState> getEpsilons() {
        return epsilons;
    }

    /**
     * Adds a zero-width edge to the given state. Adding an edge that already exists has no effect.
     */
    synchronized void addEpsilon(@Nonnull final ByteState target) {
        if (target == this || containsIdentity(epsilons, target)) {
            return;
        }
        List<ByteState> newEpsilons = new ArrayList<>(epsilons.size() + 1);
        newEpsilons.addAll(epsilons);
        newEpsilons.add(target);
        epsilons = Collections.unmodifiableList(newEpsilons);
        epsilonClosure = null;
    }

    /**
     * Adds zero-width edges to each of the given states, skipping any already present.
     */
    synchronized void addEpsilons(@Nonnull final List<ByteState> targets) {
        List<ByteState> newEpsilons = new ArrayList<>(epsilons.size() + targets.size());
        newEpsilons.addAll(epsilons);
        for (ByteState target : targets) {
            if (target != this && !containsIdentity(newEpsilons, target)) {
                newEpsilons.add(target);
            }
        }
        if (newEpsilons.size() != epsilons.size()) {
            epsilons = Collections.unmodifiableList(newEpsilons);
            epsilonClosure = null;
        }
    }

    List<NameState> getFieldTransitions() {
        return fieldTransitions;
    }

    /**
     * Adds a NameState handed off to when a traversal reaches this state. Adding the same NameState twice has no
     * effect.
     */
    synchronized void addFieldTransition(@Nonnull final NameState nameState) {
        if (containsIdentity(fieldTransitions, nameState)) {
            return;
        }
        List<NameState> newTransitions = new ArrayList<>(fieldTransitions.size() + 1);
        newTransitions.addAll(fieldTransitions);
        newTransitions.add(nameState);
        fieldTransitions = Collections.unmodifiableList(newTransitions);
    }

    /**
     * Adds each of the given NameStates, skipping any already present.
     */
    synchronized void addFieldTransitions(@Nonnull final List<NameState> nameStates) {
        List<NameState> newTransitions = new ArrayList<>(fieldTransitions.size() + nameStates.size());
        newTransitions.addAll(fieldTransitions);
        for (NameState nameState : nameStates) {
            if (!containsIdentity(newTransitions, nameState)) {
                newTransitions.add(nameState);
            }
        }
        if (newTransitions.size() != fieldTransitions.size()) {
            fieldTransitions = Collections.unmodifiableList(newTransitions);
        }
    }

    /**
     * Returns this state plus every state reachable from it through one or more epsilon edges, without duplicates.
     * This state is always first.
     *
     * @return the epsilon closure of this state
     */
    List<ByteState> getEpsilonClosure() {
        List<ByteState> closure = epsilonClosure;
        if (closure == null) {
            closure = computeEpsilonClosure();
            epsilonClosure = closure;
        }
        return closure;
    }

    private List<ByteState> computeEpsilonClosure() {
        if (epsilons.isEmpty()) {
            return Collections.singletonList(this);
        }
        final Set<ByteState> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        final List<ByteState> result = new ArrayList<>();
        final Deque<ByteState> toVisit = new ArrayDeque<>();
        toVisit.push(this);
        while (!toVisit.isEmpty()) {
            ByteState state = toVisit.pop();
            if (seen.add(state)) {
                result.add(state);
                for (ByteState target : state.getEpsilons()) {
                    if (!seen.contains(target)) {
                        toVisit.push(target);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns {@code true} if this state has neither steps nor epsilon edges.
     */
    boolean hasNoTransitions() {
        return map.isEmpty() && epsilons.isEmpty();
    }

    /**
     * Return true if this state has a self-referential step and no others. This is the shape of a wildcard spinner.
     *
     * @return True if this state has a self-referential step and no others, false otherwise.
     */
    boolean hasOnlySelfReferentialTransition() {
        return map.numberOfSteps() == 1 && map.hasStep(this);
    }

    private static <T> boolean containsIdentity(List<T> list, T element) {
        for (T each : list) {
            if (each == element) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BS#").append(id).append(": ").append(map);
        if (!epsilons.isEmpty()) {
            sb.append(" eps=[");
            for (ByteState epsilon : epsilons) {
                sb.append(epsilon.getId()).append(',');
            }
            sb.setCharAt(sb.length() - 1, ']');
        }
        if (!fieldTransitions.isEmpty()) {
            sb.append(" ft=").append(fieldTransitions);
        }
        return sb.toString();
    }
}
