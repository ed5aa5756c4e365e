package software.fieldmatch.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static software.fieldmatch.automaton.Constants.ALPHABET_SIZE;

/**
 * A deterministic state standing in for one epsilon-closed set of automaton states. Its transitions are filled in
 * as traversals need them: a null slot has not been computed yet, while {@link #DEAD} records that the symbol leads
 * nowhere.
 */
final class LazyDfaState {

    static final LazyDfaState DEAD = new LazyDfaState(Collections.emptyList());

    private final LazyDfaState[] transitions = new LazyDfaState[ALPHABET_SIZE];

    private final List<ByteState> nfaStates;

    private final List<NameState> fieldTransitions;

    LazyDfaState(final List<ByteState> nfaStates) {
        this.nfaStates = nfaStates;
        List<NameState> union = new ArrayList<>();
        for (ByteState state : nfaStates) {
            for (NameState nameState : state.getFieldTransitions()) {
                if (!union.contains(nameState)) {
                    union.add(nameState);
                }
            }
        }
        this.fieldTransitions = union.isEmpty() ? Collections.emptyList() : Collections.unmodifiableList(union);
    }

    LazyDfaState getTransition(final int symbol) {
        return transitions[symbol];
    }

    void setTransition(final int symbol, final LazyDfaState next) {
        transitions[symbol] = next;
    }

    List<ByteState> getNfaStates() {
        return nfaStates;
    }

    List<NameState> getFieldTransitions() {
        return fieldTransitions;
    }

    boolean isDead() {
        return this == DEAD;
    }

    @Override
    public String toString() {
        if (isDead()) {
            return "LDS: DEAD";
        }
        StringBuilder sb = new StringBuilder("LDS: {");
        for (ByteState state : nfaStates) {
            sb.append(state.getId()).append(',');
        }
        sb.setCharAt(sb.length() - 1, '}');
        return sb.toString();
    }
}
