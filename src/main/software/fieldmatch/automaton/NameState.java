package software.fieldmatch.automaton;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The hand-off point out of a value automaton. When a traversal reaches a node carrying a NameState, the
 * surrounding system continues with whatever this NameState stands for: the matcher of the next field of a
 * multi-field pattern, or the completion of a pattern.
 *
 * The automaton never looks inside a NameState. Two NameStates are the same only if they are the same object,
 * so equals and hashCode are left as identity.
 */
@Immutable
public class NameState {

    @Nullable
    private final String label;

    public NameState() {
        this(null);
    }

    /**
     * @param label a name used only in diagnostics and toString, may be null
     */
    public NameState(@Nullable final String label) {
        this.label = label;
    }

    @Nullable
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label == null ? "NS: HC=" + hashCode() : "NS: " + label;
    }
}
