package software.fieldmatch.automaton.jmh;

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import software.fieldmatch.automaton.ByteMachine;
import software.fieldmatch.automaton.Configuration;
import software.fieldmatch.automaton.Patterns;
import software.fieldmatch.automaton.TraversalContext;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A machine holding many overlapping wildcard patterns on one field, and a fixed set of values to match against it.
 */
@State(Scope.Thread)
public class WildcardMachineState {

    public static final int VALUE_COUNT = 10_000;

    private static final String ALPHABET = "abcdefghij";

    @Param({ "true", "false" })
    public boolean shellStyleFastPath;

    @Param({ "1", "100" })
    public int patternCount;

    ByteMachine machine;
    TraversalContext context;
    final List<byte[]> values = new ArrayList<>(VALUE_COUNT);

    @Setup(Level.Trial)
    public void setup() {
        Configuration configuration = Configuration.builder()
                .withShellStyleFastPathEnabled(shellStyleFastPath)
                .build();
        machine = new ByteMachine(configuration);
        context = machine.newContext();

        Random random = new Random(42);
        for (int i = 0; i < patternCount; i++) {
            machine.addPattern(Patterns.wildcardMatch('"' + "*" + word(random, 2) + "*" + word(random, 2) + "*" + '"'));
        }
        for (int i = 0; i < VALUE_COUNT; i++) {
            values.add(('"' + word(random, 12) + '"').getBytes(StandardCharsets.UTF_8));
        }
    }

    private static String word(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
