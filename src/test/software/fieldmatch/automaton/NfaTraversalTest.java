package software.fieldmatch.automaton;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static software.fieldmatch.automaton.Constants.VALUE_TERMINATOR;

public class NfaTraversalTest {

    @Test
    public void WHEN_ValueMatchesOrderedWildcard_THEN_FieldTransitionIsReturned() {
        NameState ns = new NameState("abc");
        ByteState root = FragmentBuilder.build(Patterns.wildcardMatch("\"*a*b*c*\""), ns);

        assertEquals(Collections.singleton(ns), traverse(root, "\"xaxbxcx\""));
        assertThat(traverse(root, "\"cab\""), empty());
    }

    @Test
    public void WHEN_OverlappingWildcardsAreMerged_THEN_BothFieldTransitionsAreReturned() {
        NameState ab = new NameState("ab");
        NameState abc = new NameState("abc");
        ByteState root = StateMerger.merge(
                FragmentBuilder.build(Patterns.wildcardMatch("\"*ab*\""), ab),
                FragmentBuilder.build(Patterns.wildcardMatch("\"*abc*\""), abc));

        assertThat(traverse(root, "\"xabcx\""), containsInAnyOrder(ab, abc));
        assertThat(traverse(root, "\"xabx\""), containsInAnyOrder(ab));
        assertThat(traverse(root, "\"xacbx\""), empty());
    }

    @Test
    public void WHEN_IncomingIsGiven_THEN_ItIsPartOfTheResult() {
        NameState already = new NameState("already");
        ByteState root = FragmentBuilder.build(Patterns.exactMatch("\"foo\""), new NameState());

        Set<NameState> result = NfaTraversal.traverse(root, bytes("\"bar\""), Collections.singleton(already),
                Configuration.DEFAULT);
        assertEquals(Collections.singleton(already), result);
    }

    @Test
    public void WHEN_ValueIsOnlyAPrefixOfExactPattern_THEN_NoMatch() {
        NameState ns = new NameState();
        ByteState root = FragmentBuilder.build(Patterns.exactMatch("\"foo\""), ns);

        assertThat(traverse(root, "\"fo\""), empty());
        assertThat(traverse(root, "\"fooo\""), empty());
        assertEquals(Collections.singleton(ns), traverse(root, "\"foo\""));
    }

    @Test
    public void WHEN_PrefixPatternIsReachedMidValue_THEN_ItMatches() {
        NameState ns = new NameState();
        ByteState root = FragmentBuilder.build(Patterns.prefixMatch("\"foo"), ns);

        assertEquals(Collections.singleton(ns), traverse(root, "\"foobar\""));
        assertEquals(Collections.singleton(ns), traverse(root, "\"foo\""));
        assertThat(traverse(root, "\"fobar\""), empty());
    }

    @Test
    public void WHEN_SuffixPatternIsTraversed_THEN_OnlyValuesEndingWithItMatch() {
        NameState ns = new NameState();
        ByteState root = FragmentBuilder.build(Patterns.suffixMatch("bar\""), ns);

        assertEquals(Collections.singleton(ns), traverse(root, "\"foobar\""));
        assertEquals(Collections.singleton(ns), traverse(root, "\"bar\""));
        assertThat(traverse(root, "\"barfoo\""), empty());
    }

    @Test
    public void WHEN_PatternMatchesEverything_THEN_EmptyValueMatches() {
        NameState ns = new NameState();
        ByteState root = FragmentBuilder.build(Patterns.wildcardMatch("*"), ns);

        assertEquals(Collections.singleton(ns), traverse(root, ""));
        assertEquals(Collections.singleton(ns), traverse(root, "anything at all"));
    }

    @Test
    public void WHEN_ValueHasNonAsciiBytes_THEN_WildcardsConsumeThem() {
        NameState ns = new NameState();
        ByteState root = FragmentBuilder.build(Patterns.wildcardMatch("\"*ü*\""), ns);

        assertEquals(Collections.singleton(ns), traverse(root, "\"grüße\""));
        assertThat(traverse(root, "\"grusse\""), empty());
        assertEquals(Collections.singleton(ns),
                NfaTraversal.traverse(root, new byte[] { '"', (byte) 0xFF, (byte) 0xC3, (byte) 0xBC, '"' },
                        Collections.emptySet(), Configuration.DEFAULT));
    }

    @Test
    public void WHEN_SortingDedupeIsForced_THEN_ResultsAreTheSame() {
        Configuration sorting = Configuration.builder().withDedupeSortThreshold(1).build();
        NameState ns1 = new NameState();
        NameState ns2 = new NameState();
        NameState ns3 = new NameState();
        ByteState root = StateMerger.merge(StateMerger.merge(
                FragmentBuilder.build(Patterns.wildcardMatch("\"*a*a*\""), ns1),
                FragmentBuilder.build(Patterns.wildcardMatch("\"*a*b*\""), ns2)),
                FragmentBuilder.build(Patterns.wildcardMatch("\"*aa*\""), ns3));

        for (String value : Arrays.asList("\"aa\"", "\"ab\"", "\"xaaxbx\"", "\"b\"", "\"\"")) {
            assertEquals(value, traverse(root, value),
                    NfaTraversal.traverse(root, bytes(value), Collections.emptySet(), sorting));
        }
        assertThat(traverse(root, "\"xaaxbx\""), containsInAnyOrder(ns1, ns2, ns3));
    }

    @Test
    public void dedupeShouldRemoveDuplicatesBothWays() {
        ByteState a = new ByteState();
        ByteState b = new ByteState();
        ByteState c = new ByteState();
        List<ByteState> states = Arrays.asList(c, a, b, a, c, c);

        List<ByteState> scanned = NfaTraversal.dedupe(states, 100);
        assertEquals(Arrays.asList(c, a, b), scanned);

        List<ByteState> sorted = NfaTraversal.dedupe(states, 2);
        assertEquals(3, sorted.size());
        assertEquals(new HashSet<>(Arrays.asList(a, b, c)), new HashSet<>(sorted));
        assertTrue(sorted.get(0).getId() < sorted.get(1).getId());
        assertTrue(sorted.get(1).getId() < sorted.get(2).getId());
    }

    @Test
    public void stepStatesShouldReturnClosedStatesOrEmpty() {
        ByteState start = new ByteState();
        ByteState next = new ByteState();
        ByteState viaEpsilon = new ByteState();
        start.putStep('a', next);
        next.addEpsilon(viaEpsilon);

        List<ByteState> states = new ArrayList<>(Collections.singletonList(start));
        assertEquals(Arrays.asList(next, viaEpsilon), NfaTraversal.stepStates(states, 'a', 500));
        assertThat(NfaTraversal.stepStates(states, 'b', 500), empty());
        assertThat(NfaTraversal.stepStates(states, VALUE_TERMINATOR, 500), empty());
    }

    @Test
    public void stepStatesShouldGatherFromEveryState() {
        ByteState s1 = new ByteState();
        ByteState s2 = new ByteState();
        ByteState shared = new ByteState();
        s1.putStep('x', shared);
        s2.putStep('x', shared);

        List<ByteState> result = NfaTraversal.stepStates(Arrays.asList(s1, s2), 'x', 500);
        assertEquals(1, result.size());
        assertSame(shared, result.get(0));
    }

    static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static Set<NameState> traverse(ByteState root, String value) {
        return NfaTraversal.traverse(root, bytes(value), Collections.emptySet(), Configuration.DEFAULT);
    }
}
