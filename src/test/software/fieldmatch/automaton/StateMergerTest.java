package software.fieldmatch.automaton;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class StateMergerTest {

    private static final List<String> VALUES = Arrays.asList(
            "\"\"", "\"foo\"", "\"bar\"", "\"foobar\"", "\"barfoo\"", "\"xaxbxcx\"", "\"cab\"", "\"abc\"",
            "\"fo\"", "\"foox\"", "\"xbar\"", "foo", "\"a\"");

    @Test
    public void WHEN_EitherSideIsNull_THEN_OtherSideIsReturned() {
        ByteState fragment = FragmentBuilder.build(Patterns.exactMatch("\"foo\""), new NameState());
        assertSame(fragment, StateMerger.merge(null, fragment));
        assertSame(fragment, StateMerger.merge(fragment, null));
        assertNull(StateMerger.merge(null, null));
    }

    @Test
    public void WHEN_StateIsMergedWithItself_THEN_ItIsReturned() {
        ByteState fragment = FragmentBuilder.build(Patterns.wildcardMatch("\"*a*\""), new NameState());
        assertSame(fragment, StateMerger.merge(fragment, fragment));
    }

    @Test
    public void WHEN_ExactFragmentsAreMerged_THEN_BothMatch() {
        NameState foo = new NameState("foo");
        NameState bar = new NameState("bar");
        ByteState root = StateMerger.merge(
                FragmentBuilder.build(Patterns.exactMatch("\"foo\""), foo),
                FragmentBuilder.build(Patterns.exactMatch("\"bar\""), bar));

        assertEquals(Collections.singleton(foo), traverse(root, "\"foo\""));
        assertEquals(Collections.singleton(bar), traverse(root, "\"bar\""));
        assertThat(traverse(root, "\"baz\""), empty());
    }

    @Test
    public void WHEN_FragmentsShareAPrefix_THEN_SharedStepIsMergedAndBothMatch() {
        NameState foo = new NameState("foo");
        NameState food = new NameState("food");
        NameState prefix = new NameState("fo-prefix");
        ByteState root = StateMerger.merge(
                StateMerger.merge(
                        FragmentBuilder.build(Patterns.exactMatch("\"foo\""), foo),
                        FragmentBuilder.build(Patterns.exactMatch("\"food\""), food)),
                FragmentBuilder.build(Patterns.prefixMatch("\"fo"), prefix));

        assertThat(traverse(root, "\"foo\""), containsInAnyOrder(foo, prefix));
        assertThat(traverse(root, "\"food\""), containsInAnyOrder(food, prefix));
        assertThat(traverse(root, "\"fox\""), containsInAnyOrder(prefix));
    }

    @Test
    public void WHEN_FragmentsAreMerged_THEN_InputsAreNotModified() {
        NameState foo = new NameState("foo");
        NameState bar = new NameState("bar");
        ByteState fooRoot = FragmentBuilder.build(Patterns.wildcardMatch("\"foo*\""), foo);
        ByteState barRoot = FragmentBuilder.build(Patterns.wildcardMatch("\"*bar\""), bar);
        String fooBefore = fooRoot.toString();
        String barBefore = barRoot.toString();

        ByteState merged = StateMerger.merge(fooRoot, barRoot);

        assertThat(traverse(merged, "\"foobar\""), containsInAnyOrder(foo, bar));
        assertEquals(fooBefore, fooRoot.toString());
        assertEquals(barBefore, barRoot.toString());
        assertEquals(Collections.singleton(foo), traverse(fooRoot, "\"foobar\""));
        assertEquals(Collections.singleton(bar), traverse(barRoot, "\"foobar\""));
    }

    @Test
    public void WHEN_WildcardFragmentsAreMerged_THEN_MergeTerminatesAndBothMatch() {
        NameState a = new NameState("a");
        NameState b = new NameState("b");
        ByteState root = StateMerger.merge(
                FragmentBuilder.build(Patterns.wildcardMatch("\"*a*\""), a),
                FragmentBuilder.build(Patterns.wildcardMatch("\"*b*\""), b));

        assertThat(traverse(root, "\"xaxbx\""), containsInAnyOrder(a, b));
        assertThat(traverse(root, "\"xax\""), containsInAnyOrder(a));
        assertThat(traverse(root, "\"xxx\""), empty());
    }

    @Test
    public void WHEN_SameFragmentIsMergedTwice_THEN_ResultsAreUnchanged() {
        NameState ns = new NameState();
        ByteState once = StateMerger.merge(
                FragmentBuilder.build(Patterns.exactMatch("\"foo\""), ns),
                FragmentBuilder.build(Patterns.wildcardMatch("\"*a*b*c*\""), ns));
        ByteState twice = StateMerger.merge(once, FragmentBuilder.build(Patterns.wildcardMatch("\"*a*b*c*\""), ns));

        for (String value : VALUES) {
            assertEquals(value, traverse(once, value), traverse(twice, value));
        }
    }

    @Test
    public void WHEN_MergeOrderChanges_THEN_ResultsAreUnchanged() {
        NameState nsA = new NameState("A");
        NameState nsB = new NameState("B");
        NameState nsC = new NameState("C");

        ByteState left = StateMerger.merge(StateMerger.merge(fragmentA(nsA), fragmentB(nsB)), fragmentC(nsC));
        ByteState right = StateMerger.merge(fragmentA(nsA), StateMerger.merge(fragmentB(nsB), fragmentC(nsC)));
        ByteState reversed = StateMerger.merge(StateMerger.merge(fragmentC(nsC), fragmentB(nsB)), fragmentA(nsA));

        for (String value : VALUES) {
            Set<NameState> expected = traverse(left, value);
            assertEquals(value, expected, traverse(right, value));
            assertEquals(value, expected, traverse(reversed, value));
        }
        assertThat(traverse(left, "\"foobar\""), containsInAnyOrder(nsA, nsB, nsC));
    }

    @Test
    public void WHEN_MergedAutomatonIsTraversed_THEN_ResultIsUnionOfSeparateTraversals() {
        NameState nsA = new NameState("A");
        NameState nsB = new NameState("B");
        NameState nsC = new NameState("C");
        ByteState a = fragmentA(nsA);
        ByteState b = fragmentB(nsB);
        ByteState c = fragmentC(nsC);
        ByteState merged = StateMerger.merge(StateMerger.merge(a, b), c);

        for (String value : VALUES) {
            Set<NameState> expected = new HashSet<>(traverse(a, value));
            expected.addAll(traverse(b, value));
            expected.addAll(traverse(c, value));
            assertEquals(value, expected, traverse(merged, value));
        }
    }

    private static ByteState fragmentA(NameState ns) {
        return FragmentBuilder.build(Patterns.wildcardMatch("\"foo*\""), ns);
    }

    private static ByteState fragmentB(NameState ns) {
        return FragmentBuilder.build(Patterns.suffixMatch("bar\""), ns);
    }

    private static ByteState fragmentC(NameState ns) {
        return FragmentBuilder.build(Patterns.wildcardMatch("\"*o*a*\""), ns);
    }

    static Set<NameState> traverse(ByteState root, String value) {
        return NfaTraversal.traverse(root, value.getBytes(StandardCharsets.UTF_8), Collections.emptySet(),
                Configuration.DEFAULT);
    }
}
