package software.amazon.event.ahocorasick;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class LinkBuilderTest {

    @Test
    public void breadthFirstShouldListShallowStatesFirst() {
        Automaton automaton = automaton(false, "hers", "his", "she");
        List<TrieState> order = LinkBuilder.breadthFirst(automaton.getRoot());

        assertEquals(automaton.getStateCount(), order.size());
        assertSame(automaton.getRoot(), order.get(0));
        for (int i = 1; i < order.size(); i++) {
            assertTrue(order.get(i - 1).getDepth() <= order.get(i).getDepth());
        }
    }

    @Test
    public void shouldLinkFailuresOfClassicExample() {
        Automaton automaton = automaton(false, "he", "she", "his", "hers");
        automaton.build();
        TrieState root = automaton.getRoot();

        assertSame(root, root.getFail());
        assertSame(root, state(automaton, "h").getFail());
        assertSame(root, state(automaton, "s").getFail());
        assertSame(root, state(automaton, "he").getFail());
        assertSame(root, state(automaton, "hi").getFail());
        assertSame(state(automaton, "h"), state(automaton, "sh").getFail());
        assertSame(state(automaton, "he"), state(automaton, "she").getFail());
        assertSame(root, state(automaton, "her").getFail());
        assertSame(state(automaton, "s"), state(automaton, "hers").getFail());
        assertSame(state(automaton, "s"), state(automaton, "his").getFail());
    }

    @Test
    public void shouldLinkOutputsOfClassicExample() {
        Automaton automaton = automaton(true, "he", "she", "his", "hers");
        automaton.build();

        assertSame(state(automaton, "he"), state(automaton, "she").getOutputs());
        assertNull(state(automaton, "hers").getOutputs());
        assertNull(state(automaton, "his").getOutputs());
        assertNull(state(automaton, "sh").getOutputs());
        assertNull(automaton.getRoot().getOutputs());
    }

    @Test
    public void failureShouldFollowParentChainPastFirstCandidate() {
        // "aaa" fails to "aa", which has no 'b'; the longest suffix of "aaab" in the trie is "ab"
        Automaton automaton = automaton(false, "aaab", "ab");
        automaton.build();

        assertSame(state(automaton, "ab"), state(automaton, "aaab").getFail());
        assertSame(state(automaton, "ab"), state(automaton, "aaab").getOutputs());
    }

    @Test
    public void outputsShouldChainThroughSeveralSuffixes() {
        Automaton automaton = automaton(true, "abcd", "bcd", "cd", "d");
        automaton.build();

        TrieState outputs = state(automaton, "abcd").getOutputs();
        assertSame(state(automaton, "bcd"), outputs);
        assertSame(state(automaton, "cd"), outputs.getOutputs());
        assertSame(state(automaton, "d"), outputs.getOutputs().getOutputs());
        assertNull(state(automaton, "d").getOutputs());
    }

    @Test
    public void outputsShouldSkipNonOutputStatesOnChain() {
        Automaton automaton = automaton(true, "xyz", "yzq", "z");
        automaton.build();

        // "xyz" fails to "yz", which is not an output, and then to "z", which is
        assertSame(state(automaton, "yz"), unprunedFail(state(automaton, "xyz")));
        assertSame(state(automaton, "z"), state(automaton, "xyz").getOutputs());
    }

    @Test
    public void pruningShouldSkipTargetsWithoutUsefulTransitions() {
        Automaton unpruned = automaton(false, "xabc", "abc", "bz");
        unpruned.build();
        assertSame(state(unpruned, "ab"), state(unpruned, "xab").getFail());
        assertSame(state(unpruned, "a"), state(unpruned, "xa").getFail());

        Automaton pruned = automaton(true, "xabc", "abc", "bz");
        pruned.build();
        // "ab" only offers 'c', which "xab" has itself; "b" offers 'z'
        assertSame(state(pruned, "b"), state(pruned, "xab").getFail());
        // "a" only offers 'b', which "xa" has itself, and "a" fails to root
        assertSame(pruned.getRoot(), state(pruned, "xa").getFail());
    }

    @Test
    public void pruningShouldNotChangeOutputs() {
        Automaton pruned = automaton(true, "xabc", "abc", "bz");
        pruned.build();

        assertSame(pruned.getRoot(), state(pruned, "xabc").getFail());
        assertSame(state(pruned, "abc"), state(pruned, "xabc").getOutputs());
    }

    @Test
    public void shouldBuildTransitionIndexForEveryState() {
        Automaton automaton = automaton(true, "he", "she", "his", "hers");
        automaton.build();

        for (TrieState state : LinkBuilder.breadthFirst(automaton.getRoot())) {
            for (TrieState child : state.getChildren()) {
                assertSame(child, state.step(child.getSymbol()));
            }
        }
        assertNotNull(automaton.getRoot().step((byte) 'h'));
        assertNull(automaton.getRoot().step((byte) 'e'));
    }

    @Test
    public void buildTransitionIndexesShouldReturnWidestIndex() {
        Automaton automaton = automaton(true, "ab", "ac", "ad", "b");
        List<TrieState> order = LinkBuilder.breadthFirst(automaton.getRoot());

        TransitionIndex widest = LinkBuilder.buildTransitionIndexes(order);

        assertSame(state(automaton, "ac"), widest.find((byte) 'c'));
        assertNull(widest.find((byte) 'a'));
        assertEquals(3, widest.size());
        assertEquals(2, widest.height());
    }

    @Test
    public void buildTransitionIndexesOfBareRootShouldBeEmpty() {
        TrieState root = new TrieState();
        assertSame(TransitionIndex.EMPTY, LinkBuilder.buildTransitionIndexes(LinkBuilder.breadthFirst(root)));
    }

    @Test
    public void linkShouldReturnStateCount() {
        Automaton automaton = automaton(true, "he", "she", "his", "hers");
        // root, h, he, her, hers, hi, his, s, sh, she
        assertEquals(10, LinkBuilder.link(automaton.getRoot(), true));
    }

    private static TrieState unprunedFail(TrieState state) {
        TrieState root = state;
        while (!root.isRoot()) {
            root = root.getParent();
        }
        // recompute without pruning
        List<TrieState> order = LinkBuilder.breadthFirst(root);
        LinkBuilder.linkFailures(root, order);
        return state.getFail();
    }

    private static Automaton automaton(boolean pruning, String... patterns) {
        Automaton automaton = Automaton.builder().withFailureLinkPruning(pruning).build();
        for (String pattern : patterns) {
            automaton.addPattern(pattern);
        }
        return automaton;
    }

    static TrieState state(Automaton automaton, String prefix) {
        TrieState state = automaton.getRoot();
        for (byte b : prefix.getBytes(StandardCharsets.UTF_8)) {
            state = state.getChild(b);
            assertNotNull("no state for " + prefix, state);
        }
        return state;
    }
}
