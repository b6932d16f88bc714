package software.amazon.event.ahocorasick;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * Turns a plain pattern trie into an Aho-Corasick automaton. This is a one-time pass, run by {@link Automaton} once all
 * patterns have been added:
 * <ol>
 *     <li>failure links, assigned breadth-first from root;</li>
 *     <li>output links, pointing each state at the nearest output state on its failure chain;</li>
 *     <li>optionally, pruning of failure targets that can never supply a transition;</li>
 *     <li>the per-state transition indexes used by matching.</li>
 * </ol>
 */
final class LinkBuilder {

    private static final Logger logger = LoggerFactory.getLogger(LinkBuilder.class);

    private LinkBuilder() { }

    /**
     * Runs every step over the trie hanging from the given root.
     *
     * @param root                the root state
     * @param pruneFailureLinks   whether to shorten failure chains
     * @return the number of states in the trie, root included
     */
    static int link(final TrieState root, final boolean pruneFailureLinks) {
        final List<TrieState> breadthFirst = breadthFirst(root);

        linkFailures(root, breadthFirst);
        linkOutputs(root, breadthFirst);
        if (pruneFailureLinks) {
            pruneFailures(root, breadthFirst);
        }
        final TransitionIndex widest = buildTransitionIndexes(breadthFirst);

        logger.debug("Linked {} states, widest state has {} transitions (lookup depth {})",
                breadthFirst.size(), widest.size(), widest.height());
        return breadthFirst.size();
    }

    /**
     * Lists all states so that every state comes after its parent and after every state of smaller depth.
     */
    static List<TrieState> breadthFirst(final TrieState root) {
        final List<TrieState> order = new ArrayList<>();
        final Queue<TrieState> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            final TrieState state = queue.remove();
            order.add(state);
            queue.addAll(state.getChildren());
        }
        return order;
    }

    /**
     * A state's failure target is the state spelling the longest proper suffix of its own prefix that is also a path
     * from root. It is found by walking the parent's failure chain until some state there has a transition on the
     * incoming symbol. States one level below root always fail to root.
     */
    static void linkFailures(final TrieState root, final List<TrieState> breadthFirst) {
        root.setFail(root);
        for (TrieState state : breadthFirst) {
            if (state.isRoot()) {
                continue;
            }
            final TrieState parent = state.getParent();
            if (parent.isRoot()) {
                state.setFail(root);
                continue;
            }

            final byte symbol = state.getSymbol();
            TrieState candidate = parent.getFail();
            TrieState target = candidate.getChild(symbol);
            while (target == null && !candidate.isRoot()) {
                candidate = candidate.getFail();
                target = candidate.getChild(symbol);
            }
            state.setFail(target == null ? root : target);
        }
    }

    /**
     * Points each state at the first output state on its failure chain, root excluded. Matching then reaches every
     * pattern that is a suffix of the current position by following output links only.
     */
    static void linkOutputs(final TrieState root, final List<TrieState> breadthFirst) {
        for (TrieState state : breadthFirst) {
            state.setOutputs(null);
            if (state.isRoot()) {
                continue;
            }
            for (TrieState candidate = state.getFail(); !candidate.isRoot(); candidate = candidate.getFail()) {
                if (candidate.isOutput()) {
                    state.setOutputs(candidate);
                    break;
                }
            }
        }
    }

    /**
     * Skips failure targets that cannot produce a transition. When matching falls back from a state, it is because
     * the input symbol is not one of the state's own outgoing symbols; a failure target whose outgoing symbols are all
     * among the state's own therefore cannot have that transition either, and the walk may go straight on to the
     * target's own failure target. Output links were computed beforehand and are left alone.
     *
     * Parents are processed before children, so the failure chains being walked are already pruned.
     */
    static void pruneFailures(final TrieState root, final List<TrieState> breadthFirst) {
        for (TrieState state : breadthFirst) {
            if (state.isRoot()) {
                continue;
            }
            TrieState target = state.getFail();
            while (!target.isRoot() && state.coversSymbolsOf(target)) {
                target = target.getFail();
            }
            state.setFail(target);
        }
    }

    /**
     * @return the largest index built, or {@link TransitionIndex#EMPTY} if no state has children
     */
    static TransitionIndex buildTransitionIndexes(final List<TrieState> breadthFirst) {
        TransitionIndex widest = TransitionIndex.EMPTY;
        for (TrieState state : breadthFirst) {
            final TransitionIndex index = TransitionIndex.of(state.getChildren());
            state.setTransitions(index);
            if (index.size() > widest.size()) {
                widest = index;
            }
        }
        return widest;
    }
}
