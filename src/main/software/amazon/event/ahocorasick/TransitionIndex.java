package software.amazon.event.ahocorasick;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;

/**
 * Read-only lookup structure over the children of one state. Children are sorted by unsigned symbol value and
 * searched by halving the range, which walks the same path as a balanced binary search tree whose root is the
 * median child and whose subtrees are built recursively from the two halves. Lookup cost is logarithmic in the
 * number of distinct symbols leaving the state, however many patterns the automaton holds.
 */
@Immutable
final class TransitionIndex {

    static final TransitionIndex EMPTY = new TransitionIndex(new int[0], new TrieState[0]);

    private static final Comparator<TrieState> BY_SYMBOL = Comparator.comparingInt(s -> s.getSymbol() & 0xFF);

    // unsigned symbol values, ascending
    private final int[] symbols;
    private final TrieState[] targets;

    private TransitionIndex(int[] symbols, TrieState[] targets) {
        this.symbols = symbols;
        this.targets = targets;
    }

    /**
     * Builds the index over the given children. Siblings never share a symbol, so the sort is total.
     *
     * @param children the children of one state
     * @return the index, or {@link #EMPTY} if there are no children
     */
    static TransitionIndex of(Collection<TrieState> children) {
        if (children.isEmpty()) {
            return EMPTY;
        }
        TrieState[] sorted = children.toArray(new TrieState[0]);
        Arrays.sort(sorted, BY_SYMBOL);
        int[] symbols = new int[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            symbols[i] = sorted[i].getSymbol() & 0xFF;
        }
        return new TransitionIndex(symbols, sorted);
    }

    /**
     * Returns the child reached on the given symbol, or {@code null} if there is no such transition.
     */
    @Nullable
    TrieState find(byte symbol) {
        final int key = symbol & 0xFF;
        int low = 0;
        int high = symbols.length - 1;
        while (low <= high) {
            final int mid = (low + high) >>> 1;
            final int midSymbol = symbols[mid];
            if (midSymbol < key) {
                low = mid + 1;
            } else if (midSymbol > key) {
                high = mid - 1;
            } else {
                return targets[mid];
            }
        }
        return null;
    }

    int size() {
        return symbols.length;
    }

    /**
     * Returns the number of comparisons a lookup may need in the worst case, i.e. the height of the implied tree.
     */
    int height() {
        return 32 - Integer.numberOfLeadingZeros(symbols.length);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TI: ");
        for (int i = 0; i < symbols.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(symbols[i]);
        }
        return sb.toString();
    }
}
