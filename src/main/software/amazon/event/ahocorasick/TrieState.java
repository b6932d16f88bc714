package software.amazon.event.ahocorasick;

import it.unimi.dsi.fastutil.bytes.Byte2ObjectMap;
import it.unimi.dsi.fastutil.bytes.Byte2ObjectOpenHashMap;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Represents one node of the pattern trie, i.e. one distinct prefix of the added patterns. The trie edges live in
 * {@link #children}; the failure and output links are cross edges assigned by {@link LinkBuilder} and are never
 * followed when walking the trie itself.
 *
 * Once the owning automaton is compiled, everything except the diagnostic match counter is read-only.
 */
@ThreadSafe
class TrieState {

    private final byte symbol;
    private final int depth;
    private final TrieState parent;

    // bytes of the path from root, as given by the pattern that created this state
    private final byte[] prefix;

    private final Byte2ObjectMap<TrieState> children = new Byte2ObjectOpenHashMap<>(2);

    private boolean output = false;
    private MatchCallback callback;
    private Object payload;

    private TrieState fail;
    private TrieState outputs;
    private TransitionIndex transitions = TransitionIndex.EMPTY;

    private final AtomicLong matchCount = new AtomicLong(0);

    /**
     * Creates a root state.
     */
    TrieState() {
        this.symbol = 0;
        this.depth = 0;
        this.parent = null;
        this.prefix = new byte[0];
    }

    private TrieState(TrieState parent, byte symbol, byte[] prefix) {
        this.symbol = symbol;
        this.depth = parent.depth + 1;
        this.parent = parent;
        this.prefix = prefix;
    }

    byte getSymbol() {
        return symbol;
    }

    int getDepth() {
        return depth;
    }

    TrieState getParent() {
        return parent;
    }

    boolean isRoot() {
        return parent == null;
    }

    byte[] getPrefix() {
        return prefix;
    }

    /**
     * Returns the child reached on the given symbol while the trie is still being built. Matching goes through
     * {@link #step(byte)} instead.
     */
    @Nullable
    TrieState getChild(byte childSymbol) {
        return children.get(childSymbol);
    }

    /**
     * Returns the child for the given symbol, creating it if it does not exist yet.
     *
     * @param childSymbol the (already normalized) symbol
     * @param source      the pattern being inserted; its first {@code depth + 1} bytes become the child's prefix
     * @return the existing or newly created child
     */
    TrieState getOrCreateChild(byte childSymbol, byte[] source) {
        TrieState child = children.get(childSymbol);
        if (child == null) {
            byte[] childPrefix = new byte[depth + 1];
            System.arraycopy(source, 0, childPrefix, 0, depth + 1);
            child = new TrieState(this, childSymbol, childPrefix);
            children.put(childSymbol, child);
        }
        return child;
    }

    boolean hasChildren() {
        return !children.isEmpty();
    }

    Collection<TrieState> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    /**
     * Returns true if every outgoing symbol of the other state is also an outgoing symbol of this state.
     */
    boolean coversSymbolsOf(TrieState other) {
        if (other.children.size() > children.size()) {
            return false;
        }
        for (byte otherSymbol : other.children.keySet()) {
            if (!children.containsKey(otherSymbol)) {
                return false;
            }
        }
        return true;
    }

    boolean isOutput() {
        return output;
    }

    /**
     * Marks this state as the end of a pattern. Callback and payload are always overwritten.
     *
     * @return true if this state was not an output before
     */
    boolean markOutput(MatchCallback newCallback, Object newPayload) {
        boolean wasOutput = output;
        output = true;
        callback = newCallback;
        payload = newPayload;
        return !wasOutput;
    }

    @Nullable
    MatchCallback getCallback() {
        return callback;
    }

    @Nullable
    Object getPayload() {
        return payload;
    }

    TrieState getFail() {
        return fail;
    }

    void setFail(TrieState fail) {
        this.fail = fail;
    }

    /**
     * The nearest output state on this state's failure chain, or {@code null} if there is none.
     */
    @Nullable
    TrieState getOutputs() {
        return outputs;
    }

    void setOutputs(TrieState outputs) {
        this.outputs = outputs;
    }

    void setTransitions(TransitionIndex transitions) {
        this.transitions = transitions;
    }

    /**
     * The goto() function: returns the child on the given symbol using the compiled transition index.
     */
    @Nullable
    TrieState step(byte input) {
        return transitions.find(input);
    }

    long getMatchCount() {
        return matchCount.get();
    }

    void incrementMatchCount() {
        matchCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return "TS: D=" + depth + " P=" + new String(prefix, StandardCharsets.ISO_8859_1)
                + (output ? " OUT" : "");
    }
}
