package software.amazon.event.ahocorasick;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The cursor of one matching session over an {@link Automaton}. It remembers the automaton state reached by the last
 * consumed byte, so a stream may be fed in chunks over several consume calls and patterns spanning chunk boundaries
 * are still found. Feeding the chunks of one stream to a single context gives the same matches, at the same absolute
 * offsets, as consuming the whole stream at once.
 *
 * A context must only be driven by one thread at a time. Many contexts may share one automaton.
 */
@NotThreadSafe
public class MatchingContext {

    private static final Set<ConsumeOption> FIRST_MATCH_ONLY = Collections.unmodifiableSet(
            EnumSet.noneOf(ConsumeOption.class));

    private final Automaton automaton;

    private TrieState current;

    // bytes consumed since creation or the last reset, over all calls
    private long processed = 0;

    // bytes consumed by the current (or last) call
    private long callOffset = 0;

    private long matchCount = 0;

    private List<Match> matches = null;

    MatchingContext(final Automaton automaton) {
        this.automaton = automaton;
        this.current = automaton.getRoot();
    }

    /**
     * Consume the given bytes, returning on the first match.
     */
    public ConsumeResult consume(@Nonnull final byte[] data) {
        return consume(data, 0, data.length, FIRST_MATCH_ONLY);
    }

    public ConsumeResult consume(@Nonnull final byte[] data, @Nonnull final Set<ConsumeOption> options) {
        return consume(data, 0, data.length, options);
    }

    /**
     * Consume the remaining bytes of the buffer. The buffer's position is advanced past the bytes actually consumed,
     * which is fewer than all of them if the call returned early on a first match.
     */
    public ConsumeResult consume(@Nonnull final ByteBuffer data, @Nonnull final Set<ConsumeOption> options) {
        final ConsumeResult result;
        if (data.hasArray()) {
            result = consume(data.array(), data.arrayOffset() + data.position(), data.remaining(), options);
        } else {
            final byte[] copy = new byte[data.remaining()];
            data.duplicate().get(copy);
            result = consume(copy, 0, copy.length, options);
        }
        data.position(data.position() + (int) callOffset);
        return result;
    }

    /**
     * Run the given bytes through the automaton, compiling it first if that has not happened yet.
     *
     * For every byte, the automaton moves from the current state along the transition on that byte, falling back
     * along failure links until a transition exists or root is reached. Reaching a state where patterns end is a
     * match. The longest pattern ending at this position is reported first, then the shorter ones that are suffixes
     * of it. Without {@link ConsumeOption#MATCH_ALL} the call returns right after the first match is reported.
     *
     * @param data    holds the bytes to consume
     * @param offset  index of the first byte to consume
     * @param length  number of bytes to consume
     * @param options what to do with matches
     * @return {@link ConsumeResult#MATCH_FOUND} if at least one match was reported during this call
     */
    public ConsumeResult consume(@Nonnull final byte[] data, final int offset, final int length,
                                 @Nonnull final Set<ConsumeOption> options) {
        if (offset < 0 || length < 0 || offset > data.length - length) {
            throw new IndexOutOfBoundsException("offset " + offset + ", length " + length + ", array " + data.length);
        }
        if (!automaton.isCompiled()) {
            automaton.build();
        }

        final boolean matchAll = options.contains(ConsumeOption.MATCH_ALL);
        final boolean record = options.contains(ConsumeOption.RECORD_MATCHES);
        final boolean invokeCallbacks = options.contains(ConsumeOption.INVOKE_CALLBACKS);

        final TrieState root = automaton.getRoot();
        boolean found = false;
        TrieState state = current;
        callOffset = 0;

        final int end = offset + length;
        for (int i = offset; i < end; i++) {
            final byte symbol = automaton.normalize(data[i]);
            processed++;
            callOffset++;

            TrieState next = state.step(symbol);
            while (next == null && !state.isRoot()) {
                state = state.getFail();
                next = state.step(symbol);
            }
            if (next == null) {
                // no pattern continues with this byte; stay at root
                continue;
            }
            state = next;
            current = state;

            TrieState matched = state.isOutput() ? state : state.getOutputs();
            while (matched != null) {
                found = true;
                report(matched, record, invokeCallbacks);
                if (!matchAll) {
                    return ConsumeResult.MATCH_FOUND;
                }
                matched = matched.getOutputs();
            }
        }
        current = state;
        return found ? ConsumeResult.MATCH_FOUND : ConsumeResult.NO_MATCH;
    }

    private void report(final TrieState state, final boolean record, final boolean invokeCallbacks) {
        state.incrementMatchCount();
        matchCount++;

        if (!record && !invokeCallbacks) {
            return;
        }
        final int length = state.getDepth();
        final Match match = new Match(state.getPrefix(), processed - length, callOffset - length, state.getPayload());
        if (invokeCallbacks) {
            final MatchCallback callback = state.getCallback();
            if (callback != null) {
                callback.onMatch(automaton, match);
            }
        }
        if (record) {
            if (matches == null) {
                matches = new ArrayList<>();
            }
            matches.add(match);
        }
    }

    /**
     * Return this context to the start of a stream: root state, zero counters and an empty match list.
     */
    public void reset() {
        current = automaton.getRoot();
        processed = 0;
        callOffset = 0;
        matchCount = 0;
        if (matches != null) {
            matches.clear();
        }
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public long getProcessed() {
        return processed;
    }

    public long getCallOffset() {
        return callOffset;
    }

    public long getMatchCount() {
        return matchCount;
    }

    /**
     * Returns the matches recorded so far, in the order they were found. Only consume calls with
     * {@link ConsumeOption#RECORD_MATCHES} add to this list.
     */
    public List<Match> getMatches() {
        return matches == null ? Collections.emptyList() : Collections.unmodifiableList(matches);
    }

    /**
     * Returns the prefix spelled by the state this context is at, i.e. the longest suffix of the consumed input that
     * could still grow into a pattern.
     */
    byte[] getCurrentPrefix() {
        return current.getPrefix();
    }

    @Override
    public String toString() {
        return "MatchingContext{processed=" + processed + ", matches=" + matchCount
                + ", prefix=" + new String(getCurrentPrefix(), StandardCharsets.UTF_8) + "}";
    }
}
