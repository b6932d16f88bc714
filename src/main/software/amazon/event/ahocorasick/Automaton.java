package software.amazon.event.ahocorasick;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;

/**
 *  Represents an Aho-Corasick automaton matching many literal byte patterns in a single pass over the input.
 *
 *  An automaton has two phases. While building, patterns are added and the trie grows. The first call to
 *  {@link #build()}, or the first consume on one of its {@link MatchingContext}s, compiles it: failure and output links
 *  and transition indexes are computed, and from then on the automaton is frozen and further additions are rejected.
 *
 *  The concurrency strategy is: single-thread update enforced by synchronized on addPattern/build; once compiled the
 *  structure is read-only and may be shared by any number of matching contexts on any number of threads. The only
 *  thing those contexts write to is the per-pattern diagnostic match counter, which is atomic.
 */
@ThreadSafe
public class Automaton {

    private static final Logger logger = LoggerFactory.getLogger(Automaton.class);

    private enum Phase { BUILDING, COMPILED }

    private final AutomatonConfiguration configuration;

    private final TrieState root = new TrieState();

    private volatile Phase phase = Phase.BUILDING;

    private int patternCount = 0;
    private int stateCount = 1;

    /**
     * Creates a case-sensitive automaton with failure link pruning enabled.
     */
    public Automaton() {
        this(builder().buildConfig());
    }

    protected Automaton(AutomatonConfiguration configuration) {
        this.configuration = configuration;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Add a pattern, with no callback and no payload.
     *
     * @param pattern the pattern; must not be empty
     * @throws FrozenAutomatonException if the automaton has already been compiled
     */
    public void addPattern(@Nonnull final byte[] pattern) {
        addPattern(pattern, pattern.length, null, null);
    }

    /**
     * Add a pattern given as a String, encoded as UTF-8.
     */
    public void addPattern(@Nonnull final String pattern) {
        addPattern(pattern.getBytes(StandardCharsets.UTF_8));
    }

    public void addPattern(@Nonnull final String pattern, @Nullable final MatchCallback callback,
                           @Nullable final Object payload) {
        final byte[] bytes = pattern.getBytes(StandardCharsets.UTF_8);
        addPattern(bytes, bytes.length, callback, payload);
    }

    public void addPattern(@Nonnull final byte[] pattern, @Nullable final MatchCallback callback,
                           @Nullable final Object payload) {
        addPattern(pattern, pattern.length, callback, payload);
    }

    /**
     * Add a pattern to the trie. Adding the same pattern again does not change the trie or the pattern count, but the
     * callback and payload given last replace the earlier ones.
     *
     * @param pattern  holds the pattern bytes
     * @param length   the number of bytes of {@code pattern} to use, or 0 to use the bytes up to the first NUL byte (or
     *                 the whole array if it has none)
     * @param callback called for matches of this pattern when consuming with {@link ConsumeOption#INVOKE_CALLBACKS}
     * @param payload  opaque data reported with matches of this pattern
     * @throws FrozenAutomatonException if the automaton has already been compiled
     * @throws IllegalArgumentException if the length is out of range or the resulting pattern is empty
     */
    public synchronized void addPattern(@Nonnull final byte[] pattern, final int length,
                                        @Nullable final MatchCallback callback, @Nullable final Object payload) {
        if (phase == Phase.COMPILED) {
            throw new FrozenAutomatonException("Patterns cannot be added once the automaton is compiled");
        }
        if (length < 0 || length > pattern.length) {
            throw new IllegalArgumentException("Pattern length " + length + " out of range [0, " + pattern.length + "]");
        }
        final int effectiveLength = length == 0 ? nulTerminatedLength(pattern) : length;
        if (effectiveLength == 0) {
            throw new IllegalArgumentException("Empty patterns are not allowed");
        }

        TrieState state = root;
        for (int i = 0; i < effectiveLength; i++) {
            final byte symbol = normalize(pattern[i]);
            if (state.getChild(symbol) == null) {
                stateCount++;
            }
            state = state.getOrCreateChild(symbol, pattern);
        }
        if (state.markOutput(callback, payload)) {
            patternCount++;
        }
    }

    /**
     * Compiles the automaton. Calling this more than once has no further effect.
     */
    public synchronized void build() {
        if (phase == Phase.COMPILED) {
            return;
        }
        final int states = LinkBuilder.link(root, configuration.isFailureLinkPruning());
        phase = Phase.COMPILED;
        logger.debug("Compiled automaton with {} patterns and {} states (caseInsensitive={}, failureLinkPruning={})",
                patternCount, states, configuration.isCaseInsensitive(), configuration.isFailureLinkPruning());
    }

    /**
     * Creates a new matching context positioned at the start of a stream.
     */
    public MatchingContext newContext() {
        return new MatchingContext(this);
    }

    public boolean isCompiled() {
        return phase == Phase.COMPILED;
    }

    public boolean isCaseInsensitive() {
        return configuration.isCaseInsensitive();
    }

    public boolean isFailureLinkPruning() {
        return configuration.isFailureLinkPruning();
    }

    /**
     * Returns the number of distinct patterns, which is lower than the number of add calls if a pattern was added
     * more than once.
     */
    public synchronized int getPatternCount() {
        return patternCount;
    }

    /**
     * Returns the number of trie states, root included.
     */
    public synchronized int getStateCount() {
        return stateCount;
    }

    /**
     * Returns how many times the given pattern has been matched, summed over all matching contexts of this automaton.
     *
     * @param pattern the pattern, as it was added
     * @return the match count, or 0 if the pattern is not in the automaton
     */
    public long getPatternMatchCount(@Nonnull final byte[] pattern) {
        final TrieState state = find(pattern);
        return state == null || !state.isOutput() ? 0 : state.getMatchCount();
    }

    public long getPatternMatchCount(@Nonnull final String pattern) {
        return getPatternMatchCount(pattern.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns true if the given bytes were added as a pattern.
     */
    public boolean containsPattern(@Nonnull final byte[] pattern) {
        final TrieState state = find(pattern);
        return state != null && state.isOutput();
    }

    private synchronized TrieState find(final byte[] pattern) {
        TrieState state = root;
        for (int i = 0; i < pattern.length && state != null; i++) {
            state = state.getChild(normalize(pattern[i]));
        }
        return state;
    }

    TrieState getRoot() {
        return root;
    }

    /**
     * Folds ASCII upper case letters to lower case when the automaton is case-insensitive. Other bytes, including
     * non-ASCII ones, are left as they are.
     */
    byte normalize(final byte b) {
        if (configuration.isCaseInsensitive() && b >= 'A' && b <= 'Z') {
            return (byte) (b + ('a' - 'A'));
        }
        return b;
    }

    private static int nulTerminatedLength(final byte[] pattern) {
        for (int i = 0; i < pattern.length; i++) {
            if (pattern[i] == 0) {
                return i;
            }
        }
        return pattern.length;
    }

    @Override
    public String toString() {
        return "Automaton{patterns=" + getPatternCount() + ", states=" + getStateCount() + ", phase=" + phase + "}";
    }

    public static class Builder {

        /**
         * If true, ASCII letters in patterns and input are folded to lower case, so that a pattern matches regardless
         * of the case of its letters. Bytes outside the ASCII letter ranges are compared as they are.
         */
        private boolean caseInsensitive = false;

        /**
         * If true, compilation shortens failure chains by skipping failure targets whose outgoing symbols all leave
         * the failing state too, since falling back to such a target can never find a transition. This only saves
         * work on mismatches; matches are the same either way.
         */
        private boolean failureLinkPruning = true;

        Builder() {}

        public Builder withCaseInsensitive(boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
            return this;
        }

        public Builder withFailureLinkPruning(boolean failureLinkPruning) {
            this.failureLinkPruning = failureLinkPruning;
            return this;
        }

        public Automaton build() {
            return new Automaton(buildConfig());
        }

        AutomatonConfiguration buildConfig() {
            return new AutomatonConfiguration(caseInsensitive, failureLinkPruning);
        }
    }
}
