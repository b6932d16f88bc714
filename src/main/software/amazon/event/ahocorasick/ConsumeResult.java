package software.amazon.event.ahocorasick;

/**
 * Outcome of one {@link MatchingContext#consume} call. Neither value is an error.
 */
public enum ConsumeResult {
    MATCH_FOUND,
    NO_MATCH;

    public boolean isMatch() {
        return this == MATCH_FOUND;
    }
}
