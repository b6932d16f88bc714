package software.amazon.event.ahocorasick;

/**
 * Options for {@link MatchingContext#consume}. With none of them set, a consume call returns as soon as it finds the
 * first match and records nothing beyond the counters.
 */
public enum ConsumeOption {
    MATCH_ALL,          // keep scanning after the first match, and report the shorter suffix patterns too
    RECORD_MATCHES,     // append a Match to the context's match list for every match
    INVOKE_CALLBACKS    // call the callback registered with each matching pattern
}
