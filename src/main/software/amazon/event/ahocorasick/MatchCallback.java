package software.amazon.event.ahocorasick;

/**
 * Receives a match when a {@link MatchingContext} consumes input with {@link ConsumeOption#INVOKE_CALLBACKS}. The
 * callback is the one registered together with the pattern that matched.
 */
@FunctionalInterface
public interface MatchCallback {

    /**
     * @param automaton the automaton the pattern belongs to
     * @param match     the match, including the payload registered with the pattern
     */
    void onMatch(Automaton automaton, Match match);
}
