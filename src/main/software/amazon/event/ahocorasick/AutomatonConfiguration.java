package software.amazon.event.ahocorasick;

/**
 * Configuration for an Automaton. For descriptions of the options, see Automaton.Builder.
 */
class AutomatonConfiguration {

    private final boolean caseInsensitive;
    private final boolean failureLinkPruning;

    AutomatonConfiguration(boolean caseInsensitive, boolean failureLinkPruning) {
        this.caseInsensitive = caseInsensitive;
        this.failureLinkPruning = failureLinkPruning;
    }

    boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    boolean isFailureLinkPruning() {
        return failureLinkPruning;
    }
}
