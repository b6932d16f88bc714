package software.amazon.event.ahocorasick;

/**
 * Thrown when a pattern is added to an automaton that has already been compiled. The automaton is left unchanged.
 */
public class FrozenAutomatonException extends IllegalStateException {

    public FrozenAutomatonException(String msg) {
        super(msg);
    }
}
