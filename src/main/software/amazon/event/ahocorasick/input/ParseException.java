package software.amazon.event.ahocorasick.input;

/**
 * A RuntimeException that indicates an error parsing a pattern.
 */
public class ParseException extends RuntimeException {

    public ParseException(String msg) {
        super(msg);
    }

}
