package intoto.error;

/**
 * Base of all failures reported by the signed-metadata core.
 * Every failure on untrusted input surfaces as one of the subclasses.
 */
public class InTotoException extends Exception {

    public InTotoException(String message) {
        super(message);
    }

    public InTotoException(String message, Throwable cause) {
        super(message, cause);
    }
}
