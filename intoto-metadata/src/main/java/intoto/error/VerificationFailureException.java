package intoto.error;

/**
 * Signature verification did not establish trust.
 */
public class VerificationFailureException extends InTotoException {

    public VerificationFailureException(String message) {
        super(message);
    }

    public VerificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
