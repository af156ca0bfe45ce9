package intoto.error;

/**
 * An operation was invoked with structurally incompatible inputs,
 * e.g. merging signatures of two different payloads.
 */
public class InvalidArgumentException extends InTotoException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
