package intoto.error;

/**
 * Malformed path, malformed bytes, or a document that does not parse
 * against its declared schema.
 */
public class EncodingException extends InTotoException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
