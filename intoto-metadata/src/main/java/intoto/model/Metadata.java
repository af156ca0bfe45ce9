package intoto.model;

/**
 * A document that can be signed and verified.
 * Implementations must be (de)serializable by the interchange in use.
 */
public interface Metadata {

    /** The version number. */
    int version();
}
