package intoto.model;

import intoto.crypto.KeyId;
import intoto.error.VerificationFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives per-signature outcomes during {@link SignedMetadata#verify}.
 * None of these events fail verification by themselves.
 */
public interface VerificationListener {

    /** A signature from an authorized key verified and counted toward the threshold. */
    void goodSignature(KeyId keyId);

    /** A signature from an authorized key did not verify. */
    void badSignature(KeyId keyId, VerificationFailureException cause);

    /** A signature came from a key that is not in the authorized set. */
    void unauthorizedKey(KeyId keyId);

    /** Listener that logs through SLF4J: good signatures at DEBUG, the rest at WARN. */
    static VerificationListener logging() {
        return LoggingListener.INSTANCE;
    }

    /** Listener that ignores every event. */
    static VerificationListener ignoring() {
        return IgnoringListener.INSTANCE;
    }

    final class LoggingListener implements VerificationListener {

        private static final Logger log = LoggerFactory.getLogger(SignedMetadata.class);
        private static final LoggingListener INSTANCE = new LoggingListener();

        private LoggingListener() {}

        @Override
        public void goodSignature(KeyId keyId) {
            log.debug("Good signature from key ID {}", keyId);
        }

        @Override
        public void badSignature(KeyId keyId, VerificationFailureException cause) {
            log.warn("Bad signature from key ID {}: {}", keyId, cause.getMessage());
        }

        @Override
        public void unauthorizedKey(KeyId keyId) {
            log.warn("Key ID {} was not found in the set of authorized keys", keyId);
        }
    }

    final class IgnoringListener implements VerificationListener {

        private static final IgnoringListener INSTANCE = new IgnoringListener();

        private IgnoringListener() {}

        @Override
        public void goodSignature(KeyId keyId) {}

        @Override
        public void badSignature(KeyId keyId, VerificationFailureException cause) {}

        @Override
        public void unauthorizedKey(KeyId keyId) {}
    }
}
