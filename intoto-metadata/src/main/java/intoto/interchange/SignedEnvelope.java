package intoto.interchange;

import intoto.crypto.Signature;

import java.util.List;
import java.util.Objects;

/**
 * Wire shape of a signed document: {@code {"signatures": [...], "signed": <payload>}}.
 */
public record SignedEnvelope<R>(
        List<Signature> signatures,
        R signed
) {
    public static final String SIGNATURES_FIELD = "signatures";
    public static final String SIGNED_FIELD = "signed";

    public SignedEnvelope {
        signatures = List.copyOf(signatures);
        Objects.requireNonNull(signed, SIGNED_FIELD);
    }
}
