package intoto.benchmark;

import com.fasterxml.jackson.databind.JsonNode;
import intoto.crypto.PrivateKey;
import intoto.crypto.PublicKey;
import intoto.crypto.SignatureScheme;
import intoto.error.InTotoException;
import intoto.model.MetadataFormat;
import intoto.model.RawSignedMetadata;
import intoto.model.SignedMetadata;
import intoto.model.SignedMetadataBuilder;
import intoto.model.VerificationListener;
import intoto.model.link.LinkMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the sign → serialize → parse → verify flow for a given signature scheme,
 * measuring wall-clock time for each phase.
 */
public class BenchmarkRunner {

    public static final List<String> TIME_METRICS = List.of(
            "Serialize", "Canonicalize", "Sign", "Build", "ToRaw", "Parse", "Verify t=1", "Verify t=all");
    public static final List<String> SIZE_METRICS = List.of("Signature", "SignedDoc");

    private static final int WARMUP_ITERATIONS = 5;

    /** Median time per metric in nanoseconds, and sizes in bytes, for one scheme. */
    public record Result(String schemeName, Map<String, Long> timings, Map<String, Integer> sizes) {
        public Result {
            timings = Map.copyOf(timings);
            sizes = Map.copyOf(sizes);
        }
    }

    private final int iterations;
    private final int signers;

    public BenchmarkRunner(int iterations, int signers) {
        if (iterations < 1 || signers < 1) {
            throw new IllegalArgumentException("iterations and signers must be positive");
        }
        this.iterations = iterations;
        this.signers = signers;
    }

    /**
     * Benchmark a single signature scheme end-to-end.
     *
     * @param scheme the signature scheme to measure
     * @param link   the document to sign (same across all schemes for fair comparison)
     * @return aggregated results (median timings)
     */
    public Result run(SignatureScheme scheme, LinkMetadata link) throws InTotoException {
        MetadataFormat<JsonNode, LinkMetadata> format = MetadataFormat.json(LinkMetadata.class);

        // Pre-generate keys once (not part of per-operation timing)
        List<PrivateKey> keys = new ArrayList<>();
        List<PublicKey> authorized = new ArrayList<>();
        for (int i = 0; i < signers; i++) {
            PrivateKey key = PrivateKey.generate(scheme);
            keys.add(key);
            authorized.add(key.publicKey());
        }

        // Warmup: let JIT compile hot paths
        for (int i = 0; i < WARMUP_ITERATIONS; i++) {
            runSingleIteration(format, link, keys, authorized);
        }

        List<long[]> allTimings = new ArrayList<>();
        int sigBytes = 0, docBytes = 0;

        for (int i = 0; i < iterations; i++) {
            TimedRun run = runSingleIteration(format, link, keys, authorized);
            allTimings.add(run.timings);

            if (i == 0) {
                // RSA and Ed25519 sizes are constant; ECDSA DER varies by a byte or two
                sigBytes = run.signed.signatures().get(0).value().length;
                docBytes = run.raw.asBytes().length;
            }
        }

        Map<String, Long> timings = new LinkedHashMap<>();
        for (int m = 0; m < TIME_METRICS.size(); m++) {
            final int idx = m;
            timings.put(TIME_METRICS.get(m), median(allTimings.stream().mapToLong(t -> t[idx]).sorted().toArray()));
        }

        return new Result(scheme.signer().algorithmName(), timings,
                Map.of("Signature", sigBytes, "SignedDoc", docBytes));
    }

    /** Timing data from a single iteration plus the generated artifacts. */
    private record TimedRun(long[] timings, SignedMetadata<JsonNode, LinkMetadata> signed,
                            RawSignedMetadata<JsonNode, LinkMetadata> raw) {}

    private TimedRun runSingleIteration(MetadataFormat<JsonNode, LinkMetadata> format, LinkMetadata link,
                                        List<PrivateKey> keys, List<PublicKey> authorized)
            throws InTotoException {
        long[] t = new long[TIME_METRICS.size()];
        int idx = 0;

        long start = System.nanoTime();
        JsonNode raw = format.serialize(link);
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        format.canonicalize(raw);
        t[idx++] = System.nanoTime() - start;

        // Builder creation re-checks and canonicalizes, so it is timed with signing
        start = System.nanoTime();
        SignedMetadataBuilder<JsonNode, LinkMetadata> builder = SignedMetadataBuilder.fromRawMetadata(raw, format);
        for (PrivateKey key : keys) {
            builder = builder.sign(key);
        }
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        SignedMetadata<JsonNode, LinkMetadata> signed = builder.build();
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        RawSignedMetadata<JsonNode, LinkMetadata> rawSigned = signed.toRaw();
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        SignedMetadata<JsonNode, LinkMetadata> parsed = rawSigned.parse();
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        parsed.verify(1, authorized, VerificationListener.ignoring());
        t[idx++] = System.nanoTime() - start;

        start = System.nanoTime();
        parsed.verify(keys.size(), authorized, VerificationListener.ignoring());
        t[idx++] = System.nanoTime() - start;

        return new TimedRun(t, signed, rawSigned);
    }

    private long median(long[] sorted) {
        int n = sorted.length;
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }
}
