package intoto;

import com.fasterxml.jackson.databind.JsonNode;
import intoto.benchmark.BenchmarkRunner;
import intoto.benchmark.ResultPrinter;
import intoto.crypto.PrivateKey;
import intoto.crypto.PublicKey;
import intoto.crypto.Sha2Hasher;
import intoto.crypto.SignatureScheme;
import intoto.error.InTotoException;
import intoto.error.VerificationFailureException;
import intoto.model.MetadataFormat;
import intoto.model.RawSignedMetadata;
import intoto.model.SignedMetadata;
import intoto.model.SignedMetadataBuilder;
import intoto.model.TargetPath;
import intoto.model.link.LinkMetadata;
import intoto.model.link.TargetDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the signed metadata demo.
 *
 * Runs two phases:
 * 1. Smoke test: two functionaries sign a link separately, the copies are
 *    merged, round-tripped through bytes and verified against a threshold of 2
 * 2. Benchmark: measures timing and sizes across all signature schemes
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final int BENCHMARK_ITERATIONS = 100;
    private static final int BENCHMARK_SIGNERS = 3;

    public static void main(String[] args) throws InTotoException {
        System.out.println("=".repeat(60));
        System.out.println("  IN-TOTO SIGNED METADATA");
        System.out.println("=".repeat(60));

        LinkMetadata link = demoLink();
        System.out.println("\nLink: " + link.name()
                + " (" + link.materials().size() + " materials, "
                + link.products().size() + " products)");

        System.out.println("\n--- Smoke Test ---");
        for (SignatureScheme scheme : SignatureScheme.all()) {
            smokeTest(scheme, link);
        }

        System.out.println("\n--- Benchmark ---");
        int iterations = BENCHMARK_ITERATIONS;
        if (args.length > 0) {
            try {
                iterations = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid iteration count '{}', using {}", args[0], iterations);
            }
        }

        BenchmarkRunner runner = new BenchmarkRunner(iterations, BENCHMARK_SIGNERS);
        List<BenchmarkRunner.Result> results = new ArrayList<>();

        for (SignatureScheme scheme : SignatureScheme.all()) {
            System.out.println("Benchmarking " + scheme.signer().algorithmName() + "...");
            results.add(runner.run(scheme, link));
        }

        ResultPrinter.printTable(results, iterations, BENCHMARK_SIGNERS);
    }

    static LinkMetadata demoLink() throws InTotoException {
        Sha2Hasher sha256 = new Sha2Hasher();
        byte[] source = "int main(void) { return 0; }\n".getBytes(StandardCharsets.UTF_8);
        byte[] binary = "\u007fELF demo binary".getBytes(StandardCharsets.UTF_8);
        return LinkMetadata.builder("build")
                .material(TargetPath.of("src/main.c"), TargetDescription.of(source, sha256))
                .product(TargetPath.of("out.bin"), TargetDescription.of(binary, sha256))
                .env("CC", "gcc")
                .byproduct("return-value", "0")
                .build();
    }

    /**
     * Run the two-signer flow for one scheme and check that it behaves.
     */
    static boolean smokeTest(SignatureScheme scheme, LinkMetadata link) {
        System.out.print(scheme.signer().algorithmName() + " ... ");
        try {
            MetadataFormat<JsonNode, LinkMetadata> format = MetadataFormat.json(LinkMetadata.class);
            PrivateKey alice = PrivateKey.derive(scheme, "alice");
            PrivateKey bob = PrivateKey.derive(scheme, "bob");
            List<PublicKey> authorized = List.of(alice.publicKey(), bob.publicKey());

            // Each functionary signs its own copy
            SignedMetadata<JsonNode, LinkMetadata> byAlice = SignedMetadataBuilder.from(link, format).sign(alice).build();
            SignedMetadata<JsonNode, LinkMetadata> byBob = SignedMetadataBuilder.from(link, format).sign(bob).build();

            try {
                byAlice.verify(2, authorized);
                System.out.println("FAILED: one signature met a threshold of 2");
                return false;
            } catch (VerificationFailureException expected) {
                log.debug("Single signature rejected as expected: {}", expected.getMessage());
            }

            RawSignedMetadata<JsonNode, LinkMetadata> raw = byAlice.mergeSignatures(byBob).toRaw();
            LinkMetadata verified = raw.parse().verify(2, authorized);

            if (verified.equals(link)) {
                System.out.println("OK (" + raw.asBytes().length + " bytes, 2/2 signatures)");
                return true;
            }
            System.out.println("FAILED: verified link differs from original");
            return false;
        } catch (InTotoException e) {
            System.out.println("FAILED: " + e.getMessage());
            return false;
        }
    }
}
