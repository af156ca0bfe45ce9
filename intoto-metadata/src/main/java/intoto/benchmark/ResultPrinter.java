package intoto.benchmark;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints benchmark results as a formatted comparison table followed by CSV.
 */
public final class ResultPrinter {

    private static final int NAME_WIDTH = 20;
    private static final int CELL_WIDTH = 16;

    private ResultPrinter() {}

    /**
     * Print a comparison table of all scheme results to stdout.
     */
    public static void printTable(List<BenchmarkRunner.Result> results, int iterations, int signers) {
        printTable(System.out, results, iterations, signers);
    }

    public static void printTable(PrintStream out, List<BenchmarkRunner.Result> results, int iterations, int signers) {
        List<String> timeMetrics = BenchmarkRunner.TIME_METRICS;
        List<String> sizeMetrics = BenchmarkRunner.SIZE_METRICS;

        out.println();
        out.println("=".repeat(NAME_WIDTH + (CELL_WIDTH + 3) * timeMetrics.size()));
        out.println("  SIGNED METADATA SCHEME COMPARISON");
        out.println("  (" + iterations + " iterations, " + signers + " signers, median values)");
        out.println("=".repeat(NAME_WIDTH + (CELL_WIDTH + 3) * timeMetrics.size()));
        out.println();

        printHeader(out, timeMetrics, " (us)");
        for (BenchmarkRunner.Result r : results) {
            out.printf("%-" + NAME_WIDTH + "s", r.schemeName());
            for (String m : timeMetrics) {
                Long nanos = r.timings().get(m);
                out.printf(" | %" + CELL_WIDTH + "d", nanos != null ? toMicros(nanos) : -1);
            }
            out.println();
        }
        out.println();

        printHeader(out, sizeMetrics, " (B)");
        for (BenchmarkRunner.Result r : results) {
            out.printf("%-" + NAME_WIDTH + "s", r.schemeName());
            for (String m : sizeMetrics) {
                Integer bytes = r.sizes().get(m);
                out.printf(" | %" + CELL_WIDTH + "d", bytes != null ? bytes : -1);
            }
            out.println();
        }
        out.println();

        // CSV output for easy import
        out.println("--- CSV (for spreadsheet import) ---");
        out.print("Scheme");
        for (String m : timeMetrics) out.print("," + m + " (us)");
        for (String m : sizeMetrics) out.print("," + m + " (B)");
        out.println();

        for (BenchmarkRunner.Result r : results) {
            out.print(r.schemeName());
            for (String m : timeMetrics) {
                Long nanos = r.timings().get(m);
                out.print("," + (nanos != null ? toMicros(nanos) : -1));
            }
            for (String m : sizeMetrics) {
                Integer bytes = r.sizes().get(m);
                out.print("," + (bytes != null ? bytes : -1));
            }
            out.println();
        }
    }

    private static void printHeader(PrintStream out, List<String> metrics, String unit) {
        out.printf("%-" + NAME_WIDTH + "s", "Scheme");
        for (String m : metrics) {
            out.printf(" | %" + CELL_WIDTH + "s", m + unit);
        }
        out.println();
        out.println("-".repeat(NAME_WIDTH) + ("-+-" + "-".repeat(CELL_WIDTH)).repeat(metrics.size()));
    }

    private static long toMicros(long nanos) {
        return nanos / 1_000;
    }
}
