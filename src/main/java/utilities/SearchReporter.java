package utilities;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Console reporting for a search run. Nothing here touches the automaton;
 * it only formats what the harness measured.
 */
public final class SearchReporter {
    private SearchReporter() {}

    public static void printHeader(PrintStream out, String pattern, int textLength) {
        out.printf(Locale.ROOT, "Search: pattern = '%s', text length = %d%n", pattern, textLength);
    }

    public static void printTiming(PrintStream out, RunResult result) {
        out.printf(Locale.ROOT, "%s: %2.0f us%n", result.algorithm(), result.firstMicros());
        if (result.runs() > 1) {
            DescriptiveStatistics stats = summarize(result);
            out.printf(Locale.ROOT, "%s: mean=%.3f us, min=%.3f us, max=%.3f us over %d runs%n",
                    result.algorithm(), stats.getMean(), stats.getMin(), stats.getMax(), result.runs());
        }
    }

    public static void printOutcome(PrintStream out, RunResult result) {
        if (result.found()) {
            out.printf(Locale.ROOT, "Output: found at offset %d%n", result.offset().getAsInt());
        } else {
            out.println("Output: not found");
        }
    }

    public static void printMemory(PrintStream out, MemoryUsageReport report) {
        out.println(report.report());
    }

    public static void printError(PrintStream out, String reason) {
        out.println("Error: " + reason);
    }

    // Per-run scan times in microseconds.
    static DescriptiveStatistics summarize(RunResult result) {
        DescriptiveStatistics stats = new DescriptiveStatistics(result.runs());
        for (int i = 0; i < result.runs(); i++) {
            stats.addValue(result.elapsedNanos().getLong(i) / 1_000.0);
        }
        return stats;
    }
}
