package utilities;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import kmp.InvalidPatternException;
import search.KmpSearch;
import search.NaiveSearch;
import search.Pattern;
import search.SearchAlgorithm;
import search.Verifier;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Reads one line of text, searches it for a pattern and reports the outcome.
 * Returns a process exit status instead of exiting so callers decide what to do with it.
 */
public final class SearchHarness {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private final HarnessConfiguration config;

    public SearchHarness(HarnessConfiguration config) {
        this.config = config;
    }

    public int run(String patternText, InputStream in, PrintStream out) {
        Pattern pattern;
        try {
            pattern = new Pattern(patternText, config.charset());
        } catch (InvalidPatternException e) {
            KmpLogger.error("Rejected pattern: " + e.getMessage());
            SearchReporter.printError(out, "invalid pattern: " + e.getMessage());
            return EXIT_FAILURE;
        }

        LineReader.Line line;
        try {
            line = new LineReader(in, config.maxLineLength()).readLine();
        } catch (IOException e) {
            KmpLogger.error("Failed to read input", e);
            SearchReporter.printError(out, "failed to read input: " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (line.truncated()) {
            KmpLogger.warning(String.format(Locale.ROOT,
                    "Input line truncated to %d bytes", line.length()));
        }
        byte[] text = line.bytes();

        if (config.verbose()) {
            SearchReporter.printHeader(out, pattern.patternTxt, text.length);
        }

        long t0 = System.nanoTime();
        KmpSearch kmp = new KmpSearch(pattern);
        KmpLogger.debug(String.format(Locale.ROOT, "Built DFA for %d-byte pattern in %d ns",
                pattern.size(), System.nanoTime() - t0));

        RunResult result = time(kmp, text, config.runs());
        SearchReporter.printTiming(out, result);

        if (config.baseline()) {
            RunResult naive = time(new NaiveSearch(pattern), text, config.runs());
            SearchReporter.printTiming(out, naive);
            if (!naive.offset().equals(result.offset())) {
                KmpLogger.error("KMP and naive search disagree: " + result.offset() + " vs " + naive.offset());
                SearchReporter.printError(out, "baseline mismatch");
                return EXIT_FAILURE;
            }
        }

        if (config.verbose()) {
            SearchReporter.printOutcome(out, result);
        }

        // An absent match is a normal result; only a reported offset is checked.
        if (result.found() && !Verifier.verifyAt(text, result.offset().getAsInt(), pattern)) {
            KmpLogger.error("Reported offset " + result.offset().getAsInt() + " does not hold the pattern");
            SearchReporter.printError(out, "verification failed");
            return EXIT_FAILURE;
        }

        if (config.memoryReport()) {
            SearchReporter.printMemory(out, MemUtil.tableReport(kmp.table()));
        }
        return EXIT_SUCCESS;
    }

    static RunResult time(SearchAlgorithm algorithm, byte[] text, int runs) {
        LongArrayList elapsed = new LongArrayList(runs);
        OptionalInt offset = OptionalInt.empty();
        for (int r = 0; r < runs; r++) {
            long start = System.nanoTime();
            offset = algorithm.firstMatch(text);
            elapsed.add(System.nanoTime() - start);
        }
        KmpLogger.trace(algorithm.name() + " scan times (ns): " + elapsed);
        return new RunResult(algorithm.name(), offset, elapsed);
    }
}
