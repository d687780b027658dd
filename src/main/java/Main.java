import utilities.KmpLogger;
import utilities.SearchHarness;
import utilities.SearchOptions;
import utilities.SearchReporter;

/**
 * Command-line driver: searches one line read from stdin for the pattern
 * given on the command line and prints the scan time.
 *
 * <pre>
 *   echo "some text" | java Main [--verbose] [--runs=N] [--memory] [--baseline] &lt;pattern&gt;
 * </pre>
 */
public final class Main {

    private static final String PROGRAM = "kmp";

    public static void main(String[] args) {
        SearchOptions options;
        try {
            options = SearchOptions.parse(args);
        } catch (IllegalArgumentException e) {
            KmpLogger.debug("Bad command line: " + e.getMessage());
            SearchReporter.printError(System.out, e.getMessage());
            usage();
            return;
        }

        SearchHarness harness = new SearchHarness(options.toConfiguration());
        int status = harness.run(options.pattern(), System.in, System.out);
        System.out.flush();
        System.exit(status);
    }

    private static void usage() {
        System.out.printf("%s - Testing program for kmp.%n", PROGRAM);
        System.out.printf("Usage: %s [--verbose] <pattern>%n", PROGRAM);
        System.exit(SearchHarness.EXIT_FAILURE);
    }
}
