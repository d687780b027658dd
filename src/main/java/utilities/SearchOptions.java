package utilities;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

// Parsed command line for the kmp driver.
public record SearchOptions(
        String pattern,
        boolean verbose,
        int runs,
        int maxLineLength,
        Charset charset,
        boolean memoryReport,
        boolean baseline) {

    public static final String INVALID_COUNT = "invalid number of arguments.";
    public static final String INVALID_ARGS = "invalid arguments.";

    public static SearchOptions parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException(INVALID_COUNT);
        }
        // A lone argument is always the pattern, even if it looks like a flag.
        if (args.length == 1) {
            return new SearchOptions(args[0], false, 1, LineReader.DEFAULT_MAX_LENGTH,
                    StandardCharsets.UTF_8, false, false);
        }

        boolean verbose = false;
        int runs = 1;
        int maxLineLength = LineReader.DEFAULT_MAX_LENGTH;
        Charset charset = StandardCharsets.UTF_8;
        boolean memoryReport = false;
        boolean baseline = false;
        List<String> positional = new ArrayList<>();

        boolean flagsDone = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (flagsDone || !arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                flagsDone = true;
                continue;
            }
            String key; String value = null;
            int eq = arg.indexOf('=');
            if (eq >= 0) { key = arg.substring(2, eq); value = arg.substring(eq + 1); } else { key = arg.substring(2); }

            switch (key) {
                case "verbose", "v" -> verbose = true;
                case "memory", "mem" -> memoryReport = true;
                case "baseline", "naive" -> baseline = true;
                case "runs" -> {
                    if (value == null) value = nextValue(args, ++i);
                    runs = parsePositive(value);
                }
                case "max-line", "max-line-length" -> {
                    if (value == null) value = nextValue(args, ++i);
                    maxLineLength = parsePositive(value);
                    if (maxLineLength < 2) throw new IllegalArgumentException(INVALID_ARGS);
                }
                case "charset", "encoding" -> {
                    if (value == null) value = nextValue(args, ++i);
                    charset = parseCharset(value);
                }
                default -> throw new IllegalArgumentException(INVALID_ARGS);
            }
        }

        if (positional.size() != 1) {
            throw new IllegalArgumentException(INVALID_COUNT);
        }
        return new SearchOptions(positional.get(0), verbose, runs, maxLineLength, charset, memoryReport, baseline);
    }

    public HarnessConfiguration toConfiguration() {
        return HarnessConfiguration.builder()
                .verbose(verbose)
                .runs(runs)
                .maxLineLength(maxLineLength)
                .charset(charset)
                .memoryReport(memoryReport)
                .baseline(baseline)
                .build();
    }

    private static String nextValue(String[] args, int i) {
        if (i >= args.length) throw new IllegalArgumentException(INVALID_ARGS);
        return args[i];
    }

    private static int parsePositive(String value) {
        try {
            int v = Integer.parseInt(value);
            if (v <= 0) throw new IllegalArgumentException(INVALID_ARGS);
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(INVALID_ARGS, e);
        }
    }

    private static Charset parseCharset(String value) {
        try {
            return Charset.forName(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(INVALID_ARGS, e);
        }
    }
}
