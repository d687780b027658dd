package utilities;

import kmp.TransitionTable;
import org.openjdk.jol.info.GraphLayout;

import java.util.Locale;

public class MemUtil {

    // Retained bytes of the table, header and backing array included.
    public static long tableBytes(TransitionTable table) {
        return GraphLayout.parseInstance(table).totalSize();
    }

    // Lower bound from the entry count alone: RADIX * m ints.
    public static long payloadBytes(TransitionTable table) {
        return (long) table.size() * Integer.BYTES;
    }

    public static MemoryUsageReport tableReport(TransitionTable table) {
        long total = tableBytes(table);
        double totalMiB = total / (1024.0 * 1024.0);
        String txt = String.format(Locale.ROOT,
                "DFA: %d states x %d symbols, %d B (%.3f MiB), payload %d B",
                table.patternLength(), table.size() / Math.max(1, table.patternLength()),
                total, totalMiB, payloadBytes(table));
        return new MemoryUsageReport(txt, totalMiB);
    }
}
