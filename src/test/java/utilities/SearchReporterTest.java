package utilities;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SearchReporterTest {

    @Test
    void printTiming_roundsToWholeMicroseconds() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        RunResult r = new RunResult("KMP", OptionalInt.of(0), LongArrayList.wrap(new long[]{12_400L}));

        SearchReporter.printTiming(new PrintStream(buf, true, StandardCharsets.UTF_8), r);

        assertThat(buf.toString(StandardCharsets.UTF_8)).isEqualTo("KMP: 12 us" + System.lineSeparator());
    }

    @Test
    void summarize_usesEveryRun() {
        RunResult r = new RunResult("KMP", OptionalInt.empty(), LongArrayList.wrap(new long[]{1_000L, 3_000L, 2_000L}));

        DescriptiveStatistics stats = SearchReporter.summarize(r);

        assertThat(stats.getN()).isEqualTo(3);
        assertThat(stats.getMean()).isCloseTo(2.0, within(1e-9));
        assertThat(stats.getMin()).isCloseTo(1.0, within(1e-9));
        assertThat(stats.getMax()).isCloseTo(3.0, within(1e-9));
    }
}
