package utilities;

import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.util.OptionalInt;

// Outcome of timing one algorithm over the same text several times.
public record RunResult(String algorithm, OptionalInt offset, LongArrayList elapsedNanos) {

    public boolean found() {
        return offset.isPresent();
    }

    public int runs() {
        return elapsedNanos.size();
    }

    public double firstMicros() {
        return elapsedNanos.isEmpty() ? 0.0 : elapsedNanos.getLong(0) / 1_000.0;
    }
}
