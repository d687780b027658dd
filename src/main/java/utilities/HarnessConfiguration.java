package utilities;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

// Immutable configuration for a SearchHarness run.
public final class HarnessConfiguration {

    private final int maxLineLength;
    private final Charset charset;
    private final int runs;
    private final boolean verbose;
    private final boolean memoryReport;
    private final boolean baseline;

    private HarnessConfiguration(Builder builder) {
        this.maxLineLength = builder.maxLineLength;
        this.charset = Objects.requireNonNull(builder.charset, "charset");
        this.runs = builder.runs;
        this.verbose = builder.verbose;
        this.memoryReport = builder.memoryReport;
        this.baseline = builder.baseline;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    private void validate() {
        if (maxLineLength < 2) {
            throw new IllegalArgumentException("maxLineLength must be at least 2");
        }
        if (runs <= 0) {
            throw new IllegalArgumentException("runs must be positive");
        }
    }

    public int maxLineLength() { return maxLineLength; }
    public Charset charset() { return charset; }
    public int runs() { return runs; }
    public boolean verbose() { return verbose; }
    public boolean memoryReport() { return memoryReport; }
    public boolean baseline() { return baseline; }

    public static final class Builder {
        private int maxLineLength = LineReader.DEFAULT_MAX_LENGTH;
        private Charset charset = StandardCharsets.UTF_8;
        private int runs = 1;
        private boolean verbose;
        private boolean memoryReport;
        private boolean baseline;

        private Builder() {
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder runs(int runs) {
            this.runs = runs;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder memoryReport(boolean memoryReport) {
            this.memoryReport = memoryReport;
            return this;
        }

        public Builder baseline(boolean baseline) {
            this.baseline = baseline;
            return this;
        }

        public HarnessConfiguration build() {
            return new HarnessConfiguration(this);
        }
    }
}
