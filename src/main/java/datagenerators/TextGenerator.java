package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.Arrays;
import java.util.Objects;

// Seeded byte texts for exercising and benchmarking the matcher.
public final class TextGenerator {

    private TextGenerator() {
    }

    // Uniform bytes in [minSymbol, maxSymbol).
    public static byte[] generateUniform(int length, int minSymbol, int maxSymbol, long seed) {
        checkDomain(length, minSymbol, maxSymbol);
        RandomGenerator rng = new Well19937c(seed);
        int span = maxSymbol - minSymbol;
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = (byte) (minSymbol + rng.nextInt(span));
        }
        return out;
    }

    // Zipf-skewed bytes; rank 1 maps to minSymbol.
    public static byte[] generateZipf(int length, int minSymbol, int maxSymbol, double exponent, long seed) {
        checkDomain(length, minSymbol, maxSymbol);
        RandomGenerator rng = new Well19937c(seed);
        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, maxSymbol - minSymbol, exponent);
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = (byte) (minSymbol + dist.sample() - 1);
        }
        return out;
    }

    // fill^length with the last byte replaced by tail: the worst case for backtracking search.
    public static byte[] generateRunWithTail(int length, byte fill, byte tail) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        byte[] out = new byte[length];
        Arrays.fill(out, fill);
        out[length - 1] = tail;
        return out;
    }

    // unit repeated (and cut) to exactly length bytes.
    public static byte[] generatePeriodic(byte[] unit, int length) {
        Objects.requireNonNull(unit, "unit");
        if (unit.length == 0) {
            throw new IllegalArgumentException("unit must not be empty");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = unit[i % unit.length];
        }
        return out;
    }

    // Copy of text[from, from + length), handy for planting a known pattern.
    public static byte[] slice(byte[] text, int from, int length) {
        Objects.checkFromIndexSize(from, length, text.length);
        return Arrays.copyOfRange(text, from, from + length);
    }

    private static void checkDomain(int length, int minSymbol, int maxSymbol) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
        if (minSymbol < 0) {
            throw new IllegalArgumentException("minSymbol < 0");
        }
        if (maxSymbol > 256) {
            throw new IllegalArgumentException("maxSymbol > 256");
        }
        if (maxSymbol - minSymbol <= 0) {
            throw new IllegalArgumentException("maxSymbol must be greater than minSymbol");
        }
    }
}
