package kmp;

// Raw byte alphabet shared by the builder and the runner.
public final class Alphabet {

    // Number of distinct symbols, one per byte value.
    public static final int RADIX = 256;

    private Alphabet() {
    }

    // Unsigned view of a byte, always in [0, RADIX).
    public static int symbol(byte b) {
        return b & 0xFF;
    }
}
