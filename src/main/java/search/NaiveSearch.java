package search;

import java.util.OptionalInt;

// Brute-force baseline: tries every alignment and backs up on mismatch.
public final class NaiveSearch implements SearchAlgorithm {

    private final byte[] pat;

    public NaiveSearch(Pattern pattern) {
        this.pat = pattern.bytes();
    }

    @Override
    public OptionalInt firstMatch(byte[] text) {
        final int m = pat.length;
        final int last = text.length - m;
        for (int i = 0; i <= last; i++) {
            int j = 0;
            while (j < m && text[i + j] == pat[j]) {
                j++;
            }
            if (j == m) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public int patternLength() {
        return pat.length;
    }

    @Override
    public String name() {
        return "Naive";
    }
}
