package kmp;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Builds the Knuth-Morris-Pratt automaton of a pattern.
 * <p>
 * Column {@code j} is a copy of the column of the restart state {@code x}
 * (the state the automaton would reach on {@code pattern[1..j)}), with the
 * entry for {@code pattern[j]} redirected to {@code j + 1}. Time and space
 * are {@code O(RADIX * m)}.
 */
public final class DfaBuilder {

    private DfaBuilder() {
    }

    public static TransitionTable build(String pattern, Charset charset) {
        if (pattern == null) {
            throw new InvalidPatternException("pattern must not be null");
        }
        Objects.requireNonNull(charset, "charset");
        return build(pattern.getBytes(charset));
    }

    public static TransitionTable build(byte[] pattern) {
        if (pattern == null) {
            throw new InvalidPatternException("pattern must not be null");
        }
        final int m = pattern.length;
        if (m == 0) {
            throw new InvalidPatternException("pattern must not be empty");
        }
        final int R = Alphabet.RADIX;
        long cells = (long) R * m;
        if (cells > Integer.MAX_VALUE - 8) {
            throw new InvalidPatternException("pattern too long for a dense table: " + m);
        }
        int[] dfa = new int[(int) cells];

        // Column 0: everything stays at 0 except the first pattern symbol.
        dfa[Alphabet.symbol(pattern[0])] = 1;

        int x = 0;
        for (int j = 1; j < m; j++) {
            int column = j * R;
            System.arraycopy(dfa, x * R, dfa, column, R);

            int c = Alphabet.symbol(pattern[j]);
            dfa[column + c] = j + 1;

            x = dfa[x * R + c];
        }
        return new TransitionTable(dfa, m);
    }
}
