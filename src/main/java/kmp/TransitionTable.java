package kmp;

/**
 * Immutable KMP automaton for a single pattern.
 * <p>
 * Entries are stored row-major by state, so {@code next(c, j)} reads
 * {@code dfa[j * RADIX + c]}. States run over {@code [0, m]} where {@code m}
 * is the pattern length and state {@code m} is accepting. Only the columns
 * {@code j < m} are materialised; the runner stops as soon as it reaches {@code m}.
 */
public final class TransitionTable {

    private final int[] dfa;
    private final int patternLength;

    // Takes ownership of dfa; only DfaBuilder creates tables.
    TransitionTable(int[] dfa, int patternLength) {
        this.dfa = dfa;
        this.patternLength = patternLength;
    }

    public int next(int symbol, int state) {
        return dfa[state * Alphabet.RADIX + symbol];
    }

    public int patternLength() {
        return patternLength;
    }

    public int acceptingState() {
        return patternLength;
    }

    // Number of transition entries held, RADIX * m.
    public int size() {
        return dfa.length;
    }

    // True when every (symbol, state < m) entry names a state in [0, m].
    public boolean isTotal() {
        if (dfa.length != Alphabet.RADIX * patternLength) {
            return false;
        }
        for (int target : dfa) {
            if (target < 0 || target > patternLength) {
                return false;
            }
        }
        return true;
    }
}
