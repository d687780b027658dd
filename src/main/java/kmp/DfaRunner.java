package kmp;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Drives a {@link TransitionTable} over a text, one lookup per symbol.
 * Stateless; tables can be shared between threads.
 */
public final class DfaRunner {

    private DfaRunner() {
    }

    // Offset of the leftmost occurrence in text, or empty.
    public static OptionalInt scan(TransitionTable table, byte[] text) {
        Objects.requireNonNull(text, "text");
        return scan(table, text, 0, text.length);
    }

    // Like scan(table, text), restricted to text[from, to). Offsets stay relative to text[0].
    public static OptionalInt scan(TransitionTable table, byte[] text, int from, int to) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(text, "text");
        Objects.checkFromToIndex(from, to, text.length);

        final int m = table.acceptingState();
        int state = 0;
        for (int i = from; i < to; i++) {
            state = table.next(Alphabet.symbol(text[i]), state);
            if (state == m) {
                return OptionalInt.of(i - m + 1);
            }
        }
        return OptionalInt.empty();
    }
}
