package search;

import kmp.DfaBuilder;
import kmp.DfaRunner;
import kmp.TransitionTable;

import java.util.OptionalInt;

// Knuth-Morris-Pratt search; the automaton is built once and shared by every call.
public final class KmpSearch implements SearchAlgorithm {

    private final TransitionTable table;

    public KmpSearch(Pattern pattern) {
        this.table = DfaBuilder.build(pattern.bytes());
    }

    @Override
    public OptionalInt firstMatch(byte[] text) {
        return DfaRunner.scan(table, text);
    }

    @Override
    public int patternLength() {
        return table.patternLength();
    }

    @Override
    public String name() {
        return "KMP";
    }

    public TransitionTable table() {
        return table;
    }
}
