package search;

import java.util.OptionalInt;

public interface SearchAlgorithm {

    // Offset of the leftmost occurrence of the prepared pattern, or empty.
    OptionalInt firstMatch(byte[] text);

    int patternLength();

    String name();
}
