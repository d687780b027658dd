package kmp;

// Thrown when an automaton is requested for a pattern that cannot be matched (null or empty).
public class InvalidPatternException extends IllegalArgumentException {

    public InvalidPatternException(String message) {
        super(message);
    }
}
