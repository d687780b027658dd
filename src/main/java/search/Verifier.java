package search;

// Checks reported matches against the text they were found in.
public final class Verifier {

    private Verifier() {
    }

    // True when text[offset, offset + m) holds exactly the pattern bytes.
    public static boolean verifyAt(byte[] text, int offset, Pattern pat) {
        final int m = pat.size();
        if (offset < 0 || offset > text.length - m) {
            return false;
        }
        for (int i = 0; i < m; i++) {
            if (text[offset + i] != pat.byteAt(i)) {
                return false;
            }
        }
        return true;
    }
}
