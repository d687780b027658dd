package search;

import kmp.InvalidPatternException;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

// A search pattern as raw bytes, keeping the source text for reporting.
public final class Pattern {
    public final String patternTxt;
    private final byte[] bytes;

    public Pattern(String s, Charset charset) {
        if (s == null || s.isEmpty()) {
            throw new InvalidPatternException("pattern must not be empty");
        }
        Objects.requireNonNull(charset, "charset");
        this.patternTxt = s;
        this.bytes = s.getBytes(charset);
    }

    public Pattern(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidPatternException("pattern must not be empty");
        }
        this.bytes = bytes.clone();
        this.patternTxt = new String(bytes, StandardCharsets.ISO_8859_1);
    }

    public int size() {
        return bytes.length;
    }

    public byte byteAt(int i) {
        return bytes[i];
    }

    // Returns a copy.
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public String toString() {
        return "Pattern{'" + patternTxt + "', " + bytes.length + " bytes}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        return Arrays.equals(bytes, ((Pattern) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
