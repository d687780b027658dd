package utilities;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads a single newline-terminated line of raw bytes with a length cap.
 * <p>
 * At most {@code maxLength - 1} bytes are kept. The terminating {@code '\n'}
 * is consumed and dropped. When the line is longer than the cap, the kept
 * prefix is returned and the rest of the line is consumed up to the next
 * newline or end of stream. An exhausted stream yields an empty line.
 */
public final class LineReader {

    public static final int DEFAULT_MAX_LENGTH = 4096;

    public record Line(byte[] bytes, boolean truncated) {
        public int length() {
            return bytes.length;
        }
    }

    private final InputStream in;
    private final int maxLength;

    public LineReader(InputStream in) {
        this(in, DEFAULT_MAX_LENGTH);
    }

    public LineReader(InputStream in, int maxLength) {
        Objects.requireNonNull(in, "in");
        if (maxLength < 2) {
            throw new IllegalArgumentException("maxLength must be at least 2");
        }
        this.in = (in instanceof BufferedInputStream) ? in : new BufferedInputStream(in);
        this.maxLength = maxLength;
    }

    public Line readLine() throws IOException {
        final int limit = maxLength - 1;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.min(limit, 256));

        int b;
        while (buffer.size() < limit) {
            b = in.read();
            if (b == -1 || b == '\n') {
                return new Line(buffer.toByteArray(), false);
            }
            buffer.write(b);
        }

        // Cap reached; discard what is left of this line.
        boolean dropped = false;
        while ((b = in.read()) != -1 && b != '\n') {
            dropped = true;
        }
        return new Line(buffer.toByteArray(), dropped);
    }
}
