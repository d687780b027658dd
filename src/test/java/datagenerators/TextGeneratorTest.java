package datagenerators;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextGeneratorTest {

    @Test
    void seededGeneratorsAreReproducible() {
        assertThat(TextGenerator.generateUniform(500, 'a', 'z', 7L))
                .isEqualTo(TextGenerator.generateUniform(500, 'a', 'z', 7L));
        assertThat(TextGenerator.generateZipf(500, 'a', 'z', 1.1, 7L))
                .isEqualTo(TextGenerator.generateZipf(500, 'a', 'z', 1.1, 7L));
    }

    @Test
    void symbolsStayInsideTheRequestedRange() {
        for (byte b : TextGenerator.generateZipf(2_000, 200, 256, 1.0, 3L)) {
            assertThat(b & 0xFF).isBetween(200, 255);
        }
        for (byte b : TextGenerator.generateUniform(2_000, 'a', 'd', 3L)) {
            assertThat(b & 0xFF).isBetween((int) 'a', (int) 'c');
        }
    }

    @Test
    void adversarialShapes() {
        assertThat(TextGenerator.generateRunWithTail(4, (byte) 'a', (byte) 'b'))
                .containsExactly('a', 'a', 'a', 'b');
        assertThat(TextGenerator.generatePeriodic(new byte[]{'x', 'y'}, 5))
                .containsExactly('x', 'y', 'x', 'y', 'x');
    }

    @Test
    void rejectsBadDomains() {
        assertThatThrownBy(() -> TextGenerator.generateUniform(10, 5, 5, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TextGenerator.generateUniform(10, 0, 300, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
