package search;

import datagenerators.TextGenerator;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class KmpSearchTest {

    private static Pattern latin1(String s) {
        return new Pattern(s, StandardCharsets.ISO_8859_1);
    }

    @Test
    void firstMatch_agreesWithStringIndexOf() {
        String text = "she sells sea shells by the sea shore";
        for (String p : new String[]{"sea", "shells", "shore", "s", "e s", "sh", "seashore", "zzz"}) {
            KmpSearch kmp = new KmpSearch(latin1(p));
            OptionalInt got = kmp.firstMatch(text.getBytes(StandardCharsets.ISO_8859_1));
            int expected = text.indexOf(p);

            if (expected < 0) {
                assertThat(got).as(p).isEmpty();
            } else {
                assertThat(got).as(p).hasValue(expected);
            }
        }
    }

    @Test
    void firstMatch_agreesWithNaiveOnSkewedRandomTexts() {
        for (long seed = 1; seed <= 20; seed++) {
            byte[] text = TextGenerator.generateZipf(2_000, 'a', 'a' + 4, 1.2, seed);
            for (int len = 1; len <= 8; len++) {
                int from = (int) ((seed * 97 + len * 31) % (text.length - len));
                Pattern p = new Pattern(TextGenerator.slice(text, from, len));

                OptionalInt kmp = new KmpSearch(p).firstMatch(text);
                OptionalInt naive = new NaiveSearch(p).firstMatch(text);

                assertThat(kmp).isEqualTo(naive);
                assertThat(kmp.getAsInt()).isLessThanOrEqualTo(from);
                assertThat(Verifier.verifyAt(text, kmp.getAsInt(), p)).isTrue();
            }
        }
    }

    @Test
    void firstMatch_agreesWithNaiveOnUniformTextsWithAbsentPatterns() {
        byte[] text = TextGenerator.generateUniform(5_000, 'a', 'a' + 3, 42L);
        Pattern absent = latin1("abcd");

        assertThat(new KmpSearch(absent).firstMatch(text)).isEmpty();
        assertThat(new NaiveSearch(absent).firstMatch(text)).isEmpty();
    }

    @Test
    void firstMatch_adversarialRunWithTail() {
        byte[] text = TextGenerator.generateRunWithTail(10_000, (byte) 'a', (byte) 'b');
        Pattern p = latin1("a".repeat(50) + "b");

        assertThat(new KmpSearch(p).firstMatch(text)).hasValue(10_000 - 51);
    }

    @Test
    void firstMatch_periodicText() {
        byte[] text = TextGenerator.generatePeriodic("aab".getBytes(StandardCharsets.US_ASCII), 30);

        assertThat(new KmpSearch(latin1("baab")).firstMatch(text)).hasValue(2);
        assertThat(new KmpSearch(latin1("abaa")).firstMatch(text)).hasValue(1);
        assertThat(new KmpSearch(latin1("bb")).firstMatch(text)).isEmpty();
    }

    @Test
    void kmpExposesItsTable() {
        KmpSearch kmp = new KmpSearch(latin1("abc"));

        assertThat(kmp.patternLength()).isEqualTo(3);
        assertThat(kmp.table().isTotal()).isTrue();
        assertThat(kmp.name()).isEqualTo("KMP");
    }
}
