package utilities;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HarnessConfigurationTest {

    @Test
    void defaultsMatchTheInteractiveDriver() {
        HarnessConfiguration c = HarnessConfiguration.builder().build();

        assertThat(c.maxLineLength()).isEqualTo(4096);
        assertThat(c.runs()).isEqualTo(1);
        assertThat(c.verbose()).isFalse();
        assertThat(c.memoryReport()).isFalse();
    }

    @Test
    void validatesRanges() {
        assertThatThrownBy(() -> HarnessConfiguration.builder().runs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HarnessConfiguration.builder().maxLineLength(1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HarnessConfiguration.builder().charset(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}
