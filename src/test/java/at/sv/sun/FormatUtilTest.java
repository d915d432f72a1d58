package at.sv.sun;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FormatUtilTest {

    @Test
    void formatDuration() {
        assertThat(FormatUtil.formatDuration(Duration.ZERO)).isEqualTo("0s");
        assertThat(FormatUtil.formatDuration(Duration.ofSeconds(59))).isEqualTo("59s");
        assertThat(FormatUtil.formatDuration(Duration.ofHours(9).plusMinutes(24).plusSeconds(39))).isEqualTo("9h 24m 39s");
        assertThat(FormatUtil.formatDuration(Duration.ofHours(2).plusSeconds(1))).isEqualTo("2h 1s");
        assertThat(FormatUtil.formatDuration(Duration.ofDays(1).plusMinutes(3))).isEqualTo("1d 3m 0s");
    }
}
