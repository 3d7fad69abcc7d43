package uk.gegc.codejudge.shared.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ClockConfig")
class ClockConfigTest {

    @Test
    @DisplayName("blank zone falls back to UTC")
    void blankZone_isUtc() {
        assertThat(ClockConfig.resolveZone("  ")).isEqualTo(ZoneOffset.UTC);
        assertThat(ClockConfig.resolveZone(null)).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("named zone is used for the clock")
    void namedZone() {
        assertThat(new ClockConfig().clock(" Europe/London ").getZone()).isEqualTo(ZoneId.of("Europe/London"));
    }

    @Test
    @DisplayName("unknown zone fails startup")
    void unknownZone_fails() {
        assertThatThrownBy(() -> ClockConfig.resolveZone("Mars/Olympus"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Mars/Olympus");
    }
}
