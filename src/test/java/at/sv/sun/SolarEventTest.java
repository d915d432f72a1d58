package at.sv.sun;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SolarEventTest {

    @Test
    void fromKeyword_allKeywords() {
        for (SolarEvent event : SolarEvent.values()) {
            assertThat(SolarEvent.fromKeyword(event.getKeyword())).isEqualTo(event);
        }
    }

    @Test
    void fromKeyword_aliases_caseInsensitive() {
        assertThat(SolarEvent.fromKeyword("noon")).isEqualTo(SolarEvent.SOLAR_NOON);
        assertThat(SolarEvent.fromKeyword("Civil_Start")).isEqualTo(SolarEvent.CIVIL_DAWN);
        assertThat(SolarEvent.fromKeyword(" NAUTICAL_END ")).isEqualTo(SolarEvent.NAUTICAL_DUSK);
        assertThat(SolarEvent.fromKeyword("astronomical_end")).isEqualTo(SolarEvent.ASTRONOMICAL_DUSK);
    }

    @Test
    void fromKeyword_unknown_null() {
        assertThat(SolarEvent.fromKeyword("golden_hour")).isNull();
    }

    @Test
    void dawnAndDusk_shareAltitude() {
        assertThat(SolarEvent.SUNRISE.getAltitude()).isSameAs(SolarEvent.SUNSET.getAltitude());
        assertThat(SolarEvent.CIVIL_DAWN.getAltitude().getDegrees()).isEqualTo(-6.0);
        assertThat(SolarEvent.NAUTICAL_DUSK.getAltitude().getDegrees()).isEqualTo(-12.0);
        assertThat(SolarEvent.ASTRONOMICAL_DAWN.isRising()).isTrue();
        assertThat(SolarEvent.ASTRONOMICAL_DUSK.isRising()).isFalse();
        assertThat(SolarEvent.SOLAR_NOON.isTransit()).isTrue();
        assertThat(SolarEvent.SUNRISE.isTransit()).isFalse();
    }
}
