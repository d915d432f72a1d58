package at.sv.sun.time;

import at.sv.sun.SolarEvent;
import at.sv.sun.SolarPositionEngine;
import org.junit.jupiter.api.Test;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compares the solar position model with the independent implementation of commons-suncalc.
 */
class SunCalcAgreementTest {

    private static final double LAT = 48.20;
    private static final double LNG = 16.39;
    private static final ZoneId VIENNA = ZoneId.of("Europe/Vienna");
    private static final Duration TOLERANCE = Duration.ofMinutes(3);

    private final SolarPositionEngine engine = new SolarPositionEngine(LAT, LNG);

    private static SunTimes sunCalc(ZonedDateTime dateTime, SunTimes.Twilight twilight) {
        return SunTimes.compute().at(LAT, LNG).on(dateTime.with(LocalTime.MIDNIGHT)).twilight(twilight).execute();
    }

    private static void assertAgrees(ZonedDateTime actual, ZonedDateTime reference) {
        assertThat(reference).isNotNull();
        assertThat(Duration.between(reference, actual).abs())
                .as("%s differs from suncalc %s", actual, reference)
                .isLessThanOrEqualTo(TOLERANCE);
    }

    @Test
    void sunriseSunsetAndNoon_agreeForEveryMonth() {
        for (int month = 1; month <= 12; month++) {
            ZonedDateTime dateTime = ZonedDateTime.of(2021, month, 1, 0, 0, 0, 0, VIENNA);
            SunTimes reference = sunCalc(dateTime, SunTimes.Twilight.VISUAL);

            assertAgrees(engine.get(dateTime.toLocalDate(), SolarEvent.SUNRISE, VIENNA), reference.getRise());
            assertAgrees(engine.get(dateTime.toLocalDate(), SolarEvent.SUNSET, VIENNA), reference.getSet());
            assertAgrees(engine.getSolarNoon(dateTime.toLocalDate(), VIENNA), reference.getNoon());
        }
    }

    @Test
    void civilTwilight_agreesForEveryMonth() {
        for (int month = 1; month <= 12; month++) {
            ZonedDateTime dateTime = ZonedDateTime.of(2021, month, 15, 0, 0, 0, 0, VIENNA);
            SunTimes reference = sunCalc(dateTime, SunTimes.Twilight.CIVIL);

            assertAgrees(engine.getCivilDawn(dateTime.toLocalDate(), VIENNA), reference.getRise());
            assertAgrees(engine.getCivilDusk(dateTime.toLocalDate(), VIENNA), reference.getSet());
        }
    }

    @Test
    void nauticalTwilight_agreesInWinter() {
        ZonedDateTime dateTime = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, VIENNA);
        SunTimes reference = sunCalc(dateTime, SunTimes.Twilight.NAUTICAL);

        assertAgrees(engine.getNauticalDawn(dateTime.toLocalDate(), VIENNA), reference.getRise());
        assertAgrees(engine.getNauticalDusk(dateTime.toLocalDate(), VIENNA), reference.getSet());
    }
}
