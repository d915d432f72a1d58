package at.sv.sun.time;

import at.sv.sun.SolarEvent;
import at.sv.sun.SolarEventDoesNotOccur;
import at.sv.sun.SolarPositionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SunTimesProviderTest {

    private ZonedDateTime dateTime;
    private SunTimesProviderImpl provider;

    private void assertTime(ZonedDateTime time, int hour, int minute, int second) {
        assertThat("Time differs", time.toLocalTime().truncatedTo(ChronoUnit.SECONDS),
                is(LocalTime.of(hour, minute, second)));
        assertThat("Zone differs", time.getZone(), is(dateTime.getZone()));
    }

    @BeforeEach
    void setUp() {
        ZoneId zone = ZoneId.of("Europe/Vienna");
        dateTime = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, zone);
        provider = new SunTimesProviderImpl(new SolarPositionEngine(48.20, 16.39));
    }

    @Test
    void returnsCorrectTimes_dependingOnDate() {
        assertTime(provider.getEvent(SolarEvent.ASTRONOMICAL_DAWN, dateTime), 5, 51, 14);
        assertTime(provider.getEvent(SolarEvent.NAUTICAL_DAWN, dateTime), 6, 29, 5);
        assertTime(provider.getEvent(SolarEvent.CIVIL_DAWN, dateTime), 7, 8, 43);
        assertTime(provider.getEvent(SolarEvent.SUNRISE, dateTime), 7, 45, 3);
        assertTime(provider.getEvent(SolarEvent.SOLAR_NOON, dateTime), 11, 58, 3);
        assertTime(provider.getEvent(SolarEvent.SUNSET, dateTime), 16, 11, 4);
        assertTime(provider.getEvent(SolarEvent.CIVIL_DUSK, dateTime), 16, 47, 24);
        assertTime(provider.getEvent(SolarEvent.NAUTICAL_DUSK, dateTime), 17, 27, 1);
        assertTime(provider.getEvent(SolarEvent.ASTRONOMICAL_DUSK, dateTime), 18, 4, 52);
    }

    @Test
    void returnsCorrectTime_doesNotDependOnTimeOfDay() {
        assertTime(provider.getEvent(SolarEvent.SUNSET, dateTime), 16, 11, 4);
        assertTime(provider.getEvent(SolarEvent.SUNSET, dateTime.withHour(16).withMinute(14).withSecond(30)), 16, 11, 4);
        assertTime(provider.getEvent(SolarEvent.SUNSET, dateTime.withHour(23).withMinute(59)), 16, 11, 4);
    }

    @Test
    void sunNeverSetsAtLocation_exception() {
        provider = new SunTimesProviderImpl(new SolarPositionEngine(78.614803, 15.895517)); // Somewhere in Svalbard (Norway)

        assertThrows(SolarEventDoesNotOccur.class, () -> provider.getEvent(SolarEvent.SUNSET, dateTime.withMonth(6)));
        assertThrows(SolarEventDoesNotOccur.class, () -> provider.getEvent(SolarEvent.SUNRISE, dateTime));
    }
}
