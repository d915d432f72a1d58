package at.sv.sun;

import at.sv.sun.time.HourAngle;
import at.sv.sun.time.JulianDay;
import at.sv.sun.time.SolarPosition;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Computes sunrise, sunset, solar noon and twilight times for a fixed location.
 * <p>
 * Only the calendar date of the input is used. Results are returned in UTC, or in the given zone if one is passed.
 * Each rise/set/twilight event comes with two accessors: {@code getXxx} throws {@link SolarEventDoesNotOccur} if
 * the event does not occur on that date (polar day or night), {@code findXxx} returns an empty {@link Optional}
 * instead.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
@Slf4j
public final class SolarPositionEngine {

    @Getter
    private final GeoCoordinate coordinate;

    public SolarPositionEngine(double latitude, double longitude) {
        this(new GeoCoordinate(latitude, longitude));
    }

    public SolarPositionEngine(GeoCoordinate coordinate) {
        this.coordinate = coordinate;
    }

    /**
     * Solves the time at which the sun crosses the given altitude on the given date.
     *
     * @param altitudeDegrees the altitude of the sun's center in degrees, negative below the horizon
     * @param rising          {@code true} for the crossing before solar noon, {@code false} for the one after
     */
    public EventOutcome solveEvent(LocalDate date, double altitudeDegrees, boolean rising) {
        return solve(date, altitudeDegrees, rising, eventFor(altitudeDegrees, rising));
    }

    private static SolarEvent eventFor(double altitudeDegrees, boolean rising) {
        for (SolarEvent event : SolarEvent.values()) {
            if (!event.isTransit() && event.isRising() == rising && event.getAltitude().getDegrees() == altitudeDegrees) {
                return event;
            }
        }
        return rising ? SolarEvent.SUNRISE : SolarEvent.SUNSET;
    }

    public EventOutcome solveEvent(LocalDate date, SolarEvent event) {
        if (event.isTransit()) {
            return EventOutcome.occurs(solarNoon(date));
        }
        return solve(date, event.getAltitude().getDegrees(), event.isRising(), event);
    }

    private EventOutcome solve(LocalDate date, double altitude, boolean rising, SolarEvent event) {
        SolarPosition position = positionOn(date);
        OptionalDouble hourAngle = HourAngle.solve(coordinate.latitude(), position.declination(), altitude);
        if (hourAngle.isEmpty()) {
            log.trace("No {} at [{}] on {}: declination={}", event.getDisplayName(), coordinate, date,
                    position.declination());
            return EventOutcome.doesNotOccur(event, date);
        }
        double jd = HourAngle.eventTime(position.transit(), hourAngle.getAsDouble(), rising);
        return EventOutcome.occurs(JulianDay.toInstant(jd));
    }

    private Instant solarNoon(LocalDate date) {
        return JulianDay.toInstant(positionOn(date).transit());
    }

    private SolarPosition positionOn(LocalDate date) {
        return SolarPosition.at(JulianDay.fromDate(date), coordinate.longitude());
    }

    public ZonedDateTime getSunrise(LocalDate date) {
        return get(date, SolarEvent.SUNRISE, ZoneOffset.UTC);
    }

    public ZonedDateTime getSunrise(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.SUNRISE, zone);
    }

    public Optional<ZonedDateTime> findSunrise(LocalDate date) {
        return find(date, SolarEvent.SUNRISE, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findSunrise(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.SUNRISE, zone);
    }

    public ZonedDateTime getSunset(LocalDate date) {
        return get(date, SolarEvent.SUNSET, ZoneOffset.UTC);
    }

    public ZonedDateTime getSunset(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.SUNSET, zone);
    }

    public Optional<ZonedDateTime> findSunset(LocalDate date) {
        return find(date, SolarEvent.SUNSET, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findSunset(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.SUNSET, zone);
    }

    public ZonedDateTime getCivilDawn(LocalDate date) {
        return get(date, SolarEvent.CIVIL_DAWN, ZoneOffset.UTC);
    }

    public ZonedDateTime getCivilDawn(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.CIVIL_DAWN, zone);
    }

    public Optional<ZonedDateTime> findCivilDawn(LocalDate date) {
        return find(date, SolarEvent.CIVIL_DAWN, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findCivilDawn(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.CIVIL_DAWN, zone);
    }

    public ZonedDateTime getCivilDusk(LocalDate date) {
        return get(date, SolarEvent.CIVIL_DUSK, ZoneOffset.UTC);
    }

    public ZonedDateTime getCivilDusk(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.CIVIL_DUSK, zone);
    }

    public Optional<ZonedDateTime> findCivilDusk(LocalDate date) {
        return find(date, SolarEvent.CIVIL_DUSK, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findCivilDusk(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.CIVIL_DUSK, zone);
    }

    public ZonedDateTime getNauticalDawn(LocalDate date) {
        return get(date, SolarEvent.NAUTICAL_DAWN, ZoneOffset.UTC);
    }

    public ZonedDateTime getNauticalDawn(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.NAUTICAL_DAWN, zone);
    }

    public Optional<ZonedDateTime> findNauticalDawn(LocalDate date) {
        return find(date, SolarEvent.NAUTICAL_DAWN, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findNauticalDawn(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.NAUTICAL_DAWN, zone);
    }

    public ZonedDateTime getNauticalDusk(LocalDate date) {
        return get(date, SolarEvent.NAUTICAL_DUSK, ZoneOffset.UTC);
    }

    public ZonedDateTime getNauticalDusk(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.NAUTICAL_DUSK, zone);
    }

    public Optional<ZonedDateTime> findNauticalDusk(LocalDate date) {
        return find(date, SolarEvent.NAUTICAL_DUSK, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findNauticalDusk(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.NAUTICAL_DUSK, zone);
    }

    public ZonedDateTime getAstronomicalDawn(LocalDate date) {
        return get(date, SolarEvent.ASTRONOMICAL_DAWN, ZoneOffset.UTC);
    }

    public ZonedDateTime getAstronomicalDawn(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.ASTRONOMICAL_DAWN, zone);
    }

    public Optional<ZonedDateTime> findAstronomicalDawn(LocalDate date) {
        return find(date, SolarEvent.ASTRONOMICAL_DAWN, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findAstronomicalDawn(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.ASTRONOMICAL_DAWN, zone);
    }

    public ZonedDateTime getAstronomicalDusk(LocalDate date) {
        return get(date, SolarEvent.ASTRONOMICAL_DUSK, ZoneOffset.UTC);
    }

    public ZonedDateTime getAstronomicalDusk(LocalDate date, ZoneId zone) {
        return get(date, SolarEvent.ASTRONOMICAL_DUSK, zone);
    }

    public Optional<ZonedDateTime> findAstronomicalDusk(LocalDate date) {
        return find(date, SolarEvent.ASTRONOMICAL_DUSK, ZoneOffset.UTC);
    }

    public Optional<ZonedDateTime> findAstronomicalDusk(LocalDate date, ZoneId zone) {
        return find(date, SolarEvent.ASTRONOMICAL_DUSK, zone);
    }

    public ZonedDateTime getSolarNoon(LocalDate date) {
        return getSolarNoon(date, ZoneOffset.UTC);
    }

    public ZonedDateTime getSolarNoon(LocalDate date, ZoneId zone) {
        return solarNoon(date).atZone(zone);
    }

    /**
     * @throws SolarEventDoesNotOccur if the event does not occur on that date
     */
    public ZonedDateTime get(LocalDate date, SolarEvent event, ZoneId zone) {
        return solveEvent(date, event).orElseThrow().atZone(zone);
    }

    public Optional<ZonedDateTime> find(LocalDate date, SolarEvent event, ZoneId zone) {
        return solveEvent(date, event).toOptional().map(instant -> instant.atZone(zone));
    }

    /**
     * @return the time between sunrise and sunset, or {@link Duration#ZERO} if either does not occur
     */
    public Duration getDaylightLength(LocalDate date) {
        EventOutcome sunrise = solveEvent(date, SolarEvent.SUNRISE);
        EventOutcome sunset = solveEvent(date, SolarEvent.SUNSET);
        if (!sunrise.occurred() || !sunset.occurred()) {
            return Duration.ZERO;
        }
        return Duration.between(sunrise.orElseThrow(), sunset.orElseThrow());
    }

    public SolarEventReport getEvents(LocalDate date) {
        return getEvents(date, ZoneOffset.UTC);
    }

    /**
     * @return all {@link SolarEvent events} of the given date, in chronological order
     */
    public SolarEventReport getEvents(LocalDate date, ZoneId zone) {
        Map<SolarEvent, ZonedDateTime> events = new EnumMap<>(SolarEvent.class);
        for (SolarEvent event : SolarEvent.values()) {
            find(date, event, zone).ifPresent(time -> events.put(event, time));
        }
        return new SolarEventReport(coordinate, date, zone, events, getDaylightLength(date));
    }

    @Override
    public String toString() {
        return "SolarPositionEngine[" + coordinate + "]";
    }
}
