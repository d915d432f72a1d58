package at.sv.sun.time;

import at.sv.sun.SolarEvent;

import java.time.ZonedDateTime;

/**
 * Sun times for the date of a {@link ZonedDateTime}, expressed in its zone.
 */
public interface SunTimesProvider {

    /**
     * @throws at.sv.sun.SolarEventDoesNotOccur if the event does not occur on that date
     */
    ZonedDateTime getEvent(SolarEvent event, ZonedDateTime dateTime);
}
