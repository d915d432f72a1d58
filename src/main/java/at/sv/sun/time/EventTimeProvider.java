package at.sv.sun.time;

import java.time.ZonedDateTime;

public interface EventTimeProvider {
    /**
     * @param input    a ISO_LOCAL_TIME formatted string, or a sun keyword with optional minute offset, e.g.
     *                 {@code sunset-30}
     * @param dateTime the date to use as reference for resolving sun times
     * @return the time corresponding to the input and dateTime, in the zone of dateTime
     * @throws InvalidEventTimeExpression      if the input is neither a valid
     *                                         {@link java.time.format.DateTimeFormatter#ISO_LOCAL_TIME} nor a
     *                                         supported sun keyword with optional offset.
     * @throws at.sv.sun.SolarEventDoesNotOccur if the referenced sun event does not occur on that date
     */
    ZonedDateTime getTime(String input, ZonedDateTime dateTime);
}
