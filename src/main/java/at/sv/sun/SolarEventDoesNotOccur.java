package at.sv.sun;

import lombok.Getter;

import java.time.LocalDate;

/**
 * Thrown by the failing accessors of {@link SolarPositionEngine} if the sun does not reach the altitude of the
 * requested event on the given date (polar day or polar night).
 */
@Getter
public final class SolarEventDoesNotOccur extends RuntimeException {

    private final SolarEvent event;
    private final LocalDate date;

    public SolarEventDoesNotOccur(SolarEvent event, LocalDate date) {
        super("No " + event.getDisplayName() + " occurs on " + date + " for this location (polar night/day)");
        this.event = event;
        this.date = date;
    }
}
