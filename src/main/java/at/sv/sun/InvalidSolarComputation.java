package at.sv.sun;

/**
 * Signals an internal inconsistency of the solar position model, e.g. a non-finite Julian Day reaching the instant
 * conversion. Never caused by a sun that just does not rise or set, see {@link SolarEventDoesNotOccur} for that.
 */
public final class InvalidSolarComputation extends IllegalStateException {
    public InvalidSolarComputation(String message) {
        super(message);
    }
}
