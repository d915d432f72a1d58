package at.sv.sun;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Result of solving a solar event: either the instant it occurs, or the information that the sun does not reach
 * the event's altitude on that date.
 */
public sealed interface EventOutcome permits EventOutcome.Occurs, EventOutcome.DoesNotOccur {

    static EventOutcome occurs(Instant instant) {
        return new Occurs(instant);
    }

    static EventOutcome doesNotOccur(SolarEvent event, LocalDate date) {
        return new DoesNotOccur(event, date);
    }

    boolean occurred();

    Optional<Instant> toOptional();

    /**
     * @throws SolarEventDoesNotOccur if the event does not occur
     */
    Instant orElseThrow();

    record Occurs(Instant instant) implements EventOutcome {
        @Override
        public boolean occurred() {
            return true;
        }

        @Override
        public Optional<Instant> toOptional() {
            return Optional.of(instant);
        }

        @Override
        public Instant orElseThrow() {
            return instant;
        }
    }

    record DoesNotOccur(SolarEvent event, LocalDate date) implements EventOutcome {
        @Override
        public boolean occurred() {
            return false;
        }

        @Override
        public Optional<Instant> toOptional() {
            return Optional.empty();
        }

        @Override
        public Instant orElseThrow() {
            throw new SolarEventDoesNotOccur(event, date);
        }
    }
}
