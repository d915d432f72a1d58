package at.sv.sun.time;

import at.sv.sun.SolarEvent;
import at.sv.sun.SolarPositionEngine;

import java.time.ZonedDateTime;

public final class SunTimesProviderImpl implements SunTimesProvider {

    private final SolarPositionEngine engine;

    public SunTimesProviderImpl(SolarPositionEngine engine) {
        this.engine = engine;
    }

    @Override
    public ZonedDateTime getEvent(SolarEvent event, ZonedDateTime dateTime) {
        return engine.get(dateTime.toLocalDate(), event, dateTime.getZone());
    }
}
