package at.sv.sun;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Altitudes of the sun's center that define the rise/set and twilight events.
 */
@Getter
@RequiredArgsConstructor
public enum SolarAltitude {
    /**
     * Apparent altitude at sunrise and sunset: mean refraction plus the sun's semi-diameter.
     */
    SUNRISE_SUNSET(-0.8333),
    CIVIL(-6.0),
    NAUTICAL(-12.0),
    ASTRONOMICAL(-18.0);

    private final double degrees;
}
