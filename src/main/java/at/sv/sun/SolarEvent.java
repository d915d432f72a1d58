package at.sv.sun;

import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * The named solar events of a day, in chronological order.
 */
@Getter
public enum SolarEvent {
    ASTRONOMICAL_DAWN("astronomical_dawn", "astronomical dawn", SolarAltitude.ASTRONOMICAL, true),
    NAUTICAL_DAWN("nautical_dawn", "nautical dawn", SolarAltitude.NAUTICAL, true),
    CIVIL_DAWN("civil_dawn", "civil dawn", SolarAltitude.CIVIL, true),
    SUNRISE("sunrise", "sunrise", SolarAltitude.SUNRISE_SUNSET, true),
    SOLAR_NOON("solar_noon", "solar noon", null, false),
    SUNSET("sunset", "sunset", SolarAltitude.SUNRISE_SUNSET, false),
    CIVIL_DUSK("civil_dusk", "civil dusk", SolarAltitude.CIVIL, false),
    NAUTICAL_DUSK("nautical_dusk", "nautical dusk", SolarAltitude.NAUTICAL, false),
    ASTRONOMICAL_DUSK("astronomical_dusk", "astronomical dusk", SolarAltitude.ASTRONOMICAL, false);

    private final String keyword;
    private final String displayName;
    /**
     * The altitude threshold, {@code null} for {@link #SOLAR_NOON} which is the transit itself.
     */
    @Nullable
    private final SolarAltitude altitude;
    private final boolean rising;

    SolarEvent(String keyword, String displayName, @Nullable SolarAltitude altitude, boolean rising) {
        this.keyword = keyword;
        this.displayName = displayName;
        this.altitude = altitude;
        this.rising = rising;
    }

    public boolean isTransit() {
        return altitude == null;
    }

    /**
     * Looks up an event by its keyword. Besides the {@link #getKeyword() keywords} themselves, {@code noon} and the
     * {@code *_start} / {@code *_end} twilight names are accepted, case-insensitive.
     *
     * @return the event, or {@code null} if the keyword is unknown
     */
    public static @Nullable SolarEvent fromKeyword(String keyword) {
        return switch (keyword.trim().toLowerCase(Locale.ENGLISH)) {
            case "astronomical_start", "astronomical_dawn" -> ASTRONOMICAL_DAWN;
            case "nautical_start", "nautical_dawn" -> NAUTICAL_DAWN;
            case "civil_start", "civil_dawn" -> CIVIL_DAWN;
            case "sunrise" -> SUNRISE;
            case "noon", "solar_noon" -> SOLAR_NOON;
            case "sunset" -> SUNSET;
            case "civil_end", "civil_dusk" -> CIVIL_DUSK;
            case "nautical_end", "nautical_dusk" -> NAUTICAL_DUSK;
            case "astronomical_end", "astronomical_dusk" -> ASTRONOMICAL_DUSK;
            default -> null;
        };
    }
}
