package at.sv.sun.time;

import java.util.OptionalDouble;

public final class HourAngle {

    private HourAngle() {
    }

    /**
     * Solves the hour angle at which the sun passes the given altitude.
     *
     * @param latitude    observer latitude in degrees
     * @param declination solar declination in degrees
     * @param altitude    altitude threshold in degrees, negative below the horizon
     * @return the hour angle in degrees [0, 180], or empty if the sun never crosses the altitude on that day
     * (polar day or polar night)
     */
    public static OptionalDouble solve(double latitude, double declination, double altitude) {
        double lat = Math.toRadians(latitude);
        double dec = Math.toRadians(declination);
        double cosHourAngle = (Math.sin(Math.toRadians(altitude)) - Math.sin(lat) * Math.sin(dec))
                              / (Math.cos(lat) * Math.cos(dec));
        if (!(Math.abs(cosHourAngle) <= 1)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.toDegrees(Math.acos(cosHourAngle)));
    }

    /**
     * @return the Julian Day at which the sun crosses the altitude belonging to {@code hourAngle}, before the
     * transit when rising, after it when setting
     */
    public static double eventTime(double transit, double hourAngle, boolean rising) {
        return rising ? transit - hourAngle / 360.0 : transit + hourAngle / 360.0;
    }
}
