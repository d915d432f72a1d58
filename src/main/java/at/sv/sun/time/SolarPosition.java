package at.sv.sun.time;

import static at.sv.sun.time.JulianDay.J2000;

/**
 * Position of the sun for a Julian Day, as seen from a fixed longitude.
 *
 * @param meanAnomaly       mean solar anomaly in degrees [0, 360)
 * @param eclipticLongitude ecliptic longitude of the sun in degrees [0, 360)
 * @param declination       solar declination in degrees [-90, 90]
 * @param transit           Julian Day of the local solar transit (solar noon)
 */
public record SolarPosition(double meanAnomaly, double eclipticLongitude, double declination, double transit) {

    private static final double MEAN_ANOMALY_AT_EPOCH = 357.5291;
    private static final double DAILY_MOTION = 0.98564736;
    private static final double PERIHELION_LONGITUDE = 102.9373;
    private static final double OBLIQUITY = 23.43929111;

    // equation of center coefficients for sin(M), sin(2M), sin(3M)
    private static final double CENTER_1 = 1.9148;
    private static final double CENTER_2 = 0.0200;
    private static final double CENTER_3 = 0.0003;

    private static final double TRANSIT_ECCENTRICITY = 0.00534;
    private static final double TRANSIT_OBLIQUITY = 0.00692;

    public static SolarPosition at(double jd, double longitude) {
        double meanAnomaly = normalize(MEAN_ANOMALY_AT_EPOCH + DAILY_MOTION * (jd - J2000));
        double m = Math.toRadians(meanAnomaly);
        double equationOfCenter = CENTER_1 * Math.sin(m)
                                  + CENTER_2 * Math.sin(2 * m)
                                  + CENTER_3 * Math.sin(3 * m);
        double eclipticLongitude = normalize(meanAnomaly + equationOfCenter + PERIHELION_LONGITUDE + 180.0);
        double lambda = Math.toRadians(eclipticLongitude);
        double declination = Math.toDegrees(Math.asin(Math.sin(lambda) * Math.sin(Math.toRadians(OBLIQUITY))));
        double n = jd - J2000 - longitude / 360.0;
        double transit = J2000 + n
                         + TRANSIT_ECCENTRICITY * Math.sin(m)
                         - TRANSIT_OBLIQUITY * Math.sin(2 * lambda);
        return new SolarPosition(meanAnomaly, eclipticLongitude, declination, transit);
    }

    /**
     * Normalizes an angle in degrees into [0, 360).
     */
    static double normalize(double degrees) {
        double normalized = ((degrees % 360) + 360) % 360;
        return normalized == 360.0 ? 0.0 : normalized;
    }
}
