package at.sv.sun.time;

import at.sv.sun.InvalidSolarComputation;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Conversions between civil dates, Julian Days and {@link Instant instants}.
 */
public final class JulianDay {

    /**
     * Julian Day of the J2000.0 epoch (2000-01-01 12:00 TT).
     */
    public static final double J2000 = 2_451_545.0;

    private static final double UNIX_EPOCH = 2_440_587.5;
    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final double YEAR_DAYS = 365.25;
    private static final double MONTH_FACTOR = 30.6001;
    private static final int EPOCH_YEAR_OFFSET = 4716;
    private static final double BASE_OFFSET = 1524.5;
    private static final double MIDNIGHT_FIX = 0.5;
    private static final double DAY = 1.0;

    private JulianDay() {
    }

    /**
     * Converts a proleptic Gregorian date to the Julian Day the solar position model is calibrated against.
     * <p>
     * The Meeus/USNO result is advanced by one day and moved back by half a day, which lands on 12:00 UT of the
     * given date. All constants of {@link SolarPosition} assume this anchor. The day is added to the Julian Day
     * rather than to the date, so {@link LocalDate#MAX} converts as well.
     */
    public static double fromDate(LocalDate date) {
        int year = date.getYear();
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        double a = Math.floor(year / 100.0);
        double b = 2 - a + Math.floor(a / 4);
        double jd = Math.floor(YEAR_DAYS * (year + EPOCH_YEAR_OFFSET))
                    + Math.floor(MONTH_FACTOR * (month + 1))
                    + day + b - BASE_OFFSET;
        return jd + DAY - MIDNIGHT_FIX;
    }

    /**
     * @throws InvalidSolarComputation if {@code jd} is NaN or infinite
     */
    public static Instant toInstant(double jd) {
        if (Double.isNaN(jd)) {
            throw new InvalidSolarComputation("Invalid Julian Day: NaN");
        }
        if (Double.isInfinite(jd)) {
            throw new InvalidSolarComputation("Invalid Julian Day: infinite");
        }
        double seconds = (jd - UNIX_EPOCH) * SECONDS_PER_DAY;
        long epochSeconds = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - epochSeconds) * NANOS_PER_SECOND);
        return Instant.ofEpochSecond(epochSeconds, nanos);
    }
}
