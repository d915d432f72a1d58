package at.sv.sun;

/**
 * A geographic coordinate in decimal degrees.
 *
 * @param latitude  degrees north, negative for south [-90..90]
 * @param longitude degrees east, negative for west [-180..180]
 */
public record GeoCoordinate(double latitude, double longitude) {

    public GeoCoordinate {
        if (!(latitude >= -90 && latitude <= 90)) {
            throw new InvalidCoordinate("Latitude must be between -90 and 90 degrees, but was " + latitude);
        }
        if (!(longitude >= -180 && longitude <= 180)) {
            throw new InvalidCoordinate("Longitude must be between -180 and 180 degrees, but was " + longitude);
        }
    }

    public static GeoCoordinate of(double latitude, double longitude) {
        return new GeoCoordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return latitude + ", " + longitude;
    }
}
