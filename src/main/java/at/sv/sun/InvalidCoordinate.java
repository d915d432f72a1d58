package at.sv.sun;

public final class InvalidCoordinate extends IllegalArgumentException {
    public InvalidCoordinate(String message) {
        super(message);
    }
}
