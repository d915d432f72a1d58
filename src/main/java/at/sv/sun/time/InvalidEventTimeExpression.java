package at.sv.sun.time;

public final class InvalidEventTimeExpression extends IllegalArgumentException {
    public InvalidEventTimeExpression(String message) {
        super(message);
    }
}
