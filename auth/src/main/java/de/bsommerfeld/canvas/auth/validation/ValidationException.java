package de.bsommerfeld.canvas.auth.validation;

/**
 * Client-side input error. Thrown before any request is sent.
 */
public class ValidationException extends Exception {

    private final Field field;

    public ValidationException(Field field, String message) {
        super(message);
        this.field = field;
    }

    public Field getField() {
        return field;
    }
}
