package de.bsommerfeld.canvas.auth.validation;

/** Input field a {@link ValidationException} refers to. */
public enum Field {
    USERNAME,
    EMAIL,
    PASSWORD,
    CONFIRM_PASSWORD,
    CODE
}
