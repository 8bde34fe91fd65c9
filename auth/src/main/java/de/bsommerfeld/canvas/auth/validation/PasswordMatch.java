package de.bsommerfeld.canvas.auth.validation;

/**
 * Live hint shown under the confirm-password field.
 */
public enum PasswordMatch {

    /** Both fields empty: show nothing. */
    EMPTY,
    /** Password typed, confirmation still empty. */
    PROMPT,
    MATCH,
    MISMATCH;

    public static PasswordMatch evaluate(String password, String confirmation) {
        String p = password == null ? "" : password;
        String c = confirmation == null ? "" : confirmation;
        if (c.isEmpty()) {
            return p.isEmpty() ? EMPTY : PROMPT;
        }
        return p.equals(c) ? MATCH : MISMATCH;
    }
}
