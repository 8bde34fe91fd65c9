package de.bsommerfeld.canvas.auth.validation;

import java.util.regex.Pattern;

/**
 * Form checks run before a request is sent. Each method reports the first
 * problem it finds, in field order.
 */
public final class CredentialValidator {

    public static final int USERNAME_MIN = 3;
    public static final int USERNAME_MAX = 20;
    public static final int PASSWORD_MIN = 6;

    private static final Pattern USERNAME = Pattern.compile("^[a-zA-Z0-9_]+$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern CODE = Pattern.compile("^\\d{6}$");

    public static final String USERNAME_REQUIRED = "Please enter a username";
    public static final String USERNAME_LENGTH = "Username must be 3-20 characters";
    public static final String USERNAME_CHARACTERS = "Username may only contain letters, digits and underscores";
    public static final String EMAIL_REQUIRED = "Please enter an email address";
    public static final String EMAIL_FORMAT = "Invalid email format";
    public static final String PASSWORD_REQUIRED = "Please enter a password";
    public static final String PASSWORD_LENGTH = "Password must be at least 6 characters";
    public static final String CONFIRM_REQUIRED = "Please confirm your password";
    public static final String PASSWORD_MISMATCH = "Passwords do not match";
    public static final String CODE_REQUIRED = "Please enter the verification code";
    public static final String CODE_FORMAT = "Verification code must be 6 digits";

    private CredentialValidator() {
    }

    public static void validateLogin(Credentials credentials) throws ValidationException {
        if (credentials.username().isEmpty()) {
            throw new ValidationException(Field.USERNAME, USERNAME_REQUIRED);
        }
        if (credentials.password().isEmpty()) {
            throw new ValidationException(Field.PASSWORD, PASSWORD_REQUIRED);
        }
    }

    public static void validateRegistration(Credentials credentials, String confirmation)
            throws ValidationException {
        String username = credentials.username();
        if (username.isEmpty()) {
            throw new ValidationException(Field.USERNAME, USERNAME_REQUIRED);
        }
        if (username.length() < USERNAME_MIN || username.length() > USERNAME_MAX) {
            throw new ValidationException(Field.USERNAME, USERNAME_LENGTH);
        }
        if (!USERNAME.matcher(username).matches()) {
            throw new ValidationException(Field.USERNAME, USERNAME_CHARACTERS);
        }
        validateEmail(credentials.email());
        validateNewPassword(credentials.password());
        if (confirmation == null || confirmation.isEmpty()) {
            throw new ValidationException(Field.CONFIRM_PASSWORD, CONFIRM_REQUIRED);
        }
        if (!credentials.password().equals(confirmation)) {
            throw new ValidationException(Field.CONFIRM_PASSWORD, PASSWORD_MISMATCH);
        }
    }

    public static void validateEmail(String email) throws ValidationException {
        String trimmed = email == null ? "" : email.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(Field.EMAIL, EMAIL_REQUIRED);
        }
        if (!EMAIL.matcher(trimmed).matches()) {
            throw new ValidationException(Field.EMAIL, EMAIL_FORMAT);
        }
    }

    public static void validatePasswordReset(String email, String code, String newPassword)
            throws ValidationException {
        validateEmail(email);
        String trimmed = code == null ? "" : code.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(Field.CODE, CODE_REQUIRED);
        }
        if (!CODE.matcher(trimmed).matches()) {
            throw new ValidationException(Field.CODE, CODE_FORMAT);
        }
        validateNewPassword(newPassword);
    }

    private static void validateNewPassword(String password) throws ValidationException {
        if (password == null || password.isEmpty()) {
            throw new ValidationException(Field.PASSWORD, PASSWORD_REQUIRED);
        }
        if (password.length() < PASSWORD_MIN) {
            throw new ValidationException(Field.PASSWORD, PASSWORD_LENGTH);
        }
    }
}
