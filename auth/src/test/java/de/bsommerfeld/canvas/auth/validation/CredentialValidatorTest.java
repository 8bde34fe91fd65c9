package de.bsommerfeld.canvas.auth.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialValidatorTest {

    @Test
    void validateLogin_shouldRequireTrimmedUsername() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateLogin(Credentials.login("   ", "secret")));
        assertEquals(Field.USERNAME, e.getField());
        assertEquals(CredentialValidator.USERNAME_REQUIRED, e.getMessage());
    }

    @Test
    void validateLogin_shouldRequirePassword() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateLogin(Credentials.login("alice", "")));
        assertEquals(Field.PASSWORD, e.getField());
    }

    @Test
    void validateLogin_shouldAcceptFilledForm() {
        assertDoesNotThrow(() -> CredentialValidator.validateLogin(Credentials.login(" alice ", "x")));
    }

    @Test
    void validateRegistration_shouldRejectShortUsername() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("ab", "secret1", "a@b.co"), "secret1"));
        assertEquals(Field.USERNAME, e.getField());
        assertEquals("Username must be 3-20 characters", e.getMessage());
    }

    @Test
    void validateRegistration_shouldRejectLongUsername() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("a".repeat(21), "secret1", "a@b.co"), "secret1"));
        assertEquals(CredentialValidator.USERNAME_LENGTH, e.getMessage());
    }

    @Test
    void validateRegistration_shouldRejectInvalidCharacters() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("bad-name", "secret1", "a@b.co"), "secret1"));
        assertEquals(CredentialValidator.USERNAME_CHARACTERS, e.getMessage());
    }

    @Test
    void validateRegistration_shouldRejectMalformedEmail() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("valid_1", "secret1", "not-an-email"), "secret1"));
        assertEquals(Field.EMAIL, e.getField());
        assertEquals("Invalid email format", e.getMessage());
    }

    @Test
    void validateRegistration_shouldRequireEmail() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("valid_1", "secret1", ""), "secret1"));
        assertEquals(CredentialValidator.EMAIL_REQUIRED, e.getMessage());
    }

    @Test
    void validateRegistration_shouldRejectShortPassword() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("valid_1", "12345", "a@b.co"), "12345"));
        assertEquals(Field.PASSWORD, e.getField());
        assertEquals(CredentialValidator.PASSWORD_LENGTH, e.getMessage());
    }

    @Test
    void validateRegistration_shouldRequireConfirmation() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("valid_1", "secret1", "a@b.co"), ""));
        assertEquals(Field.CONFIRM_PASSWORD, e.getField());
        assertEquals(CredentialValidator.CONFIRM_REQUIRED, e.getMessage());
    }

    @Test
    void validateRegistration_shouldRejectMismatch() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validateRegistration(
                        new Credentials("valid_1", "secret1", "a@b.co"), "secret2"));
        assertEquals(CredentialValidator.PASSWORD_MISMATCH, e.getMessage());
    }

    @Test
    void validateRegistration_shouldAcceptValidForm() {
        assertDoesNotThrow(() -> CredentialValidator.validateRegistration(
                new Credentials("valid_1", "secret1", "user@example.com"), "secret1"));
    }

    @Test
    void validatePasswordReset_shouldRequireSixDigitCode() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validatePasswordReset("a@b.co", "12a456", "secret1"));
        assertEquals(Field.CODE, e.getField());
        assertEquals(CredentialValidator.CODE_FORMAT, e.getMessage());

        ValidationException empty = assertThrows(ValidationException.class,
                () -> CredentialValidator.validatePasswordReset("a@b.co", " ", "secret1"));
        assertEquals(CredentialValidator.CODE_REQUIRED, empty.getMessage());
    }

    @Test
    void validatePasswordReset_shouldCheckNewPassword() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> CredentialValidator.validatePasswordReset("a@b.co", "123456", "abc"));
        assertEquals(Field.PASSWORD, e.getField());
    }

    @Test
    void validatePasswordReset_shouldAcceptValidInput() {
        assertDoesNotThrow(() -> CredentialValidator.validatePasswordReset("a@b.co", "123456", "secret1"));
    }

    @Test
    void credentials_shouldNotExposePasswordInToString() {
        assertFalse(new Credentials("alice", "hunter22", "a@b.co").toString().contains("hunter22"));
    }
}
