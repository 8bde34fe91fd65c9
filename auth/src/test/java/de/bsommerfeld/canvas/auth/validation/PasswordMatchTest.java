package de.bsommerfeld.canvas.auth.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PasswordMatchTest {

    @Test
    void evaluate_shouldBeEmptyWhenBothEmpty() {
        assertEquals(PasswordMatch.EMPTY, PasswordMatch.evaluate("", ""));
        assertEquals(PasswordMatch.EMPTY, PasswordMatch.evaluate(null, null));
    }

    @Test
    void evaluate_shouldPromptWhenOnlyPasswordTyped() {
        assertEquals(PasswordMatch.PROMPT, PasswordMatch.evaluate("secret", ""));
    }

    @Test
    void evaluate_shouldMatchEqualValues() {
        assertEquals(PasswordMatch.MATCH, PasswordMatch.evaluate("secret", "secret"));
    }

    @Test
    void evaluate_shouldMismatchDifferentValues() {
        assertEquals(PasswordMatch.MISMATCH, PasswordMatch.evaluate("secret", "secreT"));
    }

    @Test
    void evaluate_shouldMismatchWhenOnlyConfirmationTyped() {
        assertEquals(PasswordMatch.MISMATCH, PasswordMatch.evaluate("", "secret"));
    }
}
