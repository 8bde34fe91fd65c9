package de.bsommerfeld.canvas.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestAuthClientTest {

    private final TestAuthClient client = new TestAuthClient();

    @Test
    void login_shouldAcceptDemoAccount() {
        AuthResult result = client.login("demo", "demo123").join();

        assertTrue(result.success());
        assertNotNull(result.grant());
        assertNotNull(result.grant().token());
        assertTrue(client.heartbeat(result.grant().token()).join().success());
    }

    @Test
    void login_shouldRejectWrongPassword() {
        assertFalse(client.login("demo", "nope").join().success());
    }

    @Test
    void register_shouldRejectExistingUser() {
        assertTrue(client.register("new_user", "secret1", "n@x.io").join().success());

        AuthResult again = client.register("new_user", "secret1", "n@x.io").join();
        assertFalse(again.success());
        assertEquals("Username already exists", again.message());
    }

    @Test
    void resetPassword_shouldRequireFixedCode() {
        assertTrue(client.sendResetCode("demo@example.com").join().success());
        assertFalse(client.resetPassword("demo@example.com", "000000", "changed1").join().success());
        assertTrue(client.resetPassword("demo@example.com", TestAuthClient.RESET_CODE, "changed1").join().success());
        assertTrue(client.login("demo", "changed1").join().success());
    }

    @Test
    void heartbeat_shouldRejectUnknownToken() {
        assertFalse(client.heartbeat("unknown").join().success());
    }
}
