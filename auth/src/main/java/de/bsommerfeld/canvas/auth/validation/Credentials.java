package de.bsommerfeld.canvas.auth.validation;

/**
 * What the user typed into a login or registration form. The username is
 * trimmed; passwords are kept as entered. Never persisted.
 *
 * @param username trimmed username
 * @param password password as entered
 * @param email    trimmed email, empty for login
 */
public record Credentials(String username, String password, String email) {

    public Credentials {
        username = username == null ? "" : username.trim();
        password = password == null ? "" : password;
        email = email == null ? "" : email.trim();
    }

    public static Credentials login(String username, String password) {
        return new Credentials(username, password, "");
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", email=" + email + "]";
    }
}
