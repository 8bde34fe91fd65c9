package de.bsommerfeld.canvas.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the {@code config.toml} document. Each section maps to a TOML
 * table of the same name.
 *
 * <p>
 * Instances loaded through {@link ConfigStore} remember their store, so
 * {@link #save()} writes back to the file they came from. A config created
 * with {@code new} has no store and cannot be saved.
 */
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("user")
    private UserConfig user = new UserConfig();

    @JsonProperty("auth")
    private AuthConfig auth = new AuthConfig();

    @JsonProperty("history")
    private HistoryConfig history = new HistoryConfig();

    @JsonProperty("update")
    private UpdateConfig update = new UpdateConfig();

    @JsonIgnore
    private ConfigStore store;

    public boolean isDebugMode() {
        return debugMode;
    }

    public UserConfig getUser() {
        return user;
    }

    public AuthConfig getAuth() {
        return auth;
    }

    public HistoryConfig getHistory() {
        return history;
    }

    public UpdateConfig getUpdate() {
        return update;
    }

    void attach(ConfigStore store) {
        this.store = store;
    }

    /**
     * Writes this configuration back to its {@code config.toml}.
     *
     * @throws IllegalStateException       if the config was not loaded from a
     *                                     {@link ConfigStore}
     * @throws java.io.UncheckedIOException if the file cannot be written
     */
    public void save() {
        if (store == null) {
            throw new IllegalStateException("Configuration has no backing file");
        }
        store.save(this);
    }
}
