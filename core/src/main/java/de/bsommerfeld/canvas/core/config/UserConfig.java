package de.bsommerfeld.canvas.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-adjustable preferences that survive restarts. Written back on every
 * main-window close.
 */
public class UserConfig {

    public static final double DEFAULT_SIDEBAR_RATIO = 0.25;
    static final double MIN_SIDEBAR_RATIO = 0.1;
    static final double MAX_SIDEBAR_RATIO = 0.6;

    @JsonProperty("remember-username")
    private boolean rememberUsername = true;

    @JsonProperty("last-username")
    private String lastUsername = "";

    @JsonProperty("auto-update")
    private boolean autoUpdate = true;

    /** Position of the library divider, as a fraction of the window width. */
    @JsonProperty("library-sidebar-ratio")
    private double librarySidebarRatio = DEFAULT_SIDEBAR_RATIO;

    public boolean isRememberUsername() {
        return rememberUsername;
    }

    public void setRememberUsername(boolean rememberUsername) {
        this.rememberUsername = rememberUsername;
    }

    public String getLastUsername() {
        return lastUsername;
    }

    public void setLastUsername(String lastUsername) {
        this.lastUsername = lastUsername;
    }

    public boolean isAutoUpdate() {
        return autoUpdate;
    }

    public void setAutoUpdate(boolean autoUpdate) {
        this.autoUpdate = autoUpdate;
    }

    /** @return the stored ratio, kept within {@code [0.1, 0.6]} */
    public double getLibrarySidebarRatio() {
        if (Double.isNaN(librarySidebarRatio)) {
            return DEFAULT_SIDEBAR_RATIO;
        }
        return Math.max(MIN_SIDEBAR_RATIO, Math.min(MAX_SIDEBAR_RATIO, librarySidebarRatio));
    }

    public void setLibrarySidebarRatio(double librarySidebarRatio) {
        this.librarySidebarRatio = librarySidebarRatio;
    }
}
