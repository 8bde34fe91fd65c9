package de.bsommerfeld.canvas.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of the running application, injected into
 * {@code canvas-version.properties} at build time via Maven resource
 * filtering.
 */
public final class AppVersion {

    public static final String UNKNOWN = "unknown";

    private static final String VERSION = load();

    private AppVersion() {
    }

    public static String get() {
        return VERSION;
    }

    /** The version without a {@code -SNAPSHOT} or similar qualifier. */
    public static String release() {
        int dash = VERSION.indexOf('-');
        return dash > 0 ? VERSION.substring(0, dash) : VERSION;
    }

    private static String load() {
        try (InputStream in = AppVersion.class.getResourceAsStream("/canvas-version.properties")) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                String version = props.getProperty("app.version", UNKNOWN);
                // Unfiltered placeholder when running from an IDE without a Maven build
                return version.startsWith("${") ? UNKNOWN : version;
            }
        } catch (IOException e) {
            // A missing version must not prevent startup
            return UNKNOWN;
        }
        return UNKNOWN;
    }
}
