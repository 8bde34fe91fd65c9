package de.bsommerfeld.canvas.auth;

import com.google.common.hash.Hashing;
import de.bsommerfeld.canvas.core.util.AppVersion;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;

/**
 * Identifies this installation to the account server, which binds accounts to
 * a limited number of devices.
 *
 * @param hardwareId stable SHA-256 fingerprint of the machine
 * @param deviceName host name
 * @param osVersion  operating system name and version
 * @param appVersion application version
 */
public record DeviceIdentity(String hardwareId, String deviceName, String osVersion, String appVersion) {

    public static DeviceIdentity detect() {
        String deviceName = hostName();
        String os = System.getProperty("os.name", "unknown") + " " + System.getProperty("os.version", "");
        String fingerprint = String.join("|",
                deviceName,
                System.getProperty("os.name", ""),
                System.getProperty("os.arch", ""),
                System.getProperty("user.name", ""),
                System.getProperty("user.home", ""));
        String hardwareId = Hashing.sha256().hashString(fingerprint, StandardCharsets.UTF_8).toString();
        return new DeviceIdentity(hardwareId, deviceName, os.trim(), AppVersion.get());
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            String env = System.getenv("COMPUTERNAME");
            if (env == null) {
                env = System.getenv("HOSTNAME");
            }
            return env != null ? env : "unknown";
        }
    }
}
