package com.swipesentinel.capture.appium;

import com.swipesentinel.core.ConfigException;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

import static com.swipesentinel.core.EnvDefaults.boolEnvOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrDefault;
import static com.swipesentinel.core.EnvDefaults.envOrNull;
import static com.swipesentinel.core.EnvDefaults.intEnvOrDefault;

/**
 * Connection settings for the Appium (UiAutomator2) transport.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 *   SWIPESENTINEL_APPIUM_URL              - Appium server URL (default: http://127.0.0.1:4723)
 *   SWIPESENTINEL_DEVICE_NAME             - Device name capability (default: emulator-5554)
 *   SWIPESENTINEL_DEVICE_UDID             - Device UDID, when several devices are attached
 *   SWIPESENTINEL_APP_ACTIVITY            - Launch activity, when the app must be started by the session
 *   SWIPESENTINEL_NO_RESET                - Keep app data between sessions (default: true)
 *   SWIPESENTINEL_COMMAND_TIMEOUT_S       - Appium new-command timeout (default: 60)
 *   SWIPESENTINEL_CAPTURE_SCREENSHOT      - Attach a screenshot to each observation (default: true)
 */
public class AppiumConfig {

    public static final String DEFAULT_SERVER_URL       = "http://127.0.0.1:4723";
    public static final String DEFAULT_DEVICE_NAME      = "emulator-5554";
    public static final int    DEFAULT_COMMAND_TIMEOUT_S = 60;

    private final URL     serverUrl;
    private final String  deviceName;
    private final String  udid;
    private final String  appActivity;
    private final boolean noReset;
    private final int     commandTimeoutSeconds;
    private final boolean captureScreenshot;

    private AppiumConfig(Builder b, URL serverUrl) {
        this.serverUrl             = serverUrl;
        this.deviceName            = b.deviceName;
        this.udid                  = b.udid;
        this.appActivity           = b.appActivity;
        this.noReset               = b.noReset;
        this.commandTimeoutSeconds = b.commandTimeoutSeconds;
        this.captureScreenshot     = b.captureScreenshot;
    }

    public static AppiumConfig fromEnvironment() {
        return builder()
            .serverUrl(envOrDefault("SWIPESENTINEL_APPIUM_URL", DEFAULT_SERVER_URL))
            .deviceName(envOrDefault("SWIPESENTINEL_DEVICE_NAME", DEFAULT_DEVICE_NAME))
            .udid(envOrNull("SWIPESENTINEL_DEVICE_UDID"))
            .appActivity(envOrNull("SWIPESENTINEL_APP_ACTIVITY"))
            .noReset(boolEnvOrDefault("SWIPESENTINEL_NO_RESET", true))
            .commandTimeoutSeconds(intEnvOrDefault("SWIPESENTINEL_COMMAND_TIMEOUT_S", DEFAULT_COMMAND_TIMEOUT_S))
            .captureScreenshot(boolEnvOrDefault("SWIPESENTINEL_CAPTURE_SCREENSHOT", true))
            .build();
    }

    public URL     getServerUrl()             { return serverUrl; }
    public String  getDeviceName()            { return deviceName; }
    public String  getUdid()                  { return udid; }
    public String  getAppActivity()           { return appActivity; }
    public boolean isNoReset()                { return noReset; }
    public int     getCommandTimeoutSeconds() { return commandTimeoutSeconds; }
    public boolean isCaptureScreenshot()      { return captureScreenshot; }

    @Override
    public String toString() {
        return "AppiumConfig{url=" + serverUrl + ", device=" + deviceName
            + (udid != null ? ", udid=" + udid : "") + ", noReset=" + noReset + "}";
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String  serverUrl = DEFAULT_SERVER_URL;
        private String  deviceName = DEFAULT_DEVICE_NAME;
        private String  udid;
        private String  appActivity;
        private boolean noReset = true;
        private int     commandTimeoutSeconds = DEFAULT_COMMAND_TIMEOUT_S;
        private boolean captureScreenshot = true;

        public Builder serverUrl(String u)             { this.serverUrl = u; return this; }
        public Builder deviceName(String n)            { this.deviceName = n; return this; }
        public Builder udid(String u)                  { this.udid = u; return this; }
        public Builder appActivity(String a)           { this.appActivity = a; return this; }
        public Builder noReset(boolean b)              { this.noReset = b; return this; }
        public Builder commandTimeoutSeconds(int s)    { this.commandTimeoutSeconds = s; return this; }
        public Builder captureScreenshot(boolean b)    { this.captureScreenshot = b; return this; }

        /** @throws ConfigException on a malformed server URL or a non-positive timeout */
        public AppiumConfig build() {
            if (deviceName == null || deviceName.isBlank()) {
                throw new ConfigException("appium.device_name is required");
            }
            if (commandTimeoutSeconds <= 0) {
                throw new ConfigException("appium.command_timeout_s must be > 0");
            }
            URL url;
            try {
                url = new URI(serverUrl).toURL();
            } catch (URISyntaxException | MalformedURLException | IllegalArgumentException | NullPointerException e) {
                throw new ConfigException("appium.server_url is not a valid URL: " + serverUrl, e);
            }
            return new AppiumConfig(this, url);
        }
    }
}
