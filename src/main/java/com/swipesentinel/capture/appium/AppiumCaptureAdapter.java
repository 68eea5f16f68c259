package com.swipesentinel.capture.appium;

import com.swipesentinel.capture.CaptureAdapter;
import com.swipesentinel.capture.Primitive;
import com.swipesentinel.capture.PrimitiveResult;
import com.swipesentinel.capture.TransportException;
import com.swipesentinel.capture.UiHierarchyParser;
import com.swipesentinel.model.Observation;
import io.appium.java_client.android.AndroidDriver;
import io.appium.java_client.android.nativekey.AndroidKey;
import io.appium.java_client.android.nativekey.KeyEvent;
import io.appium.java_client.android.options.UiAutomator2Options;
import io.appium.java_client.appmanagement.ApplicationState;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.PointerInput;
import org.openqa.selenium.interactions.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * {@link CaptureAdapter} over an Appium UiAutomator2 session.
 *
 * Observation = page source (parsed by {@link UiHierarchyParser}) plus an optional
 * PNG screenshot. Taps and swipes are W3C pointer sequences; text goes to the
 * focused element; BACK is the Android key event. Any WebDriver failure during
 * {@link #execute} becomes an error result, never an exception.
 */
public class AppiumCaptureAdapter implements CaptureAdapter, Closeable {

    private static final Logger log = LoggerFactory.getLogger(AppiumCaptureAdapter.class);

    private static final Duration TAP_HOLD = Duration.ofMillis(80);

    private final AndroidDriver     driver;
    private final AppiumConfig      config;
    private final UiHierarchyParser parser = new UiHierarchyParser();
    private final PointerInput      finger = new PointerInput(PointerInput.Kind.TOUCH, "finger");

    AppiumCaptureAdapter(AndroidDriver driver, AppiumConfig config) {
        this.driver = driver;
        this.config = config;
    }

    /**
     * Opens a UiAutomator2 session for {@code appPackage}.
     *
     * @throws TransportException when the Appium server refuses or cannot be reached
     */
    public static AppiumCaptureAdapter connect(AppiumConfig config, String appPackage) throws TransportException {
        UiAutomator2Options options = new UiAutomator2Options()
            .setDeviceName(config.getDeviceName())
            .setAppPackage(appPackage)
            .setNoReset(config.isNoReset())
            .setNewCommandTimeout(Duration.ofSeconds(config.getCommandTimeoutSeconds()));
        if (config.getUdid() != null)        options.setUdid(config.getUdid());
        if (config.getAppActivity() != null) options.setAppActivity(config.getAppActivity());

        try {
            AndroidDriver driver = new AndroidDriver(config.getServerUrl(), options);
            log.info("AppiumCaptureAdapter: Session {} opened ({})", driver.getSessionId(), config);
            return new AppiumCaptureAdapter(driver, config);
        } catch (WebDriverException e) {
            throw new TransportException("Could not open Appium session at " + config.getServerUrl()
                + ": " + firstLine(e.getMessage()), e);
        }
    }

    // ── CaptureAdapter ────────────────────────────────────────────────────────

    @Override
    public Observation observe() throws TransportException {
        String source;
        try {
            source = driver.getPageSource();
        } catch (WebDriverException e) {
            throw new TransportException("getPageSource failed: " + firstLine(e.getMessage()), e);
        }

        byte[] png = null;
        if (config.isCaptureScreenshot()) {
            try {
                png = driver.getScreenshotAs(OutputType.BYTES);
            } catch (WebDriverException e) {
                // The tree is enough to decide on; the packet just carries no screenshot.
                log.warn("AppiumCaptureAdapter: Screenshot failed: {}", firstLine(e.getMessage()));
            }
        }

        try {
            return parser.parse(source, png, Instant.now());
        } catch (IllegalArgumentException e) {
            throw new TransportException("Unusable page source: " + e.getMessage(), e);
        }
    }

    @Override
    public PrimitiveResult execute(Primitive primitive) {
        try {
            switch (primitive.kind()) {
                case TAP   -> driver.perform(List.of(tap(primitive.x(), primitive.y())));
                case SWIPE -> driver.perform(List.of(swipe(primitive)));
                case TYPE  -> typeIntoFocused(primitive.text());
                case KEY   -> driver.executeScript("mobile: pressKey", Map.of("keycode", primitive.keyCode()));
                case BACK  -> driver.pressKey(new KeyEvent(AndroidKey.BACK));
            }
            log.debug("AppiumCaptureAdapter: {}", primitive);
            return PrimitiveResult.success();
        } catch (WebDriverException e) {
            log.warn("AppiumCaptureAdapter: {} failed: {}", primitive, firstLine(e.getMessage()));
            return PrimitiveResult.error(primitive.kind().name().toLowerCase() + ": " + firstLine(e.getMessage()));
        }
    }

    @Override
    public boolean ensureForeground(String packageName) throws TransportException {
        try {
            ApplicationState state = driver.queryAppState(packageName);
            if (state == ApplicationState.RUNNING_IN_FOREGROUND) return true;

            log.warn("AppiumCaptureAdapter: {} is {}, activating", packageName, state);
            driver.activateApp(packageName);
            return driver.queryAppState(packageName) == ApplicationState.RUNNING_IN_FOREGROUND;
        } catch (WebDriverException e) {
            throw new TransportException("App state query failed for " + packageName + ": "
                + firstLine(e.getMessage()), e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
            log.info("AppiumCaptureAdapter: Session closed");
        } catch (WebDriverException e) {
            log.warn("AppiumCaptureAdapter: Session close failed: {}", firstLine(e.getMessage()));
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private Sequence tap(int x, int y) {
        return new Sequence(finger, 1)
            .addAction(finger.createPointerMove(Duration.ZERO, PointerInput.Origin.viewport(), x, y))
            .addAction(finger.createPointerDown(PointerInput.MouseButton.LEFT.asArg()))
            .addAction(finger.createPointerMove(TAP_HOLD, PointerInput.Origin.viewport(), x, y))
            .addAction(finger.createPointerUp(PointerInput.MouseButton.LEFT.asArg()));
    }

    private Sequence swipe(Primitive p) {
        return new Sequence(finger, 1)
            .addAction(finger.createPointerMove(Duration.ZERO, PointerInput.Origin.viewport(), p.x(), p.y()))
            .addAction(finger.createPointerDown(PointerInput.MouseButton.LEFT.asArg()))
            .addAction(finger.createPointerMove(Duration.ofMillis(Math.max(1, p.durationMs())),
                PointerInput.Origin.viewport(), p.toX(), p.toY()))
            .addAction(finger.createPointerUp(PointerInput.MouseButton.LEFT.asArg()));
    }

    private void typeIntoFocused(String text) {
        WebElement focused = driver.switchTo().activeElement();
        focused.sendKeys(text != null ? text : "");
    }

    private static String firstLine(String message) {
        if (message == null) return "unknown error";
        int nl = message.indexOf('\n');
        return nl > 0 ? message.substring(0, nl) : message;
    }
}
