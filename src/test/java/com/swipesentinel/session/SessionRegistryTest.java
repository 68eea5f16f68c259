package com.swipesentinel.session;

import com.swipesentinel.decision.DecisionEngine;
import com.swipesentinel.decision.DecisionEngineConfig;
import com.swipesentinel.decision.Directive;
import com.swipesentinel.decision.PolicyProfile;
import com.swipesentinel.model.TerminationReason;
import com.swipesentinel.support.FakeCaptureAdapter;
import com.swipesentinel.support.ScreenFixtures;
import com.swipesentinel.validation.ValidationConfig;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SessionRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final PolicyProfile  profile = PolicyProfile.defaults();
    private final DecisionEngine engine  = DecisionEngine.create(DecisionEngineConfig.builder().build(), profile);

    private SessionRegistry registry;
    private Path            artifacts;

    @BeforeMethod
    public void setUp() throws IOException {
        registry  = new SessionRegistry();
        artifacts = Files.createTempDirectory("swipesentinel-registry");
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() {
        registry.shutdownAll();
    }

    private LiveSession session(String name, int maxActions, CountDownLatch firstSleep) {
        SessionConfig config = SessionConfig.builder()
            .sessionName(name)
            .artifactsDir(artifacts)
            .maxActions(maxActions)
            .loopSleepMs(5)
            .build();
        ValidationConfig validation = ValidationConfig.builder().settleMs(0).build();
        return new LiveSession(config, validation, engine, profile, Directive.none(),
            FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD),
            ms -> {
                firstSleep.countDown();
                Thread.sleep(ms);
            },
            Clock.systemUTC());
    }

    @Test
    public void startAndAwait_returnsSessionResult() {
        registry.create(session("alpha", 2, new CountDownLatch(1)));
        registry.start("alpha");

        SessionResult result = registry.await("alpha", TIMEOUT);

        assertThat(result.sessionName()).isEqualTo("alpha");
        assertThat(result.terminationReason()).isEqualTo(TerminationReason.ABORTED_BUDGET);
        assertThat(registry.isRunning("alpha")).isFalse();
    }

    @Test
    public void stop_endsRunningSessionAsCompleted() throws InterruptedException {
        CountDownLatch firstSleep = new CountDownLatch(1);
        registry.create(session("beta", 100_000, firstSleep));
        registry.start("beta");
        assertThat(firstSleep.await(10, TimeUnit.SECONDS)).isTrue();

        registry.stop("beta");
        SessionResult result = registry.await("beta", TIMEOUT);

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.detail()).isEqualTo("stop_requested");
    }

    @Test
    public void sessionsRunIndependently() {
        registry.create(session("one", 1, new CountDownLatch(1)));
        registry.create(session("two", 3, new CountDownLatch(1)));
        registry.start("one");
        registry.start("two");

        assertThat(registry.await("one", TIMEOUT).iterations()).isEqualTo(1);
        assertThat(registry.await("two", TIMEOUT).iterations()).isEqualTo(3);
        assertThat(registry.names()).containsExactlyInAnyOrder("one", "two");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Misuse
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void duplicateName_isRejected() {
        registry.create(session("dup", 1, new CountDownLatch(1)));

        assertThatThrownBy(() -> registry.create(session("dup", 1, new CountDownLatch(1))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already exists");
    }

    @Test
    public void unknownSession_isRejected() {
        assertThatThrownBy(() -> registry.start("ghost"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Unknown session 'ghost'");
    }

    @Test
    public void awaitBeforeStart_isRejected() {
        registry.create(session("idle", 1, new CountDownLatch(1)));

        assertThatThrownBy(() -> registry.await("idle", TIMEOUT))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("was not started");
    }

    @Test
    public void startTwice_isRejected() {
        registry.create(session("twice", 1, new CountDownLatch(1)));
        registry.start("twice");

        assertThatThrownBy(() -> registry.start("twice"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    @Test
    public void remove_forgetsSession() {
        registry.create(session("gone", 1, new CountDownLatch(1)));

        registry.remove("gone");

        assertThat(registry.get("gone")).isEmpty();
        assertThat(registry.names()).isEmpty();
    }
}
