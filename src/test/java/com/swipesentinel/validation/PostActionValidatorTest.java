package com.swipesentinel.validation;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.classifier.ScreenClassifier;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.core.Sleeper;
import com.swipesentinel.extract.ContentFingerprint;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.ValidationOutcome;
import com.swipesentinel.model.ValidationStatus;
import com.swipesentinel.support.FakeCaptureAdapter;
import com.swipesentinel.support.ScreenFixtures;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PostActionValidatorTest {

    private static final String CARD_FINGERPRINT =
        ContentFingerprint.of(ScreenFixtures.observation(ScreenFixtures.DISCOVER_CARD));

    private final ScreenClassifier classifier = new ScreenClassifier();
    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    private PostActionValidator validator(FakeCaptureAdapter adapter, ValidationConfig config) {
        return new PostActionValidator(config, classifier, adapter, recordingSleeper);
    }

    private static ValidationConfig config(int maxFailures, ChangeDetection detection) {
        return ValidationConfig.builder()
            .settleMs(250)
            .maxConsecutiveFailures(maxFailures)
            .changeDetection(detection)
            .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Checks that re-observe
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void nextCard_passesOnContentChange() {
        FakeCaptureAdapter adapter = new FakeCaptureAdapter(
            ScreenFixtures.observation(ScreenFixtures.DISCOVER_CARD_NEXT));
        PostActionValidator validator = validator(adapter, ValidationConfig.defaults());

        ValidationOutcome outcome = validator.validate(ActionCatalog.LIKE,
            ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.PASSED);
        assertThat(outcome.changed()).isTrue();
        assertThat(outcome.postScreenType()).isEqualTo(ScreenType.DISCOVER_CARD);
        assertThat(adapter.getObserveCalls()).isEqualTo(1);
    }

    @Test
    public void nextCard_failsWhenOnlyScreenTypeCounts() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD_NEXT);
        PostActionValidator validator = validator(adapter, config(4, ChangeDetection.SCREEN_TYPE));

        ValidationOutcome outcome = validator.validate(ActionCatalog.PASS,
            ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.FAILED);
        assertThat(validator.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    public void openThread_passesOnScreenTypeChange() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.CHAT_THREAD);
        PostActionValidator validator = validator(adapter, config(4, ChangeDetection.SCREEN_TYPE));

        ValidationOutcome outcome = validator.validate(ActionCatalog.OPEN_THREAD,
            ScreenType.MATCHES_LIST, "irrelevant", 1, false);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.PASSED);
        assertThat(outcome.postScreenType()).isEqualTo(ScreenType.CHAT_THREAD);
    }

    @Test
    public void settleDelay_isSleptBeforeReobserving() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD_NEXT);

        validator(adapter, config(4, ChangeDetection.SCREEN_TYPE_OR_CONTENT))
            .validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);

        assertThat(sleeps).containsExactly(250L);
    }

    @Test
    public void observeFailure_countsAsFailure() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD).failObservations(1);
        PostActionValidator validator = validator(adapter, ValidationConfig.defaults());

        ValidationOutcome outcome = validator.validate(ActionCatalog.LIKE,
            ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.FAILED);
        assertThat(outcome.postScreenType()).isNull();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Streak
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void unchangedScreen_streakAbortsAtThreshold() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);
        PostActionValidator validator = validator(adapter, config(2, ChangeDetection.SCREEN_TYPE_OR_CONTENT));

        validator.validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);
        assertThat(validator.isAborted()).isFalse();

        validator.validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);
        assertThat(validator.isAborted()).isTrue();
        assertThat(validator.getState()).isEqualTo(PostActionValidator.State.ABORTED);

        assertThatThrownBy(() -> validator.validate(ActionCatalog.LIKE,
                ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void pass_resetsStreak() {
        FakeCaptureAdapter stuck = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);
        PostActionValidator validator = validator(stuck, config(3, ChangeDetection.SCREEN_TYPE_OR_CONTENT));

        validator.validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);
        validator.validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);
        assertThat(validator.getConsecutiveFailures()).isEqualTo(2);

        validator.validate(ActionCatalog.LIKE, ScreenType.MATCHES_LIST, "other", 1, false);
        assertThat(validator.getConsecutiveFailures()).isZero();
        assertThat(validator.getState()).isEqualTo(PostActionValidator.State.IDLE);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Checks that do not re-observe
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void wait_isNotRequired() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        ValidationOutcome outcome = validator(adapter, ValidationConfig.defaults())
            .validate(ActionCatalog.WAIT, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 0, false);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.NOT_REQUIRED);
        assertThat(outcome.passed()).isTrue();
        assertThat(adapter.getObserveCalls()).isZero();
    }

    @Test
    public void dryRun_isSkipped() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        ValidationOutcome outcome = validator(adapter, ValidationConfig.defaults())
            .validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 0, true);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.SKIPPED_DRY_RUN);
        assertThat(adapter.getObserveCalls()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    public void noPrimitivesIssued_isNotRequired() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        ValidationOutcome outcome = validator(adapter, ValidationConfig.defaults())
            .validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 0, false);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.NOT_REQUIRED);
    }

    @Test
    public void disabled_isNotRequired() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);
        ValidationConfig off = ValidationConfig.builder().enabled(false).build();

        ValidationOutcome outcome = validator(adapter, off)
            .validate(ActionCatalog.LIKE, ScreenType.DISCOVER_CARD, CARD_FINGERPRINT, 1, false);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.NOT_REQUIRED);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Config
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void config_defaults() {
        ValidationConfig config = ValidationConfig.defaults();

        assertThat(config.getMaxConsecutiveFailures()).isEqualTo(4);
        assertThat(config.getRequireScreenChangeFor())
            .contains("like", "pass", "open_thread", "send_message", "back", "dismiss_overlay")
            .doesNotContain("wait");
    }

    @Test
    public void config_rejectsUnknownAction() {
        assertThatThrownBy(() -> ValidationConfig.builder().requireScreenChangeFor(List.of("super_like")).build())
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("super_like");
    }

    @Test
    public void config_rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> ValidationConfig.builder().maxConsecutiveFailures(0).build())
            .isInstanceOf(ConfigException.class);
    }

    @Test
    public void changeDetection_parsesCaseInsensitively() {
        assertThat(ChangeDetection.parse("screen_type")).isEqualTo(ChangeDetection.SCREEN_TYPE);
        assertThatThrownBy(() -> ChangeDetection.parse("pixels")).isInstanceOf(ConfigException.class);
    }
}
