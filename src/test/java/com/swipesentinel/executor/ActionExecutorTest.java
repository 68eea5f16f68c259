package com.swipesentinel.executor;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.capture.Primitive;
import com.swipesentinel.capture.PrimitiveKind;
import com.swipesentinel.extract.TargetExtractor;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.support.FakeCaptureAdapter;
import com.swipesentinel.support.ScreenFixtures;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Handler discovery and primitive sequences, against a scripted device.
 */
public class ActionExecutorTest {

    private ActionHandlerRegistry registry;
    private final TargetExtractor extractor = new TargetExtractor();

    @BeforeClass
    public void setUp() {
        registry = new ActionHandlerRegistry();
    }

    private ActionExecutor executor(FakeCaptureAdapter adapter, boolean dryRun) {
        return new ActionExecutor(registry, adapter, extractor, 0, dryRun);
    }

    private List<InteractionTarget> targetsOf(String fixture) {
        return extractor.extract(ScreenFixtures.observation(fixture));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Registry
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void registry_hasHandlerForEveryCatalogAction() {
        assertThat(registry.size()).isEqualTo(ActionCatalog.actionIds().size());
        ActionCatalog.actionIds().forEach(id -> assertThat(registry.hasHandler(id)).as(id).isTrue());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Dry run and target checks
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void dryRun_skipsWithoutPrimitives() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        ActionResult result = executor(adapter, true).execute(
            ActionPlan.deterministic(ActionCatalog.LIKE, "score>=70", null),
            ScreenType.DISCOVER_CARD, targetsOf(ScreenFixtures.DISCOVER_CARD));

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getMessage()).startsWith("DryRun: ");
        assertThat(adapter.getExecuted()).isEmpty();
    }

    @Test
    public void unknownTargetId_failsWithoutSubstitution() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.llm(ActionCatalog.LIKE, "like_button:99", "nice prompt", null),
            ScreenType.DISCOVER_CARD, targetsOf(ScreenFixtures.DISCOVER_CARD));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("target_not_found: like_button:99");
        assertThat(adapter.getExecuted()).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Single-tap actions
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void like_tapsFirstLikeButtonCenter() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.LIKE, "score>=70", null),
            ScreenType.DISCOVER_CARD, targetsOf(ScreenFixtures.DISCOVER_CARD));

        assertThat(result.isExecuted()).isTrue();
        assertThat(result.getPrimitivesIssued()).isEqualTo(1);
        assertThat(adapter.getExecuted()).containsExactly(Primitive.tap(970, 1210));
    }

    @Test
    public void like_plannedTargetIsHonoured() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        executor(adapter, false).execute(
            ActionPlan.llm(ActionCatalog.LIKE, "like_button:9", "prompt", null),
            ScreenType.DISCOVER_CARD, targetsOf(ScreenFixtures.DISCOVER_CARD));

        assertThat(adapter.getExecuted()).containsExactly(Primitive.tap(970, 1490));
    }

    @Test
    public void pass_tapsSkipButton() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD);

        executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.PASS, "score<70", null),
            ScreenType.DISCOVER_CARD, targetsOf(ScreenFixtures.DISCOVER_CARD));

        assertThat(adapter.getExecuted()).containsExactly(Primitive.tap(120, 2040));
    }

    @Test
    public void back_issuesBackKey() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.CHAT_THREAD);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.BACK, "leave thread", null),
            ScreenType.CHAT_THREAD, targetsOf(ScreenFixtures.CHAT_THREAD));

        assertThat(result.isExecuted()).isTrue();
        assertThat(adapter.getExecuted()).extracting(Primitive::kind).containsExactly(PrimitiveKind.BACK);
    }

    @Test
    public void wait_issuesNothing() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.MATCHES_EMPTY);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.WAIT, "nothing to do", null),
            ScreenType.MATCHES_LIST, List.of());

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getPrimitivesIssued()).isZero();
        assertThat(adapter.getExecuted()).isEmpty();
    }

    @Test
    public void openThread_withoutRows_reportsMissingTarget() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.MATCHES_EMPTY);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.OPEN_THREAD, "open first", null),
            ScreenType.MATCHES_LIST, targetsOf(ScreenFixtures.MATCHES_EMPTY));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).startsWith("target_missing: no thread_row");
    }

    // ════════════════════════════════════════════════════════════════════════
    // send_message
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void sendMessage_onDiscover_likesThenComments() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD)
            .then(ScreenFixtures.DISCOVER_COMPOSER);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.SEND_MESSAGE, "opener", "Farmers market regular too?"),
            ScreenType.DISCOVER_CARD, targetsOf(ScreenFixtures.DISCOVER_CARD));

        assertThat(result.isExecuted()).isTrue();
        assertThat(result.getPrimitivesIssued()).isEqualTo(4);
        assertThat(adapter.getExecuted()).containsExactly(
            Primitive.tap(970, 1210),
            Primitive.tap(540, 1330),
            Primitive.type("Farmers market regular too?"),
            Primitive.tap(540, 1520));
        assertThat(adapter.getObserveCalls()).isEqualTo(1);
    }

    @Test
    public void sendMessage_inThread_typesAndSends() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.CHAT_THREAD);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.SEND_MESSAGE, "reply", "Sounds great, Saturday?"),
            ScreenType.CHAT_THREAD, targetsOf(ScreenFixtures.CHAT_THREAD));

        assertThat(result.isExecuted()).isTrue();
        assertThat(adapter.getExecuted()).containsExactly(
            Primitive.tap(460, 2190),
            Primitive.type("Sounds great, Saturday?"),
            Primitive.tap(970, 2190));
    }

    @Test
    public void sendMessage_withoutText_fails() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.CHAT_THREAD);

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.SEND_MESSAGE, "reply", null),
            ScreenType.CHAT_THREAD, targetsOf(ScreenFixtures.CHAT_THREAD));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo("message_text_missing");
        assertThat(adapter.getExecuted()).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Transport
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void primitiveError_isTransportFailure() {
        FakeCaptureAdapter adapter = FakeCaptureAdapter.showing(ScreenFixtures.DISCOVER_CARD).failPrimitives();

        ActionResult result = executor(adapter, false).execute(
            ActionPlan.deterministic(ActionCatalog.LIKE, "score>=70", null),
            ScreenType.DISCOVER_CARD, targetsOf(ScreenFixtures.DISCOVER_CARD));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.isTransportFailure()).isTrue();
        assertThat(result.getMessage()).contains("device offline");
    }
}
