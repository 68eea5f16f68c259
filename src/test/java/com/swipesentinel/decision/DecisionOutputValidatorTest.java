package com.swipesentinel.decision;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.action.ActionCatalogEntry;
import com.swipesentinel.model.Bounds;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TargetKind;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;

import static com.swipesentinel.decision.DecisionOutputValidator.*;
import static org.assertj.core.api.Assertions.assertThat;

public class DecisionOutputValidatorTest {

    private final DecisionOutputValidator validator = new DecisionOutputValidator();
    private final PolicyProfile.PersonaSpec persona = PolicyProfile.defaults().getPersonaSpec();

    private final PacketContext card = PacketContext.builder()
        .screenType(ScreenType.DISCOVER_CARD)
        .qualityScore(94)
        .qualityFeatures(new QualityFeatures("Ana", "Sunday farmers market and salsa nights",
            List.of("Like Ana's photo"), List.of()))
        .availableActions(List.of("like", "pass", "send_message", "back", "wait"))
        .targets(List.of(new InteractionTarget("like_button:5", TargetKind.LIKE_BUTTON, "Like Ana's photo",
            new Bounds(900, 1140, 1040, 1280), 970, 1210, List.of())))
        .build();

    // ════════════════════════════════════════════════════════════════════════
    // Accepted decisions
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void personalisedMessage_passesAndReportsSignals() {
        DecisionCheck check = validator.validate("send_message", "high score",
            "Hey Ana, which salsa spot is your favourite?", "like_button:5", card, persona);

        assertThat(check.ok()).isTrue();
        assertThat(check.mentionsProfileName()).isTrue();
        assertThat(check.mentionsPromptKeyword()).isTrue();
    }

    @Test
    public void plainLike_passes() {
        DecisionCheck check = validator.validate("like", "score>=70", null, null, card, persona);

        assertThat(check.issues()).isEmpty();
        assertThat(check.mentionsProfileName()).isFalse();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Rejected decisions
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void unavailableAction_isRejected() {
        assertThat(validator.validate("open_thread", "r", null, null, card, persona).issues())
            .containsExactly(ACTION_NOT_AVAILABLE);
        assertThat(validator.validate(null, "r", null, null, card, persona).issues())
            .contains(ACTION_NOT_AVAILABLE);
    }

    @Test
    public void messageRequirement_followsCatalogEntry() {
        PacketContext anything = PacketContext.builder()
            .screenType(ScreenType.CHAT_THREAD)
            .qualityFeatures(QualityFeatures.empty())
            .availableActions(ActionCatalog.actionIds())
            .build();

        assertThat(ActionCatalog.entries()).anyMatch(ActionCatalogEntry::isRequiresMessage);
        for (ActionCatalogEntry entry : ActionCatalog.entries()) {
            if (entry.isRequiresMessage()) {
                assertThat(validator.validate(entry.getActionId(), "r", null, null, anything, persona).issues())
                    .as(entry.getActionId()).containsExactly(MESSAGE_REQUIRED);
            } else {
                assertThat(validator.validate(entry.getActionId(), "r", "Hi there?", null, anything, persona).issues())
                    .as(entry.getActionId()).containsExactly(MESSAGE_MUST_BE_NULL);
            }
        }
    }

    @Test
    public void blankReason_isRejected() {
        assertThat(validator.validate("like", " ", null, null, card, persona).issues())
            .containsExactly(REASON_MISSING);
    }

    @Test
    public void sendWithoutText_isRejected() {
        assertThat(validator.validate("send_message", "r", "  ", null, card, persona).issues())
            .containsExactly(MESSAGE_REQUIRED);
    }

    @Test
    public void textOnNonSendAction_isRejected() {
        assertThat(validator.validate("like", "r", "Hi?", null, card, persona).issues())
            .containsExactly(MESSAGE_MUST_BE_NULL);
    }

    @Test
    public void unknownTarget_isRejected() {
        assertThat(validator.validate("like", "r", null, "like_button:99", card, persona).issues())
            .containsExactly(TARGET_NOT_FOUND);
    }

    @Test
    public void overlongMessage_isRejected() {
        String text = "Hey Ana " + "a".repeat(200) + "?";

        assertThat(validator.validate("send_message", "r", text, null, card, persona).issues())
            .containsExactly(MESSAGE_TOO_LONG);
    }

    @DataProvider
    public Object[][] unsafeMessages() {
        return new Object[][] {
            { "Hey Ana, what's your weekend plan",            MISSING_QUESTION },
            { "Write me at ana.b@example.com, ok?",           CONTAINS_EMAIL },
            { "Text me on 415-555-0134, ok?",                 CONTAINS_PHONE },
            { "Seen www.salsaclub.example yet?",              CONTAINS_URL },
            { "Got insta?",                                   OFF_APP_HANDLE },
            { "Want to hook up tonight?",                     SEXUAL_CONTENT },
        };
    }

    @Test(dataProvider = "unsafeMessages")
    public void unsafeMessage_isFlagged(String text, String issue) {
        assertThat(validator.validate("send_message", "r", text, null, card, persona).issues()).contains(issue);
    }

    @Test
    public void sexualTerms_needMatchingBoundary() {
        PolicyProfile.PersonaSpec d = persona;
        PolicyProfile.PersonaSpec permissive = new PolicyProfile.PersonaSpec(d.archetype(), d.intent(),
            d.toneTraits(), List.of("Be kind"), d.preferredSignals(), d.avoidSignals(), d.openerStrategy(),
            d.examples(), d.maxMessageChars(), d.requireQuestion());

        assertThat(validator.validate("send_message", "r", "Want to hook up tonight?", null, card, permissive).issues())
            .doesNotContain(SEXUAL_CONTENT);
    }

    @Test
    public void promptKeywords_dropStopWords() {
        assertThat(DecisionOutputValidator.promptKeywords("The market and salsa with you"))
            .containsExactly("market", "salsa");
        assertThat(DecisionOutputValidator.promptKeywords(null)).isEmpty();
    }
}
