package com.swipesentinel.decision;

import com.swipesentinel.core.ConfigException;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DirectiveParserTest {

    private final DirectiveParser parser = new DirectiveParser();

    @Test
    public void blankQuery_isNoDirective() {
        assertThat(parser.parse(null)).isEqualTo(Directive.none());
        assertThat(parser.parse("   ")).isEqualTo(Directive.none());
    }

    @Test
    public void limitsAndRunMode_areParsed() {
        Directive d = parser.parse("Swipe for 12 actions, max likes 5, max passes 9, score above 80, dry run");

        assertThat(d.goal()).isEqualTo(Goal.SWIPE);
        assertThat(d.maxActions()).isEqualTo(12);
        assertThat(d.maxLikes()).isEqualTo(5);
        assertThat(d.maxPasses()).isEqualTo(9);
        assertThat(d.minQualityScoreLike()).isEqualTo(80);
        assertThat(d.dryRun()).isTrue();
        assertThat(d.messageEnabled()).isNull();
        assertThat(d.hasForcedAction()).isFalse();
    }

    @Test
    public void explore_isRecognised() {
        assertThat(parser.parse("explore the app").goal()).isEqualTo(Goal.EXPLORE);
        assertThat(parser.parse("freely navigate for a bit").goal()).isEqualTo(Goal.EXPLORE);
    }

    @Test
    public void message_enablesMessagingAndSetsGoal() {
        Directive d = parser.parse("Message my matches, max messages 2, live run");

        assertThat(d.goal()).isEqualTo(Goal.MESSAGE);
        assertThat(d.messageEnabled()).isTrue();
        assertThat(d.maxMessages()).isEqualTo(2);
        assertThat(d.dryRun()).isFalse();
    }

    @Test
    public void dontMessage_disablesMessagingWithoutMessageGoal() {
        Directive d = parser.parse("Explore, but don't message anyone");

        assertThat(d.goal()).isEqualTo(Goal.EXPLORE);
        assertThat(d.messageEnabled()).isFalse();
    }

    @Test
    public void swipe_winsOverEarlierGoals() {
        assertThat(parser.parse("explore then swipe").goal()).isEqualTo(Goal.SWIPE);
    }

    @Test
    public void forcePhrase_firstMatchInTableOrderWins() {
        Directive d = parser.parse("like now, then go to matches");

        assertThat(d.forceActionOnce()).isEqualTo("goto_matches");
    }

    @Test
    public void forcePhrase_sendMessage() {
        Directive d = parser.parse("force send message to Ana");

        assertThat(d.forceActionOnce()).isEqualTo("send_message");
        assertThat(d.goal()).isEqualTo(Goal.MESSAGE);
    }

    @Test
    public void runtime_minutesAndSeconds() {
        assertThat(parser.parse("swipe for 3 minutes").maxRuntimeSeconds()).isEqualTo(180);
        assertThat(parser.parse("swipe for 45 seconds").maxRuntimeSeconds()).isEqualTo(45);
        assertThat(parser.parse("swipe for 1 minute or for 20 seconds").maxRuntimeSeconds()).isEqualTo(20);
    }

    @Test
    public void onlyClause_buildsAllowedSubset() {
        Directive d = parser.parse("only like, pass and wait");

        assertThat(d.allowedActions()).containsExactly("like", "pass", "wait");
    }

    @Test
    public void onlyClause_stopsAtStopWord() {
        Directive d = parser.parse("only pass for 10 actions");

        assertThat(d.allowedActions()).containsExactly("pass");
        assertThat(d.maxActions()).isEqualTo(10);
    }

    @Test
    public void onlyClause_rejectsUnknownAction() {
        assertThatThrownBy(() -> parser.parse("only like, superlike"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("superlike");
    }

    @Test
    public void oversizedCount_isConfigError() {
        assertThatThrownBy(() -> parser.parse("swipe for 99999999999 actions"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("'99999999999'")
            .hasMessageContaining("out of range");
    }

    @Test
    public void runtimeOverflowingSeconds_isConfigError() {
        assertThatThrownBy(() -> parser.parse("swipe for 40000000 minutes"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("40000000 minutes");
    }

    @Test
    public void queryText_isKept() {
        assertThat(parser.parse("  Swipe carefully ").query()).isEqualTo("Swipe carefully");
    }
}
