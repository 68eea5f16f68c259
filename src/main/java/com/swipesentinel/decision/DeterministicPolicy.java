package com.swipesentinel.decision;

import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.RunCounters;
import com.swipesentinel.model.ScreenType;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.swipesentinel.action.ActionCatalog.BACK;
import static com.swipesentinel.action.ActionCatalog.DISMISS_OVERLAY;
import static com.swipesentinel.action.ActionCatalog.GOTO_DISCOVER;
import static com.swipesentinel.action.ActionCatalog.GOTO_LIKES_YOU;
import static com.swipesentinel.action.ActionCatalog.GOTO_MATCHES;
import static com.swipesentinel.action.ActionCatalog.GOTO_PROFILE_HUB;
import static com.swipesentinel.action.ActionCatalog.GOTO_STANDOUTS;
import static com.swipesentinel.action.ActionCatalog.LIKE;
import static com.swipesentinel.action.ActionCatalog.OPEN_THREAD;
import static com.swipesentinel.action.ActionCatalog.PASS;
import static com.swipesentinel.action.ActionCatalog.SEND_MESSAGE;
import static com.swipesentinel.action.ActionCatalog.WAIT;

/**
 * Rule-table decision policy. Pure: the same context and directive always yield
 * the same plan, and the plan's action is always one of the available actions.
 *
 * Rules are evaluated top to bottom; the first that applies wins.
 *
 * <pre>
 *  1. forced action   directive's one-shot action if available, else a route towards it
 *  2. goal=explore    overlay recovery, discover scoring, message opportunity,
 *                     navigation cycle, any other action, wait
 *  3. goal=message    validation-streak recovery, overlay recovery, discover message,
 *                     matches routing, chat send, open thread, navigation fallbacks
 *  4. goal=swipe      per screen, see {@link #swipeGoal}
 * </pre>
 */
public class DeterministicPolicy implements DecisionPolicy {

    public static final String FORCED_REASON = "natural_language_forced_action";

    static final List<String> NAV_CYCLE =
        List.of(GOTO_MATCHES, GOTO_LIKES_YOU, GOTO_STANDOUTS, GOTO_PROFILE_HUB, GOTO_DISCOVER);

    static final int MESSAGE_GOAL_RECOVERY_STREAK = 2;

    private final PolicyProfile profile;

    public DeterministicPolicy(PolicyProfile profile) {
        this.profile = profile;
    }

    @Override
    public DecisionOutcome decide(PacketContext ctx, Directive directive) {
        return DecisionOutcome.ok(plan(ctx, directive));
    }

    /** The rule table itself; never returns {@code null}. */
    public ActionPlan plan(PacketContext ctx, Directive directive) {
        Cycle c = new Cycle(ctx);

        ActionPlan forced = forcedAction(c, directive);
        if (forced != null) return forced;

        return switch (directive.goal()) {
            case EXPLORE -> exploreGoal(c);
            case MESSAGE -> messageGoal(c);
            case SWIPE   -> swipeGoal(c);
        };
    }

    // ── 1. Forced action ──────────────────────────────────────────────────────

    private ActionPlan forcedAction(Cycle c, Directive directive) {
        if (!directive.hasForcedAction() || c.ctx.isForcedActionConsumed()) return null;
        String forced = directive.forceActionOnce();
        if (c.has(forced)) return plan(forced, FORCED_REASON);

        switch (forced) {
            case SEND_MESSAGE -> {
                if (c.screen.isOverlay()) {
                    if (c.has(DISMISS_OVERLAY)) return plan(DISMISS_OVERLAY, "forced_send_message_overlay_recovery_dismiss");
                    if (c.has(BACK))            return plan(BACK, "forced_send_message_overlay_recovery_back");
                }
                if (c.has(GOTO_DISCOVER)) return plan(GOTO_DISCOVER, "forced_send_message_route_discover");
                if (c.has(OPEN_THREAD))   return plan(OPEN_THREAD, "forced_send_message_route_open_thread");
                if (c.has(GOTO_MATCHES))  return plan(GOTO_MATCHES, "forced_send_message_route_matches");
            }
            case OPEN_THREAD -> {
                if (c.has(GOTO_MATCHES)) return plan(GOTO_MATCHES, "forced_open_thread_route_matches");
            }
            case LIKE, PASS -> {
                if (c.has(GOTO_DISCOVER)) return plan(GOTO_DISCOVER, "forced_" + forced + "_route_discover");
            }
            default -> { }
        }
        return null;
    }

    // ── 2. Explore ────────────────────────────────────────────────────────────

    private ActionPlan exploreGoal(Cycle c) {
        if (c.screen.isOverlay()) {
            if (c.has(DISMISS_OVERLAY)) return plan(DISMISS_OVERLAY, "explore_overlay_recovery_dismiss");
            if (c.has(BACK))            return plan(BACK, "explore_overlay_recovery_back");
        }

        if (c.screen == ScreenType.DISCOVER_CARD) {
            boolean eligible = c.hasRequiredFlags() && !c.blocked();
            if (c.messageAllowed() && c.score >= messageThreshold() && eligible) {
                return message("explore_discover_message_opportunity", c);
            }
            if (c.score >= likeThreshold() && eligible && c.has(LIKE) && c.counters.likes() < maxLikes()) {
                return plan(LIKE, "explore_scored_like");
            }
            if (c.passAllowed()) return plan(PASS, "explore_fallback_pass");
        } else if (messagingOn() && c.counters.messages() < maxMessages()) {
            if (c.has(SEND_MESSAGE)) return message("explore_message_opportunity", c);
            if (c.has(OPEN_THREAD))  return plan(OPEN_THREAD, "explore_open_thread");
        }

        // Navigation cycle resumes after the previous action's position
        String lastAction = c.ctx.getLastAction();
        int start = lastAction == null ? 0 : NAV_CYCLE.indexOf(lastAction) + 1;
        for (int offset = 0; offset < NAV_CYCLE.size(); offset++) {
            String candidate = NAV_CYCLE.get((start + offset) % NAV_CYCLE.size());
            if (c.has(candidate) && !candidate.equals(c.ctx.getLastAction())) {
                return plan(candidate, "explore_nav_cycle");
            }
        }
        for (String candidate : c.ctx.getAvailableActions()) {
            if (!WAIT.equals(candidate) && !candidate.equals(c.ctx.getLastAction())) {
                return plan(candidate, "explore_any_available");
            }
        }
        return plan(WAIT, "explore_wait");
    }

    // ── 3. Message ────────────────────────────────────────────────────────────

    private ActionPlan messageGoal(Cycle c) {
        if (c.ctx.getConsecutiveValidationFailures() >= MESSAGE_GOAL_RECOVERY_STREAK) {
            if (c.screen == ScreenType.DISCOVER_CARD && c.has(BACK)) {
                return plan(BACK, "message_goal_validation_recovery_back");
            }
            if (c.has(GOTO_DISCOVER)) return plan(GOTO_DISCOVER, "message_goal_validation_recovery_discover");
        }
        if (c.screen.isOverlay()) {
            String tag = c.screen == ScreenType.OVERLAY_PAYWALL ? "like_paywall" : "overlay";
            if (c.has(DISMISS_OVERLAY)) return plan(DISMISS_OVERLAY, "message_goal_" + tag + "_recovery_dismiss");
            if (c.has(BACK))            return plan(BACK, "message_goal_" + tag + "_recovery_back");
        }
        boolean underCap = c.counters.messages() < maxMessages();
        if (c.screen == ScreenType.DISCOVER_CARD) {
            if (c.has(SEND_MESSAGE) && underCap) return message("message_goal_discover_message_surface", c);
            if (c.has(GOTO_MATCHES))             return plan(GOTO_MATCHES, "message_goal_route_matches");
        }
        if (c.screen == ScreenType.MATCHES_EMPTY) {
            if (c.has(GOTO_DISCOVER)) return plan(GOTO_DISCOVER, "message_goal_no_matches_route_discover");
            return plan(WAIT, "message_goal_no_matches_available");
        }
        if (c.screen == ScreenType.TAB_SHELL && c.has(GOTO_DISCOVER)) {
            return plan(GOTO_DISCOVER, "message_goal_tab_shell_route_discover");
        }
        if (c.has(SEND_MESSAGE) && underCap) return message("message_goal_chat_surface", c);
        if (c.has(OPEN_THREAD))              return plan(OPEN_THREAD, "message_goal_open_thread");
        if (c.has(GOTO_MATCHES))             return plan(GOTO_MATCHES, "message_goal_navigate_matches");
        if (c.has(GOTO_DISCOVER))            return plan(GOTO_DISCOVER, "message_goal_fallback_discover");
        if (c.has(BACK))                     return plan(BACK, "message_goal_back_recovery");
        return plan(WAIT, "message_goal_no_action_available");
    }

    // ── 4. Swipe (default) ────────────────────────────────────────────────────

    /**
     * <pre>
     *   discover_card  like cap reached      -> pass | wait
     *                  blocked keyword       -> pass | wait
     *                  missing required flag -> pass | wait
     *                  message policy        -> send_message
     *                  score >= threshold    -> like
     *                  otherwise             -> pass | back | wait
     *   overlays                             -> dismiss_overlay | back
     *   chat_thread    message policy        -> send_message, else goto_discover | back | wait
     *   anything else                        -> goto_discover | back (unknown only) | wait
     * </pre>
     */
    private ActionPlan swipeGoal(Cycle c) {
        if (c.screen == ScreenType.DISCOVER_CARD) {
            int threshold = likeThreshold();
            if (c.counters.likes() >= maxLikes()) {
                return c.passAllowed() ? plan(PASS, "like_quota_exhausted") : plan(WAIT, "like_quota_exhausted_no_pass");
            }
            if (c.blocked()) {
                return c.passAllowed() ? plan(PASS, "blocked_prompt_keyword") : plan(WAIT, "blocked_prompt_keyword_no_pass");
            }
            if (!c.hasRequiredFlags()) {
                return c.passAllowed() ? plan(PASS, "required_flags_missing") : plan(WAIT, "required_flags_missing_no_pass");
            }
            if (c.messageAllowed() && c.score >= messageThreshold()) {
                return message("discover_profile_message_policy", c);
            }
            if (c.score >= threshold && c.has(LIKE)) return plan(LIKE, "score>=" + threshold);
            if (c.passAllowed())                     return plan(PASS, "score<" + threshold);
            if (c.has(BACK))                         return plan(BACK, "discover_no_pass_recovery_back");
            return plan(WAIT, "no_like_or_pass_available");
        }

        if (c.screen.isOverlay()) {
            String tag = c.screen == ScreenType.OVERLAY_PAYWALL ? "like_paywall" : "overlay";
            if (c.has(DISMISS_OVERLAY)) return plan(DISMISS_OVERLAY, "swipe_goal_" + tag + "_recovery_dismiss");
            if (c.has(BACK))            return plan(BACK, "swipe_goal_" + tag + "_recovery_back");
        }

        if (c.screen == ScreenType.CHAT_THREAD) {
            if (c.messageAllowed() && c.score >= messageThreshold()) {
                return message("chat_surface_profile_message_policy", c);
            }
            if (c.has(GOTO_DISCOVER)) return plan(GOTO_DISCOVER, "chat_surface_return_discover");
            if (c.has(BACK))          return plan(BACK, "chat_surface_back");
            return plan(WAIT, "chat_surface_no_available_navigation");
        }

        if (c.has(GOTO_DISCOVER)) return plan(GOTO_DISCOVER, "default_route_discover");
        if (c.screen == ScreenType.UNKNOWN && c.has(BACK)) return plan(BACK, "unknown_surface_recovery_back");
        return plan(WAIT, "default_wait");
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private int likeThreshold()    { return profile.getSwipePolicy().minQualityScoreLike(); }
    private int maxLikes()         { return profile.getSwipePolicy().maxLikes(); }
    private int maxPasses()        { return profile.getSwipePolicy().maxPasses(); }
    private int messageThreshold() { return profile.getMessagePolicy().minQualityScoreToMessage(); }
    private int maxMessages()      { return profile.getMessagePolicy().maxMessages(); }
    private boolean messagingOn()  { return profile.getMessagePolicy().enabled(); }

    private static ActionPlan plan(String actionId, String reason) {
        return ActionPlan.deterministic(actionId, reason, null);
    }

    private ActionPlan message(String reason, Cycle c) {
        String text = MessageTemplates.compose(profile, c.features.profileNameCandidate());
        return ActionPlan.deterministic(SEND_MESSAGE, reason, text);
    }

    /** Per-call view of the context with the derived predicates the rules share. */
    private final class Cycle {
        final PacketContext   ctx;
        final ScreenType      screen;
        final int             score;
        final RunCounters     counters;
        final QualityFeatures features;
        final Set<String>     available;

        Cycle(PacketContext ctx) {
            this.ctx       = ctx;
            this.screen    = ctx.getScreenType();
            this.score     = ctx.getQualityScore();
            this.counters  = ctx.getCounters();
            this.features  = ctx.getQualityFeatures();
            this.available = new HashSet<>(ctx.getAvailableActions());
        }

        boolean has(String actionId) {
            return available.contains(actionId);
        }

        boolean passAllowed() {
            return has(PASS) && counters.passes() < maxPasses();
        }

        boolean messageAllowed() {
            return messagingOn() && counters.messages() < maxMessages() && has(SEND_MESSAGE);
        }

        boolean blocked() {
            String answer = features.promptAnswer() != null ? features.promptAnswer().toLowerCase(Locale.ROOT) : "";
            return profile.getSwipePolicy().blockPromptKeywords().stream()
                .anyMatch(k -> !k.isEmpty() && answer.contains(k));
        }

        boolean hasRequiredFlags() {
            return features.qualityFlags().containsAll(profile.getSwipePolicy().requireFlagsAll());
        }
    }
}
