package com.swipesentinel.action;

import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TargetKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.swipesentinel.model.ScreenType.CHAT_THREAD;
import static com.swipesentinel.model.ScreenType.DISCOVER_CARD;
import static com.swipesentinel.model.ScreenType.MATCHES_EMPTY;
import static com.swipesentinel.model.ScreenType.MATCHES_LIST;
import static com.swipesentinel.model.ScreenType.OVERLAY_GENERIC;
import static com.swipesentinel.model.ScreenType.OVERLAY_PAYWALL;
import static com.swipesentinel.model.ScreenType.TAB_SHELL;
import static com.swipesentinel.model.ScreenType.UNKNOWN;

/**
 * The fixed, versioned set of actions the agent may take.
 *
 * Catalog order is significant: the action space builder emits available
 * actions in this order, and both decision variants see them that way.
 *
 * <pre>
 *   goto_discover, goto_matches, goto_likes_you, goto_standouts, goto_profile_hub,
 *   open_thread, like, pass, send_message, back, dismiss_overlay, wait
 * </pre>
 */
public final class ActionCatalog {

    public static final String VERSION = "action_catalog.v1";

    public static final String GOTO_DISCOVER    = "goto_discover";
    public static final String GOTO_MATCHES     = "goto_matches";
    public static final String GOTO_LIKES_YOU   = "goto_likes_you";
    public static final String GOTO_STANDOUTS   = "goto_standouts";
    public static final String GOTO_PROFILE_HUB = "goto_profile_hub";
    public static final String OPEN_THREAD      = "open_thread";
    public static final String LIKE             = "like";
    public static final String PASS             = "pass";
    public static final String SEND_MESSAGE     = "send_message";
    public static final String BACK             = "back";
    public static final String DISMISS_OVERLAY  = "dismiss_overlay";
    public static final String WAIT             = "wait";

    private static final ScreenType[] TAB_SCREENS =
        { DISCOVER_CARD, MATCHES_LIST, MATCHES_EMPTY, CHAT_THREAD, TAB_SHELL, UNKNOWN };

    private static final Map<String, ActionCatalogEntry> ENTRIES = new LinkedHashMap<>();

    static {
        register(ActionCatalogEntry.builder(GOTO_DISCOVER)
            .on(TargetKind.TAB_DISCOVER, TAB_SCREENS)
            .human("Tap the Discover tab")
            .description("Navigate to the discover feed"));
        register(ActionCatalogEntry.builder(GOTO_MATCHES)
            .on(TargetKind.TAB_MATCHES, TAB_SCREENS)
            .human("Tap the Matches tab")
            .description("Navigate to the matches list"));
        register(ActionCatalogEntry.builder(GOTO_LIKES_YOU)
            .on(TargetKind.TAB_LIKES_YOU, TAB_SCREENS)
            .human("Tap the Likes You tab")
            .description("Navigate to incoming likes"));
        register(ActionCatalogEntry.builder(GOTO_STANDOUTS)
            .on(TargetKind.TAB_STANDOUTS, TAB_SCREENS)
            .human("Tap the Standouts tab")
            .description("Navigate to standouts"));
        register(ActionCatalogEntry.builder(GOTO_PROFILE_HUB)
            .on(TargetKind.TAB_PROFILE_HUB, TAB_SCREENS)
            .human("Tap the Profile Hub tab")
            .description("Navigate to the own-profile hub"));
        register(ActionCatalogEntry.builder(OPEN_THREAD)
            .on(TargetKind.THREAD_ROW, MATCHES_LIST, TAB_SHELL)
            .human("Tap a conversation row")
            .description("Open a chat thread from the matches list"));
        register(ActionCatalogEntry.builder(LIKE)
            .on(TargetKind.LIKE_BUTTON, DISCOVER_CARD)
            .human("Tap a like affordance")
            .description("Like the profile on the current discover card"));
        register(ActionCatalogEntry.builder(PASS)
            .on(TargetKind.PASS_BUTTON, DISCOVER_CARD)
            .human("Tap Skip")
            .description("Pass on the profile on the current discover card"));
        register(ActionCatalogEntry.builder(SEND_MESSAGE)
            .on(TargetKind.LIKE_BUTTON, DISCOVER_CARD)
            .on(TargetKind.MESSAGE_INPUT, CHAT_THREAD)
            .requiresMessage()
            .human("Write and send a message")
            .description("Send a like with a comment on discover, or a chat message in a thread"));
        register(ActionCatalogEntry.builder(BACK)
            .on(ScreenType.values())
            .human("Press the Android back key")
            .description("Return to the previous screen"));
        register(ActionCatalogEntry.builder(DISMISS_OVERLAY)
            .on(TargetKind.CLOSE_OVERLAY, OVERLAY_PAYWALL, OVERLAY_GENERIC)
            .human("Tap the overlay's close control")
            .description("Dismiss a paywall or sheet"));
        register(ActionCatalogEntry.builder(WAIT)
            .on(ScreenType.values())
            .human("Do nothing this cycle")
            .description("Wait for the screen to settle"));
    }

    private ActionCatalog() {}

    private static void register(ActionCatalogEntry.Builder builder) {
        ActionCatalogEntry entry = builder.build();
        if (ENTRIES.put(entry.getActionId(), entry) != null) {
            throw new IllegalStateException("Duplicate catalog action: " + entry.getActionId());
        }
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    /** All entries in catalog order. */
    public static List<ActionCatalogEntry> entries() {
        return List.copyOf(ENTRIES.values());
    }

    /** All action ids in catalog order. */
    public static List<String> actionIds() {
        return List.copyOf(ENTRIES.keySet());
    }

    public static Optional<ActionCatalogEntry> find(String actionId) {
        return Optional.ofNullable(ENTRIES.get(actionId));
    }

    public static boolean contains(String actionId) {
        return ENTRIES.containsKey(actionId);
    }

    public static ActionCatalogEntry get(String actionId) {
        ActionCatalogEntry entry = ENTRIES.get(actionId);
        if (entry == null) throw new IllegalArgumentException("Unknown action id: " + actionId);
        return entry;
    }

    /** Position of the action in catalog order, or -1 if unknown. */
    public static int indexOf(String actionId) {
        return actionIds().indexOf(actionId);
    }

    /** Comma-separated ids, for config error messages. */
    public static String describeIds() {
        return String.join(", ", ENTRIES.keySet());
    }
}
