package com.swipesentinel.action;

import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TargetKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One action in the fixed catalog: where it is valid, which target kind it needs
 * on each of those screens, and whether it carries message text.
 *
 * Immutable. Built only by {@link ActionCatalog}.
 */
public final class ActionCatalogEntry {

    private final String                      actionId;
    private final boolean                     requiresMessage;
    private final Set<ScreenType>             validScreens;
    private final Map<ScreenType, TargetKind> requiredTargets;
    private final String                      humanAction;
    private final String                      description;

    private ActionCatalogEntry(String actionId, boolean requiresMessage, Set<ScreenType> validScreens,
                               Map<ScreenType, TargetKind> requiredTargets,
                               String humanAction, String description) {
        this.actionId        = actionId;
        this.requiresMessage = requiresMessage;
        this.validScreens    = Collections.unmodifiableSet(validScreens);
        this.requiredTargets = Collections.unmodifiableMap(requiredTargets);
        this.humanAction     = humanAction;
        this.description     = description;
    }

    public String  getActionId()       { return actionId; }
    public boolean isRequiresMessage() { return requiresMessage; }
    public boolean isRequiresTarget()  { return !requiredTargets.isEmpty(); }
    public String  getHumanAction()    { return humanAction; }
    public String  getDescription()    { return description; }
    public Set<ScreenType> getValidScreens() { return validScreens; }

    public boolean isValidOn(ScreenType screenType) {
        return validScreens.contains(screenType);
    }

    /** The target kind this action taps first on the given screen, if it needs one. */
    public Optional<TargetKind> requiredTargetOn(ScreenType screenType) {
        return Optional.ofNullable(requiredTargets.get(screenType));
    }

    @Override
    public String toString() {
        return "ActionCatalogEntry{" + actionId + ", screens=" + validScreens + "}";
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    static Builder builder(String actionId) { return new Builder(actionId); }

    static class Builder {
        private final String actionId;
        private boolean requiresMessage;
        private final Set<ScreenType> validScreens = EnumSet.noneOf(ScreenType.class);
        private final Map<ScreenType, TargetKind> requiredTargets = new EnumMap<>(ScreenType.class);
        private String humanAction = "";
        private String description = "";

        private Builder(String actionId) { this.actionId = actionId; }

        Builder requiresMessage()                          { this.requiresMessage = true; return this; }
        Builder human(String h)                            { this.humanAction = h; return this; }
        Builder description(String d)                      { this.description = d; return this; }

        Builder on(ScreenType... screens) {
            for (ScreenType s : screens) validScreens.add(s);
            return this;
        }

        Builder on(TargetKind target, ScreenType... screens) {
            for (ScreenType s : screens) {
                validScreens.add(s);
                requiredTargets.put(s, target);
            }
            return this;
        }

        ActionCatalogEntry build() {
            return new ActionCatalogEntry(actionId, requiresMessage,
                EnumSet.copyOf(validScreens),
                new EnumMap<>(requiredTargets), humanAction, description);
        }
    }
}
