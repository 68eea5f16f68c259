package com.swipesentinel.action;

import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TargetKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the actions legal on the current screen.
 *
 * An action is available only if the catalog marks it valid for the screen type
 * and the target kind it needs is present in the observation. Missing targets are
 * never substituted: no like button, no {@code like}. Output follows catalog order.
 */
public class ActionSpaceBuilder {

    private final boolean messagingEnabled;
    private final Set<String> allowedActions;

    /** Builds the full action space, messaging included. */
    public ActionSpaceBuilder() {
        this(true, null);
    }

    /**
     * @param messagingEnabled when false, {@code send_message} is never offered
     * @param allowedActions   optional subset restriction; {@code null} means no restriction.
     *                         {@code wait} is always kept so the space is never empty
     */
    public ActionSpaceBuilder(boolean messagingEnabled, Collection<String> allowedActions) {
        this.messagingEnabled = messagingEnabled;
        this.allowedActions = allowedActions != null ? Set.copyOf(allowedActions) : null;
    }

    public List<String> build(ScreenType screenType, List<InteractionTarget> targets) {
        Set<TargetKind> present = EnumSet.noneOf(TargetKind.class);
        for (InteractionTarget t : targets) present.add(t.kind());

        List<String> available = new ArrayList<>();
        for (ActionCatalogEntry entry : ActionCatalog.entries()) {
            String id = entry.getActionId();
            if (!entry.isValidOn(screenType)) continue;
            if (entry.isRequiresMessage() && !messagingEnabled) continue;
            if (allowedActions != null && !allowedActions.contains(id) && !ActionCatalog.WAIT.equals(id)) continue;

            Optional<TargetKind> required = entry.requiredTargetOn(screenType);
            if (required.isPresent() && !present.contains(required.get())) continue;

            available.add(id);
        }
        return available;
    }

    public boolean isMessagingEnabled() {
        return messagingEnabled;
    }
}
