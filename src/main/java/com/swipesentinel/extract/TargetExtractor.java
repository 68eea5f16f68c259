package com.swipesentinel.extract;

import com.swipesentinel.model.Bounds;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.Observation;
import com.swipesentinel.model.TargetKind;
import com.swipesentinel.model.UiNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the interaction map of one observation: every clickable, enabled,
 * bounded node whose label or view id identifies a known affordance.
 *
 * Target ids have the form {@code <kind>:<node ordinal>} and are only meaningful
 * within the observation they were extracted from.
 */
public class TargetExtractor {

    public static final int DEFAULT_MAX_TARGETS = 160;

    private static final int CONTEXT_MAX_DY    = 260;
    private static final int CONTEXT_MAX_ITEMS = 2;
    private static final int CONTEXT_MAX_CHARS = 220;

    private static final Map<String, TargetKind> TAB_LABELS = Map.of(
        "discover",    TargetKind.TAB_DISCOVER,
        "matches",     TargetKind.TAB_MATCHES,
        "likes you",   TargetKind.TAB_LIKES_YOU,
        "standouts",   TargetKind.TAB_STANDOUTS,
        "profile hub", TargetKind.TAB_PROFILE_HUB);

    private final int maxTargets;

    public TargetExtractor() {
        this(DEFAULT_MAX_TARGETS);
    }

    public TargetExtractor(int maxTargets) {
        if (maxTargets <= 0) throw new IllegalArgumentException("maxTargets must be > 0");
        this.maxTargets = maxTargets;
    }

    public List<InteractionTarget> extract(Observation observation) {
        List<UiNode> textNodes = new ArrayList<>();
        for (UiNode node : observation.nodes()) {
            String label = node.label();
            if (node.bounds() != null && !label.isEmpty() && !ChromeText.isChrome(label)
                    && label.length() <= CONTEXT_MAX_CHARS) {
                textNodes.add(node);
            }
        }

        List<InteractionTarget> targets = new ArrayList<>();
        for (UiNode node : observation.nodes()) {
            if (targets.size() >= maxTargets) break;
            if (!node.clickable() || !node.enabled() || node.bounds() == null) continue;

            TargetKind kind = kindOf(node);
            if (kind == null) continue;

            Bounds b = node.bounds();
            List<String> context = kind == TargetKind.LIKE_BUTTON ? nearbyContext(b, textNodes) : List.of();
            String label = node.label();
            targets.add(new InteractionTarget(
                kind.wireName() + ":" + node.ordinal(),
                kind,
                label.isEmpty() ? null : label,
                b,
                b.centerX(),
                b.centerY(),
                context));
        }
        return targets;
    }

    // ── Classification of a single node ───────────────────────────────────────

    static TargetKind kindOf(UiNode node) {
        String lowered = node.label().toLowerCase(Locale.ROOT);
        String resourceId = node.hasResourceId() ? node.resourceId() : "";

        if (lowered.startsWith("like "))                              return TargetKind.LIKE_BUTTON;
        if (lowered.equals("skip") || lowered.startsWith("skip "))    return TargetKind.PASS_BUTTON;
        if (lowered.equals("send like"))                              return TargetKind.SEND_LIKE;
        if (lowered.contains("add a comment") || lowered.contains("edit comment")) return TargetKind.COMMENT_INPUT;
        if (lowered.equals("close") || lowered.equals("close sheet")) return TargetKind.CLOSE_OVERLAY;
        if (resourceId.endsWith(":id/message_input") || lowered.contains("type a message")) return TargetKind.MESSAGE_INPUT;
        if (lowered.equals("send"))                                   return TargetKind.SEND_BUTTON;
        if (resourceId.contains(":id/match_row"))                     return TargetKind.THREAD_ROW;
        return TAB_LABELS.get(lowered);
    }

    /**
     * Up to two content strings to the left of a like affordance and vertically
     * close to it, nearest first. Lets the model tell several like buttons apart.
     */
    private List<String> nearbyContext(Bounds like, List<UiNode> textNodes) {
        int cx = like.centerX();
        int cy = like.centerY();
        record Scored(double score, String text) {}

        List<Scored> scored = new ArrayList<>();
        for (UiNode n : textNodes) {
            int tx = n.bounds().centerX();
            int ty = n.bounds().centerY();
            if (Math.abs(ty - cy) > CONTEXT_MAX_DY || tx >= cx) continue;
            scored.add(new Scored(Math.abs(ty - cy) + Math.abs(tx - cx) * 0.25, n.label()));
        }
        scored.sort(Comparator.comparingDouble(Scored::score));

        Set<String> context = new LinkedHashSet<>();
        for (Scored s : scored) {
            String normalized = String.join(" ", s.text().trim().split("\\s+"));
            if (!normalized.isEmpty()) context.add(normalized);
            if (context.size() >= CONTEXT_MAX_ITEMS) break;
        }
        return new ArrayList<>(context);
    }
}
