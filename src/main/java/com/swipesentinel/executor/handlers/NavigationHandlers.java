package com.swipesentinel.executor.handlers;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.capture.Primitive;
import com.swipesentinel.executor.ActionContext;
import com.swipesentinel.executor.ActionHandler;
import com.swipesentinel.executor.ActionResult;
import com.swipesentinel.executor.HandlesAction;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.TargetKind;

import java.util.Optional;

// ── Shared tab tap ────────────────────────────────────────────────────────────

abstract class TapTargetHandler implements ActionHandler {

    private final TargetKind kind;

    TapTargetHandler(TargetKind kind) {
        this.kind = kind;
    }

    @Override
    public ActionResult execute(ActionContext ctx) {
        Optional<InteractionTarget> target = ctx.resolveTarget(kind);
        if (target.isEmpty()) return ctx.missingTarget(kind);
        if (!ctx.tap(target.get())) return ctx.transportFailed("tap " + kind.wireName());
        return ctx.executed("Tapped " + target.get().targetId());
    }
}

// ── goto_* ────────────────────────────────────────────────────────────────────

@HandlesAction(ActionCatalog.GOTO_DISCOVER)
class GotoDiscoverHandler extends TapTargetHandler {
    GotoDiscoverHandler() { super(TargetKind.TAB_DISCOVER); }
}

@HandlesAction(ActionCatalog.GOTO_MATCHES)
class GotoMatchesHandler extends TapTargetHandler {
    GotoMatchesHandler() { super(TargetKind.TAB_MATCHES); }
}

@HandlesAction(ActionCatalog.GOTO_LIKES_YOU)
class GotoLikesYouHandler extends TapTargetHandler {
    GotoLikesYouHandler() { super(TargetKind.TAB_LIKES_YOU); }
}

@HandlesAction(ActionCatalog.GOTO_STANDOUTS)
class GotoStandoutsHandler extends TapTargetHandler {
    GotoStandoutsHandler() { super(TargetKind.TAB_STANDOUTS); }
}

@HandlesAction(ActionCatalog.GOTO_PROFILE_HUB)
class GotoProfileHubHandler extends TapTargetHandler {
    GotoProfileHubHandler() { super(TargetKind.TAB_PROFILE_HUB); }
}

// ── open_thread ───────────────────────────────────────────────────────────────

@HandlesAction(ActionCatalog.OPEN_THREAD)
class OpenThreadHandler extends TapTargetHandler {
    OpenThreadHandler() { super(TargetKind.THREAD_ROW); }
}

// ── back ──────────────────────────────────────────────────────────────────────

@HandlesAction(ActionCatalog.BACK)
class BackHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        if (!ctx.issue(Primitive.back())) return ctx.transportFailed("back key");
        return ctx.executed("Pressed BACK");
    }
}

// ── wait ──────────────────────────────────────────────────────────────────────

@HandlesAction(ActionCatalog.WAIT)
class WaitHandler implements ActionHandler {
    @Override
    public ActionResult execute(ActionContext ctx) {
        return ActionResult.skipped("wait: no primitive");
    }
}
