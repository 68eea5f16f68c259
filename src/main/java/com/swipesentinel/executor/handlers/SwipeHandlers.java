package com.swipesentinel.executor.handlers;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.executor.HandlesAction;
import com.swipesentinel.model.TargetKind;

// ── like ──────────────────────────────────────────────────────────────────────

@HandlesAction(ActionCatalog.LIKE)
class LikeHandler extends TapTargetHandler {
    LikeHandler() { super(TargetKind.LIKE_BUTTON); }
}

// ── pass ──────────────────────────────────────────────────────────────────────

@HandlesAction(ActionCatalog.PASS)
class PassHandler extends TapTargetHandler {
    PassHandler() { super(TargetKind.PASS_BUTTON); }
}

// ── dismiss_overlay ───────────────────────────────────────────────────────────

@HandlesAction(ActionCatalog.DISMISS_OVERLAY)
class DismissOverlayHandler extends TapTargetHandler {
    DismissOverlayHandler() { super(TargetKind.CLOSE_OVERLAY); }
}
