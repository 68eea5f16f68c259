package com.swipesentinel.executor.handlers;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.capture.Primitive;
import com.swipesentinel.capture.TransportException;
import com.swipesentinel.executor.ActionContext;
import com.swipesentinel.executor.ActionHandler;
import com.swipesentinel.executor.ActionResult;
import com.swipesentinel.executor.HandlesAction;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.ScreenType;
import com.swipesentinel.model.TargetKind;

import java.util.Optional;

/**
 * Sends the plan's message text.
 *
 * <pre>
 *   discover_card  tap like -> re-observe -> tap comment input -> type -> tap send like
 *   chat_thread    tap message input -> type -> tap send
 * </pre>
 */
@HandlesAction(ActionCatalog.SEND_MESSAGE)
class SendMessageHandler implements ActionHandler {

    @Override
    public ActionResult execute(ActionContext ctx) {
        String text = ctx.getPlan().messageText();
        if (text == null || text.isBlank()) return ctx.failed("message_text_missing");

        if (ctx.getScreenType() == ScreenType.DISCOVER_CARD) return sendOnDiscover(ctx, text);
        if (ctx.getScreenType() == ScreenType.CHAT_THREAD)   return sendInThread(ctx, text);
        return ctx.failed("send_message not supported on " + ctx.getScreenType().wireName());
    }

    private ActionResult sendOnDiscover(ActionContext ctx, String text) {
        Optional<InteractionTarget> like = ctx.resolveTarget(TargetKind.LIKE_BUTTON);
        if (like.isEmpty()) return ctx.missingTarget(TargetKind.LIKE_BUTTON);
        if (!ctx.tap(like.get())) return ctx.transportFailed("tap like");

        try {
            ctx.reobserve();
        } catch (TransportException e) {
            return ActionResult.transportFailed("re-observe after like failed: " + e.getMessage(),
                ctx.getPrimitivesIssued());
        }

        Optional<InteractionTarget> comment = ctx.resolveTarget(TargetKind.COMMENT_INPUT);
        if (comment.isEmpty()) return ctx.missingTarget(TargetKind.COMMENT_INPUT);
        if (!ctx.tap(comment.get()))          return ctx.transportFailed("tap comment input");
        if (!ctx.issue(Primitive.type(text))) return ctx.transportFailed("type message");

        Optional<InteractionTarget> send = ctx.resolveTarget(TargetKind.SEND_LIKE);
        if (send.isEmpty()) return ctx.missingTarget(TargetKind.SEND_LIKE);
        if (!ctx.tap(send.get())) return ctx.transportFailed("tap send like");

        return ctx.executed("Sent like with comment (" + text.length() + " chars)");
    }

    private ActionResult sendInThread(ActionContext ctx, String text) {
        Optional<InteractionTarget> input = ctx.resolveTarget(TargetKind.MESSAGE_INPUT);
        if (input.isEmpty()) return ctx.missingTarget(TargetKind.MESSAGE_INPUT);
        Optional<InteractionTarget> send = ctx.resolveTarget(TargetKind.SEND_BUTTON);
        if (send.isEmpty()) return ctx.missingTarget(TargetKind.SEND_BUTTON);

        if (!ctx.tap(input.get()))            return ctx.transportFailed("tap message input");
        if (!ctx.issue(Primitive.type(text))) return ctx.transportFailed("type message");
        if (!ctx.tap(send.get()))             return ctx.transportFailed("tap send");

        return ctx.executed("Sent chat message (" + text.length() + " chars)");
    }
}
