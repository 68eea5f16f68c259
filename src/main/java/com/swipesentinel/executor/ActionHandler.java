package com.swipesentinel.executor;

/**
 * Implemented by every class that turns one catalog action into primitives.
 *
 * <h3>Registration</h3>
 * Implementations must:
 * <ol>
 *   <li>Be annotated with {@link HandlesAction} (value = the catalog action id)</li>
 *   <li>Have a no-arg constructor</li>
 *   <li>Be in the {@code com.swipesentinel.executor.handlers} package so the
 *       {@link ActionHandlerRegistry} discovers them automatically at startup</li>
 * </ol>
 *
 * <h3>Implementation rules</h3>
 * <ul>
 *   <li>Issue primitives only through {@link ActionContext#issue}; it counts them
 *       and records transport failures</li>
 *   <li>Resolve targets with {@link ActionContext#resolveTarget}; never substitute
 *       a different target when the planned one is missing</li>
 *   <li>Never throw - return {@link ActionResult#failed}</li>
 *   <li>Be stateless - the same instance is reused for every cycle</li>
 * </ul>
 *
 * Handlers are never invoked in dry-run mode; {@link ActionExecutor} enforces that.
 */
public interface ActionHandler {
    ActionResult execute(ActionContext context);
}
