package com.swipesentinel.executor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as the handler for one catalog action id.
 *
 * The {@link ActionHandlerRegistry} scans the {@code com.swipesentinel.executor.handlers}
 * package at startup, finds every class annotated with {@code @HandlesAction}, and
 * registers it under the given action id. No manual registration required.
 *
 * <pre>
 *   {@literal @}HandlesAction(ActionCatalog.LIKE)
 *   class LikeHandler implements ActionHandler { ... }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link ActionHandler}.
 *   - It must have a no-arg constructor (package-private is fine).
 *   - Each action id has at most one handler. Duplicates cause startup failure.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface HandlesAction {
    String value();
}
