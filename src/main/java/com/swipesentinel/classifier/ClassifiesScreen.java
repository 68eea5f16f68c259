package com.swipesentinel.classifier;

import com.swipesentinel.model.ScreenType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a {@link ScreenMatcher} available for reflection-based
 * discovery by the {@link ScreenMatcherRegistry}.
 *
 * <pre>
 *   {@literal @}ClassifiesScreen(id = "overlay-paywall", screen = ScreenType.OVERLAY_PAYWALL, priority = 10)
 *   class PaywallMatcher implements ScreenMatcher {
 *       public ScreenMatch match(ScreenSignals signals) { ... }
 *   }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link ScreenMatcher}.
 *   - It must have a no-arg constructor.
 *   - ids and priorities must both be unique, so the matcher order is total;
 *     duplicates cause startup failure.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ClassifiesScreen {

    /** Unique identifier, recorded on packets as {@code matcher_id}. */
    String id();

    /** The screen type this matcher recognises. */
    ScreenType screen();

    /** Evaluation order. Lower = earlier. Must be unique. */
    int priority();
}
