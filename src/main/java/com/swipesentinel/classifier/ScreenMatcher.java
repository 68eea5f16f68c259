package com.swipesentinel.classifier;

/**
 * One rule of the classification table: a predicate over the observed strings
 * and nodes of a screen.
 *
 * Implementations must:
 *   1. Be annotated with {@link ClassifiesScreen}
 *   2. Have a no-arg constructor
 *   3. Live in {@code com.swipesentinel.classifier.matchers} so the
 *      {@link ScreenMatcherRegistry} can discover them via classpath scanning
 *
 * Implementations should be stateless and must never throw; when uncertain,
 * return {@link ScreenMatch#noMatch}. A false positive hides every lower-priority
 * rule, a miss only falls through to the next one.
 */
public interface ScreenMatcher {

    ScreenMatch match(ScreenSignals signals);
}
