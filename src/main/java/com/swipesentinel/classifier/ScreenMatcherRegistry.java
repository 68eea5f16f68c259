package com.swipesentinel.classifier;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers and holds all {@link ScreenMatcher} implementations in priority order.
 *
 * At construction time the registry:
 *   1. Uses the Reflections library to scan {@code com.swipesentinel.classifier.matchers}
 *   2. Finds every class annotated with {@link ClassifiesScreen}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Sorts by priority ascending (lower number = runs first)
 *
 * Two matchers sharing an id or a priority fail construction, so the resulting
 * order never depends on classpath scan order.
 */
public class ScreenMatcherRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScreenMatcherRegistry.class);
    public static final String MATCHERS_PACKAGE = "com.swipesentinel.classifier.matchers";

    private final List<ScreenMatcher> matchers;

    public ScreenMatcherRegistry() {
        this(MATCHERS_PACKAGE);
    }

    public ScreenMatcherRegistry(String packageName) {
        this.matchers = Collections.unmodifiableList(discoverAndSort(packageName));
        log.info("ScreenMatcherRegistry: {} matcher(s) registered in priority order: {}",
            matchers.size(), matcherIds());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /** All matchers, lowest priority number first. */
    public List<ScreenMatcher> getMatchers() {
        return matchers;
    }

    public int size() {
        return matchers.size();
    }

    public static ClassifiesScreen annotationOf(ScreenMatcher matcher) {
        return matcher.getClass().getAnnotation(ClassifiesScreen.class);
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private List<ScreenMatcher> discoverAndSort(String packageName) {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(packageName)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(ClassifiesScreen.class);

        List<ScreenMatcher> discovered = new ArrayList<>();
        Map<String, String> seenIds = new HashMap<>();
        Map<Integer, String> seenPriorities = new HashMap<>();

        for (Class<?> cls : annotated) {
            ClassifiesScreen annotation = cls.getAnnotation(ClassifiesScreen.class);
            String id = annotation.id();

            if (!ScreenMatcher.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @ClassifiesScreen(id=\"" + id +
                    "\") but does not implement ScreenMatcher");
            }
            if (seenIds.containsKey(id)) {
                throw new IllegalStateException(
                    "Duplicate matcher id \"" + id + "\" in " + seenIds.get(id) + " and " + cls.getName());
            }
            if (seenPriorities.containsKey(annotation.priority())) {
                throw new IllegalStateException(
                    "Matcher priority " + annotation.priority() + " used by both " +
                    seenPriorities.get(annotation.priority()) + " and " + cls.getName());
            }
            seenIds.put(id, cls.getName());
            seenPriorities.put(annotation.priority(), cls.getName());

            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);  // matchers are package-private
                discovered.add((ScreenMatcher) constructor.newInstance());
                log.debug("ScreenMatcherRegistry: registered '{}' (priority={}, screen={}) -> {}",
                    id, annotation.priority(), annotation.screen(), cls.getSimpleName());
            } catch (Exception e) {
                throw new IllegalStateException("Failed to instantiate matcher " + cls.getName() + ".", e);
            }
        }

        discovered.sort(Comparator.comparingInt(m -> annotationOf(m).priority()));
        return discovered;
    }

    private List<String> matcherIds() {
        return matchers.stream().map(m -> annotationOf(m).id()).toList();
    }
}
