package com.swipesentinel.executor;

import com.swipesentinel.action.ActionCatalog;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Discovers and holds all {@link ActionHandler} implementations.
 *
 * At construction time the registry:
 *   1. Uses the Reflections library to scan {@code com.swipesentinel.executor.handlers}
 *   2. Finds every class annotated with {@link HandlesAction}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Registers it under the action id declared in the annotation
 *
 * Fails at startup with {@link IllegalStateException} when two handlers claim the
 * same action, when a handler names an action outside the catalog, or when a
 * catalog action has no handler.
 */
public class ActionHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);
    public static final String HANDLERS_PACKAGE = "com.swipesentinel.executor.handlers";

    private final Map<String, ActionHandler> registry = new HashMap<>();

    public ActionHandlerRegistry() {
        discoverAndRegister();
        for (String actionId : ActionCatalog.actionIds()) {
            if (!registry.containsKey(actionId)) {
                throw new IllegalStateException("No handler registered for catalog action '" + actionId + "'");
            }
        }
        log.info("ActionHandlerRegistry: {} handler(s) registered", registry.size());
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public Optional<ActionHandler> find(String actionId) {
        return Optional.ofNullable(registry.get(actionId));
    }

    public boolean hasHandler(String actionId) {
        return registry.containsKey(actionId);
    }

    public int size() {
        return registry.size();
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private void discoverAndRegister() {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(HANDLERS_PACKAGE)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(HandlesAction.class);

        for (Class<?> cls : annotated) {
            String actionId = cls.getAnnotation(HandlesAction.class).value();

            if (!ActionHandler.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @HandlesAction(\"" + actionId +
                    "\") but does not implement ActionHandler");
            }
            if (!ActionCatalog.contains(actionId)) {
                throw new IllegalStateException(
                    "Handler " + cls.getName() + " names unknown action '" + actionId + "'");
            }
            if (registry.containsKey(actionId)) {
                throw new IllegalStateException(
                    "Duplicate handler for action '" + actionId +
                    "': " + registry.get(actionId).getClass().getName() +
                    " and " + cls.getName());
            }

            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);
                registry.put(actionId, (ActionHandler) constructor.newInstance());
                log.debug("ActionHandlerRegistry: registered {} -> {}", actionId, cls.getSimpleName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Failed to instantiate handler " + cls.getName() + " for action '" + actionId + "'.", e);
            }
        }
    }
}
