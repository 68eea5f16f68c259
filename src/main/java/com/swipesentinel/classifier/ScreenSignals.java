package com.swipesentinel.classifier;

import com.swipesentinel.model.Observation;
import com.swipesentinel.model.UiNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Normalised view of an observation that matchers query: lower-cased strings
 * plus the resource ids of every node.
 */
public final class ScreenSignals {

    private final List<String> lowered;
    private final List<String> resourceIds;

    private ScreenSignals(List<String> lowered, List<String> resourceIds) {
        this.lowered     = Collections.unmodifiableList(lowered);
        this.resourceIds = Collections.unmodifiableList(resourceIds);
    }

    public static ScreenSignals of(Observation observation) {
        List<String> lowered = new ArrayList<>();
        for (String s : observation.rawStrings()) {
            if (s == null) continue;
            String v = s.trim().toLowerCase(Locale.ROOT);
            if (!v.isEmpty()) lowered.add(v);
        }
        List<String> ids = new ArrayList<>();
        for (UiNode node : observation.nodes()) {
            if (node.hasResourceId()) ids.add(node.resourceId());
        }
        return new ScreenSignals(lowered, ids);
    }

    public List<String> strings()     { return lowered; }
    public List<String> resourceIds() { return resourceIds; }

    /** First string containing {@code fragment}. */
    public Optional<String> findContaining(String fragment) {
        return lowered.stream().filter(s -> s.contains(fragment)).findFirst();
    }

    public Optional<String> findStartingWith(String prefix) {
        return lowered.stream().filter(s -> s.startsWith(prefix)).findFirst();
    }

    public boolean contains(String fragment)   { return findContaining(fragment).isPresent(); }
    public boolean startsWith(String prefix)   { return findStartingWith(prefix).isPresent(); }
    public boolean hasExact(String value)      { return lowered.contains(value); }

    public Optional<String> findResourceIdEndingWith(String suffix) {
        return resourceIds.stream().filter(id -> id.endsWith(suffix)).findFirst();
    }

    public Optional<String> findResourceIdContaining(String fragment) {
        return resourceIds.stream().filter(id -> id.contains(fragment)).findFirst();
    }
}
