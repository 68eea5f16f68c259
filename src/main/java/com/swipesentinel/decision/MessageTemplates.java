package com.swipesentinel.decision;

/**
 * Renders the profile's message template for deterministic decisions.
 *
 * Only template output is normalised here. Model-written text is never passed
 * through {@link #normalize}; it is accepted or rejected by the validator as is.
 */
public final class MessageTemplates {

    static final String NAME_PLACEHOLDER = "{{name}}";
    static final String NAME_FALLBACK    = "there";
    static final String QUESTION_SUFFIX  = " What's been your highlight this week?";

    private MessageTemplates() {}

    public static String render(String template, String name) {
        String replacement = name != null && !name.isBlank() ? name.strip() : NAME_FALLBACK;
        return template.replace(NAME_PLACEHOLDER, replacement);
    }

    /**
     * Collapses whitespace, cuts to {@code maxMessageChars} and appends a question
     * when the persona requires one, without exceeding the limit.
     */
    public static String normalize(String text, PolicyProfile.PersonaSpec persona) {
        String out = String.join(" ", text.strip().split("\\s+"));
        int max = persona.maxMessageChars();
        if (out.length() > max) {
            out = out.substring(0, max - 1).stripTrailing() + "…";
        }
        if (persona.requireQuestion() && !out.contains("?")) {
            String candidate = out + QUESTION_SUFFIX;
            if (candidate.length() <= max) {
                out = candidate;
            } else {
                String head = out.substring(0, Math.max(0, max - QUESTION_SUFFIX.length() - 1)).stripTrailing();
                out = (head + QUESTION_SUFFIX).strip();
            }
        }
        return out;
    }

    /** Template for the given profile and name, ready to send. */
    public static String compose(PolicyProfile profile, String name) {
        return normalize(render(profile.getMessagePolicy().template(), name), profile.getPersonaSpec());
    }
}
