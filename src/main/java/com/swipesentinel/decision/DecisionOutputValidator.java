package com.swipesentinel.decision;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.action.ActionCatalogEntry;
import com.swipesentinel.model.InteractionTarget;
import com.swipesentinel.model.PacketContext;
import com.swipesentinel.model.QualityFeatures;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule checks applied to every proposed decision before it is accepted.
 *
 * Model output that fails any check is rejected as a whole. Nothing here edits,
 * trims or pads the text.
 */
public class DecisionOutputValidator {

    public static final String ACTION_NOT_AVAILABLE   = "action_not_in_available_actions";
    public static final String REASON_MISSING         = "reason_missing";
    public static final String MESSAGE_REQUIRED       = "message_text_required_for_send_message";
    public static final String MESSAGE_TOO_LONG       = "message_too_long";
    public static final String MISSING_QUESTION       = "missing_required_question_mark";
    public static final String CONTAINS_EMAIL         = "contains_email";
    public static final String CONTAINS_PHONE         = "contains_phone_number";
    public static final String CONTAINS_URL           = "contains_url";
    public static final String OFF_APP_HANDLE         = "mentions_off_app_handle";
    public static final String SEXUAL_CONTENT         = "possible_sexual_content_violation";
    public static final String MESSAGE_MUST_BE_NULL   = "message_text_must_be_null_when_not_sending";
    public static final String TARGET_NOT_FOUND       = "target_id_not_in_observation";

    private static final Pattern EMAIL  = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE  =
        Pattern.compile("(?<!\\d)(?:\\+?1\\s*)?(?:\\(\\d{3}\\)|\\d{3})[\\s.-]*\\d{3}[\\s.-]*\\d{4}(?!\\d)");
    private static final Pattern HANDLE =
        Pattern.compile("\\b(?:ig|insta|instagram|snap|snapchat|telegram|whatsapp)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL    =
        Pattern.compile("\\bhttps?://\\S+|\\bwww\\.\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD   = Pattern.compile("[A-Za-z][A-Za-z'-]{2,}");

    private static final Set<String> SEXUAL_TERMS = Set.of(
        "sex", "sexy", "hook up", "hookup", "fwb", "nude", "nudes", "sugar daddy", "sugar baby");

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "that", "this", "with", "your", "you", "are", "for", "but", "not", "from",
        "have", "has", "was", "were", "what", "when", "where", "who", "why", "how", "really",
        "just", "like");

    private static final int PROMPT_KEYWORDS_CHECKED = 10;

    public DecisionCheck validate(String actionId, String reason, String messageText, String targetId,
                                  PacketContext packet, PolicyProfile.PersonaSpec persona) {
        List<String> issues = new ArrayList<>();

        if (actionId == null || !packet.getAvailableActions().contains(actionId)) {
            issues.add(ACTION_NOT_AVAILABLE);
        }
        if (reason == null || reason.isBlank()) {
            issues.add(REASON_MISSING);
        }

        boolean requiresMessage = actionId != null
            && ActionCatalog.find(actionId).map(ActionCatalogEntry::isRequiresMessage).orElse(false);
        if (requiresMessage) {
            if (messageText == null || messageText.isBlank()) {
                issues.add(MESSAGE_REQUIRED);
            } else {
                String text = messageText.strip();
                if (text.length() > persona.maxMessageChars()) issues.add(MESSAGE_TOO_LONG);
                if (persona.requireQuestion() && !text.contains("?")) issues.add(MISSING_QUESTION);
                if (EMAIL.matcher(text).find())  issues.add(CONTAINS_EMAIL);
                if (PHONE.matcher(text).find())  issues.add(CONTAINS_PHONE);
                if (URL.matcher(text).find())    issues.add(CONTAINS_URL);
                if (HANDLE.matcher(text).find()) issues.add(OFF_APP_HANDLE);
                String boundaries = String.join(" ", persona.hardBoundaries()).toLowerCase(Locale.ROOT);
                if (boundaries.contains("sex") && containsAny(text, SEXUAL_TERMS)) issues.add(SEXUAL_CONTENT);
            }
        } else if (messageText != null) {
            issues.add(MESSAGE_MUST_BE_NULL);
        }

        if (targetId != null && packet.getTargets().stream().map(InteractionTarget::targetId).noneMatch(targetId::equals)) {
            issues.add(TARGET_NOT_FOUND);
        }

        QualityFeatures qf = packet.getQualityFeatures();
        String lowered = messageText != null ? messageText.toLowerCase(Locale.ROOT) : "";
        String name = qf.profileNameCandidate();
        boolean mentionsName = name != null && !name.isBlank() && lowered.contains(name.strip().toLowerCase(Locale.ROOT));
        boolean mentionsKeyword = promptKeywords(qf.promptAnswer()).stream()
            .limit(PROMPT_KEYWORDS_CHECKED)
            .anyMatch(lowered::contains);

        return new DecisionCheck(issues, mentionsName, mentionsKeyword);
    }

    /** Content words of a prompt answer, lower-cased, stop words removed. */
    static List<String> promptKeywords(String promptAnswer) {
        List<String> out = new ArrayList<>();
        if (promptAnswer == null) return out;
        Matcher m = WORD.matcher(promptAnswer);
        while (m.find()) {
            String w = m.group().toLowerCase(Locale.ROOT);
            if (!STOP_WORDS.contains(w)) out.add(w);
        }
        return out;
    }

    private static boolean containsAny(String text, Set<String> terms) {
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String t : terms) {
            if (Pattern.compile("\\b" + Pattern.quote(t) + "\\b").matcher(lowered).find()) return true;
        }
        return false;
    }
}
