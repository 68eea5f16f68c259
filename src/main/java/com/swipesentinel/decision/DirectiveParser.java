package com.swipesentinel.decision;

import com.swipesentinel.action.ActionCatalog;
import com.swipesentinel.core.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text run instruction into a {@link Directive}.
 *
 * Recognised phrasing (case-insensitive):
 * <pre>
 *   goal          "explore" / "free form" / "freely navigate", "message", "swipe" (last wins)
 *   force once    "go to matches", "go back", "like now", "force send message", ...
 *   limits        "for 12 actions", "max likes 5", "max passes 9", "max messages 2",
 *                 "score above 80", "for 3 minutes", "for 45 seconds"
 *   run mode      "dry run", "live run" / "execute"
 *   messaging     "don't message" / "do not message" disables; any other "message" enables
 *   subset        "only like, pass and wait"
 * </pre>
 */
public class DirectiveParser {

    private static final Logger log = LoggerFactory.getLogger(DirectiveParser.class);

    private static final Pattern ACTIONS   = Pattern.compile("(?:for\\s+)?(\\d+)\\s+actions");
    private static final Pattern LIKES     = Pattern.compile("max\\s+likes?\\s+(\\d+)");
    private static final Pattern PASSES    = Pattern.compile("max\\s+passes?\\s+(\\d+)");
    private static final Pattern MESSAGES  = Pattern.compile("max\\s+messages?\\s+(\\d+)");
    private static final Pattern SCORE     = Pattern.compile("(?:score|quality)\\s*(?:>=|above|over)?\\s*(\\d{1,3})");
    private static final Pattern MINUTES   = Pattern.compile("for\\s+(\\d+)\\s+minutes?");
    private static final Pattern SECONDS   = Pattern.compile("for\\s+(\\d+)\\s+seconds?");
    private static final Pattern ONLY      = Pattern.compile("\\bonly\\s+([a-z_,\\s]+)");

    // Words that end an "only ..." list
    private static final Set<String> ONLY_STOP_WORDS =
        Set.of("for", "with", "max", "then", "in", "during", "until", "dry", "live", "score", "quality");

    // First phrase that matches wins, in this order
    private static final Map<String, String> FORCE_PHRASES = new LinkedHashMap<>();
    static {
        FORCE_PHRASES.put("go to matches",      ActionCatalog.GOTO_MATCHES);
        FORCE_PHRASES.put("go to discover",     ActionCatalog.GOTO_DISCOVER);
        FORCE_PHRASES.put("go to likes",        ActionCatalog.GOTO_LIKES_YOU);
        FORCE_PHRASES.put("go to standouts",    ActionCatalog.GOTO_STANDOUTS);
        FORCE_PHRASES.put("go to profile",      ActionCatalog.GOTO_PROFILE_HUB);
        FORCE_PHRASES.put("go back",            ActionCatalog.BACK);
        FORCE_PHRASES.put("press back",         ActionCatalog.BACK);
        FORCE_PHRASES.put("dismiss overlay",    ActionCatalog.DISMISS_OVERLAY);
        FORCE_PHRASES.put("close overlay",      ActionCatalog.DISMISS_OVERLAY);
        FORCE_PHRASES.put("open thread now",    ActionCatalog.OPEN_THREAD);
        FORCE_PHRASES.put("force open thread",  ActionCatalog.OPEN_THREAD);
        FORCE_PHRASES.put("send message now",   ActionCatalog.SEND_MESSAGE);
        FORCE_PHRASES.put("force send message", ActionCatalog.SEND_MESSAGE);
        FORCE_PHRASES.put("like now",           ActionCatalog.LIKE);
        FORCE_PHRASES.put("force like",         ActionCatalog.LIKE);
        FORCE_PHRASES.put("pass now",           ActionCatalog.PASS);
        FORCE_PHRASES.put("force pass",         ActionCatalog.PASS);
        FORCE_PHRASES.put("wait now",           ActionCatalog.WAIT);
        FORCE_PHRASES.put("force wait",         ActionCatalog.WAIT);
        FORCE_PHRASES.put("do nothing now",     ActionCatalog.WAIT);
    }

    /**
     * @throws ConfigException if an {@code only ...} clause names an action outside the catalog,
     *         or a number in the instruction does not fit an int
     */
    public Directive parse(String query) {
        if (query == null || query.isBlank()) return Directive.none();

        String q = query.strip();
        String lowered = q.toLowerCase(Locale.ROOT);
        boolean noMessage = lowered.contains("don't message") || lowered.contains("do not message");

        Goal goal = Goal.SWIPE;
        if (lowered.contains("explore") || lowered.contains("free form") || lowered.contains("freely navigate")) {
            goal = Goal.EXPLORE;
        }
        if (lowered.contains("message") && !noMessage) goal = Goal.MESSAGE;
        if (lowered.contains("swipe")) goal = Goal.SWIPE;

        String force = null;
        for (Map.Entry<String, String> e : FORCE_PHRASES.entrySet()) {
            if (lowered.contains(e.getKey())) {
                force = e.getValue();
                break;
            }
        }

        Integer runtime = firstInt(MINUTES, lowered);
        if (runtime != null) {
            try {
                runtime = Math.multiplyExact(runtime, 60);
            } catch (ArithmeticException e) {
                throw new ConfigException("Runtime of " + runtime + " minutes in instruction is out of range", e);
            }
        }
        Integer seconds = firstInt(SECONDS, lowered);
        if (seconds != null) runtime = seconds;

        Boolean dryRun = null;
        if (lowered.contains("dry run")) dryRun = Boolean.TRUE;
        if (lowered.contains("live run") || lowered.contains("execute")) dryRun = Boolean.FALSE;

        Boolean messageEnabled = null;
        if (noMessage) messageEnabled = Boolean.FALSE;
        else if (lowered.contains("message")) messageEnabled = Boolean.TRUE;

        Directive directive = new Directive(
            q, goal, force,
            firstInt(ACTIONS, lowered),
            firstInt(LIKES, lowered),
            firstInt(PASSES, lowered),
            firstInt(MESSAGES, lowered),
            firstInt(SCORE, lowered),
            runtime,
            dryRun,
            messageEnabled,
            parseOnly(lowered));

        log.info("DirectiveParser: goal={} force={} allowed={}", directive.goal(), force, directive.allowedActions());
        return directive;
    }

    private static Integer firstInt(Pattern p, String text) {
        Matcher m = p.matcher(text);
        if (!m.find()) return null;
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            throw new ConfigException("Number '" + m.group(1) + "' in instruction is out of range", e);
        }
    }

    private static List<String> parseOnly(String lowered) {
        Matcher m = ONLY.matcher(lowered);
        if (!m.find()) return null;

        List<String> ids = new ArrayList<>();
        for (String token : m.group(1).split("[,\\s]+")) {
            String id = token.trim();
            if (id.isEmpty() || id.equals("and") || id.equals("or")) continue;
            if (ONLY_STOP_WORDS.contains(id)) break;
            if (!ActionCatalog.contains(id)) {
                throw new ConfigException("Unknown action '" + id + "' in 'only' clause. Known: "
                    + ActionCatalog.describeIds());
            }
            if (!ids.contains(id)) ids.add(id);
        }
        return ids.isEmpty() ? null : ids;
    }
}
