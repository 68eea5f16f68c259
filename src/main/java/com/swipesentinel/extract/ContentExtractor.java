package com.swipesentinel.extract;

import com.swipesentinel.model.ExtractedContent;
import com.swipesentinel.model.Observation;
import com.swipesentinel.model.PromptPair;
import com.swipesentinel.model.QualityFeatures;
import com.swipesentinel.model.ScreenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives profile fields, conversation lines and the quality score from an
 * observation's visible strings.
 *
 * Best-effort by nature: unlabelled or occluded content is simply absent. The
 * extractor never fails; an observation with no recognisable content yields
 * empty features and a score of whatever the screen type alone is worth.
 */
public class ContentExtractor {

    private static final Pattern PROMPT_ANSWER =
        Pattern.compile("^\\s*prompt:\\s*(.*?)\\s*answer:\\s*(.*)\\s*$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern PHOTO_NAME =
        Pattern.compile("^(.+?)['’]s photo$", Pattern.CASE_INSENSITIVE);

    private static final int BIO_MIN_CHARS = 3;
    private static final int BIO_MAX_CHARS = 180;
    private static final int BIO_MAX_ITEMS = 30;

    private final QualityScorer scorer;

    public ContentExtractor() {
        this(new QualityScorer());
    }

    public ContentExtractor(QualityScorer scorer) {
        this.scorer = scorer;
    }

    public ExtractedContent extract(Observation observation, ScreenType screenType) {
        List<String> names       = new ArrayList<>();
        List<PromptPair> prompts = new ArrayList<>();
        List<String> likeTargets = new ArrayList<>();
        TreeSet<String> flags    = new TreeSet<>();
        List<String> bio         = new ArrayList<>();
        List<String> thread      = new ArrayList<>();

        for (String raw : observation.rawStrings()) {
            String s = raw.trim();
            String lowered = s.toLowerCase(Locale.ROOT);

            Matcher photo = PHOTO_NAME.matcher(s);
            if (photo.matches() && !photo.group(1).isBlank()) {
                names.add(photo.group(1).trim());
            }
            Matcher pa = PROMPT_ANSWER.matcher(s);
            if (pa.matches()) {
                prompts.add(new PromptPair(pa.group(1).trim(), pa.group(2).trim()));
            }
            if (lowered.startsWith("like ")) likeTargets.add(s);

            if (lowered.contains("selfie verified")) flags.add(QualityFeatures.FLAG_SELFIE_VERIFIED);
            if (lowered.contains("active today"))    flags.add(QualityFeatures.FLAG_ACTIVE_TODAY);
            if (lowered.contains("voice prompt"))    flags.add(QualityFeatures.FLAG_VOICE_PROMPT);

            if (!ChromeText.isChrome(s)) {
                if (screenType == ScreenType.CHAT_THREAD) {
                    thread.add(s);
                } else if (s.length() >= BIO_MIN_CHARS && s.length() <= BIO_MAX_CHARS && bio.size() < BIO_MAX_ITEMS) {
                    bio.add(s);
                }
            }
        }

        String name = names.isEmpty() ? null : names.get(0);
        String promptAnswer = prompts.stream()
            .map(PromptPair::answer)
            .filter(a -> !a.isBlank())
            .findFirst()
            .orElse(null);

        QualityFeatures features = new QualityFeatures(name, promptAnswer, likeTargets, new ArrayList<>(flags));
        int score = scorer.score(screenType, features);

        int signals = 0;
        if (name != null)            signals++;
        if (!prompts.isEmpty())      signals++;
        if (!likeTargets.isEmpty())  signals++;
        if (!flags.isEmpty())        signals++;
        if (!bio.isEmpty())          signals++;
        int completeness = Math.round(signals * 100f / 5f);

        return new ExtractedContent(screenType, features, score, QualityScorer.VERSION,
            prompts, bio, thread, completeness);
    }
}
