package com.jz.guard.guard;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 词法规则打标，无副作用。各规则独立判断，一条消息可同时命中多个标签。
 */
@Component
@RequiredArgsConstructor
public class ContentClassifier {

    public static final String TAG_LANGUAGE = "inappropriate_language";
    public static final String TAG_PATTERN = "pattern_match";
    public static final String TAG_CAPS = "excessive_caps";
    public static final String TAG_TOO_LONG = "message_too_long";
    public static final String TAG_REPETITION = "excessive_repetition";

    /**
     * 至少 10 个字符才判断大写占比。
     * 有意从原先的"超过 10 个字符"放宽到"不少于 10 个"，让刚好 10 个字符的 "AAAAAAAAAA" 也命中，不要改回严格大于 10。
     */
    static final int CAPS_MIN_LENGTH = 10;
    static final double CAPS_RATIO = 0.7;
    static final int MAX_LENGTH = 500;

    /** 同一字符连续出现 6 次及以上 */
    private static final Pattern REPETITION = Pattern.compile("(.)\\1{5,}");

    private final ContentRuleStore ruleStore;

    public ContentVerdict classify(String text) {
        return classify(text, ruleStore.current());
    }

    public static ContentVerdict classify(String text, ContentRules rules) {
        Set<String> reasons = new LinkedHashSet<>();
        String lower = text.toLowerCase(Locale.ROOT);

        for (String word : rules.words()) {
            if (lower.contains(word.toLowerCase(Locale.ROOT))) {
                reasons.add(TAG_LANGUAGE + ":" + word);
            }
        }
        for (ContentRules.CompiledPattern p : rules.compiled()) {
            if (p.regex().matcher(text).find()) {
                reasons.add(TAG_PATTERN + ":" + p.source());
            }
        }

        int length = text.codePointCount(0, text.length());
        if (length >= CAPS_MIN_LENGTH) {
            long upper = text.codePoints().filter(Character::isUpperCase).count();
            if ((double) upper / length > CAPS_RATIO) {
                reasons.add(TAG_CAPS);
            }
        }
        if (length > MAX_LENGTH) {
            reasons.add(TAG_TOO_LONG);
        }
        if (REPETITION.matcher(text).find()) {
            reasons.add(TAG_REPETITION);
        }
        return new ContentVerdict(!reasons.isEmpty(), Collections.unmodifiableSet(reasons));
    }
}
