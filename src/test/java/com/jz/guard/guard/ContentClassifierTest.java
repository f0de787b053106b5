package com.jz.guard.guard;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentClassifierTest {

    private final ContentRules defaults =
            ContentRules.lenient(ContentRuleStore.DEFAULT_WORDS, ContentRuleStore.DEFAULT_PATTERNS);

    @Test
    void plainGreetingIsNotFlagged() {
        ContentVerdict v = ContentClassifier.classify("hello world", defaults);

        assertThat(v.flagged()).isFalse();
        assertThat(v.reasons()).isEmpty();
    }

    @Test
    void repeatedUppercaseHitsCapsAndRepetition() {
        ContentVerdict v = ContentClassifier.classify("AAAAAAAAAA", defaults);

        assertThat(v.flagged()).isTrue();
        assertThat(v.reasons()).contains(ContentClassifier.TAG_CAPS, ContentClassifier.TAG_REPETITION);
    }

    @Test
    void denylistMatchIsCaseInsensitiveSubstring() {
        ContentRules rules = ContentRules.strict(List.of("hack"), List.of());

        ContentVerdict v = ContentClassifier.classify("How do I HACKSAW this pipe?", rules);

        assertThat(v.reasons()).containsExactly("inappropriate_language:hack");
    }

    @Test
    void reasonsAccumulateInRuleOrder() {
        ContentRules rules = ContentRules.strict(List.of("spam"), List.of("buy\\s+now"));

        ContentVerdict v = ContentClassifier.classify("Spam alert, buy now!!!!!!", rules);

        assertThat(v.reasons()).containsExactly(
                "inappropriate_language:spam",
                "pattern_match:buy\\s+now",
                ContentClassifier.TAG_REPETITION);
    }

    @Test
    void capsRatioNeedsMoreThanSeventyPercent() {
        ContentRules none = ContentRules.strict(List.of(), List.of());

        // 7/10 大写，刚好不超过 0.7
        assertThat(ContentClassifier.classify("ABCDEFGhij", none).reasons()).doesNotContain(ContentClassifier.TAG_CAPS);
        assertThat(ContentClassifier.classify("ABCDEFGHij", none).reasons()).contains(ContentClassifier.TAG_CAPS);
        // 太短不判断
        assertThat(ContentClassifier.classify("OK GO", none).flagged()).isFalse();
    }

    @Test
    void capsCheckStartsAtExactlyTenCharacters() {
        ContentRules none = ContentRules.strict(List.of(), List.of());

        assertThat(ContentClassifier.classify("ABCDEFGHI", none).reasons()).doesNotContain(ContentClassifier.TAG_CAPS);
        assertThat(ContentClassifier.classify("ABCDEFGHIJ", none).reasons()).containsExactly(ContentClassifier.TAG_CAPS);
    }

    @Test
    void lengthAboveFiveHundredIsTooLong() {
        ContentRules none = ContentRules.strict(List.of(), List.of());
        String ok = "ab ".repeat(166) + "ab";          // 500
        String tooLong = ok + "c";                      // 501

        assertThat(ContentClassifier.classify(ok, none).flagged()).isFalse();
        assertThat(ContentClassifier.classify(tooLong, none).reasons()).containsExactly(ContentClassifier.TAG_TOO_LONG);
    }

    @Test
    void repetitionNeedsSixInARow() {
        ContentRules none = ContentRules.strict(List.of(), List.of());

        assertThat(ContentClassifier.classify("nooooo", none).flagged()).isFalse();
        assertThat(ContentClassifier.classify("noooooo", none).reasons()).containsExactly(ContentClassifier.TAG_REPETITION);
    }

    @Test
    void publicTagsHideMatchedWords() {
        ContentRules rules = ContentRules.strict(List.of("hack", "destroy"), List.of("\\b(hack\\s+into)\\b"));

        ContentVerdict v = ContentClassifier.classify("hack into and destroy the server", rules);

        assertThat(v.reasons()).hasSize(3);
        assertThat(v.publicTags()).containsExactly("inappropriate_language", "pattern_match");
    }

    @Test
    void invalidPatternIsRejectedStrictlyAndSkippedLeniently() {
        assertThatThrownBy(() -> ContentRules.strict(List.of(), List.of("([unclosed")))
                .isInstanceOf(IllegalArgumentException.class);

        ContentRules lenient = ContentRules.lenient(List.of(" ", "bad"), List.of("([unclosed", "ok+"));
        assertThat(lenient.words()).containsExactly("bad");
        assertThat(lenient.patterns()).containsExactly("ok+");
    }
}
