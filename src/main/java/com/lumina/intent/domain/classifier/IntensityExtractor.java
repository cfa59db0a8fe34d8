package com.lumina.intent.domain.classifier;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 사용자가 말한 강도를 숫자 비율 또는 형용사에서 정규화된 값으로 뽑아내기 위함.
 */
public class IntensityExtractor {

    private static final Pattern PERCENT = Pattern.compile("(\\d+)\\s*%");

    private static final List<String> LOW_WORDS = List.of("subtle", "light", "slight", "little");
    private static final List<String> MEDIUM_WORDS = List.of("medium", "moderate", "normal");
    private static final List<String> HIGH_WORDS = List.of("strong", "heavy", "intense", "max");

    static final double LOW = 0.3;
    static final double MEDIUM = 0.5;
    static final double HIGH = 0.8;

    /**
     * @return the first percentage found divided by 100, else the adjective bucket value, else empty
     */
    public Optional<Double> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = PERCENT.matcher(text);
        if (matcher.find()) {
            return Optional.of(Double.parseDouble(matcher.group(1)) / 100.0);
        }
        if (containsAny(text, LOW_WORDS)) {
            return Optional.of(LOW);
        }
        if (containsAny(text, MEDIUM_WORDS)) {
            return Optional.of(MEDIUM);
        }
        if (containsAny(text, HIGH_WORDS)) {
            return Optional.of(HIGH);
        }
        return Optional.empty();
    }

    static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
