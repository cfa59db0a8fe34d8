package com.lumina.intent.domain.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * 왜: 네이티브 후처리 효과 슬롯과 같은 코드 값을 공유해 효과 대상 검증의 기준으로 삼기 위함.
 */
public enum EffectType {
    NONE(0),
    BLUR(1),
    BLOOM(2),
    COLOR_GRADE(3),
    VIGNETTE(4),
    CHROMATIC_ABERRATION(5),
    NOISE(6),
    SHARPEN(7);

    private final int code;

    EffectType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static boolean isKnown(String target) {
        if (target == null) {
            return false;
        }
        String candidate = target.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).anyMatch(effect -> effect.wireName().equals(candidate));
    }
}
