package com.lumina.intent.domain.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * 왜: 네이티브 렌더러와 같은 코드 값을 공유해 렌더 모드 대상 검증의 기준으로 삼기 위함.
 */
public enum RenderMode {
    PASSTHROUGH(0),
    STYLIZED(1),
    SEGMENTED(2),
    DEPTH_MAP(3),
    NORMAL_MAP(4);

    private final int code;

    RenderMode(int code) {
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
        return Arrays.stream(values()).anyMatch(mode -> mode.wireName().equals(candidate));
    }
}
