package com.lumina.intent.domain.model;

/**
 * 왜: 모든 단계 경계에서 신뢰도가 [0.0, 1.0]을 벗어나지 않도록 한 곳에서 강제하기 위함.
 */
public final class Confidence {

    public static final double MIN = 0.0;
    public static final double MAX = 1.0;

    private Confidence() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return MIN;
        }
        return Math.max(MIN, Math.min(MAX, value));
    }

    /**
     * Clamps an untyped value, as found in parsed model output. Numbers and numeric strings are
     * accepted; anything else clamps to {@link #MIN}.
     */
    public static double clamp(Object value) {
        if (value instanceof Number number) {
            return clamp(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return clamp(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return MIN;
            }
        }
        return MIN;
    }
}
