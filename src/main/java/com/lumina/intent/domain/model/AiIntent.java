package com.lumina.intent.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 왜: 호스트 앱과 네이티브 엔진이 공유하는 고정 구조체 계약을 그대로 표현하기 위함.
 *
 * <p>{@code parameters} is a JSON-encoded string, not a nested object. The consuming side reads a
 * fixed cross-language struct with a string slot, so the double encoding is intentional.
 */
@JsonPropertyOrder({"action", "target", "parameters", "confidence", "timestamp"})
public record AiIntent(String action,
                       String target,
                       String parameters,
                       double confidence,
                       long timestamp) {

    public static final String EMPTY_PARAMETERS = "{}";

    public AiIntent {
        Objects.requireNonNull(action, "action");
        target = target == null ? "" : target;
        parameters = parameters == null || parameters.isBlank() ? EMPTY_PARAMETERS : parameters;
        confidence = Confidence.clamp(confidence);
    }

    public static AiIntent unknown(String target, double confidence, long timestamp) {
        return new AiIntent(IntentAction.UNKNOWN.value(), target, EMPTY_PARAMETERS, confidence, timestamp);
    }
}
