package com.lumina.intent.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 왜: 규칙 경로와 모델 경로의 분류 결과를 같은 형태로 맞춰 병합 로직이 출처를 가리지 않고 비교하도록 하기 위함.
 *
 * <p>{@code action} is kept as the raw wire value because model output may name actions outside
 * {@link IntentAction}; the merge and validate stages decide whether it is trusted.
 */
public record Classification(String action,
                             String target,
                             Map<String, Object> parameters,
                             double confidence,
                             ClassificationSource source) {

    public Classification {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(source, "source");
        target = target == null ? "" : target;
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Classification rule(IntentAction action, String target, Map<String, Object> parameters, double confidence) {
        return new Classification(action.value(), target, parameters, confidence, ClassificationSource.RULE);
    }

    public Classification withConfidence(double newConfidence) {
        return new Classification(action, target, parameters, newConfidence, source);
    }
}
