package com.lumina.intent.domain.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.domain.model.Classification;
import com.lumina.intent.domain.model.ClassificationSource;
import com.lumina.intent.domain.model.Confidence;
import com.lumina.intent.domain.model.EffectType;
import com.lumina.intent.domain.model.IntentAction;
import com.lumina.intent.domain.model.RenderMode;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: 모델 결과를 그대로 믿지 않고, 어휘 검증과 신뢰도 하한을 통과한 경우에만 규칙 결과를 대체하도록 하기 위함.
 */
public class ClassificationMerger {

    static final double MODEL_CONFIDENCE_FLOOR = 0.55;
    static final double RULE_CONFIDENCE_MARGIN = 0.05;
    static final double GUARDRAIL_CONFIDENCE = 0.2;
    private static final double MISSING_MODEL_CONFIDENCE = 0.5;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ClassificationMerger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Turns parsed model output into a classification. Returns empty when the output is absent or
     * carries no usable {@code action}. String-encoded {@code parameters} are decoded; anything that
     * is not a JSON object becomes an empty map.
     */
    public Optional<Classification> normalize(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        String action = stringValue(raw.get("action")).trim();
        if (action.isEmpty()) {
            return Optional.empty();
        }
        String target = stringValue(raw.get("target")).trim().toLowerCase(Locale.ROOT);
        Map<String, Object> parameters = decodeParameters(raw.get("parameters"));
        Object rawConfidence = raw.containsKey("confidence") ? raw.get("confidence") : MISSING_MODEL_CONFIDENCE;
        double confidence = Confidence.clamp(rawConfidence);
        return Optional.of(new Classification(action, target, parameters, confidence, ClassificationSource.LLM));
    }

    /**
     * Keeps {@code rule} unless {@code model} names a known action, a target valid for that action,
     * and a confidence of at least {@code max(0.55, rule.confidence - 0.05)}.
     */
    public Classification merge(Optional<Classification> model, Classification rule) {
        Classification chosen = rule;
        if (model.isPresent() && isTrusted(model.get(), rule)) {
            Classification candidate = model.get();
            chosen = new Classification(
                    candidate.action(),
                    candidate.target().toLowerCase(Locale.ROOT),
                    candidate.parameters(),
                    candidate.confidence(),
                    ClassificationSource.LLM);
        }
        return chosen.withConfidence(Confidence.clamp(chosen.confidence()));
    }

    public Classification unknownClassification(String reason) {
        return new Classification(IntentAction.UNKNOWN.value(), reason, Map.of(), GUARDRAIL_CONFIDENCE,
                ClassificationSource.GUARDRAIL);
    }

    boolean isTrusted(Classification model, Classification rule) {
        Optional<IntentAction> action = IntentAction.fromValue(model.action());
        if (action.isEmpty()) {
            return false;
        }
        if (!isTargetValid(action.get(), model.target())) {
            return false;
        }
        double threshold = Math.max(MODEL_CONFIDENCE_FLOOR, rule.confidence() - RULE_CONFIDENCE_MARGIN);
        return model.confidence() >= threshold;
    }

    static boolean isTargetValid(IntentAction action, String target) {
        if (action == IntentAction.SET_RENDER_MODE) {
            return RenderMode.isKnown(target);
        }
        if (action.isEffectAction()) {
            return EffectType.isKnown(target);
        }
        return true;
    }

    Map<String, Object> decodeParameters(Object rawParameters) {
        if (rawParameters instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return copy;
        }
        if (rawParameters instanceof String text && !text.isBlank()) {
            try {
                Object decoded = objectMapper.readValue(text, Object.class);
                if (decoded instanceof Map<?, ?>) {
                    return objectMapper.convertValue(decoded, MAP_TYPE);
                }
            } catch (JsonProcessingException e) {
                return Map.of();
            }
        }
        return Map.of();
    }

    private static String stringValue(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
