package com.lumina.intent.domain.pipeline;

import com.lumina.intent.domain.dag.NodeProcessor;
import com.lumina.intent.domain.model.Classification;
import com.lumina.intent.domain.model.IntentAction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 왜: 병합된 분류를 최상위 필드로 펼쳐 검증과 확정 단계가 출처와 무관하게 같은 필드를 읽도록 하기 위함.
 */
public class ExtractStage implements NodeProcessor<PipelineContext> {

    static final String INTENSITY = "intensity";

    private final double defaultEffectIntensity;

    public ExtractStage(double defaultEffectIntensity) {
        this.defaultEffectIntensity = defaultEffectIntensity;
    }

    @Override
    public PipelineContext process(String input, PipelineContext context) {
        Classification classification = context.classification();
        if (classification == null) {
            return context;
        }

        Map<String, Object> parameters = classification.parameters() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(classification.parameters());
        // adjust_parameter always asks for an intensity
        if (IntentAction.ADJUST_PARAMETER.value().equals(classification.action())
                && !parameters.containsKey(INTENSITY)) {
            parameters.put(INTENSITY, defaultEffectIntensity);
        }

        context.setAction(classification.action());
        context.setTarget(classification.target());
        context.setParameters(parameters);
        context.setConfidence(classification.confidence());
        context.setClassificationSource(classification.source());
        return context;
    }
}
