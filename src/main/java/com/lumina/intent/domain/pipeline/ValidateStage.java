package com.lumina.intent.domain.pipeline;

import com.lumina.intent.domain.dag.NodeProcessor;
import com.lumina.intent.domain.model.Confidence;
import com.lumina.intent.domain.model.EffectType;
import com.lumina.intent.domain.model.IntentAction;
import com.lumina.intent.domain.model.RenderMode;

import java.util.Optional;

/**
 * 왜: 확정 직전에 동작과 대상을 어휘와 다시 대조해, 어휘 밖의 값은 낮은 신뢰도로만 통과시키기 위함.
 */
public class ValidateStage implements NodeProcessor<PipelineContext> {

    static final double INVALID_ACTION_CONFIDENCE_CAP = 0.3;
    static final double INVALID_TARGET_CONFIDENCE_CAP = 0.4;

    @Override
    public PipelineContext process(String input, PipelineContext context) {
        String target = context.target() == null ? "" : context.target();
        Optional<IntentAction> action = IntentAction.fromValue(context.action());

        if (action.isEmpty()) {
            context.setAction(IntentAction.UNKNOWN.value());
            context.setConfidence(Math.min(context.confidence(), INVALID_ACTION_CONFIDENCE_CAP));
        } else if (action.get() == IntentAction.SET_RENDER_MODE && !RenderMode.isKnown(target)) {
            context.setConfidence(Math.min(context.confidence(), INVALID_TARGET_CONFIDENCE_CAP));
        } else if (action.get().isEffectAction() && !EffectType.isKnown(target)) {
            context.setConfidence(Math.min(context.confidence(), INVALID_TARGET_CONFIDENCE_CAP));
        }

        context.setConfidence(Confidence.clamp(context.confidence()));
        context.markValidated();
        return context;
    }
}
