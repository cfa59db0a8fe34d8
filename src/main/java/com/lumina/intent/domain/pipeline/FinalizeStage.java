package com.lumina.intent.domain.pipeline;

import com.lumina.intent.domain.dag.NodeProcessor;
import com.lumina.intent.domain.model.AiIntent;
import com.lumina.intent.domain.model.IntentAction;

public class FinalizeStage implements NodeProcessor<PipelineContext> {

    private final IntentJsonCodec codec;

    public FinalizeStage(IntentJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    public PipelineContext process(String input, PipelineContext context) {
        String action = context.action() == null ? IntentAction.UNKNOWN.value() : context.action();
        AiIntent intent = new AiIntent(
                action,
                context.target(),
                codec.encodeParameters(context.parameters()),
                context.confidence(),
                context.timestamp()
        );
        context.setIntent(intent);
        return context;
    }
}
