package com.lumina.intent.domain.classifier;

import com.lumina.intent.domain.model.Classification;
import com.lumina.intent.domain.port.out.ModelPort;

import java.util.Optional;

/**
 * 왜: 프롬프트 구성, 모델 호출, 응답 정규화를 한 경로로 묶어 분류 단계가 모델 세부사항을 모르게 하기 위함.
 */
public class LlmClassifier {

    private final ModelPort modelPort;
    private final PromptBuilder promptBuilder;
    private final ModelOutputParser outputParser;
    private final ClassificationMerger merger;

    public LlmClassifier(ModelPort modelPort,
                         PromptBuilder promptBuilder,
                         ModelOutputParser outputParser,
                         ClassificationMerger merger) {
        this.modelPort = modelPort;
        this.promptBuilder = promptBuilder;
        this.outputParser = outputParser;
        this.merger = merger;
    }

    public boolean isAvailable() {
        return modelPort.isLoaded();
    }

    /**
     * Invocation failures propagate as {@link com.lumina.intent.domain.exception.ModelInvocationException};
     * unparseable output yields empty.
     */
    public Optional<Classification> classify(String normalizedInput) {
        String raw = modelPort.query(promptBuilder.build(normalizedInput));
        return outputParser.firstJsonObject(raw).flatMap(merger::normalize);
    }
}
