package com.lumina.intent.domain.pipeline;

import com.lumina.intent.domain.classifier.ClassificationMerger;
import com.lumina.intent.domain.classifier.LlmClassifier;
import com.lumina.intent.domain.classifier.RuleClassifier;
import com.lumina.intent.domain.dag.NodeProcessor;
import com.lumina.intent.domain.model.Classification;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * 왜: 규칙 분류가 이미 확신하는 경우 모델 호출을 건너뛰고, 모델 실패는 규칙 결과로 흡수하기 위함.
 */
public class ClassifyStage implements NodeProcessor<PipelineContext> {

    private static final Logger log = Logger.getLogger(ClassifyStage.class);

    static final String EMPTY_INPUT_REASON = "empty_input";

    private final RuleClassifier ruleClassifier;
    private final LlmClassifier llmClassifier;
    private final ClassificationMerger merger;
    private final double ruleConfidenceSkipLlm;

    public ClassifyStage(RuleClassifier ruleClassifier,
                         LlmClassifier llmClassifier,
                         ClassificationMerger merger,
                         double ruleConfidenceSkipLlm) {
        this.ruleClassifier = ruleClassifier;
        this.llmClassifier = llmClassifier;
        this.merger = merger;
        this.ruleConfidenceSkipLlm = ruleConfidenceSkipLlm;
    }

    @Override
    public PipelineContext process(String input, PipelineContext context) {
        String normalized = context.normalizedInput();
        if (normalized == null || normalized.isEmpty()) {
            Classification guardrail = merger.unknownClassification(EMPTY_INPUT_REASON);
            context.setClassification(guardrail);
            context.setConfidence(guardrail.confidence());
            return context;
        }

        Classification rule = ruleClassifier.classify(normalized);
        Optional<Classification> model = Optional.empty();
        if (rule.confidence() < ruleConfidenceSkipLlm && llmClassifier.isAvailable()) {
            try {
                model = llmClassifier.classify(normalized);
                model.ifPresent(context::setLlmResult);
            } catch (RuntimeException e) {
                log.warnf("모델 질의 실패, 규칙 결과로 진행합니다: %s", e.getMessage());
                model = Optional.empty();
            }
        }

        Classification merged = merger.merge(model, rule);
        context.setClassification(merged);
        context.setRuleResult(rule);
        context.setConfidence(merged.confidence());
        return context;
    }
}
