package com.lumina.intent.domain.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.domain.classifier.ClassificationMerger;
import com.lumina.intent.domain.classifier.IntensityExtractor;
import com.lumina.intent.domain.classifier.LlmClassifier;
import com.lumina.intent.domain.classifier.ModelOutputParser;
import com.lumina.intent.domain.classifier.PromptBuilder;
import com.lumina.intent.domain.classifier.RuleClassifier;
import com.lumina.intent.domain.dag.DagNode;
import com.lumina.intent.domain.model.OrchestratorSettings;
import com.lumina.intent.domain.port.out.ModelPort;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 왜: 다섯 단계 노드와 실행 순서를 한 번만 조립해 오케스트레이터 인스턴스 수명 동안 고정하기 위함.
 */
public final class IntentPipeline {

    private final Map<String, DagNode<PipelineContext>> nodes;
    private final List<String> order;

    public IntentPipeline(Map<String, DagNode<PipelineContext>> nodes, List<String> order) {
        this.nodes = Map.copyOf(nodes);
        this.order = List.copyOf(order);
    }

    public static IntentPipeline standard(OrchestratorSettings settings, ModelPort modelPort, ObjectMapper objectMapper) {
        ClassificationMerger merger = new ClassificationMerger(objectMapper);
        RuleClassifier ruleClassifier = new RuleClassifier(new IntensityExtractor());
        LlmClassifier llmClassifier = new LlmClassifier(modelPort, new PromptBuilder(),
                new ModelOutputParser(objectMapper), merger);

        Map<String, DagNode<PipelineContext>> nodes = new LinkedHashMap<>();
        nodes.put(StageNames.PREPROCESS, DagNode.root(StageNames.PREPROCESS,
                new PreprocessStage(settings.maxNormalizedLength())));
        nodes.put(StageNames.CLASSIFY, DagNode.after(StageNames.PREPROCESS, StageNames.CLASSIFY,
                new ClassifyStage(ruleClassifier, llmClassifier, merger, settings.ruleConfidenceSkipLlm())));
        nodes.put(StageNames.EXTRACT, DagNode.after(StageNames.CLASSIFY, StageNames.EXTRACT,
                new ExtractStage(settings.defaultEffectIntensity())));
        nodes.put(StageNames.VALIDATE, DagNode.after(StageNames.EXTRACT, StageNames.VALIDATE,
                new ValidateStage()));
        nodes.put(StageNames.FINALIZE, DagNode.after(StageNames.VALIDATE, StageNames.FINALIZE,
                new FinalizeStage(new IntentJsonCodec(objectMapper))));
        return new IntentPipeline(nodes, StageNames.EXECUTION_ORDER);
    }

    /**
     * Returns a copy with {@code node} added or replacing the node of the same name. Diagnostics only.
     */
    public IntentPipeline withNode(DagNode<PipelineContext> node) {
        Map<String, DagNode<PipelineContext>> copy = new LinkedHashMap<>(nodes);
        copy.put(node.name(), node);
        return new IntentPipeline(copy, order);
    }

    public Map<String, DagNode<PipelineContext>> nodes() {
        return nodes;
    }

    public List<String> order() {
        return order;
    }
}
