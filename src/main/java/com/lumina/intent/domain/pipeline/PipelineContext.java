package com.lumina.intent.domain.pipeline;

import com.lumina.intent.domain.dag.NodeTimingRecorder;
import com.lumina.intent.domain.model.AiIntent;
import com.lumina.intent.domain.model.Classification;
import com.lumina.intent.domain.model.ClassificationSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: 다섯 단계가 한 입력에 대해 점진적으로 채우는 상태를 한 객체에 모아, 실행 후에도 진단용으로 남기기 위함.
 *
 * <p>Mutable and confined to one pipeline call.
 */
public class PipelineContext implements NodeTimingRecorder {

    private final String input;
    private final long timestamp;

    private String normalizedInput;
    private String originalInput;
    private boolean truncated;

    private Classification classification;
    private Classification ruleResult;
    private Classification llmResult;

    private String action;
    private String target;
    private Map<String, Object> parameters = Map.of();
    private double confidence;
    private ClassificationSource classificationSource;
    private boolean validated;

    private AiIntent intent;
    private String error;

    private final Map<String, NodeTiming> nodeTimings = new LinkedHashMap<>();

    public PipelineContext(String input, long timestamp) {
        this.input = input == null ? "" : input;
        this.timestamp = timestamp;
    }

    @Override
    public void recordNodeTiming(String nodeName, double elapsedMs) {
        nodeTimings.put(nodeName, new NodeTiming(elapsedMs));
    }

    public Map<String, NodeTiming> nodeTimings() {
        return Collections.unmodifiableMap(nodeTimings);
    }

    public String input() {
        return input;
    }

    public long timestamp() {
        return timestamp;
    }

    public String normalizedInput() {
        return normalizedInput;
    }

    public void setNormalizedInput(String normalizedInput) {
        this.normalizedInput = normalizedInput;
    }

    public String originalInput() {
        return originalInput;
    }

    public void setOriginalInput(String originalInput) {
        this.originalInput = originalInput;
    }

    public boolean truncated() {
        return truncated;
    }

    public void markTruncated() {
        this.truncated = true;
    }

    public Classification classification() {
        return classification;
    }

    public void setClassification(Classification classification) {
        this.classification = classification;
    }

    public Optional<Classification> ruleResult() {
        return Optional.ofNullable(ruleResult);
    }

    public void setRuleResult(Classification ruleResult) {
        this.ruleResult = ruleResult;
    }

    public Optional<Classification> llmResult() {
        return Optional.ofNullable(llmResult);
    }

    public void setLlmResult(Classification llmResult) {
        this.llmResult = llmResult;
    }

    public String action() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String target() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters == null ? Map.of() : parameters;
    }

    public double confidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public Optional<ClassificationSource> classificationSource() {
        return Optional.ofNullable(classificationSource);
    }

    public void setClassificationSource(ClassificationSource classificationSource) {
        this.classificationSource = classificationSource;
    }

    public boolean validated() {
        return validated;
    }

    public void markValidated() {
        this.validated = true;
    }

    public Optional<AiIntent> intent() {
        return Optional.ofNullable(intent);
    }

    public void setIntent(AiIntent intent) {
        this.intent = intent;
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public void setError(String error) {
        this.error = error;
    }

    public record NodeTiming(double ms) {
    }
}
