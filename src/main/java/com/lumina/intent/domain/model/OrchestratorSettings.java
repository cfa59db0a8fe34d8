package com.lumina.intent.domain.model;

/**
 * 왜: 설정 API에 의존하지 않고 도메인이 라우팅 임계값과 자원 한도를 받도록 하기 위함.
 */
public record OrchestratorSettings(double ruleConfidenceSkipLlm,
                                   int maxLlmTokens,
                                   int maxNormalizedLength,
                                   double defaultEffectIntensity,
                                   boolean telemetryEnabled,
                                   int maxHistory,
                                   String defaultAssetsPath,
                                   String modelFileName,
                                   String grammarFileName) {

    public static final double DEFAULT_RULE_CONFIDENCE_SKIP_LLM = 0.9;
    public static final int DEFAULT_MAX_LLM_TOKENS = 96;
    public static final int DEFAULT_MAX_NORMALIZED_LENGTH = 512;
    public static final double DEFAULT_EFFECT_INTENSITY = 0.5;
    public static final String DEFAULT_MODEL_FILE_NAME = "qwen-2.5-1.5b-instruct-q4_k_m.gguf";
    public static final String DEFAULT_GRAMMAR_FILE_NAME = "qwen_grammar.gbnf";

    public OrchestratorSettings {
        if (maxNormalizedLength < 1) {
            throw new IllegalArgumentException("maxNormalizedLength는 1 이상이어야 합니다: " + maxNormalizedLength);
        }
        if (maxLlmTokens < 1) {
            throw new IllegalArgumentException("maxLlmTokens는 1 이상이어야 합니다: " + maxLlmTokens);
        }
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(
                DEFAULT_RULE_CONFIDENCE_SKIP_LLM,
                DEFAULT_MAX_LLM_TOKENS,
                DEFAULT_MAX_NORMALIZED_LENGTH,
                DEFAULT_EFFECT_INTENSITY,
                true,
                IntentHistory.DEFAULT_MAX_ENTRIES,
                "./data/assets",
                DEFAULT_MODEL_FILE_NAME,
                DEFAULT_GRAMMAR_FILE_NAME
        );
    }

    public OrchestratorSettings withRuleConfidenceSkipLlm(double threshold) {
        return new OrchestratorSettings(threshold, maxLlmTokens, maxNormalizedLength, defaultEffectIntensity,
                telemetryEnabled, maxHistory, defaultAssetsPath, modelFileName, grammarFileName);
    }

    public OrchestratorSettings withMaxNormalizedLength(int length) {
        return new OrchestratorSettings(ruleConfidenceSkipLlm, maxLlmTokens, length, defaultEffectIntensity,
                telemetryEnabled, maxHistory, defaultAssetsPath, modelFileName, grammarFileName);
    }

    public OrchestratorSettings withDefaultAssetsPath(String assetsPath) {
        return new OrchestratorSettings(ruleConfidenceSkipLlm, maxLlmTokens, maxNormalizedLength, defaultEffectIntensity,
                telemetryEnabled, maxHistory, assetsPath, modelFileName, grammarFileName);
    }
}
