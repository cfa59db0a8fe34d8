package com.lumina.intent.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "lumina")
public interface AppConfig {

    OrchestratorConfig orchestrator();

    ModelConfig model();

    interface OrchestratorConfig {
        @WithName("rule-confidence-skip-llm")
        @WithDefault("0.9")
        double ruleConfidenceSkipLlm();

        @WithName("max-llm-tokens")
        @WithDefault("96")
        int maxLlmTokens();

        @WithName("max-normalized-length")
        @WithDefault("512")
        int maxNormalizedLength();

        @WithName("default-effect-intensity")
        @WithDefault("0.5")
        double defaultEffectIntensity();

        @WithName("telemetry-enabled")
        @WithDefault("true")
        boolean telemetryEnabled();

        @WithName("max-history")
        @WithDefault("10")
        int maxHistory();
    }

    interface ModelConfig {
        @WithName("assets-path")
        @WithDefault("./data/assets")
        String assetsPath();

        @WithName("model-file-name")
        @WithDefault("qwen-2.5-1.5b-instruct-q4_k_m.gguf")
        String modelFileName();

        @WithName("grammar-file-name")
        @WithDefault("qwen_grammar.gbnf")
        String grammarFileName();

        @WithDefault("openai")
        String backend();

        @WithName("base-url")
        @WithDefault("http://localhost:8081/v1")
        String baseUrl();

        @WithName("model-name")
        Optional<String> modelName();

        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("0.1")
        double temperature();

        @WithName("timeout-seconds")
        @WithDefault("30")
        int timeoutSeconds();
    }
}
