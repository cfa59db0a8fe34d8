package com.lumina.intent.config;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        AppConfig.OrchestratorConfig orchestrator = appConfig.orchestrator();
        validateUnitInterval("lumina.orchestrator.rule-confidence-skip-llm", orchestrator.ruleConfidenceSkipLlm());
        validateUnitInterval("lumina.orchestrator.default-effect-intensity", orchestrator.defaultEffectIntensity());
        validatePositive("lumina.orchestrator.max-llm-tokens", orchestrator.maxLlmTokens());
        validatePositive("lumina.orchestrator.max-normalized-length", orchestrator.maxNormalizedLength());
        validatePositive("lumina.orchestrator.max-history", orchestrator.maxHistory());
        validatePositive("lumina.model.timeout-seconds", appConfig.model().timeoutSeconds());
        validateAssetsPath(appConfig.model().assetsPath());
    }

    void validateUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalStateException("설정 값은 0.0~1.0 범위여야 합니다: " + name + "=" + value);
        }
    }

    void validatePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalStateException("설정 값은 1 이상이어야 합니다: " + name + "=" + value);
        }
    }

    private void validateAssetsPath(String path) {
        if (!Files.isDirectory(Path.of(path))) {
            // 자산이 없으면 규칙 전용 모드로 동작하므로 경고만 남긴다
            log.warn("자산 경로가 존재하지 않습니다: lumina.model.assets-path=" + path);
        }
    }
}
