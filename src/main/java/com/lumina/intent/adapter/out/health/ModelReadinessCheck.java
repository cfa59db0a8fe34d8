package com.lumina.intent.adapter.out.health;

import com.lumina.intent.config.AppConfig;
import com.lumina.intent.domain.port.in.ParseIntentUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * 왜: 규칙 전용 모드도 정상 상태이므로, 모델 유무가 아닌 초기화 여부로 준비 상태를 판단하기 위함.
 */
@Readiness
@ApplicationScoped
public class ModelReadinessCheck implements HealthCheck {

    private final ParseIntentUseCase parseIntentUseCase;
    private final AppConfig appConfig;

    public ModelReadinessCheck(ParseIntentUseCase parseIntentUseCase, AppConfig appConfig) {
        this.parseIntentUseCase = parseIntentUseCase;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("intent-orchestrator")
                .withData("mode", parseIntentUseCase.isModelLoaded() ? "llm" : "mock")
                .withData("assetsPath", appConfig.model().assetsPath())
                .withData("historySize", parseIntentUseCase.history().size())
                .status(parseIntentUseCase.isInitialized())
                .build();
    }
}
