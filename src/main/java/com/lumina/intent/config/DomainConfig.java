package com.lumina.intent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.adapter.out.clock.SystemClockAdapter;
import com.lumina.intent.domain.model.OrchestratorSettings;
import com.lumina.intent.domain.port.in.ParseIntentUseCase;
import com.lumina.intent.domain.port.out.ClockPort;
import com.lumina.intent.domain.port.out.ModelPort;
import com.lumina.intent.domain.service.IntentOrchestrator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public ParseIntentUseCase parseIntentUseCase(AppConfig appConfig,
                                                 ModelPort modelPort,
                                                 ClockPort clockPort,
                                                 ObjectMapper objectMapper) {
        return new IntentOrchestrator(toSettings(appConfig), modelPort, clockPort, objectMapper);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }

    static OrchestratorSettings toSettings(AppConfig appConfig) {
        AppConfig.OrchestratorConfig orchestrator = appConfig.orchestrator();
        AppConfig.ModelConfig model = appConfig.model();
        return new OrchestratorSettings(
                orchestrator.ruleConfidenceSkipLlm(),
                orchestrator.maxLlmTokens(),
                orchestrator.maxNormalizedLength(),
                orchestrator.defaultEffectIntensity(),
                orchestrator.telemetryEnabled(),
                orchestrator.maxHistory(),
                model.assetsPath(),
                model.modelFileName(),
                model.grammarFileName()
        );
    }
}
