package com.lumina.intent.config;

import com.lumina.intent.domain.port.in.ParseIntentUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * 왜: 애플리케이션 기동 시 모델을 미리 찾아 첫 요청 지연을 없애고, 종료 시 모델 핸들을 반드시 해제하기 위함.
 */
@Startup
@ApplicationScoped
public class OrchestratorLifecycle {

    private final ParseIntentUseCase parseIntentUseCase;
    private final AppConfig appConfig;

    public OrchestratorLifecycle(ParseIntentUseCase parseIntentUseCase, AppConfig appConfig) {
        this.parseIntentUseCase = parseIntentUseCase;
        this.appConfig = appConfig;
    }

    @PostConstruct
    void start() {
        parseIntentUseCase.initialize(appConfig.model().assetsPath());
    }

    @PreDestroy
    void stop() {
        parseIntentUseCase.shutdown();
    }
}
