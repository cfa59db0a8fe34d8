package com.lumina.intent.domain.port.in;

import com.lumina.intent.domain.model.AiIntent;
import com.lumina.intent.domain.pipeline.PipelineContext;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 호스트 앱의 자연어 명령을 도메인 진입점 하나로 수렴시켜 초기화, 해석, 종료를 일관되게 처리하기 위함.
 */
public interface ParseIntentUseCase {

    /**
     * Locates the model and optional grammar file under {@code assetsPath}. Missing files degrade to
     * rule-only mode and still count as success.
     */
    boolean initialize(String assetsPath);

    /**
     * Never throws; internal failures surface as an {@code unknown} intent with very low confidence.
     */
    AiIntent parseIntent(String text);

    /**
     * Same as {@link #parseIntent(String)}, encoded as JSON with {@code parameters} as an embedded JSON string.
     */
    String parseIntentJson(String text);

    List<AiIntent> history();

    Optional<PipelineContext> lastContext();

    boolean isInitialized();

    boolean isModelLoaded();

    /**
     * Releases the model. No-op when already shut down.
     */
    void shutdown();
}
