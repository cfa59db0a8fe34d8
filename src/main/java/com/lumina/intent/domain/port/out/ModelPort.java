package com.lumina.intent.domain.port.out;

import com.lumina.intent.domain.model.ModelAssets;
import com.lumina.intent.domain.model.ModelPrompt;

/**
 * 왜: 언어 모델의 로딩과 추론을 추상화하여 도메인이 추론 런타임이나 프로토콜에 의존하지 않도록 하기 위함.
 */
public interface ModelPort {

    /**
     * @throws com.lumina.intent.domain.exception.ModelInvocationException if the model cannot be made available
     */
    void load(ModelAssets assets, int maxTokens);

    boolean isLoaded();

    /**
     * @return raw completion text, possibly wrapped in prose
     * @throws com.lumina.intent.domain.exception.ModelInvocationException on inference failure
     */
    String query(ModelPrompt prompt);

    /**
     * Safe to call when nothing is loaded.
     */
    void release();
}
