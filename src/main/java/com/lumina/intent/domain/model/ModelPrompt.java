package com.lumina.intent.domain.model;

import java.util.Objects;

/**
 * 왜: 모델 어댑터가 프롬프트 구성 방식을 몰라도 되도록 시스템/사용자 메시지를 완성된 형태로 넘기기 위함.
 */
public record ModelPrompt(String systemMessage, String userMessage) {
    public ModelPrompt {
        Objects.requireNonNull(systemMessage, "systemMessage");
        Objects.requireNonNull(userMessage, "userMessage");
    }
}
