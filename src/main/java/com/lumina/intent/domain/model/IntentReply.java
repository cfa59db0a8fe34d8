package com.lumina.intent.domain.model;

import java.util.Objects;

/**
 * 왜: 요청 식별자와 해석 결과를 묶어 비동기 응답 채널에서도 요청과 결과를 짝지을 수 있게 하기 위함.
 */
public record IntentReply(String requestId, AiIntent intent) {
    public IntentReply {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(intent, "intent");
    }
}
