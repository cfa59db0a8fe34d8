package com.lumina.intent.domain.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.domain.model.AiIntent;

import java.util.Map;

/**
 * 왜: 파라미터 문자열 인코딩과 의도 JSON 인코딩을 한 곳에 모아 호스트와의 고정 구조체 계약을 지키기 위함.
 */
public class IntentJsonCodec {

    private final ObjectMapper objectMapper;

    public IntentJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return {@code "{}"} for empty parameters, the JSON object text otherwise
     */
    public String encodeParameters(Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return AiIntent.EMPTY_PARAMETERS;
        }
        try {
            return objectMapper.writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("파라미터 직렬화 실패: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Encodes the intent with {@code parameters} kept as an embedded JSON string.
     */
    public String encode(AiIntent intent) {
        try {
            return objectMapper.writeValueAsString(intent);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("의도 직렬화 실패: " + e.getOriginalMessage(), e);
        }
    }
}
