package com.lumina.intent.domain.classifier;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: 소형 모델이 JSON 앞뒤에 설명 문장을 덧붙여도 첫 번째 온전한 JSON 객체만 골라 쓰기 위함.
 */
public class ModelOutputParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ModelOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Scans every {@code '{'} left to right and returns the first position that parses as a complete
     * JSON object. Trailing text after the object is ignored.
     */
    public Optional<Map<String, Object>> firstJsonObject(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return Optional.empty();
        }
        int start = rawText.indexOf('{');
        while (start >= 0) {
            Optional<Map<String, Object>> parsed = tryParseAt(rawText, start);
            if (parsed.isPresent()) {
                return parsed;
            }
            start = rawText.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private Optional<Map<String, Object>> tryParseAt(String rawText, int start) {
        try (JsonParser parser = objectMapper.getFactory().createParser(rawText.substring(start))) {
            JsonNode node = objectMapper.readTree(parser);
            if (node != null && node.isObject()) {
                return Optional.of(objectMapper.convertValue(node, MAP_TYPE));
            }
        } catch (IOException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
