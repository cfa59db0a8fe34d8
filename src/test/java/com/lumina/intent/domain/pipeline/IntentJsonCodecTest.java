package com.lumina.intent.domain.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.domain.model.AiIntent;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntentJsonCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IntentJsonCodec codec = new IntentJsonCodec(objectMapper);

    @Test
    void emptyOrNullParametersEncodeAsEmptyObject() {
        assertThat(codec.encodeParameters(Map.of())).isEqualTo("{}");
        assertThat(codec.encodeParameters(null)).isEqualTo("{}");
    }

    @Test
    void parametersKeepInsertionOrder() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("intensity", 0.8);
        parameters.put("radius", 4);

        assertThat(codec.encodeParameters(parameters)).isEqualTo("{\"intensity\":0.8,\"radius\":4}");
    }

    @Test
    void intentKeepsParametersAsEmbeddedString() throws Exception {
        AiIntent intent = new AiIntent("add_effect", "blur", "{\"intensity\":0.3}", 0.7, 42L);

        String json = codec.encode(intent);
        JsonNode node = objectMapper.readTree(json);

        assertThat(json).startsWith("{\"action\":\"add_effect\",\"target\":\"blur\",\"parameters\":");
        assertThat(node.get("parameters").isTextual()).isTrue();
        assertThat(node.get("parameters").asText()).isEqualTo("{\"intensity\":0.3}");
        assertThat(node.get("confidence").asDouble()).isEqualTo(0.7);
        assertThat(node.get("timestamp").asLong()).isEqualTo(42L);
    }
}
