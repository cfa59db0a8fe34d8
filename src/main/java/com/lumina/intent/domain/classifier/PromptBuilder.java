package com.lumina.intent.domain.classifier;

import com.lumina.intent.domain.model.EffectType;
import com.lumina.intent.domain.model.IntentAction;
import com.lumina.intent.domain.model.ModelPrompt;
import com.lumina.intent.domain.model.RenderMode;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 왜: 모델이 닫힌 어휘와 응답 형식 안에서만 답하도록 어휘 목록에서 시스템 프롬프트를 만들기 위함.
 */
public class PromptBuilder {

    private final String systemMessage;

    public PromptBuilder() {
        this.systemMessage = buildSystemMessage();
    }

    public ModelPrompt build(String normalizedInput) {
        return new ModelPrompt(systemMessage, normalizedInput);
    }

    private static String buildSystemMessage() {
        String modes = Arrays.stream(RenderMode.values())
                .map(RenderMode::wireName)
                .collect(Collectors.joining(", "));
        String effects = Arrays.stream(EffectType.values())
                .filter(effect -> effect != EffectType.NONE)
                .map(EffectType::wireName)
                .collect(Collectors.joining(", "));
        String actions = Arrays.stream(IntentAction.values())
                .map(IntentAction::value)
                .collect(Collectors.joining(", "));
        return """
                You are the command parser of Lumina Virtual Studio, a real-time video effects application.
                Parse the user request into one structured intent. Respond ONLY with valid JSON.

                Allowed actions: %s
                Render modes (target of set_render_mode): %s
                Effects (target of add_effect / remove_effect): %s

                Response format:
                {"action": "<action>", "target": "<target>", "parameters": "<json_params>", "confidence": <0.0-1.0>}

                Examples:
                User: make it look dreamy
                {"action": "add_effect", "target": "bloom", "parameters": "{\\"intensity\\": 0.7}", "confidence": 0.85}

                User: show depth
                {"action": "set_render_mode", "target": "depth_map", "parameters": "{}", "confidence": 0.95}
                """.formatted(actions, modes, effects);
    }
}
