package com.lumina.intent.domain.classifier;

import com.lumina.intent.domain.model.Classification;
import com.lumina.intent.domain.model.EffectType;
import com.lumina.intent.domain.model.IntentAction;
import com.lumina.intent.domain.model.RenderMode;

import java.util.List;
import java.util.Map;

/**
 * 왜: 모델 없이도 키워드만으로 결정론적인 분류를 제공해 저렴한 경로를 기본으로 삼기 위함.
 *
 * <p>Tables are checked in order (render mode, then effect, then control words) and the first hit
 * wins. Some keywords overlap across categories ("normal", "clear", "frame"); the table order is
 * what resolves them.
 */
public class RuleClassifier {

    static final double RENDER_MODE_CONFIDENCE = 0.75;
    static final double EFFECT_CONFIDENCE = 0.7;
    static final double CAPTURE_CONFIDENCE = 0.9;
    static final double RECORDING_CONFIDENCE = 0.85;
    static final double RESET_CONFIDENCE = 0.9;
    static final double HELP_CONFIDENCE = 0.95;
    static final double NO_MATCH_CONFIDENCE = 0.5;

    private static final List<Map.Entry<RenderMode, List<String>>> RENDER_MODE_KEYWORDS = List.of(
            Map.entry(RenderMode.PASSTHROUGH, List.of("normal", "passthrough", "original", "clear")),
            Map.entry(RenderMode.STYLIZED, List.of("stylize", "artistic", "style", "paint")),
            Map.entry(RenderMode.SEGMENTED, List.of("segment", "separate", "isolate", "mask")),
            Map.entry(RenderMode.DEPTH_MAP, List.of("depth", "3d", "distance")),
            Map.entry(RenderMode.NORMAL_MAP, List.of("normal", "surface", "bumps"))
    );

    private static final List<Map.Entry<EffectType, List<String>>> EFFECT_KEYWORDS = List.of(
            Map.entry(EffectType.BLUR, List.of("blur", "soft", "smooth", "fuzzy")),
            Map.entry(EffectType.BLOOM, List.of("bloom", "glow", "dreamy", "ethereal")),
            Map.entry(EffectType.COLOR_GRADE, List.of("color", "grade", "tint", "warm", "cool")),
            Map.entry(EffectType.VIGNETTE, List.of("vignette", "border", "frame", "dark edges")),
            Map.entry(EffectType.CHROMATIC_ABERRATION, List.of("chromatic", "rgb split", "glitch")),
            Map.entry(EffectType.NOISE, List.of("noise", "grain", "film", "vintage")),
            Map.entry(EffectType.SHARPEN, List.of("sharpen", "crisp", "detail", "enhance"))
    );

    private static final List<String> REMOVE_WORDS = List.of("remove", "off");
    private static final List<String> CAPTURE_WORDS = List.of("capture", "screenshot", "photo", "snap");
    private static final List<String> RECORD_WORDS = List.of("record", "start recording", "video");
    private static final List<String> STOP_WORDS = List.of("stop", "end recording");
    private static final List<String> RESET_WORDS = List.of("reset", "clear", "default");
    private static final List<String> HELP_WORDS = List.of("help", "what can", "how to");

    private final IntensityExtractor intensityExtractor;

    public RuleClassifier(IntensityExtractor intensityExtractor) {
        this.intensityExtractor = intensityExtractor;
    }

    /**
     * @param normalized lower-cased, trimmed input
     */
    public Classification classify(String normalized) {
        for (Map.Entry<RenderMode, List<String>> entry : RENDER_MODE_KEYWORDS) {
            if (IntensityExtractor.containsAny(normalized, entry.getValue())) {
                return Classification.rule(IntentAction.SET_RENDER_MODE, entry.getKey().wireName(), Map.of(),
                        RENDER_MODE_CONFIDENCE);
            }
        }

        for (Map.Entry<EffectType, List<String>> entry : EFFECT_KEYWORDS) {
            if (IntensityExtractor.containsAny(normalized, entry.getValue())) {
                IntentAction action = IntensityExtractor.containsAny(normalized, REMOVE_WORDS)
                        ? IntentAction.REMOVE_EFFECT
                        : IntentAction.ADD_EFFECT;
                Map<String, Object> parameters = intensityExtractor.extract(normalized)
                        .<Map<String, Object>>map(intensity -> Map.of("intensity", intensity))
                        .orElse(Map.of());
                return Classification.rule(action, entry.getKey().wireName(), parameters, EFFECT_CONFIDENCE);
            }
        }

        if (IntensityExtractor.containsAny(normalized, CAPTURE_WORDS)) {
            return control(IntentAction.CAPTURE_FRAME, CAPTURE_CONFIDENCE);
        } else if (IntensityExtractor.containsAny(normalized, RECORD_WORDS)) {
            return control(IntentAction.START_RECORDING, RECORDING_CONFIDENCE);
        } else if (IntensityExtractor.containsAny(normalized, STOP_WORDS)) {
            return control(IntentAction.STOP_RECORDING, RECORDING_CONFIDENCE);
        } else if (IntensityExtractor.containsAny(normalized, RESET_WORDS)) {
            return control(IntentAction.RESET, RESET_CONFIDENCE);
        } else if (IntensityExtractor.containsAny(normalized, HELP_WORDS)) {
            return control(IntentAction.HELP, HELP_CONFIDENCE);
        }

        return control(IntentAction.UNKNOWN, NO_MATCH_CONFIDENCE);
    }

    private static Classification control(IntentAction action, double confidence) {
        return Classification.rule(action, "", Map.of(), confidence);
    }
}
