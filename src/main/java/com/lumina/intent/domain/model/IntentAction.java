package com.lumina.intent.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 왜: 호스트 앱이 실행할 수 있는 동작을 닫힌 집합으로 고정해 모델 출력의 환각을 걸러내기 위함.
 */
public enum IntentAction {
    SET_RENDER_MODE("set_render_mode"),
    ADD_EFFECT("add_effect"),
    REMOVE_EFFECT("remove_effect"),
    ADJUST_PARAMETER("adjust_parameter"),
    CAPTURE_FRAME("capture_frame"),
    START_RECORDING("start_recording"),
    STOP_RECORDING("stop_recording"),
    RESET("reset"),
    HELP("help"),
    UNKNOWN("unknown");

    private final String value;

    IntentAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<IntentAction> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(action -> action.value.equals(value))
                .findFirst();
    }

    public static boolean isKnown(String value) {
        return fromValue(value).isPresent();
    }

    public boolean isEffectAction() {
        return this == ADD_EFFECT || this == REMOVE_EFFECT;
    }
}
