package com.lumina.intent.domain.port.out;

import java.time.Instant;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 의도 타임스탬프를 테스트에서 고정할 수 있도록 하기 위함.
 */
public interface ClockPort {
    Instant now();
}
