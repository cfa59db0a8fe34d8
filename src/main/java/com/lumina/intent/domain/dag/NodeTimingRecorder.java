package com.lumina.intent.domain.dag;

/**
 * 왜: 실행기가 컨텍스트의 구체 타입을 몰라도 노드별 소요 시간을 기록할 수 있게 하기 위함.
 */
public interface NodeTimingRecorder {
    void recordNodeTiming(String nodeName, double elapsedMs);
}
