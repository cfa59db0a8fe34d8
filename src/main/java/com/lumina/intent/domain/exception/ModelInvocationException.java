package com.lumina.intent.domain.exception;

/**
 * 왜: 모델 로딩/추론 실패를 하나의 예외로 모아 분류 단계가 규칙 결과로 안전하게 되돌아가도록 하기 위함.
 */
public class ModelInvocationException extends RuntimeException {
    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
