package com.lumina.intent.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.lumina.intent.domain.exception.InvalidRequestException;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingCommand(String requestId, String text) {

    public IncomingCommand {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(text, "text");
        if (requestId.isBlank()) {
            throw new InvalidRequestException("requestId가 비어 있습니다.");
        }
    }
}
