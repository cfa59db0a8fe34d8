package com.lumina.intent.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.domain.exception.InvalidRequestException;
import com.lumina.intent.domain.model.AiIntent;
import com.lumina.intent.domain.model.IntentReply;
import com.lumina.intent.domain.port.in.ParseIntentUseCase;
import com.lumina.intent.domain.port.out.IntentReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * 왜: RabbitMQ로 들어온 자연어 명령을 도메인 유스케이스로 진입시키는 단일 경로를 제공하기 위함.
 */
@ApplicationScoped
public class IntentRequestConsumer {

    private static final Logger log = Logger.getLogger(IntentRequestConsumer.class);

    private final ParseIntentUseCase parseIntentUseCase;
    private final IntentReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public IntentRequestConsumer(ParseIntentUseCase parseIntentUseCase,
                                 IntentReplyPort replyPort,
                                 ObjectMapper objectMapper) {
        this.parseIntentUseCase = parseIntentUseCase;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("intent-requests")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            IncomingCommand command;
            try {
                command = objectMapper.readValue(message.getPayload(), IncomingCommand.class);
            } catch (IOException | InvalidRequestException e) {
                log.warnf("요청 파싱 실패로 처리 중단: %s", e.getMessage());
                return null;
            }
            MDC.put("requestId", command.requestId());
            try {
                AiIntent intent = parseIntentUseCase.parseIntent(command.text());
                log.debugf("의도 해석 완료: action=%s target=%s confidence=%.2f",
                        intent.action(), intent.target(), intent.confidence());
                replyPort.send(new IntentReply(command.requestId(), intent));
            } finally {
                MDC.remove("requestId");
            }
            return null;
        }).onItemOrFailure().transformToUni((ignored, failure) -> {
            if (failure == null) {
                return Uni.createFrom().completionStage(message.ack());
            }
            log.errorf(failure, "의도 응답 전송 실패, 메시지를 nack 합니다: %s", failure.getMessage());
            return Uni.createFrom().completionStage(message.nack(failure));
        });
    }
}
