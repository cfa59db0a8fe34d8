package com.lumina.intent.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.domain.model.IntentReply;
import com.lumina.intent.domain.port.out.IntentReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 해석된 의도를 RabbitMQ로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 */
@ApplicationScoped
public class RabbitIntentReplyProducer implements IntentReplyPort {

    private static final Logger log = Logger.getLogger(RabbitIntentReplyProducer.class);

    private final Emitter<String> replyEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitIntentReplyProducer(@Channel("intent-replies") Emitter<String> replyEmitter,
                                     ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(IntentReply reply) {
        try {
            replyEmitter.send(objectMapper.writeValueAsString(reply));
        } catch (JsonProcessingException e) {
            log.warnf("의도 응답 직렬화 실패: requestId=%s, %s", reply.requestId(), e.getMessage());
        }
    }
}
