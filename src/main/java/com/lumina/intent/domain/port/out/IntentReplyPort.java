package com.lumina.intent.domain.port.out;

import com.lumina.intent.domain.model.IntentReply;

public interface IntentReplyPort {
    void send(IntentReply reply);
}
