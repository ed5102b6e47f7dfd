package com.agentbridge.messaging;

import com.agentbridge.model.InboundMessage;

@FunctionalInterface
public interface InboundMessageListener {
    void onMessage(InboundMessage message);
}
