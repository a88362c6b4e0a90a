package io.agentledger.bus;

import io.agentledger.model.Message;

@FunctionalInterface
public interface MessageHandler {
    void handle(Message message);
}
