package com.enterprise.orchestration.bus;

/**
 * Receives messages delivered to a subscriber.
 * Called from the delivery tick, one message at a time, in publish order.
 */
@FunctionalInterface
public interface MessageSink {

    void onMessage(Message message) throws Exception;
}
