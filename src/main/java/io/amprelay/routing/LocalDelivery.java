package io.amprelay.routing;

import io.amprelay.agent.AgentRecord;
import io.amprelay.model.Envelope;
import io.amprelay.model.Payload;

import java.io.IOException;

/**
 * Hands a message to a local agent's active delivery channel. A thrown
 * exception means the message was not delivered and must be queued.
 */
public interface LocalDelivery {
    void deliver(AgentRecord recipient, Envelope envelope, Payload payload, String senderPublicKey) throws IOException;

    /**
     * Whether a message already reached the recipient. Consulted after a
     * timed-out attempt; channels that cannot tell answer {@code false}.
     */
    default boolean isDelivered(AgentRecord recipient, String messageId) {
        return false;
    }
}
