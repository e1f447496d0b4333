package io.amprelay.routing;

import io.amprelay.model.Priority;

public record DeliveryNotice(
        String recipientId,
        String recipientName,
        String sessionName,
        String messageId,
        String from,
        String subject,
        Priority priority
) {
}
