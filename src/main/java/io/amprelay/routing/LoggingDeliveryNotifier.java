package io.amprelay.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingDeliveryNotifier implements DeliveryNotifier {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingDeliveryNotifier.class);

    @Override
    public void notify(DeliveryNotice notice) {
        LOG.info("New message {} for {} (session {}) from {}: {}",
                notice.messageId(),
                notice.recipientName(),
                notice.sessionName() == null ? "-" : notice.sessionName(),
                notice.from(),
                notice.subject());
    }
}
