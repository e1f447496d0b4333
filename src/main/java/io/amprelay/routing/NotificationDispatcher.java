package io.amprelay.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class NotificationDispatcher implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final DeliveryNotifier notifier;
    private final ExecutorService executor;

    public NotificationDispatcher(DeliveryNotifier notifier) {
        this.notifier = notifier;
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "amprelay-notify-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void dispatch(DeliveryNotice notice) {
        try {
            executor.execute(() -> {
                try {
                    notifier.notify(notice);
                } catch (Exception e) {
                    LOG.warn("Delivery notification failed for message {} to {}", notice.messageId(), notice.recipientName(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Notification dispatcher closed; dropping notice for message {}", notice.messageId());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
