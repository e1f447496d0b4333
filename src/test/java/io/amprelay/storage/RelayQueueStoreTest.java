package io.amprelay.storage;

import io.amprelay.TestSupport;
import io.amprelay.TestSupport.MutableClock;
import io.amprelay.config.AmpRelayConfig;
import io.amprelay.model.Envelope;
import io.amprelay.model.Payload;
import io.amprelay.model.PayloadType;
import io.amprelay.model.Priority;
import io.amprelay.model.RelayEntry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class RelayQueueStoreTest {
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    @Test
    void pendingReturnsOldestFirstAndCountsAttempts() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-relay-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            RelayQueueStore queue = newQueue(root, clock);
            Envelope first = envelope(clock, "first");
            clock.advanceMillis(10L);
            Envelope second = envelope(clock, "second");
            clock.advanceMillis(10L);
            Envelope third = envelope(clock, "third");
            queue.enqueue("agent-bob", third, payload("3"), "pk");
            clock.advanceMillis(1L);
            queue.enqueue("agent-bob", first, payload("1"), "pk");
            clock.advanceMillis(1L);
            queue.enqueue("agent-bob", second, payload("2"), "pk");

            RelayQueueStore.PendingMessages page = queue.pending("agent-bob", 2);
            Assertions.assertEquals(2, page.count());
            Assertions.assertEquals(1, page.remaining());
            Assertions.assertEquals(third.id(), page.messages().get(0).id());
            Assertions.assertEquals(first.id(), page.messages().get(1).id());
            Assertions.assertEquals(1, page.messages().get(0).attempts());
            Assertions.assertEquals("pk", page.messages().get(0).senderPublicKey());

            RelayQueueStore.PendingMessages again = queue.pending("agent-bob", 10);
            Assertions.assertEquals(3, again.count());
            Assertions.assertEquals(2, again.messages().get(0).attempts());
            Assertions.assertEquals(1, again.messages().get(2).attempts());
            Assertions.assertEquals(0, queue.pending("agent-alice", 10).count());
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void enqueueIsIdempotentPerRecipientAndMessage() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-relay-idem-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            RelayQueueStore queue = newQueue(root, clock);
            Envelope env = envelope(clock, "once");
            RelayEntry a = queue.enqueue("bob", env, payload("original"), null);
            clock.advanceMillis(5_000L);
            RelayEntry b = queue.enqueue("bob", env, payload("changed"), null);
            Assertions.assertEquals(a.queuedAt(), b.queuedAt());
            Assertions.assertEquals("original", b.payload().message());
            Assertions.assertEquals(1, queue.count("bob"));
            queue.enqueue("carol", env, payload("original"), null);
            Assertions.assertEquals(1, queue.count("carol"));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void acknowledgeRemovesMessagesAndBatchIsBounded() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-relay-ack-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            RelayQueueStore queue = newQueue(root, clock);
            Envelope a = envelope(clock, "a");
            Envelope b = envelope(clock, "b");
            Envelope c = envelope(clock, "c");
            queue.enqueue("bob", a, payload("a"), null);
            queue.enqueue("bob", b, payload("b"), null);
            queue.enqueue("bob", c, payload("c"), null);

            Assertions.assertTrue(queue.acknowledge("bob", a.id()));
            Assertions.assertFalse(queue.acknowledge("bob", a.id()));
            Assertions.assertFalse(queue.acknowledge("carol", b.id()));
            Assertions.assertEquals(2, queue.acknowledgeBatch("bob", List.of(b.id(), c.id(), c.id(), "msg_missing")));
            Assertions.assertEquals(0, queue.count("bob"));

            List<String> tooMany = new ArrayList<>();
            for (int i = 0; i <= AmpRelayConfig.MAX_ACK_BATCH; i++) {
                tooMany.add("msg_" + i);
            }
            Assertions.assertThrows(IllegalArgumentException.class, () -> queue.acknowledgeBatch("bob", tooMany));
            Assertions.assertThrows(IllegalArgumentException.class, () -> queue.acknowledgeBatch("bob", List.of()));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void expiredEntriesAreHiddenAndSwept() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-relay-expiry-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            RelayQueueStore queue = newQueue(root, clock);
            queue.enqueue("bob", envelope(clock, "old"), payload("old"), null);
            clock.advanceMillis(6L * DAY_MS);
            queue.enqueue("bob", envelope(clock, "new"), payload("new"), null);
            clock.advanceMillis(DAY_MS + 1L);

            RelayQueueStore.PendingMessages page = queue.pending("bob", 10);
            Assertions.assertEquals(1, page.count());
            Assertions.assertEquals("new", page.messages().get(0).payload().message());
            Assertions.assertEquals(0, queue.expireAll());
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void lookupFallsBackToNameOnlyWhenIdHasNothing() throws Exception {
        Path root = Files.createTempDirectory("amprelay-test-relay-fallback-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            RelayQueueStore queue = newQueue(root, clock);
            Envelope byName = envelope(clock, "queued before bob existed");
            queue.enqueue("bob", byName, payload("by name"), null);

            RelayQueueStore.PendingMessages fallback = queue.pendingFor("agent-bob", "bob", 10);
            Assertions.assertEquals(1, fallback.count());
            Assertions.assertEquals(byName.id(), fallback.messages().get(0).id());

            Envelope byId = envelope(clock, "queued for id");
            queue.enqueue("agent-bob", byId, payload("by id"), null);
            RelayQueueStore.PendingMessages preferred = queue.pendingFor("agent-bob", "bob", 10);
            Assertions.assertEquals(1, preferred.count());
            Assertions.assertEquals(byId.id(), preferred.messages().get(0).id());

            Assertions.assertTrue(queue.acknowledgeFor("agent-bob", "bob", byName.id()));
            Assertions.assertEquals(1, queue.acknowledgeBatchFor("agent-bob", "bob", List.of(byId.id())));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void limitIsClampedToDefaultAndMaximum() {
        Assertions.assertEquals(AmpRelayConfig.DEFAULT_PENDING_LIMIT, RelayQueueStore.clampLimit(0));
        Assertions.assertEquals(AmpRelayConfig.DEFAULT_PENDING_LIMIT, RelayQueueStore.clampLimit(-5));
        Assertions.assertEquals(25, RelayQueueStore.clampLimit(25));
        Assertions.assertEquals(AmpRelayConfig.MAX_PENDING_LIMIT, RelayQueueStore.clampLimit(5_000));
    }

    private static RelayQueueStore newQueue(Path root, MutableClock clock) {
        Database db = new Database(AmpRelayConfig.fromRoot(root.toString()));
        db.init();
        return new RelayQueueStore(db, clock);
    }

    private static Envelope envelope(MutableClock clock, String subject) {
        return Envelope.create("alice@acme.aimaestro.local", "bob@acme.aimaestro.local", subject, Priority.NORMAL, null, clock);
    }

    private static Payload payload(String message) {
        return Payload.of(PayloadType.NOTIFICATION, message);
    }
}
