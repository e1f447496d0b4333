package io.amprelay.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.amprelay.agent.AgentRecord;
import io.amprelay.model.Envelope;
import io.amprelay.model.Payload;
import io.amprelay.util.Hashing;
import io.amprelay.util.Jsons;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

public final class InboxDelivery implements LocalDelivery {
    private final Path inboxRoot;
    private final Clock clock;

    public InboxDelivery(Path inboxRoot, Clock clock) {
        this.inboxRoot = inboxRoot;
        this.clock = clock;
    }

    @Override
    public void deliver(AgentRecord recipient, Envelope envelope, Payload payload, String senderPublicKey) throws IOException {
        Path dir = inboxDir(recipient.id());
        Files.createDirectories(dir);
        ObjectNode row = Jsons.mapper().createObjectNode();
        row.set("envelope", Jsons.mapper().valueToTree(envelope));
        row.set("payload", Jsons.mapper().valueToTree(payload));
        if (senderPublicKey != null) {
            row.put("sender_public_key", senderPublicKey);
        }
        row.put("delivered_at", Instant.now(clock).toString());
        Path target = messageFile(dir, envelope.id(), ".json");
        Path tmp = messageFile(dir, envelope.id(), ".tmp");
        try {
            Files.writeString(tmp, Jsons.toJson(row), StandardCharsets.UTF_8);
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Delivery of " + envelope.id() + " was cancelled");
            }
        } catch (ClosedByInterruptException e) {
            Files.deleteIfExists(tmp);
            InterruptedIOException cancelled = new InterruptedIOException("Delivery of " + envelope.id() + " was cancelled");
            cancelled.initCause(e);
            throw cancelled;
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public boolean isDelivered(AgentRecord recipient, String messageId) {
        Path dir = inboxDir(recipient.id());
        return Files.exists(messageFile(dir, messageId, ".json"));
    }

    public List<JsonNode> read(String agentId) {
        Path dir = inboxDir(agentId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<JsonNode> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".json")).toList()) {
                out.add(Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8)));
            }
            out.sort(Comparator.comparing((JsonNode n) -> n.path("delivered_at").asText())
                    .thenComparing(n -> n.path("envelope").path("id").asText()));
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read inbox for agent " + agentId, e);
        }
    }

    // base64url of the id, or its sha256 when too long; never leaves dir.
    static Path messageFile(Path dir, String messageId, String suffix) {
        if (messageId == null || messageId.isEmpty()) {
            throw new IllegalArgumentException("Message id is required");
        }
        String encoded = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(messageId.getBytes(StandardCharsets.UTF_8));
        if (encoded.length() > 200) {
            encoded = Hashing.sha256Hex(messageId);
        }
        Path base = dir.toAbsolutePath().normalize();
        Path file = base.resolve(encoded + suffix).normalize();
        if (!base.equals(file.getParent())) {
            throw new IllegalArgumentException("Message id escapes inbox directory: " + messageId);
        }
        return file;
    }

    private Path inboxDir(String agentId) {
        if (agentId == null || agentId.isBlank() || agentId.contains("/") || agentId.contains("\\") || agentId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid agent id for inbox: " + agentId);
        }
        return inboxRoot.resolve(agentId);
    }
}
