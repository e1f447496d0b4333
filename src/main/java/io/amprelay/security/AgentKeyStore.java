package io.amprelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.amprelay.util.Hashing;
import io.amprelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentKeyStore {
    private static final String SCHEMA = "amprelay.agent.keys.v1";

    private final Path keysRoot;
    private final Map<String, AgentKeys> cache = new ConcurrentHashMap<>();

    public AgentKeyStore(Path keysRoot) {
        this.keysRoot = keysRoot;
    }

    public AgentKeys loadOrCreate(String agentId) {
        return cache.computeIfAbsent(agentId, this::readOrGenerate);
    }

    public boolean exists(String agentId) {
        return cache.containsKey(agentId) || Files.exists(keyFile(agentId));
    }

    private synchronized AgentKeys readOrGenerate(String agentId) {
        Path file = keyFile(agentId);
        if (Files.exists(file)) {
            return read(agentId, file);
        }
        try {
            KeyPair pair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
            AgentKeys keys = new AgentKeys(agentId, pair.getPrivate(), pair.getPublic());
            persist(file, keys);
            return keys;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    private AgentKeys read(String agentId, Path file) {
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            KeyFactory kf = KeyFactory.getInstance("Ed25519");
            byte[] priv = Base64.getDecoder().decode(node.path("private_key").asText(""));
            byte[] pub = Base64.getDecoder().decode(node.path("public_key").asText(""));
            return new AgentKeys(
                    agentId,
                    kf.generatePrivate(new PKCS8EncodedKeySpec(priv)),
                    kf.generatePublic(new X509EncodedKeySpec(pub))
            );
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to load agent key file: " + file, e);
        }
    }

    private void persist(Path file, AgentKeys keys) {
        try {
            Files.createDirectories(file.getParent());
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", SCHEMA);
            root.put("agent_id", keys.agentId());
            root.put("created_at", Instant.now().toString());
            root.put("private_key", Base64.getEncoder().encodeToString(keys.privateKey().getEncoded()));
            root.put("public_key", Base64.getEncoder().encodeToString(keys.publicKey().getEncoded()));
            Files.writeString(file, Jsons.toJson(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist agent key file: " + file, e);
        }
    }

    private Path keyFile(String agentId) {
        String safe = agentId == null ? "" : agentId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.-]", "-");
        if (safe.isBlank() || safe.startsWith(".")) {
            throw new IllegalArgumentException("Invalid agent id for key file: " + agentId);
        }
        return keysRoot.resolve(safe + ".json");
    }

    public record AgentKeys(String agentId, PrivateKey privateKey, PublicKey publicKey) {
        /**
         * Raw 32-byte public key as hex, the form exchanged with other hosts.
         */
        public String publicKeyHex() {
            byte[] encoded = publicKey.getEncoded();
            return Hashing.toHex(Arrays.copyOfRange(encoded, encoded.length - 32, encoded.length));
        }
    }
}
