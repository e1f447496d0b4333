package io.amprelay.security;

import io.amprelay.model.Envelope;
import io.amprelay.model.Payload;
import io.amprelay.model.TrustLevel;
import io.amprelay.util.Hashing;
import io.amprelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Ed25519 sender signatures over the canonical signing string
 * {@code from|to|subject|priority|in_reply_to|base64(sha256(payload_json))}.
 *
 * <p>The pipe separator matches the format already spoken by deployed peers.
 */
public final class EnvelopeSigner {
    private static final Logger LOG = LoggerFactory.getLogger(EnvelopeSigner.class);
    private static final String ALGORITHM = "Ed25519";
    private static final byte[] ED25519_X509_PREFIX = Hashing.fromHex("302a300506032b6570032100");

    private EnvelopeSigner() {
    }

    public static String signingData(Envelope envelope, Payload payload) {
        String payloadDigest = Hashing.sha256Base64(Jsons.toCompactJson(payload));
        return String.join("|",
                nullToEmpty(envelope.from()),
                nullToEmpty(envelope.to()),
                nullToEmpty(envelope.subject()),
                envelope.priority().wireName(),
                nullToEmpty(envelope.inReplyTo()),
                payloadDigest);
    }

    public static String sign(Envelope envelope, Payload payload, PrivateKey privateKey) {
        try {
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(privateKey);
            signer.update(signingData(envelope, payload).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign envelope " + envelope.id(), e);
        }
    }

    /**
     * Never throws: malformed keys or signatures simply fail verification.
     */
    public static boolean verify(Envelope envelope, Payload payload, String signature, String publicKeyHex) {
        if (signature == null || signature.isBlank() || publicKeyHex == null || publicKeyHex.isBlank()) {
            return false;
        }
        try {
            PublicKey key = decodePublicKey(publicKeyHex);
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(key);
            verifier.update(signingData(envelope, payload).getBytes(StandardCharsets.UTF_8));
            return verifier.verify(Base64.getDecoder().decode(signature.trim()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            LOG.debug("Signature verification failed for message {}: {}", envelope.id(), e.getMessage());
            return false;
        }
    }

    public static TrustLevel trustLevel(Envelope envelope, Payload payload, String signature, String publicKeyHex) {
        return verify(envelope, payload, signature, publicKeyHex) ? TrustLevel.EXTERNAL : TrustLevel.UNTRUSTED;
    }

    /**
     * Accepts a raw 32-byte key or an X.509 SubjectPublicKeyInfo, both hex.
     */
    public static PublicKey decodePublicKey(String hex) throws GeneralSecurityException {
        byte[] raw = Hashing.fromHex(hex.trim());
        byte[] encoded = raw;
        if (raw.length == 32) {
            encoded = new byte[ED25519_X509_PREFIX.length + raw.length];
            System.arraycopy(ED25519_X509_PREFIX, 0, encoded, 0, ED25519_X509_PREFIX.length);
            System.arraycopy(raw, 0, encoded, ED25519_X509_PREFIX.length, raw.length);
        }
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
