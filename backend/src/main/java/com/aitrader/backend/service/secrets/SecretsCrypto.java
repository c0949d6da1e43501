package com.aitrader.backend.service.secrets;

import com.aitrader.backend.exception.SecretsException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM for exchange and model credentials.
 *
 * Key: HKDF-SHA256 over the master key (at least 32 bytes), info {@code ai-crypto-trader-secrets-v1}.
 * Format: {@code "v1:" + base64url(nonce + ciphertext + tag)}.
 */
@Service
@Slf4j
public class SecretsCrypto {

    private static final String VERSION_PREFIX = "v1:";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final int KEY_BYTES = 32;
    private static final byte[] HKDF_INFO = "ai-crypto-trader-secrets-v1".getBytes(StandardCharsets.UTF_8);
    private static final SecureRandom RNG = new SecureRandom();

    private final String masterKey;

    private volatile SecretKey secretKey;

    public SecretsCrypto(@Value("${secrets.master-key:}") String masterKey) {
        this.masterKey = masterKey;
    }

    @PostConstruct
    public void init() {
        if (masterKey == null || masterKey.isBlank()) {
            log.warn("secrets.master-key not configured, credential decryption disabled");
            return;
        }
        byte[] material = masterKey.getBytes(StandardCharsets.UTF_8);
        if (material.length < KEY_BYTES) {
            throw new SecretsException("secrets.master-key must be at least 32 bytes");
        }
        secretKey = new SecretKeySpec(deriveKey(material), "AES");
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new SecretsException("Cannot encrypt empty string");
        }
        SecretKey key = requireKey();
        try {
            byte[] nonce = new byte[NONCE_BYTES];
            RNG.nextBytes(nonce);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] payload = new byte[nonce.length + ciphertext.length];
            System.arraycopy(nonce, 0, payload, 0, nonce.length);
            System.arraycopy(ciphertext, 0, payload, nonce.length, ciphertext.length);
            return VERSION_PREFIX + Base64.getUrlEncoder().encodeToString(payload);
        } catch (Exception e) {
            throw new SecretsException("Failed to encrypt secret", e);
        }
    }

    /**
     * Plaintext lives only in the returned string; callers keep it for the duration of one call.
     */
    public String decrypt(String encrypted) {
        if (encrypted == null || encrypted.isEmpty()) {
            throw new SecretsException("Cannot decrypt empty string");
        }
        if (!encrypted.startsWith(VERSION_PREFIX)) {
            throw new SecretsException("Unsupported encryption version: "
                    + encrypted.substring(0, Math.min(10, encrypted.length())));
        }
        SecretKey key = requireKey();
        byte[] payload;
        try {
            payload = Base64.getUrlDecoder().decode(encrypted.substring(VERSION_PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new SecretsException("Invalid ciphertext encoding", e);
        }
        if (payload.length < NONCE_BYTES + 16) {
            throw new SecretsException("Invalid ciphertext: too short");
        }
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, payload, 0, NONCE_BYTES));
            byte[] plain = cipher.doFinal(payload, NONCE_BYTES, payload.length - NONCE_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SecretsException("Failed to decrypt secret", e);
        }
    }

    public static String mask(String key) {
        if (key == null || key.isEmpty()) {
            return "***";
        }
        if (key.length() <= 8) {
            return "*".repeat(key.length());
        }
        return key.substring(0, 4) + "***" + key.substring(key.length() - 4);
    }

    private SecretKey requireKey() {
        SecretKey key = secretKey;
        if (key == null) {
            throw new SecretsException("secrets.master-key is not configured");
        }
        return key;
    }

    private static byte[] deriveKey(byte[] material) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(material, null, HKDF_INFO));
        byte[] key = new byte[KEY_BYTES];
        hkdf.generateBytes(key, 0, KEY_BYTES);
        return key;
    }
}
