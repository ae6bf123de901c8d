package com.example.dbmonitor.security;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.exception.CredentialException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Symmetric encryption for stored target passwords.
 *
 * AES-256 in CTR mode with a fresh random IV per value. The stored form is
 * {@code hex(iv) + ":" + hex(ciphertext)}.
 */
@Component
public class CredentialCodec {

    private static final String TRANSFORMATION = "AES/CTR/NoPadding";
    private static final int IV_LENGTH = 16;
    private static final int KEY_LENGTH = 32;
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public CredentialCodec(MonitorProperties properties) {
        this(properties.getSecurity().getEncryptionSecret());
    }

    public CredentialCodec(String secret) {
        byte[] keyBytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Encryption secret must be exactly " + KEY_LENGTH + " bytes, got " + keyBytes.length);
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Nothing to encrypt");
        }
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(iv) + ":" + HEX.formatHex(encrypted);
        } catch (GeneralSecurityException e) {
            throw new CredentialException("Failed to encrypt credential", e);
        }
    }

    public String decrypt(String ciphertext) {
        if (ciphertext == null) {
            throw new CredentialException("No stored credential", null);
        }
        int separator = ciphertext.indexOf(':');
        if (separator != IV_LENGTH * 2) {
            throw new CredentialException("Stored credential is not in iv:ciphertext form", null);
        }
        try {
            byte[] iv = HEX.parseHex(ciphertext, 0, separator);
            byte[] encrypted = HEX.parseHex(ciphertext, separator + 1, ciphertext.length());
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new CredentialException("Failed to decrypt credential", e);
        }
    }
}
