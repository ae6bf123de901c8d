package com.example.dbmonitor.security;

import com.example.dbmonitor.exception.CredentialException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialCodecTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private final CredentialCodec codec = new CredentialCodec(SECRET);

    @Test
    void decryptsWhatItEncrypted() {
        String stored = codec.encrypt("s3cr3t-p@ss");

        assertEquals("s3cr3t-p@ss", codec.decrypt(stored));
    }

    @Test
    void storedFormIsHexIvColonHexCiphertext() {
        String stored = codec.encrypt("password");

        assertTrue(stored.matches("[0-9a-f]{32}:[0-9a-f]+"), stored);
        assertFalse(stored.contains("password"));
    }

    @Test
    void freshIvPerValue() {
        assertNotEquals(codec.encrypt("same"), codec.encrypt("same"));
    }

    @Test
    void wrongKeyDoesNotRecoverPlaintext() {
        String stored = codec.encrypt("password");
        CredentialCodec other = new CredentialCodec("fedcba9876543210fedcba9876543210");

        assertNotEquals("password", other.decrypt(stored));
    }

    @Test
    void rejectsMalformedStoredValues() {
        assertThrows(CredentialException.class, () -> codec.decrypt(null));
        assertThrows(CredentialException.class, () -> codec.decrypt("not-encrypted"));
        assertThrows(CredentialException.class, () -> codec.decrypt("zz" + "0".repeat(30) + ":abcd"));
    }

    @Test
    void secretMustBeThirtyTwoBytes() {
        assertThrows(IllegalArgumentException.class, () -> new CredentialCodec("short"));
        assertThrows(IllegalArgumentException.class, () -> new CredentialCodec((String) null));
    }
}
