package me.relaygate.gateway.security;

import me.relaygate.gateway.domain.exception.VaultException;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class AesGcmVaultTest {

    private AesGcmVault vault;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getVault().setKey(AesGcmVault.generateKey());
        vault = new AesGcmVault(properties);
    }

    @Test
    void shouldDecryptWhatItEncrypted() throws VaultException {
        String ciphertext = vault.encrypt("hello world".getBytes(StandardCharsets.UTF_8));

        assertEquals("hello world", new String(vault.decrypt(ciphertext), StandardCharsets.UTF_8));
    }

    @Test
    void shouldNotLeakPlaintext() throws VaultException {
        String ciphertext = vault.encrypt("secret message".getBytes(StandardCharsets.UTF_8));

        String decoded = new String(Base64.getDecoder().decode(ciphertext), StandardCharsets.ISO_8859_1);
        assertFalse(decoded.contains("secret message"));
    }

    @Test
    void shouldUseFreshNoncePerCall() throws VaultException {
        byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

        assertNotEquals(vault.encrypt(plaintext), vault.encrypt(plaintext));
    }

    @Test
    void shouldPrefixNonceAndAppendTag() throws VaultException {
        String ciphertext = vault.encrypt(new byte[10]);

        assertEquals(AesGcmVault.NONCE_BYTES + 10 + 16, Base64.getDecoder().decode(ciphertext).length);
    }

    @Test
    void shouldRejectTamperedCiphertext() throws VaultException {
        byte[] data = Base64.getDecoder().decode(vault.encrypt("payload".getBytes(StandardCharsets.UTF_8)));
        data[data.length - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(data);

        assertThrows(VaultException.class, () -> vault.decrypt(tampered));
    }

    @Test
    void shouldRejectForeignKey() throws VaultException {
        String ciphertext = vault.encrypt("payload".getBytes(StandardCharsets.UTF_8));
        AesGcmVault other = new AesGcmVault(Base64.getDecoder().decode(AesGcmVault.generateKey()));

        assertThrows(VaultException.class, () -> other.decrypt(ciphertext));
    }

    @Test
    void shouldRejectMalformedInput() {
        assertThrows(VaultException.class, () -> vault.decrypt("not base64 !!"));
        assertThrows(VaultException.class, () -> vault.decrypt(Base64.getEncoder().encodeToString(new byte[4])));
    }

    @Test
    void shouldRejectWrongKeyLength() {
        GatewayProperties properties = new GatewayProperties();
        properties.getVault().setKey(Base64.getEncoder().encodeToString(new byte[16]));

        assertThrows(IllegalStateException.class, () -> new AesGcmVault(properties));
    }

    @Test
    void shouldGenerateEphemeralKeyWhenBlank() throws VaultException {
        AesGcmVault ephemeral = new AesGcmVault(new GatewayProperties());

        String ciphertext = ephemeral.encrypt("x".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals("x".getBytes(StandardCharsets.UTF_8), ephemeral.decrypt(ciphertext));
    }
}
