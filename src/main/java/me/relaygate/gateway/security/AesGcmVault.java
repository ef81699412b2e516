package me.relaygate.gateway.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.relaygate.gateway.domain.exception.VaultException;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.outbound.VaultPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM vault for message content at rest.
 *
 * <p>
 * Output layout is {@code base64(nonce || ciphertext || tag)} with a fresh
 * random 12-byte nonce per call. The key is read from {@code gateway.vault.key}
 * (Base64, 32 bytes). When no key is configured an ephemeral key is generated
 * and previously stored records become unreadable after a restart.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class AesGcmVault implements VaultPort {

    static final int KEY_BYTES = 32;
    static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public AesGcmVault(GatewayProperties properties) {
        this(resolveKey(properties.getVault().getKey()));
    }

    public AesGcmVault(byte[] rawKey) {
        if (rawKey == null || rawKey.length != KEY_BYTES) {
            throw new IllegalStateException("invalid encryption key: expected " + KEY_BYTES + " bytes");
        }
        this.key = new SecretKeySpec(rawKey, "AES");
    }

    @Override
    public String encrypt(byte[] plaintext) throws VaultException {
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext);

            byte[] out = new byte[NONCE_BYTES + sealed.length];
            System.arraycopy(nonce, 0, out, 0, NONCE_BYTES);
            System.arraycopy(sealed, 0, out, NONCE_BYTES, sealed.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new VaultException("encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(String ciphertext) throws VaultException {
        byte[] data;
        try {
            data = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new VaultException("decryption failed: malformed input", e);
        }
        if (data.length < NONCE_BYTES) {
            throw new VaultException("decryption failed: input too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, data, 0, NONCE_BYTES));
            return cipher.doFinal(data, NONCE_BYTES, data.length - NONCE_BYTES);
        } catch (GeneralSecurityException e) {
            throw new VaultException("decryption failed", e);
        }
    }

    /**
     * Generates a new random Base64 key suitable for {@code gateway.vault.key}.
     */
    public static String generateKey() {
        byte[] raw = new byte[KEY_BYTES];
        new SecureRandom().nextBytes(raw);
        return Base64.getEncoder().encodeToString(raw);
    }

    private static byte[] resolveKey(String configured) {
        if (configured == null || configured.isBlank()) {
            log.warn("[Vault] gateway.vault.key is not set, using an ephemeral key");
            return Base64.getDecoder().decode(generateKey());
        }
        try {
            return Base64.getDecoder().decode(configured.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("invalid encryption key: not Base64", e);
        }
    }
}
