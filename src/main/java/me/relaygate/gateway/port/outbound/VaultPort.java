package me.relaygate.gateway.port.outbound;

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

/**
 * Authenticated symmetric encryption of message bodies at rest.
 */
public interface VaultPort {

    /**
     * Encrypts plaintext and returns Base64 ciphertext.
     */
    String encrypt(byte[] plaintext) throws VaultException;

    /**
     * Decrypts Base64 ciphertext produced by {@link #encrypt(byte[])}.
     */
    byte[] decrypt(String ciphertext) throws VaultException;
}
