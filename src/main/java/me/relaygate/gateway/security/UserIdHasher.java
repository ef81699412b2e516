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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Produces the loggable form of a user ID. Raw IDs never reach logs or
 * persisted records; this short digest is stable per platform and user so
 * audit trails can still be correlated.
 */
public final class UserIdHasher {

    private static final int DIGEST_PREFIX_BYTES = 8;

    private UserIdHasher() {
    }

    /**
     * Base64 of the first 8 bytes of SHA-256({@code platform:userId}).
     */
    public static String hash(String platform, String userId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((platform + ":" + userId).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(Arrays.copyOf(hash, DIGEST_PREFIX_BYTES));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Access key scoping rate-limit, lockout and access-session lookups.
     */
    public static String accessKey(String platform, String userId) {
        return platform + ":" + userId;
    }
}
