package me.relaygate.gateway.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Access-layer session tracking that a user was recently validated. Unrelated
 * to conversation content; it only carries absolute and idle expiry.
 */
@Data
@Builder
public class AccessSession {

    private String platform;
    private String userId;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastSeen;

    /**
     * Validity verdict of an access session.
     */
    public enum Validity {
        VALID, ABSENT, EXPIRED, IDLE
    }

    public Validity check(Instant now, Duration idleTimeout) {
        if (now.isAfter(expiresAt)) {
            return Validity.EXPIRED;
        }
        if (Duration.between(lastSeen, now).compareTo(idleTimeout) > 0) {
            return Validity.IDLE;
        }
        return Validity.VALID;
    }

    public boolean isValid(Instant now, Duration idleTimeout) {
        return check(now, idleTimeout) == Validity.VALID;
    }
}
