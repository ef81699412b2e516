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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of security-relevant events written to the audit trail.
 */
public enum SecurityEventType {

    AUTH_SUCCESS("auth_success"),
    AUTH_FAILURE("auth_failure"),
    AUTH_LOCKOUT("auth_lockout"),
    SESSION_CREATED("session_created"),
    SESSION_EXPIRED("session_expired"),
    RATE_LIMITED("rate_limited"),
    ACCESS_DENIED("access_denied"),
    ENCRYPT_ERROR("encrypt_error");

    private final String value;

    SecurityEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Severity assigned when an event does not carry one explicitly.
     */
    public String defaultSeverity() {
        return switch (this) {
        case AUTH_LOCKOUT -> "critical";
        case AUTH_FAILURE, ACCESS_DENIED, RATE_LIMITED -> "warning";
        default -> "info";
        };
    }
}
