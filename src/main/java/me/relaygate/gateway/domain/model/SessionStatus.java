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

/**
 * Lifecycle status of a conversation session.
 *
 * <p>
 * Sub-sessions move {@code PENDING -> RUNNING -> COMPLETE | FAILED | CANCELED};
 * {@code CANCELED} is also reachable straight from {@code PENDING}. Main
 * sessions are created directly in {@code RUNNING}.
 */
public enum SessionStatus {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETE("complete"),
    FAILED("failed"),
    CANCELED("canceled");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELED;
    }

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
