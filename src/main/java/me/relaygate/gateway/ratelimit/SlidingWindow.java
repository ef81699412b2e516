package me.relaygate.gateway.ratelimit;

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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Thread-safe sliding window log for one access key.
 *
 * <p>
 * Keeps the timestamps of accepted events. An event is accepted while fewer
 * than {@code limit} events were accepted within the trailing window ending at
 * the current instant. Rejected events are not recorded, so a client that keeps
 * hammering does not extend its own penalty.
 *
 * @since 1.0
 */
public class SlidingWindow {

    private final Deque<Instant> accepted = new ArrayDeque<>();

    /**
     * Try to record one event at {@code now}.
     *
     * @return {@code true} when the event fits the window
     */
    public synchronized boolean tryAcquire(Instant now, int limit, Duration window) {
        evictBefore(now.minus(window));
        if (accepted.size() >= limit) {
            return false;
        }
        accepted.addLast(now);
        return true;
    }

    /**
     * Whether any accepted event is newer than {@code cutoff}.
     */
    public synchronized boolean hasActivityAfter(Instant cutoff) {
        Instant last = accepted.peekLast();
        return last != null && last.isAfter(cutoff);
    }

    private void evictBefore(Instant cutoff) {
        while (!accepted.isEmpty() && !accepted.peekFirst().isAfter(cutoff)) {
            accepted.removeFirst();
        }
    }
}
