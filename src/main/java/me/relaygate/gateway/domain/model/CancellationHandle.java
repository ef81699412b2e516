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

import java.util.Optional;

/**
 * Stop signal shared by a sub-session and the task it runs.
 *
 * <p>
 * Created when the sub-session is spawned and handed to the task runner. Both
 * an explicit cancel request and the execution ceiling trigger the same
 * handle, so a runner only has to honor one contract: poll
 * {@link #isCancelled()} and react to thread interruption. The first trigger
 * wins; later ones are ignored.
 */
public final class CancellationHandle {

    /**
     * What triggered the cancellation.
     */
    public enum Reason {
        CANCELED, TIMEOUT
    }

    private Reason reason;
    private Thread worker;

    /**
     * Triggers the handle. Returns {@code false} if it was already triggered.
     */
    public synchronized boolean cancel(Reason cause) {
        if (reason != null) {
            return false;
        }
        reason = cause;
        if (worker != null) {
            worker.interrupt();
        }
        return true;
    }

    public synchronized boolean isCancelled() {
        return reason != null;
    }

    public synchronized Optional<Reason> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Binds the thread that executes the task so that a trigger interrupts it.
     * A handle triggered before binding interrupts the thread immediately.
     */
    public synchronized void bind(Thread thread) {
        this.worker = thread;
        if (reason != null && thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Detaches the worker thread; after this call triggers no longer interrupt
     * it.
     */
    public synchronized void unbind() {
        this.worker = null;
    }
}
