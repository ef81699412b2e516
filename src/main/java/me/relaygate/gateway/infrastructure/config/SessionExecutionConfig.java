package me.relaygate.gateway.infrastructure.config;

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

import me.relaygate.gateway.domain.service.MessageRouter;
import me.relaygate.gateway.port.outbound.NotifyPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads and callbacks used by background sub-sessions.
 *
 * <ul>
 * <li>{@code subSessionExecutor} - one daemon thread per running
 * sub-session</li>
 * <li>{@code subSessionTimeoutScheduler} - fires the execution ceiling</li>
 * <li>{@link NotifyPort} - completion messages go out through the router</li>
 * </ul>
 */
@Configuration
public class SessionExecutionConfig {

    @Bean(name = "subSessionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService subSessionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sub-session-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(name = "subSessionTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService subSessionTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sub-session-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public NotifyPort subSessionNotifier(MessageRouter router) {
        return router::send;
    }
}
