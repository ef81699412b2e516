package me.relaygate.gateway.adapter.outbound.hook;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaygate.gateway.domain.model.HookEvent;
import me.relaygate.gateway.domain.model.HookEventData;
import me.relaygate.gateway.domain.model.HookResult;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.outbound.HookPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs configured shell commands in response to gateway events.
 *
 * <p>
 * Each hook receives the {@link HookEventData} as JSON on stdin. A hook that
 * exits non-zero or runs past its timeout marks the synchronous result as
 * blocked. The last non-empty trimmed stdout among matching hooks becomes the
 * result output, which the router uses as replacement text for
 * {@code pre_message} and {@code post_response}. Captured stdout and stderr are
 * capped at {@code gateway.hooks.max-output-bytes}.
 *
 * <p>
 * Hooks flagged {@code async} never block and never contribute output.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ShellHookManager implements HookPort {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final long STREAM_DRAIN_SECONDS = 1;

    private final List<ConfiguredHook> hooks;
    private final int maxOutputBytes;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public ShellHookManager(GatewayProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.maxOutputBytes = properties.getHooks().getMaxOutputBytes();
        this.hooks = resolveHooks(properties.getHooks().getDefinitions());

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "hook-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        if (!hooks.isEmpty()) {
            log.info("[Hooks] {} hooks configured", hooks.size());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Hooks] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean hasHooks(HookEvent event) {
        return hooks.stream().anyMatch(hook -> hook.event() == event);
    }

    @Override
    public HookResult fire(HookEvent event, HookEventData data) {
        if (hooks.isEmpty()) {
            return HookResult.empty();
        }
        HookEventData payload = data.toBuilder().event(event.getValue()).build();

        String output = "";
        boolean blocked = false;
        for (ConfiguredHook hook : matching(event, payload.getPlatform())) {
            if (hook.async()) {
                runDetached(hook, payload);
                continue;
            }
            Execution execution = execute(hook, payload);
            if (!execution.succeeded()) {
                blocked = true;
                log.warn("[Hooks] Hook blocked or failed: hook={}, event={}", hook.name(), event.getValue());
            }
            if (!execution.output().isEmpty()) {
                output = execution.output();
            }
        }
        return new HookResult(output, blocked);
    }

    @Override
    public void fireAsync(HookEvent event, HookEventData data) {
        if (hooks.isEmpty()) {
            return;
        }
        HookEventData payload = data.toBuilder().event(event.getValue()).build();
        for (ConfiguredHook hook : matching(event, payload.getPlatform())) {
            runDetached(hook, payload);
        }
    }

    private List<ConfiguredHook> matching(HookEvent event, String platform) {
        return hooks.stream()
                .filter(hook -> hook.event() == event)
                .filter(hook -> hook.matchesPlatform(platform))
                .toList();
    }

    private void runDetached(ConfiguredHook hook, HookEventData payload) {
        executor.execute(() -> execute(hook, payload));
    }

    private Execution execute(ConfiguredHook hook, HookEventData payload) {
        byte[] stdin;
        try {
            stdin = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            log.error("[Hooks] Failed to serialize event for hook {}", hook.name(), e);
            return Execution.failed("");
        }

        log.debug("[Hooks] Firing hook={}, event={}, platform={}", hook.name(), payload.getEvent(),
                payload.getPlatform());

        Process process;
        try {
            process = new ProcessBuilder(shellCommand(hook.command())).start();
        } catch (IOException e) {
            log.warn("[Hooks] Failed to start hook {}: {}", hook.name(), e.getMessage());
            return Execution.failed("");
        }

        Future<byte[]> stdout = executor.submit(() -> readCapped(process.getInputStream()));
        Future<byte[]> stderr = executor.submit(() -> readCapped(process.getErrorStream()));

        try (OutputStream in = process.getOutputStream()) {
            in.write(stdin);
        } catch (IOException e) {
            log.debug("[Hooks] Hook {} closed stdin early: {}", hook.name(), e.getMessage());
        }

        try {
            boolean finished = process.waitFor(hook.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("[Hooks] Hook {} timed out after {}", hook.name(), hook.timeout());
                return Execution.failed(collect(stdout));
            }

            String output = collect(stdout);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.warn("[Hooks] Hook execution failed: hook={}, event={}, exitCode={}, stderr={}",
                        hook.name(), payload.getEvent(), exitCode, collect(stderr));
                return Execution.failed(output);
            }
            if (!output.isEmpty()) {
                log.debug("[Hooks] Hook {} produced output, length={}", hook.name(), output.length());
            }
            return new Execution(output, true);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Execution.failed("");
        }
    }

    private String collect(Future<byte[]> stream) throws InterruptedException {
        try {
            byte[] bytes = stream.get(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS);
            return new String(bytes, StandardCharsets.UTF_8).trim();
        } catch (ExecutionException | TimeoutException e) {
            log.debug("[Hooks] Failed to read hook output: {}", e.getMessage());
            return "";
        }
    }

    private byte[] readCapped(InputStream stream) throws IOException {
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        try (InputStream in = stream) {
            int read = in.read(buffer);
            while (read != -1) {
                int room = maxOutputBytes - captured.size();
                if (room > 0) {
                    captured.write(buffer, 0, Math.min(room, read));
                }
                read = in.read(buffer);
            }
        }
        return captured.toByteArray();
    }

    static List<String> shellCommand(String command) {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("cmd", "/C", command);
        }
        return List.of("sh", "-c", command);
    }

    private static List<ConfiguredHook> resolveHooks(List<GatewayProperties.HookProperties> definitions) {
        List<ConfiguredHook> resolved = new ArrayList<>();
        if (definitions == null) {
            return resolved;
        }
        for (GatewayProperties.HookProperties definition : definitions) {
            Optional<HookEvent> event = HookEvent.fromValue(definition.getEvent());
            if (event.isEmpty()) {
                log.warn("[Hooks] Ignoring hook {} with unknown event '{}'", definition.getName(),
                        definition.getEvent());
                continue;
            }
            if (definition.getCommand() == null || definition.getCommand().isBlank()) {
                log.warn("[Hooks] Ignoring hook {} without command", definition.getName());
                continue;
            }
            Duration timeout = definition.getTimeout() == null || definition.getTimeout().isZero()
                    || definition.getTimeout().isNegative() ? DEFAULT_TIMEOUT : definition.getTimeout();
            List<String> platforms = definition.getPlatforms() != null ? List.copyOf(definition.getPlatforms())
                    : List.of();
            resolved.add(new ConfiguredHook(definition.getName(), event.get(), definition.getCommand(), timeout,
                    platforms, definition.isAsync()));
        }
        return List.copyOf(resolved);
    }

    private record ConfiguredHook(String name, HookEvent event, String command, Duration timeout,
            List<String> platforms, boolean async) {

        boolean matchesPlatform(String platform) {
            if (platforms.isEmpty()) {
                return true;
            }
            return platforms.stream().anyMatch(candidate -> candidate.equalsIgnoreCase(platform));
        }
    }

    private record Execution(String output, boolean succeeded) {

        static Execution failed(String output) {
            return new Execution(output, false);
        }
    }
}
