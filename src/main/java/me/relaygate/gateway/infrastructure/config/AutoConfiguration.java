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
import me.relaygate.gateway.port.inbound.MessageHandler;
import me.relaygate.gateway.port.inbound.PlatformPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;

/**
 * Spring auto-configuration that wires and starts the gateway on application
 * startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper}</li>
 * <li>Registers every enabled platform adapter with the router</li>
 * <li>Installs the application handler and starts the platforms</li>
 * <li>Stops the platforms on shutdown</li>
 * </ul>
 *
 * <p>
 * Platforms are discovered via dependency injection and registered if their
 * corresponding {@code gateway.platforms.<name>.enabled} property is true.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatewayProperties properties;
    private final ObjectProvider<PlatformPort> platformPorts;
    private final MessageRouter router;
    private final MessageHandler messageHandler;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Relaygate gateway starting...");
        log.info("Access mode: {}", properties.getAccess().getMode());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());

        List<PlatformPort> platforms = platformPorts.orderedStream().toList();
        for (PlatformPort platform : platforms) {
            if (isPlatformEnabled(platform.getName())) {
                router.register(platform);
            } else {
                log.info("Platform disabled: {}", platform.getName());
            }
        }
        router.setHandler(messageHandler);
        router.start();

        log.info("Relaygate gateway started with platforms: {}", router.platforms());
    }

    @PreDestroy
    public void shutdown() {
        router.stop();
    }

    private boolean isPlatformEnabled(String name) {
        GatewayProperties.PlatformProperties platformProps = properties.getPlatforms().get(name);
        return platformProps != null && platformProps.isEnabled();
    }
}
