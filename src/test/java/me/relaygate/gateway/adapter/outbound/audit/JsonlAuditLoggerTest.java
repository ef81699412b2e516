package me.relaygate.gateway.adapter.outbound.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaygate.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.relaygate.gateway.domain.model.SecurityEvent;
import me.relaygate.gateway.domain.model.SecurityEventType;
import me.relaygate.gateway.infrastructure.config.AutoConfiguration;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.outbound.StoragePort;
import me.relaygate.gateway.security.UserIdHasher;
import me.relaygate.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonlAuditLoggerTest {

    private static final String PLATFORM = "telegram";
    private static final String USER = "123456789";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private GatewayProperties properties;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private JsonlAuditLogger auditLogger;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(NOW);
        auditLogger = new JsonlAuditLogger(storage, objectMapper, properties, clock);
    }

    @Test
    void shouldWriteHashedLockoutEvent() throws Exception {
        auditLogger.logAuthLockout(PLATFORM, USER);

        JsonNode event = singleEvent();
        assertEquals("auth_lockout", event.get("event_type").asText());
        assertEquals("critical", event.get("severity").asText());
        assertEquals(UserIdHasher.hash(PLATFORM, USER), event.get("user_id").asText());
        assertFalse(event.get("success").asBoolean());
        assertEquals("2026-03-01T10:00:00Z", event.get("timestamp").asText());
    }

    @Test
    void shouldNeverWriteRawUserId() throws Exception {
        auditLogger.logAuthFailure(PLATFORM, USER, "not in allowlist");
        auditLogger.logRateLimited(PLATFORM, USER);

        String content = Files.readString(logFile());
        assertFalse(content.contains(USER));
    }

    @Test
    void shouldInferSeverityFromType() throws Exception {
        auditLogger.logRateLimited(PLATFORM, USER);

        assertEquals("warning", singleEvent().get("severity").asText());
    }

    @Test
    void shouldKeepExplicitSeverityAndTimestamp() throws Exception {
        Instant earlier = Instant.parse("2026-02-01T00:00:00Z");
        auditLogger.log(SecurityEvent.builder()
                .eventType(SecurityEventType.SESSION_CREATED)
                .platform(PLATFORM)
                .severity("warning")
                .timestamp(earlier)
                .success(true)
                .build());

        JsonNode event = singleEvent();
        assertEquals("warning", event.get("severity").asText());
        assertEquals("2026-02-01T00:00:00Z", event.get("timestamp").asText());
        assertFalse(event.has("details"));
    }

    @Test
    void shouldRotateWhenFileExceedsLimit() throws Exception {
        properties.getAudit().setMaxFileBytes(10);

        auditLogger.logRateLimited(PLATFORM, USER);
        auditLogger.logRateLimited(PLATFORM, USER);

        assertTrue(Files.exists(tempDir.resolve("audit/security.log.20260301-100000")));
        assertEquals(1, Files.readAllLines(logFile()).size());
    }

    @Test
    void shouldSwallowStorageFailures() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.size(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(0L));
        when(failing.appendText(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        JsonlAuditLogger logger = new JsonlAuditLogger(failing, objectMapper, properties, clock);

        assertDoesNotThrow(() -> logger.logAuthFailure(PLATFORM, USER, "reason"));
    }

    private Path logFile() {
        return tempDir.resolve("audit").resolve(JsonlAuditLogger.LOG_FILE);
    }

    private JsonNode singleEvent() throws Exception {
        List<String> lines = Files.readAllLines(logFile());
        assertEquals(1, lines.size());
        return objectMapper.readTree(lines.get(0));
    }
}
