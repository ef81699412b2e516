package me.relaygate.gateway.security;

import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccessControlValidatorTest {

    private static final String TELEGRAM = "telegram";
    private static final String USER = "100";
    private static final String GROUP_CHAT = "-500";

    private GatewayProperties properties;
    private GatewayProperties.PlatformProperties telegram;
    private AccessControlValidator validator;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        telegram = new GatewayProperties.PlatformProperties();
        telegram.setEnabled(true);
        telegram.setAllowedUsers(new ArrayList<>(List.of(USER)));
        properties.getPlatforms().put(TELEGRAM, telegram);
        validator = new AccessControlValidator(properties);
    }

    // ====== platform rules ======

    @Test
    void shouldAllowListedUserInDirectMessage() {
        assertTrue(validator.isAllowed(TELEGRAM, USER, USER, false));
    }

    @Test
    void shouldDenyUnlistedUserInAllowlistMode() {
        assertFalse(validator.isAllowed(TELEGRAM, "999", "999", false));
    }

    @Test
    void shouldAllowEveryoneInOpenMode() {
        properties.getAccess().setMode("open");

        assertTrue(validator.isAllowed("unknown", "999", "999", false));
    }

    @Test
    void shouldAllowGlobalAdminEverywhere() {
        properties.getAccess().setGlobalAdmins(List.of("1"));
        telegram.setEnabled(false);

        assertTrue(validator.isAllowed(TELEGRAM, "1", "1", false));
        assertTrue(validator.isAllowed("unknown", "1", GROUP_CHAT, true));
    }

    @Test
    void shouldDenyUnknownPlatform() {
        assertFalse(validator.isAllowed("discord", USER, USER, false));
    }

    @Test
    void shouldDenyDisabledPlatform() {
        telegram.setEnabled(false);

        assertFalse(validator.isAllowed(TELEGRAM, USER, USER, false));
    }

    @Test
    void shouldDenyGroupsUnlessAllowed() {
        telegram.setAllowedChats(List.of(GROUP_CHAT));
        assertFalse(validator.isAllowed(TELEGRAM, USER, GROUP_CHAT, true));

        telegram.setAllowGroups(true);
        assertTrue(validator.isAllowed(TELEGRAM, USER, GROUP_CHAT, true));
    }

    @Test
    void shouldRequireListedChatForGroupsInAllowlistMode() {
        telegram.setAllowGroups(true);

        assertFalse(validator.isAllowed(TELEGRAM, USER, GROUP_CHAT, true));
    }

    @Test
    void shouldDenyDirectMessagesWhenDisabled() {
        telegram.setAllowDms(false);

        assertFalse(validator.isAllowed(TELEGRAM, USER, USER, false));
    }

    @Test
    void shouldAllowPlatformAdminWithoutListing() {
        telegram.setAdmins(List.of("7"));

        assertTrue(validator.isAllowed(TELEGRAM, "7", "7", false));
    }

    @Test
    void shouldTreatEmptyListAsOpenOutsideAllowlistMode() {
        properties.getAccess().setMode("denylist");
        telegram.setAllowedUsers(new ArrayList<>());

        assertTrue(validator.isAllowed(TELEGRAM, "999", "999", false));
    }

    @Test
    void shouldTreatEmptyListAsClosedInAllowlistMode() {
        telegram.setAllowedUsers(new ArrayList<>());

        assertFalse(validator.isAllowed(TELEGRAM, "999", "999", false));
    }

    // ====== legacy allowlist ======

    @Test
    void legacyShouldDenyUnknownPlatform() {
        assertFalse(validator.isAuthorized(TELEGRAM, USER));
    }

    @Test
    void legacyShouldAllowAllOnEmptyList() {
        properties.getAccess().getLegacyAllowedUsers().put(TELEGRAM, new ArrayList<>());

        assertTrue(validator.isAuthorized(TELEGRAM, "anyone"));
    }

    @Test
    void legacyShouldCheckMembership() {
        properties.getAccess().getLegacyAllowedUsers().put(TELEGRAM, List.of("55"));

        assertTrue(validator.isAuthorized(TELEGRAM, "55"));
        assertFalse(validator.isAuthorized(TELEGRAM, "56"));
    }
}
