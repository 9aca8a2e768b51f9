package me.golemcore.agent.adapter.outbound.mcp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpToolNamesTest {

    @Test
    void shouldKeepBareNameForSingleServer() {
        assertEquals("search", McpToolNames.registryName("github", "search", false));
    }

    @Test
    void shouldNamespaceWithSeveralServers() {
        assertEquals("github.search", McpToolNames.registryName("github", "search", true));
    }

    @Test
    void shouldReplaceInvalidCharacters() {
        assertEquals("my_server.get_user_info", McpToolNames.registryName("my server", "get user/info", true));
    }

    @Test
    void shouldShortenLongNamesKeepingBothEnds() {
        String longName = "a".repeat(30) + "b".repeat(20) + "c".repeat(32);

        String sanitized = McpToolNames.sanitize(longName);

        assertEquals(McpToolNames.MAX_LENGTH, sanitized.length());
        assertEquals("a".repeat(28) + "___" + "c".repeat(32), sanitized);
    }

    @Test
    void shouldLeaveNameAtLimitUntouched() {
        String atLimit = "x".repeat(McpToolNames.MAX_LENGTH);

        assertEquals(atLimit, McpToolNames.sanitize(atLimit));
        assertTrue(McpToolNames.sanitize(atLimit + "y").contains("___"));
    }
}
