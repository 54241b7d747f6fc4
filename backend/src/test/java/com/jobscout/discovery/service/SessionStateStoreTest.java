package com.jobscout.discovery.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobscout.config.DiscoveryConfig;
import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.browser.BrowserCookie;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStateStoreTest {
    private static final BrowserCookie COOKIE = new BrowserCookie(
        "cf_clearance", "token", ".eluta.ca", "/", 1.9e9, true, true, "None"
    );

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new DiscoveryConfig().objectMapper();

    @Test
    void savedCookiesAreLoadedBack() {
        SessionStateStore store = store(tempDir.resolve("state/session.json"));

        store.save(List.of(COOKIE));

        assertTrue(Files.exists(tempDir.resolve("state/session.json")));
        assertEquals(List.of(COOKIE), store.load());
    }

    @Test
    void staleStateIsIgnored() throws Exception {
        Path file = tempDir.resolve("session.json");
        objectMapper.writeValue(
            file.toFile(),
            new SessionStateStore.SessionState(Instant.now().minus(Duration.ofHours(25)), List.of(COOKIE))
        );

        assertTrue(store(file).load().isEmpty());
    }

    @Test
    void missingOrCorruptFileYieldsNoCookies() throws Exception {
        Path file = tempDir.resolve("session.json");
        SessionStateStore store = store(file);
        assertTrue(store.load().isEmpty());

        Files.writeString(file, "{not json");
        assertTrue(store.load().isEmpty());
    }

    @Test
    void emptyCookieListIsNotPersisted() {
        Path file = tempDir.resolve("session.json");
        store(file).save(List.of());
        assertFalse(Files.exists(file));
    }

    private SessionStateStore store(Path file) {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getSession().setStateFile(file.toString());
        return new SessionStateStore(objectMapper, properties);
    }
}
