package com.jobscout.discovery.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobscout.config.DiscoveryProperties;
import com.jobscout.discovery.browser.BrowserCookie;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Cookies from the last successful verification, shared by new worker sessions while fresh.
 */
@Component
public class SessionStateStore {
    private static final Logger log = LoggerFactory.getLogger(SessionStateStore.class);

    public record SessionState(Instant savedAt, List<BrowserCookie> cookies) {
    }

    private final ObjectMapper objectMapper;
    private final Path stateFile;
    private final Duration maxAge;

    public SessionStateStore(ObjectMapper objectMapper, DiscoveryProperties properties) {
        this.objectMapper = objectMapper;
        this.stateFile = Path.of(properties.getSession().getStateFile());
        this.maxAge = Duration.ofHours(properties.getSession().getMaxAgeHours());
    }

    public synchronized List<BrowserCookie> load() {
        if (!Files.isRegularFile(stateFile)) {
            return List.of();
        }
        try {
            SessionState state = objectMapper.readValue(stateFile.toFile(), SessionState.class);
            if (state == null || state.savedAt() == null || state.cookies() == null) {
                return List.of();
            }
            if (state.savedAt().plus(maxAge).isBefore(Instant.now())) {
                log.info("Ignoring session state saved at {} (older than {}h)", state.savedAt(), maxAge.toHours());
                return List.of();
            }
            return state.cookies();
        } catch (IOException e) {
            log.warn("Failed to read session state from {}", stateFile, e);
            return List.of();
        }
    }

    public synchronized void save(List<BrowserCookie> cookies) {
        if (cookies == null || cookies.isEmpty()) {
            return;
        }
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(stateFile.toFile(), new SessionState(Instant.now(), cookies));
            log.info("Saved {} cookies to {}", cookies.size(), stateFile);
        } catch (IOException e) {
            log.warn("Failed to save session state to {}", stateFile, e);
        }
    }
}
