package com.tableadvisor.advisor.session;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live advisor sessions by id.
 *
 * <p>Each session holds a scheduler thread, so sessions whose client went away without
 * stopping them are evicted once they have seen no event for {@code idleTimeout}.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, AdvisorSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionRegistry(Clock clock,
                           @Value("${advisor.session.idle-timeout-ms:1800000}") long idleTimeoutMs) {
        this.clock = clock;
        this.idleTimeout = Duration.ofMillis(Math.max(1L, idleTimeoutMs));
    }

    public AdvisorSession start() {
        String id = UUID.randomUUID().toString();
        AdvisorSession session = new AdvisorSession(id, Instant.now(clock));
        sessions.put(id, session);
        log.info("[Session] started. sessionId={} active={}", id, sessions.size());
        return session;
    }

    public Optional<AdvisorSession> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(sessions.get(id));
    }

    /** Removes the session from lookup; the caller closes it. */
    public Optional<AdvisorSession> remove(String id) {
        Optional<AdvisorSession> removed = id == null ? Optional.empty() : Optional.ofNullable(sessions.remove(id));
        removed.ifPresent(s -> log.info("[Session] removed. sessionId={} active={}", id, sessions.size()));
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${advisor.session.eviction-interval-ms:60000}")
    public void sweepIdle() {
        evictIdle();
    }

    /** Closes every session idle longer than the timeout and returns their ids. */
    public List<String> evictIdle() {
        Instant now = Instant.now(clock);
        List<String> evicted = new ArrayList<>();
        for (Map.Entry<String, AdvisorSession> entry : sessions.entrySet()) {
            Duration idle = Duration.between(entry.getValue().getLastActivityAt(), now);
            if (idle.compareTo(idleTimeout) > 0) {
                remove(entry.getKey()).ifPresent(session -> {
                    session.close().subscribe();
                    evicted.add(session.getId());
                });
            }
        }
        if (!evicted.isEmpty()) {
            log.info("[Session] evicted idle sessions. count={} idleTimeout={}", evicted.size(), idleTimeout);
        }
        return evicted;
    }

    @PreDestroy
    public void shutdown() {
        sessions.keySet().forEach(id -> remove(id).ifPresent(session -> session.close().subscribe()));
    }
}
