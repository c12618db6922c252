package com.naturalsql.service;

import com.naturalsql.config.PipelineSettings;
import com.naturalsql.exception.SessionNotFoundException;
import com.naturalsql.model.SessionInfo;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class SessionManager {
    static final long IDLE_TIMEOUT_MINUTES = 30;
    static final long MAX_LIFETIME_HOURS = 24;

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "naturalsql-session-cleanup");
        t.setDaemon(true);
        return t;
    });
    private final PipelineSettings settings;

    public SessionManager(PipelineSettings settings) {
        this.settings = settings;
        // Run cleanup task every 5 minutes
        scheduler.scheduleAtFixedRate(this::cleanupExpiredSessions, 5, 5, TimeUnit.MINUTES);
    }

    public SessionContext createSession() {
        String sessionId = UUID.randomUUID().toString();
        OffsetDateTime now = OffsetDateTime.now();
        SessionInfo sessionInfo = SessionInfo.builder()
                .sessionId(sessionId)
                .createdAt(now)
                .lastAccessedAt(now)
                .expiresAt(now.plusHours(MAX_LIFETIME_HOURS))
                .build();

        SessionContext context = new SessionContext(sessionInfo, settings);
        sessions.put(sessionId, context);
        log.info("Session created (session_id={})", sessionId);
        return context;
    }

    public Optional<SessionContext> getSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        SessionContext session = sessions.get(sessionId);
        if (session != null) {
            if (isSessionExpired(session.getInfo())) {
                terminateSession(sessionId);
                return Optional.empty();
            }
            session.getInfo().setLastAccessedAt(OffsetDateTime.now());
            return Optional.of(session);
        }
        return Optional.empty();
    }

    /**
     * Session by id.
     *
     * @param sessionId session identifier
     * @return session
     * @throws SessionNotFoundException when missing or expired
     */
    public SessionContext requireSession(String sessionId) {
        return getSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public void terminateSession(String sessionId) {
        SessionContext removed = sessions.remove(sessionId);
        if (removed != null) {
            removed.close();
        }
    }

    public int activeSessions() {
        return sessions.size();
    }

    boolean isSessionExpired(SessionInfo session) {
        OffsetDateTime now = OffsetDateTime.now();
        boolean idleExpired = session.getLastAccessedAt().plusMinutes(IDLE_TIMEOUT_MINUTES).isBefore(now);
        boolean lifeExpired = session.getExpiresAt().isBefore(now);
        return idleExpired || lifeExpired;
    }

    void cleanupExpiredSessions() {
        Iterator<Map.Entry<String, SessionContext>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, SessionContext> entry = it.next();
            if (isSessionExpired(entry.getValue().getInfo())) {
                it.remove();
                log.info("Session expired (session_id={})", entry.getKey());
                try {
                    entry.getValue().close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close expired session (session_id={}): {}", entry.getKey(), e.getMessage());
                }
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        for (String sessionId : sessions.keySet()) {
            terminateSession(sessionId);
        }
    }
}
