package me.golemcore.exterm.domain.session;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.exception.SessionNotFoundException;
import me.golemcore.exterm.domain.exception.SessionStoppedException;
import me.golemcore.exterm.domain.model.SessionInfo;
import me.golemcore.exterm.domain.model.SessionStatus;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * The only state shared between conversations: live sessions and the global
 * kill switch.
 *
 * <p>
 * Mutations are funnelled through a single owner thread and applied in
 * submission order. Reads go straight to the concurrent map and may observe a
 * mutation that is still in flight.
 */
@Service
@Slf4j
public class SessionRegistry {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService owner = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "session-registry");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean globallyStopped = false;

    public void register(ChatSession session) {
        mutate(() -> {
            sessions.put(session.getSessionId(), session);
            log.info("[Registry] Registered session {} ({} active)", session.getSessionId(), sessions.size());
            return null;
        });
    }

    public void unregister(String sessionId) {
        mutate(() -> {
            ChatSession removed = sessions.remove(sessionId);
            if (removed != null) {
                removed.close();
                log.info("[Registry] Unregistered session {} ({} active)", sessionId, sessions.size());
            }
            return null;
        });
    }

    public Optional<ChatSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public ChatSession require(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public List<SessionInfo> list() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(ChatSession::getCreatedAt))
                .map(SessionRegistry::toInfo)
                .toList();
    }

    public SessionInfo describe(String sessionId) {
        return toInfo(require(sessionId));
    }

    public SessionInfo stopSession(String sessionId) {
        return mutate(() -> {
            ChatSession session = require(sessionId);
            session.stop();
            return toInfo(session);
        });
    }

    /**
     * Resumes a stopped session. Refused while the global kill switch is on.
     */
    public SessionInfo startSession(String sessionId) {
        return mutate(() -> {
            if (globallyStopped) {
                throw SessionStoppedException.cannotStart();
            }
            ChatSession session = require(sessionId);
            session.resume();
            return toInfo(session);
        });
    }

    /**
     * Turns the global kill switch on and marks every live session stopped.
     *
     * @return number of sessions stopped
     */
    public int stopAll() {
        return mutate(() -> {
            globallyStopped = true;
            sessions.values().forEach(ChatSession::stop);
            log.warn("[Registry] AI globally stopped ({} sessions)", sessions.size());
            return sessions.size();
        });
    }

    /**
     * Turns the global kill switch off. Individually stopped sessions stay
     * stopped until started.
     */
    public void startAll() {
        mutate(() -> {
            globallyStopped = false;
            log.info("[Registry] AI globally started");
            return null;
        });
    }

    public boolean isGloballyStopped() {
        return globallyStopped;
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        owner.shutdownNow();
    }

    private <T> T mutate(Callable<T> operation) {
        Future<T> future = owner.submit(operation);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for session registry", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Session registry operation failed", e.getCause());
        }
    }

    private static SessionInfo toInfo(ChatSession session) {
        return SessionInfo.builder()
                .id(session.getSessionId())
                .status(session.isStopped() ? SessionStatus.STOPPED : SessionStatus.RUNNING)
                .turnState(session.getTurnState())
                .createdAt(session.getCreatedAt())
                .lastActivity(session.getLastActivity())
                .messageCount(session.getMessageCount())
                .build();
    }
}
