package me.golemcore.exterm.adapter.inbound.web;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.adapter.outbound.terminal.TerminalBridge;
import me.golemcore.exterm.domain.exception.SessionStoppedException;
import me.golemcore.exterm.domain.model.AiStatus;
import me.golemcore.exterm.domain.model.ClientEvent;
import me.golemcore.exterm.domain.model.SessionInfo;
import me.golemcore.exterm.domain.session.ChatSession;
import me.golemcore.exterm.domain.session.ChatSessionFactory;
import me.golemcore.exterm.domain.session.SessionRegistry;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.LlmPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Reactive WebSocket handler for the chat panel. Each connection gets its own
 * {@link ChatSession}, registered for the lifetime of the socket.
 *
 * <p>
 * Inbound frames are JSON objects with a {@code type}: {@code chat_message},
 * {@code stop_ai}, {@code start_ai}, {@code clear_history} or {@code ping}.
 * Frames that are not JSON are treated as chat text. A terminal can be
 * attached with the {@code terminal_session_id} query parameter.
 */
@Component
@Slf4j
public class WebSocketChatHandler implements WebSocketHandler {

    static final String SESSION_PREFIX = "chat_";
    static final String TERMINAL_PARAM = "terminal_session_id";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ChatSessionFactory sessionFactory;
    private final SessionRegistry registry;
    private final TerminalBridge terminalBridge;
    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration heartbeatInterval;

    public WebSocketChatHandler(ChatSessionFactory sessionFactory, SessionRegistry registry,
            TerminalBridge terminalBridge, LlmPort llmPort, ObjectMapper objectMapper, Clock clock,
            ExtermProperties properties) {
        this.sessionFactory = sessionFactory;
        this.registry = registry;
        this.terminalBridge = terminalBridge;
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.heartbeatInterval = properties.getSession().getHeartbeatInterval();
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        String sessionId = newSessionId();
        ChatConnection connection = new ChatConnection(sessionId, objectMapper, clock);
        ChatSession chat = sessionFactory.create(sessionId, connection::send);
        // registry mutations block on its owner thread, keep them off the event loop
        Mono<Void> registration = Mono.<Void>fromRunnable(() -> registry.register(chat))
                .subscribeOn(Schedulers.boundedElastic())
                .cache();

        String terminalId = queryParam(webSocketSession, TERMINAL_PARAM);
        if (terminalId != null && !terminalId.isBlank()) {
            terminalBridge.bindChat(sessionId, terminalId);
        }
        log.info("[WebSocket] Connection established: session={}, terminal={}", sessionId, terminalId);

        sendGreeting(connection);
        Disposable heartbeat = Flux.interval(heartbeatInterval)
                .subscribe(tick -> connection.send(ClientEvent.ping()));

        Mono<Void> input = registration
                .thenMany(webSocketSession.receive().map(WebSocketMessage::getPayloadAsText))
                .concatMap(payload -> handleIncoming(payload, chat, connection))
                .then()
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: session={}, signal={}", sessionId, signal);
                    heartbeat.dispose();
                    connection.complete();
                    terminalBridge.unbindChat(sessionId);
                    registration
                            .then(Mono.<Void>fromRunnable(() -> registry.unregister(sessionId))
                                    .subscribeOn(Schedulers.boundedElastic()))
                            .subscribe(null, error -> log.warn("[WebSocket] Failed to unregister {}: {}",
                                    sessionId, error.getMessage()));
                });
        Mono<Void> output = webSocketSession.send(connection.outbound().map(webSocketSession::textMessage));
        return Mono.when(input, output);
    }

    void sendGreeting(ChatConnection connection) {
        if (registry.isGloballyStopped()) {
            connection.send(ClientEvent.error("AI is globally stopped."));
            return;
        }
        connection.send(ClientEvent.system(welcomeMessage(connection.getSessionId())));
        connection.send(ClientEvent.aiStatus(AiStatus.READY));
    }

    /**
     * Handles one inbound frame. Registry commands complete on a worker thread
     * once the returned {@code Mono} is subscribed; everything else is applied
     * before this method returns.
     */
    Mono<Void> handleIncoming(String payload, ChatSession chat, ChatConnection connection) {
        JsonNode json;
        try {
            json = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            json = null;
        }

        if (json == null || !json.isObject()) {
            if (payload != null && !payload.isBlank()) {
                submit(chat, connection, payload.strip());
            }
            return Mono.empty();
        }

        String type = json.path("type").asText("");
        String content = json.path("content").asText("");
        Mono<Void> handling;
        try {
            handling = dispatch(type, content, chat, connection);
        } catch (RuntimeException e) { // NOSONAR - one bad frame must not kill the connection
            handling = Mono.error(e);
        }
        return handling
                .onErrorResume(SessionStoppedException.class, e -> {
                    connection.send(ClientEvent.error(e.getMessage()));
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.warn("[WebSocket] Failed to process '{}' on {}: {}", type, chat.getSessionId(),
                            e.getMessage());
                    connection.send(ClientEvent.error("Error: " + e.getMessage()));
                    return Mono.empty();
                });
    }

    private Mono<Void> dispatch(String type, String content, ChatSession chat, ChatConnection connection) {
        switch (type) {
        case "chat_message" -> {
            if (!content.isBlank()) {
                submit(chat, connection, content);
            }
        }
        case "stop_ai" -> {
            return onRegistryThread(() -> registry.stopSession(chat.getSessionId()));
        }
        case "start_ai" -> {
            return onRegistryThread(() -> registry.startSession(chat.getSessionId()));
        }
        case "clear_history" -> chat.clearHistory()
                .thenRun(() -> connection.send(ClientEvent.system("Chat history cleared")));
        case "ping" -> connection.send(ClientEvent.pong());
        default -> {
            log.debug("[WebSocket] Unknown message type '{}' on {}", type, chat.getSessionId());
            connection.send(ClientEvent.error("Unknown message type"));
        }
        }
        return Mono.empty();
    }

    private static Mono<Void> onRegistryThread(Callable<SessionInfo> command) {
        return Mono.fromCallable(command)
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private void submit(ChatSession chat, ChatConnection connection, String content) {
        log.debug("[WebSocket] Chat message on {} ({} chars)", chat.getSessionId(), content.length());
        chat.submit(content).whenComplete((result, error) -> {
            if (error == null) {
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof SessionStoppedException stopped) {
                connection.send(ClientEvent.error(stopped.getMessage()));
            } else if (!(cause instanceof CancellationException)) {
                log.warn("[WebSocket] Turn failed on {}: {}", chat.getSessionId(), cause.getMessage());
            }
        });
    }

    private String welcomeMessage(String sessionId) {
        if (!llmPort.isAvailable()) {
            String provider = llmPort.getProviderId();
            return "Chat system connected with warnings: No API key configured for LLM provider '" + provider
                    + "'. Set " + provider.toUpperCase(Locale.ROOT).replace('-', '_')
                    + "_API_KEY and restart the application.";
        }
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);
        return "Chat system connected! I'm your AI assistant for session " + sessionId
                + ". I can help you with terminal commands and system administration.\n\n"
                + "**System Information:**\n"
                + "- Current Date: " + now.format(DateTimeFormatter.ISO_LOCAL_DATE) + "\n"
                + "- Current Time: " + now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) + "\n"
                + "- Operating System: " + System.getProperty("os.name") + "\n"
                + "- Architecture: " + System.getProperty("os.arch") + "\n"
                + "- Session ID: " + sessionId + "\n"
                + "- Terminal Environment: Ready for commands and assistance";
    }

    static String newSessionId() {
        byte[] bytes = new byte[6];
        RANDOM.nextBytes(bytes);
        return SESSION_PREFIX + HexFormat.of().formatHex(bytes);
    }

    private static String queryParam(WebSocketSession session, String name) {
        URI uri = session.getHandshakeInfo().getUri();
        String query = uri.getQuery();
        if (query == null) {
            return null;
        }
        return UriComponentsBuilder.newInstance()
                .query(query)
                .build()
                .getQueryParams()
                .getFirst(name);
    }
}
