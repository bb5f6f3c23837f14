package me.golemcore.exterm.adapter.inbound.web.controller;

import me.golemcore.exterm.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.exterm.domain.exception.SessionNotFoundException;
import me.golemcore.exterm.domain.exception.SessionStoppedException;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.SessionInfo;
import me.golemcore.exterm.domain.model.SessionStatus;
import me.golemcore.exterm.domain.session.ChatSession;
import me.golemcore.exterm.domain.session.SessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionsControllerWebTest {

    private SessionRegistry registry;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        registry = mock(SessionRegistry.class);
        webTestClient = WebTestClient.bindToController(new SessionsController(registry))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static SessionInfo info(String id, SessionStatus status, int messages) {
        return SessionInfo.builder()
                .id(id)
                .status(status)
                .createdAt(Instant.parse("2026-01-01T10:00:00Z"))
                .lastActivity(Instant.parse("2026-01-01T10:05:00Z"))
                .messageCount(messages)
                .build();
    }

    @Test
    void shouldListSessions() {
        when(registry.list()).thenReturn(List.of(
                info("chat_a", SessionStatus.RUNNING, 3),
                info("chat_b", SessionStatus.STOPPED, 1)));

        webTestClient.get()
                .uri("/api/sessions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].id").isEqualTo("chat_a")
                .jsonPath("$[0].status").isEqualTo("running")
                .jsonPath("$[0].message_count").isEqualTo(3)
                .jsonPath("$[1].status").isEqualTo("stopped");
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() {
        when(registry.describe("chat_missing")).thenThrow(new SessionNotFoundException("chat_missing"));

        webTestClient.get()
                .uri("/api/sessions/chat_missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404);
    }

    @Test
    void shouldReturnSessionHistory() {
        ChatSession session = mock(ChatSession.class);
        when(registry.require("chat_a")).thenReturn(session);
        when(session.getHistory()).thenReturn(CompletableFuture.completedFuture(
                List.of(Message.system("prompt"), Message.user("hi"), Message.assistant("hello"))));

        webTestClient.get()
                .uri("/api/sessions/chat_a/history")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(3)
                .jsonPath("$[1].role").isEqualTo("user")
                .jsonPath("$[1].content").isEqualTo("hi")
                .jsonPath("$[2].content").isEqualTo("hello");
    }

    @Test
    void shouldStopSession() {
        when(registry.stopSession("chat_a")).thenReturn(info("chat_a", SessionStatus.STOPPED, 2));

        webTestClient.post()
                .uri("/api/sessions/chat_a/stop")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("chat_a")
                .jsonPath("$.status").isEqualTo("stopped");

        verify(registry).stopSession("chat_a");
    }

    @Test
    void shouldRejectStartWhileGloballyStopped() {
        when(registry.startSession("chat_a")).thenThrow(SessionStoppedException.cannotStart());

        webTestClient.post()
                .uri("/api/sessions/chat_a/start")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.error").isEqualTo(SessionStoppedException.CANNOT_START);
    }

    @Test
    void shouldHideUnexpectedFailures() {
        when(registry.stopSession("chat_a")).thenThrow(new IllegalStateException("boom"));

        webTestClient.post()
                .uri("/api/sessions/chat_a/stop")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Internal server error");
    }
}
