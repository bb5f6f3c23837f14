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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.exception.LlmProviderException;
import me.golemcore.exterm.domain.exception.LlmTransportException;
import me.golemcore.exterm.domain.exception.SessionStoppedException;
import me.golemcore.exterm.domain.model.AiStatus;
import me.golemcore.exterm.domain.model.ClientEvent;
import me.golemcore.exterm.domain.model.LlmRequest;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.StreamDelta;
import me.golemcore.exterm.domain.model.SummaryLength;
import me.golemcore.exterm.domain.model.SummaryReason;
import me.golemcore.exterm.domain.model.ToolCall;
import me.golemcore.exterm.domain.model.TurnState;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.toolloop.ContinuationController;
import me.golemcore.exterm.domain.toolloop.ToolCallAssembler;
import me.golemcore.exterm.domain.toolloop.ToolExecutionOutcome;
import reactor.core.Disposable;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * One conversation, run as an actor.
 *
 * <p>
 * Every state change happens inside the session's mailbox: operations are
 * queued as tasks and drained one at a time on a shared executor, so history
 * and turn state need no locking. Streaming runs on Reactor schedulers and tool
 * rounds run on the tool executor; their results are posted back to the
 * mailbox. Only one turn is active at a time, later submissions wait in
 * {@code pendingTurns}.
 *
 * <p>
 * Futures returned by this class complete on the mailbox thread. Dependents
 * must not block on another call to the same session.
 */
@Slf4j
public class ChatSession implements ToolContext {

    private static final int MAX_ERROR_BODY = 500;

    private final String sessionId;
    private final Instant createdAt;
    private final SessionEventListener listener;
    private final SessionCollaborators collaborators;
    private final ContinuationController continuationController;

    private final Object lock = new Object();
    private final Deque<Runnable> mailbox = new ArrayDeque<>();
    private boolean draining = false;

    // confined to the mailbox
    private final List<Message> history = new ArrayList<>();
    private final Deque<PendingTurn> pendingTurns = new ArrayDeque<>();
    private ActiveTurn activeTurn;
    private boolean closed = false;

    private volatile TurnState turnState = TurnState.IDLE;
    private volatile boolean stopped = false;
    private volatile int messageCount;
    private volatile Instant lastActivity;

    public ChatSession(String sessionId, List<Message> initialHistory, SessionEventListener listener,
            SessionCollaborators collaborators) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.collaborators = collaborators;
        this.continuationController = collaborators.continuationController();
        this.createdAt = collaborators.clock().instant();
        this.lastActivity = createdAt;
        this.history.addAll(initialHistory);
        this.messageCount = history.size();
    }

    // ==================== Public API ====================

    /**
     * Queues a user message. The returned future fails with
     * {@link SessionStoppedException} if the session or the whole service is
     * stopped when the turn would start.
     */
    public CompletableFuture<TurnResult> submit(String userMessage) {
        Objects.requireNonNull(userMessage, "userMessage");
        CompletableFuture<TurnResult> future = new CompletableFuture<>();
        post(() -> enqueueTurn(new PendingTurn(userMessage, List.of(), future)));
        return future;
    }

    /**
     * Appends already-computed tool results and keeps generating with tools
     * enabled until a generation makes no tool calls.
     */
    public CompletableFuture<TurnResult> continueAutonomously(List<ToolExecutionOutcome> toolResults) {
        CompletableFuture<TurnResult> future = new CompletableFuture<>();
        List<ToolExecutionOutcome> outcomes = List.copyOf(toolResults);
        post(() -> enqueueTurn(new PendingTurn(null, outcomes, future)));
        return future;
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public CompletableFuture<List<Message>> getHistory() {
        return ask(() -> List.copyOf(history));
    }

    @Override
    public CompletableFuture<Void> replaceHistory(List<Message> messages) {
        List<Message> replacement = List.copyOf(messages);
        return ask(() -> {
            history.clear();
            history.addAll(replacement);
            touch();
            log.info("[Session] {} history replaced ({} messages)", sessionId, replacement.size());
            return null;
        });
    }

    /**
     * Drops every non-system message.
     */
    public CompletableFuture<Void> clearHistory() {
        return ask(() -> {
            history.removeIf(message -> !message.isSystem());
            touch();
            log.info("[Session] {} history cleared", sessionId);
            return null;
        });
    }

    /**
     * Marks the session stopped. A turn already in progress runs to completion;
     * the next submission is rejected.
     */
    public void stop() {
        stopped = true;
        log.info("[Session] {} stopped", sessionId);
        listener.onEvent(ClientEvent.aiStatus(AiStatus.STOPPED, "AI execution stopped for session " + sessionId));
    }

    public void resume() {
        stopped = false;
        log.info("[Session] {} resumed", sessionId);
        listener.onEvent(ClientEvent.aiStatus(AiStatus.READY, "AI execution resumed for session " + sessionId));
    }

    /**
     * Releases the session when its connection goes away: the in-flight stream
     * is cancelled and queued turns are abandoned.
     */
    public void close() {
        post(() -> {
            closed = true;
            if (activeTurn != null) {
                activeTurn.cancelStream();
                activeTurn.future.completeExceptionally(new CancellationException("Session closed"));
                activeTurn = null;
            }
            for (PendingTurn pending : pendingTurns) {
                pending.future().completeExceptionally(new CancellationException("Session closed"));
            }
            pendingTurns.clear();
            turnState = TurnState.IDLE;
            log.info("[Session] {} closed", sessionId);
        });
    }

    public boolean isStopped() {
        return stopped;
    }

    public TurnState getTurnState() {
        return turnState;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    // ==================== Mailbox ====================

    private void post(Runnable task) {
        boolean schedule;
        synchronized (lock) {
            mailbox.addLast(task);
            schedule = !draining;
            draining = true;
        }
        if (schedule) {
            try {
                collaborators.mailboxExecutor().execute(this::drain);
            } catch (RejectedExecutionException e) {
                synchronized (lock) {
                    draining = false;
                    mailbox.clear();
                }
                log.error("[Session] {} mailbox executor rejected work", sessionId, e);
            }
        }
    }

    private void drain() {
        while (true) {
            Runnable task;
            synchronized (lock) {
                task = mailbox.pollFirst();
                if (task == null) {
                    draining = false;
                    return;
                }
            }
            try {
                task.run();
            } catch (Exception e) { // NOSONAR - must not kill the mailbox
                log.error("[Session] {} mailbox task failed: {}", sessionId, e.getMessage(), e);
            }
        }
    }

    private <T> CompletableFuture<T> ask(Supplier<T> operation) {
        CompletableFuture<T> future = new CompletableFuture<>();
        post(() -> {
            try {
                future.complete(operation.get());
            } catch (RuntimeException e) { // NOSONAR - surfaced through the future
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    // ==================== Turn lifecycle ====================

    private void enqueueTurn(PendingTurn pending) {
        if (closed) {
            pending.future().completeExceptionally(new CancellationException("Session closed"));
            return;
        }
        pendingTurns.addLast(pending);
        startNextTurn();
    }

    private void startNextTurn() {
        while (activeTurn == null && !pendingTurns.isEmpty()) {
            PendingTurn pending = pendingTurns.pollFirst();
            if (collaborators.globalStop().getAsBoolean()) {
                log.info("[Session] {} rejected turn: AI is globally stopped", sessionId);
                pending.future().completeExceptionally(SessionStoppedException.globally());
                continue;
            }
            if (stopped) {
                log.info("[Session] {} rejected turn: session is stopped", sessionId);
                pending.future().completeExceptionally(SessionStoppedException.session());
                continue;
            }
            ActiveTurn turn = new ActiveTurn(pending.future());
            activeTurn = turn;
            beginTurn(turn, pending);
        }
    }

    private void beginTurn(ActiveTurn turn, PendingTurn pending) {
        turnState = TurnState.STREAMING;
        listener.onEvent(ClientEvent.aiStatus(AiStatus.THINKING));

        if (pending.userMessage() == null) {
            turnState = TurnState.EXECUTING_TOOLS;
            for (ToolExecutionOutcome outcome : pending.toolOutcomes()) {
                append(outcome.toMessage());
            }
            continueOrFinish(turn);
            return;
        }

        ConversationSummarizer summarizer = collaborators.summarizer();
        if (summarizer != null && summarizer.shouldAutoSummarize(history.size())) {
            log.info("[Session] {} history has {} messages, summarizing", sessionId, history.size());
            summarizer.summarize(List.copyOf(history), SummaryReason.AUTOMATIC_LENGTH_LIMIT,
                    collaborators.summaryKeepRecent(), SummaryLength.MEDIUM)
                    .whenComplete((outcome, error) -> post(() -> {
                        if (turn != activeTurn) {
                            return;
                        }
                        if (outcome != null && outcome.summarized()) {
                            history.clear();
                            history.addAll(outcome.condensedHistory());
                            touch();
                        } else {
                            log.warn("[Session] {} auto-summary skipped: {}", sessionId,
                                    error != null ? error.getMessage() : outcome.error());
                        }
                        appendUserAndGenerate(turn, pending.userMessage());
                    }));
            return;
        }
        appendUserAndGenerate(turn, pending.userMessage());
    }

    private void appendUserAndGenerate(ActiveTurn turn, String userMessage) {
        append(Message.user(userMessage));
        startGeneration(turn, continuationController.initialRequest(sessionId, history));
    }

    private void startGeneration(ActiveTurn turn, LlmRequest request) {
        turnState = TurnState.STREAMING;
        long generation = turn.beginGeneration();
        listener.onEvent(ClientEvent.streamStart(ModelNameFormatter.format(request.getModel())));
        log.debug("[Session] {} generation #{} started (model={})", sessionId, generation, request.getModel());

        try {
            turn.subscription = collaborators.llmPort().chatStream(request)
                    .timeout(collaborators.generationTimeout())
                    .subscribe(
                            delta -> post(() -> onDelta(turn, generation, delta)),
                            error -> post(() -> onGenerationFailed(turn, generation, error)),
                            () -> post(() -> onGenerationCompleted(turn, generation)));
        } catch (RuntimeException e) { // NOSONAR - a broken adapter ends the turn, not the actor
            onGenerationFailed(turn, generation, e);
        }
    }

    private void onDelta(ActiveTurn turn, long generation, StreamDelta delta) {
        if (!turn.isCurrent(activeTurn, generation)) {
            return;
        }
        if (delta instanceof StreamDelta.Content content) {
            if (content.text() != null && !content.text().isEmpty()) {
                turn.content.append(content.text());
                listener.onEvent(ClientEvent.streamChunk(content.text()));
            }
        } else if (delta instanceof StreamDelta.Thinking thinking) {
            if (thinking.text() != null && !thinking.text().isEmpty()) {
                listener.onEvent(ClientEvent.thinkingChunk(thinking.text()));
            }
        } else if (delta instanceof StreamDelta.ToolCallFragment fragment) {
            turn.assembler.accept(fragment);
        } else if (delta instanceof StreamDelta.Finish finish) {
            // the trailing [DONE] must not mask a more specific reason
            if (turn.finishReason == null || StreamDelta.Finish.STOP.equals(turn.finishReason)) {
                turn.finishReason = finish.reason();
            }
        }
    }

    private void onGenerationCompleted(ActiveTurn turn, long generation) {
        if (!turn.isCurrent(activeTurn, generation)) {
            return;
        }
        turn.subscription = null;
        String content = turn.content.toString();
        List<ToolCall> toolCalls = turn.assembler.build();

        if (toolCalls.isEmpty()) {
            String reason = turn.finishReason != null ? turn.finishReason : StreamDelta.Finish.STOP;
            listener.onEvent(ClientEvent.streamEnd(reason));
            if (!content.isEmpty()) {
                append(Message.assistant(content));
            }
            finishTurn(turn, new TurnResult(reason, content, turn.toolRounds, false));
            return;
        }

        listener.onEvent(ClientEvent.streamEnd(StreamDelta.Finish.TOOL_CALLS));
        append(Message.assistant(content.isEmpty() ? null : content, toolCalls));
        // stored with the calls, a later failure must not append it again
        turn.content = new StringBuilder();
        listener.onEvent(ClientEvent.toolUsage(continuationController.summarizeUsage(toolCalls), toolCalls));
        listener.onEvent(ClientEvent.aiStatus(AiStatus.WORKING));
        turnState = TurnState.EXECUTING_TOOLS;
        turn.toolRounds++;
        log.info("[Session] {} executing {} tool call(s), round {}", sessionId, toolCalls.size(), turn.toolRounds);

        try {
            CompletableFuture
                    .supplyAsync(() -> continuationController.executeToolRound(toolCalls, this, listener),
                            collaborators.toolExecutor())
                    .whenComplete((outcomes, error) -> post(() -> onToolRoundCompleted(turn, outcomes, error)));
        } catch (RejectedExecutionException e) {
            failTurn(turn, e);
        }
    }

    private void onToolRoundCompleted(ActiveTurn turn, List<ToolExecutionOutcome> outcomes, Throwable error) {
        if (turn != activeTurn) {
            return;
        }
        if (error != null) {
            failTurn(turn, error);
            return;
        }
        for (ToolExecutionOutcome outcome : outcomes) {
            append(outcome.toMessage());
        }
        continueOrFinish(turn);
    }

    private void continueOrFinish(ActiveTurn turn) {
        if (!continuationController.canContinue(turn.continuations)) {
            int max = continuationController.getMaxContinuations();
            log.warn("[Session] {} reached {} continuations, ending turn", sessionId, max);
            listener.onEvent(ClientEvent.streamEnd(TurnResult.REASON_MAX_CONTINUATIONS));
            listener.onEvent(ClientEvent.error(
                    "Stopped after " + max + " tool rounds without a final answer. Send a message to continue."));
            finishTurn(turn, new TurnResult(TurnResult.REASON_MAX_CONTINUATIONS, "", turn.toolRounds, false));
            return;
        }
        turn.continuations++;
        listener.onEvent(ClientEvent.aiStatus(AiStatus.THINKING));
        startGeneration(turn, continuationController.continuationRequest(sessionId, history));
    }

    private void onGenerationFailed(ActiveTurn turn, long generation, Throwable error) {
        if (!turn.isCurrent(activeTurn, generation)) {
            return;
        }
        turn.subscription = null;
        failTurn(turn, error);
    }

    private void failTurn(ActiveTurn turn, Throwable error) {
        String partial = turn.content.toString();
        if (!partial.isEmpty()) {
            append(Message.assistant(partial));
        }
        String description = describe(error);
        log.warn("[Session] {} turn failed: {}", sessionId, description);
        listener.onEvent(ClientEvent.streamEnd(TurnResult.REASON_ERROR));
        listener.onEvent(ClientEvent.error(description));
        finishTurn(turn, new TurnResult(TurnResult.REASON_ERROR, partial, turn.toolRounds, true));
    }

    private void finishTurn(ActiveTurn turn, TurnResult result) {
        activeTurn = null;
        turnState = TurnState.IDLE;
        touch();
        boolean halted = stopped || collaborators.globalStop().getAsBoolean();
        listener.onEvent(ClientEvent.aiStatus(halted ? AiStatus.STOPPED : AiStatus.READY));
        log.info("[Session] {} turn finished: reason={}, toolRounds={}", sessionId, result.finishReason(),
                result.toolRounds());
        turn.future.complete(result);
        startNextTurn();
    }

    private void append(Message message) {
        history.add(message);
        touch();
    }

    private void touch() {
        messageCount = history.size();
        lastActivity = collaborators.clock().instant();
    }

    static String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "LLM request timed out";
        }
        if (cause instanceof LlmProviderException provider) {
            return "LLM provider error (HTTP " + provider.getStatus() + "): " + abbreviate(provider.getBody());
        }
        if (cause instanceof LlmTransportException) {
            return "Connection to LLM provider failed: " + cause.getMessage();
        }
        String message = cause.getMessage();
        return "Error: " + (message != null ? message : cause.getClass().getSimpleName());
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }

    private record PendingTurn(String userMessage, List<ToolExecutionOutcome> toolOutcomes,
            CompletableFuture<TurnResult> future) {
    }

    private static final class ActiveTurn {

        private final CompletableFuture<TurnResult> future;
        private StringBuilder content = new StringBuilder();
        private ToolCallAssembler assembler = new ToolCallAssembler();
        private String finishReason;
        private Disposable subscription;
        private long generation;
        private int continuations;
        private int toolRounds;

        private ActiveTurn(CompletableFuture<TurnResult> future) {
            this.future = future;
        }

        private long beginGeneration() {
            content = new StringBuilder();
            assembler = new ToolCallAssembler();
            finishReason = null;
            return ++generation;
        }

        private boolean isCurrent(ActiveTurn active, long expectedGeneration) {
            return this == active && generation == expectedGeneration;
        }

        private void cancelStream() {
            if (subscription != null) {
                subscription.dispose();
                subscription = null;
            }
        }
    }
}
