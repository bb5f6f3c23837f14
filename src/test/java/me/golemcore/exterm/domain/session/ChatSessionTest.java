package me.golemcore.exterm.domain.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.exterm.domain.component.ToolComponent;
import me.golemcore.exterm.domain.exception.LlmProviderException;
import me.golemcore.exterm.domain.exception.LlmTransportException;
import me.golemcore.exterm.domain.exception.SessionStoppedException;
import me.golemcore.exterm.domain.model.ClientEvent;
import me.golemcore.exterm.domain.model.LlmRequest;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.StreamDelta;
import me.golemcore.exterm.domain.model.ToolCall;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.model.TurnState;
import me.golemcore.exterm.domain.tool.ToolDispatcher;
import me.golemcore.exterm.domain.toolloop.ContinuationController;
import me.golemcore.exterm.domain.toolloop.ToolExecutionOutcome;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.LlmPort;
import me.golemcore.exterm.tools.ListFilesTool;
import me.golemcore.exterm.tools.SummarizeChatTool;
import me.golemcore.exterm.tools.WorkspacePaths;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatSessionTest {

    private static final String SESSION_ID = "chat_test";
    private static final String MODEL = "meta-llama/llama-3.3-70b-instruct";
    private static final String SYSTEM_PROMPT = "You are Exterm.";

    @TempDir
    Path workspace;

    private ExtermProperties properties;
    private LlmPort llmPort;
    private ExecutorService mailboxExecutor;
    private ExecutorService toolExecutor;
    private AtomicBoolean globalStop;
    private List<ClientEvent> events;
    private ChatSession session;

    @BeforeEach
    void setUp() {
        properties = new ExtermProperties();
        properties.getLlm().setModel(MODEL);
        properties.getSession().setMaxContinuations(2);
        properties.getTools().getFilesystem().setWorkspace(workspace.toString());

        llmPort = mock(LlmPort.class);
        mailboxExecutor = Executors.newSingleThreadExecutor();
        toolExecutor = Executors.newCachedThreadPool();
        globalStop = new AtomicBoolean(false);
        events = new CopyOnWriteArrayList<>();

        session = newSession(List.of(new ListFilesTool(new WorkspacePaths(properties))), null, toolExecutor);
    }

    private ChatSession newSession(List<ToolComponent> tools, ConversationSummarizer summarizer,
            Executor toolRunner) {
        ObjectMapper objectMapper = new ObjectMapper();
        ToolDispatcher dispatcher = new ToolDispatcher(tools, objectMapper, properties);
        ContinuationController controller = new ContinuationController(llmPort, dispatcher, objectMapper,
                properties);
        SessionCollaborators collaborators = new SessionCollaborators(llmPort, controller, summarizer,
                mailboxExecutor, toolRunner, globalStop::get, Duration.ofSeconds(5), 10,
                Clock.systemUTC());
        return new ChatSession(SESSION_ID, List.of(Message.system(SYSTEM_PROMPT)), events::add, collaborators);
    }

    private static List<Message> conversation(int size) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(SYSTEM_PROMPT));
        for (int i = 0; i < size; i++) {
            messages.add(i % 2 == 0 ? Message.user("question " + i) : Message.assistant("answer " + i));
        }
        return messages;
    }

    @AfterEach
    void tearDown() {
        mailboxExecutor.shutdownNow();
        toolExecutor.shutdownNow();
    }

    private static Flux<StreamDelta> answer(String... chunks) {
        List<StreamDelta> deltas = new ArrayList<>();
        for (String chunk : chunks) {
            deltas.add(new StreamDelta.Content(chunk));
        }
        deltas.add(new StreamDelta.Finish(StreamDelta.Finish.STOP));
        return Flux.fromIterable(deltas);
    }

    private static Flux<StreamDelta> listFilesCall(String id, String path) {
        return Flux.just(
                new StreamDelta.ToolCallFragment(0, id, "list_files", "{\"path\":"),
                new StreamDelta.ToolCallFragment(0, null, null, "\"" + path + "\"}"),
                new StreamDelta.Finish(StreamDelta.Finish.TOOL_CALLS),
                new StreamDelta.Finish(StreamDelta.Finish.STOP));
    }

    private List<Message> history() throws Exception {
        return session.getHistory().get(5, TimeUnit.SECONDS);
    }

    private List<String> types() {
        return events.stream().map(ClientEvent::getType).toList();
    }

    private List<Object> statuses() {
        return events.stream()
                .filter(event -> ClientEvent.TYPE_AI_STATUS.equals(event.getType()))
                .map(event -> event.get("status"))
                .toList();
    }

    @Test
    void shouldStreamPlainAnswerAndAppendItToHistory() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(answer("Hel", "lo"));

        TurnResult result = session.submit("hi").get(5, TimeUnit.SECONDS);

        assertEquals(StreamDelta.Finish.STOP, result.finishReason());
        assertEquals("Hello", result.finalContent());
        assertEquals(0, result.toolRounds());
        assertFalse(result.failed());

        assertEquals(List.of("ai_status", "stream_start", "stream_chunk", "stream_chunk", "stream_end", "ai_status"),
                types());
        assertEquals("Llama 3.3 70b Instruct", events.get(1).get("model"));
        assertEquals("Hel", events.get(2).get("content"));
        assertEquals("lo", events.get(3).get("content"));
        assertEquals("stop", events.get(4).get("reason"));
        assertEquals(List.of("thinking", "ready"), statuses());

        List<Message> history = history();
        assertEquals(3, history.size());
        assertEquals(SYSTEM_PROMPT, history.get(0).getContent());
        assertEquals(Message.user("hi"), history.get(1));
        assertEquals(Message.assistant("Hello"), history.get(2));
        assertEquals(3, session.getMessageCount());
        assertEquals(TurnState.IDLE, session.getTurnState());
    }

    @Test
    void shouldSendWholeHistoryWithModelAndTools() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(answer("ok"));

        session.submit("hi").get(5, TimeUnit.SECONDS);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals(MODEL, request.getModel());
        assertEquals(List.of(Message.system(SYSTEM_PROMPT), Message.user("hi")), request.getMessages());
        assertEquals("list_files", request.getTools().get(0).getName());
        assertEquals(SESSION_ID, request.getSessionId());
    }

    @Test
    void shouldForwardThinkingWithoutStoringIt() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                new StreamDelta.Thinking("pondering"),
                new StreamDelta.Content("answer"),
                new StreamDelta.Finish(StreamDelta.Finish.STOP)));

        session.submit("hi").get(5, TimeUnit.SECONDS);

        ClientEvent thinking = events.stream()
                .filter(event -> ClientEvent.ROLE_THINKING.equals(event.get("role")))
                .findFirst()
                .orElseThrow();
        assertEquals("pondering", thinking.get("content"));
        assertEquals(Message.assistant("answer"), history().get(2));
    }

    @Test
    void shouldNotAppendEmptyAssistantMessage() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(new StreamDelta.Finish(StreamDelta.Finish.STOP)));

        session.submit("hi").get(5, TimeUnit.SECONDS);

        assertEquals(2, history().size());
    }

    @Test
    void shouldKeepMoreSpecificFinishReasonOverTrailingDone() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                new StreamDelta.Content("truncated"),
                new StreamDelta.Finish("length"),
                new StreamDelta.Finish(StreamDelta.Finish.STOP)));

        TurnResult result = session.submit("hi").get(5, TimeUnit.SECONDS);

        assertEquals("length", result.finishReason());
    }

    @Test
    void shouldRunToolRoundAndContinueUntilFinalAnswer() throws Exception {
        when(llmPort.chatStream(any()))
                .thenReturn(listFilesCall("call_1", "missing"))
                .thenReturn(answer("That directory does not exist."));

        TurnResult result = session.submit("what is in missing?").get(5, TimeUnit.SECONDS);

        assertEquals(StreamDelta.Finish.STOP, result.finishReason());
        assertEquals(1, result.toolRounds());

        List<Message> history = history();
        assertEquals(5, history.size());
        Message assistantCall = history.get(2);
        assertNull(assistantCall.getContent());
        ToolCall call = assistantCall.getToolCalls().get(0);
        assertEquals("call_1", call.getId());
        assertEquals("{\"path\":\"missing\"}", call.getArguments());

        Message toolMessage = history.get(3);
        assertEquals(Message.ROLE_TOOL, toolMessage.getRole());
        assertEquals("call_1", toolMessage.getToolCallId());
        assertTrue(toolMessage.getContent().contains("\"success\":false"));
        assertTrue(toolMessage.getContent().contains("no such directory: missing"));
        assertEquals(Message.assistant("That directory does not exist."), history.get(4));

        assertEquals(List.of(
                "ai_status", "stream_start", "stream_end", "tool_usage", "ai_status", "tool_result",
                "ai_status", "stream_start", "stream_chunk", "stream_end", "ai_status"), types());
        assertEquals("tool_calls", events.get(2).get("reason"));
        assertEquals("Using list_files tool", events.get(3).get("content"));
        assertEquals(List.of("thinking", "working", "thinking", "ready"), statuses());
        ToolResult toolResult = (ToolResult) events.get(5).get("result");
        assertFalse(toolResult.isSuccess());
    }

    @Test
    void shouldConvergeAfterTwoToolRounds() throws Exception {
        properties.getSession().setMaxContinuations(5);
        when(llmPort.chatStream(any()))
                .thenReturn(listFilesCall("call_1", "."))
                .thenReturn(listFilesCall("call_2", "missing"))
                .thenReturn(answer("Nothing there."));

        TurnResult result = session.submit("look around").get(5, TimeUnit.SECONDS);

        assertEquals(2, result.toolRounds());
        assertFalse(result.failed());
        assertEquals("Nothing there.", result.finalContent());
        verify(llmPort, times(3)).chatStream(any());
        assertEquals(TurnState.IDLE, session.getTurnState());

        List<Message> history = history();
        assertEquals(7, history.size());
        assertEquals("call_1", history.get(2).getToolCalls().get(0).getId());
        assertEquals("call_1", history.get(3).getToolCallId());
        assertEquals("call_2", history.get(4).getToolCalls().get(0).getId());
        assertEquals("call_2", history.get(5).getToolCallId());
        assertEquals(Message.assistant("Nothing there."), history.get(6));
        assertEquals(List.of("thinking", "working", "thinking", "working", "thinking", "ready"), statuses());
    }

    @Test
    void shouldKeepPendingCallWhenModelSummarizesEverything() throws Exception {
        ConversationSummarizer summarizer = new ConversationSummarizer(llmPort, properties);
        session = newSession(List.of(new SummarizeChatTool(summarizer, properties)), summarizer, toolExecutor);
        session.replaceHistory(conversation(8)).get(5, TimeUnit.SECONDS);
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture("earlier questions"));
        when(llmPort.chatStream(any()))
                .thenReturn(Flux.just(
                        new StreamDelta.ToolCallFragment(0, "c1", "summarize_chat",
                                "{\"reason\":\"user_request\",\"max_history_length\":0}"),
                        new StreamDelta.Finish(StreamDelta.Finish.TOOL_CALLS)))
                .thenReturn(answer("Summarized."));

        TurnResult result = session.submit("summarize the chat").get(5, TimeUnit.SECONDS);

        assertFalse(result.failed());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chatStream(captor.capture());
        List<Message> followUp = captor.getAllValues().get(1).getMessages();
        assertEquals(5, followUp.size());
        assertEquals(Message.system(SYSTEM_PROMPT), followUp.get(0));
        assertEquals(Message.system(ConversationSummarizer.SUMMARY_PREFIX + "earlier questions"), followUp.get(1));
        assertEquals("c1", followUp.get(2).getToolCalls().get(0).getId());
        assertEquals(Message.ROLE_TOOL, followUp.get(3).getRole());
        assertEquals("c1", followUp.get(3).getToolCallId());
        assertTrue(followUp.get(3).getContent().contains("\"success\":true"));
        assertEquals(Message.user(ContinuationController.CONTINUATION_PROMPT), followUp.get(4));

        List<Message> history = history();
        assertEquals(5, history.size());
        assertEquals(Message.assistant("Summarized."), history.get(4));
    }

    @Test
    void shouldAutoSummarizeLongHistoryBeforeGenerating() throws Exception {
        ConversationSummarizer summarizer = new ConversationSummarizer(llmPort, properties);
        session = newSession(List.of(), summarizer, toolExecutor);
        List<Message> longHistory = conversation(30);
        session.replaceHistory(longHistory).get(5, TimeUnit.SECONDS);
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture("thirty messages of chat"));
        when(llmPort.chatStream(any())).thenReturn(answer("ok"));

        session.submit("next question").get(5, TimeUnit.SECONDS);

        ArgumentCaptor<LlmRequest> summaryCaptor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).complete(summaryCaptor.capture());
        assertEquals(2, summaryCaptor.getValue().getMessages().size());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        List<Message> expected = new ArrayList<>();
        expected.add(Message.system(SYSTEM_PROMPT));
        expected.add(Message.system(ConversationSummarizer.SUMMARY_PREFIX + "thirty messages of chat"));
        expected.addAll(longHistory.subList(21, 31));
        expected.add(Message.user("next question"));
        assertEquals(expected, captor.getValue().getMessages());

        assertEquals(14, history().size());
        assertEquals(TurnState.IDLE, session.getTurnState());
    }

    @Test
    void shouldGenerateWithFullHistoryWhenAutoSummaryFails() throws Exception {
        ConversationSummarizer summarizer = new ConversationSummarizer(llmPort, properties);
        session = newSession(List.of(), summarizer, toolExecutor);
        List<Message> longHistory = conversation(30);
        session.replaceHistory(longHistory).get(5, TimeUnit.SECONDS);
        when(llmPort.complete(any()))
                .thenReturn(CompletableFuture.failedFuture(new LlmProviderException(500, "down")));
        when(llmPort.chatStream(any())).thenReturn(answer("ok"));

        TurnResult result = session.submit("next question").get(5, TimeUnit.SECONDS);

        assertFalse(result.failed());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        List<Message> sent = captor.getValue().getMessages();
        assertEquals(32, sent.size());
        assertEquals(longHistory, sent.subList(0, 31));
        assertEquals(Message.user("next question"), sent.get(31));
        assertEquals(33, history().size());
    }

    @Test
    void shouldNotDuplicateAssistantMessageWhenToolRoundCannotStart() throws Exception {
        Executor saturated = command -> {
            throw new RejectedExecutionException("tool pool saturated");
        };
        session = newSession(List.of(new ListFilesTool(new WorkspacePaths(properties))), null, saturated);
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                new StreamDelta.Content("Let me check."),
                new StreamDelta.ToolCallFragment(0, "call_1", "list_files", "{}"),
                new StreamDelta.Finish(StreamDelta.Finish.TOOL_CALLS)));

        TurnResult result = session.submit("what is here?").get(5, TimeUnit.SECONDS);

        assertTrue(result.failed());
        List<Message> history = history();
        assertEquals(3, history.size());
        assertEquals("Let me check.", history.get(2).getContent());
        assertEquals("call_1", history.get(2).getToolCalls().get(0).getId());
        assertEquals(TurnState.IDLE, session.getTurnState());
    }

    @Test
    void shouldAppendContinuationPromptOnlyToRequest() throws Exception {
        when(llmPort.chatStream(any()))
                .thenReturn(listFilesCall("call_1", "."))
                .thenReturn(answer("done"));

        session.submit("list").get(5, TimeUnit.SECONDS);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chatStream(captor.capture());
        List<Message> followUp = captor.getAllValues().get(1).getMessages();
        assertEquals(5, followUp.size());
        assertEquals(Message.user(ContinuationController.CONTINUATION_PROMPT), followUp.get(4));

        assertTrue(history().stream()
                .noneMatch(message -> ContinuationController.CONTINUATION_PROMPT.equals(message.getContent())));
    }

    @Test
    void shouldEndTurnAfterMaxContinuations() throws Exception {
        when(llmPort.chatStream(any())).thenAnswer(invocation -> listFilesCall("call_x", "."));

        TurnResult result = session.submit("loop forever").get(5, TimeUnit.SECONDS);

        assertEquals(TurnResult.REASON_MAX_CONTINUATIONS, result.finishReason());
        assertEquals(3, result.toolRounds());
        verify(llmPort, times(3)).chatStream(any());

        ClientEvent error = events.stream()
                .filter(event -> ClientEvent.TYPE_ERROR.equals(event.getType()))
                .findFirst()
                .orElseThrow();
        assertTrue(error.get("content").toString().contains("2 tool rounds"));
        assertEquals("ready", statuses().get(statuses().size() - 1));
    }

    @Test
    void shouldKeepPartialContentWhenStreamFails() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(Flux.concat(
                Flux.just(new StreamDelta.Content("partial")),
                Flux.error(new LlmProviderException(503, "overloaded"))));

        TurnResult result = session.submit("hi").get(5, TimeUnit.SECONDS);

        assertTrue(result.failed());
        assertEquals(TurnResult.REASON_ERROR, result.finishReason());
        assertEquals(Message.assistant("partial"), history().get(2));

        int end = types().indexOf(ClientEvent.TYPE_STREAM_END);
        assertEquals("error", events.get(end).get("reason"));
        assertEquals(ClientEvent.TYPE_ERROR, events.get(end + 1).getType());
        assertEquals("LLM provider error (HTTP 503): overloaded", events.get(end + 1).get("content"));
        assertEquals("ready", statuses().get(statuses().size() - 1));
    }

    @Test
    void shouldReportSynchronousAdapterFailure() throws Exception {
        when(llmPort.chatStream(any())).thenThrow(new IllegalStateException("not configured"));

        TurnResult result = session.submit("hi").get(5, TimeUnit.SECONDS);

        assertTrue(result.failed());
        assertEquals(2, history().size());
    }

    @Test
    void shouldDescribeFailures() {
        assertEquals("LLM request timed out", ChatSession.describe(new TimeoutException()));
        assertEquals("Connection to LLM provider failed: reset",
                ChatSession.describe(new LlmTransportException("reset", null)));
        assertEquals("Error: boom",
                ChatSession.describe(new CompletionException(new IllegalStateException("boom"))));
        assertEquals("Error: NullPointerException", ChatSession.describe(new NullPointerException()));
    }

    @Test
    void shouldProcessQueuedTurnsInOrder() throws Exception {
        when(llmPort.chatStream(any()))
                .thenReturn(answer("first answer"))
                .thenReturn(answer("second answer"));

        CompletableFuture<TurnResult> first = session.submit("first");
        CompletableFuture<TurnResult> second = session.submit("second");
        second.get(5, TimeUnit.SECONDS);

        assertTrue(first.isDone());
        assertEquals(List.of(
                Message.system(SYSTEM_PROMPT),
                Message.user("first"),
                Message.assistant("first answer"),
                Message.user("second"),
                Message.assistant("second answer")), history());
    }

    @Test
    void shouldLetActiveTurnFinishWhenStopped() throws Exception {
        Sinks.Many<StreamDelta> sink = Sinks.many().unicast().onBackpressureBuffer();
        CountDownLatch subscribed = new CountDownLatch(1);
        when(llmPort.chatStream(any())).thenReturn(sink.asFlux().doOnSubscribe(s -> subscribed.countDown()));

        CompletableFuture<TurnResult> turn = session.submit("long task");
        assertTrue(subscribed.await(5, TimeUnit.SECONDS));

        session.stop();
        sink.tryEmitNext(new StreamDelta.Content("still finishing"));
        sink.tryEmitNext(new StreamDelta.Finish(StreamDelta.Finish.STOP));
        sink.tryEmitComplete();

        TurnResult result = turn.get(5, TimeUnit.SECONDS);
        assertEquals("still finishing", result.finalContent());
        assertTrue(session.isStopped());
        assertEquals("stopped", statuses().get(statuses().size() - 1));

        ExecutionException rejected = assertThrows(ExecutionException.class,
                () -> session.submit("next").get(5, TimeUnit.SECONDS));
        assertInstanceOf(SessionStoppedException.class, rejected.getCause());
        assertEquals(SessionStoppedException.SESSION_STOPPED, rejected.getCause().getMessage());
        assertEquals(3, history().size());
    }

    @Test
    void shouldAcceptTurnsAgainAfterResume() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(answer("back"));
        session.stop();
        session.resume();

        TurnResult result = session.submit("hello again").get(5, TimeUnit.SECONDS);

        assertEquals("back", result.finalContent());
        assertFalse(session.isStopped());
    }

    @Test
    void shouldRejectTurnsWhileGloballyStopped() {
        globalStop.set(true);

        ExecutionException rejected = assertThrows(ExecutionException.class,
                () -> session.submit("hi").get(5, TimeUnit.SECONDS));

        SessionStoppedException cause = assertInstanceOf(SessionStoppedException.class, rejected.getCause());
        assertTrue(cause.isGlobal());
        verify(llmPort, never()).chatStream(any());
    }

    @Test
    void shouldCancelStreamWhenClosed() throws Exception {
        CountDownLatch subscribed = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        when(llmPort.chatStream(any())).thenReturn(Flux.<StreamDelta>never()
                .doOnSubscribe(s -> subscribed.countDown())
                .doOnCancel(cancelled::countDown));

        CompletableFuture<TurnResult> turn = session.submit("hang");
        assertTrue(subscribed.await(5, TimeUnit.SECONDS));
        session.close();

        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
        ExecutionException error = assertThrows(ExecutionException.class, () -> turn.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, error.getCause());

        ExecutionException afterClose = assertThrows(ExecutionException.class,
                () -> session.submit("again").get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, afterClose.getCause());
    }

    @Test
    void shouldClearEverythingButSystemMessages() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(answer("hello"));
        session.submit("hi").get(5, TimeUnit.SECONDS);

        session.clearHistory().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(Message.system(SYSTEM_PROMPT)), history());
        assertEquals(1, session.getMessageCount());
    }

    @Test
    void shouldReplaceHistoryThroughToolContext() throws Exception {
        List<Message> replacement = List.of(Message.system(SYSTEM_PROMPT), Message.system("summary"));

        session.replaceHistory(replacement).get(5, TimeUnit.SECONDS);

        assertEquals(replacement, history());
    }

    @Test
    void shouldContinueAutonomouslyFromToolResults() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(answer("Based on the output, all good."));
        ToolCall call = ToolCall.builder().id("call_9").name("read_terminal").arguments("{}").build();
        ToolExecutionOutcome outcome = new ToolExecutionOutcome(call, ToolResult.success("read"),
                "{\"success\":true,\"message\":\"read\"}");

        TurnResult result = session.continueAutonomously(List.of(outcome)).get(5, TimeUnit.SECONDS);

        assertEquals("Based on the output, all good.", result.finalContent());
        List<Message> history = history();
        assertEquals(Message.tool("call_9", "read_terminal", "{\"success\":true,\"message\":\"read\"}"),
                history.get(1));
        assertEquals(Message.assistant("Based on the output, all good."), history.get(2));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        List<Message> sent = captor.getValue().getMessages();
        assertEquals(Message.user(ContinuationController.CONTINUATION_PROMPT), sent.get(sent.size() - 1));
    }
}
