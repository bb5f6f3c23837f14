package me.golemcore.exterm.domain.session;

import me.golemcore.exterm.domain.model.LlmRequest;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.SummaryLength;
import me.golemcore.exterm.domain.model.SummaryReason;
import me.golemcore.exterm.domain.model.ToolCall;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationSummarizerTest {

    private LlmPort llmPort;
    private ExtermProperties properties;
    private ConversationSummarizer summarizer;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new ExtermProperties();
        properties.getLlm().setModel("main/model");
        summarizer = new ConversationSummarizer(llmPort, properties);
    }

    private static List<Message> conversation(int exchanges) {
        List<Message> history = new ArrayList<>();
        history.add(Message.system("prompt"));
        for (int i = 1; i <= exchanges; i++) {
            history.add(Message.user("question " + i));
            history.add(Message.assistant("answer " + i));
        }
        return history;
    }

    @Test
    void shouldSkipShortHistoryWithoutCallingProvider() throws Exception {
        List<Message> history = List.of(Message.system("prompt"), Message.user("hi"), Message.assistant("hey"));

        ConversationSummarizer.SummaryOutcome outcome = summarizer
                .summarize(history, SummaryReason.USER_REQUEST, 10, SummaryLength.MEDIUM).get();

        assertTrue(outcome.success());
        assertFalse(outcome.summarized());
        assertEquals(history, outcome.condensedHistory());
        verify(llmPort, never()).complete(any());
    }

    @Test
    void shouldCondenseToSystemSummaryAndRecentMessages() throws Exception {
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture("- discussed things"));
        List<Message> history = conversation(4);

        ConversationSummarizer.SummaryOutcome outcome = summarizer
                .summarize(history, SummaryReason.USER_REQUEST, 2, SummaryLength.MEDIUM).get();

        assertTrue(outcome.summarized());
        assertEquals(9, outcome.originalCount());
        assertEquals(List.of(
                Message.system("prompt"),
                Message.system(ConversationSummarizer.SUMMARY_PREFIX + "- discussed things"),
                Message.user("question 4"),
                Message.assistant("answer 4")), outcome.condensedHistory());
        assertEquals("- discussed things", outcome.summaryPreview());
    }

    @Test
    void shouldSendIsolatedSummaryRequest() throws Exception {
        when(llmPort.complete(any())).thenReturn(CompletableFuture.completedFuture("summary"));
        properties.getLlm().setSummaryModel("cheap/model");

        summarizer.summarize(conversation(2), SummaryReason.AUTOMATIC_LENGTH_LIMIT, 10, SummaryLength.SHORT).get();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).complete(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals("cheap/model", request.getModel());
        assertEquals(ConversationSummarizer.SUMMARY_TEMPERATURE, request.getTemperature());
        assertEquals(ConversationSummarizer.SUMMARY_MAX_TOKENS, request.getMaxTokens());
        assertFalse(request.hasTools());
        assertEquals(2, request.getMessages().size());
        assertEquals(ConversationSummarizer.SUMMARIZER_SYSTEM_PROMPT, request.getMessages().get(0).getContent());
        String prompt = request.getMessages().get(1).getContent();
        assertTrue(prompt.contains("USER: question 1"));
        assertTrue(prompt.contains("ASSISTANT: answer 2"));
        assertFalse(prompt.contains("SYSTEM: prompt"));
    }

    @Test
    void shouldReportProviderFailureAndKeepHistory() throws Exception {
        when(llmPort.complete(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota exceeded")));
        List<Message> history = conversation(3);

        ConversationSummarizer.SummaryOutcome outcome = summarizer
                .summarize(history, SummaryReason.USER_REQUEST, 2, SummaryLength.MEDIUM).get();

        assertFalse(outcome.success());
        assertFalse(outcome.summarized());
        assertEquals("Error summarizing chat: quota exceeded", outcome.error());
        assertEquals(history, outcome.condensedHistory());
        assertNull(outcome.summaryPreview());
    }

    @Test
    void shouldDropToolMessagesWhoseCallFellOutOfWindow() {
        ToolCall call = ToolCall.builder().id("call_1").name("read_terminal").arguments("{}").build();
        List<Message> history = List.of(
                Message.system("prompt"),
                Message.user("check terminal"),
                Message.assistant(null, List.of(call)),
                Message.tool("call_1", "read_terminal", "{\"success\":true}"),
                Message.assistant("looks fine"));

        List<Message> condensed = ConversationSummarizer.condense(history, "s", 2);

        assertEquals(List.of(
                Message.system("prompt"),
                Message.system(ConversationSummarizer.SUMMARY_PREFIX + "s"),
                Message.assistant("looks fine")), condensed);
    }

    @Test
    void shouldKeepPendingToolCallEvenWhenNothingRecentIsKept() {
        ToolCall call = ToolCall.builder().id("call_1").name("summarize_chat").arguments("{}").build();
        Message pending = Message.assistant(null, List.of(call));
        List<Message> history = List.of(
                Message.system("prompt"),
                Message.user("hello"),
                Message.assistant("hi"),
                Message.user("summarize please"),
                pending);

        List<Message> condensed = ConversationSummarizer.condense(history, "s", 0);

        assertEquals(List.of(
                Message.system("prompt"),
                Message.system(ConversationSummarizer.SUMMARY_PREFIX + "s"),
                pending), condensed);
    }

    @Test
    void shouldAbbreviateLongPreview() {
        String summary = "x".repeat(250);
        ConversationSummarizer.SummaryOutcome outcome = new ConversationSummarizer.SummaryOutcome(true, true,
                summary, 10, List.of(), null);

        assertEquals(203, outcome.summaryPreview().length());
        assertTrue(outcome.summaryPreview().endsWith("..."));
    }

    @Test
    void shouldAutoSummarizeAboveThreshold() {
        properties.getSession().setAutoSummarizeThreshold(30);

        assertFalse(summarizer.shouldAutoSummarize(30));
        assertTrue(summarizer.shouldAutoSummarize(31));
    }
}
