package me.golemcore.exterm.adapter.outbound.web;

import me.golemcore.exterm.domain.model.WebPage;
import me.golemcore.exterm.domain.model.WebSearchResult;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.UnknownHostException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WebAdapterTest {

    private OkHttpMockEngine engine;
    private BraveSearchClient braveSearchClient;
    private WebAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        braveSearchClient = mock(BraveSearchClient.class);
        adapter = new WebAdapter(engine.client(), new JsoupPageContentExtractor(), braveSearchClient,
                new ExtermProperties());
    }

    @Test
    void shouldFetchAndExtractPage() {
        engine.enqueueText(200, "<html><head><title>Docs</title></head><body><p>Hello docs</p></body></html>",
                "text/html; charset=utf-8");

        WebPage page = adapter.fetch("example.com/docs");

        assertTrue(page.isSuccess());
        assertEquals("https://example.com/docs", page.getUrl());
        assertEquals("Docs", page.getTitle());
        assertEquals("Hello docs", page.getContent());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/docs", request.target());
        assertEquals("Exterm AI Browser 1.0", request.header("User-Agent"));
    }

    @Test
    void shouldReturnPlainTextBodies() {
        engine.enqueueText(200, "just text", "text/plain");

        WebPage page = adapter.fetch("https://example.com/robots.txt");

        assertEquals("just text", page.getContent());
    }

    @Test
    void shouldRejectInvalidUrlWithoutRequest() {
        WebPage page = adapter.fetch("not a url");

        assertFalse(page.isSuccess());
        assertEquals(WebAdapter.INVALID_URL, page.getError());
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldReportNotFound() {
        engine.enqueueText(404, "missing", "text/html");

        WebPage page = adapter.fetch("https://example.com/gone");

        assertFalse(page.isSuccess());
        assertEquals("Page not found (404). The URL may not exist.", page.getError());
        assertTrue(page.getSuggestion().contains("search_web"));
    }

    @Test
    void shouldReportOtherHttpErrors() {
        engine.enqueueText(503, "busy", "text/html");

        WebPage page = adapter.fetch("https://example.com");

        assertEquals("HTTP 503: Failed to fetch page", page.getError());
    }

    @Test
    void shouldReportUnknownHost() {
        engine.enqueueFailure(new UnknownHostException("nowhere.example"));

        WebPage page = adapter.fetch("https://nowhere.example");

        assertEquals("Domain not found. The website does not exist.", page.getError());
    }

    @Test
    void shouldReportNetworkError() {
        engine.enqueueFailure(new IOException("connection reset"));

        WebPage page = adapter.fetch("https://example.com");

        assertEquals("Network error: connection reset", page.getError());
    }

    @Test
    void shouldDelegateSearchToBrave() {
        WebSearchResult expected = WebSearchResult.found("q", List.of());
        when(braveSearchClient.search("q", 3)).thenReturn(expected);

        assertEquals(expected, adapter.search("q", 3));
    }

    @Test
    void shouldNormalizeAndValidateUrls() {
        assertEquals("https://example.com", WebAdapter.normalizeUrl("  example.com "));
        assertEquals("http://example.com", WebAdapter.normalizeUrl("http://example.com"));
        assertTrue(WebAdapter.isValidUrl("https://docs.example.com/a?b=c"));
        assertFalse(WebAdapter.isValidUrl("https://localhost"));
        assertFalse(WebAdapter.isValidUrl("ftp://example.com"));
    }
}
