package me.golemcore.exterm.adapter.outbound.web;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.exterm.domain.model.WebSearchResult;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.infrastructure.http.FeignClientFactory;
import me.golemcore.exterm.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BraveSearchClientTest {

    private static final String BASE_URL = "https://brave.test";
    private static final String QUERY = "spring webflux websocket";

    private OkHttpMockEngine engine;
    private FeignClientFactory feignClientFactory;
    private ExtermProperties properties;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        ObjectMapper objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        feignClientFactory = new FeignClientFactory(engine.client(), objectMapper);
        properties = new ExtermProperties();
        properties.getTools().getWeb().setBraveApiKey("test-key");
    }

    private BraveSearchClient client() {
        return new BraveSearchClient(feignClientFactory, properties, BASE_URL, 1);
    }

    @Test
    void shouldMapResultsInOrder() {
        engine.enqueueJson(200, """
                {"web":{"results":[
                  {"title":"WebSocket support","url":"https://docs.spring.io/ws","description":"Reactive WS"},
                  {"title":"Guide","url":"https://spring.io/guides/ws"}
                ]}}
                """);

        WebSearchResult result = client().search(QUERY, 5);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getResults().size());
        assertEquals(1, result.getResults().get(0).getPosition());
        assertEquals("https://docs.spring.io/ws", result.getResults().get(0).getUrl());
        assertEquals("", result.getResults().get(1).getSnippet());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertTrue(request.target().startsWith("/res/v1/web/search?q="));
        assertTrue(request.target().endsWith("&count=5"));
        assertEquals("test-key", request.header("X-Subscription-Token"));
    }

    @Test
    void shouldReportNoResults() {
        engine.enqueueJson(200, "{\"web\":{\"results\":[]}}");

        WebSearchResult result = client().search(QUERY, 5);

        assertFalse(result.isSuccess());
        assertEquals("No search results found for '" + QUERY + "'. Try different keywords.", result.getError());
    }

    @Test
    void shouldRetryWhenRateLimited() {
        engine.enqueueJson(429, "{}");
        engine.enqueueJson(429, "{}");
        engine.enqueueJson(200, "{\"web\":{\"results\":[{\"title\":\"t\",\"url\":\"https://a.example\"}]}}");

        WebSearchResult result = client().search(QUERY, 5);

        assertTrue(result.isSuccess());
        assertEquals(3, engine.getRequestCount());
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        for (int i = 0; i < 4; i++) {
            engine.enqueueJson(429, "{}");
        }

        WebSearchResult result = client().search(QUERY, 5);

        assertFalse(result.isSuccess());
        assertEquals("Search rate limit exceeded. Try again later.", result.getError());
        assertEquals(4, engine.getRequestCount());
    }

    @Test
    void shouldReportHttpError() {
        engine.enqueueJson(500, "{\"error\":\"boom\"}");

        WebSearchResult result = client().search(QUERY, 5);

        assertEquals("Search failed with HTTP 500. Try again later.", result.getError());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldReportNetworkError() {
        engine.enqueueFailure(new IOException("connection refused"));

        WebSearchResult result = client().search(QUERY, 5);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Network error: "));
        assertTrue(result.getError().endsWith("Check internet connection."));
    }

    @Test
    void shouldRefuseWithoutApiKey() {
        properties.getTools().getWeb().setBraveApiKey(" ");

        WebSearchResult result = client().search(QUERY, 5);

        assertFalse(result.isSuccess());
        assertEquals(BraveSearchClient.NOT_CONFIGURED, result.getError());
        assertEquals(0, engine.getRequestCount());
    }
}
