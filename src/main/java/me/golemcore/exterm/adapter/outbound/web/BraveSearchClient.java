package me.golemcore.exterm.adapter.outbound.web;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.model.WebSearchResult;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.infrastructure.http.FeignClientFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Web search through the Brave Search API, retrying with exponential backoff
 * when rate limited.
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@Slf4j
public class BraveSearchClient {

    static final String BRAVE_API_URL = "https://api.search.brave.com";
    static final String NOT_CONFIGURED = "Web search is not configured. Set BRAVE_API_KEY to enable search_web.";

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final BraveSearchApi searchApi;
    private final String apiKey;
    private final long initialBackoffMs;

    @Autowired
    public BraveSearchClient(FeignClientFactory feignClientFactory, ExtermProperties properties) {
        this(feignClientFactory, properties, BRAVE_API_URL, INITIAL_BACKOFF_MS);
    }

    BraveSearchClient(FeignClientFactory feignClientFactory, ExtermProperties properties, String baseUrl,
            long initialBackoffMs) {
        this.apiKey = properties.getTools().getWeb().getBraveApiKey();
        this.initialBackoffMs = initialBackoffMs;
        this.searchApi = feignClientFactory.create(BraveSearchApi.class, baseUrl);
        if (!isConfigured()) {
            log.warn("[Web] Brave Search API key is not configured, search_web will report an error");
        }
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public WebSearchResult search(String query, int count) {
        if (!isConfigured()) {
            return WebSearchResult.failed(query, NOT_CONFIGURED);
        }

        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                log.debug("[Web] Brave search: query='{}', count={}, attempt={}", query, count, attempt);
                return toResult(query, searchApi.search(apiKey, query, count));
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < MAX_RETRIES) {
                    long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Web] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    if (!sleep(backoffMs)) {
                        return WebSearchResult.failed(query, "Search interrupted");
                    }
                } else if (e.status() == HTTP_TOO_MANY_REQUESTS) {
                    log.error("[Web] Rate limit exceeded after {} retries for query: {}", MAX_RETRIES, query);
                    return WebSearchResult.failed(query, "Search rate limit exceeded. Try again later.");
                } else if (e.status() > 0) {
                    log.error("[Web] Search API error (status {}) for query: {}", e.status(), query);
                    return WebSearchResult.failed(query,
                            "Search failed with HTTP " + e.status() + ". Try again later.");
                } else {
                    log.error("[Web] Search request failed for query: {}", query, e);
                    return WebSearchResult.failed(query,
                            "Network error: " + e.getMessage() + ". Check internet connection.");
                }
            } catch (RuntimeException e) { // NOSONAR - broad catch for unexpected errors
                log.error("[Web] Unexpected search error for query: {}", query, e);
                return WebSearchResult.failed(query, "Error searching web: " + e.getMessage());
            }
        }
        return WebSearchResult.failed(query, "Search rate limit exceeded. Try again later.");
    }

    private static WebSearchResult toResult(String query, BraveSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null
                || response.getWeb().getResults().isEmpty()) {
            return WebSearchResult.failed(query, "No search results found for '" + query
                    + "'. Try different keywords.");
        }

        List<WebSearchResult.Hit> hits = new ArrayList<>();
        for (WebResult result : response.getWeb().getResults()) {
            hits.add(new WebSearchResult.Hit(hits.size() + 1,
                    result.getTitle() != null ? result.getTitle() : "",
                    result.getUrl() != null ? result.getUrl() : "",
                    result.getDescription() != null ? result.getDescription() : ""));
        }
        return WebSearchResult.found(query, hits);
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
