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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.model.WebPage;
import me.golemcore.exterm.domain.model.WebSearchResult;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.PageContentExtractor;
import me.golemcore.exterm.port.outbound.WebPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.time.Duration;

/**
 * {@link WebPort} backed by Brave Search and plain OkHttp page fetches.
 */
@Component
@Slf4j
public class WebAdapter implements WebPort {

    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(15);

    static final String INVALID_URL = "Invalid URL format. Consider using search_web first to find the correct URL.";
    private static final String SUGGEST_SEARCH = "Try using search_web tool instead to find the website you're "
            + "looking for.";

    private final OkHttpClient okHttpClient;
    private final PageContentExtractor extractor;
    private final BraveSearchClient braveSearchClient;
    private final String userAgent;

    public WebAdapter(OkHttpClient okHttpClient, PageContentExtractor extractor,
            BraveSearchClient braveSearchClient, ExtermProperties properties) {
        this.okHttpClient = okHttpClient.newBuilder().callTimeout(FETCH_TIMEOUT).build();
        this.extractor = extractor;
        this.braveSearchClient = braveSearchClient;
        this.userAgent = properties.getTools().getWeb().getUserAgent();
    }

    @Override
    public WebSearchResult search(String query, int maxResults) {
        return braveSearchClient.search(query, maxResults);
    }

    @Override
    public WebPage fetch(String url) {
        String formatted = normalizeUrl(url);
        if (!isValidUrl(formatted)) {
            return WebPage.failed(formatted, INVALID_URL, SUGGEST_SEARCH);
        }

        Request request = new Request.Builder()
                .url(formatted)
                .header("User-Agent", userAgent)
                .get()
                .build();

        log.debug("[Web] Fetching {}", formatted);
        try (Response response = okHttpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return WebPage.failed(formatted, "Page not found (404). The URL may not exist.",
                        "Try using search_web to find the correct URL for the content you're looking for.");
            }
            if (!response.isSuccessful()) {
                return WebPage.failed(formatted, "HTTP " + response.code() + ": Failed to fetch page",
                        "The website may be down or the URL may be incorrect. "
                                + "Try search_web to find alternative sources.");
            }

            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            MediaType mediaType = body != null ? body.contentType() : null;
            String contentType = mediaType != null ? mediaType.toString() : response.header("Content-Type");
            PageContentExtractor.Extracted extracted = extractor.extract(text, contentType, formatted);
            return WebPage.builder()
                    .success(true)
                    .url(formatted)
                    .title(extracted.title())
                    .content(extracted.text())
                    .build();
        } catch (UnknownHostException e) {
            return WebPage.failed(formatted, "Domain not found. The website does not exist.",
                    "Use search_web to find the correct website or check for typos in the domain name.");
        } catch (IOException e) {
            log.debug("[Web] Fetch failed for {}: {}", formatted, e.getMessage());
            return WebPage.failed(formatted, "Network error: " + e.getMessage(),
                    "The website may be down or unreachable. Try search_web to find alternative sources.");
        } catch (RuntimeException e) { // NOSONAR - malformed pages must not escape as exceptions
            log.warn("[Web] Error browsing {}", formatted, e);
            return WebPage.failed(formatted, "Error browsing web: " + e.getMessage(),
                    "Consider using search_web first to find valid URLs.");
        }
    }

    static String normalizeUrl(String url) {
        String trimmed = url == null ? "" : url.strip();
        return trimmed.startsWith("http") ? trimmed : "https://" + trimmed;
    }

    static boolean isValidUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            String host = uri.getHost();
            return ("http".equals(scheme) || "https".equals(scheme))
                    && host != null && host.length() > 2 && host.contains(".");
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
