package me.golemcore.exterm.tools;

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
import me.golemcore.exterm.domain.component.ToolComponent;
import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.model.WebPage;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolKind;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.WebPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches a page and returns its readable content, truncated to
 * {@code max_content_length} characters.
 */
@Component
@Slf4j
public class BrowseWebTool implements ToolComponent {

    static final String TRUNCATION_MARKER = "\n\n... [Content truncated. Use max_content_length parameter for "
            + "longer content]";

    private final WebPort webPort;
    private final int defaultLength;
    private final int maxLength;

    public BrowseWebTool(WebPort webPort, ExtermProperties properties) {
        this.webPort = webPort;
        ExtermProperties.WebToolProperties config = properties.getTools().getWeb();
        this.defaultLength = config.getDefaultContentLength();
        this.maxLength = config.getMaxContentLength();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.BROWSE_WEB;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Browse a web page and extract readable content. Returns the main text content "
                        + "in markdown format.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "url", ToolDefinition.property("string",
                                "URL to browse (with or without http/https prefix)"),
                        "max_content_length", ToolDefinition.property("integer",
                                "Maximum length of content to return (default: " + defaultLength
                                        + ", max: " + maxLength + ")")),
                        List.of("url")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String url = ToolArguments.string(parameters, "url");
            if (url == null || url.isBlank()) {
                return ToolResult.failure("Missing required parameter: 'url'");
            }
            int limit = ToolArguments.clamp(
                    ToolArguments.integer(parameters, "max_content_length", defaultLength), 1, maxLength);

            WebPage page = webPort.fetch(url);
            if (!page.isSuccess()) {
                log.debug("[Tools] browse_web failed for {}: {}", url, page.getError());
                return ToolResult.failure(page.getError())
                        .with("suggestion", page.getSuggestion());
            }

            String content = page.getContent() != null ? page.getContent() : "";
            boolean truncated = content.length() > limit;
            String finalContent = truncated ? content.substring(0, limit) + TRUNCATION_MARKER : content;

            return ToolResult.success()
                    .with("url", page.getUrl())
                    .with("title", page.getTitle() != null && !page.getTitle().isBlank() ? page.getTitle() : null)
                    .with("content", finalContent)
                    .with("content_length", finalContent.length())
                    .with("truncated", truncated);
        });
    }
}
