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

import me.golemcore.exterm.domain.component.ToolComponent;
import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.model.WebSearchResult;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolKind;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.WebPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Web search returning a Markdown list of results the model can follow up on
 * with browse_web.
 */
@Component
public class SearchWebTool implements ToolComponent {

    private final WebPort webPort;
    private final int defaultResults;
    private final int maxResults;

    public SearchWebTool(WebPort webPort, ExtermProperties properties) {
        this.webPort = webPort;
        ExtermProperties.WebToolProperties config = properties.getTools().getWeb();
        this.defaultResults = config.getDefaultResults();
        this.maxResults = config.getMaxResults();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SEARCH_WEB;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Search the web and return a list of relevant results with titles, URLs, "
                        + "and snippets.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "query", ToolDefinition.property("string",
                                "Search query (e.g., 'how to install Node.js on Ubuntu')"),
                        "max_results", ToolDefinition.property("integer",
                                "Maximum number of results to return (default: " + defaultResults
                                        + ", max: " + maxResults + ")")),
                        List.of("query")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String query = ToolArguments.string(parameters, "query");
            if (query == null || query.isBlank()) {
                return ToolResult.failure("Missing required parameter: 'query'");
            }
            int count = ToolArguments.clamp(
                    ToolArguments.integer(parameters, "max_results", defaultResults), 1, maxResults);

            WebSearchResult search = webPort.search(query, count);
            if (!search.isSuccess()) {
                return ToolResult.failure(search.getError());
            }
            List<WebSearchResult.Hit> hits = search.getResults().stream().limit(count).toList();
            return ToolResult.success()
                    .with("query", query)
                    .with("results_count", hits.size())
                    .with("results", formatResults(query, hits));
        });
    }

    static String formatResults(String query, List<WebSearchResult.Hit> hits) {
        StringBuilder sb = new StringBuilder("# Search Results for: ").append(query).append("\n\n");
        if (hits.isEmpty()) {
            return sb.append("No results found. Try different search terms or check spelling.").toString();
        }
        for (int i = 0; i < hits.size(); i++) {
            WebSearchResult.Hit hit = hits.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append(i + 1).append(". **[").append(hit.getTitle()).append("](").append(hit.getUrl()).append(")**");
            if (hit.getSnippet() != null && !hit.getSnippet().isBlank()) {
                sb.append("\n   *").append(hit.getSnippet().strip()).append('*');
            }
        }
        sb.append("\n\n*Use browse_web with any of the above URLs to read the full content. For example: "
                + "browse_web(url: \"").append(hits.get(0).getUrl()).append("\")*");
        return sb.toString();
    }
}
