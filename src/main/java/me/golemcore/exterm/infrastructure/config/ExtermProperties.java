package me.golemcore.exterm.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.yml.
 *
 * <p>
 * Everything lives under the {@code exterm.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - provider selection, model and sampling</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link SessionProperties} - per-conversation actor limits</li>
 * <li>{@link ToolsProperties} - file, terminal and web tools</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "exterm")
@Data
public class ExtermProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private SessionProperties session = new SessionProperties();
    private ToolsProperties tools = new ToolsProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "openrouter";
        private String model;
        private String summaryModel;
        private double temperature = 0.7;
        private int maxTokens = 2048;
        private Duration requestTimeout = Duration.ofSeconds(120);
        private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiUrl;
        private String apiKey;
        private String defaultModel;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== SESSION ====================

    @Data
    public static class SessionProperties {
        private int maxContinuations = 25;
        private Duration toolTimeout = Duration.ofSeconds(120);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int autoSummarizeThreshold = 30;
        private int summaryKeepRecent = 10;
        private int mailboxThreads = 4;
        private int toolThreads = 8;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private FileSystemToolProperties filesystem = new FileSystemToolProperties();
        private TerminalToolProperties terminal = new TerminalToolProperties();
        private WebToolProperties web = new WebToolProperties();
    }

    @Data
    public static class FileSystemToolProperties {
        private String workspace = System.getProperty("user.home") + "/.golemcore/exterm";
        private int maxReadLines = 1000;
    }

    @Data
    public static class TerminalToolProperties {
        private int historySize = 100;
        private int defaultReadLines = 20;
        private int maxReadLines = 100;
        private int maxHistoryLines = 50;
    }

    @Data
    public static class WebToolProperties {
        private String braveApiKey;
        private int defaultResults = 5;
        private int maxResults = 10;
        private int defaultContentLength = 8000;
        private int maxContentLength = 20000;
        private String userAgent = "Exterm AI Browser 1.0";
    }
}
