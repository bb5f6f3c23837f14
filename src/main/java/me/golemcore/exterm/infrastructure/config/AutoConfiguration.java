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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.tool.ToolDispatcher;
import me.golemcore.exterm.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans shared by the session machinery, plus the startup summary.
 *
 * <p>
 * Session mailboxes and tool rounds run on separate pools so that a slow tool
 * never delays event delivery for other sessions.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ExtermProperties properties;
    private final LlmPort llmPort;
    private final ToolDispatcher toolDispatcher;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "sessionMailboxExecutor", destroyMethod = "shutdownNow")
    public static ExecutorService sessionMailboxExecutor(ExtermProperties properties) {
        return Executors.newFixedThreadPool(properties.getSession().getMailboxThreads(),
                daemonThreads("session-mailbox-"));
    }

    @Bean(name = "toolExecutor", destroyMethod = "shutdownNow")
    public static ExecutorService toolExecutor(ExtermProperties properties) {
        return Executors.newFixedThreadPool(properties.getSession().getToolThreads(),
                daemonThreads("tool-round-"));
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Exterm starting...");
        log.info("LLM Provider: {} (available: {})", llmPort.getProviderId(), llmPort.isAvailable());
        log.info("LLM Model: {}", llmPort.getCurrentModel());
        log.info("Tools: {}", toolDispatcher.getDefinitions().size());
        log.info("File workspace: {}", properties.getTools().getFilesystem().getWorkspace());
        if (!llmPort.isAvailable()) {
            log.warn("LLM provider '{}' has no API key or URL configured; chats will fail until it is set",
                    llmPort.getProviderId());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
