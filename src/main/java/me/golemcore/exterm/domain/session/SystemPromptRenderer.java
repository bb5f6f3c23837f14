package me.golemcore.exterm.domain.session;

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
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Renders the per-session system prompt from {@code prompts/system-prompt.md}.
 */
@Service
@Slf4j
public class SystemPromptRenderer {

    static final String TEMPLATE_PATH = "prompts/system-prompt.md";

    private final Clock clock;
    private final String template;

    public SystemPromptRenderer(Clock clock) {
        this.clock = clock;
        this.template = loadTemplate();
    }

    public String render(String sessionId) {
        ZonedDateTime now = ZonedDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        Map<String, String> values = Map.of(
                "DATE", now.toLocalDate().toString(),
                "TIME", now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "OS_NAME", System.getProperty("os.name", "unknown"),
                "ARCH", System.getProperty("os.arch", "unknown"),
                "SESSION_ID", sessionId);

        String rendered = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            rendered = rendered.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return rendered;
    }

    private static String loadTemplate() {
        ClassPathResource resource = new ClassPathResource(TEMPLATE_PATH);
        try (InputStream is = resource.getInputStream()) {
            String text = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            log.info("[Prompt] Loaded system prompt template ({} chars)", text.length());
            return text;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + TEMPLATE_PATH, e);
        }
    }
}
