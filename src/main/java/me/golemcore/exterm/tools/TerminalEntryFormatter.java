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

import me.golemcore.exterm.domain.model.TerminalEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shapes terminal history entries for tool results.
 */
final class TerminalEntryFormatter {

    private TerminalEntryFormatter() {
    }

    static List<Map<String, Object>> format(List<TerminalEntry> entries) {
        return entries.stream().map(TerminalEntryFormatter::format).toList();
    }

    private static Map<String, Object> format(TerminalEntry entry) {
        Map<String, Object> formatted = new LinkedHashMap<>();
        formatted.put("type", entry.getType().name().toLowerCase(Locale.ROOT));
        formatted.put("content", entry.getContent() != null ? entry.getContent().strip() : "");
        formatted.put("timestamp", entry.getTimestamp() != null ? entry.getTimestamp().toString() : null);
        return formatted;
    }
}
