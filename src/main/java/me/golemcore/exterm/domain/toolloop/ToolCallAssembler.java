package me.golemcore.exterm.domain.toolloop;

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

import me.golemcore.exterm.domain.model.StreamDelta;
import me.golemcore.exterm.domain.model.ToolCall;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Supplier;

/**
 * Merges streamed {@link StreamDelta.ToolCallFragment}s into complete
 * {@link ToolCall}s.
 *
 * <p>
 * Fragments are addressed by {@code index}. An id or name, once seen, is never
 * replaced by an absent or empty value; argument fragments are concatenated in
 * arrival order. Not thread-safe: one assembler per generation.
 */
public class ToolCallAssembler {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final List<Entry> entries = new ArrayList<>();
    private final Supplier<String> idGenerator;

    public ToolCallAssembler() {
        this(ToolCallAssembler::randomCallId);
    }

    public ToolCallAssembler(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public void accept(StreamDelta.ToolCallFragment fragment) {
        if (fragment.index() < 0) {
            return;
        }
        while (entries.size() <= fragment.index()) {
            entries.add(new Entry());
        }
        Entry entry = entries.get(fragment.index());
        entry.touched = true;
        if (hasText(fragment.id())) {
            entry.id = fragment.id();
        }
        if (hasText(fragment.name())) {
            entry.name = fragment.name();
        }
        if (fragment.argumentsFragment() != null) {
            entry.arguments.append(fragment.argumentsFragment());
        }
    }

    public boolean hasToolCalls() {
        return entries.stream().anyMatch(entry -> entry.touched);
    }

    /**
     * Finishes assembly. Entries without an id receive a generated
     * {@code call_<hex>} id; indices no fragment addressed are skipped.
     */
    public List<ToolCall> build() {
        List<ToolCall> calls = new ArrayList<>();
        for (Entry entry : entries) {
            if (!entry.touched) {
                continue;
            }
            if (entry.id == null) {
                entry.id = idGenerator.get();
            }
            calls.add(ToolCall.builder()
                    .id(entry.id)
                    .name(entry.name != null ? entry.name : "")
                    .arguments(entry.arguments.toString())
                    .build());
        }
        return calls;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    static String randomCallId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return "call_" + HexFormat.of().formatHex(bytes);
    }

    private static final class Entry {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
        private boolean touched;
    }
}
