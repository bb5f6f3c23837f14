package me.golemcore.exterm.domain.model;

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

/**
 * One incremental unit of a streamed generation. Provider adapters translate
 * their wire dialect into these variants so that sessions never look at raw
 * provider JSON.
 */
public interface StreamDelta {

    /**
     * Visible answer text.
     */
    record Content(String text) implements StreamDelta {
    }

    /**
     * Reasoning text emitted by thinking models.
     */
    record Thinking(String text) implements StreamDelta {
    }

    /**
     * Partial tool call. Only the fields present in the wire fragment are
     * non-null; absent fields must not be treated as resets.
     */
    record ToolCallFragment(int index, String id, String name, String argumentsFragment) implements StreamDelta {
    }

    /**
     * End-of-generation signal carrying the provider's finish reason.
     */
    record Finish(String reason) implements StreamDelta {

        public static final String STOP = "stop";
        public static final String TOOL_CALLS = "tool_calls";
    }
}
