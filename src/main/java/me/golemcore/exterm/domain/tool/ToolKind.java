package me.golemcore.exterm.domain.tool;

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

import java.util.Arrays;

/**
 * Closed set of tools the model may call. Names match the function names
 * advertised to the provider; anything else resolves to {@link #UNKNOWN}.
 */
public enum ToolKind {

    READ_TERMINAL("read_terminal"),
    SEND_TO_TERMINAL("send_to_terminal"),
    SLEEP("sleep"),
    SUGGEST_TERMINAL_COMMAND("suggest_terminal_command"),
    GET_TERMINAL_HISTORY("get_terminal_history"),
    CREATE_FILE("create_file"),
    READ_FILE("read_file"),
    UPDATE_FILE("update_file"),
    APPEND_TO_FILE("append_to_file"),
    DELETE_FILE("delete_file"),
    EDIT_LINES("edit_lines"),
    FIND_AND_REPLACE_IN_FILE("find_and_replace_in_file"),
    LIST_FILES("list_files"),
    BROWSE_WEB("browse_web"),
    SEARCH_WEB("search_web"),
    SUMMARIZE_CHAT("summarize_chat"),
    UNKNOWN("");

    private final String toolName;

    ToolKind(String toolName) {
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    public static ToolKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(kind -> kind != UNKNOWN && kind.toolName.equals(name))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
