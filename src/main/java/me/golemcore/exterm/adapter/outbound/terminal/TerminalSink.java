package me.golemcore.exterm.adapter.outbound.terminal;

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
 * Input side of a live terminal, registered with the {@link TerminalBridge}
 * by whatever hosts the pseudo-terminal.
 */
@FunctionalInterface
public interface TerminalSink {

    /**
     * Delivers raw input to the terminal.
     *
     * @return false if the terminal can no longer accept input
     */
    boolean send(String input);
}
