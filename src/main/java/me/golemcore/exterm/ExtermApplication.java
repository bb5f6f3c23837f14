package me.golemcore.exterm;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Exterm, the AI side of a browser
 * terminal.
 *
 * <p>
 * Each chat WebSocket ({@code /ws/chat}) gets a session that streams model
 * output to the client and runs tool rounds (terminal, files, web, chat
 * summary) until the model produces a final answer. Sessions can be stopped
 * one by one or all at once through the {@code /api} admin endpoints.
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration lives in {@code application.yml} under the
 * {@code exterm.*} prefix; API keys come from environment variables.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ExtermApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExtermApplication.class, args);
    }

}
