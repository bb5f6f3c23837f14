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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a web search. Either {@link #isSuccess()} with ranked results,
 * or a failure with an error text suitable for the model.
 */
@Value
@Builder
public class WebSearchResult {

    boolean success;
    String query;
    List<Hit> results;
    String error;

    @Value
    public static class Hit {
        int position;
        String title;
        String url;
        String snippet;
    }

    public static WebSearchResult found(String query, List<Hit> results) {
        return WebSearchResult.builder().success(true).query(query).results(List.copyOf(results)).build();
    }

    public static WebSearchResult failed(String query, String error) {
        return WebSearchResult.builder().success(false).query(query).results(List.of()).error(error).build();
    }
}
