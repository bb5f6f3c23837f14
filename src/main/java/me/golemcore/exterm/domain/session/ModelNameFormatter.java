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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a provider model id such as {@code qwen/qwen3-235b-a22b:free} into the
 * display name sent with {@code stream_start}.
 */
public final class ModelNameFormatter {

    private ModelNameFormatter() {
    }

    public static String format(String model) {
        if (model == null || model.isBlank()) {
            return "AI";
        }
        String lastSegment = model.substring(model.lastIndexOf('/') + 1);
        return Arrays.stream(lastSegment.replace('-', ' ').replace('_', ' ').trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(ModelNameFormatter::capitalize)
                .collect(Collectors.joining(" "));
    }

    private static String capitalize(String word) {
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
