package me.golemcore.exterm.domain.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ModelNameFormatterTest {

    @Test
    void shouldFormatProviderModelId() {
        assertEquals("Llama 3.3 70b Instruct", ModelNameFormatter.format("meta-llama/llama-3.3-70b-instruct"));
    }

    @Test
    void shouldKeepVariantSuffix() {
        assertEquals("Qwen3 235b A22b:free", ModelNameFormatter.format("qwen/qwen3-235b-a22b:free"));
    }

    @Test
    void shouldHandleUnderscoresAndExtraSeparators() {
        assertEquals("Gpt 4o Mini", ModelNameFormatter.format("gpt__4o-mini"));
    }

    @Test
    void shouldFallBackForMissingModel() {
        assertEquals("AI", ModelNameFormatter.format(null));
        assertEquals("AI", ModelNameFormatter.format("  "));
    }
}
