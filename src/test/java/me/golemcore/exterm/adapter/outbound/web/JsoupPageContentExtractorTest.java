package me.golemcore.exterm.adapter.outbound.web;

import me.golemcore.exterm.port.outbound.PageContentExtractor.Extracted;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsoupPageContentExtractorTest {

    private static final String ARTICLE_TEXT = "Installing the toolchain takes a few steps. "
            + "First download the archive, then unpack it into your home directory and add the bin folder "
            + "to your PATH so that the shell can find the binaries when you open a new terminal window.";

    private final JsoupPageContentExtractor extractor = new JsoupPageContentExtractor();

    @Test
    void shouldExtractMainArticleAsMarkdown() {
        String html = """
                <html><head><title>Setup Guide</title><script>var x = 1;</script></head>
                <body>
                  <nav><a href="/">Home</a> <a href="/blog">Blog</a></nav>
                  <article><h2>Install</h2><p>%s</p></article>
                  <footer>Copyright footer text</footer>
                </body></html>
                """.formatted(ARTICLE_TEXT);

        Extracted extracted = extractor.extract(html, "text/html; charset=utf-8", "https://example.com/setup");

        assertEquals("Setup Guide", extracted.title());
        assertTrue(extracted.text().startsWith(JsoupPageContentExtractor.EXTRACTION_NOTE));
        assertTrue(extracted.text().contains("Install"));
        assertTrue(extracted.text().contains("add the bin folder"));
        assertFalse(extracted.text().contains("var x"));
        assertFalse(extracted.text().contains("Copyright footer"));
    }

    @Test
    void shouldStripNoiseFromBodyWithoutMainBlock() {
        String html = """
                <html><body>
                  <header>Site header</header>
                  <div class="sidebar">Popular posts</div>
                  <p>Short page.</p>
                </body></html>
                """;

        Extracted extracted = extractor.extract(html, "text/html", "https://example.com");

        assertEquals("Short page.", extracted.text());
        assertNull(extracted.title());
    }

    @Test
    void shouldFallBackToOpenGraphTitle() {
        String html = "<html><head><meta property=\"og:title\" content=\"OG Title\"></head>"
                + "<body><p>Body</p></body></html>";

        Extracted extracted = extractor.extract(html, "text/html", null);

        assertEquals("OG Title", extracted.title());
    }

    @Test
    void shouldReturnPlainTextAsIs() {
        Extracted extracted = extractor.extract("  {\"status\":\"ok\"}\n", "application/json", "https://api.example.com");

        assertEquals("{\"status\":\"ok\"}", extracted.text());
        assertNull(extracted.title());
    }

    @Test
    void shouldSniffHtmlWithoutContentType() {
        assertTrue(JsoupPageContentExtractor.looksLikeHtml("<!DOCTYPE html><html></html>", null));
        assertFalse(JsoupPageContentExtractor.looksLikeHtml("plain words", null));
        assertFalse(JsoupPageContentExtractor.looksLikeHtml("<p>tag</p>", "text/plain"));
    }

    @Test
    void shouldHandleEmptyBody() {
        assertEquals("", extractor.extract("", "text/html", null).text());
    }
}
