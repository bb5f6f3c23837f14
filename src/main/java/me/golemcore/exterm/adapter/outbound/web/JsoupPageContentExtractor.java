package me.golemcore.exterm.adapter.outbound.web;

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

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import me.golemcore.exterm.port.outbound.PageContentExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reader-mode extraction: picks the main content block of an HTML page,
 * strips navigation and other noise, and renders the rest as Markdown.
 * Non-HTML bodies are returned as they are.
 */
@Component
public class JsoupPageContentExtractor implements PageContentExtractor {

    static final String EXTRACTION_NOTE = "**[Content extracted using reader-mode algorithm]**\n\n";

    private static final int MIN_MAIN_CONTENT_CHARS = 200;
    private static final int MIN_NOTE_CHARS = 100;
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");

    private static final List<String> TITLE_SELECTORS = List.of(
            "title", "h1", "meta[property=og:title]", "meta[name=twitter:title]", ".article-title", ".headline");

    private static final List<String> CONTENT_SELECTORS = List.of(
            "article", "main", "[role=main]", ".article-content", ".post-content", ".content",
            ".entry-content", "#content", ".main-content");

    private static final String ALWAYS_REMOVED = "script, style, noscript, template, iframe, form, svg, img";

    private static final String NOISE = "nav, header, footer, aside, .navigation, .nav, .menu, .advertisement, "
            + ".ads, .ad, .social, .share, .comments, .sidebar, .widget, .related";

    private final FlexmarkHtmlConverter converter = FlexmarkHtmlConverter.builder().build();

    @Override
    public Extracted extract(String body, String contentType, String url) {
        if (body == null || body.isBlank()) {
            return new Extracted(null, "");
        }
        if (!looksLikeHtml(body, contentType)) {
            return new Extracted(null, body.strip());
        }

        Document document = url != null ? Jsoup.parse(body, url) : Jsoup.parse(body);
        String title = findTitle(document);
        document.select(ALWAYS_REMOVED).remove();

        Element main = findMainContent(document);
        String markdown = converter.convert(main.outerHtml());
        String text = EXCESS_BLANK_LINES.matcher(markdown).replaceAll("\n\n").strip();
        if (text.length() > MIN_NOTE_CHARS) {
            text = EXTRACTION_NOTE + text;
        }
        return new Extracted(title, text);
    }

    static boolean looksLikeHtml(String body, String contentType) {
        if (contentType != null) {
            String type = contentType.toLowerCase(Locale.ROOT);
            if (type.contains("html")) {
                return true;
            }
            if (type.startsWith("text/plain") || type.contains("json")) {
                return false;
            }
        }
        String head = body.substring(0, Math.min(body.length(), 1024)).toLowerCase(Locale.ROOT);
        return head.contains("<html") || head.contains("<!doctype") || head.contains("<body")
                || head.contains("<div") || head.contains("<p");
    }

    private static String findTitle(Document document) {
        for (String selector : TITLE_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            String text = "meta".equals(element.tagName()) ? element.attr("content") : element.text();
            if (!text.isBlank()) {
                return text.strip();
            }
        }
        return null;
    }

    private static Element findMainContent(Document document) {
        for (String selector : CONTENT_SELECTORS) {
            Element candidate = document.selectFirst(selector);
            if (candidate != null && candidate.text().length() > MIN_MAIN_CONTENT_CHARS) {
                return candidate;
            }
        }
        Element body = document.body();
        body.select(NOISE).remove();
        return body;
    }
}
