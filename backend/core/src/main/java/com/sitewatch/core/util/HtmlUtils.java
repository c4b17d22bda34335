package com.sitewatch.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern TITLE_PATTERN = Pattern.compile("<title[^>]*>(.*?)</title>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>");
    private static final Pattern CDATA_PATTERN = Pattern.compile("<!\\[CDATA\\[(.*?)]]>", Pattern.DOTALL);
    private static final Pattern NON_TEXT_BLOCK_PATTERN = Pattern.compile(
            "<(script|style|noscript|template)\\b.*?</\\1>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Map<String, String> ENTITIES = Map.ofEntries(
            Map.entry("&nbsp;", " "),
            Map.entry("&lt;", "<"),
            Map.entry("&gt;", ">"),
            Map.entry("&quot;", "\""),
            Map.entry("&apos;", "'"),
            Map.entry("&#39;", "'"),
            Map.entry("&ndash;", "-"),
            Map.entry("&mdash;", "-"),
            Map.entry("&lsquo;", "'"),
            Map.entry("&rsquo;", "'"),
            Map.entry("&ldquo;", "\""),
            Map.entry("&rdquo;", "\"")
    );

    private HtmlUtils() {
    }

    public static Optional<String> extractTitle(String html) {
        return firstElementText(html, "title").or(() -> firstElementText(html, "h1"));
    }

    /**
     * Text of the first {@code <tag>} element, with markup removed and whitespace collapsed.
     */
    public static Optional<String> firstElementText(String html, String tag) {
        Matcher matcher = elementPattern(tag).matcher(html);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String text = toText(matcher.group(1));
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Texts of every {@code <tag>} element in document order, blank ones skipped.
     */
    public static List<String> elementTexts(String html, String tag) {
        Matcher matcher = elementPattern(tag).matcher(html);
        List<String> texts = new ArrayList<>();
        while (matcher.find()) {
            String text = toText(matcher.group(1));
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }

    public static Optional<String> firstCdata(String xml) {
        Matcher matcher = CDATA_PATTERN.matcher(xml);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String text = toText(matcher.group(1));
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public static String toText(String markup) {
        String withoutBlocks = NON_TEXT_BLOCK_PATTERN.matcher(markup).replaceAll(" ");
        String withoutCdata = CDATA_PATTERN.matcher(withoutBlocks).replaceAll("$1");
        String withoutTags = TAG_PATTERN.matcher(withoutCdata).replaceAll(" ");
        return ContentNormalizer.collapseWhitespace(decodeEntities(withoutTags));
    }

    public static String decodeEntities(String text) {
        String decoded = text;
        for (Map.Entry<String, String> entity : ENTITIES.entrySet()) {
            decoded = decoded.replace(entity.getKey(), entity.getValue());
        }
        // Last, so "&amp;lt;" decodes to the literal "&lt;".
        return decoded.replace("&amp;", "&");
    }

    private static Pattern elementPattern(String tag) {
        return Pattern.compile("<" + Pattern.quote(tag) + "(?:\\s[^>]*)?>(.*?)</" + Pattern.quote(tag) + ">",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
