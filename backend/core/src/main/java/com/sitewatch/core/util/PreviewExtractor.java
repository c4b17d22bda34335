package com.sitewatch.core.util;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the short human-readable excerpt carried by live update events. Feeds, JSON documents
 * and HTML pages are recognised and summarised differently. A title line takes at most a quarter
 * of the budget, and the whole preview never exceeds the requested length plus an ellipsis.
 */
public final class PreviewExtractor {
    private static final List<String> HTML_CONTENT_TAGS = List.of("article", "main");
    private static final char[] WORD_BREAKS = {' ', '.', ',', ';', ':', '!', '?', '\n', '\r'};
    private static final char[] SENTENCE_BREAKS = {'.', '!', '?', '\n', '\r'};
    private static final String JSON_HEADING = "JSON Data\n\n";

    private PreviewExtractor() {
    }

    public static String preview(String content, int maxLength) {
        if (content == null || content.isBlank()) {
            return "";
        }
        String trimmed = content.trim();
        if (looksLikeFeed(trimmed)) {
            return feedPreview(trimmed, maxLength);
        }
        if (looksLikeJson(trimmed)) {
            return capped(JSON_HEADING + truncateAtWord(trimmed, bodyBudget(JSON_HEADING, maxLength)), maxLength);
        }
        return htmlPreview(trimmed, maxLength);
    }

    static boolean looksLikeFeed(String content) {
        String head = content.length() > 2048 ? content.substring(0, 2048) : content;
        String lowered = head.toLowerCase(Locale.ROOT);
        return lowered.contains("<?xml") || lowered.contains("<rss") || lowered.contains("<feed")
                || content.contains("<item>") || content.contains("<entry>");
    }

    static boolean looksLikeJson(String content) {
        return (content.startsWith("{") && content.endsWith("}"))
                || (content.startsWith("[") && content.endsWith("]"));
    }

    private static String feedPreview(String xml, int maxLength) {
        String heading = heading(HtmlUtils.firstElementText(xml, "title"), maxLength);
        String text = HtmlUtils.firstElementText(xml, "content")
                .or(() -> HtmlUtils.firstElementText(xml, "description"))
                .or(() -> HtmlUtils.firstElementText(xml, "summary"))
                .or(() -> HtmlUtils.firstCdata(xml))
                .orElse("");

        StringBuilder preview = new StringBuilder(heading);
        if (!text.isEmpty()) {
            preview.append(truncateAtWord(text, bodyBudget(heading, maxLength)));
        } else if (preview.length() > 0) {
            preview.append("[Feed detected - content not available]");
        } else {
            preview.append("Feed content detected, but no readable text was found.");
        }
        return capped(preview.toString(), maxLength);
    }

    private static String htmlPreview(String html, int maxLength) {
        String heading = heading(HtmlUtils.extractTitle(html), maxLength);
        String text = "";
        for (String tag : HTML_CONTENT_TAGS) {
            text = HtmlUtils.firstElementText(html, tag).orElse("");
            if (!text.isEmpty()) {
                break;
            }
        }
        if (text.isEmpty()) {
            text = String.join(" ", HtmlUtils.elementTexts(html, "p"));
        }
        if (text.isEmpty()) {
            text = HtmlUtils.firstElementText(html, "body").orElseGet(() -> HtmlUtils.toText(html));
        }

        StringBuilder preview = new StringBuilder(heading);
        if (!text.isEmpty()) {
            preview.append(truncateAtSentence(text, bodyBudget(heading, maxLength)));
        } else if (preview.length() > 0) {
            preview.append("[Content not available]");
        } else {
            preview.append("Unable to extract readable content from this page.");
        }
        return capped(preview.toString(), maxLength);
    }

    private static String heading(Optional<String> title, int maxLength) {
        return title.map(value -> truncateAtWord(value, Math.max(1, maxLength / 4)) + "\n\n").orElse("");
    }

    private static int bodyBudget(String heading, int maxLength) {
        return Math.max(1, maxLength - heading.length());
    }

    // Short budgets can still overflow through the heading or a fallback message.
    private static String capped(String preview, int maxLength) {
        return preview.length() <= maxLength + 3 ? preview : truncateAtWord(preview, maxLength);
    }

    static String truncateAtWord(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, lastBreakBefore(text, maxLength, WORD_BREAKS).orElse(maxLength)).stripTrailing() + "...";
    }

    static String truncateAtSentence(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        // A sentence break in the first half would throw away most of the budget.
        int cut = lastBreakBefore(text, maxLength, SENTENCE_BREAKS)
                .filter(index -> index > maxLength / 2)
                .or(() -> lastBreakBefore(text, maxLength, WORD_BREAKS))
                .orElse(maxLength);
        return text.substring(0, cut).stripTrailing() + "...";
    }

    private static Optional<Integer> lastBreakBefore(String text, int maxLength, char[] breaks) {
        for (int i = Math.min(maxLength, text.length()) - 1; i > 0; i--) {
            char c = text.charAt(i);
            for (char candidate : breaks) {
                if (c == candidate) {
                    return Optional.of(i + 1);
                }
            }
        }
        return Optional.empty();
    }
}
