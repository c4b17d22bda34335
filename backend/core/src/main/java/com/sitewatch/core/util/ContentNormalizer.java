package com.sitewatch.core.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces a fetched page to the part worth comparing between polls.
 */
public final class ContentNormalizer {
    private static final List<Pattern> VOLATILE_PATTERNS = List.of(
            Pattern.compile("(?is)<script\\b.*?</script>"),
            Pattern.compile("(?is)<iframe\\b.*?</iframe>"),
            Pattern.compile("(?is)<ins\\b.*?</ins>"),
            Pattern.compile("(?s)<!--.*?-->"),
            Pattern.compile("\\d{1,2}:\\d{2}:\\d{2}"),
            Pattern.compile("\\d{1,2}:\\d{2}"),
            Pattern.compile("\\d{1,2}/\\d{1,2}/\\d{2,4}"),
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}"),
            Pattern.compile("[A-Za-z]{3},\\s\\d{1,2}\\s[A-Za-z]{3}\\s\\d{4}"),
            Pattern.compile("(?i)viewcount[\"']?\\s*:\\s*[\"']?\\d+"),
            Pattern.compile("(?i)[\"']timestamp[\"']\\s*:\\s*\\d+"),
            Pattern.compile("(?i)data-timestamp=[\"']\\d+[\"']")
    );

    // First match wins.
    private static final List<Pattern> MAIN_CONTENT_PATTERNS = List.of(
            Pattern.compile("(?is)<article[^>]*>(.*?)</article>"),
            Pattern.compile("(?is)<main[^>]*>(.*?)</main>"),
            Pattern.compile("(?is)<div[^>]*class=[\"']content[\"'][^>]*>(.*?)</div>"),
            Pattern.compile("(?is)<div[^>]*class=[\"']post-content[\"'][^>]*>(.*?)</div>"),
            Pattern.compile("(?is)<div[^>]*id=[\"']content[\"'][^>]*>(.*?)</div>")
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentNormalizer() {
    }

    public static String forComparison(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        String cleaned = body;
        for (Pattern pattern : VOLATILE_PATTERNS) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        for (Pattern pattern : MAIN_CONTENT_PATTERNS) {
            Matcher matcher = pattern.matcher(cleaned);
            if (matcher.find() && !matcher.group(1).isBlank()) {
                cleaned = matcher.group(1);
                break;
            }
        }
        return collapseWhitespace(cleaned);
    }

    static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
