package com.sitewatch.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentNormalizerTest {
    @Test
    void removesVolatileFragments() {
        String page = "<div>Price 10</div><!-- build 77 --><iframe src='ad'>x</iframe>"
                + "<p>Updated 2024-05-01 at 10:30</p><div data-timestamp=\"1714550000\">ok</div>";

        assertEquals("<div>Price 10</div><p>Updated at </p><div >ok</div>",
                ContentNormalizer.forComparison(page));
    }

    @Test
    void keepsOnlyTheMainArticleWhenPresent() {
        String first = "<header>Ad slot 1</header><article><h2>Story</h2><p>Body</p></article><footer>x</footer>";
        String second = "<header>Ad slot 2</header><article><h2>Story</h2><p>Body</p></article><footer>y</footer>";

        assertEquals("<h2>Story</h2><p>Body</p>", ContentNormalizer.forComparison(first));
        assertEquals(ContentNormalizer.forComparison(first), ContentNormalizer.forComparison(second));
    }

    @Test
    void fallsBackToContentDivWhenThereIsNoArticle() {
        String page = "<nav>menu</nav><div class=\"content\">Main text</div>";

        assertEquals("Main text", ContentNormalizer.forComparison(page));
    }

    @Test
    void collapsesWhitespaceAndHandlesEmptyInput() {
        assertEquals("a b c", ContentNormalizer.forComparison("  a \n\t b   c \r\n"));
        assertEquals("", ContentNormalizer.forComparison(""));
        assertEquals("", ContentNormalizer.forComparison(null));
    }
}
