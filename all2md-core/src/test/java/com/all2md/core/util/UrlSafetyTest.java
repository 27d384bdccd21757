package com.all2md.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link UrlSafety}.
 */
class UrlSafetyTest {

    @Test
    void check_withSafeSchemes_returnsEmpty() {
        assertThat(UrlSafety.check("https://example.com/a?b=c", false)).isEmpty();
        assertThat(UrlSafety.check("mailto:someone@example.com", false)).isEmpty();
        assertThat(UrlSafety.check("tel:+4512345678", false)).isEmpty();
    }

    @Test
    void check_withRelativeUrls_returnsEmpty() {
        assertThat(UrlSafety.check("/docs/intro.md", false)).isEmpty();
        assertThat(UrlSafety.check("#overview", false)).isEmpty();
        assertThat(UrlSafety.check("../images/logo.png", false)).isEmpty();
        assertThat(UrlSafety.check("page.html", false)).isEmpty();
    }

    @Test
    void check_withJavascriptScheme_reportsDangerousScheme() {
        assertThat(UrlSafety.check("javascript:alert(1)", false))
            .hasValueSatisfying(problem -> assertThat(problem).startsWith("URL uses dangerous scheme 'javascript'"));
    }

    @Test
    void check_withObfuscatedJavascript_stillDetectsIt() {
        assertThat(UrlSafety.isSafe(" JavaScript\t:alert(1)", false)).isFalse();
    }

    @Test
    void check_withDataUri_dependsOnImageFlag() {
        String png = "data:image/png;base64,iVBORw0KGgo=";

        assertThat(UrlSafety.check(png, true)).isEmpty();
        assertThat(UrlSafety.check(png, false))
            .hasValueSatisfying(problem -> assertThat(problem).startsWith("data URI is not allowed here"));
        assertThat(UrlSafety.check("data:text/html,<script>", true)).isPresent();
    }

    @Test
    void check_withUnknownScheme_reportsIt() {
        assertThat(UrlSafety.check("gopher://old.example.com", false))
            .hasValueSatisfying(problem -> assertThat(problem).contains("unrecognized scheme 'gopher'"));
    }

    @Test
    void check_withBlankUrl_returnsEmpty() {
        assertThat(UrlSafety.check(null, false)).isEmpty();
        assertThat(UrlSafety.check("  ", false)).isEmpty();
    }
}
