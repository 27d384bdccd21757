package com.all2md.core.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Slugs}.
 */
class SlugsTest {

    @Test
    void slugify_withPunctuationAndCase_returnsLowercaseAscii() {
        assertThat(Slugs.slugify("Hello, World!")).isEqualTo("hello-world");
    }

    @Test
    void slugify_withAccents_stripsCombiningMarks() {
        assertThat(Slugs.slugify("Café Menü")).isEqualTo("cafe-menu");
    }

    @Test
    void slugify_withUnderscoresAndRepeatedSpaces_collapsesSeparators() {
        assertThat(Slugs.slugify("  snake_case   words  ")).isEqualTo("snake-case-words");
    }

    @Test
    void slugify_withOnlySymbols_returnsDefaultSlug() {
        assertThat(Slugs.slugify("!!!")).isEqualTo(Slugs.DEFAULT_SLUG);
        assertThat(Slugs.slugify(null)).isEqualTo(Slugs.DEFAULT_SLUG);
    }

    @Test
    void slugify_withSharedSeenSet_makesSlugsUnique() {
        Set<String> seen = new HashSet<>();

        String first = Slugs.slugify("Overview", seen);
        String second = Slugs.slugify("Overview", seen);
        String third = Slugs.slugify("Overview", seen);

        assertThat(first).isEqualTo("overview");
        assertThat(second).isEqualTo("overview-2");
        assertThat(third).isEqualTo("overview-3");
    }

    @Test
    void slugify_withMaxLength_truncatesWithoutTrailingSeparator() {
        String slug = Slugs.slugify("alpha beta gamma", null, 6, "-");

        assertThat(slug).isEqualTo("alpha");
    }

    @Test
    void slugify_withCustomSeparator_usesIt() {
        assertThat(Slugs.slugify("Getting Started Guide", null, 0, "_")).isEqualTo("getting_started_guide");
    }

    @Test
    void slugify_withEmptySeparator_throwsException() {
        assertThatThrownBy(() -> Slugs.slugify("text", null, 0, ""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("separator");
    }
}
