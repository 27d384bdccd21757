package com.all2md.core.section;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SectionTarget}.
 */
class SectionTargetTest {

    @Test
    void parse_withHashNumber_returnsIndexTarget() {
        SectionTarget target = SectionTarget.parse("#2");

        assertThat(target.index()).isEqualTo(2);
        assertThat(target.heading()).isNull();
        assertThat(target).hasToString("#2");
    }

    @Test
    void parse_withNegativeIndex_keepsSign() {
        assertThat(SectionTarget.parse("#-1").index()).isEqualTo(-1);
    }

    @Test
    void parse_withText_returnsHeadingTarget() {
        SectionTarget target = SectionTarget.parse("  Getting Started ");

        assertThat(target.heading()).isEqualTo("Getting Started");
        assertThat(target).hasToString("'Getting Started'");
    }

    @Test
    void parse_withBadIndex_throwsException() {
        assertThatThrownBy(() -> SectionTarget.parse("#abc"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid section index 'abc'");
    }

    @Test
    void parse_withBlankSelector_throwsException() {
        assertThatThrownBy(() -> SectionTarget.parse(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_withBothOrNeither_throwsException() {
        assertThatThrownBy(() -> new SectionTarget(1, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SectionTarget(null, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
