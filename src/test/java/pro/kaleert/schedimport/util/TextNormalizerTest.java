package pro.kaleert.schedimport.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void courseCodeShape() {
        assertThat(TextNormalizer.isCourseCode("CSC4303")).isTrue();
        assertThat(TextNormalizer.isCourseCode("ECO 1200")).isTrue();
        assertThat(TextNormalizer.isCourseCode("csc 4303")).isTrue();
        assertThat(TextNormalizer.isCourseCode("CSC 4303")).isTrue();
        assertThat(TextNormalizer.isCourseCode("INFO 101")).isFalse();
        assertThat(TextNormalizer.isCourseCode("ABCDE 1234")).isFalse();
        assertThat(TextNormalizer.isCourseCode("Code")).isFalse();
    }

    @Test
    void collapsesWhitespace() {
        assertThat(TextNormalizer.collapseWhitespace("  CSC \t 4303 ")).isEqualTo("CSC 4303");
        assertThat(TextNormalizer.collapseWhitespace(null)).isEmpty();
    }

    @Test
    void creditHourFallsBackToDefault() {
        assertThat(TextNormalizer.parseCreditHour("4", 3)).isEqualTo(4);
        assertThat(TextNormalizer.parseCreditHour("2.0", 3)).isEqualTo(2);
        assertThat(TextNormalizer.parseCreditHour("", 3)).isEqualTo(3);
        assertThat(TextNormalizer.parseCreditHour("0", 3)).isEqualTo(3);
        assertThat(TextNormalizer.parseCreditHour("n/a", 3)).isEqualTo(3);
        assertThat(TextNormalizer.parseCreditHour(null, 3)).isEqualTo(3);
    }

    @Test
    void venuePlaceholderIsEmpty() {
        assertThat(TextNormalizer.cleanVenue(" - ")).isEmpty();
        assertThat(TextNormalizer.cleanVenue(null)).isEmpty();
        assertThat(TextNormalizer.cleanVenue("LR 5")).isEqualTo("LR 5");
    }
}
