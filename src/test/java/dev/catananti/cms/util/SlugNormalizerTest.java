package dev.catananti.cms.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlugNormalizerTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("should lower-case and hyphenate words")
        void shouldLowerCaseAndHyphenate() {
            assertThat(SlugNormalizer.normalize("Hello, World!")).isEqualTo("hello-world");
        }

        @Test
        @DisplayName("should collapse whitespace and hyphen runs")
        void shouldCollapseSeparators() {
            assertThat(SlugNormalizer.normalize("  Spring   Boot -- Tips  ")).isEqualTo("spring-boot-tips");
        }

        @Test
        @DisplayName("should fold accented characters to ASCII")
        void shouldFoldAccents() {
            assertThat(SlugNormalizer.normalize("Café Crème Brûlée")).isEqualTo("cafe-creme-brulee");
        }

        @Test
        @DisplayName("should keep letters of scripts that do not fold")
        void shouldKeepNonLatinLetters() {
            assertThat(SlugNormalizer.normalize("Привет мир")).isEqualTo("привет-мир");
            assertThat(SlugNormalizer.normalize("你好 世界")).isEqualTo("你好-世界");
            assertThat(SlugNormalizer.normalize("Ωμέγα 3")).isEqualTo("ωμεγα-3");
        }

        @Test
        @DisplayName("should treat a no-break space as a separator")
        void shouldSplitOnNoBreakSpace() {
            assertThat(SlugNormalizer.normalize("Hello\u00A0World")).isEqualTo("hello-world");
        }

        @Test
        @DisplayName("should drop underscores and punctuation")
        void shouldDropUnderscores() {
            assertThat(SlugNormalizer.normalize("snake_case & co.")).isEqualTo("snakecase-co");
        }

        @Test
        @DisplayName("should fall back when nothing usable remains")
        void shouldFallBackForSymbolsOnly() {
            assertThat(SlugNormalizer.normalize("!!! ??? ***")).isEqualTo(SlugNormalizer.FALLBACK);
            assertThat(SlugNormalizer.normalize("   ")).isEqualTo(SlugNormalizer.FALLBACK);
            assertThat(SlugNormalizer.normalize(null)).isEqualTo(SlugNormalizer.FALLBACK);
        }

        @Test
        @DisplayName("should cap length without a trailing hyphen")
        void shouldCapLength() {
            String title = "word ".repeat(60);

            String slug = SlugNormalizer.normalize(title);

            assertThat(slug).hasSizeLessThanOrEqualTo(SlugNormalizer.MAX_LENGTH);
            assertThat(slug).startsWith("word-word").doesNotEndWith("-");
        }

        @Test
        @DisplayName("should return the same slug for the same input")
        void shouldBeDeterministic() {
            assertThat(SlugNormalizer.normalize("Release Notes 2.0"))
                    .isEqualTo(SlugNormalizer.normalize("Release Notes 2.0"))
                    .isEqualTo("release-notes-20");
        }
    }

    @Nested
    @DisplayName("withSuffix")
    class WithSuffix {

        @Test
        @DisplayName("should append the suffix")
        void shouldAppend() {
            assertThat(SlugNormalizer.withSuffix("hello-world", "1")).isEqualTo("hello-world-1");
        }

        @Test
        @DisplayName("should shorten a long base to keep the suffix")
        void shouldShortenBase() {
            String base = "a".repeat(SlugNormalizer.MAX_LENGTH);

            String slug = SlugNormalizer.withSuffix(base, "12");

            assertThat(slug).hasSize(SlugNormalizer.MAX_LENGTH).endsWith("-12");
        }
    }
}
