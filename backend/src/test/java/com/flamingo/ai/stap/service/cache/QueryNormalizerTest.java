package com.flamingo.ai.stap.service.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QueryNormalizerTest {

  @Test
  @DisplayName("should lowercase, strip punctuation and collapse whitespace")
  void shouldCanonicalizeQuery() {
    assertThat(QueryNormalizer.normalize("  Hello World!  ")).isEqualTo("hello world");
    assertThat(QueryNormalizer.normalize("Who is the\tHEAD of\n\nDepartment?"))
        .isEqualTo("who is the head of department");
  }

  @Test
  @DisplayName("should keep accented letters as word characters")
  void shouldKeepAccentedLetters() {
    assertThat(QueryNormalizer.normalize("Café?")).isEqualTo("café");
    assertThat(QueryNormalizer.normalize("Naïve  ÉMIGRÉ")).isEqualTo("naïve émigré");
  }

  @Test
  @DisplayName("should map trivially different inputs to the same key")
  void shouldCollideTriviallyDifferentInputs() {
    assertThat(QueryNormalizer.normalize("Hello!")).isEqualTo(QueryNormalizer.normalize("hello"));
    assertThat(QueryNormalizer.normalize("data-mining")).isEqualTo("datamining");
    assertThat(QueryNormalizer.normalize("DataMining")).isEqualTo("datamining");
  }

  @Test
  @DisplayName("should keep underscores and digits as word characters")
  void shouldKeepWordCharacters() {
    assertThat(QueryNormalizer.normalize("CS_101 (2024)")).isEqualTo("cs_101 2024");
  }

  @Test
  @DisplayName("should return empty key for empty, blank, punctuation-only and null input")
  void shouldReturnEmptyKeyForDegenerateInput() {
    assertThat(QueryNormalizer.normalize("")).isEmpty();
    assertThat(QueryNormalizer.normalize("   \t ")).isEmpty();
    assertThat(QueryNormalizer.normalize("?!...")).isEmpty();
    assertThat(QueryNormalizer.normalize(null)).isEmpty();
  }

  @Test
  @DisplayName("should be idempotent")
  void shouldBeIdempotent() {
    List<String> inputs =
        List.of(
            "",
            "  Hello World!  ",
            "Senarai PENSYARAH jabatan AI?",
            "a  b   c",
            "émigré Café — naïve",
            "tab\tand\nnewline",
            "!!!",
            "mixed_Case_123 ... end.");

    for (String input : inputs) {
      String once = QueryNormalizer.normalize(input);
      assertThat(QueryNormalizer.normalize(once)).as("input: %s", input).isEqualTo(once);
    }
  }

  @Test
  @DisplayName("should keep non-ASCII letters")
  void shouldKeepNonAsciiLetters() {
    assertThat(QueryNormalizer.normalize("Café Résumé!")).isEqualTo("café résumé");
  }
}
