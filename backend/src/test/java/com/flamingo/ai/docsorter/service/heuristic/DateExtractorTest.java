package com.flamingo.ai.docsorter.service.heuristic;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DateExtractorTest {

  private final DateExtractor extractor = new DateExtractor();

  @Nested
  @DisplayName("normalize")
  class Normalize {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
      "01/15/2024, 2024-01-15",
      "15/01/2024, 2024-01-15",
      "3/7/24, 2024-03-07",
      "12-31-99, 1999-12-31",
      "25.12.2023, 2023-12-25",
      "'January 15, 2024', 2024-01-15",
      "'Sept. 3rd 2021', 2021-09-03",
      "'15 March 2022', 2022-03-15",
      "2023-06-30, 2023-06-30",
      "2023/6/3, 2023-06-03"
    })
    void shouldNormalizeSupportedFormats(String raw, String expected) {
      assertThat(extractor.normalize(raw)).contains(expected);
    }

    @Test
    @DisplayName("should reject impossible calendar dates")
    void shouldReject_whenDateDoesNotExist() {
      assertThat(extractor.normalize("02/30/2024")).isEmpty();
      assertThat(extractor.normalize("2023-02-29")).isEmpty();
      assertThat(extractor.normalize("13/13/2024")).isEmpty();
    }

    @Test
    @DisplayName("should reject years outside 1900..2100")
    void shouldReject_whenYearOutOfRange() {
      assertThat(extractor.normalize("01/01/1850")).isEmpty();
      assertThat(extractor.normalize("2150-01-01")).isEmpty();
    }

    @Test
    @DisplayName("should return empty for blank or dateless text")
    void shouldReturnEmpty_whenNoDate() {
      assertThat(extractor.normalize(null)).isEmpty();
      assertThat(extractor.normalize(" ")).isEmpty();
      assertThat(extractor.normalize("next Tuesday")).isEmpty();
    }
  }

  @Test
  @DisplayName("should prefer slash dates over later patterns and report the source line")
  void shouldFollowPatternOrder_whenSeveralDatesPresent() {
    List<String> lines = List.of("Issued March 3, 2021", "Due 04/05/2022");

    FieldMatch match = extractor.extract(lines).orElseThrow();

    assertThat(match.value()).isEqualTo("2022-04-05");
    assertThat(match.evidence()).isEqualTo("Due 04/05/2022");
    assertThat(match.lineIndex()).isEqualTo(1);
  }

  @Test
  @DisplayName("should skip an invalid match and keep searching")
  void shouldSkipInvalidMatch() {
    List<String> lines = List.of("Ref 99/99/2024", "Date: 02/14/2024");

    assertThat(extractor.extract(lines)).map(FieldMatch::value).contains("2024-02-14");
  }

  @Test
  void shouldDetectDateInLine() {
    assertThat(extractor.containsDate("Printed on 2024-01-02")).isTrue();
    assertThat(extractor.containsDate("Acme Corporation")).isFalse();
  }
}
