package com.flamingo.ai.cliniclists.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.service.segmentation.model.ClassifiedLine;
import com.flamingo.ai.cliniclists.service.segmentation.model.LineTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LineClassifierTest {

  private final LineClassifier classifier = new LineClassifier(new ListsConfig());

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "Jan 15, 2023|DATE",
        "01/15/2023|DATE",
        "2023-01-15|DATE",
        "Mass General Hospital|LOCATION",
        "Continued on Page 4|PAGE_MARKER",
        "Patient Name: Jane Doe|HEADER_FOOTER",
        "Printed by clerk|HEADER_FOOTER",
        "ab|OUT_OF_BOUNDS_LENGTH",
        "Aspirin 81 mg daily|RECORD_WITH_VALUE",
        "Vitamin D|RECORD_NAME_ONLY",
        "take with food|CONTINUATION"
      })
  @DisplayName("should tag lines in precedence order")
  void shouldTagLine(String line, LineTag expected) {
    assertThat(classifier.classify(line).tag()).isEqualTo(expected);
  }

  @Test
  @DisplayName("should split name and dosage of a record line")
  void shouldExtractNameAndValue_whenRecordWithValue() {
    ClassifiedLine line = classifier.classify("  Metformin 500 mg twice  ");

    assertThat(line.recordName()).isEqualTo("Metformin");
    assertThat(line.recordValue()).isEqualTo("500 mg twice");
  }

  @Test
  @DisplayName("should tag blank and null lines as blank")
  void shouldTagBlank_whenEmpty() {
    assertThat(classifier.classify("   ").tag()).isEqualTo(LineTag.BLANK);
    assertThat(classifier.classify(null).tag()).isEqualTo(LineTag.BLANK);
  }

  @Test
  @DisplayName("should not tag an overlong line starting with a date as a date")
  void shouldNotTagDate_whenLineTooLong() {
    String line = "Jan 15, 2023 " + "follow-up discussion of treatment plan options";

    assertThat(classifier.classify(line).tag()).isNotEqualTo(LineTag.DATE);
  }

  @Test
  @DisplayName("should find a dosage anywhere in a line")
  void shouldFindValue() {
    assertThat(classifier.findValue("take 2 tablets daily")).contains("2 tablets daily");
    assertThat(classifier.findValue("as needed")).isEmpty();
  }
}
