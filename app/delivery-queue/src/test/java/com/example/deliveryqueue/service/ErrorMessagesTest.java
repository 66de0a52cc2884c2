package com.example.deliveryqueue.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ErrorMessagesTest {

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "\t"})
  void blankMessageBecomesUnknownError(String message) {
    assertThat(ErrorMessages.truncate(message, 10)).isEqualTo(ErrorMessages.UNKNOWN_ERROR);
  }

  @Test
  void shortMessageIsKept() {
    assertThat(ErrorMessages.truncate("bounce", 6)).isEqualTo("bounce");
  }

  @Test
  void longMessageIsCutAtLimit() {
    assertThat(ErrorMessages.truncate("smtp timeout", 4)).isEqualTo("smtp");
  }

  @Test
  void cutNeverSplitsSurrogatePair() {
    // U+1F600 は 2 char。上限がペアの間に来たらペアごと落とす
    final String message = "abc😀def";

    final String truncated = ErrorMessages.truncate(message, 4);

    assertThat(truncated).isEqualTo("abc");
    assertThat(Character.isHighSurrogate(truncated.charAt(truncated.length() - 1))).isFalse();
  }

  @Test
  void cutAfterCompletePairKeepsIt() {
    assertThat(ErrorMessages.truncate("abc😀def", 5)).isEqualTo("abc😀");
  }
}
