package com.example.deliveryqueue.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.deliveryqueue.config.NotificationBackoffProperties;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class FixedScheduleBackoffPolicyTest {

  private final FixedScheduleBackoffPolicy policy =
      new FixedScheduleBackoffPolicy(
          new NotificationBackoffProperties(
              List.of(
                  Duration.ofMinutes(5),
                  Duration.ofMinutes(30),
                  Duration.ofHours(2),
                  Duration.ofHours(6))));

  @Test
  void indexesScheduleByFailedAttempts() {
    assertThat(policy.backoffFor(0)).isEqualTo(Duration.ofMinutes(5));
    assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofMinutes(30));
    assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofHours(2));
    assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofHours(6));
  }

  @Test
  void capsAtLastEntry() {
    assertThat(policy.backoffFor(4)).isEqualTo(Duration.ofHours(6));
    assertThat(policy.backoffFor(50)).isEqualTo(Duration.ofHours(6));
  }

  @Test
  void negativeAttemptsUseFirstEntry() {
    assertThat(policy.backoffFor(-1)).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void emptyScheduleIsRejected() {
    assertThatThrownBy(() -> new FixedScheduleBackoffPolicy(new NotificationBackoffProperties(List.of())))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
