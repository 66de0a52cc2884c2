/*
 * Where: Delivery queue configuration binding
 * What: Holds reminder promotion schedule and defaults for armed reminders
 * Why: Keep reminder cadence and default offsets tunable per environment
 */
package com.example.deliveryqueue.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.reminder")
@Validated
public record NotificationReminderProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @NotBlank String defaultTemplate,
    @NotEmpty List<@Positive Integer> defaultDays) {

  public NotificationReminderProperties {
    defaultDays = defaultDays == null ? List.of() : List.copyOf(defaultDays);
  }
}
