/*
 * どこで: Delivery Queue サービス層
 * 何を: reminder_schedule の相対オフセット ("+3 days" / "P3D") を Duration に変換する
 * なぜ: 既存データの表記と ISO-8601 表記の両方を同じ規則で解釈するため
 */
package com.example.deliveryqueue.service;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ReminderOffsets {

  private static final Pattern RELATIVE =
      Pattern.compile("^\\+?\\s*(\\d+)\\s*(minute|hour|day|week)s?$");

  private ReminderOffsets() {}

  public static Duration parse(String offset) {
    if (offset == null || offset.isBlank()) {
      throw new IllegalArgumentException("reminder offset is blank");
    }
    final String normalized = offset.trim().toLowerCase(Locale.ROOT);
    final Matcher matcher = RELATIVE.matcher(normalized);
    if (matcher.matches()) {
      final long amount = Long.parseLong(matcher.group(1));
      return switch (matcher.group(2)) {
        case "minute" -> Duration.ofMinutes(amount);
        case "hour" -> Duration.ofHours(amount);
        case "day" -> Duration.ofDays(amount);
        case "week" -> Duration.ofDays(amount * 7);
        default -> throw new IllegalArgumentException("unsupported reminder offset unit: " + offset);
      };
    }
    try {
      final Duration duration = Duration.parse(offset.trim());
      if (duration.isNegative()) {
        throw new IllegalArgumentException("reminder offset must not be negative: " + offset);
      }
      return duration;
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("invalid reminder offset: " + offset, ex);
    }
  }

  public static String ofDays(int days) {
    if (days <= 0) {
      throw new IllegalArgumentException("reminder days must be positive: " + days);
    }
    return "+" + days + " days";
  }
}
