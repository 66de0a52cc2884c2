/*
 * どこで: Delivery Queue ドメインモデル
 * 何を: チャネル名 (email/sms/push/discord など) の正規化と検証
 * なぜ: delivery_methods と delivery_status のキーを同じ表記に揃えるため
 */
package com.example.deliveryqueue.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class DeliveryChannels {

  public static final String EMAIL = "email";

  private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z][a-z0-9_-]{0,31}");

  private DeliveryChannels() {}

  public static String normalize(String channel) {
    if (channel == null || channel.isBlank()) {
      throw new IllegalArgumentException("channel is required");
    }
    final String normalized = channel.trim().toLowerCase(Locale.ROOT);
    if (!CHANNEL_NAME.matcher(normalized).matches()) {
      throw new IllegalArgumentException("invalid channel name: " + channel);
    }
    return normalized;
  }

  // 指定順を保ったまま重複を除く
  public static List<String> normalizeAll(List<String> channels) {
    if (channels == null || channels.isEmpty()) {
      throw new IllegalArgumentException("delivery_methods must not be empty");
    }
    final Set<String> normalized = new LinkedHashSet<>();
    for (String channel : channels) {
      normalized.add(normalize(channel));
    }
    return List.copyOf(normalized);
  }
}
