package com.example.deliveryqueue.service;

final class ErrorMessages {

  static final String UNKNOWN_ERROR = "unknown error";

  private ErrorMessages() {}

  static String truncate(String message, int maxLength) {
    if (message == null || message.isBlank()) {
      return UNKNOWN_ERROR;
    }
    if (message.length() <= maxLength) {
      return message;
    }
    // サロゲートペアの途中で切らない
    final int end = Character.isHighSurrogate(message.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
    return message.substring(0, end);
  }
}
