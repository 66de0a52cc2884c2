/*
 * どこで: Delivery Queue API リクエスト DTO
 * 何を: リマインダー設定 API の入力を定義する
 * なぜ: 省略時は設定の既定テンプレート/日数を使うため、すべて任意項目とする
 */
package com.example.deliveryqueue.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.Positive;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record ScheduleRemindersRequest(String reminderTemplate, List<@Positive Integer> days) {}
