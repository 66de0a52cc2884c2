/*
 * どこで: Delivery Queue 管理 API
 * 何を: enqueue/cancel/force-retry/trigger/pause/resume/リマインダー/一括トリガー/統計/参照を公開する
 * なぜ: 運用者と上流サービスがキューを操作する入口を提供するため
 */
package com.example.deliveryqueue.api;

import com.example.deliveryqueue.api.request.CancelNotificationRequest;
import com.example.deliveryqueue.api.request.EnqueueNotificationRequest;
import com.example.deliveryqueue.api.request.ForceRetryRequest;
import com.example.deliveryqueue.api.request.ScheduleRemindersRequest;
import com.example.deliveryqueue.api.request.TriggerNotificationRequest;
import com.example.deliveryqueue.api.response.NotificationResponse;
import com.example.deliveryqueue.api.response.TriggerPendingResponse;
import com.example.deliveryqueue.model.NotificationStats;
import com.example.deliveryqueue.service.NotificationAdminService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationAdminController {

  private final NotificationAdminService adminService;
  private final NotificationResponseMapper mapper;
  private final Clock clock;

  @PostMapping("/{id}/enqueue")
  public ResponseEntity<NotificationResponse> enqueue(
      @PathVariable("id") UUID id, @Valid @RequestBody EnqueueNotificationRequest request) {
    return ResponseEntity.ok(mapper.toResponse(adminService.enqueue(mapper.toCommand(id, request))));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<NotificationResponse> cancel(
      @PathVariable("id") UUID id,
      @Valid @RequestBody(required = false) CancelNotificationRequest request) {
    final String reason = request == null ? null : request.reason();
    return ResponseEntity.ok(mapper.toResponse(adminService.cancel(id, reason)));
  }

  @PostMapping("/{id}/force-retry")
  public ResponseEntity<NotificationResponse> forceRetry(
      @PathVariable("id") UUID id, @RequestBody(required = false) ForceRetryRequest request) {
    final Instant sendAfter = request == null ? null : request.sendAfter();
    final boolean clearExpiry = request != null && Boolean.TRUE.equals(request.clearExpiry());
    return ResponseEntity.ok(mapper.toResponse(adminService.forceRetry(id, sendAfter, clearExpiry)));
  }

  @PostMapping("/{id}/trigger")
  public ResponseEntity<NotificationResponse> trigger(
      @PathVariable("id") UUID id, @RequestBody(required = false) TriggerNotificationRequest request) {
    final boolean resetAttempts = request != null && Boolean.TRUE.equals(request.resetAttempts());
    return ResponseEntity.ok(mapper.toResponse(adminService.trigger(id, resetAttempts)));
  }

  @PostMapping("/{id}/pause")
  public ResponseEntity<NotificationResponse> pause(@PathVariable("id") UUID id) {
    return ResponseEntity.ok(mapper.toResponse(adminService.pause(id)));
  }

  @PostMapping("/{id}/resume")
  public ResponseEntity<NotificationResponse> resume(@PathVariable("id") UUID id) {
    return ResponseEntity.ok(mapper.toResponse(adminService.resume(id)));
  }

  @PostMapping("/{id}/reminders")
  public ResponseEntity<NotificationResponse> scheduleReminders(
      @PathVariable("id") UUID id,
      @Valid @RequestBody(required = false) ScheduleRemindersRequest request) {
    final String template = request == null ? null : request.reminderTemplate();
    return ResponseEntity.ok(
        mapper.toResponse(
            adminService.scheduleReminders(id, template, request == null ? null : request.days())));
  }

  @PostMapping("/trigger-pending")
  public ResponseEntity<TriggerPendingResponse> triggerPending() {
    final int affected = adminService.triggerAllPending();
    return ResponseEntity.ok(new TriggerPendingResponse(affected, Instant.now(clock)));
  }

  @GetMapping("/stats")
  public ResponseEntity<NotificationStats> stats(
      @RequestParam(name = "recent_failures", required = false) @Positive @Max(100)
          Integer recentFailures) {
    return ResponseEntity.ok(adminService.stats(recentFailures));
  }

  @GetMapping("/{id}")
  public ResponseEntity<NotificationResponse> get(@PathVariable("id") UUID id) {
    return ResponseEntity.ok(mapper.toResponse(adminService.get(id)));
  }
}
