/*
 * Where: Delivery queue reminder worker
 * What: Periodically promotes sent notifications whose next reminder is due
 */
package com.example.deliveryqueue.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.reminder.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReminderWorker {

  private final ReminderScheduler reminderScheduler;

  @Scheduled(fixedDelayString = "${notification.reminder.poll-interval}")
  public void run() {
    reminderScheduler.promoteDueReminders();
  }
}
