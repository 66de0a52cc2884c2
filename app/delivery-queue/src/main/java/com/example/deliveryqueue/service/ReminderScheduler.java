/*
 * Where: Delivery queue service layer
 * What: Reopens sent notifications as reminder_due when their next reminder offset has elapsed
 * Why: Reminders reuse the normal claim/outcome path instead of a separate sender
 */
package com.example.deliveryqueue.service;

import com.example.deliveryqueue.config.NotificationReminderProperties;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderScheduler {

  private static final Logger logger = LoggerFactory.getLogger(ReminderScheduler.class);

  private final NotificationQueueRepository repository;
  private final NotificationReminderProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /** Promotes every sent record whose next reminder is due; returns how many were promoted. */
  public int promoteDueReminders() {
    final Instant now = Instant.now(clock);
    int promoted = 0;
    Instant afterCompletedAt = null;
    UUID afterId = null;
    while (true) {
      final List<NotificationRecord> page =
          repository.findReminderCandidates(now, afterCompletedAt, afterId, properties.batchSize());
      for (NotificationRecord candidate : page) {
        if (promoteIfDue(candidate, now)) {
          promoted++;
        }
      }
      if (page.size() < properties.batchSize()) {
        break;
      }
      final NotificationRecord last = page.get(page.size() - 1);
      afterCompletedAt = last.completedAt();
      afterId = last.id();
    }
    if (promoted > 0) {
      logger.info("reminders promoted count={}", promoted);
    }
    return promoted;
  }

  private boolean promoteIfDue(NotificationRecord candidate, Instant now) {
    if (NotificationStateMachine.isExpired(candidate, now) || !candidate.hasPendingReminder()) {
      return false;
    }
    final String offset = candidate.reminderSchedule().get(candidate.reminderCount());
    final Duration delay;
    try {
      delay = ReminderOffsets.parse(offset);
    } catch (IllegalArgumentException ex) {
      logger.warn(
          "skipping unparseable reminder offset id={} index={} offset={}",
          candidate.id(),
          candidate.reminderCount(),
          offset,
          ex);
      return false;
    }
    if (now.isBefore(candidate.completedAt().plus(delay))) {
      return false;
    }
    if (repository.promoteToReminderDue(candidate.id(), candidate.reminderCount(), now) == 0) {
      logger.debug("reminder already promoted or record changed id={}", candidate.id());
      return false;
    }
    metrics.recordReminderPromoted();
    logger.info(
        "reminder due id={} reminderIndex={} offset={}",
        candidate.id(),
        candidate.reminderCount(),
        offset);
    return true;
  }
}
