/*
 * Where: Delivery queue configuration binding
 * What: Holds the default size of the recent failure list in stats
 * Why: Let operators widen the failure window without a code change
 */
package com.example.deliveryqueue.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.stats")
@Validated
public record NotificationStatsProperties(@Positive int recentFailuresLimit) {}
