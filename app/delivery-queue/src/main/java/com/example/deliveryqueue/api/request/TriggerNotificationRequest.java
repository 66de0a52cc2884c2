package com.example.deliveryqueue.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code reset_attempts} also clears the attempt count and last error. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TriggerNotificationRequest(Boolean resetAttempts) {}
