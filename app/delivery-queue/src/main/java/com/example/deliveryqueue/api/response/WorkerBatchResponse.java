package com.example.deliveryqueue.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkerBatchResponse(List<EligibleNotificationResponse> notifications) {

  public WorkerBatchResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
