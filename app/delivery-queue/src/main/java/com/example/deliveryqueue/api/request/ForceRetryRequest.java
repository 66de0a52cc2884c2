package com.example.deliveryqueue.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Omitted {@code send_after} means now; {@code clear_expiry} drops a past soft expiry. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ForceRetryRequest(Instant sendAfter, Boolean clearExpiry) {}
