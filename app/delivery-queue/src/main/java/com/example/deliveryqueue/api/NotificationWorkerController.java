/*
 * どこで: Delivery Queue ワーカー API
 * 何を: 外部ワーカー向けに pickBatch/claim/チャネル結果報告を公開する
 * なぜ: 組み込みワーカーと同じ操作で、別プロセスのワーカーも安全に配信できるようにするため
 */
package com.example.deliveryqueue.api;

import com.example.deliveryqueue.api.request.ReportFailureRequest;
import com.example.deliveryqueue.api.request.ReportSuccessRequest;
import com.example.deliveryqueue.api.response.NotificationResponse;
import com.example.deliveryqueue.api.response.WorkerBatchResponse;
import com.example.deliveryqueue.config.NotificationDeliveryProperties;
import com.example.deliveryqueue.model.NotificationRecord;
import com.example.deliveryqueue.service.NotificationClaimConflictException;
import com.example.deliveryqueue.service.NotificationClaimService;
import com.example.deliveryqueue.service.NotificationOutcomeService;
import com.example.deliveryqueue.service.NotificationSelector;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/worker")
@RequiredArgsConstructor
public class NotificationWorkerController {

  private static final String HEADER_WORKER_ID = "X-Worker-Id";

  private final NotificationSelector selector;
  private final NotificationClaimService claimService;
  private final NotificationOutcomeService outcomeService;
  private final NotificationDeliveryProperties properties;
  private final NotificationResponseMapper mapper;

  @GetMapping("/batch")
  public ResponseEntity<WorkerBatchResponse> pickBatch(
      @RequestParam(name = "limit", required = false) @Positive @Max(500) Integer limit) {
    final int effectiveLimit = limit == null ? properties.batchSize() : limit;
    return ResponseEntity.ok(
        new WorkerBatchResponse(
            selector.pickBatch(effectiveLimit).stream().map(mapper::toResponse).toList()));
  }

  @PostMapping("/notifications/{id}/claim")
  public ResponseEntity<NotificationResponse> claim(
      @PathVariable("id") UUID id, @RequestHeader(HEADER_WORKER_ID) String workerId) {
    final NotificationRecord claimed =
        claimService.claim(id, workerId).orElseThrow(() -> new NotificationClaimConflictException(id));
    return ResponseEntity.ok(mapper.toResponse(claimed));
  }

  @PostMapping("/notifications/{id}/channels/{channel}/success")
  public ResponseEntity<NotificationResponse> reportSuccess(
      @PathVariable("id") UUID id,
      @PathVariable("channel") String channel,
      @RequestHeader(HEADER_WORKER_ID) String workerId,
      @RequestBody(required = false) ReportSuccessRequest request) {
    final String messageId = request == null ? null : request.providerMessageId();
    return ResponseEntity.ok(
        mapper.toResponse(outcomeService.reportSuccess(id, channel, messageId, workerId)));
  }

  @PostMapping("/notifications/{id}/channels/{channel}/failure")
  public ResponseEntity<NotificationResponse> reportFailure(
      @PathVariable("id") UUID id,
      @PathVariable("channel") String channel,
      @RequestHeader(HEADER_WORKER_ID) String workerId,
      @Valid @RequestBody ReportFailureRequest request) {
    return ResponseEntity.ok(
        mapper.toResponse(outcomeService.reportFailure(id, channel, request.error(), workerId)));
  }
}
