/*
 * どこで: Procurement サービス層
 * 何を: ドメインイベントを JSON、レプリケーションをバイト列で JetStream へ publish する
 * なぜ: Nats-Msg-Id による重複排除付きで下流へ通知するため
 */
package com.usedmarket.procurement.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.usedmarket.common.TraceIds;
import com.usedmarket.common.event.ProcurementEventPayload;
import com.usedmarket.procurement.config.ProcurementNatsProperties;
import com.usedmarket.procurement.model.ProcurementEvent;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsProcurementEventPublisher implements ProcurementEventPublisher {

  private final JetStream jetStream;
  private final ProcurementNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream と ObjectMapper は Spring 管理の共有コンポーネントのため")
  public NatsProcurementEventPublisher(
      JetStream jetStream,
      ProcurementNatsProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public void publish(ProcurementEvent event) {
    if (event == null || event.type() == null || isBlank(event.consumerId())) {
      throw new IllegalArgumentException("event type and consumerId are required");
    }
    final String eventId = UUID.randomUUID().toString();
    final ProcurementEventPayload payload =
        new ProcurementEventPayload(
            eventId,
            event.type().value(),
            Instant.now(clock).toString(),
            event.consumerId(),
            event.searchId(),
            event.listingId(),
            event.catalogKey(),
            event.simulatedDay(),
            TraceIds.currentOrNew());
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize procurement event", ex);
    }
    send(properties.subject(), eventId, body, "failed to publish procurement event");
  }

  @Override
  public void replicate(String searchId, byte[] payload) {
    if (isBlank(searchId) || payload == null) {
      throw new IllegalArgumentException("searchId and payload are required");
    }
    send(
        properties.replicationSubject(),
        UUID.randomUUID().toString(),
        payload,
        "failed to publish search replica");
  }

  private void send(String subject, String messageId, byte[] body, String failureMessage) {
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", messageId);
    try {
      jetStream.publish(subject, headers, body);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException(failureMessage, ex);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
