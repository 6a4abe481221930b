/*
 * どこで: Procurement サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカル実行やテストで NATS なしでも起動可能にするため
 */
package com.usedmarket.procurement.service;

import com.usedmarket.procurement.model.ProcurementEvent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopProcurementEventPublisher implements ProcurementEventPublisher {

  @Override
  public void publish(ProcurementEvent event) {
    // no-op
  }

  @Override
  public void replicate(String searchId, byte[] payload) {
    // no-op
  }
}
