/*
 * どこで: common のイベント payload 定義
 * 何を: 調達検索・出品・ディスカバリーの通知 payload を共通レコードとして提供する
 * なぜ: publisher と購読側で同一のペイロード形状を共有するため
 */
package com.usedmarket.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcurementEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String consumerId,
    String searchId,
    String listingId,
    String catalogKey,
    long simulatedDay,
    String traceId) {}
