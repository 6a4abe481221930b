/*
 * どこで: Procurement API レスポンス DTO
 * 何を: 検索レコードの公開情報を定義する
 * なぜ: 確定済みの結果 (成否・成功までの時間) を完了前に見せないため
 */
package com.usedmarket.procurement.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.usedmarket.procurement.model.SearchRecordSnapshot;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResponse(
    String searchId,
    String consumerId,
    String catalogKey,
    String displayName,
    String tierId,
    String qualityId,
    String status,
    long cost,
    int hoursRemaining,
    long createdAtHour,
    FoundItemPayload foundItem) {

  public static SearchResponse from(SearchRecordSnapshot snapshot) {
    return new SearchResponse(
        snapshot.id(),
        snapshot.consumerId(),
        snapshot.item().catalogKey(),
        snapshot.item().displayName(),
        snapshot.tierId(),
        snapshot.qualityId(),
        snapshot.status().value(),
        snapshot.cost(),
        Math.max(0, snapshot.ttl()),
        snapshot.createdAtHour(),
        FoundItemPayload.from(snapshot.foundItem()));
  }
}
