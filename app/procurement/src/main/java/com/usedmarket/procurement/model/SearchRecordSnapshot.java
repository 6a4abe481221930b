/*
 * どこで: Procurement ドメインモデル
 * 何を: SearchRecord の全フィールドを平坦化した不変スナップショット
 * なぜ: 永続化・レプリケーション・API 応答で同一の状態表現を共有するため
 */
package com.usedmarket.procurement.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** pendingFind と foundItem は該当しない場合 null。 */
public record SearchRecordSnapshot(
    String id,
    String consumerId,
    ItemReference item,
    String tierId,
    String qualityId,
    SortedMap<String, Integer> requestedConfigurations,
    double creditModifier,
    long cost,
    int ttl,
    int tts,
    boolean successOutcome,
    FoundItem pendingFind,
    SearchStatus status,
    FoundItem foundItem,
    long createdAtHour) {

  public SearchRecordSnapshot {
    requestedConfigurations =
        Collections.unmodifiableSortedMap(
            new TreeMap<>(requestedConfigurations == null ? Map.of() : requestedConfigurations));
  }
}
