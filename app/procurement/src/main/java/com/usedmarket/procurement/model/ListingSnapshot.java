/*
 * どこで: Procurement ドメインモデル
 * 何を: 出品の全フィールドを平坦化した不変スナップショット
 * なぜ: 永続化・レプリケーション・API 応答で同一の状態表現を共有するため
 */
package com.usedmarket.procurement.model;

/** inspectionTierId は点検未依頼の場合 null。 */
public record ListingSnapshot(
    String id,
    String searchId,
    String consumerId,
    String tierId,
    String catalogKey,
    String displayName,
    FoundItem item,
    int hoursRemaining,
    ListingStatus status,
    InspectionState inspectionState,
    String inspectionTierId,
    long inspectionCompletesAtHour,
    int createdDay) {}
