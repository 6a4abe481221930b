/*
 * どこで: Procurement ドメインモデル
 * 何を: DiscoveryGateState の永続化用スナップショット
 * なぜ: Redis 保存と復元で同じフィールド集合を使うため
 */
package com.usedmarket.procurement.model;

/** lastPrerequisites は前提条件を一度も評価していない場合 null。 */
public record DiscoveryStateSnapshot(
    String consumerId,
    boolean discovered,
    boolean purchased,
    boolean opportunityActive,
    long opportunityExpiryHour,
    int eligibleTransactions,
    PrerequisiteSnapshot lastPrerequisites) {}
