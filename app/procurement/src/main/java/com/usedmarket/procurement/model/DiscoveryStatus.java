package com.usedmarket.procurement.model;

/** prerequisites は一度も評価していない場合 null。 */
public record DiscoveryStatus(
    String consumerId,
    boolean discovered,
    boolean purchased,
    boolean opportunityActive,
    int remainingDays,
    int eligibleTransactions,
    long price,
    PrerequisiteSnapshot prerequisites) {}
