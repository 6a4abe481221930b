/*
 * どこで: Procurement ドメインモデル
 * 何を: 直近の前提条件評価で取得した外部値を保持する
 * なぜ: 状態表示で再度外部呼び出しをせずに進捗を見せるため
 */
package com.usedmarket.procurement.model;

public record PrerequisiteSnapshot(
    int usageCount, int creditScore, boolean hasDegradedResource, long evaluatedAtHour) {}
