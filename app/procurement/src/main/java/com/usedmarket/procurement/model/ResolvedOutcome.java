/*
 * どこで: Procurement ドメインモデル
 * 何を: OutcomeResolver の解決結果を保持する
 * なぜ: 費用・寿命・成功時刻・発見内容を検索作成時に凍結するため
 */
package com.usedmarket.procurement.model;

/** 失敗結果では pendingFind は null で、timeToSuccess は duration を超える到達不能値になる。 */
public record ResolvedOutcome(
    long cost, int duration, boolean success, int timeToSuccess, FoundItem pendingFind) {}
