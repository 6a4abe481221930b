/*
 * どこで: Procurement ドメインモデル
 * 何を: 検索対象アイテムのカタログ参照を保持する
 * なぜ: カタログキー・表示名・基準価格を一組で受け渡すため
 */
package com.usedmarket.procurement.model;

public record ItemReference(String catalogKey, String displayName, long basePrice) {}
