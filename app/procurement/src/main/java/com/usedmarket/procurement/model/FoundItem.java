/*
 * どこで: Procurement ドメインモデル
 * 何を: 検索成功時に発見されたアイテムの状態・価格・構成を保持する
 * なぜ: 事前抽選した結果を成功確定まで不変のまま保持するため
 */
package com.usedmarket.procurement.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * matchedConfigurations は要求どおりに一致した構成、randomizedConfigurations はホスト側カタログが
 * ランダムに選び直す構成 ID を表す。
 */
public record FoundItem(
    double condition,
    long price,
    SortedMap<String, Integer> matchedConfigurations,
    SortedSet<String> randomizedConfigurations) {

  public FoundItem {
    matchedConfigurations =
        Collections.unmodifiableSortedMap(
            new TreeMap<>(matchedConfigurations == null ? Map.of() : matchedConfigurations));
    randomizedConfigurations =
        Collections.unmodifiableSortedSet(
            randomizedConfigurations == null
                ? new TreeSet<>()
                : new TreeSet<>(randomizedConfigurations));
  }
}
