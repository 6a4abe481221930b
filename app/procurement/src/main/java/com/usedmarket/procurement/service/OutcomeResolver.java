/*
 * どこで: Procurement サービス層
 * 何を: 検索作成時に費用・所要時間・成否・発見内容を一括で解決する
 * なぜ: 乱数消費を作成時点に限定し、時間経過で結果が変わらないようにするため
 */
package com.usedmarket.procurement.service;

import com.usedmarket.procurement.model.FoundItem;
import com.usedmarket.procurement.model.QualityTier;
import com.usedmarket.procurement.model.ResolvedOutcome;
import com.usedmarket.procurement.model.TierDefinition;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

@Component
public class OutcomeResolver {

  public static final double MIN_SUCCESS_PROBABILITY = 0.05d;
  public static final double MAX_SUCCESS_PROBABILITY = 0.95d;
  public static final int FAILURE_TTS_OFFSET = 999;
  static final double PRICE_VARIANCE_MIN = 0.9d;
  static final double PRICE_VARIANCE_SPAN = 0.2d;

  /**
   * 役割: 1 件の検索結果を解決する。
   * 動作: duration → warm-up → 成否 → (成功時) tts → condition → 価格ゆらぎ → 構成 ID 昇順の一致判定
   *       の順で rng を消費する。失敗時の tts は duration + 999。
   * 前提: rng は nextDouble() と nextInt(origin, bound) のみ使用する。requested は null 可。
   */
  public ResolvedOutcome resolve(
      TierDefinition tier,
      QualityTier quality,
      long basePrice,
      double creditModifier,
      Map<String, Integer> requested,
      RandomGenerator rng) {
    if (tier == null || quality == null) {
      throw new IllegalArgumentException("tier and quality are required");
    }
    final long cost = cost(tier, basePrice, creditModifier);
    final int duration = rng.nextInt(tier.minDuration(), tier.maxDuration() + 1);
    rng.nextDouble();
    final double roll = rng.nextDouble();
    if (roll > effectiveSuccessProbability(tier, quality)) {
      return new ResolvedOutcome(cost, duration, false, duration + FAILURE_TTS_OFFSET, null);
    }

    final int earliest = Math.max(1, duration / 2);
    final int timeToSuccess = rng.nextInt(earliest, duration + 1);
    final double condition =
        quality.minCondition()
            + rng.nextDouble() * (quality.maxCondition() - quality.minCondition());
    final double variance = PRICE_VARIANCE_MIN + rng.nextDouble() * PRICE_VARIANCE_SPAN;
    final long price =
        (long)
            Math.floor(
                basePrice
                    * quality.priceMultiplier()
                    * (condition / quality.maxCondition())
                    * variance);

    final SortedMap<String, Integer> matched = new TreeMap<>();
    final SortedSet<String> randomized = new TreeSet<>();
    if (requested != null) {
      for (Map.Entry<String, Integer> entry : new TreeMap<>(requested).entrySet()) {
        if (rng.nextDouble() <= tier.matchChance()) {
          matched.put(entry.getKey(), entry.getValue());
        } else {
          randomized.add(entry.getKey());
        }
      }
    }
    return new ResolvedOutcome(
        cost, duration, true, timeToSuccess, new FoundItem(condition, price, matched, randomized));
  }

  public static long cost(TierDefinition tier, long basePrice, double creditModifier) {
    return (long) Math.floor(basePrice * tier.feeFraction() * (1.0d + creditModifier));
  }

  public static double effectiveSuccessProbability(TierDefinition tier, QualityTier quality) {
    final double combined = tier.baseSuccess() + quality.successModifier();
    return Math.max(MIN_SUCCESS_PROBABILITY, Math.min(MAX_SUCCESS_PROBABILITY, combined));
  }
}
