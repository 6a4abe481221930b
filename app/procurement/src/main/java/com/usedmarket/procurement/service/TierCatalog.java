/*
 * どこで: Procurement サービス層
 * 何を: 検索ティア・品質ティア・点検ティアの静的カタログを提供する
 * なぜ: ID からの解決と未知 ID の検出を 1 か所に集約するため
 */
package com.usedmarket.procurement.service;

import com.google.common.collect.ImmutableMap;
import com.usedmarket.procurement.api.ConfigurationException;
import com.usedmarket.procurement.model.InspectionTier;
import com.usedmarket.procurement.model.QualityTier;
import com.usedmarket.procurement.model.TierDefinition;
import java.util.Collection;
import java.util.Locale;
import java.util.function.Function;
import org.springframework.stereotype.Component;

@Component
public class TierCatalog {

  public static final String LOCAL = "local";
  public static final String REGIONAL = "regional";
  public static final String NATIONAL = "national";

  private static final ImmutableMap<String, TierDefinition> TIERS =
      index(
          TierDefinition::id,
          new TierDefinition(LOCAL, "Local Search", 0.04d, 24, 24, 0.25d, 0.25d),
          new TierDefinition(REGIONAL, "Regional Search", 0.06d, 24, 48, 0.55d, 0.50d),
          new TierDefinition(NATIONAL, "National Search", 0.10d, 48, 96, 0.80d, 0.70d));

  private static final ImmutableMap<String, QualityTier> QUALITIES =
      index(
          QualityTier::id,
          new QualityTier("any", "Any Condition", 0.10d, 0.40d, 0.30d, 0.08d),
          new QualityTier("poor", "Poor", 0.05d, 0.30d, 0.15d, 0.15d),
          new QualityTier("fair", "Fair", 0.40d, 0.60d, 0.48d, 0.0d),
          new QualityTier("good", "Good", 0.60d, 0.80d, 0.65d, -0.08d),
          new QualityTier("excellent", "Excellent", 0.80d, 0.95d, 0.80d, -0.15d));

  private static final ImmutableMap<String, InspectionTier> INSPECTIONS =
      index(
          InspectionTier::id,
          new InspectionTier("quick", "Quick Glance", 1_000L, 0.02d, 2_500L, 2),
          new InspectionTier("standard", "Standard Inspection", 2_000L, 0.03d, 5_000L, 6),
          new InspectionTier("comprehensive", "Comprehensive Inspection", 4_000L, 0.05d, 10_000L, 12));

  public TierDefinition tier(String tierId) {
    return lookup(TIERS, tierId, "search tier");
  }

  public QualityTier quality(String qualityId) {
    return lookup(QUALITIES, qualityId, "quality tier");
  }

  public InspectionTier inspectionTier(String inspectionTierId) {
    return lookup(INSPECTIONS, inspectionTierId, "inspection tier");
  }

  public Collection<TierDefinition> tiers() {
    return TIERS.values();
  }

  public Collection<QualityTier> qualities() {
    return QUALITIES.values();
  }

  private static <T> T lookup(ImmutableMap<String, T> table, String id, String kind) {
    final T value = id == null ? null : table.get(id.toLowerCase(Locale.ROOT));
    if (value == null) {
      throw new ConfigurationException("unknown " + kind + ": " + id);
    }
    return value;
  }

  @SafeVarargs
  private static <T> ImmutableMap<String, T> index(Function<T, String> key, T... values) {
    final ImmutableMap.Builder<String, T> builder = ImmutableMap.builder();
    for (T value : values) {
      builder.put(key.apply(value), value);
    }
    return builder.buildOrThrow();
  }
}
