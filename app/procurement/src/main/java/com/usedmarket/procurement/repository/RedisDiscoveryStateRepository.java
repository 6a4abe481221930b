package com.usedmarket.procurement.repository;

import com.usedmarket.procurement.model.DiscoveryStateSnapshot;
import com.usedmarket.procurement.model.PrerequisiteSnapshot;
import com.usedmarket.procurement.service.ProcurementMetrics;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisDiscoveryStateRepository implements DiscoveryStateRepository {

  private static final Logger logger = LoggerFactory.getLogger(RedisDiscoveryStateRepository.class);

  static final String FIELD_CONSUMER_ID = "consumer_id";
  static final String FIELD_HAS_DISCOVERED = "has_discovered";
  static final String FIELD_HAS_PURCHASED = "has_purchased";
  static final String FIELD_OPPORTUNITY_ACTIVE = "opportunity_active";
  static final String FIELD_OPPORTUNITY_EXPIRY_HOUR = "opportunity_expiry_hour";
  static final String FIELD_ELIGIBLE_TRANSACTIONS = "eligible_transactions";
  static final String FIELD_PREREQ_USAGE_COUNT = "prereq_usage_count";
  static final String FIELD_PREREQ_CREDIT_SCORE = "prereq_credit_score";
  static final String FIELD_PREREQ_DEGRADED = "prereq_has_degraded_resource";
  static final String FIELD_PREREQ_EVALUATED_AT_HOUR = "prereq_evaluated_at_hour";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ProcurementMetrics metrics;

  public RedisDiscoveryStateRepository(
      StringRedisTemplate redisTemplate, ProcurementMetrics metrics) {
    this.redisTemplate = redisTemplate;
    this.metrics = metrics;
  }

  @Override
  public void save(DiscoveryStateSnapshot snapshot) {
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_CONSUMER_ID, snapshot.consumerId());
    fields.put(FIELD_HAS_DISCOVERED, Boolean.toString(snapshot.discovered()));
    fields.put(FIELD_HAS_PURCHASED, Boolean.toString(snapshot.purchased()));
    fields.put(FIELD_OPPORTUNITY_ACTIVE, Boolean.toString(snapshot.opportunityActive()));
    fields.put(FIELD_OPPORTUNITY_EXPIRY_HOUR, Long.toString(snapshot.opportunityExpiryHour()));
    fields.put(FIELD_ELIGIBLE_TRANSACTIONS, Integer.toString(snapshot.eligibleTransactions()));
    final String key = stateKey(snapshot.consumerId());
    final PrerequisiteSnapshot prerequisites = snapshot.lastPrerequisites();
    if (prerequisites == null) {
      // putAll は既存フィールドを消さないため、reset 前の評価値を明示的に取り除く
      redisTemplate
          .opsForHash()
          .delete(
              key,
              FIELD_PREREQ_USAGE_COUNT,
              FIELD_PREREQ_CREDIT_SCORE,
              FIELD_PREREQ_DEGRADED,
              FIELD_PREREQ_EVALUATED_AT_HOUR);
    } else {
      fields.put(FIELD_PREREQ_USAGE_COUNT, Integer.toString(prerequisites.usageCount()));
      fields.put(FIELD_PREREQ_CREDIT_SCORE, Integer.toString(prerequisites.creditScore()));
      fields.put(FIELD_PREREQ_DEGRADED, Boolean.toString(prerequisites.hasDegradedResource()));
      fields.put(FIELD_PREREQ_EVALUATED_AT_HOUR, Long.toString(prerequisites.evaluatedAtHour()));
    }
    redisTemplate.opsForHash().putAll(key, fields);
    redisTemplate.opsForSet().add(indexKey(), snapshot.consumerId());
  }

  @Override
  public List<DiscoveryStateSnapshot> loadAll() {
    final Set<String> consumerIds = redisTemplate.opsForSet().members(indexKey());
    final List<DiscoveryStateSnapshot> loaded = new ArrayList<>();
    if (consumerIds == null) {
      return loaded;
    }
    for (String consumerId : new TreeSet<>(consumerIds)) {
      final String key = stateKey(consumerId);
      final Map<Object, Object> raw = redisTemplate.opsForHash().entries(key);
      if (raw.isEmpty()) {
        continue;
      }
      try {
        loaded.add(decode(key, raw));
      } catch (CorruptRecordException ex) {
        logger.warn("skipping corrupt discovery state key={} cause={}", ex.key(), ex.getMessage());
        metrics.recordCorruptRecordSkipped("discovery");
      }
    }
    return loaded;
  }

  static DiscoveryStateSnapshot decode(String key, Map<?, ?> raw) {
    final RedisHashFields fields = RedisHashFields.of(key, raw);
    try {
      return new DiscoveryStateSnapshot(
          fields.required(FIELD_CONSUMER_ID),
          fields.optionalBoolean(FIELD_HAS_DISCOVERED, false),
          fields.optionalBoolean(FIELD_HAS_PURCHASED, false),
          fields.optionalBoolean(FIELD_OPPORTUNITY_ACTIVE, false),
          fields.optionalLong(FIELD_OPPORTUNITY_EXPIRY_HOUR, 0L),
          fields.optionalInt(FIELD_ELIGIBLE_TRANSACTIONS, 0),
          decodePrerequisites(fields));
    } catch (ArithmeticException ex) {
      throw fields.corrupt("invalid discovery state", ex);
    }
  }

  private static PrerequisiteSnapshot decodePrerequisites(RedisHashFields fields) {
    if (!fields.has(FIELD_PREREQ_EVALUATED_AT_HOUR)) {
      return null;
    }
    return new PrerequisiteSnapshot(
        fields.requiredInt(FIELD_PREREQ_USAGE_COUNT),
        fields.requiredInt(FIELD_PREREQ_CREDIT_SCORE),
        fields.optionalBoolean(FIELD_PREREQ_DEGRADED, false),
        fields.requiredLong(FIELD_PREREQ_EVALUATED_AT_HOUR));
  }

  static String stateKey(String consumerId) {
    return "um:discovery:" + consumerId;
  }

  static String indexKey() {
    return "um:discovery:consumers";
  }
}
