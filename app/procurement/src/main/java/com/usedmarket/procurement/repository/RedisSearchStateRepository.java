package com.usedmarket.procurement.repository;

import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.SearchRecordSnapshot;
import com.usedmarket.procurement.service.ProcurementMetrics;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisSearchStateRepository implements SearchStateRepository {

  private static final Logger logger = LoggerFactory.getLogger(RedisSearchStateRepository.class);

  private static final String FIELD_NEXT_SEQUENCE = "next_sequence";
  private static final String FIELD_LAST_PROCESSED_DAY = "last_processed_day";
  private static final String FIELD_LAST_HOUR = "last_hour";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final SearchAttributesCodec codec;
  private final ProcurementMetrics metrics;

  public RedisSearchStateRepository(
      StringRedisTemplate redisTemplate, SearchAttributesCodec codec, ProcurementMetrics metrics) {
    this.redisTemplate = redisTemplate;
    this.codec = codec;
    this.metrics = metrics;
  }

  @Override
  public void saveSearch(SearchRecordSnapshot snapshot) {
    redisTemplate.opsForHash().putAll(searchKey(snapshot.id()), codec.encodeSearch(snapshot));
    redisTemplate.opsForSet().add(searchIndexKey(), snapshot.id());
  }

  @Override
  public void deleteSearch(String searchId) {
    redisTemplate.delete(searchKey(searchId));
    redisTemplate.opsForSet().remove(searchIndexKey(), searchId);
  }

  @Override
  public void saveListing(ListingSnapshot snapshot) {
    redisTemplate.opsForHash().putAll(listingKey(snapshot.id()), codec.encodeListing(snapshot));
    redisTemplate.opsForSet().add(listingIndexKey(), snapshot.id());
  }

  @Override
  public void deleteListing(String listingId) {
    redisTemplate.delete(listingKey(listingId));
    redisTemplate.opsForSet().remove(listingIndexKey(), listingId);
  }

  @Override
  public void saveMeta(SchedulerMeta meta) {
    redisTemplate
        .opsForHash()
        .putAll(
            metaKey(),
            Map.of(
                FIELD_NEXT_SEQUENCE, Long.toString(meta.nextSequence()),
                FIELD_LAST_PROCESSED_DAY, Integer.toString(meta.lastProcessedDay()),
                FIELD_LAST_HOUR, Long.toString(meta.lastHour())));
  }

  @Override
  public SchedulerState load() {
    final List<SearchRecordSnapshot> searches =
        loadAll(searchIndexKey(), RedisSearchStateRepository::searchKey, codec::decodeSearch, "search");
    final List<ListingSnapshot> listings =
        loadAll(
            listingIndexKey(), RedisSearchStateRepository::listingKey, codec::decodeListing, "listing");
    return new SchedulerState(searches, listings, loadMeta());
  }

  private SchedulerMeta loadMeta() {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(metaKey());
    if (raw.isEmpty()) {
      return SchedulerMeta.initial();
    }
    final RedisHashFields fields = RedisHashFields.of(metaKey(), raw);
    final SchedulerMeta initial = SchedulerMeta.initial();
    return new SchedulerMeta(
        fields.optionalLong(FIELD_NEXT_SEQUENCE, initial.nextSequence()),
        fields.optionalInt(FIELD_LAST_PROCESSED_DAY, initial.lastProcessedDay()),
        fields.optionalLong(FIELD_LAST_HOUR, initial.lastHour()));
  }

  private <T> List<T> loadAll(
      String indexKey,
      Function<String, String> keyOf,
      BiFunction<String, Map<?, ?>, T> decoder,
      String recordType) {
    final Set<String> ids = redisTemplate.opsForSet().members(indexKey);
    final List<T> loaded = new ArrayList<>();
    if (ids == null) {
      return loaded;
    }
    for (String id : new TreeSet<>(ids)) {
      final String key = keyOf.apply(id);
      final Map<Object, Object> raw = redisTemplate.opsForHash().entries(key);
      if (raw.isEmpty()) {
        logger.warn("indexed {} missing in redis key={}", recordType, key);
        continue;
      }
      try {
        loaded.add(decoder.apply(key, raw));
      } catch (CorruptRecordException ex) {
        logger.warn("skipping corrupt {} key={} cause={}", recordType, ex.key(), ex.getMessage());
        metrics.recordCorruptRecordSkipped(recordType);
      }
    }
    return loaded;
  }

  static String searchKey(String searchId) {
    return "um:search:" + searchId;
  }

  static String searchIndexKey() {
    return "um:searches";
  }

  static String listingKey(String listingId) {
    return "um:listing:" + listingId;
  }

  static String listingIndexKey() {
    return "um:listings";
  }

  static String metaKey() {
    return "um:scheduler";
  }
}
