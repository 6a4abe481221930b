/*
 * どこで: Procurement 永続化層
 * 何を: 検索レコードと出品を Redis hash の固定フィールド集合へ変換する
 * なぜ: バージョンを持たないキー/値形式で、欠落フィールドの既定値を一定にするため
 */
package com.usedmarket.procurement.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.usedmarket.procurement.model.FoundItem;
import com.usedmarket.procurement.model.InspectionState;
import com.usedmarket.procurement.model.ItemReference;
import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.ListingStatus;
import com.usedmarket.procurement.model.SearchRecordSnapshot;
import com.usedmarket.procurement.model.SearchStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class SearchAttributesCodec {

  static final String FIELD_ID = "id";
  static final String FIELD_CONSUMER_ID = "consumer_id";
  static final String FIELD_CATALOG_KEY = "catalog_key";
  static final String FIELD_DISPLAY_NAME = "display_name";
  static final String FIELD_BASE_PRICE = "base_price";
  static final String FIELD_TIER_ID = "tier_id";
  static final String FIELD_QUALITY_ID = "quality_id";
  static final String FIELD_REQUESTED_CONFIGURATIONS = "requested_configurations";
  static final String FIELD_CREDIT_MODIFIER = "credit_modifier";
  static final String FIELD_COST = "cost";
  static final String FIELD_TTL = "ttl";
  static final String FIELD_TTS = "tts";
  static final String FIELD_SUCCESS_OUTCOME = "success_outcome";
  static final String FIELD_STATUS = "status";
  static final String FIELD_CREATED_AT_HOUR = "created_at_hour";
  static final String PREFIX_PENDING = "pending_";
  static final String PREFIX_FOUND = "found_";
  static final String FIELD_CONDITION = "condition";
  static final String FIELD_PRICE = "price";
  static final String FIELD_MATCHED = "matched_configurations";
  static final String FIELD_RANDOMIZED = "randomized_configurations";

  static final String FIELD_SEARCH_ID = "search_id";
  static final String FIELD_HOURS_REMAINING = "hours_remaining";
  static final String FIELD_INSPECTION_STATE = "inspection_state";
  static final String FIELD_INSPECTION_TIER_ID = "inspection_tier_id";
  static final String FIELD_INSPECTION_COMPLETES_AT_HOUR = "inspection_completes_at_hour";
  static final String FIELD_CREATED_DAY = "created_day";

  static final String DEFAULT_QUALITY_ID = "any";
  static final int DEFAULT_LISTING_HOURS = 72;

  private static final TypeReference<TreeMap<String, Integer>> CONFIGURATION_MAP =
      new TypeReference<>() {};
  private static final TypeReference<List<String>> CONFIGURATION_IDS = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public SearchAttributesCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Map<String, String> encodeSearch(SearchRecordSnapshot snapshot) {
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_ID, snapshot.id());
    fields.put(FIELD_CONSUMER_ID, snapshot.consumerId());
    fields.put(FIELD_CATALOG_KEY, snapshot.item().catalogKey());
    fields.put(FIELD_DISPLAY_NAME, nullToEmpty(snapshot.item().displayName()));
    fields.put(FIELD_BASE_PRICE, Long.toString(snapshot.item().basePrice()));
    fields.put(FIELD_TIER_ID, snapshot.tierId());
    fields.put(FIELD_QUALITY_ID, snapshot.qualityId());
    fields.put(FIELD_REQUESTED_CONFIGURATIONS, writeJson(snapshot.requestedConfigurations()));
    fields.put(FIELD_CREDIT_MODIFIER, Double.toString(snapshot.creditModifier()));
    fields.put(FIELD_COST, Long.toString(snapshot.cost()));
    fields.put(FIELD_TTL, Integer.toString(snapshot.ttl()));
    fields.put(FIELD_TTS, Integer.toString(snapshot.tts()));
    fields.put(FIELD_SUCCESS_OUTCOME, Boolean.toString(snapshot.successOutcome()));
    fields.put(FIELD_STATUS, snapshot.status().value());
    fields.put(FIELD_CREATED_AT_HOUR, Long.toString(snapshot.createdAtHour()));
    putFoundItem(fields, PREFIX_PENDING, snapshot.pendingFind());
    putFoundItem(fields, PREFIX_FOUND, snapshot.foundItem());
    return fields;
  }

  /**
   * 役割: Redis hash から検索レコードを復元する。
   * 動作: id 欠落や必須値の破損は CorruptRecordException。品質/状態/信用補正/作成時刻は既定値を補う。
   * 前提: key はログ用の Redis キー。
   */
  public SearchRecordSnapshot decodeSearch(String key, Map<?, ?> raw) {
    final RedisHashFields fields = RedisHashFields.of(key, raw);
    final String id = fields.required(FIELD_ID);
    try {
      return new SearchRecordSnapshot(
          id,
          fields.required(FIELD_CONSUMER_ID),
          new ItemReference(
              fields.required(FIELD_CATALOG_KEY),
              fields.optional(FIELD_DISPLAY_NAME, ""),
              fields.requiredLong(FIELD_BASE_PRICE)),
          fields.required(FIELD_TIER_ID),
          fields.optional(FIELD_QUALITY_ID, DEFAULT_QUALITY_ID),
          readConfigurations(fields, FIELD_REQUESTED_CONFIGURATIONS),
          fields.optionalDouble(FIELD_CREDIT_MODIFIER, 0.0d),
          fields.requiredLong(FIELD_COST),
          fields.requiredInt(FIELD_TTL),
          fields.requiredInt(FIELD_TTS),
          fields.optionalBoolean(FIELD_SUCCESS_OUTCOME, fields.has(PREFIX_PENDING + FIELD_PRICE)),
          readFoundItem(fields, PREFIX_PENDING),
          SearchStatus.fromValue(fields.optional(FIELD_STATUS, SearchStatus.ACTIVE.value())),
          readFoundItem(fields, PREFIX_FOUND),
          fields.optionalLong(FIELD_CREATED_AT_HOUR, 0L));
    } catch (IllegalArgumentException | ArithmeticException ex) {
      throw fields.corrupt("invalid search record " + id, ex);
    }
  }

  public Map<String, String> encodeListing(ListingSnapshot snapshot) {
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_ID, snapshot.id());
    fields.put(FIELD_SEARCH_ID, snapshot.searchId());
    fields.put(FIELD_CONSUMER_ID, snapshot.consumerId());
    fields.put(FIELD_TIER_ID, snapshot.tierId());
    fields.put(FIELD_CATALOG_KEY, snapshot.catalogKey());
    fields.put(FIELD_DISPLAY_NAME, nullToEmpty(snapshot.displayName()));
    putFoundItem(fields, "", snapshot.item());
    fields.put(FIELD_HOURS_REMAINING, Integer.toString(snapshot.hoursRemaining()));
    fields.put(FIELD_STATUS, snapshot.status().value());
    fields.put(FIELD_INSPECTION_STATE, snapshot.inspectionState().value());
    if (snapshot.inspectionTierId() != null) {
      fields.put(FIELD_INSPECTION_TIER_ID, snapshot.inspectionTierId());
    }
    fields.put(
        FIELD_INSPECTION_COMPLETES_AT_HOUR, Long.toString(snapshot.inspectionCompletesAtHour()));
    fields.put(FIELD_CREATED_DAY, Integer.toString(snapshot.createdDay()));
    return fields;
  }

  public ListingSnapshot decodeListing(String key, Map<?, ?> raw) {
    final RedisHashFields fields = RedisHashFields.of(key, raw);
    final String id = fields.required(FIELD_ID);
    try {
      final FoundItem item = readFoundItem(fields, "");
      if (item == null) {
        throw new CorruptRecordException(key, "listing has no item " + id);
      }
      return new ListingSnapshot(
          id,
          fields.required(FIELD_SEARCH_ID),
          fields.required(FIELD_CONSUMER_ID),
          fields.required(FIELD_TIER_ID),
          fields.required(FIELD_CATALOG_KEY),
          fields.optional(FIELD_DISPLAY_NAME, ""),
          item,
          fields.optionalInt(FIELD_HOURS_REMAINING, DEFAULT_LISTING_HOURS),
          ListingStatus.fromValue(fields.optional(FIELD_STATUS, ListingStatus.AVAILABLE.value())),
          InspectionState.fromValue(
              fields.optional(FIELD_INSPECTION_STATE, InspectionState.NONE.value())),
          fields.optional(FIELD_INSPECTION_TIER_ID, null),
          fields.optionalLong(FIELD_INSPECTION_COMPLETES_AT_HOUR, 0L),
          fields.optionalInt(FIELD_CREATED_DAY, 0));
    } catch (IllegalArgumentException | ArithmeticException ex) {
      throw fields.corrupt("invalid listing " + id, ex);
    }
  }

  private void putFoundItem(Map<String, String> fields, String prefix, FoundItem item) {
    if (item == null) {
      return;
    }
    fields.put(prefix + FIELD_CONDITION, Double.toString(item.condition()));
    fields.put(prefix + FIELD_PRICE, Long.toString(item.price()));
    fields.put(prefix + FIELD_MATCHED, writeJson(item.matchedConfigurations()));
    fields.put(prefix + FIELD_RANDOMIZED, writeJson(item.randomizedConfigurations()));
  }

  private FoundItem readFoundItem(RedisHashFields fields, String prefix) {
    if (!fields.has(prefix + FIELD_PRICE)) {
      return null;
    }
    final List<String> randomized = readJson(fields, prefix + FIELD_RANDOMIZED, CONFIGURATION_IDS);
    return new FoundItem(
        fields.optionalDouble(prefix + FIELD_CONDITION, 0.0d),
        fields.requiredLong(prefix + FIELD_PRICE),
        readConfigurations(fields, prefix + FIELD_MATCHED),
        randomized == null ? new TreeSet<>() : new TreeSet<>(randomized));
  }

  private SortedMap<String, Integer> readConfigurations(RedisHashFields fields, String field) {
    final TreeMap<String, Integer> configurations = readJson(fields, field, CONFIGURATION_MAP);
    return configurations == null ? new TreeMap<>() : configurations;
  }

  private <T> T readJson(RedisHashFields fields, String field, TypeReference<T> type) {
    if (!fields.has(field)) {
      return null;
    }
    try {
      return objectMapper.readValue(fields.required(field), type);
    } catch (JsonProcessingException ex) {
      throw fields.corrupt("invalid json in " + field, ex);
    }
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize configurations", ex);
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
