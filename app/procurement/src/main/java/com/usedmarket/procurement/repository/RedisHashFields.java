/*
 * どこで: Procurement 永続化層
 * 何を: Redis hash の文字列フィールドを読み書きする補助関数を提供する
 * なぜ: 既定値と破損判定を各コーデックで同じ規則にそろえるため
 */
package com.usedmarket.procurement.repository;

import java.util.HashMap;
import java.util.Map;

final class RedisHashFields {

  private final String key;
  private final Map<String, String> fields;

  private RedisHashFields(String key, Map<String, String> fields) {
    this.key = key;
    this.fields = fields;
  }

  static RedisHashFields of(String key, Map<?, ?> raw) {
    final Map<String, String> map = new HashMap<>();
    for (Map.Entry<?, ?> e : raw.entrySet()) {
      map.put(
          String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
    }
    return new RedisHashFields(key, map);
  }

  boolean has(String field) {
    final String value = fields.get(field);
    return value != null && !value.isBlank();
  }

  String required(String field) {
    if (!has(field)) {
      throw new CorruptRecordException(key, "missing field " + field);
    }
    return fields.get(field);
  }

  String optional(String field, String defaultValue) {
    return has(field) ? fields.get(field) : defaultValue;
  }

  long requiredLong(String field) {
    return parseLong(field, required(field));
  }

  long optionalLong(String field, long defaultValue) {
    return has(field) ? parseLong(field, fields.get(field)) : defaultValue;
  }

  int requiredInt(String field) {
    return Math.toIntExact(requiredLong(field));
  }

  int optionalInt(String field, int defaultValue) {
    return has(field) ? Math.toIntExact(parseLong(field, fields.get(field))) : defaultValue;
  }

  double optionalDouble(String field, double defaultValue) {
    if (!has(field)) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(fields.get(field));
    } catch (NumberFormatException ex) {
      throw new CorruptRecordException(key, "invalid number in " + field, ex);
    }
  }

  boolean optionalBoolean(String field, boolean defaultValue) {
    return has(field) ? Boolean.parseBoolean(fields.get(field)) : defaultValue;
  }

  CorruptRecordException corrupt(String message, Throwable cause) {
    return new CorruptRecordException(key, message, cause);
  }

  private long parseLong(String field, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      throw new CorruptRecordException(key, "invalid number in " + field, ex);
    }
  }
}
