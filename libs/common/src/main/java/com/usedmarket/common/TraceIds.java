package com.usedmarket.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 役割: 現在のスレッドに紐づく trace_id を返す。
   * 動作: MDC の trace_id / traceId を順に参照し、どちらも無ければ新しい ID を採番する。
   * 前提: なし。
   */
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_KEY);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get("traceId");
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
