/*
 * どこで: Procurement API
 * 何を: 未知の検索・品質・点検ティア ID を表現する
 * なぜ: 設定不備を 400 応答へ変換するため
 */
package com.usedmarket.procurement.api;

public class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }
}
