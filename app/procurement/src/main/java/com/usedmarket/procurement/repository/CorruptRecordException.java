/*
 * どこで: Procurement 永続化層
 * 何を: 復元できない保存レコードを表現する
 * なぜ: 1 件の破損でロード全体を止めず、その 1 件だけを読み飛ばすため
 */
package com.usedmarket.procurement.repository;

public class CorruptRecordException extends RuntimeException {

  private final String key;

  public CorruptRecordException(String key, String message) {
    super(message + " key=" + key);
    this.key = key;
  }

  public CorruptRecordException(String key, String message, Throwable cause) {
    super(message + " key=" + key, cause);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
