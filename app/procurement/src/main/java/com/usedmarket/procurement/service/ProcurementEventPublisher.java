/*
 * どこで: Procurement サービス層
 * 何を: ドメインイベントとレプリケーション用スナップショットの送信口を定義する
 * なぜ: NATS 有効/無効で実装を切り替え、スケジューラを送信手段から独立させるため
 */
package com.usedmarket.procurement.service;

import com.usedmarket.procurement.model.ProcurementEvent;

public interface ProcurementEventPublisher {

  /**
   * 役割: ドメインイベントを publish する。
   * 動作: 送信失敗時は IllegalStateException を送出する。
   * 前提: event.type と consumerId は必須。
   */
  void publish(ProcurementEvent event);

  /**
   * 役割: 検索レコードのワイヤ形式スナップショットを購読ノードへ送る。
   * 動作: 送信失敗時は IllegalStateException を送出する。
   * 前提: payload は SearchWireCodec で直列化済み。
   */
  void replicate(String searchId, byte[] payload);
}
