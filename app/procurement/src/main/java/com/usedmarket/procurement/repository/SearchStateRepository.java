/*
 * どこで: Procurement 永続化層
 * 何を: 検索レコード・出品・スケジューラ状態の保存口を定義する
 * なぜ: SearchScheduler を保存先の実装から独立させるため
 */
package com.usedmarket.procurement.repository;

import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.SearchRecordSnapshot;

public interface SearchStateRepository {

  void saveSearch(SearchRecordSnapshot snapshot);

  void deleteSearch(String searchId);

  void saveListing(ListingSnapshot snapshot);

  void deleteListing(String listingId);

  void saveMeta(SchedulerMeta meta);

  /**
   * 役割: 保存済みの全状態を読み込む。
   * 動作: 破損レコードはログとメトリクスに記録して読み飛ばし、残りを返す。
   * 前提: 起動時に 1 回だけ呼ばれる。
   */
  SchedulerState load();
}
