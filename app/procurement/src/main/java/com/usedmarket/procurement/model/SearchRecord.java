/*
 * どこで: Procurement ドメインモデル
 * 何を: 進行中の検索 1 件と、作成時に凍結した結果を保持する
 * なぜ: 時間経過では残り時間だけを減算し、結果の再抽選を起こさないため
 */
package com.usedmarket.procurement.model;

import com.usedmarket.procurement.service.OutcomeResolver;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.random.RandomGenerator;

public final class SearchRecord {

  private final String id;
  private final String consumerId;
  private final ItemReference item;
  private final String tierId;
  private final String qualityId;
  private final SortedMap<String, Integer> requestedConfigurations;
  private final double creditModifier;
  private final long cost;
  private final boolean successOutcome;
  private final FoundItem pendingFind;
  private final long createdAtHour;
  private int ttl;
  private int tts;
  private SearchStatus status;
  private FoundItem foundItem;

  private SearchRecord(SearchRecordSnapshot snapshot) {
    this.id = snapshot.id();
    this.consumerId = snapshot.consumerId();
    this.item = snapshot.item();
    this.tierId = snapshot.tierId();
    this.qualityId = snapshot.qualityId();
    this.requestedConfigurations = new TreeMap<>(snapshot.requestedConfigurations());
    this.creditModifier = snapshot.creditModifier();
    this.cost = snapshot.cost();
    this.ttl = snapshot.ttl();
    this.tts = snapshot.tts();
    this.successOutcome = snapshot.successOutcome();
    this.pendingFind = snapshot.pendingFind();
    this.status = snapshot.status();
    this.foundItem = snapshot.foundItem();
    this.createdAtHour = snapshot.createdAtHour();
  }

  /**
   * 役割: 検索レコードを作成し、結果を一度だけ解決して凍結する。
   * 動作: OutcomeResolver を 1 回呼び、費用・ttl・tts・発見内容を確定して ACTIVE で返す。
   * 前提: tier/quality は TierCatalog で解決済み。rng は呼び出し側が所有する。
   */
  public static SearchRecord create(
      String id,
      String consumerId,
      ItemReference item,
      TierDefinition tier,
      QualityTier quality,
      Map<String, Integer> requestedConfigurations,
      double creditModifier,
      long createdAtHour,
      OutcomeResolver resolver,
      RandomGenerator rng) {
    final SortedMap<String, Integer> requested =
        new TreeMap<>(requestedConfigurations == null ? Map.of() : requestedConfigurations);
    final ResolvedOutcome outcome =
        resolver.resolve(tier, quality, item.basePrice(), creditModifier, requested, rng);
    return new SearchRecord(
        new SearchRecordSnapshot(
            id,
            consumerId,
            item,
            tier.id(),
            quality.id(),
            requested,
            creditModifier,
            outcome.cost(),
            outcome.duration(),
            outcome.timeToSuccess(),
            outcome.success(),
            outcome.pendingFind(),
            SearchStatus.ACTIVE,
            null,
            createdAtHour));
  }

  public static SearchRecord fromSnapshot(SearchRecordSnapshot snapshot) {
    return new SearchRecord(snapshot);
  }

  public SearchRecordSnapshot snapshot() {
    return new SearchRecordSnapshot(
        id,
        consumerId,
        item,
        tierId,
        qualityId,
        requestedConfigurations,
        creditModifier,
        cost,
        ttl,
        tts,
        successOutcome,
        pendingFind,
        status,
        foundItem,
        createdAtHour);
  }

  /** 残り時間を減算する。0 未満への減算もそのまま保持する。 */
  public void advance(int delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("delta must not be negative");
    }
    ttl -= delta;
    tts -= delta;
  }

  /**
   * 役割: 完了条件を判定する。
   * 動作: ACTIVE かつ tts <= 0 なら SUCCESS、ACTIVE かつ ttl <= 0 なら FAILED を返す。状態は変更しない。
   * 前提: 状態遷移は SearchScheduler が markSucceeded/markFailed で確定させる。
   */
  public CompletionCheck checkCompletion() {
    if (status != SearchStatus.ACTIVE) {
      return CompletionCheck.NONE;
    }
    if (tts <= 0) {
      return CompletionCheck.SUCCESS;
    }
    if (ttl <= 0) {
      return CompletionCheck.FAILED;
    }
    return CompletionCheck.NONE;
  }

  public void markSucceeded() {
    requireStatus(SearchStatus.ACTIVE);
    if (!successOutcome || pendingFind == null) {
      throw new IllegalStateException("search has no success outcome: " + id);
    }
    status = SearchStatus.SUCCESS;
    foundItem = pendingFind;
  }

  public void markFailed() {
    requireStatus(SearchStatus.ACTIVE);
    status = SearchStatus.FAILED;
  }

  public void markCompleted() {
    requireStatus(SearchStatus.SUCCESS);
    status = SearchStatus.COMPLETED;
  }

  /** キャンセル済みへの再呼び出しは false を返すだけ。手数料は返金しない。 */
  public boolean cancel() {
    if (status == SearchStatus.CANCELLED) {
      return false;
    }
    if (status != SearchStatus.ACTIVE) {
      throw new IllegalStateException("search is not active: " + id + " status=" + status.value());
    }
    status = SearchStatus.CANCELLED;
    return true;
  }

  private void requireStatus(SearchStatus expected) {
    if (status != expected) {
      throw new IllegalStateException(
          "search " + id + " expected status=" + expected.value() + " but was " + status.value());
    }
  }

  public String id() {
    return id;
  }

  public String consumerId() {
    return consumerId;
  }

  public ItemReference item() {
    return item;
  }

  public String tierId() {
    return tierId;
  }

  public String qualityId() {
    return qualityId;
  }

  public long cost() {
    return cost;
  }

  public int ttl() {
    return ttl;
  }

  public int tts() {
    return tts;
  }

  public boolean successOutcome() {
    return successOutcome;
  }

  public SearchStatus status() {
    return status;
  }

  public FoundItem foundItem() {
    return foundItem;
  }

  public long createdAtHour() {
    return createdAtHour;
  }
}
