/*
 * どこで: Procurement ドメインモデル
 * 何を: 成功した検索から生成される購入可能な出品を表す
 * なぜ: 有効期限のカウントダウンと点検状態を出品単位で管理するため
 */
package com.usedmarket.procurement.model;

public final class SearchListing {

  private final String id;
  private final String searchId;
  private final String consumerId;
  private final String tierId;
  private final String catalogKey;
  private final String displayName;
  private final FoundItem item;
  private final int createdDay;
  private int hoursRemaining;
  private ListingStatus status;
  private InspectionState inspectionState;
  private String inspectionTierId;
  private long inspectionCompletesAtHour;

  private SearchListing(ListingSnapshot snapshot) {
    this.id = snapshot.id();
    this.searchId = snapshot.searchId();
    this.consumerId = snapshot.consumerId();
    this.tierId = snapshot.tierId();
    this.catalogKey = snapshot.catalogKey();
    this.displayName = snapshot.displayName();
    this.item = snapshot.item();
    this.hoursRemaining = snapshot.hoursRemaining();
    this.status = snapshot.status();
    this.inspectionState = snapshot.inspectionState();
    this.inspectionTierId = snapshot.inspectionTierId();
    this.inspectionCompletesAtHour = snapshot.inspectionCompletesAtHour();
    this.createdDay = snapshot.createdDay();
  }

  /**
   * 役割: 成功確定した検索から出品を生成する。
   * 動作: 発見内容を引き継ぎ、有効期限 ttlHours で AVAILABLE の出品を返す。
   * 前提: record は SUCCESS 遷移済みで foundItem を持つ。
   */
  public static SearchListing fromSucceededSearch(
      String id, SearchRecord record, int ttlHours, int createdDay) {
    if (record.foundItem() == null) {
      throw new IllegalStateException("search has no found item: " + record.id());
    }
    return new SearchListing(
        new ListingSnapshot(
            id,
            record.id(),
            record.consumerId(),
            record.tierId(),
            record.item().catalogKey(),
            record.item().displayName(),
            record.foundItem(),
            ttlHours,
            ListingStatus.AVAILABLE,
            InspectionState.NONE,
            null,
            0L,
            createdDay));
  }

  public static SearchListing fromSnapshot(ListingSnapshot snapshot) {
    return new SearchListing(snapshot);
  }

  public ListingSnapshot snapshot() {
    return new ListingSnapshot(
        id,
        searchId,
        consumerId,
        tierId,
        catalogKey,
        displayName,
        item,
        hoursRemaining,
        status,
        inspectionState,
        inspectionTierId,
        inspectionCompletesAtHour,
        createdDay);
  }

  /** 点検待ちの間は期限を進めない。減算した場合は true。 */
  public boolean age(int hours) {
    if (status != ListingStatus.AVAILABLE || inspectionState == InspectionState.PENDING) {
      return false;
    }
    hoursRemaining -= hours;
    return true;
  }

  public boolean isExpired() {
    return status == ListingStatus.AVAILABLE
        && inspectionState != InspectionState.PENDING
        && hoursRemaining <= 0;
  }

  public void beginInspection(String tierId, long completesAtHour) {
    if (inspectionState != InspectionState.NONE) {
      throw new IllegalStateException("inspection already requested for listing " + id);
    }
    inspectionState = InspectionState.PENDING;
    inspectionTierId = tierId;
    inspectionCompletesAtHour = completesAtHour;
  }

  public boolean isInspectionDue(long currentHour) {
    return inspectionState == InspectionState.PENDING && currentHour >= inspectionCompletesAtHour;
  }

  /** 点検待ちでなければ 0。完了予定時刻を過ぎていても負にはしない。 */
  public long inspectionHoursRemaining(long currentHour) {
    if (inspectionState != InspectionState.PENDING) {
      return 0L;
    }
    return Math.max(0L, inspectionCompletesAtHour - currentHour);
  }

  /**
   * 役割: 点検待ちを取り消し、未依頼の状態へ戻す。
   * 動作: 点検ティアと完了予定時刻を消去し、期限のカウントダウンを再開させる。
   * 前提: 点検待ちであること。支払済みの点検費用はここでは扱わない。
   */
  public void cancelInspection() {
    if (inspectionState != InspectionState.PENDING) {
      throw new IllegalStateException("no pending inspection for listing " + id);
    }
    inspectionState = InspectionState.NONE;
    inspectionTierId = null;
    inspectionCompletesAtHour = 0L;
  }

  public void completeInspection() {
    if (inspectionState != InspectionState.PENDING) {
      throw new IllegalStateException("no pending inspection for listing " + id);
    }
    inspectionState = InspectionState.COMPLETE;
  }

  public void markPurchased() {
    requireAvailable();
    status = ListingStatus.PURCHASED;
  }

  public void markExpired() {
    requireAvailable();
    status = ListingStatus.EXPIRED;
  }

  private void requireAvailable() {
    if (status != ListingStatus.AVAILABLE) {
      throw new IllegalStateException("listing " + id + " is " + status.value());
    }
  }

  public String id() {
    return id;
  }

  public String searchId() {
    return searchId;
  }

  public String consumerId() {
    return consumerId;
  }

  public String tierId() {
    return tierId;
  }

  public String catalogKey() {
    return catalogKey;
  }

  public FoundItem item() {
    return item;
  }

  public int hoursRemaining() {
    return hoursRemaining;
  }

  public ListingStatus status() {
    return status;
  }

  public InspectionState inspectionState() {
    return inspectionState;
  }
}
