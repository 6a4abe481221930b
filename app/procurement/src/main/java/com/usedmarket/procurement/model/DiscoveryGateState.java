/*
 * どこで: Procurement ドメインモデル
 * 何を: 利用者ごとのディスカバリー解放状態を保持する
 * なぜ: 発見済み・機会有効・天井カウンタを 1 か所で遷移させるため
 */
package com.usedmarket.procurement.model;

public final class DiscoveryGateState {

  private final String consumerId;
  private boolean discovered;
  private boolean purchased;
  private boolean opportunityActive;
  private long opportunityExpiryHour;
  private int eligibleTransactions;
  private PrerequisiteSnapshot lastPrerequisites;

  public DiscoveryGateState(String consumerId) {
    this.consumerId = consumerId;
  }

  public static DiscoveryGateState fromSnapshot(DiscoveryStateSnapshot snapshot) {
    final DiscoveryGateState state = new DiscoveryGateState(snapshot.consumerId());
    state.purchased = snapshot.purchased();
    state.eligibleTransactions = Math.max(0, snapshot.eligibleTransactions());
    // 機会有効なら発見済みでなければならない
    state.discovered = snapshot.discovered() || snapshot.opportunityActive();
    state.opportunityActive = snapshot.opportunityActive();
    state.opportunityExpiryHour = snapshot.opportunityExpiryHour();
    state.lastPrerequisites = snapshot.lastPrerequisites();
    return state;
  }

  public DiscoveryStateSnapshot snapshot() {
    return new DiscoveryStateSnapshot(
        consumerId,
        discovered,
        purchased,
        opportunityActive,
        opportunityExpiryHour,
        eligibleTransactions,
        lastPrerequisites);
  }

  public int recordEligibleTransaction() {
    if (discovered) {
      throw new IllegalStateException("discovery already happened for consumer " + consumerId);
    }
    eligibleTransactions++;
    return eligibleTransactions;
  }

  public void openOpportunity(long expiryHour) {
    discovered = true;
    opportunityActive = true;
    opportunityExpiryHour = expiryHour;
  }

  public void closeOpportunity() {
    opportunityActive = false;
  }

  public void markPurchased() {
    purchased = true;
    opportunityActive = false;
  }

  public boolean isOpportunityElapsed(long currentHour) {
    return opportunityActive && currentHour >= opportunityExpiryHour;
  }

  public void cachePrerequisites(PrerequisiteSnapshot snapshot) {
    this.lastPrerequisites = snapshot;
  }

  public String consumerId() {
    return consumerId;
  }

  public boolean discovered() {
    return discovered;
  }

  public boolean purchased() {
    return purchased;
  }

  public boolean opportunityActive() {
    return opportunityActive;
  }

  public long opportunityExpiryHour() {
    return opportunityExpiryHour;
  }

  public int eligibleTransactions() {
    return eligibleTransactions;
  }

  public PrerequisiteSnapshot lastPrerequisites() {
    return lastPrerequisites;
  }
}
