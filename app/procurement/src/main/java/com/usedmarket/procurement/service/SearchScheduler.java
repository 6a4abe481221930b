/*
 * どこで: Procurement サービス層
 * 何を: 全検索レコード・出品・連番を所有し、受付/時間経過/キャンセル/更新/購入/点検を処理する
 * なぜ: 状態の書き込みを単一の所有者へ集約し、複数日の早送りでも日単位の結果を一致させるため
 */
package com.usedmarket.procurement.service;

import com.google.common.annotations.VisibleForTesting;
import com.usedmarket.procurement.api.AcquisitionFailedException;
import com.usedmarket.procurement.api.InsufficientFundsException;
import com.usedmarket.procurement.api.InvalidProcurementRequestException;
import com.usedmarket.procurement.api.InvalidSearchStateException;
import com.usedmarket.procurement.api.ListingNotFoundException;
import com.usedmarket.procurement.api.ResourceAccessDeniedException;
import com.usedmarket.procurement.api.SearchNotFoundException;
import com.usedmarket.procurement.client.AcquisitionClient;
import com.usedmarket.procurement.client.ChargeResult;
import com.usedmarket.procurement.client.HostIntegrationException;
import com.usedmarket.procurement.client.LedgerClient;
import com.usedmarket.procurement.client.dto.AcquisitionRequest;
import com.usedmarket.procurement.config.ProcurementProperties;
import com.usedmarket.procurement.model.CompletionCheck;
import com.usedmarket.procurement.model.InspectionState;
import com.usedmarket.procurement.model.InspectionTier;
import com.usedmarket.procurement.model.ItemReference;
import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.ListingStatus;
import com.usedmarket.procurement.model.ProcurementEvent;
import com.usedmarket.procurement.model.ProcurementEventType;
import com.usedmarket.procurement.model.QualityTier;
import com.usedmarket.procurement.model.SearchListing;
import com.usedmarket.procurement.model.SearchRecord;
import com.usedmarket.procurement.model.SearchRecordSnapshot;
import com.usedmarket.procurement.model.SearchStatus;
import com.usedmarket.procurement.model.SimulationTime;
import com.usedmarket.procurement.model.TierDefinition;
import com.usedmarket.procurement.replication.SearchWireCodec;
import com.usedmarket.procurement.repository.SchedulerMeta;
import com.usedmarket.procurement.repository.SchedulerState;
import com.usedmarket.procurement.repository.SearchStateRepository;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchScheduler {

  private static final Logger logger = LoggerFactory.getLogger(SearchScheduler.class);

  private static final int RENEWABLE_HISTORY = 1_000;

  private final TierCatalog catalog;
  private final OutcomeResolver resolver;
  private final CreditScoreResolver creditScoreResolver;
  private final LedgerClient ledgerClient;
  private final AcquisitionClient acquisitionClient;
  private final SearchStateRepository repository;
  private final ProcurementEventPublisher eventPublisher;
  private final SearchWireCodec wireCodec;
  private final ProcurementMetrics metrics;
  private final ProcurementProperties properties;
  private final RandomGenerator rng;
  private final List<AgentTransactionListener> listeners;

  private final Map<String, SearchRecord> registry = new LinkedHashMap<>();
  private final TreeMap<String, Set<String>> activeByConsumer = new TreeMap<>();
  private final Map<String, SearchListing> listings = new LinkedHashMap<>();
  // 失敗/購入完了/出品期限切れで終了した検索。更新元として古い順に上限まで保持する
  private final Map<String, SearchRecord> concluded =
      new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, SearchRecord> eldest) {
          return size() > RENEWABLE_HISTORY;
        }
      };
  private long nextSequence = 1L;
  private int lastProcessedDay;
  private long lastHour;

  public SearchScheduler(
      TierCatalog catalog,
      OutcomeResolver resolver,
      CreditScoreResolver creditScoreResolver,
      LedgerClient ledgerClient,
      AcquisitionClient acquisitionClient,
      SearchStateRepository repository,
      ProcurementEventPublisher eventPublisher,
      SearchWireCodec wireCodec,
      ProcurementMetrics metrics,
      ProcurementProperties properties,
      RandomGenerator rng,
      List<AgentTransactionListener> listeners) {
    this.catalog = catalog;
    this.resolver = resolver;
    this.creditScoreResolver = creditScoreResolver;
    this.ledgerClient = ledgerClient;
    this.acquisitionClient = acquisitionClient;
    this.repository = repository;
    this.eventPublisher = eventPublisher;
    this.wireCodec = wireCodec;
    this.metrics = metrics;
    this.properties = properties;
    this.rng = rng;
    this.listeners = List.copyOf(listeners);
  }

  /**
   * 役割: 検索依頼を受け付ける。
   * 動作: 入力検証 → 信用補正の取得 → 結果解決 → 手数料課金 → 登録/保存/通知の順に処理する。
   *       課金拒否時は InsufficientFundsException を送出し、連番は消費しない。
   * 前提: tierId / qualityId はカタログに存在すること (未知なら ConfigurationException)。
   */
  public synchronized SearchRecordSnapshot submit(
      String consumerId,
      ItemReference item,
      String tierId,
      String qualityId,
      Map<String, Integer> requestedConfigurations,
      SimulationTime now) {
    validateSubmit(consumerId, item, requestedConfigurations);
    final TierDefinition tier = catalog.tier(tierId);
    final QualityTier quality = catalog.quality(qualityId);
    final double creditModifier = creditScoreResolver.feeModifier(consumerId);
    final ItemReference normalizedItem =
        new ItemReference(
            item.catalogKey(),
            isBlank(item.displayName()) ? item.catalogKey() : item.displayName(),
            item.basePrice());

    final SearchRecord record =
        SearchRecord.create(
            formatSearchId(nextSequence),
            consumerId,
            normalizedItem,
            tier,
            quality,
            requestedConfigurations,
            creditModifier,
            now.hour(),
            resolver,
            rng);

    final ChargeResult charge =
        ledgerClient.charge(consumerId, record.cost(), "search_fee:" + record.id());
    if (charge == ChargeResult.INSUFFICIENT_FUNDS) {
      throw new InsufficientFundsException(
          "insufficient funds for search fee " + record.cost() + " consumerId=" + consumerId);
    }

    nextSequence++;
    registry.put(record.id(), record);
    activeByConsumer.computeIfAbsent(consumerId, key -> new LinkedHashSet<>()).add(record.id());
    repository.saveSearch(record.snapshot());
    repository.saveMeta(meta());

    metrics.recordSearchSubmitted(tier.id());
    updateGauges();
    logger.info(
        "search submitted searchId={} consumerId={} tier={} quality={} cost={} ttl={}",
        record.id(),
        consumerId,
        tier.id(),
        quality.id(),
        record.cost(),
        record.ttl());
    publishSafely(ProcurementEvent.ofSearch(ProcurementEventType.SEARCH_SUBMITTED, record, now.day()));
    replicateSafely(record);
    return record.snapshot();
  }

  /**
   * 役割: シミュレーション時刻まで状態を進める。
   * 動作: 前回処理日の翌日から now.day までを 1 日ずつ処理する。各日はその日の境界時刻までに
   *       完了する点検 → 出品の期限減算 → 利用者 ID 昇順で検索を減算・判定の順に進め、最後に
   *       now.hour までの点検完了を処理する。新規出品は全日分の計算後に公開する。
   * 前提: now は単調非減少。
   */
  public synchronized TickReport tick(SimulationTime now) {
    final long startedAt = System.nanoTime();
    final List<SearchListing> inspected = new ArrayList<>();
    final List<SearchListing> staged = new ArrayList<>();
    final List<SearchListing> expired = new ArrayList<>();
    final List<SearchRecord> failed = new ArrayList<>();
    final Set<SearchListing> touched = new LinkedHashSet<>();
    final int daysElapsed = now.day() - lastProcessedDay;
    if (daysElapsed > 0) {
      for (int day = lastProcessedDay + 1; day <= now.day(); day++) {
        final List<SearchListing> inspectedToday =
            completeDueInspections((long) day * SimulationTime.HOURS_PER_DAY);
        inspected.addAll(inspectedToday);
        ageListings(staged, inspectedToday, expired, touched);
        advanceSearches(day, staged, failed);
      }
      lastProcessedDay = now.day();
    }
    inspected.addAll(completeDueInspections(now.hour()));
    touched.addAll(inspected);
    lastHour = now.hour();

    final List<SearchListing> published =
        commit(staged, expired, failed, touched, daysElapsed > 0);
    publishTickEvents(now, inspected, published, expired, failed);
    metrics.recordTickDuration(Duration.ofNanos(System.nanoTime() - startedAt));
    updateGauges();

    final TickReport report =
        new TickReport(
            Math.max(0, daysElapsed),
            published.stream().map(SearchListing::id).toList(),
            failed.stream().map(SearchRecord::id).toList(),
            expired.stream().map(SearchListing::id).toList(),
            inspected.stream().map(SearchListing::id).toList());
    if (daysElapsed > 0 || !inspected.isEmpty()) {
      logger.info(
          "scheduler tick day={} hour={} days={} listings={} failed={} expired={} inspections={}",
          now.day(),
          now.hour(),
          report.daysProcessed(),
          report.listingsCreated().size(),
          report.searchesFailed().size(),
          report.listingsExpired().size(),
          report.inspectionsCompleted().size());
    }
    return report;
  }

  /** ACTIVE の検索のみキャンセルできる。手数料は返金しない。 */
  public synchronized SearchRecordSnapshot cancel(String consumerId, String searchId) {
    final SearchRecord record = requireOwnedSearch(consumerId, searchId);
    if (record.status() != SearchStatus.ACTIVE) {
      throw new InvalidSearchStateException(
          "search " + searchId + " cannot be cancelled in status " + record.status().value());
    }
    record.cancel();
    removeSearch(record);
    repository.deleteSearch(record.id());
    metrics.recordSearchResult("cancelled");
    updateGauges();
    logger.info("search cancelled searchId={} consumerId={}", searchId, consumerId);
    publishSafely(
        ProcurementEvent.ofSearch(ProcurementEventType.SEARCH_CANCELLED, record, lastProcessedDay));
    replicateSafely(record);
    return record.snapshot();
  }

  /**
   * 役割: 出品を購入する。
   * 動作: 価格を課金 → ホストで実体化 → 出品 PURCHASED / 検索 COMPLETED として両方を解放する。
   *       実体化に失敗した場合は返金し AcquisitionFailedException を送出する (状態は変更しない)。
   * 前提: 点検待ちの出品は購入できない。
   */
  public synchronized ListingSnapshot purchaseListing(
      String consumerId, String listingId, SimulationTime now) {
    final SearchListing listing = requireOwnedListing(consumerId, listingId);
    if (listing.inspectionState() == InspectionState.PENDING) {
      throw new InvalidSearchStateException("listing " + listingId + " has a pending inspection");
    }
    final long price = listing.item().price();
    final AcquisitionRequest request = acquisitionRequest(listing);
    if (ledgerClient.charge(consumerId, price, "listing_purchase:" + listingId)
        == ChargeResult.INSUFFICIENT_FUNDS) {
      throw new InsufficientFundsException(
          "insufficient funds for listing " + listingId + " price=" + price);
    }

    final boolean materialized;
    try {
      materialized = acquisitionClient.materialize(request);
    } catch (HostIntegrationException ex) {
      refund(consumerId, price, listingId);
      metrics.recordDependencyError("acquisition_" + ex.reason().name().toLowerCase(Locale.ROOT));
      throw new AcquisitionFailedException("acquisition failed for listing " + listingId, ex);
    }
    if (!materialized) {
      refund(consumerId, price, listingId);
      metrics.recordDependencyError("acquisition_rejected");
      throw new AcquisitionFailedException("acquisition rejected for listing " + listingId);
    }

    listing.markPurchased();
    listings.remove(listingId);
    repository.deleteListing(listingId);
    final SearchRecord record = registry.get(listing.searchId());
    if (record != null) {
      record.markCompleted();
      removeSearch(record);
      concluded.put(record.id(), record);
      repository.deleteSearch(record.id());
      replicateSafely(record);
    }
    metrics.recordListingResult("purchased");
    updateGauges();
    logger.info(
        "listing purchased listingId={} consumerId={} price={}", listingId, consumerId, price);
    publishSafely(
        ProcurementEvent.ofListing(ProcurementEventType.LISTING_PURCHASED, listing, now.day()));
    notifyListeners(consumerId, listing.tierId(), now);
    return listing.snapshot();
  }

  /** 点検費用を課金し、完了時刻まで出品を点検待ちにする。 */
  public synchronized ListingSnapshot requestInspection(
      String consumerId, String listingId, String inspectionTierId, SimulationTime now) {
    final SearchListing listing = requireOwnedListing(consumerId, listingId);
    final InspectionTier tier = catalog.inspectionTier(inspectionTierId);
    if (listing.inspectionState() != InspectionState.NONE) {
      throw new InvalidSearchStateException(
          "listing " + listingId + " inspection is " + listing.inspectionState().value());
    }
    final long cost = tier.costFor(listing.item().price());
    if (ledgerClient.charge(consumerId, cost, "inspection:" + listingId)
        == ChargeResult.INSUFFICIENT_FUNDS) {
      throw new InsufficientFundsException(
          "insufficient funds for inspection " + tier.id() + " cost=" + cost);
    }
    listing.beginInspection(tier.id(), now.hour() + tier.durationHours());
    repository.saveListing(listing.snapshot());
    metrics.recordInspection("requested");
    logger.info(
        "inspection requested listingId={} tier={} cost={} completesAtHour={}",
        listingId,
        tier.id(),
        cost,
        now.hour() + tier.durationHours());
    return listing.snapshot();
  }

  /** 点検待ちを取り消す。支払済みの点検費用は返金しない。 */
  public synchronized ListingSnapshot cancelInspection(
      String consumerId, String listingId, SimulationTime now) {
    final SearchListing listing = requireOwnedListing(consumerId, listingId);
    if (listing.inspectionState() != InspectionState.PENDING) {
      throw new InvalidSearchStateException(
          "listing " + listingId + " has no pending inspection");
    }
    final long hoursLeft = listing.inspectionHoursRemaining(now.hour());
    listing.cancelInspection();
    repository.saveListing(listing.snapshot());
    metrics.recordInspection("cancelled");
    logger.info(
        "inspection cancelled listingId={} consumerId={} hoursLeft={}",
        listingId,
        consumerId,
        hoursLeft);
    return listing.snapshot();
  }

  public synchronized long inspectionHoursRemaining(
      String consumerId, String listingId, SimulationTime now) {
    return requireOwnedListing(consumerId, listingId).inspectionHoursRemaining(now.hour());
  }

  /**
   * 役割: 終了した検索を同じ条件で出し直す。
   * 動作: 元の品目・ティア・品質・要求構成で submit と同じ手順を踏み、手数料と結果を新たに確定する。
   *       受付に成功した場合だけ元の検索を更新元から外す。
   * 前提: 元の検索は失敗・購入完了・出品期限切れのいずれかで終了していること (キャンセルは対象外)。
   */
  public synchronized SearchRecordSnapshot renewSearch(
      String consumerId, String searchId, SimulationTime now) {
    final SearchRecord previous = concluded.get(searchId);
    if (previous == null) {
      if (registry.containsKey(searchId)) {
        final SearchRecord current = requireOwnedSearch(consumerId, searchId);
        throw new InvalidSearchStateException(
            "search " + searchId + " cannot be renewed in status " + current.status().value());
      }
      throw new SearchNotFoundException(searchId);
    }
    if (!previous.consumerId().equals(consumerId)) {
      throw new ResourceAccessDeniedException("search is owned by another consumer: " + searchId);
    }
    final SearchRecordSnapshot origin = previous.snapshot();
    final SearchRecordSnapshot renewed =
        submit(
            consumerId,
            origin.item(),
            origin.tierId(),
            origin.qualityId(),
            origin.requestedConfigurations(),
            now);
    concluded.remove(searchId);
    metrics.recordSearchResult("renewed");
    logger.info(
        "search renewed previousSearchId={} searchId={} consumerId={}",
        searchId,
        renewed.id(),
        consumerId);
    return renewed;
  }

  public synchronized List<SearchRecordSnapshot> searchesFor(String consumerId) {
    final List<SearchRecordSnapshot> result = new ArrayList<>();
    for (String searchId : activeByConsumer.getOrDefault(consumerId, Set.of())) {
      result.add(registry.get(searchId).snapshot());
    }
    return result;
  }

  public synchronized SearchRecordSnapshot findSearch(String consumerId, String searchId) {
    return requireOwnedSearch(consumerId, searchId).snapshot();
  }

  public synchronized byte[] replicaOf(String consumerId, String searchId) {
    return wireCodec.encodeSearch(requireOwnedSearch(consumerId, searchId).snapshot());
  }

  public synchronized List<ListingSnapshot> listingsFor(String consumerId) {
    final List<ListingSnapshot> result = new ArrayList<>();
    for (SearchListing listing : listings.values()) {
      if (listing.consumerId().equals(consumerId)) {
        result.add(listing.snapshot());
      }
    }
    return result;
  }

  /**
   * 役割: 保存済み状態から内部マップを再構築する。
   * 動作: AVAILABLE の出品を復元し、ACTIVE の検索と出品が残っている SUCCESS の検索だけを
   *       利用者の有効集合へ戻す。出品を失った SUCCESS の検索は保存先からも削除する。
   * 前提: 起動直後、他の操作より前に 1 回だけ呼ばれる。
   */
  public synchronized void restore(SchedulerState state) {
    registry.clear();
    activeByConsumer.clear();
    listings.clear();
    concluded.clear();
    final Set<String> listedSearchIds = new HashSet<>();
    for (ListingSnapshot snapshot : state.listings()) {
      if (snapshot.status() == ListingStatus.AVAILABLE) {
        listings.put(snapshot.id(), SearchListing.fromSnapshot(snapshot));
        listedSearchIds.add(snapshot.searchId());
      }
    }
    for (SearchRecordSnapshot snapshot : state.searches()) {
      if (snapshot.status() == SearchStatus.SUCCESS && !listedSearchIds.contains(snapshot.id())) {
        logger.warn(
            "dropping succeeded search without listing searchId={} consumerId={}",
            snapshot.id(),
            snapshot.consumerId());
        metrics.recordCorruptRecordSkipped("orphan_search");
        repository.deleteSearch(snapshot.id());
        continue;
      }
      if (snapshot.status() != SearchStatus.ACTIVE && snapshot.status() != SearchStatus.SUCCESS) {
        continue;
      }
      final SearchRecord record = SearchRecord.fromSnapshot(snapshot);
      registry.put(record.id(), record);
      activeByConsumer
          .computeIfAbsent(record.consumerId(), key -> new LinkedHashSet<>())
          .add(record.id());
    }
    nextSequence = Math.max(1L, state.meta().nextSequence());
    lastProcessedDay = state.meta().lastProcessedDay();
    lastHour = state.meta().lastHour();
    updateGauges();
    logger.info(
        "scheduler restored searches={} listings={} lastProcessedDay={}",
        registry.size(),
        listings.size(),
        lastProcessedDay);
  }

  @VisibleForTesting
  synchronized SchedulerMeta meta() {
    return new SchedulerMeta(nextSequence, lastProcessedDay, lastHour);
  }

  private List<SearchListing> completeDueInspections(long currentHour) {
    final List<SearchListing> completed = new ArrayList<>();
    for (SearchListing listing : listings.values()) {
      if (listing.isInspectionDue(currentHour)) {
        listing.completeInspection();
        completed.add(listing);
      }
    }
    return completed;
  }

  // 点検がその日のうちに完了した出品は期限判定を翌日へ回す
  private void ageListings(
      List<SearchListing> staged,
      List<SearchListing> inspectedToday,
      List<SearchListing> expired,
      Set<SearchListing> touched) {
    final List<SearchListing> candidates = new ArrayList<>(listings.values());
    candidates.addAll(staged);
    for (SearchListing listing : candidates) {
      if (listing.status() != ListingStatus.AVAILABLE) {
        continue;
      }
      if (listing.age(properties.unitsPerDay())) {
        touched.add(listing);
      }
      if (!inspectedToday.contains(listing) && listing.isExpired()) {
        listing.markExpired();
        expired.add(listing);
      }
    }
  }

  private void advanceSearches(int day, List<SearchListing> staged, List<SearchRecord> failed) {
    for (Set<String> searchIds : activeByConsumer.values()) {
      for (String searchId : List.copyOf(searchIds)) {
        final SearchRecord record = registry.get(searchId);
        if (record == null || record.status() != SearchStatus.ACTIVE) {
          continue;
        }
        record.advance(properties.unitsPerDay());
        final CompletionCheck check = record.checkCompletion();
        if (check == CompletionCheck.SUCCESS) {
          record.markSucceeded();
          staged.add(
              SearchListing.fromSucceededSearch(
                  formatListingId(day, nextSequence++), record, properties.listingTtlHours(), day));
        } else if (check == CompletionCheck.FAILED) {
          record.markFailed();
          searchIds.remove(searchId);
          registry.remove(searchId);
          concluded.put(searchId, record);
          failed.add(record);
        }
      }
    }
    activeByConsumer.values().removeIf(Set::isEmpty);
  }

  private List<SearchListing> commit(
      List<SearchListing> staged,
      List<SearchListing> expired,
      List<SearchRecord> failed,
      Set<SearchListing> touched,
      boolean advanced) {
    final List<SearchListing> published = new ArrayList<>();
    for (SearchListing listing : staged) {
      if (listing.status() == ListingStatus.AVAILABLE) {
        listings.put(listing.id(), listing);
        published.add(listing);
      }
    }
    for (SearchListing listing : expired) {
      listings.remove(listing.id());
      final SearchRecord record = registry.get(listing.searchId());
      if (record != null) {
        removeSearch(record);
        concluded.put(record.id(), record);
      }
      repository.deleteListing(listing.id());
      repository.deleteSearch(listing.searchId());
    }
    for (SearchRecord record : failed) {
      repository.deleteSearch(record.id());
    }
    if (advanced) {
      registry.values().forEach(record -> repository.saveSearch(record.snapshot()));
    }
    final Set<SearchListing> changed = new LinkedHashSet<>(published);
    changed.addAll(touched);
    for (SearchListing listing : changed) {
      if (listing.status() == ListingStatus.AVAILABLE) {
        repository.saveListing(listing.snapshot());
      }
    }
    // lastHour は再起動時の時計の復元元
    repository.saveMeta(meta());
    return published;
  }

  private void publishTickEvents(
      SimulationTime now,
      List<SearchListing> inspected,
      List<SearchListing> published,
      List<SearchListing> expired,
      List<SearchRecord> failed) {
    for (SearchListing listing : inspected) {
      metrics.recordInspection("completed");
      publishSafely(
          ProcurementEvent.ofListing(ProcurementEventType.INSPECTION_COMPLETED, listing, now.day()));
    }
    for (SearchListing listing : published) {
      metrics.recordSearchResult("success");
      publishSafely(
          ProcurementEvent.ofListing(
              ProcurementEventType.LISTING_FOUND, listing, listingDay(listing)));
      final SearchRecord record = registry.get(listing.searchId());
      if (record != null) {
        replicateSafely(record);
      }
    }
    for (SearchRecord record : failed) {
      metrics.recordSearchResult("failed");
      publishSafely(ProcurementEvent.ofSearch(ProcurementEventType.SEARCH_FAILED, record, now.day()));
      replicateSafely(record);
    }
    for (SearchListing listing : expired) {
      metrics.recordListingResult("expired");
      publishSafely(
          ProcurementEvent.ofListing(ProcurementEventType.LISTING_EXPIRED, listing, now.day()));
    }
  }

  private int listingDay(SearchListing listing) {
    return listing.snapshot().createdDay();
  }

  private void notifyListeners(String consumerId, String tierId, SimulationTime now) {
    for (AgentTransactionListener listener : listeners) {
      try {
        listener.onAgentPurchase(consumerId, tierId, now);
      } catch (RuntimeException ex) {
        logger.warn(
            "agent purchase listener failed consumerId={} listener={}",
            consumerId,
            listener.getClass().getSimpleName(),
            ex);
        metrics.recordDependencyError("purchase_listener");
      }
    }
  }

  private void refund(String consumerId, long amount, String listingId) {
    ledgerClient.credit(consumerId, amount, "listing_refund:" + listingId);
    logger.warn(
        "listing purchase refunded listingId={} consumerId={} amount={}",
        listingId,
        consumerId,
        amount);
  }

  private AcquisitionRequest acquisitionRequest(SearchListing listing) {
    return new AcquisitionRequest(
        listing.catalogKey(),
        listing.consumerId(),
        listing.item().condition(),
        Map.copyOf(listing.item().matchedConfigurations()),
        List.copyOf(listing.item().randomizedConfigurations()));
  }

  private void removeSearch(SearchRecord record) {
    registry.remove(record.id());
    final Set<String> searchIds = activeByConsumer.get(record.consumerId());
    if (searchIds != null) {
      searchIds.remove(record.id());
      if (searchIds.isEmpty()) {
        activeByConsumer.remove(record.consumerId());
      }
    }
  }

  private SearchRecord requireOwnedSearch(String consumerId, String searchId) {
    final SearchRecord record = registry.get(searchId);
    if (record == null) {
      throw new SearchNotFoundException(searchId);
    }
    if (!record.consumerId().equals(consumerId)) {
      throw new ResourceAccessDeniedException("search is owned by another consumer: " + searchId);
    }
    return record;
  }

  private SearchListing requireOwnedListing(String consumerId, String listingId) {
    final SearchListing listing = listings.get(listingId);
    if (listing == null) {
      throw new ListingNotFoundException(listingId);
    }
    if (!listing.consumerId().equals(consumerId)) {
      throw new ResourceAccessDeniedException(
          "listing is owned by another consumer: " + listingId);
    }
    return listing;
  }

  private void validateSubmit(
      String consumerId, ItemReference item, Map<String, Integer> requestedConfigurations) {
    if (isBlank(consumerId)) {
      throw new InvalidProcurementRequestException("consumerId is required");
    }
    if (item == null || isBlank(item.catalogKey())) {
      throw new InvalidProcurementRequestException("catalogKey is required");
    }
    if (item.basePrice() <= 0) {
      throw new InvalidProcurementRequestException("basePrice must be positive");
    }
    if (requestedConfigurations == null) {
      return;
    }
    for (Map.Entry<String, Integer> entry : requestedConfigurations.entrySet()) {
      if (isBlank(entry.getKey())) {
        throw new InvalidProcurementRequestException("configuration name is required");
      }
      if (entry.getValue() == null || entry.getValue() < 0) {
        throw new InvalidProcurementRequestException(
            "configuration " + entry.getKey() + " must be a non-negative option index");
      }
    }
  }

  private void publishSafely(ProcurementEvent event) {
    try {
      eventPublisher.publish(event);
    } catch (RuntimeException ex) {
      logger.warn(
          "procurement event publish failed type={} consumerId={}",
          event.type().value(),
          event.consumerId(),
          ex);
      metrics.recordDependencyError("event_publish");
    }
  }

  private void replicateSafely(SearchRecord record) {
    try {
      eventPublisher.replicate(record.id(), wireCodec.encodeSearch(record.snapshot()));
    } catch (RuntimeException ex) {
      logger.warn("search replication failed searchId={}", record.id(), ex);
      metrics.recordDependencyError("replication_publish");
    }
  }

  private void updateGauges() {
    metrics.updateActiveSearches(registry.size());
    metrics.updateAvailableListings(listings.size());
  }

  static String formatSearchId(long sequence) {
    return String.format(Locale.ROOT, "SEARCH_%08d", sequence);
  }

  static String formatListingId(int day, long sequence) {
    return String.format(Locale.ROOT, "LISTING_D%d_%08d", day, sequence);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
