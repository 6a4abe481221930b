package com.usedmarket.procurement.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.usedmarket.procurement.ScriptedRandom;
import com.usedmarket.procurement.api.AcquisitionFailedException;
import com.usedmarket.procurement.api.ConfigurationException;
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
import com.usedmarket.procurement.model.FoundItem;
import com.usedmarket.procurement.model.InspectionState;
import com.usedmarket.procurement.model.ItemReference;
import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.ListingStatus;
import com.usedmarket.procurement.model.ProcurementEvent;
import com.usedmarket.procurement.model.ProcurementEventType;
import com.usedmarket.procurement.model.SearchRecordSnapshot;
import com.usedmarket.procurement.model.SearchStatus;
import com.usedmarket.procurement.model.SimulationTime;
import com.usedmarket.procurement.replication.SearchWireCodec;
import com.usedmarket.procurement.repository.SchedulerMeta;
import com.usedmarket.procurement.repository.SchedulerState;
import com.usedmarket.procurement.repository.SearchStateRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.random.RandomGenerator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class SearchSchedulerTest {

  private static final ItemReference TRACTOR = new ItemReference("tractor-6r", "6R Tractor", 10_000L);
  private static final SimulationTime START = SimulationTime.ofHour(0L);

  @Test
  void submitChargesFeeOnceAndRegistersActiveSearch() {
    final Fixture fixture = newFixture(successScript());

    final SearchRecordSnapshot snapshot =
        fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    assertThat(snapshot.id()).isEqualTo("SEARCH_00000001");
    assertThat(snapshot.cost()).isEqualTo(400L);
    assertThat(snapshot.status()).isEqualTo(SearchStatus.ACTIVE);
    verify(fixture.ledger).charge("consumer-1", 400L, "search_fee:SEARCH_00000001");
    verify(fixture.repository).saveSearch(snapshot);
    verify(fixture.publisher).replicate(eq("SEARCH_00000001"), any(byte[].class));
    assertThat(publishedTypes(fixture)).containsExactly(ProcurementEventType.SEARCH_SUBMITTED);
    assertThat(fixture.scheduler.searchesFor("consumer-1")).containsExactly(snapshot);
    assertThat(fixture.scheduler.searchesFor("consumer-2")).isEmpty();
  }

  @Test
  void refusedChargeDoesNotConsumeAnId() {
    final Fixture fixture = newFixture(new Random(3L));
    when(fixture.ledger.charge(anyString(), anyLong(), anyString()))
        .thenReturn(ChargeResult.INSUFFICIENT_FUNDS)
        .thenReturn(ChargeResult.OK);

    assertThatThrownBy(
            () -> fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START))
        .isInstanceOf(InsufficientFundsException.class);
    assertThat(fixture.scheduler.searchesFor("consumer-1")).isEmpty();

    final SearchRecordSnapshot accepted =
        fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    assertThat(accepted.id()).isEqualTo("SEARCH_00000001");
  }

  @Test
  void invalidSubmissionsAreRejectedBeforeCharging() {
    final Fixture fixture = newFixture(new Random(3L));

    assertThatThrownBy(
            () -> fixture.scheduler.submit(" ", TRACTOR, "local", "any", Map.of(), START))
        .isInstanceOf(InvalidProcurementRequestException.class);
    assertThatThrownBy(
            () ->
                fixture.scheduler.submit(
                    "consumer-1",
                    new ItemReference("tractor-6r", "6R", 0L),
                    "local",
                    "any",
                    Map.of(),
                    START))
        .isInstanceOf(InvalidProcurementRequestException.class);
    assertThatThrownBy(
            () -> fixture.scheduler.submit("consumer-1", TRACTOR, "global", "any", Map.of(), START))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(
            () -> fixture.scheduler.submit("consumer-1", TRACTOR, "local", "mint", Map.of(), START))
        .isInstanceOf(ConfigurationException.class);

    verifyNoInteractions(fixture.ledger);
  }

  @Test
  void successfulSearchBecomesListingAfterTick() {
    final Fixture fixture = newFixture(successScript());
    fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    final TickReport report = fixture.scheduler.tick(SimulationTime.ofHour(24L));

    assertThat(report.daysProcessed()).isEqualTo(1);
    assertThat(report.listingsCreated()).containsExactly("LISTING_D1_00000002");
    final List<ListingSnapshot> listings = fixture.scheduler.listingsFor("consumer-1");
    assertThat(listings).hasSize(1);
    assertThat(listings.get(0).searchId()).isEqualTo("SEARCH_00000001");
    assertThat(listings.get(0).item().price()).isEqualTo(1_875L);
    assertThat(listings.get(0).hoursRemaining()).isEqualTo(72);
    assertThat(fixture.scheduler.findSearch("consumer-1", "SEARCH_00000001").status())
        .isEqualTo(SearchStatus.SUCCESS);
    assertThat(publishedTypes(fixture)).contains(ProcurementEventType.LISTING_FOUND);
    verify(fixture.repository).saveListing(listings.get(0));
    assertThat(fixture.scheduler.meta()).isEqualTo(new SchedulerMeta(3L, 1, 24L));
  }

  @Test
  void failedSearchLeavesActiveSetAtExpiry() {
    final Fixture fixture = newFixture(failureScript());
    fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    final TickReport report = fixture.scheduler.tick(SimulationTime.ofHour(24L));

    assertThat(report.searchesFailed()).containsExactly("SEARCH_00000001");
    assertThat(fixture.scheduler.searchesFor("consumer-1")).isEmpty();
    assertThat(fixture.scheduler.listingsFor("consumer-1")).isEmpty();
    verify(fixture.repository).deleteSearch("SEARCH_00000001");
    assertThat(publishedTypes(fixture)).contains(ProcurementEventType.SEARCH_FAILED);
    verify(fixture.ledger, never()).credit(anyString(), anyLong(), anyString());
  }

  @Test
  void tickWithinSameDayDoesNotAdvanceSearches() {
    final Fixture fixture = newFixture(successScript());
    fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    final TickReport report = fixture.scheduler.tick(SimulationTime.ofHour(23L));

    assertThat(report.daysProcessed()).isZero();
    assertThat(fixture.scheduler.findSearch("consumer-1", "SEARCH_00000001").ttl()).isEqualTo(24);
    assertThat(fixture.scheduler.meta().lastHour()).isEqualTo(23L);
  }

  @Test
  void multiDayTickMatchesDailyTicks() {
    final Fixture batched = newFixture(new Random(42L));
    final Fixture daily = newFixture(new Random(42L));
    submitMix(batched);
    submitMix(daily);

    batched.scheduler.tick(SimulationTime.ofHour(24L * 6));
    for (int day = 1; day <= 6; day++) {
      daily.scheduler.tick(SimulationTime.ofHour(24L * day));
    }

    for (String consumerId : List.of("consumer-a", "consumer-b", "consumer-c")) {
      assertThat(batched.scheduler.searchesFor(consumerId))
          .isEqualTo(daily.scheduler.searchesFor(consumerId));
      assertThat(batched.scheduler.listingsFor(consumerId))
          .isEqualTo(daily.scheduler.listingsFor(consumerId));
    }
    assertThat(batched.scheduler.meta()).isEqualTo(daily.scheduler.meta());
  }

  @Test
  void multiDayTickMatchesDailyTicksAcrossCompletedInspection() {
    final Fixture batched = newFixture(successScript());
    final Fixture daily = newFixture(successScript());
    for (Fixture fixture : List.of(batched, daily)) {
      final String listingId = listingReady(fixture);
      fixture.scheduler.requestInspection(
          "consumer-1", listingId, "comprehensive", SimulationTime.ofHour(40L));
    }

    final TickReport report = batched.scheduler.tick(SimulationTime.ofHour(24L * 4));
    for (int day = 2; day <= 4; day++) {
      daily.scheduler.tick(SimulationTime.ofHour(24L * day));
    }

    assertThat(report.inspectionsCompleted()).hasSize(1);
    final List<ListingSnapshot> listings = batched.scheduler.listingsFor("consumer-1");
    assertThat(listings).isEqualTo(daily.scheduler.listingsFor("consumer-1"));
    assertThat(listings).hasSize(1);
    assertThat(listings.get(0).hoursRemaining()).isEqualTo(24);
    assertThat(listings.get(0).inspectionState()).isEqualTo(InspectionState.COMPLETE);
    assertThat(batched.scheduler.searchesFor("consumer-1"))
        .isEqualTo(daily.scheduler.searchesFor("consumer-1"));
    assertThat(batched.scheduler.meta()).isEqualTo(daily.scheduler.meta());
  }

  @Test
  void quickInspectionDoesNotShieldListingForWholeBatch() {
    final Fixture batched = newFixture(successScript());
    final Fixture daily = newFixture(successScript());
    for (Fixture fixture : List.of(batched, daily)) {
      final String listingId = listingReady(fixture);
      fixture.scheduler.requestInspection(
          "consumer-1", listingId, "quick", SimulationTime.ofHour(24L));
    }

    final TickReport report = batched.scheduler.tick(SimulationTime.ofHour(24L * 6));
    for (int day = 2; day <= 6; day++) {
      daily.scheduler.tick(SimulationTime.ofHour(24L * day));
    }

    assertThat(report.listingsExpired()).hasSize(1);
    assertThat(batched.scheduler.listingsFor("consumer-1")).isEmpty();
    assertThat(daily.scheduler.listingsFor("consumer-1")).isEmpty();
    assertThat(batched.scheduler.searchesFor("consumer-1")).isEmpty();
    assertThat(daily.scheduler.searchesFor("consumer-1")).isEmpty();
    assertThat(batched.scheduler.meta()).isEqualTo(daily.scheduler.meta());
  }

  @Test
  void hourlyTickPersistsOnlyChangedListings() {
    final Fixture fixture = newFixture(successScript());
    final String listingId = listingReady(fixture);

    fixture.scheduler.tick(SimulationTime.ofHour(30L));
    verify(fixture.repository, times(1)).saveListing(any(ListingSnapshot.class));

    fixture.scheduler.requestInspection(
        "consumer-1", listingId, "quick", SimulationTime.ofHour(30L));
    fixture.scheduler.tick(SimulationTime.ofHour(31L));
    fixture.scheduler.tick(SimulationTime.ofHour(32L));

    verify(fixture.repository, times(3)).saveListing(any(ListingSnapshot.class));
    verify(fixture.repository)
        .saveListing(argThat(saved -> saved.inspectionState() == InspectionState.COMPLETE));
    verify(fixture.repository, atLeastOnce()).saveMeta(new SchedulerMeta(3L, 1, 32L));
  }

  @Test
  void configurationsWithoutOptionIndexAreRejected() {
    final Fixture fixture = newFixture(successScript());
    final Map<String, Integer> missing = new HashMap<>();
    missing.put("paint", null);

    assertThatThrownBy(
            () -> fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", missing, START))
        .isInstanceOf(InvalidProcurementRequestException.class);
    assertThatThrownBy(
            () ->
                fixture.scheduler.submit(
                    "consumer-1", TRACTOR, "local", "any", Map.of("paint", -1), START))
        .isInstanceOf(InvalidProcurementRequestException.class);
    assertThatThrownBy(
            () ->
                fixture.scheduler.submit(
                    "consumer-1", TRACTOR, "local", "any", Map.of(" ", 1), START))
        .isInstanceOf(InvalidProcurementRequestException.class);

    verifyNoInteractions(fixture.ledger);
    assertThat(fixture.scheduler.searchesFor("consumer-1")).isEmpty();
  }

  @Test
  void unusableListingFailsBeforePriceIsCharged() {
    final Fixture fixture = newFixture(successScript());
    final TreeMap<String, Integer> matched = new TreeMap<>();
    matched.put("paint", null);
    final ListingSnapshot broken =
        new ListingSnapshot(
            "LISTING_D1_00000002",
            "SEARCH_00000001",
            "consumer-1",
            "local",
            "tractor-6r",
            "6R Tractor",
            new FoundItem(0.6d, 1_875L, matched, new TreeSet<>()),
            72,
            ListingStatus.AVAILABLE,
            InspectionState.NONE,
            null,
            0L,
            1);
    fixture.scheduler.restore(
        new SchedulerState(List.of(), List.of(broken), new SchedulerMeta(3L, 1, 24L)));

    assertThatThrownBy(
            () ->
                fixture.scheduler.purchaseListing(
                    "consumer-1", broken.id(), SimulationTime.ofHour(30L)))
        .isInstanceOf(NullPointerException.class);

    verify(fixture.ledger, never()).charge(anyString(), anyLong(), anyString());
    verifyNoInteractions(fixture.acquisition);
    assertThat(fixture.scheduler.listingsFor("consumer-1")).hasSize(1);
  }

  @Test
  void renewalResubmitsFailedSearchWithFreshFee() {
    final Fixture fixture = newFixture(failureScript().then(24, 0.0d, 0.1d, 20, 0.5d, 0.5d, 0.5d));
    fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of("paint", 1), START);
    fixture.scheduler.tick(SimulationTime.ofHour(24L));

    assertThatThrownBy(
            () ->
                fixture.scheduler.renewSearch(
                    "consumer-2", "SEARCH_00000001", SimulationTime.ofHour(24L)))
        .isInstanceOf(ResourceAccessDeniedException.class);

    final SearchRecordSnapshot renewed =
        fixture.scheduler.renewSearch("consumer-1", "SEARCH_00000001", SimulationTime.ofHour(24L));

    assertThat(renewed.id()).isEqualTo("SEARCH_00000002");
    assertThat(renewed.status()).isEqualTo(SearchStatus.ACTIVE);
    assertThat(renewed.item()).isEqualTo(TRACTOR);
    assertThat(renewed.tierId()).isEqualTo("local");
    assertThat(renewed.qualityId()).isEqualTo("any");
    assertThat(renewed.requestedConfigurations()).containsExactlyEntriesOf(Map.of("paint", 1));
    assertThat(renewed.createdAtHour()).isEqualTo(24L);
    verify(fixture.ledger).charge("consumer-1", 400L, "search_fee:SEARCH_00000002");
    assertThat(fixture.scheduler.searchesFor("consumer-1")).containsExactly(renewed);

    assertThatThrownBy(
            () ->
                fixture.scheduler.renewSearch(
                    "consumer-1", "SEARCH_00000001", SimulationTime.ofHour(24L)))
        .isInstanceOf(SearchNotFoundException.class);
    assertThatThrownBy(
            () ->
                fixture.scheduler.renewSearch(
                    "consumer-1", "SEARCH_00000002", SimulationTime.ofHour(24L)))
        .isInstanceOf(InvalidSearchStateException.class);
  }

  @Test
  void renewalIsOfferedForPurchasedButNotCancelledSearches() {
    final Fixture fixture =
        newFixture(
            successScript()
                .then(24, 0.0d, 0.99d)
                .then(24, 0.0d, 0.99d)
                .then(24, 0.0d, 0.99d));
    when(fixture.acquisition.materialize(any(AcquisitionRequest.class))).thenReturn(true);
    final String listingId = listingReady(fixture);
    fixture.scheduler.purchaseListing("consumer-1", listingId, SimulationTime.ofHour(30L));
    final String cancelledId =
        fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START).id();
    fixture.scheduler.cancel("consumer-1", cancelledId);

    assertThatThrownBy(
            () ->
                fixture.scheduler.renewSearch("consumer-1", cancelledId, SimulationTime.ofHour(30L)))
        .isInstanceOf(SearchNotFoundException.class);

    when(fixture.ledger.charge(eq("consumer-1"), eq(400L), anyString()))
        .thenReturn(ChargeResult.INSUFFICIENT_FUNDS)
        .thenReturn(ChargeResult.OK);
    assertThatThrownBy(
            () ->
                fixture.scheduler.renewSearch(
                    "consumer-1", "SEARCH_00000001", SimulationTime.ofHour(30L)))
        .isInstanceOf(InsufficientFundsException.class);

    final SearchRecordSnapshot renewed =
        fixture.scheduler.renewSearch("consumer-1", "SEARCH_00000001", SimulationTime.ofHour(30L));
    assertThat(renewed.status()).isEqualTo(SearchStatus.ACTIVE);
    assertThat(renewed.item()).isEqualTo(TRACTOR);
  }

  @Test
  void cancelledInspectionKeepsFeeAndUnblocksPurchase() {
    final Fixture fixture = newFixture(successScript());
    when(fixture.acquisition.materialize(any(AcquisitionRequest.class))).thenReturn(true);
    final String listingId = listingReady(fixture);
    fixture.scheduler.requestInspection(
        "consumer-1", listingId, "standard", SimulationTime.ofHour(24L));

    assertThat(
            fixture.scheduler.inspectionHoursRemaining(
                "consumer-1", listingId, SimulationTime.ofHour(27L)))
        .isEqualTo(3L);

    final ListingSnapshot cancelled =
        fixture.scheduler.cancelInspection("consumer-1", listingId, SimulationTime.ofHour(27L));

    assertThat(cancelled.inspectionState()).isEqualTo(InspectionState.NONE);
    assertThat(cancelled.inspectionTierId()).isNull();
    assertThat(
            fixture.scheduler.inspectionHoursRemaining(
                "consumer-1", listingId, SimulationTime.ofHour(27L)))
        .isZero();
    verify(fixture.ledger, never()).credit(anyString(), anyLong(), anyString());
    verify(fixture.repository, times(3)).saveListing(any(ListingSnapshot.class));
    assertThat(fixture.scheduler.tick(SimulationTime.ofHour(30L)).inspectionsCompleted()).isEmpty();
    assertThatThrownBy(
            () ->
                fixture.scheduler.cancelInspection(
                    "consumer-1", listingId, SimulationTime.ofHour(30L)))
        .isInstanceOf(InvalidSearchStateException.class);
    assertThatThrownBy(
            () ->
                fixture.scheduler.cancelInspection(
                    "consumer-2", listingId, SimulationTime.ofHour(30L)))
        .isInstanceOf(ResourceAccessDeniedException.class);

    assertThat(
            fixture
                .scheduler
                .purchaseListing("consumer-1", listingId, SimulationTime.ofHour(31L))
                .status())
        .isEqualTo(ListingStatus.PURCHASED);
  }

  @Test
  void cancelRejectsUnknownForeignAndFinishedSearches() {
    final Fixture fixture = newFixture(successScript().then(24, 0.0d, 0.1d, 20, 0.5d, 0.5d));
    fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);
    fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    assertThatThrownBy(() -> fixture.scheduler.cancel("consumer-1", "SEARCH_00000099"))
        .isInstanceOf(SearchNotFoundException.class);
    assertThatThrownBy(() -> fixture.scheduler.cancel("consumer-2", "SEARCH_00000001"))
        .isInstanceOf(ResourceAccessDeniedException.class);

    final SearchRecordSnapshot cancelled = fixture.scheduler.cancel("consumer-1", "SEARCH_00000001");

    assertThat(cancelled.status()).isEqualTo(SearchStatus.CANCELLED);
    assertThat(fixture.scheduler.searchesFor("consumer-1"))
        .extracting(SearchRecordSnapshot::id)
        .containsExactly("SEARCH_00000002");
    verify(fixture.ledger, never()).credit(anyString(), anyLong(), anyString());

    fixture.scheduler.tick(SimulationTime.ofHour(24L));
    assertThatThrownBy(() -> fixture.scheduler.cancel("consumer-1", "SEARCH_00000002"))
        .isInstanceOf(InvalidSearchStateException.class);
  }

  @Test
  void purchaseCompletesSearchAndNotifiesListeners() {
    final Fixture fixture = newFixture(successScript());
    when(fixture.acquisition.materialize(any(AcquisitionRequest.class))).thenReturn(true);
    final String listingId = listingReady(fixture);
    final SimulationTime now = SimulationTime.ofHour(30L);

    final ListingSnapshot purchased = fixture.scheduler.purchaseListing("consumer-1", listingId, now);

    assertThat(purchased.status()).isEqualTo(ListingStatus.PURCHASED);
    verify(fixture.ledger).charge("consumer-1", 1_875L, "listing_purchase:" + listingId);
    assertThat(fixture.scheduler.listingsFor("consumer-1")).isEmpty();
    assertThat(fixture.scheduler.searchesFor("consumer-1")).isEmpty();
    verify(fixture.listener).onAgentPurchase("consumer-1", "local", now);
    verify(fixture.repository).deleteListing(listingId);
    assertThat(publishedTypes(fixture)).contains(ProcurementEventType.LISTING_PURCHASED);
  }

  @Test
  void failedMaterializationRefundsAndKeepsListing() {
    final Fixture fixture = newFixture(successScript());
    when(fixture.acquisition.materialize(any(AcquisitionRequest.class))).thenReturn(false);
    final String listingId = listingReady(fixture);

    assertThatThrownBy(
            () -> fixture.scheduler.purchaseListing("consumer-1", listingId, SimulationTime.ofHour(30L)))
        .isInstanceOf(AcquisitionFailedException.class);

    verify(fixture.ledger).credit("consumer-1", 1_875L, "listing_refund:" + listingId);
    assertThat(fixture.scheduler.listingsFor("consumer-1")).hasSize(1);
    verifyNoInteractions(fixture.listener);
  }

  @Test
  void hostErrorDuringMaterializationAlsoRefunds() {
    final Fixture fixture = newFixture(successScript());
    when(fixture.acquisition.materialize(any(AcquisitionRequest.class)))
        .thenThrow(
            new HostIntegrationException(HostIntegrationException.Reason.TIMEOUT, "timeout"));
    final String listingId = listingReady(fixture);

    assertThatThrownBy(
            () -> fixture.scheduler.purchaseListing("consumer-1", listingId, SimulationTime.ofHour(30L)))
        .isInstanceOf(AcquisitionFailedException.class)
        .hasCauseInstanceOf(HostIntegrationException.class);

    verify(fixture.ledger).credit("consumer-1", 1_875L, "listing_refund:" + listingId);
  }

  @Test
  void purchaseWithoutFundsDoesNotMaterialize() {
    final Fixture fixture = newFixture(successScript());
    final String listingId = listingReady(fixture);
    when(fixture.ledger.charge(eq("consumer-1"), eq(1_875L), anyString()))
        .thenReturn(ChargeResult.INSUFFICIENT_FUNDS);

    assertThatThrownBy(
            () -> fixture.scheduler.purchaseListing("consumer-1", listingId, SimulationTime.ofHour(30L)))
        .isInstanceOf(InsufficientFundsException.class);
    verifyNoInteractions(fixture.acquisition);
    assertThatThrownBy(
            () -> fixture.scheduler.purchaseListing("consumer-1", "LISTING_D9_00000009", START))
        .isInstanceOf(ListingNotFoundException.class);
  }

  @Test
  void listenerFailureDoesNotUndoPurchase() {
    final Fixture fixture = newFixture(successScript());
    when(fixture.acquisition.materialize(any(AcquisitionRequest.class))).thenReturn(true);
    doThrow(new IllegalStateException("boom"))
        .when(fixture.listener)
        .onAgentPurchase(anyString(), anyString(), any(SimulationTime.class));
    final String listingId = listingReady(fixture);

    final ListingSnapshot purchased =
        fixture.scheduler.purchaseListing("consumer-1", listingId, SimulationTime.ofHour(30L));

    assertThat(purchased.status()).isEqualTo(ListingStatus.PURCHASED);
    assertThat(
            fixture
                .registry
                .get("procurement.dependency.error.total")
                .tag("type", "purchase_listener")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void inspectionCompletesOnItsHourAndPausesExpiry() {
    final Fixture fixture = newFixture(successScript());
    final String listingId = listingReady(fixture);

    final ListingSnapshot pending =
        fixture.scheduler.requestInspection(
            "consumer-1", listingId, "quick", SimulationTime.ofHour(24L));

    assertThat(pending.inspectionState()).isEqualTo(InspectionState.PENDING);
    verify(fixture.ledger).charge("consumer-1", 1_037L, "inspection:" + listingId);
    assertThatThrownBy(
            () -> fixture.scheduler.purchaseListing("consumer-1", listingId, SimulationTime.ofHour(25L)))
        .isInstanceOf(InvalidSearchStateException.class);
    assertThatThrownBy(
            () ->
                fixture.scheduler.requestInspection(
                    "consumer-1", listingId, "standard", SimulationTime.ofHour(25L)))
        .isInstanceOf(InvalidSearchStateException.class);

    assertThat(fixture.scheduler.tick(SimulationTime.ofHour(25L)).inspectionsCompleted()).isEmpty();
    final TickReport report = fixture.scheduler.tick(SimulationTime.ofHour(26L));

    assertThat(report.inspectionsCompleted()).containsExactly(listingId);
    assertThat(fixture.scheduler.listingsFor("consumer-1").get(0).inspectionState())
        .isEqualTo(InspectionState.COMPLETE);
    assertThat(publishedTypes(fixture)).contains(ProcurementEventType.INSPECTION_COMPLETED);
  }

  @Test
  void unpurchasedListingExpiresAndReleasesSearch() {
    final Fixture fixture = newFixture(successScript());
    final String listingId = listingReady(fixture);

    assertThat(fixture.scheduler.tick(SimulationTime.ofHour(24L * 3)).listingsExpired()).isEmpty();
    final TickReport report = fixture.scheduler.tick(SimulationTime.ofHour(24L * 4));

    assertThat(report.listingsExpired()).containsExactly(listingId);
    assertThat(fixture.scheduler.listingsFor("consumer-1")).isEmpty();
    assertThat(fixture.scheduler.searchesFor("consumer-1")).isEmpty();
    verify(fixture.repository).deleteListing(listingId);
    verify(fixture.repository, atLeastOnce()).deleteSearch("SEARCH_00000001");
    assertThat(publishedTypes(fixture)).contains(ProcurementEventType.LISTING_EXPIRED);
  }

  @Test
  void publishFailureDoesNotRejectSubmission() {
    final Fixture fixture = newFixture(successScript());
    doThrow(new IllegalStateException("failed to publish procurement event"))
        .when(fixture.publisher)
        .publish(any(ProcurementEvent.class));

    final SearchRecordSnapshot snapshot =
        fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    assertThat(snapshot.status()).isEqualTo(SearchStatus.ACTIVE);
    assertThat(
            fixture
                .registry
                .get("procurement.dependency.error.total")
                .tag("type", "event_publish")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void restoreContinuesSequenceAndSkipsFinishedRecords() {
    final Fixture source = newFixture(successScript().then(24, 0.0d, 0.99d));
    final SearchRecordSnapshot active =
        source.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);
    final SearchRecordSnapshot cancelled =
        source.scheduler.cancel(
            "consumer-1",
            source.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START).id());

    final Fixture target = newFixture(successScript());
    target.scheduler.restore(
        new SchedulerState(List.of(active, cancelled), List.of(), new SchedulerMeta(5L, 0, 12L)));

    assertThat(target.scheduler.searchesFor("consumer-1")).containsExactly(active);
    assertThat(
            target.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START).id())
        .isEqualTo("SEARCH_00000005");
    assertThat(target.scheduler.meta().lastHour()).isEqualTo(12L);
  }

  @Test
  void restoreDropsSucceededSearchWhoseListingIsGone() {
    final Fixture source = newFixture(successScript());
    listingReady(source);
    final SearchRecordSnapshot succeeded = source.scheduler.findSearch("consumer-1", "SEARCH_00000001");
    final List<ListingSnapshot> listings = source.scheduler.listingsFor("consumer-1");

    final Fixture orphaned = newFixture(successScript());
    orphaned.scheduler.restore(
        new SchedulerState(List.of(succeeded), List.of(), new SchedulerMeta(3L, 1, 24L)));

    assertThat(orphaned.scheduler.searchesFor("consumer-1")).isEmpty();
    verify(orphaned.repository).deleteSearch("SEARCH_00000001");
    assertThat(
            orphaned
                .registry
                .get("procurement.persistence.corrupt.total")
                .tag("record", "orphan_search")
                .counter()
                .count())
        .isEqualTo(1.0d);

    final Fixture intact = newFixture(successScript());
    intact.scheduler.restore(
        new SchedulerState(List.of(succeeded), listings, new SchedulerMeta(3L, 1, 24L)));

    assertThat(intact.scheduler.searchesFor("consumer-1")).containsExactly(succeeded);
    verify(intact.repository, never()).deleteSearch(anyString());
  }

  @Test
  void replicaDecodesToCurrentSnapshot() {
    final Fixture fixture = newFixture(successScript());
    final SearchRecordSnapshot snapshot =
        fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);

    final byte[] replica = fixture.scheduler.replicaOf("consumer-1", snapshot.id());

    assertThat(new SearchWireCodec().decodeSearch(replica)).isEqualTo(snapshot);
  }

  private String listingReady(Fixture fixture) {
    fixture.scheduler.submit("consumer-1", TRACTOR, "local", "any", Map.of(), START);
    fixture.scheduler.tick(SimulationTime.ofHour(24L));
    return fixture.scheduler.listingsFor("consumer-1").get(0).id();
  }

  private void submitMix(Fixture fixture) {
    final String[] tiers = {"local", "regional", "national"};
    final String[] qualities = {"any", "poor", "fair", "good", "excellent"};
    int index = 0;
    for (String consumerId : List.of("consumer-c", "consumer-a", "consumer-b")) {
      for (int i = 0; i < 6; i++) {
        fixture.scheduler.submit(
            consumerId,
            new ItemReference("item-" + index, "Item " + index, 5_000L + index * 1_000L),
            tiers[index % tiers.length],
            qualities[index % qualities.length],
            Map.of("paint", index % 3, "engine", 1),
            START);
        index++;
      }
    }
  }

  private List<ProcurementEventType> publishedTypes(Fixture fixture) {
    final ArgumentCaptor<ProcurementEvent> captor = ArgumentCaptor.forClass(ProcurementEvent.class);
    verify(fixture.publisher, atLeastOnce()).publish(captor.capture());
    return captor.getAllValues().stream().map(ProcurementEvent::type).toList();
  }

  private static ScriptedRandom successScript() {
    // local/any: duration 24, warm-up, roll, tts 20, condition, variance
    return ScriptedRandom.of(24, 0.0d, 0.1d, 20, 0.5d, 0.5d);
  }

  private static ScriptedRandom failureScript() {
    return ScriptedRandom.of(24, 0.0d, 0.99d);
  }

  private Fixture newFixture(RandomGenerator rng) {
    final LedgerClient ledger = Mockito.mock(LedgerClient.class);
    when(ledger.charge(anyString(), anyLong(), anyString())).thenReturn(ChargeResult.OK);
    final AcquisitionClient acquisition = Mockito.mock(AcquisitionClient.class);
    final CreditScoreResolver creditScoreResolver = Mockito.mock(CreditScoreResolver.class);
    when(creditScoreResolver.feeModifier(anyString())).thenReturn(0.0d);
    final SearchStateRepository repository = Mockito.mock(SearchStateRepository.class);
    final ProcurementEventPublisher publisher = Mockito.mock(ProcurementEventPublisher.class);
    final AgentTransactionListener listener = Mockito.mock(AgentTransactionListener.class);
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final SearchScheduler scheduler =
        new SearchScheduler(
            new TierCatalog(),
            new OutcomeResolver(),
            creditScoreResolver,
            ledger,
            acquisition,
            repository,
            publisher,
            new SearchWireCodec(),
            new ProcurementMetrics(registry),
            new ProcurementProperties(null, null, null, null, true, true, null),
            rng,
            List.of(listener));
    return new Fixture(scheduler, ledger, acquisition, repository, publisher, listener, registry);
  }

  private record Fixture(
      SearchScheduler scheduler,
      LedgerClient ledger,
      AcquisitionClient acquisition,
      SearchStateRepository repository,
      ProcurementEventPublisher publisher,
      AgentTransactionListener listener,
      SimpleMeterRegistry registry) {}
}
