package com.usedmarket.procurement.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.usedmarket.procurement.model.FoundItem;
import com.usedmarket.procurement.model.InspectionState;
import com.usedmarket.procurement.model.ItemReference;
import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.ListingStatus;
import com.usedmarket.procurement.model.SearchRecordSnapshot;
import com.usedmarket.procurement.model.SearchStatus;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class SearchAttributesCodecTest {

  private final SearchAttributesCodec codec = new SearchAttributesCodec(new ObjectMapper());

  @Test
  void encodesActiveSearchWithPendingFind() {
    final FoundItem pending =
        new FoundItem(0.25d, 1875L, new TreeMap<>(Map.of("seats", 2)), new TreeSet<>());
    final SearchRecordSnapshot snapshot =
        new SearchRecordSnapshot(
            "SEARCH_00000001",
            "consumer-1",
            new ItemReference("cat.truck", "Truck", 2000L),
            "standard",
            "any",
            new TreeMap<>(Map.of("seats", 2)),
            0.05d,
            420L,
            24,
            20,
            true,
            pending,
            SearchStatus.ACTIVE,
            null,
            3L);

    final Map<String, String> fields = codec.encodeSearch(snapshot);

    assertThat(fields)
        .containsEntry("id", "SEARCH_00000001")
        .containsEntry("status", "active")
        .containsEntry("pending_price", "1875")
        .containsEntry("pending_matched_configurations", "{\"seats\":2}")
        .containsEntry("success_outcome", "true")
        .doesNotContainKey("found_price");
    assertThat(codec.decodeSearch("um:search:SEARCH_00000001", new HashMap<>(fields)))
        .isEqualTo(snapshot);
  }

  @Test
  void decodeFillsDefaultsForOlderRecords() {
    final Map<Object, Object> raw = new HashMap<>();
    raw.put("id", "SEARCH_00000002");
    raw.put("consumer_id", "consumer-1");
    raw.put("catalog_key", "cat.truck");
    raw.put("base_price", "2000");
    raw.put("tier_id", "standard");
    raw.put("cost", "400");
    raw.put("ttl", "24");
    raw.put("tts", "10");
    raw.put("pending_price", "1500");

    final SearchRecordSnapshot snapshot = codec.decodeSearch("um:search:SEARCH_00000002", raw);

    assertThat(snapshot.qualityId()).isEqualTo("any");
    assertThat(snapshot.status()).isEqualTo(SearchStatus.ACTIVE);
    assertThat(snapshot.creditModifier()).isZero();
    assertThat(snapshot.successOutcome()).isTrue();
    assertThat(snapshot.pendingFind().price()).isEqualTo(1500L);
    assertThat(snapshot.requestedConfigurations()).isEmpty();
    assertThat(snapshot.foundItem()).isNull();
  }

  @Test
  void decodeRejectsMissingOrBrokenFields() {
    final Map<Object, Object> missingTtl = new HashMap<>();
    missingTtl.put("id", "SEARCH_00000003");
    missingTtl.put("consumer_id", "consumer-1");
    missingTtl.put("catalog_key", "cat.truck");
    missingTtl.put("base_price", "2000");
    missingTtl.put("tier_id", "standard");
    missingTtl.put("cost", "400");
    missingTtl.put("tts", "10");

    assertThatThrownBy(() -> codec.decodeSearch("um:search:SEARCH_00000003", missingTtl))
        .isInstanceOf(CorruptRecordException.class)
        .hasMessageContaining("ttl");

    final Map<Object, Object> badStatus = new HashMap<>(missingTtl);
    badStatus.put("ttl", "24");
    badStatus.put("status", "archived");
    assertThatThrownBy(() -> codec.decodeSearch("um:search:SEARCH_00000003", badStatus))
        .isInstanceOf(CorruptRecordException.class)
        .hasMessageContaining("key=um:search:SEARCH_00000003");

    final Map<Object, Object> badJson = new HashMap<>(missingTtl);
    badJson.put("ttl", "24");
    badJson.put("requested_configurations", "{not json");
    assertThatThrownBy(() -> codec.decodeSearch("um:search:SEARCH_00000003", badJson))
        .isInstanceOf(CorruptRecordException.class);
  }

  @Test
  void encodesListingWithoutInspectionTier() {
    final ListingSnapshot listing =
        new ListingSnapshot(
            "LISTING_D1_00000001",
            "SEARCH_00000001",
            "consumer-1",
            "standard",
            "cat.truck",
            "Truck",
            new FoundItem(0.5d, 1800L, new TreeMap<>(), new TreeSet<>(List.of("paint"))),
            72,
            ListingStatus.AVAILABLE,
            InspectionState.NONE,
            null,
            0L,
            1);

    final Map<String, String> fields = codec.encodeListing(listing);

    assertThat(fields)
        .containsEntry("price", "1800")
        .containsEntry("randomized_configurations", "[\"paint\"]")
        .doesNotContainKey("inspection_tier_id");
    assertThat(codec.decodeListing("um:listing:LISTING_D1_00000001", new HashMap<>(fields)))
        .isEqualTo(listing);
  }

  @Test
  void listingWithoutItemIsCorrupt() {
    final Map<Object, Object> raw = new HashMap<>();
    raw.put("id", "LISTING_D1_00000001");
    raw.put("search_id", "SEARCH_00000001");
    raw.put("consumer_id", "consumer-1");
    raw.put("tier_id", "standard");
    raw.put("catalog_key", "cat.truck");

    assertThatThrownBy(() -> codec.decodeListing("um:listing:LISTING_D1_00000001", raw))
        .isInstanceOf(CorruptRecordException.class)
        .hasMessageContaining("no item");
  }
}
