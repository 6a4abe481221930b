package com.usedmarket.procurement.repository;

import com.usedmarket.procurement.model.ListingSnapshot;
import com.usedmarket.procurement.model.SearchRecordSnapshot;
import java.util.List;

public record SchedulerState(
    List<SearchRecordSnapshot> searches, List<ListingSnapshot> listings, SchedulerMeta meta) {

  public SchedulerState {
    searches = List.copyOf(searches);
    listings = List.copyOf(listings);
  }
}
