package com.usedmarket.procurement.service;

import java.util.List;

/** 1 回の tick で確定した結果の ID 一覧。 */
public record TickReport(
    int daysProcessed,
    List<String> listingsCreated,
    List<String> searchesFailed,
    List<String> listingsExpired,
    List<String> inspectionsCompleted) {

  public TickReport {
    listingsCreated = List.copyOf(listingsCreated);
    searchesFailed = List.copyOf(searchesFailed);
    listingsExpired = List.copyOf(listingsExpired);
    inspectionsCompleted = List.copyOf(inspectionsCompleted);
  }
}
