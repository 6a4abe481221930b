/*
 * どこで: Procurement API
 * 何を: 検索の依頼/一覧/参照/キャンセル/更新/レプリカ取得エンドポイントを公開する
 * なぜ: ホストからの検索依頼を受け付ける入口を提供するため
 */
package com.usedmarket.procurement.api;

import com.usedmarket.procurement.api.request.SubmitSearchRequest;
import com.usedmarket.procurement.api.response.SearchResponse;
import com.usedmarket.procurement.config.RequestMdcInterceptor;
import com.usedmarket.procurement.model.ItemReference;
import com.usedmarket.procurement.service.SearchScheduler;
import com.usedmarket.procurement.service.SimulationService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/searches")
@RequiredArgsConstructor
public class SearchController {

  private static final String DEFAULT_QUALITY = "any";

  private final SearchScheduler scheduler;
  private final SimulationService simulationService;

  @PostMapping
  public ResponseEntity<SearchResponse> submit(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId,
      @Valid @RequestBody SubmitSearchRequest request) {
    final ItemReference item =
        new ItemReference(request.catalogKey(), request.displayName(), request.basePrice());
    final String qualityId =
        request.qualityId() == null || request.qualityId().isBlank()
            ? DEFAULT_QUALITY
            : request.qualityId();
    final Map<String, Integer> configurations =
        request.configurations() == null ? Map.of() : request.configurations();
    return ResponseEntity.ok(
        SearchResponse.from(
            scheduler.submit(
                consumerId,
                item,
                request.tierId(),
                qualityId,
                configurations,
                simulationService.now())));
  }

  @GetMapping
  public ResponseEntity<List<SearchResponse>> list(
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        scheduler.searchesFor(consumerId).stream().map(SearchResponse::from).toList());
  }

  @GetMapping("/{searchId}")
  public ResponseEntity<SearchResponse> get(
      @PathVariable("searchId") String searchId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(SearchResponse.from(scheduler.findSearch(consumerId, searchId)));
  }

  @DeleteMapping("/{searchId}")
  public ResponseEntity<SearchResponse> cancel(
      @PathVariable("searchId") String searchId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(SearchResponse.from(scheduler.cancel(consumerId, searchId)));
  }

  @PostMapping("/{searchId}/renew")
  public ResponseEntity<SearchResponse> renew(
      @PathVariable("searchId") String searchId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok(
        SearchResponse.from(scheduler.renewSearch(consumerId, searchId, simulationService.now())));
  }

  @GetMapping(value = "/{searchId}/replica", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
  public ResponseEntity<byte[]> replica(
      @PathVariable("searchId") String searchId,
      @RequestHeader(RequestMdcInterceptor.HEADER_CONSUMER_ID) String consumerId) {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .body(scheduler.replicaOf(consumerId, searchId));
  }
}
