package com.usedmarket.procurement.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "送信専用 DTO record であり、呼び出し側で不変コレクションを渡すため")
public record AcquisitionRequest(
    String catalogKey,
    String consumerId,
    Double condition,
    Map<String, Integer> configurations,
    List<String> randomizedConfigurations) {}
