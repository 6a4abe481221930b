/*
 * どこで: Procurement 設定
 * 何を: イベント subject・レプリケーション subject と JetStream stream 設定を保持する
 * なぜ: 起動時に stream を作成し、publish 先を設定で切り替えるため
 */
package com.usedmarket.procurement.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "procurement.nats")
public record ProcurementNatsProperties(
    @NotBlank String subject,
    @NotBlank String replicationSubject,
    @NotBlank String stream,
    @NotNull Duration duplicateWindow) {}
