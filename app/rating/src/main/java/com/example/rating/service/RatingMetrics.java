/*
 * どこで: Rating サービス層
 * 何を: 登録数/試合結果/エラー/更新時間のメトリクスを記録する
 * なぜ: エンジンの利用状況と収束失敗を Prometheus から観測できるようにするため
 */
package com.example.rating.service;

import com.example.glicko.engine.RatingEngine;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class RatingMetrics {

  private static final String METRIC_PLAYER_REGISTERED = "rating.player.registered.total";
  private static final String METRIC_PLAYER_COUNT = "rating.player.count";
  private static final String METRIC_RESULT_TOTAL = "rating.result.total";
  private static final String METRIC_ERROR_TOTAL = "rating.error.total";
  private static final String METRIC_UPDATE_DURATION = "rating.update.duration";

  private final MeterRegistry meterRegistry;
  private final Counter registeredCounter;
  private final Timer updateTimer;
  private final ConcurrentMap<String, Counter> resultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

  public RatingMetrics(MeterRegistry meterRegistry, RatingEngine engine) {
    this.meterRegistry = meterRegistry;
    this.registeredCounter =
        Counter.builder(METRIC_PLAYER_REGISTERED)
            .description("Total number of registered players")
            .register(meterRegistry);
    this.updateTimer =
        Timer.builder(METRIC_UPDATE_DURATION)
            .description("Time spent rating both sides of one result")
            .register(meterRegistry);
    Gauge.builder(METRIC_PLAYER_COUNT, engine, RatingEngine::playerCount)
        .description("Players currently held by the rating engine")
        .register(meterRegistry);
  }

  public void recordRegistration() {
    registeredCounter.increment();
  }

  public void recordResult(String outcome) {
    resultCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_RESULT_TOTAL)
                    .description("Recorded match results by outcome")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordUpdateDuration(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    updateTimer.record(duration);
  }

  public void recordError(String errorType) {
    errorCounters
        .computeIfAbsent(
            errorType,
            ignored ->
                Counter.builder(METRIC_ERROR_TOTAL)
                    .description("Rejected or failed rating operations")
                    .tags(Tags.of("type", errorType))
                    .register(meterRegistry))
        .increment();
  }
}
