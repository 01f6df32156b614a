/*
 * どこで: Rating 設定
 * 何を: レーティングプールの Glicko-2 パラメータを保持する
 * なぜ: tau や rating period を環境ごとに切り替え、起動時に不正値を検出するため
 */
package com.example.rating.config;

import com.example.glicko.model.GlickoSettings;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "rating")
@Validated
public record RatingProperties(
    @NotNull Double defaultRating,
    @NotNull @PositiveOrZero Double defaultDeviation,
    @NotNull @Positive Double defaultVolatility,
    @NotNull @Positive Double tau,
    @NotNull @Positive Double convergenceTolerance,
    @NotNull Duration ratingPeriod) {

  @AssertTrue(message = "rating.rating-period must be positive")
  public boolean isRatingPeriodPositive() {
    return ratingPeriod != null && !ratingPeriod.isZero() && !ratingPeriod.isNegative();
  }

  /**
   * 役割: バインド済みの設定をエンジン用の不変設定へ変換する。
   * 動作: GlickoSettings のコンストラクタ検証をそのまま適用する。
   * 前提: Bean Validation を通過していること。
   */
  public GlickoSettings toSettings() {
    return new GlickoSettings(
        defaultRating, defaultDeviation, defaultVolatility, tau, convergenceTolerance, ratingPeriod);
  }
}
