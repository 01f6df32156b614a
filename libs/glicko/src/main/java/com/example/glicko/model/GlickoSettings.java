/*
 * どこで: Glicko ドメインモデル
 * 何を: レーティングプールごとの調整パラメータを保持する
 * なぜ: グローバル状態を持たず、設定の異なるプールを同一プロセスで共存させるため
 */
package com.example.glicko.model;

import java.time.Duration;

/**
 * Immutable tuning of one rating pool.
 *
 * @param defaultRating public rating given to players registered without a starting rating
 * @param defaultDeviation public deviation given to players registered without a starting rating
 * @param defaultVolatility volatility given to players registered without a starting rating
 * @param tau system constant constraining volatility change, reasonable values lie in 0.3 to 1.2
 * @param convergenceTolerance bracket width at which the volatility search stops
 * @param ratingPeriod wall-clock length of one rating period
 */
public record GlickoSettings(
    double defaultRating,
    double defaultDeviation,
    double defaultVolatility,
    double tau,
    double convergenceTolerance,
    Duration ratingPeriod) {

  public static final double DEFAULT_RATING = 1500.0;
  public static final double DEFAULT_DEVIATION = 350.0;
  public static final double DEFAULT_VOLATILITY = 0.06;
  public static final double DEFAULT_TAU = 0.75;
  public static final double DEFAULT_CONVERGENCE_TOLERANCE = 0.000_001;
  public static final Duration DEFAULT_RATING_PERIOD = Duration.ofDays(1);

  public GlickoSettings {
    if (!Double.isFinite(defaultRating)) {
      throw new IllegalArgumentException("defaultRating must be finite: " + defaultRating);
    }
    if (!Double.isFinite(defaultDeviation) || defaultDeviation < 0.0) {
      throw new IllegalArgumentException(
          "defaultDeviation must be finite and >= 0: " + defaultDeviation);
    }
    requirePositive("defaultVolatility", defaultVolatility);
    requirePositive("tau", tau);
    requirePositive("convergenceTolerance", convergenceTolerance);
    if (ratingPeriod == null || ratingPeriod.isZero() || ratingPeriod.isNegative()) {
      throw new IllegalArgumentException("ratingPeriod must be positive: " + ratingPeriod);
    }
  }

  public static GlickoSettings defaults() {
    return new GlickoSettings(
        DEFAULT_RATING,
        DEFAULT_DEVIATION,
        DEFAULT_VOLATILITY,
        DEFAULT_TAU,
        DEFAULT_CONVERGENCE_TOLERANCE,
        DEFAULT_RATING_PERIOD);
  }

  /** Rating assigned to a player registered without an explicit start. */
  public PublicRating startingRating() {
    return new PublicRating(defaultRating, defaultDeviation, defaultVolatility);
  }

  public GlickoSettings withDefaultRating(double value) {
    return new GlickoSettings(
        value, defaultDeviation, defaultVolatility, tau, convergenceTolerance, ratingPeriod);
  }

  public GlickoSettings withDefaultDeviation(double value) {
    return new GlickoSettings(
        defaultRating, value, defaultVolatility, tau, convergenceTolerance, ratingPeriod);
  }

  public GlickoSettings withDefaultVolatility(double value) {
    return new GlickoSettings(
        defaultRating, defaultDeviation, value, tau, convergenceTolerance, ratingPeriod);
  }

  public GlickoSettings withTau(double value) {
    return new GlickoSettings(
        defaultRating, defaultDeviation, defaultVolatility, value, convergenceTolerance, ratingPeriod);
  }

  public GlickoSettings withConvergenceTolerance(double value) {
    return new GlickoSettings(
        defaultRating, defaultDeviation, defaultVolatility, tau, value, ratingPeriod);
  }

  public GlickoSettings withRatingPeriod(Duration value) {
    return new GlickoSettings(
        defaultRating, defaultDeviation, defaultVolatility, tau, convergenceTolerance, value);
  }

  private static void requirePositive(String name, double value) {
    if (!Double.isFinite(value) || value <= 0.0) {
      throw new IllegalArgumentException(name + " must be finite and > 0: " + value);
    }
  }
}
