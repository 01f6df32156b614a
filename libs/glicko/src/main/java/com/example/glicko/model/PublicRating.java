/*
 * どこで: Glicko ドメインモデル
 * 何を: 公開スケール (1500 中心) のレーティングを表現する
 * なぜ: 利用者に見せる値と内部計算用の値を型で区別するため
 */
package com.example.glicko.model;

import com.example.glicko.scale.RatingScale;

/**
 * Rating on the public scale.
 *
 * @param rating skill estimate, centered near 1500
 * @param deviation uncertainty of the estimate, never negative
 * @param volatility expected fluctuation of the true skill, strictly positive
 */
public record PublicRating(double rating, double deviation, double volatility) {

  public PublicRating {
    if (!Double.isFinite(rating)) {
      throw new IllegalArgumentException("rating must be finite: " + rating);
    }
    if (!Double.isFinite(deviation) || deviation < 0.0) {
      throw new IllegalArgumentException("deviation must be finite and >= 0: " + deviation);
    }
    if (!Double.isFinite(volatility) || volatility <= 0.0) {
      throw new IllegalArgumentException("volatility must be finite and > 0: " + volatility);
    }
  }

  public InternalRating toInternal() {
    return RatingScale.toInternal(this);
  }
}
