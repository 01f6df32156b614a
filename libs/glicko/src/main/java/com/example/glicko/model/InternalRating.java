/*
 * どこで: Glicko ドメインモデル
 * 何を: Glicko-2 内部スケール (0 中心) のレーティングを表現する
 * なぜ: 計算はすべて内部スケールで行い、スケール定数を数式に持ち込まないため
 */
package com.example.glicko.model;

import com.example.glicko.scale.RatingScale;

/**
 * Rating on the internal Glicko-2 scale.
 *
 * @param mu rating, centered at 0
 * @param phi deviation, never negative
 * @param sigma volatility, strictly positive
 */
public record InternalRating(double mu, double phi, double sigma) {

  public InternalRating {
    if (!Double.isFinite(mu)) {
      throw new IllegalArgumentException("mu must be finite: " + mu);
    }
    if (!Double.isFinite(phi) || phi < 0.0) {
      throw new IllegalArgumentException("phi must be finite and >= 0: " + phi);
    }
    if (!Double.isFinite(sigma) || sigma <= 0.0) {
      throw new IllegalArgumentException("sigma must be finite and > 0: " + sigma);
    }
  }

  public PublicRating toPublic() {
    return RatingScale.toPublic(this);
  }
}
