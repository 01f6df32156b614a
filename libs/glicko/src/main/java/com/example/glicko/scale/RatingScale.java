/*
 * どこで: Glicko スケール変換
 * 何を: 公開スケールと Glicko-2 内部スケールの相互変換を行う
 * なぜ: 変換を明示的な関数に限定し、暗黙の型変換を起こさないため
 */
package com.example.glicko.scale;

import com.example.glicko.model.InternalRating;
import com.example.glicko.model.PublicRating;

public final class RatingScale {

  /** Ratio between the public and the internal scale (Glickman, steps 2 and 8). */
  public static final double SCALING_FACTOR = 173.7178;

  /** Public rating that maps to internal rating 0. */
  public static final double ORIGIN = 1500.0;

  private RatingScale() {}

  public static InternalRating toInternal(PublicRating rating) {
    return new InternalRating(
        (rating.rating() - ORIGIN) / SCALING_FACTOR,
        rating.deviation() / SCALING_FACTOR,
        rating.volatility());
  }

  public static PublicRating toPublic(InternalRating rating) {
    return new PublicRating(
        rating.mu() * SCALING_FACTOR + ORIGIN, rating.phi() * SCALING_FACTOR, rating.sigma());
  }
}
