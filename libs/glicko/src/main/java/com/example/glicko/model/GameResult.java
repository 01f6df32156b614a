/*
 * どこで: Glicko ドメインモデル
 * 何を: 1 試合分の対戦相手レーティングとスコアを表現する
 * なぜ: アルゴリズム呼び出し 1 回分の入力を内部スケールで固定するため
 */
package com.example.glicko.model;

import java.util.Objects;

/**
 * One game as seen by the rated player.
 *
 * @param opponent opponent rating on the internal scale
 * @param score player's score: 1.0 win, 0.5 draw, 0.0 loss
 */
public record GameResult(InternalRating opponent, double score) {

  public GameResult {
    Objects.requireNonNull(opponent, "opponent");
    if (!(score >= 0.0 && score <= 1.0)) {
      throw new IllegalArgumentException("score must be within [0, 1]: " + score);
    }
  }

  public static GameResult of(InternalRating opponent, MatchOutcome outcome) {
    return new GameResult(opponent, outcome.score());
  }
}
