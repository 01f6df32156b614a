package com.example.glicko.model;

import java.util.Objects;

/** {@link GameResult} with the opponent on the public scale. */
public record PublicGameResult(PublicRating opponent, double score) {

  public PublicGameResult {
    Objects.requireNonNull(opponent, "opponent");
    if (!(score >= 0.0 && score <= 1.0)) {
      throw new IllegalArgumentException("score must be within [0, 1]: " + score);
    }
  }

  public GameResult toInternal() {
    return new GameResult(opponent.toInternal(), score);
  }
}
