/*
 * どこで: Glicko ドメインモデル
 * 何を: 2 者間の試合結果を先手側の視点で定義する
 * なぜ: エンジン境界で結果を列挙型に固定し、スコアへの変換を 1 箇所にまとめるため
 */
package com.example.glicko.model;

public enum MatchOutcome {
  WIN("win", 1.0),
  LOSS("loss", 0.0),
  DRAW("draw", 0.5);

  private final String value;
  private final double score;

  MatchOutcome(String value, double score) {
    this.value = value;
    this.score = score;
  }

  public String value() {
    return value;
  }

  public double score() {
    return score;
  }

  public double opponentScore() {
    return invert().score;
  }

  public MatchOutcome invert() {
    switch (this) {
      case WIN:
        return LOSS;
      case LOSS:
        return WIN;
      default:
        return DRAW;
    }
  }

  /**
   * 役割: 外部から受け取った結果文字列を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: outcome は null でないことを呼び出し側で保証する。
   */
  public static MatchOutcome fromValue(String outcome) {
    for (MatchOutcome matchOutcome : values()) {
      if (matchOutcome.value.equalsIgnoreCase(outcome)) {
        return matchOutcome;
      }
    }
    throw new IllegalArgumentException("unsupported outcome: " + outcome);
  }
}
