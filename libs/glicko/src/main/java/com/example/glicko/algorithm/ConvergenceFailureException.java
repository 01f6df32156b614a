/*
 * どこで: Glicko アルゴリズム
 * 何を: ボラティリティ探索が反復上限を超えたことを表現する
 * なぜ: 近似値を黙って返さず、ライブラリ不具合として呼び出し側に見せるため
 */
package com.example.glicko.algorithm;

public class ConvergenceFailureException extends IllegalStateException {

  private final int maxIterations;
  private final double convergenceTolerance;

  public ConvergenceFailureException(int maxIterations, double convergenceTolerance) {
    super(
        "volatility search exceeded "
            + maxIterations
            + " iterations (convergenceTolerance="
            + convergenceTolerance
            + ")");
    this.maxIterations = maxIterations;
    this.convergenceTolerance = convergenceTolerance;
  }

  public int maxIterations() {
    return maxIterations;
  }

  public double convergenceTolerance() {
    return convergenceTolerance;
  }
}
