package com.example.glicko.algorithm;

import java.util.function.DoubleUnaryOperator;

/**
 * Step 5 of Glickman's Glicko-2 procedure: finds the new volatility with the Illinois variant of
 * regula falsi over {@code x = ln(sigma^2)}.
 */
final class VolatilitySolver {

  private VolatilitySolver() {}

  /**
   * 役割: 新しいボラティリティ sigma' を求める。
   * 動作: ln(sigma^2) を起点に符号変化する区間 [A, B] を確定し、区間幅が許容誤差以下になるまで縮める。
   * 前提: 区間探索と反復はそれぞれ maxIterations 回を上限とし、超過時は ConvergenceFailureException を送出する。
   */
  static double solve(
      double delta,
      double variance,
      double phi,
      double sigma,
      double tau,
      double tolerance,
      int maxIterations) {
    final double deltaSq = delta * delta;
    final double phiSq = phi * phi;
    final double tauSq = tau * tau;
    final double origin = Math.log(sigma * sigma);

    final DoubleUnaryOperator f =
        x -> {
          final double ex = Math.exp(x);
          final double denominator = phiSq + variance + ex;
          return ex * (deltaSq - phiSq - variance - ex) / (2.0 * denominator * denominator)
              - (x - origin) / tauSq;
        };

    double a = origin;
    double b;
    if (deltaSq > phiSq + variance) {
      b = Math.log(deltaSq - phiSq - variance);
    } else {
      int k = 1;
      while (f.applyAsDouble(origin - k * tau) < 0.0) {
        if (k >= maxIterations) {
          throw new ConvergenceFailureException(maxIterations, tolerance);
        }
        k++;
      }
      b = origin - k * tau;
    }

    double fa = f.applyAsDouble(a);
    double fb = f.applyAsDouble(b);
    int iteration = 0;
    while (Math.abs(b - a) > tolerance) {
      if (iteration >= maxIterations) {
        throw new ConvergenceFailureException(maxIterations, tolerance);
      }
      final double c = a + (a - b) * fa / (fb - fa);
      final double fc = f.applyAsDouble(c);
      if (fc * fb <= 0.0) {
        a = b;
        fa = fb;
      } else {
        fa = fa / 2.0;
      }
      b = c;
      fb = fc;
      iteration++;
    }
    return Math.exp(a / 2.0);
  }
}
