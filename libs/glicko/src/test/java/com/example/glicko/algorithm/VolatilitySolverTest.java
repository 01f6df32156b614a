package com.example.glicko.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class VolatilitySolverTest {

  // 論文の中間値 (Step 3, Step 4)
  private static final double PAPER_DELTA = -0.4834;
  private static final double PAPER_VARIANCE = 1.7785;
  private static final double PAPER_PHI = 1.1513;

  @Test
  void solveReproducesPaperVolatility() {
    final double sigma =
        VolatilitySolver.solve(
            PAPER_DELTA, PAPER_VARIANCE, PAPER_PHI, 0.06, 0.5, 0.000_001, 10_000);

    assertThat(sigma).isCloseTo(0.05999, within(0.0001));
  }

  @Test
  void solveRaisesVolatilityAfterSurprisingResults() {
    final double sigma = VolatilitySolver.solve(3.0, 1.0, 0.5, 0.06, 0.5, 0.000_001, 10_000);

    assertThat(sigma).isGreaterThan(0.06);
  }

  @Test
  void solveThrowsWhenIterationCapIsExceeded() {
    assertThatThrownBy(
            () ->
                VolatilitySolver.solve(
                    PAPER_DELTA, PAPER_VARIANCE, PAPER_PHI, 0.06, 0.5, 0.000_001, 1))
        .hasMessageContaining("1 iterations")
        .isInstanceOfSatisfying(
            ConvergenceFailureException.class,
            failure -> {
              assertThat(failure.maxIterations()).isEqualTo(1);
              assertThat(failure.convergenceTolerance()).isEqualTo(0.000_001);
            });
  }

  @Test
  void solveWidensBracketBelowOriginWhenImprovementIsSmall() {
    // delta^2 <= phi^2 + v かつ tau が大きいと k = 1 では f(a - k*tau) < 0 のまま
    final double sigma = VolatilitySolver.solve(0.0, 0.01, 0.1, 1000.0, 10.0, 0.000_001, 10_000);

    assertThat(sigma).isPositive().isLessThan(1000.0);
  }

  @Test
  void solveThrowsWhenBracketSearchCapIsExceeded() {
    assertThatThrownBy(() -> VolatilitySolver.solve(0.0, 0.01, 0.1, 1000.0, 10.0, 0.000_001, 1))
        .isInstanceOfSatisfying(
            ConvergenceFailureException.class,
            failure -> assertThat(failure.maxIterations()).isEqualTo(1));
  }

  @Test
  void gShrinksWithOpponentDeviation() {
    assertThat(Glicko2Algorithm.g(0.0)).isEqualTo(1.0);
    assertThat(Glicko2Algorithm.g(1.7269)).isCloseTo(0.7242, within(0.0001));
  }
}
