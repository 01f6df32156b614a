package com.example.glicko.algorithm;

import com.example.glicko.model.GameResult;
import com.example.glicko.model.GlickoSettings;
import com.example.glicko.model.InternalRating;
import com.example.glicko.model.PublicGameResult;
import com.example.glicko.model.PublicRating;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Glicko-2 update with a fractional number of elapsed rating periods.
 *
 * <p>All methods are pure. Step numbers refer to Glickman, "Example of the Glicko-2 system".
 */
public final class Glicko2Algorithm {

  /** Iteration cap of the volatility search, applied to bracketing and to the main loop. */
  public static final int MAX_ITERATIONS = 10_000;

  private static final double PI_SQ = Math.PI * Math.PI;

  private Glicko2Algorithm() {}

  /**
   * Rates {@code current} against {@code results} after {@code elapsedPeriods} rating periods.
   *
   * @throws ConvergenceFailureException if the volatility search does not converge
   * @throws IllegalArgumentException if {@code elapsedPeriods} is negative or not finite, or the
   *     results carry no information about the player's strength
   */
  public static InternalRating update(
      InternalRating current,
      List<GameResult> results,
      double elapsedPeriods,
      GlickoSettings settings) {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(settings, "settings");
    requireElapsedPeriods(elapsedPeriods);

    // idle players only accumulate uncertainty
    if (results.isEmpty()) {
      return decay(current, elapsedPeriods);
    }

    // steps 3 and 4
    double informationSum = 0.0;
    double improvementSum = 0.0;
    for (GameResult result : results) {
      final InternalRating opponent = result.opponent();
      final double g = g(opponent.phi());
      final double e = expectedScore(g, current.mu(), opponent.mu());
      informationSum += g * g * e * (1.0 - e);
      improvementSum += g * (result.score() - e);
    }
    if (!(informationSum > 0.0)) {
      throw new IllegalArgumentException(
          "estimated variance is undefined for the given results: information=" + informationSum);
    }
    final double variance = 1.0 / informationSum;
    final double delta = variance * improvementSum;

    // step 5
    final double newSigma =
        VolatilitySolver.solve(
            delta,
            variance,
            current.phi(),
            current.sigma(),
            settings.tau(),
            settings.convergenceTolerance(),
            MAX_ITERATIONS);

    // steps 6 to 8
    final double preRatingPeriodPhi =
        preRatingPeriodValue(current.phi(), newSigma, elapsedPeriods);
    final double newPhi =
        1.0 / Math.sqrt(1.0 / (preRatingPeriodPhi * preRatingPeriodPhi) + 1.0 / variance);
    final double newMu = current.mu() + newPhi * newPhi * improvementSum;
    return new InternalRating(newMu, newPhi, newSigma);
  }

  /** Deviation growth of an idle player; rating and volatility stay as they are. */
  public static InternalRating decay(InternalRating current, double elapsedPeriods) {
    Objects.requireNonNull(current, "current");
    requireElapsedPeriods(elapsedPeriods);
    if (elapsedPeriods == 0.0) {
      return current;
    }
    return new InternalRating(
        current.mu(),
        preRatingPeriodValue(current.phi(), current.sigma(), elapsedPeriods),
        current.sigma());
  }

  /** Classic period-batched update: all {@code results} resolved over exactly one period. */
  public static InternalRating closeRatingPeriod(
      InternalRating current, List<GameResult> results, GlickoSettings settings) {
    return update(current, results, 1.0, settings);
  }

  /** {@link #update} on the public scale, for callers that manage timing themselves. */
  public static PublicRating rate(
      PublicRating current,
      List<PublicGameResult> results,
      double elapsedPeriods,
      GlickoSettings settings) {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(results, "results");
    final List<GameResult> internalResults = new ArrayList<>(results.size());
    for (PublicGameResult result : results) {
      internalResults.add(result.toInternal());
    }
    return update(current.toInternal(), internalResults, elapsedPeriods, settings).toPublic();
  }

  /** Expected score of {@code player} against {@code opponent}, in (0, 1). */
  public static double expectedScore(InternalRating player, InternalRating opponent) {
    return expectedScore(g(opponent.phi()), player.mu(), opponent.mu());
  }

  static double g(double phi) {
    return 1.0 / Math.sqrt(1.0 + 3.0 * phi * phi / PI_SQ);
  }

  private static double expectedScore(double g, double mu, double opponentMu) {
    return 1.0 / (1.0 + Math.exp(-g * (mu - opponentMu)));
  }

  private static double preRatingPeriodValue(double phi, double sigma, double elapsedPeriods) {
    return Math.sqrt(phi * phi + sigma * sigma * elapsedPeriods);
  }

  private static void requireElapsedPeriods(double elapsedPeriods) {
    if (!Double.isFinite(elapsedPeriods) || elapsedPeriods < 0.0) {
      throw new IllegalArgumentException(
          "elapsedPeriods must be finite and >= 0: " + elapsedPeriods);
    }
  }
}
