package com.example.rating.service;

import com.example.glicko.algorithm.ConvergenceFailureException;
import com.example.glicko.engine.RatingEngine;
import com.example.glicko.engine.UnknownPlayerException;
import com.example.glicko.model.MatchOutcome;
import com.example.glicko.model.PlayerHandle;
import com.example.glicko.model.PublicRating;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RatingService {

  private static final Logger logger = LoggerFactory.getLogger(RatingService.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RatingEngine は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RatingEngine engine;

  private final RatingMetrics metrics;

  public RatingService(RatingEngine engine, RatingMetrics metrics) {
    this.engine = engine;
    this.metrics = metrics;
  }

  /**
   * 役割: プレイヤーを登録してハンドルを払い出す。
   * 動作: starting が null の場合は設定の既定レーティングで登録する。
   * 前提: なし。
   */
  public PlayerHandle register(PublicRating starting) {
    final PlayerHandle handle =
        starting == null ? engine.registerPlayer() : engine.registerPlayer(starting);
    metrics.recordRegistration();
    logger.info("player registered handle={}", handle);
    return handle;
  }

  public void recordResult(PlayerHandle first, PlayerHandle second, String outcome) {
    final MatchOutcome matchOutcome = validateResultRequest(first, second, outcome);
    final long startedAt = System.nanoTime();
    try {
      engine.registerResult(first, second, matchOutcome);
    } catch (UnknownPlayerException ex) {
      metrics.recordError("unknown_player");
      logger.info("result rejected for unknown player handle={}", ex.handle());
      throw ex;
    } catch (ConvergenceFailureException ex) {
      metrics.recordError("convergence_failure");
      logger.warn(
          "volatility search did not converge first={} second={} outcome={}",
          first,
          second,
          matchOutcome.value(),
          ex);
      throw ex;
    } catch (IllegalArgumentException ex) {
      metrics.recordError("invalid_result");
      logger.warn(
          "result carries no usable information first={} second={} outcome={}",
          first,
          second,
          matchOutcome.value(),
          ex);
      throw ex;
    }
    metrics.recordUpdateDuration(Duration.ofNanos(System.nanoTime() - startedAt));
    metrics.recordResult(matchOutcome.value());
  }

  public PublicRating currentRating(PlayerHandle handle) {
    if (handle == null) {
      throw new InvalidRatingRequestException("handle is required");
    }
    try {
      return engine.playerRating(handle);
    } catch (UnknownPlayerException ex) {
      metrics.recordError("unknown_player");
      logger.info("rating query for unknown player handle={}", ex.handle());
      throw ex;
    }
  }

  private MatchOutcome validateResultRequest(
      PlayerHandle first, PlayerHandle second, String outcome) {
    if (first == null || second == null) {
      throw new InvalidRatingRequestException("both player handles are required");
    }
    if (first.equals(second)) {
      throw new InvalidRatingRequestException("players must differ: " + first);
    }
    if (outcome == null || outcome.isBlank()) {
      throw new InvalidRatingRequestException("outcome is required");
    }
    try {
      return MatchOutcome.fromValue(outcome.trim());
    } catch (IllegalArgumentException ex) {
      throw new InvalidRatingRequestException(ex.getMessage());
    }
  }
}
