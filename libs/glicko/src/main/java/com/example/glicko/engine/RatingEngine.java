package com.example.glicko.engine;

import com.example.glicko.algorithm.Glicko2Algorithm;
import com.example.glicko.engine.CompetitorRecord.CompetitorState;
import com.example.glicko.model.GameResult;
import com.example.glicko.model.GlickoSettings;
import com.example.glicko.model.InternalRating;
import com.example.glicko.model.MatchOutcome;
import com.example.glicko.model.PlayerHandle;
import com.example.glicko.model.PublicRating;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Glicko-2 rating pool with continuous time.
 *
 * <p>Every recorded result is rated as its own minimal rating period: each side is updated
 * against the opponent's rating decayed to the moment of the match, with the fractional number of
 * periods elapsed since its own last update. Queries apply idle decay without storing it.
 *
 * <p>Thread-safe. Calls touching the same competitor are serialized by a per-competitor lock.
 */
public class RatingEngine {

  private static final Logger logger = LoggerFactory.getLogger(RatingEngine.class);

  private final GlickoSettings settings;
  private final Clock clock;
  private final ConcurrentMap<PlayerHandle, CompetitorRecord> competitors =
      new ConcurrentHashMap<>();
  private final AtomicLong nextHandle = new AtomicLong();

  public RatingEngine(GlickoSettings settings) {
    this(settings, Clock.systemUTC());
  }

  public RatingEngine(GlickoSettings settings, Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public GlickoSettings settings() {
    return settings;
  }

  public PlayerHandle registerPlayer() {
    return registerPlayer(settings.startingRating());
  }

  public PlayerHandle registerPlayer(PublicRating starting) {
    return registerPlayerAt(starting, clock.instant());
  }

  public PlayerHandle registerPlayerAt(PublicRating starting, Instant at) {
    Objects.requireNonNull(starting, "starting");
    Objects.requireNonNull(at, "at");
    final PlayerHandle handle = new PlayerHandle(nextHandle.getAndIncrement());
    competitors.put(handle, new CompetitorRecord(starting.toInternal(), at));
    logger.debug("player registered handle={} rating={} at={}", handle, starting, at);
    return handle;
  }

  /**
   * Current rating of {@code handle}, including deviation growth up to now.
   *
   * @throws UnknownPlayerException if the handle was never registered
   */
  public PublicRating playerRating(PlayerHandle handle) {
    return playerRatingAt(handle, clock.instant());
  }

  public PublicRating playerRatingAt(PlayerHandle handle, Instant at) {
    Objects.requireNonNull(at, "at");
    return decayedRating(requireRecord(handle).state(), at).toPublic();
  }

  /** Rating as committed by the last recorded result, without idle decay. */
  public PublicRating lastCommittedRating(PlayerHandle handle) {
    return requireRecord(handle).state().rating().toPublic();
  }

  public double elapsedPeriods(PlayerHandle handle) {
    return elapsedPeriodsAt(handle, clock.instant());
  }

  public double elapsedPeriodsAt(PlayerHandle handle, Instant at) {
    Objects.requireNonNull(at, "at");
    return elapsedPeriods(requireRecord(handle).state().lastUpdatedAt(), at);
  }

  /**
   * Records a game between {@code first} and {@code second}.
   *
   * @param outcome result from {@code first}'s point of view
   * @throws UnknownPlayerException if either handle was never registered
   * @throws com.example.glicko.algorithm.ConvergenceFailureException if either update does not
   *     converge; neither competitor is changed in that case
   */
  public void registerResult(PlayerHandle first, PlayerHandle second, MatchOutcome outcome) {
    registerResultAt(first, second, outcome, clock.instant());
  }

  public void registerResultAt(
      PlayerHandle first, PlayerHandle second, MatchOutcome outcome, Instant at) {
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(at, "at");
    final CompetitorRecord firstRecord = requireRecord(first);
    final CompetitorRecord secondRecord = requireRecord(second);
    if (first.equals(second)) {
      throw new IllegalArgumentException("player cannot play against itself: " + first);
    }

    // ascending handle order keeps concurrent calls on overlapping pairs deadlock free
    final boolean firstIsLower = first.value() < second.value();
    final ReentrantLock lowerLock = (firstIsLower ? firstRecord : secondRecord).lock();
    final ReentrantLock upperLock = (firstIsLower ? secondRecord : firstRecord).lock();
    lowerLock.lock();
    try {
      upperLock.lock();
      try {
        final CompetitorState firstState = firstRecord.state();
        final CompetitorState secondState = secondRecord.state();
        final InternalRating firstUpdated =
            rateAgainst(firstState, decayedRating(secondState, at), outcome.score(), at);
        final InternalRating secondUpdated =
            rateAgainst(secondState, decayedRating(firstState, at), outcome.opponentScore(), at);
        firstRecord.commit(firstUpdated, at);
        secondRecord.commit(secondUpdated, at);
        logger.debug(
            "result recorded first={} second={} outcome={} at={}",
            first,
            second,
            outcome.value(),
            at);
      } finally {
        upperLock.unlock();
      }
    } finally {
      lowerLock.unlock();
    }
  }

  /** Registered handles in registration order. */
  public List<PlayerHandle> playerHandles() {
    return competitors.keySet().stream()
        .sorted(Comparator.comparingLong(PlayerHandle::value))
        .toList();
  }

  public int playerCount() {
    return competitors.size();
  }

  private InternalRating rateAgainst(
      CompetitorState player, InternalRating opponent, double score, Instant at) {
    return Glicko2Algorithm.update(
        player.rating(),
        List.of(new GameResult(opponent, score)),
        elapsedPeriods(player.lastUpdatedAt(), at),
        settings);
  }

  private InternalRating decayedRating(CompetitorState state, Instant at) {
    return Glicko2Algorithm.decay(state.rating(), elapsedPeriods(state.lastUpdatedAt(), at));
  }

  private double elapsedPeriods(Instant lastUpdatedAt, Instant at) {
    if (!at.isAfter(lastUpdatedAt)) {
      return 0.0;
    }
    return toSeconds(Duration.between(lastUpdatedAt, at)) / toSeconds(settings.ratingPeriod());
  }

  private CompetitorRecord requireRecord(PlayerHandle handle) {
    Objects.requireNonNull(handle, "handle");
    final CompetitorRecord record = competitors.get(handle);
    if (record == null) {
      throw new UnknownPlayerException(handle);
    }
    return record;
  }

  private static double toSeconds(Duration duration) {
    return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
  }
}
