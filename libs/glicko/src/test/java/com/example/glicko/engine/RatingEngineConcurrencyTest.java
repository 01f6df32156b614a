package com.example.glicko.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.glicko.model.GlickoSettings;
import com.example.glicko.model.MatchOutcome;
import com.example.glicko.model.PlayerHandle;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RatingEngineConcurrencyTest {

  private static final int THREADS = 4;
  private static final int GAMES_PER_THREAD = 10;

  private final Clock clock = Clock.fixed(Instant.parse("2026-02-24T12:00:00Z"), ZoneOffset.UTC);

  @Test
  void concurrentResultsOnSamePairLoseNoUpdates() throws Exception {
    final RatingEngine sequential = new RatingEngine(GlickoSettings.defaults(), clock);
    final PlayerHandle seqWinner = sequential.registerPlayer();
    final PlayerHandle seqLoser = sequential.registerPlayer();
    for (int i = 0; i < THREADS * GAMES_PER_THREAD; i++) {
      sequential.registerResult(seqWinner, seqLoser, MatchOutcome.WIN);
    }

    final RatingEngine concurrent = new RatingEngine(GlickoSettings.defaults(), clock);
    final PlayerHandle winner = concurrent.registerPlayer();
    final PlayerHandle loser = concurrent.registerPlayer();
    runConcurrently(
        i ->
            i % 2 == 0
                ? () -> concurrent.registerResult(winner, loser, MatchOutcome.WIN)
                : () -> concurrent.registerResult(loser, winner, MatchOutcome.LOSS));

    // 同一入力の繰り返しなので直列化されていれば順序に関係なく同じ値になる
    assertThat(concurrent.playerRating(winner)).isEqualTo(sequential.playerRating(seqWinner));
    assertThat(concurrent.playerRating(loser)).isEqualTo(sequential.playerRating(seqLoser));
  }

  @Test
  void concurrentResultsOnOverlappingPairsMatchSequentialReplay() throws Exception {
    final RatingEngine engine = new RatingEngine(GlickoSettings.defaults(), clock);
    final List<PlayerHandle> players = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      players.add(engine.registerPlayer());
    }

    // 3 人の組はどの 2 組も誰かを共有するため、ロック内で出るログ順がそのまま確定順になる
    final Logger engineLogger = (Logger) LoggerFactory.getLogger(RatingEngine.class);
    final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    engineLogger.addAppender(appender);
    try {
      runConcurrently(
          i -> {
            final PlayerHandle first = players.get(i % 3);
            final PlayerHandle second = players.get((i + 1) % 3);
            final MatchOutcome outcome = i % 2 == 0 ? MatchOutcome.WIN : MatchOutcome.LOSS;
            return () -> engine.registerResult(first, second, outcome);
          });
    } finally {
      engineLogger.detachAppender(appender);
      appender.stop();
    }

    final List<Object[]> applied =
        appender.list.stream()
            .filter(event -> event.getMessage().startsWith("result recorded"))
            .map(ILoggingEvent::getArgumentArray)
            .toList();
    assertThat(applied).hasSize(THREADS * GAMES_PER_THREAD);

    final RatingEngine replay = new RatingEngine(GlickoSettings.defaults(), clock);
    for (int i = 0; i < players.size(); i++) {
      replay.registerPlayer();
    }
    for (Object[] arguments : applied) {
      replay.registerResult(
          (PlayerHandle) arguments[0],
          (PlayerHandle) arguments[1],
          MatchOutcome.fromValue((String) arguments[2]));
    }

    for (PlayerHandle player : players) {
      assertThat(engine.playerRating(player)).isEqualTo(replay.playerRating(player));
    }
  }

  private void runConcurrently(TaskFactory factory) throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        final Runnable task = factory.create(t);
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < GAMES_PER_THREAD; i++) {
                    task.run();
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @FunctionalInterface
  private interface TaskFactory {
    Runnable create(int index);
  }
}
