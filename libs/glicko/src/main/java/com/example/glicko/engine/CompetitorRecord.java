package com.example.glicko.engine;

import com.example.glicko.model.InternalRating;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable engine entry of one competitor.
 *
 * <p>Readers see an immutable {@link CompetitorState}; writers must hold {@link #lock()}.
 */
final class CompetitorRecord {

  private final ReentrantLock lock = new ReentrantLock();
  private volatile CompetitorState state;

  CompetitorRecord(InternalRating rating, Instant lastUpdatedAt) {
    this.state = new CompetitorState(rating, lastUpdatedAt);
  }

  CompetitorState state() {
    return state;
  }

  ReentrantLock lock() {
    return lock;
  }

  void commit(InternalRating rating, Instant updatedAt) {
    final CompetitorState current = state;
    final Instant lastUpdatedAt =
        updatedAt.isAfter(current.lastUpdatedAt()) ? updatedAt : current.lastUpdatedAt();
    state = new CompetitorState(rating, lastUpdatedAt);
  }

  record CompetitorState(InternalRating rating, Instant lastUpdatedAt) {}
}
