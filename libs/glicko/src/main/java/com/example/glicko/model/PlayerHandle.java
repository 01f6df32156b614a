package com.example.glicko.model;

/** Opaque identifier handed out by a rating engine on registration. */
public record PlayerHandle(long value) {

  @Override
  public String toString() {
    return "player-" + value;
  }
}
