package com.gnovoa.gridiron.model;

import java.util.Map;

/**
 * Game metadata: weather and surface descriptions, temperature, wind, dome and playoff flags,
 * week and season, both teams' win/loss tallies and the kickoff hour.
 */
public record GameContext(StatBlock data) {

  public GameContext {
    if (data == null) data = StatBlock.EMPTY;
  }

  public static GameContext of(Map<String, ?> raw) {
    return new GameContext(StatBlock.of(raw));
  }
}
