package com.gnovoa.gridiron.model;

import java.util.Map;

/**
 * In-game situation before a snap: quarter, clock, down and distance, field position, score,
 * possession and timeouts.
 *
 * <p>{@code yard_line} is an absolute 0-100 position measured from the goal line defended by the
 * away team. The home offense drives toward 0, so the team in possession needs {@code yard_line}
 * yards to score when it is the home team and {@code 100 - yard_line} when it is the away team.
 * {@code possession} is 1 for home, 0 for away.
 */
public record PlayState(StatBlock data) {

  public PlayState {
    if (data == null) data = StatBlock.EMPTY;
  }

  public static PlayState of(Map<String, ?> raw) {
    return new PlayState(StatBlock.of(raw));
  }
}
