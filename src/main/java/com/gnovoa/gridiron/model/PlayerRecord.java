package com.gnovoa.gridiron.model;

import java.util.Map;

/**
 * One player as collected: identity, roster and draft attributes plus the nested {@code combine},
 * {@code college}, {@code nfl_career} and {@code seasonal} blocks.
 *
 * <p>Every part is optional. Accessors return raw values or {@link StatBlock#EMPTY}; coercion to
 * numbers happens in the encoders.
 */
public record PlayerRecord(StatBlock data) {

  public PlayerRecord {
    if (data == null) data = StatBlock.EMPTY;
  }

  public static PlayerRecord of(Map<String, ?> raw) {
    return new PlayerRecord(StatBlock.of(raw));
  }

  /** @return stable external id, or {@code null} when absent or blank */
  public String identity() {
    return data.text("identity");
  }

  public StatBlock draftInfo() {
    return data.block("draft_info");
  }

  public StatBlock combine() {
    return data.block("combine");
  }

  public StatBlock college() {
    return data.block("college");
  }

  public StatBlock nflCareer() {
    return data.block("nfl_career");
  }

  public StatBlock seasonal(SeasonSlot slot) {
    return data.block("seasonal").block(slot.key());
  }
}
