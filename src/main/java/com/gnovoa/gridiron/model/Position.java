package com.gnovoa.gridiron.model;

import java.util.Locale;

/** Position groups with the fixed numeric codes written into player vectors. */
public enum Position {
  UNKNOWN(0),
  QB(1),
  RB(2),
  WR(3),
  TE(4),
  OL(5),
  DL(6),
  LB(7),
  DB(8),
  K(9),
  P(10);

  private final int code;

  Position(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Resolves a free-text position label. Labels are trimmed and matched case-insensitively;
   * anything unrecognised (including {@code "UNKNOWN"} and null) maps to {@link #UNKNOWN}.
   *
   * @param label position label as collected, e.g. {@code "qb"} or {@code " WR "}
   * @return matching position, never null
   */
  public static Position fromLabel(Object label) {
    if (label == null) return UNKNOWN;
    String key = String.valueOf(label).trim().toUpperCase(Locale.ROOT);
    for (Position p : values()) {
      if (p != UNKNOWN && p.name().equals(key)) return p;
    }
    return UNKNOWN;
  }
}
