package com.gnovoa.gridiron.encode;

/**
 * Fixed sections of a player vector, in vector order.
 *
 * <pre>
 *   [0..8]     ROSTER_INFO      9
 *   [9..21]    COMBINE         13
 *   [22..85]   COLLEGE_CAREER  64
 *   [86..201]  NFL_CAREER     116
 *   [202..318] LAST_SEASON    117
 *   [319..435] WORST_SEASON   117
 *   [436..552] BEST_SEASON    117
 *   [553..668] AVERAGE_SEASON 116
 *   [669]      reserved, always 0
 * </pre>
 *
 * The sections cover 669 slots while stored vectors are 670 wide. Everything from {@link
 * #SECTIONS_WIDTH} up to the configured player width is never written.
 */
public enum PlayerSection {
  ROSTER_INFO(0, 9),
  COMBINE(9, 13),
  COLLEGE_CAREER(22, 64),
  NFL_CAREER(86, 116),
  LAST_SEASON(202, 117),
  WORST_SEASON(319, 117),
  BEST_SEASON(436, 117),
  AVERAGE_SEASON(553, 116);

  /** Sum of all section widths. */
  public static final int SECTIONS_WIDTH = 669;

  static {
    int next = 0;
    for (PlayerSection s : values()) {
      if (s.offset != next) {
        throw new ExceptionInInitializerError(s + " starts at " + s.offset + ", expected " + next);
      }
      next += s.width;
    }
    if (next != SECTIONS_WIDTH) {
      throw new ExceptionInInitializerError("sections cover " + next + " slots, not " + SECTIONS_WIDTH);
    }
  }

  private final int offset;
  private final int width;

  PlayerSection(int offset, int width) {
    this.offset = offset;
    this.width = width;
  }

  public int width() {
    return width;
  }

  /** @return index of this section's first slot within a player vector */
  public int offset() {
    return offset;
  }
}
