package com.gnovoa.gridiron.encode;

/**
 * Vector widths and categorical code spaces shared by every encoder and by any consumer that
 * reads the vectors back.
 *
 * <pre>
 *   player = playerWidth                          (670)
 *   roster = rosterSize * playerWidth             (64 * 670 = 42,880)
 *   game   = 2 * roster + CONTEXT_WIDTH           (85,810)
 *   play   = game + PLAY_STATE_WIDTH              (85,830)
 * </pre>
 *
 * @param rosterSize rows in a roster grid
 * @param playerWidth width of one player vector; at least {@link PlayerSection#SECTIONS_WIDTH}
 * @param identityModulus code space for player identities
 * @param teamModulus code space for team names
 */
public record TensorLayout(int rosterSize, int playerWidth, int identityModulus, int teamModulus) {

  public static final int DEFAULT_ROSTER_SIZE = 64;
  public static final int DEFAULT_PLAYER_WIDTH = 670;
  public static final int DEFAULT_IDENTITY_MODULUS = 1_000_000;
  public static final int DEFAULT_TEAM_MODULUS = 100;

  public static final int CONTEXT_WIDTH = 50;
  public static final int PLAY_STATE_WIDTH = 20;

  public static final TensorLayout DEFAULT =
      new TensorLayout(
          DEFAULT_ROSTER_SIZE, DEFAULT_PLAYER_WIDTH, DEFAULT_IDENTITY_MODULUS, DEFAULT_TEAM_MODULUS);

  /**
   * @throws IllegalArgumentException if any size is not positive or the player width cannot hold
   *     every section
   */
  public TensorLayout {
    if (rosterSize <= 0) {
      throw new IllegalArgumentException("rosterSize must be positive: " + rosterSize);
    }
    if (playerWidth < PlayerSection.SECTIONS_WIDTH) {
      throw new IllegalArgumentException(
          "playerWidth "
              + playerWidth
              + " is smaller than the "
              + PlayerSection.SECTIONS_WIDTH
              + " slots the player sections need");
    }
    if (identityModulus <= 0 || teamModulus <= 0) {
      throw new IllegalArgumentException(
          "categorical moduli must be positive: identity="
              + identityModulus
              + ", team="
              + teamModulus);
    }
  }

  public int rosterWidth() {
    return rosterSize * playerWidth;
  }

  public int gameWidth() {
    return 2 * rosterWidth() + CONTEXT_WIDTH;
  }

  public int playWidth() {
    return gameWidth() + PLAY_STATE_WIDTH;
  }

  /** @return offset of the away roster inside a game vector */
  public int awayRosterOffset() {
    return rosterWidth();
  }

  /** @return offset of the context block inside a game vector */
  public int contextOffset() {
    return 2 * rosterWidth();
  }

  /** @return offset of the play-state block inside a play vector */
  public int playStateOffset() {
    return gameWidth();
  }
}
