package com.gnovoa.gridiron.state;

import com.gnovoa.gridiron.encode.PlayerFeatureEncoder;
import com.gnovoa.gridiron.encode.RosterEncoder;
import com.gnovoa.gridiron.model.PlayerRecord;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest encoded vector per player, for callers that walk a season game by game and rebuild
 * rosters from current player state.
 *
 * <p>Each caller owns its store and threads it through its own processing; nothing here is shared
 * between stores. Not thread-safe.
 */
public final class PlayerStateStore {

  private final PlayerFeatureEncoder players;
  private final RosterEncoder rosters;
  private final Map<String, float[]> vectors = new HashMap<>();

  public PlayerStateStore(PlayerFeatureEncoder players, RosterEncoder rosters) {
    this.players = players;
    this.rosters = rosters;
  }

  /**
   * Encodes a player and stores the vector under its identity, replacing any previous state.
   *
   * @param player player record with an identity
   * @return copy of the stored vector
   * @throws IllegalArgumentException if the player is null or has no identity
   */
  public float[] seed(PlayerRecord player) {
    if (player == null || player.identity() == null) {
      throw new IllegalArgumentException("Player state requires a record with an identity");
    }
    float[] vector = players.encode(player);
    vectors.put(player.identity(), vector);
    return vector.clone();
  }

  /**
   * Seeds every player in order.
   *
   * @param roster players to seed; null reads as empty
   * @throws IllegalArgumentException if any player has no identity; earlier players stay seeded
   */
  public void seedAll(List<PlayerRecord> roster) {
    if (roster == null) return;
    roster.forEach(this::seed);
  }

  /** @return true when state is held for {@code identity} */
  public boolean contains(String identity) {
    return vectors.containsKey(identity);
  }

  /** @return copy of the stored vector, or the null player (all zeros) for unknown identities */
  public float[] vector(String identity) {
    float[] v = vectors.get(identity);
    return v == null ? new float[players.width()] : v.clone();
  }

  /**
   * Builds a roster grid from stored state. Unknown identities occupy null-player rows.
   *
   * @param identities player identities in row order; null reads as empty
   * @return flattened roster grid
   */
  public float[] roster(List<String> identities) {
    if (identities == null) return rosters.assemble(List.of());
    List<float[]> rows = new ArrayList<>(identities.size());
    for (String id : identities) rows.add(vectors.get(id));
    return rosters.assemble(rows);
  }

  public int size() {
    return vectors.size();
  }

  public void clear() {
    vectors.clear();
  }
}
