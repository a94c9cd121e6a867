package com.gnovoa.gridiron.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.gridiron.encode.PlayerFeatureEncoder;
import com.gnovoa.gridiron.encode.RosterEncoder;
import com.gnovoa.gridiron.encode.TensorLayout;
import com.gnovoa.gridiron.model.PlayerRecord;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlayerStateStoreTest {

  private final PlayerFeatureEncoder players = new PlayerFeatureEncoder(TensorLayout.DEFAULT);
  private final RosterEncoder rosters = new RosterEncoder(TensorLayout.DEFAULT, players);

  private final PlayerRecord mahomes =
      PlayerRecord.of(Map.of("identity", "MahoPa00", "position", "QB", "age", 29));
  private final PlayerRecord kelce =
      PlayerRecord.of(Map.of("identity", "KelcTr00", "position", "TE", "age", 35));

  @Test
  @DisplayName("Seeded state matches a fresh encoding of the same record")
  void seedStoresEncodedVector() {
    PlayerStateStore store = new PlayerStateStore(players, rosters);

    float[] seeded = store.seed(mahomes);

    assertThat(store.contains("MahoPa00")).isTrue();
    assertThat(store.size()).isEqualTo(1);
    assertThat(seeded).containsExactly(players.encode(mahomes));
    assertThat(store.vector("MahoPa00")).containsExactly(seeded);
  }

  @Test
  void returnedVectorsAreCopies() {
    PlayerStateStore store = new PlayerStateStore(players, rosters);
    store.seed(mahomes)[8] = -1f;
    store.vector("MahoPa00")[8] = -1f;

    assertThat(store.vector("MahoPa00")[8]).isEqualTo(29f);
  }

  @Test
  void reseedReplacesState() {
    PlayerStateStore store = new PlayerStateStore(players, rosters);
    store.seed(mahomes);

    store.seed(PlayerRecord.of(Map.of("identity", "MahoPa00", "position", "QB", "age", 30)));

    assertThat(store.size()).isEqualTo(1);
    assertThat(store.vector("MahoPa00")[8]).isEqualTo(30f);
  }

  @Test
  void unknownIdentityReadsAsNullPlayer() {
    PlayerStateStore store = new PlayerStateStore(players, rosters);

    assertThat(store.contains("nobody")).isFalse();
    assertThat(store.vector("nobody")).hasSize(670).containsOnly(0f);
  }

  @Test
  @DisplayName("Roster grid from stored state keeps the requested row order")
  void rosterFromState() {
    PlayerStateStore store = new PlayerStateStore(players, rosters);
    store.seedAll(List.of(mahomes, kelce));

    float[] grid = store.roster(List.of("KelcTr00", "nobody", "MahoPa00"));

    assertThat(grid).hasSize(42_880);
    assertThat(Arrays.copyOfRange(grid, 0, 670)).containsExactly(players.encode(kelce));
    assertThat(Arrays.copyOfRange(grid, 670, 1340)).containsOnly(0f);
    assertThat(Arrays.copyOfRange(grid, 1340, 2010)).containsExactly(players.encode(mahomes));
    assertThat(Arrays.copyOfRange(grid, 2010, 42_880)).containsOnly(0f);
  }

  @Test
  @DisplayName("Separate stores never see each other's state")
  void storesAreIsolated() {
    PlayerStateStore a = new PlayerStateStore(players, rosters);
    PlayerStateStore b = new PlayerStateStore(players, rosters);

    a.seed(mahomes);

    assertThat(b.contains("MahoPa00")).isFalse();
    a.clear();
    assertThat(a.size()).isZero();
  }

  @Test
  @DisplayName("Null lists read as empty, like the roster encoder")
  void nullListsReadAsEmpty() {
    PlayerStateStore store = new PlayerStateStore(players, rosters);

    store.seedAll(null);

    assertThat(store.size()).isZero();
    assertThat(store.roster(null)).hasSize(42_880).containsOnly(0f);
  }

  @Test
  void rejectsRecordsWithoutIdentity() {
    PlayerStateStore store = new PlayerStateStore(players, rosters);

    assertThatThrownBy(() -> store.seed(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.seed(PlayerRecord.of(Map.of("position", "QB"))))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(store.size()).isZero();
  }
}
