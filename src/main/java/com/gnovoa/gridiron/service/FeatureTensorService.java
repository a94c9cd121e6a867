package com.gnovoa.gridiron.service;

import com.gnovoa.gridiron.encode.GameContextEncoder;
import com.gnovoa.gridiron.encode.PlayStateEncoder;
import com.gnovoa.gridiron.encode.PlayerFeatureEncoder;
import com.gnovoa.gridiron.encode.RosterEncoder;
import com.gnovoa.gridiron.encode.TensorCompositor;
import com.gnovoa.gridiron.encode.TensorLayout;
import com.gnovoa.gridiron.io.RecordReader;
import com.gnovoa.gridiron.model.GameContext;
import com.gnovoa.gridiron.model.PlayState;
import com.gnovoa.gridiron.model.PlayerRecord;
import com.gnovoa.gridiron.state.PlayerStateStore;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for building player, roster, game and play tensors from records.
 *
 * <p>Stateless; every call returns freshly allocated vectors.
 */
@Component
public final class FeatureTensorService {

  private static final Logger log = LoggerFactory.getLogger(FeatureTensorService.class);

  private final PlayerFeatureEncoder players;
  private final RosterEncoder rosters;
  private final GameContextEncoder contexts;
  private final PlayStateEncoder playStates;
  private final TensorCompositor compositor;

  public FeatureTensorService(
      PlayerFeatureEncoder players,
      RosterEncoder rosters,
      GameContextEncoder contexts,
      PlayStateEncoder playStates,
      TensorCompositor compositor) {
    this.players = players;
    this.rosters = rosters;
    this.contexts = contexts;
    this.playStates = playStates;
    this.compositor = compositor;
  }

  public TensorLayout layout() {
    return compositor.layout();
  }

  public float[] playerTensor(PlayerRecord player) {
    return players.encode(player);
  }

  public float[] rosterTensor(List<PlayerRecord> roster) {
    return rosters.encode(roster);
  }

  /**
   * Builds {@code home roster | away roster | context}.
   *
   * @return vector of length {@link TensorLayout#gameWidth()}
   */
  public float[] gameTensor(List<PlayerRecord> home, List<PlayerRecord> away, GameContext context) {
    float[] game =
        compositor.composeGame(rosters.encode(home), rosters.encode(away), contexts.encode(context));
    log.debug("Built game tensor of length {}", game.length);
    return game;
  }

  /**
   * Appends a play situation to an already built game vector.
   *
   * @throws com.gnovoa.gridiron.encode.TensorShapeException if {@code game} has the wrong length
   */
  public float[] playTensor(float[] game, PlayState play) {
    return compositor.composePlay(game, playStates.encode(play));
  }

  public float[] playTensor(
      List<PlayerRecord> home, List<PlayerRecord> away, GameContext context, PlayState play) {
    return playTensor(gameTensor(home, away, context), play);
  }

  /**
   * Builds one play vector per situation, all sharing the same game vector, in input order.
   *
   * @throws com.gnovoa.gridiron.encode.TensorShapeException if {@code game} has the wrong length
   */
  public List<float[]> playStateTensors(float[] game, List<PlayState> plays) {
    List<float[]> out = new ArrayList<>(plays.size());
    for (PlayState p : plays) out.add(playTensor(game, p));
    log.debug("Built {} play tensors", out.size());
    return out;
  }

  /** Builds the play vectors for every play of a parsed game document. */
  public List<float[]> playStateTensors(RecordReader.GameRecord game) {
    return playStateTensors(gameTensor(game.home(), game.away(), game.context()), game.plays());
  }

  /** @return a new, empty state store owned by the caller */
  public PlayerStateStore newPlayerStateStore() {
    return new PlayerStateStore(players, rosters);
  }
}
