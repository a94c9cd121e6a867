package com.gnovoa.gridiron.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.gridiron.model.GameContext;
import com.gnovoa.gridiron.model.PlayState;
import com.gnovoa.gridiron.model.PlayerRecord;
import com.gnovoa.gridiron.model.StatBlock;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON documents into encoder inputs.
 *
 * <p>Only the document shape is checked here (an object, or an array of objects for rosters).
 * Missing or oddly typed fields inside a record are left for the encoders to default.
 */
public final class RecordReader {

  private static final TypeReference<Map<String, Object>> RAW = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public RecordReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  public PlayerRecord player(String json) {
    return new PlayerRecord(object(tree(json), "player"));
  }

  /**
   * Reads a roster: a JSON array of player objects, in row order.
   *
   * @throws IllegalArgumentException if the text is not an array of objects
   */
  public List<PlayerRecord> roster(String json) {
    return roster(tree(json));
  }

  public List<PlayerRecord> roster(InputStream in) {
    return roster(tree(in));
  }

  public GameContext gameContext(String json) {
    return new GameContext(object(tree(json), "game context"));
  }

  public PlayState playState(String json) {
    return new PlayState(object(tree(json), "play state"));
  }

  /**
   * Reads a whole game document:
   *
   * <pre>
   *   { "home": [player...], "away": [player...], "context": {...}, "plays": [{...}...] }
   * </pre>
   *
   * Absent parts read as empty.
   *
   * @throws IllegalArgumentException if the document or one of its parts has the wrong shape
   */
  public GameRecord game(InputStream in) {
    JsonNode root = tree(in);
    if (!root.isObject()) throw new IllegalArgumentException("Game document must be a JSON object");

    List<PlayState> plays = new ArrayList<>();
    JsonNode playsNode = root.path("plays");
    if (!playsNode.isMissingNode() && !playsNode.isNull()) {
      if (!playsNode.isArray()) throw new IllegalArgumentException("'plays' must be an array");
      for (JsonNode p : playsNode) plays.add(new PlayState(object(p, "play state")));
    }

    JsonNode contextNode = root.path("context");
    GameContext context =
        contextNode.isMissingNode() || contextNode.isNull()
            ? new GameContext(StatBlock.EMPTY)
            : new GameContext(object(contextNode, "game context"));

    return new GameRecord(
        optionalRoster(root.path("home")), optionalRoster(root.path("away")), context, plays);
  }

  private List<PlayerRecord> optionalRoster(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) return List.of();
    return roster(node);
  }

  private List<PlayerRecord> roster(JsonNode node) {
    if (!node.isArray()) throw new IllegalArgumentException("Roster must be a JSON array");
    List<PlayerRecord> out = new ArrayList<>(node.size());
    for (JsonNode p : node) out.add(new PlayerRecord(object(p, "player")));
    return out;
  }

  private StatBlock object(JsonNode node, String what) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Expected a JSON object for " + what);
    }
    return StatBlock.of(mapper.convertValue(node, RAW));
  }

  private JsonNode tree(String json) {
    try {
      return mapper.readTree(json);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed JSON record", e);
    }
  }

  private JsonNode tree(InputStream in) {
    try {
      return mapper.readTree(in);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed JSON record", e);
    }
  }

  /** Parsed game document. */
  public record GameRecord(
      List<PlayerRecord> home, List<PlayerRecord> away, GameContext context, List<PlayState> plays) {}
}
