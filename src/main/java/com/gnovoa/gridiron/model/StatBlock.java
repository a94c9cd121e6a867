package com.gnovoa.gridiron.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view over one raw, JSON-shaped mapping (a player record, a college career block, a
 * seasonal split, a game context, ...).
 *
 * <p>Collected data is routinely incomplete: keys are missing, nested blocks are absent or hold
 * the wrong type. Lookups here never throw. An absent key yields {@code null} from {@link
 * #value(String)}, and a nested block that is absent or not a mapping yields {@link #EMPTY}.
 *
 * <p>The source map is copied shallowly on construction, so later changes to the caller's map are
 * not observed.
 */
public final class StatBlock {

  /** Block with no keys. */
  public static final StatBlock EMPTY = new StatBlock(Map.of());

  private final Map<String, Object> values;

  private StatBlock(Map<String, Object> values) {
    this.values = values;
  }

  /**
   * Wraps a raw mapping.
   *
   * @param raw source mapping; {@code null} yields {@link #EMPTY}
   * @return block view over a copy of {@code raw}
   */
  public static StatBlock of(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) return EMPTY;
    return new StatBlock(Collections.unmodifiableMap(new LinkedHashMap<>(raw)));
  }

  /**
   * Wraps an arbitrary value when it is a mapping with string keys.
   *
   * @param raw candidate value
   * @return block view, or {@link #EMPTY} when {@code raw} is not a mapping
   */
  public static StatBlock from(Object raw) {
    if (!(raw instanceof Map<?, ?> m)) return EMPTY;
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : m.entrySet()) {
      if (e.getKey() != null) copy.put(String.valueOf(e.getKey()), e.getValue());
    }
    return copy.isEmpty() ? EMPTY : new StatBlock(Collections.unmodifiableMap(copy));
  }

  /** @return raw value for {@code key}, or {@code null} when absent */
  public Object value(String key) {
    return values.get(key);
  }

  /** @return true when {@code key} is present with a non-null value */
  public boolean has(String key) {
    return values.get(key) != null;
  }

  /** @return nested block under {@code key}, or {@link #EMPTY} */
  public StatBlock block(String key) {
    return from(values.get(key));
  }

  /** @return trimmed text for {@code key}, or {@code null} when absent or blank */
  public String text(String key) {
    Object v = values.get(key);
    if (v == null) return null;
    String s = String.valueOf(v).trim();
    return s.isEmpty() ? null : s;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** @return unmodifiable view of the underlying mapping */
  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof StatBlock other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "StatBlock" + values;
  }
}
