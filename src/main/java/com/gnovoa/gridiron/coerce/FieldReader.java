package com.gnovoa.gridiron.coerce;

import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.StatBlock;
import java.util.Locale;

/**
 * Reads fields out of {@link StatBlock}s for a single encoding call and keeps count of the fields
 * that had to be defaulted.
 *
 * <p>Create one per call. Not thread-safe.
 */
public final class FieldReader {

  private int missing;
  private int unconvertible;

  /**
   * Reads {@code key} as a float.
   *
   * @return converted value, or {@code defaultValue} when absent or unconvertible
   */
  public float number(StatBlock block, String key, float defaultValue) {
    Object raw = block.value(key);
    if (raw == null) {
      missing++;
      return defaultValue;
    }
    Float f = Coercion.tryFloat(raw);
    if (f == null) {
      unconvertible++;
      return defaultValue;
    }
    return f;
  }

  public float number(StatBlock block, String key) {
    return number(block, key, 0f);
  }

  /**
   * Reads {@code key} as a flag and returns 1 or 0. Absent or unrecognised values read as {@code
   * defaultValue}.
   */
  public float flag(StatBlock block, String key, boolean defaultValue) {
    Object raw = block.value(key);
    if (raw == null) {
      missing++;
      return defaultValue ? 1f : 0f;
    }
    Boolean b = Coercion.tryFlag(raw);
    if (b == null) {
      unconvertible++;
      return defaultValue ? 1f : 0f;
    }
    return b ? 1f : 0f;
  }

  /**
   * Reads {@code key} as text and hashes it into {@code [0, modulus)}. Absent or blank text reads
   * as 0.
   */
  public float code(StatBlock block, String key, int modulus) {
    String text = block.text(key);
    if (text == null) {
      missing++;
      return 0f;
    }
    return Coercion.categoricalCode(text, modulus);
  }

  /**
   * Reads {@code key} as a position label and returns its code. An unrecognised label counts as
   * unconvertible and reads as {@link Position#UNKNOWN}.
   */
  public float position(StatBlock block, String key) {
    String label = block.text(key);
    if (label == null) {
      missing++;
      return Position.UNKNOWN.code();
    }
    Position p = Position.fromLabel(label);
    if (p == Position.UNKNOWN) unconvertible++;
    return p.code();
  }

  /** @return lower-cased text for {@code key}, or the empty string when absent or blank */
  public String lowerText(StatBlock block, String key) {
    String text = block.text(key);
    if (text == null) {
      missing++;
      return "";
    }
    return text.toLowerCase(Locale.ROOT);
  }

  /**
   * Fills {@code out[offset..offset+keys.length)} with the fields named by {@code keys}, each
   * defaulting to 0.
   */
  public void numbers(StatBlock block, String[] keys, float[] out, int offset) {
    for (int i = 0; i < keys.length; i++) {
      out[offset + i] = number(block, keys[i]);
    }
  }

  /** @return fields read as absent so far */
  public int missing() {
    return missing;
  }

  /** @return fields present but not convertible so far */
  public int unconvertible() {
    return unconvertible;
  }
}
