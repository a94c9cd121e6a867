package com.gnovoa.gridiron.coerce;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scalar coercion and categorical hashing shared by every encoder.
 *
 * <p>Categorical codes are stored inside feature vectors and decoded elsewhere through side lookup
 * tables, so {@link #categoricalCode(String, int)} uses a fixed FNV-1a hash over UTF-8 bytes. The
 * same string yields the same code in every JVM, on every run.
 */
public final class Coercion {

  /** FNV-1a 32-bit offset basis. */
  static final int FNV_OFFSET_BASIS = 0x811C9DC5;

  /** FNV-1a 32-bit prime. */
  static final int FNV_PRIME = 0x01000193;

  /** Plain decimal text: optional sign, digits with an optional fraction, optional exponent. */
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private Coercion() {}

  /**
   * Converts a raw value to a float.
   *
   * @param value number, boolean, numeric text, or anything else
   * @param defaultValue returned when {@code value} is null or not convertible
   * @return converted value, or {@code defaultValue}; never NaN or infinite unless the default is
   */
  public static float coerceFloat(Object value, float defaultValue) {
    Float f = tryFloat(value);
    return f == null ? defaultValue : f;
  }

  /** Same as {@link #coerceFloat(Object, float)} with a default of 0. */
  public static float coerceFloat(Object value) {
    return coerceFloat(value, 0f);
  }

  /**
   * Attempts the conversion without a default.
   *
   * @return converted finite value, or {@code null} when {@code value} is null or unconvertible
   */
  static Float tryFloat(Object value) {
    if (value == null) return null;
    float f;
    if (value instanceof Number n) {
      f = n.floatValue();
    } else if (value instanceof Boolean b) {
      f = b ? 1f : 0f;
    } else if (value instanceof CharSequence cs) {
      String s = cs.toString().trim();
      if (!DECIMAL.matcher(s).matches()) return null;
      try {
        f = Float.parseFloat(s);
      } catch (NumberFormatException e) {
        return null;
      }
    } else {
      return null;
    }
    return Float.isFinite(f) ? f : null;
  }

  /**
   * Interprets a raw value as a flag; anything {@link #tryFlag(Object)} does not recognise is
   * false.
   */
  public static boolean flag(Object value) {
    return Boolean.TRUE.equals(tryFlag(value));
  }

  /**
   * Interprets a raw value as a flag: booleans as-is, numbers by whether they are non-zero, and
   * the words {@code true/yes/y/1} or {@code false/no/n/0} in any case.
   *
   * @return the flag, or {@code null} when {@code value} is null or not recognised
   */
  static Boolean tryFlag(Object value) {
    if (value instanceof Boolean b) return b;
    if (value instanceof Number n) return n.doubleValue() != 0d;
    if (value instanceof CharSequence cs) {
      switch (cs.toString().trim().toLowerCase(Locale.ROOT)) {
        case "true", "yes", "y", "1":
          return Boolean.TRUE;
        case "false", "no", "n", "0":
          return Boolean.FALSE;
        default:
          return null;
      }
    }
    return null;
  }

  /**
   * Maps a string to a stable integer code in {@code [0, modulus)}.
   *
   * @param text source string; {@code null} hashes like the empty string
   * @param modulus code space size, must be positive
   * @return FNV-1a hash of the UTF-8 bytes, unsigned, reduced modulo {@code modulus}
   * @throws IllegalArgumentException if {@code modulus <= 0}
   */
  public static int categoricalCode(String text, int modulus) {
    if (modulus <= 0) throw new IllegalArgumentException("modulus must be positive: " + modulus);
    return (int) (Integer.toUnsignedLong(fnv1a(text)) % modulus);
  }

  /** @return raw 32-bit FNV-1a hash of the UTF-8 bytes of {@code text} */
  static int fnv1a(String text) {
    int hash = FNV_OFFSET_BASIS;
    if (text == null) return hash;
    for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
      hash ^= (b & 0xFF);
      hash *= FNV_PRIME;
    }
    return hash;
  }
}
