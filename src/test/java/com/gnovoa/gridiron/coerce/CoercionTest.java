package com.gnovoa.gridiron.coerce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CoercionTest {

  @Test
  @DisplayName("Numbers, booleans and numeric text convert to float")
  void convertsSupportedScalars() {
    assertThat(Coercion.coerceFloat(100)).isEqualTo(100f);
    assertThat(Coercion.coerceFloat(4.52d)).isEqualTo(4.52f);
    assertThat(Coercion.coerceFloat(new BigDecimal("12.5"))).isEqualTo(12.5f);
    assertThat(Coercion.coerceFloat("123.45")).isEqualTo(123.45f);
    assertThat(Coercion.coerceFloat("  76 ")).isEqualTo(76f);
    assertThat(Coercion.coerceFloat(true)).isEqualTo(1f);
    assertThat(Coercion.coerceFloat(false)).isEqualTo(0f);
  }

  @Test
  @DisplayName("Absent or unconvertible values fall back to the default without throwing")
  void fallsBackToDefault() {
    assertThat(Coercion.coerceFloat(null)).isEqualTo(0f);
    assertThat(Coercion.coerceFloat(null, 70f)).isEqualTo(70f);
    assertThat(Coercion.coerceFloat("invalid", 3f)).isEqualTo(3f);
    assertThat(Coercion.coerceFloat("", 9f)).isEqualTo(9f);
    assertThat(Coercion.coerceFloat(List.of(1, 2), 5f)).isEqualTo(5f);
    assertThat(Coercion.coerceFloat(Map.of("yards", 10))).isEqualTo(0f);
    assertThat(Coercion.coerceFloat("12f", -1f)).isEqualTo(-1f);
    assertThat(Coercion.coerceFloat("3d", -1f)).isEqualTo(-1f);
    assertThat(Coercion.coerceFloat("0x1p3", -1f)).isEqualTo(-1f);
    assertThat(Coercion.coerceFloat("1,200", -1f)).isEqualTo(-1f);
  }

  @Test
  @DisplayName("Decimal text with sign, fraction or exponent still converts")
  void acceptsPlainDecimalForms() {
    assertThat(Coercion.coerceFloat("-14")).isEqualTo(-14f);
    assertThat(Coercion.coerceFloat("+3.5")).isEqualTo(3.5f);
    assertThat(Coercion.coerceFloat(".5")).isEqualTo(0.5f);
    assertThat(Coercion.coerceFloat("5.")).isEqualTo(5f);
    assertThat(Coercion.coerceFloat("1.5e2")).isEqualTo(150f);
  }

  @Test
  @DisplayName("Non-finite values count as unconvertible")
  void rejectsNonFinite() {
    assertThat(Coercion.coerceFloat(Double.NaN, 1f)).isEqualTo(1f);
    assertThat(Coercion.coerceFloat("Infinity", 2f)).isEqualTo(2f);
    assertThat(Coercion.coerceFloat(1e300d, 4f)).isEqualTo(4f);
  }

  @Test
  void flagAcceptsBooleansNumbersAndWords() {
    assertThat(Coercion.flag(true)).isTrue();
    assertThat(Coercion.flag(1)).isTrue();
    assertThat(Coercion.flag(0.0)).isFalse();
    assertThat(Coercion.flag("Yes")).isTrue();
    assertThat(Coercion.flag(" TRUE ")).isTrue();
    assertThat(Coercion.flag("no")).isFalse();
    assertThat(Coercion.flag(null)).isFalse();
  }

  @Test
  void unrecognisedFlagValuesAreReported() {
    assertThat(Coercion.tryFlag("N")).isFalse();
    assertThat(Coercion.tryFlag("0")).isFalse();
    assertThat(Coercion.tryFlag("maybe")).isNull();
    assertThat(Coercion.tryFlag(Map.of("x", 1))).isNull();
    assertThat(Coercion.tryFlag(null)).isNull();
    assertThat(Coercion.flag("maybe")).isFalse();
  }

  @Test
  @DisplayName("Categorical codes match published FNV-1a 32-bit values")
  void categoricalCodesArePinned() {
    assertThat(Coercion.fnv1a("")).isEqualTo(0x811C9DC5);
    assertThat(Coercion.fnv1a("a")).isEqualTo(0xE40C292C);
    assertThat(Coercion.fnv1a("foobar")).isEqualTo(0xBF9CF968);

    assertThat(Coercion.categoricalCode("a", 1_000_000)).isEqualTo(2220);
    assertThat(Coercion.categoricalCode("BradTo00", 1_000_000)).isEqualTo(219817);
    assertThat(Coercion.categoricalCode("KC", 100)).isEqualTo(11);
    assertThat(Coercion.categoricalCode("NE", 100)).isEqualTo(0);
  }

  @Test
  void categoricalCodeHashesUtf8Bytes() {
    assertThat(Coercion.categoricalCode("Arizóna", 1_000_000)).isEqualTo(743054);
  }

  @Test
  void categoricalCodeStaysInRange() {
    for (String s : List.of("", "x", "Tom Brady", "Patrick Mahomes", "ÅÆØ", "🏈")) {
      assertThat(Coercion.categoricalCode(s, 7)).isBetween(0, 6);
    }
    assertThat(Coercion.categoricalCode(null, 100)).isEqualTo(Coercion.categoricalCode("", 100));
  }

  @Test
  void categoricalCodeRejectsNonPositiveModulus() {
    assertThatThrownBy(() -> Coercion.categoricalCode("KC", 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("modulus");
  }
}
