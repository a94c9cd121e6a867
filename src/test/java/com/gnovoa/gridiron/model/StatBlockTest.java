package com.gnovoa.gridiron.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatBlockTest {

  @Test
  void nestedLookupsNeverThrow() {
    StatBlock b = StatBlock.of(Map.of("college", Map.of("passing", Map.of("yards", 11000))));

    assertThat(b.block("college").block("passing").value("yards")).isEqualTo(11000);
    assertThat(b.block("nfl_career").block("passing").value("yards")).isNull();
    assertThat(b.block("college").block("passing").block("yards")).isSameAs(StatBlock.EMPTY);
  }

  @Test
  void nonMappingBlocksReadAsEmpty() {
    StatBlock b = StatBlock.of(Map.of("combine", List.of(1, 2, 3), "draft_info", "1st round"));

    assertThat(b.block("combine").isEmpty()).isTrue();
    assertThat(b.block("draft_info").isEmpty()).isTrue();
  }

  @Test
  void textIsTrimmedAndBlankIsAbsent() {
    Map<String, Object> raw = new HashMap<>();
    raw.put("name", "  Tom Brady ");
    raw.put("team", "   ");
    raw.put("identity", 1234);
    raw.put("nothing", null);
    StatBlock b = StatBlock.of(raw);

    assertThat(b.text("name")).isEqualTo("Tom Brady");
    assertThat(b.text("team")).isNull();
    assertThat(b.text("identity")).isEqualTo("1234");
    assertThat(b.has("nothing")).isFalse();
  }

  @Test
  void copiesTheSourceMap() {
    Map<String, Object> raw = new HashMap<>(Map.of("age", 25));
    StatBlock b = StatBlock.of(raw);

    raw.put("age", 40);

    assertThat(b.value("age")).isEqualTo(25);
    assertThatThrownBy(() -> b.asMap().put("age", 30))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void nullSourceIsEmpty() {
    assertThat(StatBlock.of(null)).isSameAs(StatBlock.EMPTY);
    assertThat(StatBlock.from(null)).isSameAs(StatBlock.EMPTY);
  }
}
