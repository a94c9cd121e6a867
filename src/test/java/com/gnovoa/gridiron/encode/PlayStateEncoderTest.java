package com.gnovoa.gridiron.encode;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.gridiron.model.PlayState;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlayStateEncoderTest {

    private final PlayStateEncoder encoder = new PlayStateEncoder();

    @Test
    @DisplayName("Home drive at the 85: red zone, not goal to go, up by four")
    void homeDriveDeepInTerritory() {
        float[] v = encoder.encode(PlayState.of(Map.of(
                "down", 2, "distance", 5, "yard_line", 85, "possession", 1,
                "home_score", 14, "away_score", 10)));

        assertThat(v).hasSize(20);
        assertThat(v[2]).isEqualTo(2f);
        assertThat(v[3]).isEqualTo(5f);
        assertThat(v[4]).isEqualTo(85f);
        assertThat(v[7]).isEqualTo(1f);
        assertThat(v[8]).isEqualTo(1f);
        assertThat(v[9]).isEqualTo(0f);
        assertThat(v[10]).isEqualTo(4f);
    }

    @Test
    void awayGoalToGoUsesTheMirroredYardLine() {
        // away offense at yard line 96 is 4 yards from the goal
        float[] v = encoder.encode(PlayState.of(Map.of(
                "down", 1, "distance", 4, "yard_line", 96, "possession", 0)));

        assertThat(v[8]).isEqualTo(1f);
        assertThat(v[9]).isEqualTo(1f);
    }

    @Test
    void homeGoalToGoNearZero() {
        float[] v = encoder.encode(PlayState.of(Map.of(
                "distance", 3, "yard_line", 3, "possession", 1)));

        assertThat(v[9]).isEqualTo(1f);
    }

    @Test
    void midfieldIsNotRedZone() {
        float[] v = encoder.encode(PlayState.of(Map.of("yard_line", 21)));

        assertThat(v[8]).isEqualTo(0f);
    }

    @Test
    void passesThroughClockFlagsAndTimeouts() {
        float[] v = encoder.encode(PlayState.of(Map.of(
                "quarter", 4, "clock", 95, "two_minute_warning", true,
                "timeouts_home", 2, "timeouts_away", 0,
                "home_score", 20, "away_score", 27)));

        assertThat(v[0]).isEqualTo(4f);
        assertThat(v[1]).isEqualTo(95f);
        assertThat(v[10]).isEqualTo(-7f);
        assertThat(v[11]).isEqualTo(1f);
        assertThat(v[12]).isEqualTo(2f);
        assertThat(v[13]).isEqualTo(0f);
    }

    @Test
    void emptyStateUsesDefaults() {
        float[] v = encoder.encode(null);

        assertThat(Arrays.copyOfRange(v, 0, 8)).containsExactly(1f, 900f, 1f, 10f, 50f, 0f, 0f, 0f);
        assertThat(v[12]).isEqualTo(3f);
        assertThat(v[13]).isEqualTo(3f);
        assertThat(Arrays.copyOfRange(v, 14, 20)).containsOnly(0f);
    }
}
