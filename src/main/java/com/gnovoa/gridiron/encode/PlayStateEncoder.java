package com.gnovoa.gridiron.encode;

import com.gnovoa.gridiron.coerce.FieldReader;
import com.gnovoa.gridiron.model.PlayState;
import com.gnovoa.gridiron.model.StatBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes the situation before a snap into a {@value TensorLayout#PLAY_STATE_WIDTH}-slot vector.
 *
 * <pre>
 *   [0]  quarter (default 1)
 *   [1]  clock, seconds left in the quarter (default 900)
 *   [2]  down (default 1)
 *   [3]  distance (default 10)
 *   [4]  yard line (default 50)
 *   [5]  home score
 *   [6]  away score
 *   [7]  possession, 1 home / 0 away
 *   [8]  red zone: yard line &lt;= 20 or &gt;= 80
 *   [9]  goal to go: distance &gt;= yards to the goal for the team in possession
 *   [10] score differential, home - away
 *   [11] two-minute warning
 *   [12] home timeouts (default 3)
 *   [13] away timeouts (default 3)
 *   [14..19] reserved
 * </pre>
 *
 * See {@link PlayState} for the yard-line convention.
 */
public final class PlayStateEncoder {

    private static final Logger log = LoggerFactory.getLogger(PlayStateEncoder.class);

    public int width() {
        return TensorLayout.PLAY_STATE_WIDTH;
    }

    public float[] encode(PlayState state) {
        return encodeDetailed(state).vector();
    }

    /**
     * @param state play situation; null encodes as an empty situation (all defaults)
     * @return result whose vector has length {@link #width()}
     */
    public EncodingResult encodeDetailed(PlayState state) {
        StatBlock p = state == null ? StatBlock.EMPTY : state.data();
        try {
            FieldReader reader = new FieldReader();
            float[] v = new float[width()];

            float distance = reader.number(p, "distance", 10f);
            float yardLine = reader.number(p, "yard_line", 50f);
            float homeScore = reader.number(p, "home_score");
            float awayScore = reader.number(p, "away_score");
            float possession = reader.number(p, "possession");

            v[0] = reader.number(p, "quarter", 1f);
            v[1] = reader.number(p, "clock", 900f);
            v[2] = reader.number(p, "down", 1f);
            v[3] = distance;
            v[4] = yardLine;
            v[5] = homeScore;
            v[6] = awayScore;
            v[7] = possession;

            v[8] = (yardLine <= 20f || yardLine >= 80f) ? 1f : 0f;
            float toGoal = possession == 1f ? yardLine : 100f - yardLine;
            v[9] = distance >= toGoal ? 1f : 0f;
            v[10] = homeScore - awayScore;
            v[11] = reader.flag(p, "two_minute_warning", false);
            v[12] = reader.number(p, "timeouts_home", 3f);
            v[13] = reader.number(p, "timeouts_away", 3f);

            return EncodingResult.from(v, reader);
        } catch (RuntimeException e) {
            log.warn("Play state could not be encoded; substituting a zero vector", e);
            return EncodingResult.failure(width(), e.toString());
        }
    }
}
