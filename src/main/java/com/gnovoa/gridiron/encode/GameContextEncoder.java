package com.gnovoa.gridiron.encode;

import com.gnovoa.gridiron.coerce.FieldReader;
import com.gnovoa.gridiron.model.GameContext;
import com.gnovoa.gridiron.model.StatBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes game metadata into a {@value TensorLayout#CONTEXT_WIDTH}-slot vector.
 *
 * <pre>
 *   [0]      temperature (default 70)
 *   [1]      dome
 *   [2]      wind
 *   [3]      week
 *   [4]      season (default 2024)
 *   [5..8]   home wins, home losses, away wins, away losses
 *   [9]      playoff
 *   [10..14] weather mentions clear, cloudy, rain, snow, fog
 *   [15..16] surface mentions grass, turf
 *   [17]     kickoff hour (default 13)
 *   [18..49] reserved
 * </pre>
 *
 * Weather and surface flags are independent substring matches on the lower-cased description: "rain
 * and fog" sets two flags, "overcast" sets none.
 */
public final class GameContextEncoder {

    private static final Logger log = LoggerFactory.getLogger(GameContextEncoder.class);

    static final String[] WEATHER_KEYWORDS = {"clear", "cloudy", "rain", "snow", "fog"};
    static final String[] SURFACE_KEYWORDS = {"grass", "turf"};

    static final int WEATHER_OFFSET = 10;
    static final int SURFACE_OFFSET = 15;
    static final int KICKOFF_HOUR = 17;

    public int width() {
        return TensorLayout.CONTEXT_WIDTH;
    }

    public float[] encode(GameContext context) {
        return encodeDetailed(context).vector();
    }

    /**
     * @param context game metadata; null encodes as an empty context (all defaults)
     * @return result whose vector has length {@link #width()}
     */
    public EncodingResult encodeDetailed(GameContext context) {
        StatBlock g = context == null ? StatBlock.EMPTY : context.data();
        try {
            FieldReader reader = new FieldReader();
            float[] v = new float[width()];

            v[0] = reader.number(g, "temperature", 70f);
            v[1] = reader.flag(g, "dome", false);
            v[2] = reader.number(g, "wind");
            v[3] = reader.number(g, "week");
            v[4] = reader.number(g, "season", 2024f);
            v[5] = reader.number(g, "home_wins");
            v[6] = reader.number(g, "home_losses");
            v[7] = reader.number(g, "away_wins");
            v[8] = reader.number(g, "away_losses");
            v[9] = reader.flag(g, "playoff", false);

            keywordFlags(reader.lowerText(g, "weather"), WEATHER_KEYWORDS, v, WEATHER_OFFSET);
            keywordFlags(reader.lowerText(g, "surface"), SURFACE_KEYWORDS, v, SURFACE_OFFSET);

            v[KICKOFF_HOUR] = reader.number(g, "kickoff_hour", 13f);

            return EncodingResult.from(v, reader);
        } catch (RuntimeException e) {
            log.warn("Game context could not be encoded; substituting a zero vector", e);
            return EncodingResult.failure(width(), e.toString());
        }
    }

    private static void keywordFlags(String text, String[] keywords, float[] v, int offset) {
        for (int i = 0; i < keywords.length; i++) {
            v[offset + i] = text.contains(keywords[i]) ? 1f : 0f;
        }
    }
}
