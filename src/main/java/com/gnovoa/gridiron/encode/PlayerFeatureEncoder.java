package com.gnovoa.gridiron.encode;

import com.gnovoa.gridiron.coerce.FieldReader;
import com.gnovoa.gridiron.model.PlayerRecord;
import com.gnovoa.gridiron.model.SeasonSlot;
import com.gnovoa.gridiron.model.StatBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes one player record into a fixed-width vector laid out by {@link PlayerSection}.
 *
 * <p>Missing numbers read as 0, text fields (identity, team names) are hashed with
 * {@link com.gnovoa.gridiron.coerce.Coercion#categoricalCode(String, int)}, and slots past the last
 * section stay 0.
 *
 * <p>Encoding never throws. A record that cannot be encoded at all comes back as a zero vector of
 * full width with status {@link EncodingStatus#STRUCTURAL_FAILURE}, and the failure is logged.
 */
public final class PlayerFeatureEncoder {

    private static final Logger log = LoggerFactory.getLogger(PlayerFeatureEncoder.class);

    // College career blocks
    static final String[] COLLEGE_TENURE = {
            "seasons", "first_season_school", "last_season_school",
            "first_school_seasons", "last_school_seasons"
    };
    static final String[] COLLEGE_PASSING = {
            "completions", "attempts", "yards", "touchdowns", "interceptions"
    };
    static final String[] COLLEGE_RUSHING = {"attempts", "yards", "touchdowns"};
    static final String[] COLLEGE_RECEIVING = {"receptions", "yards", "touchdowns"};
    static final String[] COLLEGE_DEFENSE = {
            "tackles", "sacks", "interceptions", "int_yards", "int_td", "pd",
            "fr", "fr_yards", "ff", "tfl", "qb_hits"
    };
    static final String[] COLLEGE_KICKING = {"fgm", "fga", "xpm", "xpa", "punts", "punt_yards"};
    static final String[] COLLEGE_TEAM = {
            "pass_completions", "pass_attempts", "pass_yards", "pass_td",
            "rush_attempts", "rush_yards", "rush_td", "total_plays",
            "pass_1d", "rush_1d", "pen_1d", "penalties", "pen_yards", "fumbles", "interceptions"
    };

    // NFL career blocks
    static final String[] NFL_BASIC = {"seasons_played", "games_played", "games_started"};
    static final String[] NFL_PASSING = {
            "record", "completions", "attempts", "yards", "touchdowns", "interceptions",
            "first_downs", "longest", "sacked", "4qc", "gwd"
    };
    static final String[] NFL_RUSHING = {"attempts", "yards", "touchdowns", "first_downs", "longest"};
    static final String[] NFL_RECEIVING = {
            "targets", "receptions", "yards", "touchdowns", "first_downs", "longest"
    };
    static final String[] NFL_DEFENSE = {
            "interceptions", "int_yards", "int_td", "int_longest", "pd", "ff", "fumbles",
            "fr", "fr_yards", "fr_td", "sacks", "solo_tackles", "assisted_tackles", "tfl", "qb_hits"
    };
    static final String[] NFL_KICKING = {
            "fga_0_19", "fgm_0_19", "fga_20_29", "fgm_20_29", "fga_30_39", "fgm_30_39",
            "fga_40_49", "fgm_40_49", "fga_50_plus", "fgm_50_plus",
            "longest", "xpa", "xpm", "punts", "punt_yards"
    };
    static final String[] NFL_TEAM_PERFORMANCE = {
            "off_points", "off_yards", "off_plays", "off_turnovers", "off_fumbles", "off_1d",
            "pass_cmp", "pass_att", "pass_yds", "pass_td", "rush_att", "rush_yds", "rush_td",
            "penalties", "pen_yards",
            "def_points", "def_yards", "def_plays", "def_turnovers", "def_fumbles", "def_1d",
            "def_pass_cmp", "def_pass_att", "def_pass_yds", "def_pass_td",
            "def_rush_att", "def_rush_yds", "def_rush_td", "opp_penalties", "opp_pen_yards"
    };

    static final String[] COMBINE_MEASUREMENTS = {
            "height", "weight", "forty", "bench", "broad_jump", "shuttle", "three_cone", "vertical"
    };

    private final TensorLayout layout;

    public PlayerFeatureEncoder(TensorLayout layout) {
        this.layout = layout;
    }

    /** @return width of every vector this encoder produces */
    public int width() {
        return layout.playerWidth();
    }

    /**
     * Encodes a player.
     *
     * @param player player record; null yields a zero vector
     * @return vector of length {@link #width()}
     */
    public float[] encode(PlayerRecord player) {
        return encodeDetailed(player).vector();
    }

    /**
     * Encodes a player and reports whether defaults were substituted or the record failed outright.
     *
     * @param player player record; null is a structural failure
     * @return result whose vector has length {@link #width()}
     */
    public EncodingResult encodeDetailed(PlayerRecord player) {
        if (player == null) {
            log.warn("Null player record; substituting a zero vector");
            return EncodingResult.failure(width(), "player record is null");
        }
        try {
            FieldReader reader = new FieldReader();
            float[] v = new float[width()];

            rosterInfo(player, reader, v);
            combine(player.combine(), reader, v);
            college(player.college(), reader, v);
            nflCareer(player.nflCareer(), reader, v);
            season(player.seasonal(SeasonSlot.LAST), reader, v, PlayerSection.LAST_SEASON, true);
            season(player.seasonal(SeasonSlot.WORST), reader, v, PlayerSection.WORST_SEASON, true);
            season(player.seasonal(SeasonSlot.BEST), reader, v, PlayerSection.BEST_SEASON, true);
            season(player.seasonal(SeasonSlot.AVERAGE), reader, v, PlayerSection.AVERAGE_SEASON, false);

            return EncodingResult.from(v, reader);
        } catch (RuntimeException e) {
            log.warn("Player record could not be encoded; substituting a zero vector", e);
            return EncodingResult.failure(width(), e.toString());
        }
    }

    private void rosterInfo(PlayerRecord player, FieldReader reader, float[] v) {
        int o = PlayerSection.ROSTER_INFO.offset();
        StatBlock data = player.data();
        StatBlock draft = player.draftInfo();

        v[o]     = reader.code(data, "identity", layout.identityModulus());
        v[o + 1] = reader.position(data, "position");
        v[o + 2] = reader.number(data, "roster_tier");
        v[o + 3] = reader.code(draft, "team", layout.teamModulus());
        v[o + 4] = reader.number(draft, "year");
        v[o + 5] = reader.number(draft, "pick");
        v[o + 6] = reader.number(data, "roster_season");
        v[o + 7] = reader.code(data, "current_team", layout.teamModulus());
        v[o + 8] = reader.number(data, "age");
    }

    // 10 measured slots, last 3 of the section reserved
    private void combine(StatBlock combine, FieldReader reader, float[] v) {
        int o = PlayerSection.COMBINE.offset();
        v[o]     = reader.number(combine, "year");
        v[o + 1] = reader.position(combine, "position");
        reader.numbers(combine, COMBINE_MEASUREMENTS, v, o + 2);
    }

    // 63 of 64 slots used
    private void college(StatBlock college, FieldReader reader, float[] v) {
        int o = PlayerSection.COLLEGE_CAREER.offset();
        o = fill(college, COLLEGE_TENURE, reader, v, o);
        o = fill(college.block("passing"), COLLEGE_PASSING, reader, v, o);
        o = fill(college.block("rushing"), COLLEGE_RUSHING, reader, v, o);
        o = fill(college.block("receiving"), COLLEGE_RECEIVING, reader, v, o);
        o = fill(college.block("defense"), COLLEGE_DEFENSE, reader, v, o);
        o = fill(college.block("kicking"), COLLEGE_KICKING, reader, v, o);
        o = fill(college.block("team"), COLLEGE_TEAM, reader, v, o);
        fill(college.block("opp"), COLLEGE_TEAM, reader, v, o);
    }

    // 85 of 116 slots used; the tail stays 0
    private void nflCareer(StatBlock nfl, FieldReader reader, float[] v) {
        int o = PlayerSection.NFL_CAREER.offset();
        o = fill(nfl, NFL_BASIC, reader, v, o);
        o = fill(nfl.block("passing"), NFL_PASSING, reader, v, o);
        o = fill(nfl.block("rushing"), NFL_RUSHING, reader, v, o);
        o = fill(nfl.block("receiving"), NFL_RECEIVING, reader, v, o);
        o = fill(nfl.block("defense"), NFL_DEFENSE, reader, v, o);
        o = fill(nfl.block("kicking"), NFL_KICKING, reader, v, o);
        fill(nfl.block("team_performance"), NFL_TEAM_PERFORMANCE, reader, v, o);
    }

    /*
     * Only the team code and games played/started are read. The individual per-season detail that
     * fills the rest of the section is not collected yet and stays 0.
     */
    private void season(StatBlock season, FieldReader reader, float[] v, PlayerSection section, boolean withTeam) {
        int o = section.offset();
        if (withTeam) {
            v[o++] = reader.code(season, "team", layout.teamModulus());
        }
        v[o]     = reader.number(season, "games_played");
        v[o + 1] = reader.number(season, "games_started");
    }

    private static int fill(StatBlock block, String[] keys, FieldReader reader, float[] v, int offset) {
        reader.numbers(block, keys, v, offset);
        return offset + keys.length;
    }
}
