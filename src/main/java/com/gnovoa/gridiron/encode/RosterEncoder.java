package com.gnovoa.gridiron.encode;

import com.gnovoa.gridiron.model.PlayerRecord;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the roster grid: {@code rosterSize} rows of one player vector each, flattened row-major.
 *
 * <p>Rows follow input order (callers sort by depth chart, if they want one). Rows past the input
 * stay all-zero (the null player); input past the last row is dropped.
 */
public final class RosterEncoder {

    private static final Logger log = LoggerFactory.getLogger(RosterEncoder.class);

    private final TensorLayout layout;
    private final PlayerFeatureEncoder players;

    public RosterEncoder(TensorLayout layout, PlayerFeatureEncoder players) {
        this.layout = layout;
        this.players = players;
    }

    public int width() {
        return layout.rosterWidth();
    }

    /**
     * Encodes players into roster rows.
     *
     * @param roster players in row order; null reads as empty, null elements encode as zero rows
     * @return flattened grid of length {@link #width()}
     */
    public float[] encode(List<PlayerRecord> roster) {
        float[] grid = new float[width()];
        if (roster == null || roster.isEmpty()) return grid;

        int rows = Math.min(roster.size(), layout.rosterSize());
        for (int i = 0; i < rows; i++) {
            float[] row = players.encode(roster.get(i));
            System.arraycopy(row, 0, grid, i * layout.playerWidth(), layout.playerWidth());
        }

        if (roster.size() > rows) {
            log.debug("Roster of {} players truncated to {} rows", roster.size(), rows);
        } else {
            log.debug("Built roster tensor with {} players", rows);
        }
        return grid;
    }

    /**
     * Lays already-encoded player vectors into roster rows, with the same padding and truncation as
     * {@link #encode(List)}.
     *
     * @param playerVectors vectors in row order; null elements become null-player rows
     * @return flattened grid of length {@link #width()}
     * @throws TensorShapeException if a vector within the first {@code rosterSize} does not have
     *     the player width
     */
    public float[] assemble(List<float[]> playerVectors) {
        float[] grid = new float[width()];
        if (playerVectors == null) return grid;

        int rows = Math.min(playerVectors.size(), layout.rosterSize());
        for (int i = 0; i < rows; i++) {
            float[] row = playerVectors.get(i);
            if (row == null) continue;
            TensorShapeException.check("player", row, layout.playerWidth());
            System.arraycopy(row, 0, grid, i * layout.playerWidth(), layout.playerWidth());
        }
        return grid;
    }
}
