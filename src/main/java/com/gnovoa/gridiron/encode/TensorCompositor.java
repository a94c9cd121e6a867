package com.gnovoa.gridiron.encode;

/**
 * Concatenates fixed-width vectors into game and play vectors.
 *
 * <pre>
 *   game = home roster | away roster | context
 *   play = game | play state
 * </pre>
 *
 * Inputs are copied unchanged. A wrong-length input is a caller defect and fails with {@link
 * TensorShapeException}.
 */
public final class TensorCompositor {

    private final TensorLayout layout;

    public TensorCompositor(TensorLayout layout) {
        this.layout = layout;
    }

    public TensorLayout layout() {
        return layout;
    }

    /**
     * @return vector of length {@link TensorLayout#gameWidth()}
     * @throws TensorShapeException if any input is null or has the wrong length
     */
    public float[] composeGame(float[] homeRoster, float[] awayRoster, float[] context) {
        TensorShapeException.check("home roster", homeRoster, layout.rosterWidth());
        TensorShapeException.check("away roster", awayRoster, layout.rosterWidth());
        TensorShapeException.check("game context", context, TensorLayout.CONTEXT_WIDTH);

        float[] game = new float[layout.gameWidth()];
        System.arraycopy(homeRoster, 0, game, 0, homeRoster.length);
        System.arraycopy(awayRoster, 0, game, layout.awayRosterOffset(), awayRoster.length);
        System.arraycopy(context, 0, game, layout.contextOffset(), context.length);
        return game;
    }

    /**
     * @return vector of length {@link TensorLayout#playWidth()}
     * @throws TensorShapeException if any input is null or has the wrong length
     */
    public float[] composePlay(float[] game, float[] playState) {
        TensorShapeException.check("game", game, layout.gameWidth());
        TensorShapeException.check("play state", playState, TensorLayout.PLAY_STATE_WIDTH);

        float[] play = new float[layout.playWidth()];
        System.arraycopy(game, 0, play, 0, game.length);
        System.arraycopy(playState, 0, play, layout.playStateOffset(), playState.length);
        return play;
    }
}
