package org.energybench.leaderboard.pipeline;

/**
 * States of one view render, in the only order they can be reached.
 */
public enum PipelineStage {
    RAW,
    NORMALIZED,
    AGGREGATED,
    RANKED,
    FILTERED,
    PROJECTED,
    SORTED;

    /**
     * Whether a render in this stage may move to {@code next}. Transitions are strictly
     * forward by one step, except that ranking is optional.
     */
    public boolean canAdvanceTo(PipelineStage next) {
        if (next.ordinal() == ordinal() + 1) {
            return true;
        }
        return this == AGGREGATED && next == FILTERED;
    }
}
