package org.neuralchilli.planner.domain;

/**
 * Graph-derived inputs to the priority score. Dependency figures are already
 * normalized to [0,1]; any of them may be null.
 */
public record ScoreContext(
        Double dependencyDescendants,
        Double dependencyDemand,
        Double waitingDays
) {
    private static final ScoreContext EMPTY = new ScoreContext(null, null, null);

    public static ScoreContext empty() {
        return EMPTY;
    }
}
