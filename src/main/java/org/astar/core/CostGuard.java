package org.astar.core;

/**
 * Numeric checks on values returned by caller-supplied nodes.
 *
 * <p>Admissibility of estimates is not checked; only NaN, infinite and negative values are rejected.</p>
 */
final class CostGuard {

    private CostGuard() {
    }

    /**
     * Returns {@code cost} if it is a usable edge cost.
     */
    static double checkEdgeCost(Object from, Object to, double cost) {
        if (!Double.isFinite(cost)) {
            throw new PathSearchException(
                    PathSearchException.REASON_NON_FINITE_COST,
                    "edge cost must be finite, got " + cost + " for " + from + " -> " + to
            );
        }
        if (cost < 0.0d) {
            throw new PathSearchException(
                    PathSearchException.REASON_NEGATIVE_COST,
                    "edge cost must be >= 0, got " + cost + " for " + from + " -> " + to
            );
        }
        return cost;
    }

    /**
     * Returns {@code cost} if the accumulated path cost to {@code to} is still finite.
     */
    static double checkPathCost(Object start, Object to, double cost) {
        if (!Double.isFinite(cost)) {
            throw new PathSearchException(
                    PathSearchException.REASON_NON_FINITE_COST,
                    "path cost overflowed to " + cost + " for " + start + " -> " + to
            );
        }
        return cost;
    }

    /**
     * Returns {@code estimate} if it is a usable heuristic value.
     */
    static double checkEstimate(Object from, Object goal, double estimate) {
        if (!Double.isFinite(estimate)) {
            throw new PathSearchException(
                    PathSearchException.REASON_NON_FINITE_ESTIMATE,
                    "estimated cost must be finite, got " + estimate + " for " + from + " -> " + goal
            );
        }
        if (estimate < 0.0d) {
            throw new PathSearchException(
                    PathSearchException.REASON_NEGATIVE_ESTIMATE,
                    "estimated cost must be >= 0, got " + estimate + " for " + from + " -> " + goal
            );
        }
        return estimate;
    }
}
