package org.astar.core;

/**
 * Per-search bounds for expansion work and frontier growth.
 *
 * <p>Non-positive bounds mean unbounded.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String PROP_MAX_EXPANDED = "astar.search.maxExpandedSteps";
    static final String PROP_MAX_FRONTIER = "astar.search.maxFrontierSize";

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED, UNBOUNDED);

    private final int maxExpandedSteps;
    private final int maxFrontierSize;

    private SearchBudget(int maxExpandedSteps, int maxFrontierSize) {
        this.maxExpandedSteps = normalizeBound(maxExpandedSteps);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static SearchBudget of(int maxExpandedSteps, int maxFrontierSize) {
        return new SearchBudget(maxExpandedSteps, maxFrontierSize);
    }

    public static SearchBudget unbounded() {
        return UNLIMITED;
    }

    /**
     * Loads bounds from the {@code astar.search.maxExpandedSteps} and
     * {@code astar.search.maxFrontierSize} system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                readBound(PROP_MAX_EXPANDED),
                readBound(PROP_MAX_FRONTIER)
        );
    }

    public int maxExpandedSteps() {
        return maxExpandedSteps;
    }

    public int maxFrontierSize() {
        return maxFrontierSize;
    }

    /**
     * Validates the number of expanded steps against the configured bound.
     */
    void checkExpandedSteps(int expandedSteps) {
        if (expandedSteps > maxExpandedSteps) {
            throw new PathSearchException(
                    PathSearchException.REASON_EXPANDED_EXCEEDED,
                    "expanded-step budget exceeded: " + expandedSteps + " > " + maxExpandedSteps
            );
        }
    }

    /**
     * Validates the frontier size against the configured bound.
     */
    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new PathSearchException(
                    PathSearchException.REASON_FRONTIER_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{" +
                "maxExpandedSteps=" + maxExpandedSteps +
                ", maxFrontierSize=" + maxFrontierSize +
                '}';
    }
}
