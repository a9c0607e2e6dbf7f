package com.jobscheduler.core;

/**
 * Selection priority of a job. Used as a tie-break when picking due jobs,
 * never to preempt a job that is already running.
 *
 * <p>The weight is what gets persisted, so {@code ORDER BY priority DESC}
 * puts URGENT first.</p>
 */
public enum JobPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    URGENT(3);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Resolve a persisted weight back to a priority.
     *
     * @param weight the stored column value
     * @return the matching priority
     * @throws IllegalArgumentException if no priority has that weight
     */
    public static JobPriority fromWeight(int weight) {
        for (JobPriority priority : values()) {
            if (priority.weight == weight) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority weight: " + weight);
    }
}
