package autowarm.engine.retry;

/**
 * Configured delay window, in whole minutes, before a failed task is retried.
 */
public record BackoffWindow(int minMinutes, int maxMinutes) {

    public static final BackoffWindow DEFAULT = new BackoffWindow(30, 90);

    /** Lower bound, never below one minute */
    public int effectiveMin() {
        return Math.max(1, minMinutes);
    }

    /** Upper bound, never below the effective lower bound */
    public int effectiveMax() {
        return Math.max(effectiveMin(), maxMinutes);
    }

    @Override
    public String toString() {
        return "[" + minMinutes + ".." + maxMinutes + "]min";
    }
}
