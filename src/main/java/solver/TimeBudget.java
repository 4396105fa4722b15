package solver;

import java.util.function.LongSupplier;

/**
 * Remaining solver time for one top-level comparison. An unlimited budget
 * never runs out and imposes no per-call timeout.
 */
public class TimeBudget {

    private final boolean limited;
    private final LongSupplier clock;
    private long remainingMillis;

    public TimeBudget(long remainingMillis, LongSupplier clock) {
        this.limited = remainingMillis > 0;
        this.remainingMillis = limited ? remainingMillis : 0;
        this.clock = clock;
    }

    /**
     * @param seconds configured SMT timeout; zero or negative means unlimited
     */
    public static TimeBudget ofSeconds(int seconds) {
        return new TimeBudget(seconds > 0 ? seconds * 1000L : 0, System::currentTimeMillis);
    }

    public static TimeBudget unlimited() {
        return new TimeBudget(0, System::currentTimeMillis);
    }

    public boolean isLimited() {
        return limited;
    }

    public long getRemainingMillis() {
        return remainingMillis;
    }

    public long now() {
        return clock.getAsLong();
    }

    /**
     * Deducts the time spent since {@code startMillis}.
     *
     * @throws OutOfTimeException when the spent time uses up the rest of the budget
     */
    public long charge(long startMillis) {
        long elapsed = Math.max(0, clock.getAsLong() - startMillis);
        if (!limited) {
            return elapsed;
        }
        if (elapsed >= remainingMillis) {
            remainingMillis = 0;
            throw new OutOfTimeException("SMT time budget exhausted after " + elapsed + "ms of solving");
        }
        remainingMillis -= elapsed;
        return elapsed;
    }

    @Override
    public String toString() {
        return limited ? "TimeBudget[" + remainingMillis + "ms]" : "TimeBudget[unlimited]";
    }
}
