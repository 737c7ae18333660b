package com.vibeblog.common.infra;

import java.util.List;

/**
 * Retry backoff computation over a fixed ladder of delays.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Fixed backoff ladder; the last step repeats for every further attempt.
     *
     * @param stepsMs delays in milliseconds, indexed by 1-based attempt
     */
    public record Ladder(List<Long> stepsMs) {

        /** 30s, 1min, 5min, 15min, 60min. */
        public static final Ladder ERROR_RETRY = new Ladder(List.of(
                30_000L,
                60_000L,
                5 * 60_000L,
                15 * 60_000L,
                60 * 60_000L));

        public Ladder {
            if (stepsMs == null || stepsMs.isEmpty()) {
                throw new IllegalArgumentException("backoff ladder needs at least one step");
            }
            stepsMs = List.copyOf(stepsMs);
        }

        public long maxMs() {
            return stepsMs.get(stepsMs.size() - 1);
        }
    }

    /**
     * Compute the delay for the given number of consecutive failures.
     *
     * @param ladder  backoff ladder
     * @param attempt 1-based failure count; {@code <= 0} means no delay
     * @return delay in milliseconds (capped at the ladder's last step)
     */
    public static long compute(Ladder ladder, int attempt) {
        if (attempt <= 0) {
            return 0;
        }
        int idx = Math.min(attempt - 1, ladder.stepsMs().size() - 1);
        return ladder.stepsMs().get(idx);
    }
}
