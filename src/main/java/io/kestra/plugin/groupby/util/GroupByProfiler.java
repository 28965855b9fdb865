package io.kestra.plugin.groupby.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Per-thread phase timings, switched on with {@code -Dgroupby.profile=true}.
 */
public final class GroupByProfiler {
    private static final boolean ENABLED = Boolean.getBoolean("groupby.profile");
    private static final ThreadLocal<long[]> NANOS = ThreadLocal.withInitial(() -> new long[Phase.values().length]);

    public enum Phase {
        NORMALIZE,
        SORT,
        REDUCE
    }

    private GroupByProfiler() {
    }

    public static boolean isEnabled() {
        return ENABLED;
    }

    public static void reset() {
        if (ENABLED) {
            Arrays.fill(NANOS.get(), 0L);
        }
    }

    /**
     * Runs {@code work} and charges its wall time to {@code phase}, even when it throws.
     */
    public static <T> T time(Phase phase, Supplier<T> work) {
        if (!ENABLED) {
            return work.get();
        }
        long startNs = System.nanoTime();
        try {
            return work.get();
        } finally {
            NANOS.get()[phase.ordinal()] += System.nanoTime() - startNs;
        }
    }

    public static long nanos(Phase phase) {
        return ENABLED ? NANOS.get()[phase.ordinal()] : 0L;
    }

    /**
     * One-line report of every phase in microseconds, e.g. {@code normalize=12us sort=340us reduce=95us}.
     */
    public static String summary() {
        StringBuilder summary = new StringBuilder();
        for (Phase phase : Phase.values()) {
            if (summary.length() > 0) {
                summary.append(' ');
            }
            summary.append(phase.name().toLowerCase(Locale.ROOT)).append('=').append(nanos(phase) / 1_000).append("us");
        }
        return summary.toString();
    }
}
