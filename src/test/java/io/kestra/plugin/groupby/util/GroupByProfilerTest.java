package io.kestra.plugin.groupby.util;

import io.kestra.plugin.groupby.util.GroupByProfiler.Phase;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;

class GroupByProfilerTest {
    @Test
    void timeReturnsTheWorkResult() {
        GroupByProfiler.reset();

        String result = GroupByProfiler.time(Phase.SORT, () -> "sorted");

        assertThat(result, is("sorted"));
        if (GroupByProfiler.isEnabled()) {
            assertThat(GroupByProfiler.nanos(Phase.SORT), greaterThanOrEqualTo(0L));
        } else {
            assertThat(GroupByProfiler.nanos(Phase.SORT), is(0L));
        }
    }

    @Test
    void timePropagatesFailures() {
        IllegalStateException exception = Assertions.assertThrows(
            IllegalStateException.class,
            () -> GroupByProfiler.time(Phase.REDUCE, () -> {
                throw new IllegalStateException("boom");
            })
        );

        assertThat(exception.getMessage(), is("boom"));
    }

    @Test
    void summaryListsEveryPhase() {
        GroupByProfiler.reset();

        String summary = GroupByProfiler.summary();

        if (!GroupByProfiler.isEnabled()) {
            assertThat(summary, is("normalize=0us sort=0us reduce=0us"));
        } else {
            assertThat(summary.startsWith("normalize="), is(true));
        }
    }
}
