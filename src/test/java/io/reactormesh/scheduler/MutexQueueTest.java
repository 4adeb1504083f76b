package io.reactormesh.scheduler;

import io.reactormesh.model.MutexQueueEntry;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MutexQueueTest {
    private final StarvationPolicy policy = new StarvationPolicy(1_000L, 500L, 1.0d);

    private static MutexQueueEntry entry(String unitId, long enqueuedAtMs, int priority, long registrationSeq) {
        return new MutexQueueEntry(unitId, "g", enqueuedAtMs, priority, registrationSeq, priority);
    }

    @Test
    void effectivePriorityGrowsWithWaitAndIsCapped() {
        MutexQueueEntry low = entry("low", 0L, 1, 1L);

        Assertions.assertEquals(1.0d, policy.effectivePriority(low, 1_000L, 10));
        Assertions.assertEquals(2.0d, policy.effectivePriority(low, 1_500L, 10));
        Assertions.assertEquals(5.0d, policy.effectivePriority(low, 3_000L, 10));
        Assertions.assertTrue(policy.effectivePriority(low, 3_001L, 10) > policy.effectivePriority(low, 3_000L, 10));
        Assertions.assertEquals(11.0d, policy.effectivePriority(low, 1_000_000L, 10));
    }

    @Test
    void headFollowsPriorityThenWaitThenRegistration() {
        MutexQueue queue = new MutexQueue("g");
        queue.add(entry("b", 10L, 5, 2L));
        queue.add(entry("a", 10L, 5, 1L));
        queue.add(entry("old", 5L, 5, 3L));
        queue.add(entry("low", 0L, 1, 4L));

        for (String expected : List.of("old", "a", "b", "low")) {
            MutexQueueEntry head = queue.peek(1L, 20L, policy, 5);
            Assertions.assertEquals(expected, head.unitId());
            Assertions.assertTrue(queue.remove(head.unitId()));
        }
        Assertions.assertTrue(queue.isEmpty());
    }

    @Test
    void starvedEntryOvertakesFreshHigherPriorityOnlyAfterRekey() {
        MutexQueue queue = new MutexQueue("g");
        queue.add(entry("starved", 0L, 1, 1L));
        Assertions.assertEquals("starved", queue.peek(1L, 0L, policy, 10).unitId());

        queue.add(entry("fresh", 9_000L, 10, 2L));
        // Same cycle: no re-key, the starved entry still carries its static priority.
        Assertions.assertEquals("fresh", queue.peek(1L, 9_000L, policy, 10).unitId());

        MutexQueueEntry head = queue.peek(2L, 9_000L, policy, 10);
        Assertions.assertEquals("starved", head.unitId());
        Assertions.assertEquals(11.0d, head.effectivePriority());
    }

    @Test
    void removeAndContainsWorkByUnitId() {
        MutexQueue queue = new MutexQueue("g");
        queue.add(entry("a", 0L, 1, 1L));
        queue.add(entry("b", 0L, 2, 2L));

        Assertions.assertTrue(queue.contains("a"));
        Assertions.assertTrue(queue.remove("a"));
        Assertions.assertFalse(queue.contains("a"));
        Assertions.assertFalse(queue.remove("a"));
        Assertions.assertEquals(1, queue.size());
        Assertions.assertEquals("b", queue.entries().get(0).unitId());
    }
}
