package io.reactormesh.scheduler;

import io.reactormesh.model.MutexQueueEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Waiting units of one mutex group, as a heap on effective priority. The heap is only
 * re-keyed when it is consulted in a cycle it has not seen yet.
 */
final class MutexQueue {
    static final Comparator<MutexQueueEntry> ORDER = Comparator
            .comparingDouble(MutexQueueEntry::effectivePriority).reversed()
            .thenComparingLong(MutexQueueEntry::enqueuedAtMs)
            .thenComparingLong(MutexQueueEntry::registrationSeq);

    private final String group;
    private PriorityQueue<MutexQueueEntry> heap;
    private long rekeyedInCycle;

    MutexQueue(String group) {
        this.group = group;
        this.heap = new PriorityQueue<>(ORDER);
        this.rekeyedInCycle = -1L;
    }

    String group() {
        return group;
    }

    void add(MutexQueueEntry entry) {
        heap.add(entry);
    }

    boolean contains(String unitId) {
        for (MutexQueueEntry entry : heap) {
            if (entry.unitId().equals(unitId)) {
                return true;
            }
        }
        return false;
    }

    boolean remove(String unitId) {
        return heap.removeIf(entry -> entry.unitId().equals(unitId));
    }

    MutexQueueEntry peek(long cycleId, long nowMs, StarvationPolicy policy, int groupMaxPriority) {
        rekey(cycleId, nowMs, policy, groupMaxPriority);
        return heap.peek();
    }

    int size() {
        return heap.size();
    }

    boolean isEmpty() {
        return heap.isEmpty();
    }

    List<MutexQueueEntry> entries() {
        List<MutexQueueEntry> out = new ArrayList<>(heap);
        out.sort(ORDER);
        return out;
    }

    private void rekey(long cycleId, long nowMs, StarvationPolicy policy, int groupMaxPriority) {
        if (cycleId == rekeyedInCycle || heap.isEmpty()) {
            rekeyedInCycle = cycleId;
            return;
        }
        PriorityQueue<MutexQueueEntry> next = new PriorityQueue<>(Math.max(1, heap.size()), ORDER);
        for (MutexQueueEntry entry : heap) {
            next.add(entry.withEffectivePriority(policy.effectivePriority(entry, nowMs, groupMaxPriority)));
        }
        heap = next;
        rekeyedInCycle = cycleId;
    }
}
