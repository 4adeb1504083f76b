package io.reactormesh.scheduler;

import io.reactormesh.model.MutexQueueEntry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Ownership of mutex groups. A group is held from admission until the worker running
 * the owner returns, so at most one execution per group is ever in flight. Not
 * thread-safe; the scheduler calls it under its own lock.
 */
final class MutexArbiter {
    private final Map<String, GroupState> groups = new HashMap<>();

    boolean isBusy(String group) {
        GroupState state = groups.get(group);
        return state != null && state.owner != null;
    }

    Optional<Execution> owner(String group) {
        GroupState state = groups.get(group);
        return state == null ? Optional.empty() : Optional.ofNullable(state.owner);
    }

    void claim(String group, Execution execution) {
        GroupState state = state(group);
        if (state.owner != null) {
            throw new IllegalStateException("mutex group " + group + " already held by " + state.owner.unitId());
        }
        state.owner = execution;
    }

    void release(String group, Execution execution) {
        GroupState state = groups.get(group);
        if (state != null && state.owner == execution) {
            state.owner = null;
        }
    }

    MutexQueue queue(String group) {
        return state(group).queue;
    }

    MutexQueueEntry interrupter(String group) {
        GroupState state = groups.get(group);
        return state == null ? null : state.interrupter;
    }

    boolean setInterrupter(String group, MutexQueueEntry entry) {
        GroupState state = state(group);
        if (state.interrupter != null) {
            return false;
        }
        state.interrupter = entry;
        return true;
    }

    void clearInterrupter(String group) {
        GroupState state = groups.get(group);
        if (state != null) {
            state.interrupter = null;
        }
    }

    boolean isWaiting(String unitId) {
        for (GroupState state : groups.values()) {
            if (state.interrupter != null && state.interrupter.unitId().equals(unitId)) {
                return true;
            }
            if (state.queue.contains(unitId)) {
                return true;
            }
        }
        return false;
    }

    void purge(String unitId) {
        for (GroupState state : groups.values()) {
            if (state.interrupter != null && state.interrupter.unitId().equals(unitId)) {
                state.interrupter = null;
            }
            state.queue.remove(unitId);
        }
    }

    Iterable<String> groupsWithWaiting() {
        TreeMap<String, GroupState> sorted = new TreeMap<>();
        for (Map.Entry<String, GroupState> e : groups.entrySet()) {
            if (e.getValue().interrupter != null || !e.getValue().queue.isEmpty()) {
                sorted.put(e.getKey(), e.getValue());
            }
        }
        return sorted.keySet();
    }

    Map<String, Integer> queueDepths() {
        Map<String, Integer> out = new TreeMap<>();
        for (Map.Entry<String, GroupState> e : groups.entrySet()) {
            GroupState state = e.getValue();
            out.put(e.getKey(), state.queue.size() + (state.interrupter == null ? 0 : 1));
        }
        return out;
    }

    Map<String, String> owners() {
        Map<String, String> out = new TreeMap<>();
        for (Map.Entry<String, GroupState> e : groups.entrySet()) {
            if (e.getValue().owner != null) {
                out.put(e.getKey(), e.getValue().owner.unitId());
            }
        }
        return out;
    }

    private GroupState state(String group) {
        return groups.computeIfAbsent(group, MutexArbiter.GroupState::new);
    }

    private static final class GroupState {
        private final MutexQueue queue;
        private Execution owner;
        private MutexQueueEntry interrupter;

        private GroupState(String group) {
            this.queue = new MutexQueue(group);
        }
    }
}
