package io.reactormesh.unit;

import io.reactormesh.store.KeyPatterns;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public final class UnitRegistry {
    private final Map<String, RegisteredUnit> units = new ConcurrentHashMap<>();
    private final AtomicLong nextRegistrationSeq = new AtomicLong(0L);

    public String register(UnitDescriptor descriptor) {
        RegisteredUnit registered = new RegisteredUnit(descriptor, nextRegistrationSeq.incrementAndGet());
        RegisteredUnit existing = units.putIfAbsent(descriptor.id(), registered);
        if (existing != null) {
            throw new IllegalStateException("Unit already registered: " + descriptor.id());
        }
        return descriptor.id();
    }

    public Optional<RegisteredUnit> deregister(String unitId) {
        return Optional.ofNullable(units.remove(unitId));
    }

    public Optional<RegisteredUnit> findById(String unitId) {
        return Optional.ofNullable(units.get(unitId));
    }

    public RegisteredUnit require(String unitId) {
        RegisteredUnit unit = units.get(unitId);
        if (unit == null) {
            throw new IllegalArgumentException("Unknown unit: " + unitId);
        }
        return unit;
    }

    /**
     * Returns true when the flag actually changed.
     */
    public boolean setEnabled(String unitId, boolean enabled, String reason, long nowMs) {
        return setEnabled(require(unitId), enabled, reason, nowMs);
    }

    public boolean setEnabled(RegisteredUnit unit, boolean enabled, String reason, long nowMs) {
        synchronized (unit) {
            if (unit.enabled() == enabled) {
                return false;
            }
            if (enabled) {
                unit.enable();
            } else {
                unit.disable(reason == null || reason.isBlank() ? "manual" : reason, nowMs);
            }
            return true;
        }
    }

    /**
     * Marks every unit interested in one of {@code keys} for evaluation.
     */
    public void markDirty(Collection<String> keys, long commitSeq) {
        for (RegisteredUnit unit : units.values()) {
            for (String key : keys) {
                if (KeyPatterns.matchesAny(unit.descriptor().interests(), key)) {
                    unit.markDirty(commitSeq);
                    break;
                }
            }
        }
    }

    /**
     * All units in registration order.
     */
    public List<RegisteredUnit> ordered() {
        List<RegisteredUnit> out = new ArrayList<>(units.values());
        out.sort(Comparator.comparingLong(RegisteredUnit::registrationSeq));
        return out;
    }

    public int maxPriorityInGroup(String mutexGroup) {
        int max = Integer.MIN_VALUE;
        for (RegisteredUnit unit : units.values()) {
            if (mutexGroup.equals(unit.descriptor().mutexGroup())) {
                max = Math.max(max, unit.descriptor().priority());
            }
        }
        return max;
    }

    public int size() {
        return units.size();
    }
}
