package io.reactormesh.unit;

import io.reactormesh.model.ExecutionPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Static registration data of a unit. {@code mutexGroup} is null for units that never
 * contend; {@code timeout} null means the engine default applies.
 */
public record UnitDescriptor(
        String id,
        int priority,
        Duration cooldown,
        String mutexGroup,
        ExecutionPolicy executionPolicy,
        boolean critical,
        List<String> interests,
        boolean temporal,
        Duration timeout,
        Unit unit
) {
    public UnitDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("unit id cannot be empty");
        }
        id = id.trim();
        if (id.startsWith("@")) {
            throw new IllegalArgumentException("unit id cannot start with '@': " + id);
        }
        if (unit == null) {
            throw new IllegalArgumentException("unit implementation missing: " + id);
        }
        cooldown = cooldown == null || cooldown.isNegative() ? Duration.ZERO : cooldown;
        mutexGroup = mutexGroup == null || mutexGroup.isBlank() ? null : mutexGroup.trim();
        executionPolicy = executionPolicy == null ? ExecutionPolicy.QUEUE : executionPolicy;
        interests = interests == null ? List.of() : List.copyOf(interests);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("unit timeout must be positive: " + id);
        }
        if (!temporal && interests.isEmpty()) {
            throw new IllegalArgumentException("unit " + id + " declares no interests and is not temporal");
        }
    }

    public static Builder builder(String id, Unit unit) {
        return new Builder(id, unit);
    }

    public static final class Builder {
        private final String id;
        private final Unit unit;
        private int priority;
        private Duration cooldown = Duration.ZERO;
        private String mutexGroup;
        private ExecutionPolicy executionPolicy = ExecutionPolicy.QUEUE;
        private boolean critical;
        private List<String> interests = List.of();
        private boolean temporal;
        private Duration timeout;

        private Builder(String id, Unit unit) {
            this.id = id;
            this.unit = unit;
        }

        public Builder priority(int value) {
            this.priority = value;
            return this;
        }

        public Builder cooldown(Duration value) {
            this.cooldown = value;
            return this;
        }

        public Builder mutexGroup(String value) {
            this.mutexGroup = value;
            return this;
        }

        public Builder executionPolicy(ExecutionPolicy value) {
            this.executionPolicy = value;
            return this;
        }

        public Builder critical(boolean value) {
            this.critical = value;
            return this;
        }

        public Builder interests(String... keys) {
            this.interests = List.of(keys);
            return this;
        }

        public Builder interests(List<String> keys) {
            this.interests = keys;
            return this;
        }

        public Builder temporal(boolean value) {
            this.temporal = value;
            return this;
        }

        public Builder timeout(Duration value) {
            this.timeout = value;
            return this;
        }

        public UnitDescriptor build() {
            return new UnitDescriptor(id, priority, cooldown, mutexGroup, executionPolicy, critical,
                    interests, temporal, timeout, unit);
        }
    }
}
