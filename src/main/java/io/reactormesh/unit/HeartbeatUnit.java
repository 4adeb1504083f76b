package io.reactormesh.unit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reactormesh.model.Snapshot;
import io.reactormesh.util.Jsons;

import java.util.Optional;

/**
 * Temporal unit: writes the snapshot clock and a beat counter to {@code key}. Pacing
 * comes from the unit's cooldown.
 */
public final class HeartbeatUnit implements Unit {
    private final String key;

    public HeartbeatUnit(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("heartbeat unit needs a key");
        }
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public boolean trigger(Snapshot snapshot) {
        return true;
    }

    @Override
    public void act(MeshHandle mesh) {
        Optional<JsonNode> previous = mesh.read(key);
        long beat = previous.map(v -> v.path("beat").asLong(0L)).orElse(0L) + 1L;
        ObjectNode next = Jsons.mapper().createObjectNode();
        next.put("at", mesh.snapshot().capturedAt().toString());
        next.put("beat", beat);
        next.put("cycle", mesh.cycleId());
        mesh.write(key, next);
    }
}
