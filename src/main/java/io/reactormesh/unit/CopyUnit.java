package io.reactormesh.unit;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactormesh.model.Snapshot;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mirrors {@code source} into {@code target} whenever the two differ.
 */
public final class CopyUnit implements Unit {
    private final String source;
    private final String target;

    public CopyUnit(String source, String target) {
        if (source == null || source.isBlank() || target == null || target.isBlank()) {
            throw new IllegalArgumentException("copy unit needs source and target keys");
        }
        if (source.equals(target)) {
            throw new IllegalArgumentException("copy unit source and target must differ: " + source);
        }
        this.source = source;
        this.target = target;
    }

    public List<String> interests() {
        return List.of(source, target);
    }

    @Override
    public boolean trigger(Snapshot snapshot) {
        Optional<JsonNode> value = snapshot.value(source);
        return value.isPresent() && !Objects.equals(value.get(), snapshot.value(target).orElse(null));
    }

    @Override
    public void act(MeshHandle mesh) {
        Optional<JsonNode> value = mesh.read(source);
        if (value.isPresent()) {
            mesh.write(target, value.get());
        }
    }
}
