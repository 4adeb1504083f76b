package io.reactormesh;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.reactormesh.config.EngineSettings;
import io.reactormesh.util.Jsons;

import java.util.Map;

public final class TestSettings {
    private TestSettings() {
    }

    /**
     * Defaults with the named record components replaced.
     */
    public static EngineSettings with(Map<String, Object> overrides) {
        ObjectNode node = Jsons.mapper().valueToTree(EngineSettings.defaults());
        overrides.forEach((field, value) -> node.set(field, Jsons.mapper().valueToTree(value)));
        try {
            return Jsons.mapper().treeToValue(node, EngineSettings.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("bad settings override: " + overrides, e);
        }
    }
}
