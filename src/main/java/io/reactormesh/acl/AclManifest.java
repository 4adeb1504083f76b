package io.reactormesh.acl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.reactormesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * On-disk form of {@code acl.json}:
 * <pre>
 * {"namespaces":[{"prefix":"content","readers":["*"],"writers":["publisher"],"readOnlyForever":false}]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AclManifest(List<Namespace> namespaces) {
    public AclManifest {
        namespaces = copyKeepingNulls(namespaces);
    }

    public static AclManifest load(Path file) {
        if (file == null || !Files.exists(file)) {
            throw new IllegalArgumentException("ACL manifest not found: " + file);
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), AclManifest.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read ACL manifest: " + file, e);
        }
    }

    public void save(Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Jsons.mapper().writeValue(file.toFile(), this);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write ACL manifest: " + file, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Namespace(String prefix, List<String> readers, List<String> writers, boolean readOnlyForever) {
        public Namespace {
            readers = copyKeepingNulls(readers);
            writers = copyKeepingNulls(writers);
        }
    }

    // Null entries survive so validate() can report them.
    private static <T> List<T> copyKeepingNulls(List<T> items) {
        return items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }
}
