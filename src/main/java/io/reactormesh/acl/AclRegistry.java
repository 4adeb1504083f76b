package io.reactormesh.acl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Namespace prefix to reader/writer sets. A key is governed by the longest prefix among
 * its dot-separated ancestors (the empty prefix governs everything); keys with no
 * governing namespace are closed to every unit.
 */
public final class AclRegistry {
    public static final String ANY = "*";
    public static final String INGEST_PRINCIPAL = "@ingest";

    private final Map<String, Rule> rules;

    private AclRegistry(Map<String, Rule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static AclRegistry permissive() {
        Map<String, Rule> rules = new HashMap<>();
        rules.put("", new Rule("", Set.of(ANY), Set.of(ANY), false));
        return new AclRegistry(rules);
    }

    public static AclRegistry fromManifest(AclManifest manifest) {
        List<String> problems = validate(manifest);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid ACL manifest: " + String.join("; ", problems));
        }
        Map<String, Rule> rules = new HashMap<>();
        for (AclManifest.Namespace ns : manifest.namespaces()) {
            String prefix = normalizePrefix(ns.prefix());
            rules.put(prefix, new Rule(prefix, trimAll(ns.readers()), trimAll(ns.writers()), ns.readOnlyForever()));
        }
        return new AclRegistry(rules);
    }

    /**
     * Every problem in the manifest, empty when it is valid.
     */
    public static List<String> validate(AclManifest manifest) {
        List<String> problems = new ArrayList<>();
        if (manifest == null) {
            problems.add("manifest is missing");
            return problems;
        }
        if (manifest.namespaces().isEmpty()) {
            problems.add("manifest declares no namespaces");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (AclManifest.Namespace ns : manifest.namespaces()) {
            if (ns == null || ns.prefix() == null) {
                problems.add("namespace without prefix");
                continue;
            }
            String prefix = normalizePrefix(ns.prefix());
            String label = prefix.isEmpty() ? "<root>" : prefix;
            if (!seen.add(prefix)) {
                problems.add("duplicate namespace " + label);
            }
            if (containsBlank(ns.readers()) || containsBlank(ns.writers())) {
                problems.add("blank unit id in namespace " + label);
            }
            if (ns.readOnlyForever() && !ns.writers().isEmpty()) {
                problems.add("read-only-forever namespace " + label + " declares writers");
            }
            if (!ns.readOnlyForever() && ns.writers().isEmpty()) {
                problems.add("namespace " + label + " has no writers and is not marked readOnlyForever");
            }
        }
        return problems;
    }

    public boolean canRead(String unitId, String key) {
        return governing(key).map(rule -> rule.allowsRead(unitId)).orElse(false);
    }

    public boolean canWrite(String unitId, String key) {
        return governing(key).map(rule -> rule.allowsWrite(unitId)).orElse(false);
    }

    /**
     * External ingest may write anything except an already seeded key in a
     * read-only-forever namespace.
     */
    public boolean canIngest(String key, boolean exists) {
        Optional<Rule> rule = governing(key);
        return rule.isEmpty() || !rule.get().readOnlyForever() || !exists;
    }

    public Optional<Rule> governing(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String candidate = key;
        while (true) {
            Rule rule = rules.get(candidate);
            if (rule != null) {
                return Optional.of(rule);
            }
            int dot = candidate.lastIndexOf('.');
            if (dot < 0) {
                break;
            }
            candidate = candidate.substring(0, dot);
        }
        return Optional.ofNullable(rules.get(""));
    }

    public List<Rule> rules() {
        List<Rule> out = new ArrayList<>(rules.values());
        out.sort((a, b) -> a.prefix().compareTo(b.prefix()));
        return out;
    }

    static String normalizePrefix(String raw) {
        String prefix = raw == null ? "" : raw.trim();
        if (prefix.endsWith("*")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        while (prefix.endsWith(".")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix;
    }

    private static boolean containsBlank(List<String> ids) {
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> trimAll(List<String> ids) {
        Set<String> out = new LinkedHashSet<>();
        for (String id : ids) {
            out.add(id.trim());
        }
        return Collections.unmodifiableSet(out);
    }

    public record Rule(String prefix, Set<String> readers, Set<String> writers, boolean readOnlyForever) {
        boolean allowsRead(String unitId) {
            return readers.contains(ANY) || readers.contains(unitId);
        }

        boolean allowsWrite(String unitId) {
            if (readOnlyForever) {
                return false;
            }
            return writers.contains(ANY) || writers.contains(unitId);
        }
    }
}
