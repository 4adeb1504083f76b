package io.reactormesh.acl;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class AclRegistryTest {

    private static AclManifest manifest() {
        return new AclManifest(List.of(
                new AclManifest.Namespace("content", List.of("*"), List.of("publisher"), false),
                new AclManifest.Namespace("content.drafts", List.of("editor"), List.of("editor"), false),
                new AclManifest.Namespace("config.seed", List.of("*"), List.of(), true)
        ));
    }

    @Test
    void longestNamespacePrefixGovernsAKey() {
        AclRegistry acl = AclRegistry.fromManifest(manifest());

        Assertions.assertTrue(acl.canWrite("publisher", "content.article.1"));
        Assertions.assertTrue(acl.canRead("anyone", "content.article.1"));
        Assertions.assertFalse(acl.canWrite("editor", "content.article.1"));

        Assertions.assertTrue(acl.canWrite("editor", "content.drafts.7"));
        Assertions.assertFalse(acl.canWrite("publisher", "content.drafts.7"));
        Assertions.assertFalse(acl.canRead("publisher", "content.drafts.7"));
        Assertions.assertEquals("content.drafts", acl.governing("content.drafts.7").orElseThrow().prefix());

        // "contentious" is not inside the "content" namespace.
        Assertions.assertTrue(acl.governing("contentious").isEmpty());
    }

    @Test
    void keysOutsideEveryNamespaceAreDenied() {
        AclRegistry acl = AclRegistry.fromManifest(manifest());

        Assertions.assertFalse(acl.canRead("publisher", "billing.invoice"));
        Assertions.assertFalse(acl.canWrite("publisher", "billing.invoice"));
        Assertions.assertTrue(AclRegistry.permissive().canWrite("anyone", "billing.invoice"));
    }

    @Test
    void readOnlyForeverNamespacesAcceptOnlyTheFirstIngest() {
        AclRegistry acl = AclRegistry.fromManifest(manifest());

        Assertions.assertFalse(acl.canWrite("publisher", "config.seed.region"));
        Assertions.assertTrue(acl.canRead("publisher", "config.seed.region"));
        Assertions.assertTrue(acl.canIngest("config.seed.region", false));
        Assertions.assertFalse(acl.canIngest("config.seed.region", true));
        Assertions.assertTrue(acl.canIngest("content.article.1", true));
    }

    @Test
    void validationListsEveryProblem() {
        AclManifest bad = new AclManifest(List.of(
                new AclManifest.Namespace("content", List.of("*"), List.of(), false),
                new AclManifest.Namespace("content.*", List.of("*"), List.of("w"), false),
                new AclManifest.Namespace("frozen", List.of("*"), List.of("w"), true),
                new AclManifest.Namespace("blank", List.of(" "), List.of("w"), false)
        ));

        List<String> problems = AclRegistry.validate(bad);

        Assertions.assertEquals(4, problems.size(), problems.toString());
        Assertions.assertTrue(problems.stream().anyMatch(p -> p.contains("no writers")));
        Assertions.assertTrue(problems.stream().anyMatch(p -> p.contains("duplicate namespace content")));
        Assertions.assertTrue(problems.stream().anyMatch(p -> p.contains("declares writers")));
        Assertions.assertTrue(problems.stream().anyMatch(p -> p.contains("blank unit id")));
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> AclRegistry.fromManifest(bad));
        Assertions.assertTrue(e.getMessage().contains("duplicate namespace"));
        Assertions.assertTrue(AclRegistry.validate(manifest()).isEmpty());
    }

    @Test
    void nullEntriesInAManifestFileAreReportedNotThrown() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-acl-");
        try {
            Path file = root.resolve("acl.json");
            Files.writeString(file, """
                    {"namespaces":[null,{"prefix":"content","readers":[null],"writers":["publisher"]}]}
                    """);

            AclManifest manifest = AclManifest.load(file);
            List<String> problems = AclRegistry.validate(manifest);

            Assertions.assertEquals(2, problems.size(), problems.toString());
            Assertions.assertTrue(problems.contains("namespace without prefix"));
            Assertions.assertTrue(problems.contains("blank unit id in namespace content"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> AclRegistry.fromManifest(manifest));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void manifestRoundTripsThroughJsonFile() throws Exception {
        Path root = Files.createTempDirectory("reactormesh-test-acl-");
        try {
            Path file = root.resolve("acl.json");
            manifest().save(file);

            AclRegistry acl = AclRegistry.fromManifest(AclManifest.load(file));

            Assertions.assertEquals(3, acl.rules().size());
            Assertions.assertTrue(acl.canWrite("editor", "content.drafts.1"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> AclManifest.load(root.resolve("missing.json")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
