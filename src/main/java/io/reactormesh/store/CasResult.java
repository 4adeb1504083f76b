package io.reactormesh.store;

/**
 * Result of a single-key compare-and-set: either the new version, or the version
 * that was actually found.
 */
public record CasResult(boolean committed, String key, long expectedVersion, long actualVersion, long newVersion) {
    static CasResult from(CommitResult commit, String key, long expectedVersion) {
        if (commit.committed()) {
            return new CasResult(true, key, expectedVersion, expectedVersion, commit.newVersions().get(key));
        }
        long actual = commit.conflicts().isEmpty() ? -1L : commit.conflicts().get(0).actualVersion();
        return new CasResult(false, key, expectedVersion, actual, -1L);
    }
}
