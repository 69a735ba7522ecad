// file: core/src/main/java/io/monosync/core/sync/SyncConfigVersion.java
package io.monosync.core.sync;

import java.util.Objects;

/** Name of one version of a {@link CommitSyncConfig}, e.g. "v1". */
public record SyncConfigVersion(String name) {
    public SyncConfigVersion {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("config version must not be blank");
    }

    @Override
    public String toString() {
        return name;
    }
}
