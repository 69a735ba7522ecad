// file: storage/src/main/java/io/monosync/storage/ContentStore.java
package io.monosync.storage;

import io.monosync.core.ContentId;

import java.util.Optional;

/** File content blobs addressed by the SHA-256 of their bytes. */
public interface ContentStore {

    ContentId put(byte[] content);

    Optional<byte[]> get(ContentId id);

    boolean exists(ContentId id);
}
