// file: storage/src/main/java/io/monosync/storage/DurableSyncedCommitMapping.java
package io.monosync.storage;

import io.monosync.core.ChangesetId;
import io.monosync.core.MappingConflictException;
import io.monosync.core.RepositoryId;
import io.monosync.core.sync.SyncConfigVersion;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * WAL-backed {@link SyncedCommitMapping}.
 * <p>
 * Record payload:
 *  - kind:     byte ('M' = mapping entry, 'W' = working-copy equivalence)
 *  - smallRepo, largeRepo: int32
 *  - version:  string
 *  - smallId:  string (null for an equivalence with no small commit)
 *  - largeId:  string
 * <p>
 * Conflicts are detected before anything is logged, so the WAL never holds a
 * contradicting pair.
 */
public class DurableSyncedCommitMapping extends WalBackedStore implements SyncedCommitMapping {
    private static final Logger LOG = Logger.getLogger(DurableSyncedCommitMapping.class.getName());

    private static final byte MAPPING = 'M';
    private static final byte EQUIVALENCE = 'W';

    private record VersionedKey(RepositoryId smallRepo, RepositoryId largeRepo, SyncConfigVersion version, ChangesetId id) {}

    private record PairKey(RepositoryId smallRepo, RepositoryId largeRepo, ChangesetId id) {}

    private final Map<VersionedKey, SyncedCommitEntry> bySmall = new ConcurrentHashMap<>();
    private final Map<VersionedKey, SyncedCommitEntry> byLarge = new ConcurrentHashMap<>();
    private final Map<PairKey, SyncedCommitEntry> latestBySmall = new ConcurrentHashMap<>();
    private final Map<PairKey, SyncedCommitEntry> latestByLarge = new ConcurrentHashMap<>();
    private final Map<PairKey, WorkingCopyEquivalence> equivalences = new ConcurrentHashMap<>();

    public DurableSyncedCommitMapping(Wal wal) {
        super(wal);
        recover();
    }

    @Override
    public synchronized boolean insert(SyncedCommitEntry e) {
        SyncedCommitEntry existing = bySmall.get(smallKey(e));
        if (existing != null) {
            if (!existing.largeId().equals(e.largeId())) {
                throw new MappingConflictException(e.smallId(), existing.largeId(), e.largeId());
            }
            return false;
        }
        SyncedCommitEntry reverse = byLarge.get(largeKey(e));
        if (reverse != null && !reverse.smallId().equals(e.smallId())) {
            throw new MappingConflictException(e.largeId(), reverse.smallId(), e.smallId());
        }
        logAndApply(new RecordCodec.PayloadWriter()
                .putByte(MAPPING)
                .putInt(e.smallRepo().id())
                .putInt(e.largeRepo().id())
                .putString(e.version().name())
                .putString(e.smallId().hex())
                .putString(e.largeId().hex())
                .toByteArray());
        LOG.fine(() -> "mapped " + e.smallRepo() + ":" + e.smallId().shortHex()
                + " <-> " + e.largeRepo() + ":" + e.largeId().shortHex() + " (" + e.version().name() + ")");
        return true;
    }

    @Override
    public synchronized boolean insertEquivalentWorkingCopy(WorkingCopyEquivalence eq) {
        WorkingCopyEquivalence existing = equivalences.get(new PairKey(eq.smallRepo(), eq.largeRepo(), eq.largeId()));
        if (existing != null) {
            if (!existing.smallId().equals(eq.smallId())) {
                throw new IllegalStateException("large commit " + eq.largeId() + " already has working copy "
                        + existing.smallId() + ", refusing " + eq.smallId());
            }
            return false;
        }
        logAndApply(new RecordCodec.PayloadWriter()
                .putByte(EQUIVALENCE)
                .putInt(eq.smallRepo().id())
                .putInt(eq.largeRepo().id())
                .putString(eq.version().name())
                .putString(eq.smallId().map(ChangesetId::hex).orElse(null))
                .putString(eq.largeId().hex())
                .toByteArray());
        return true;
    }

    @Override
    protected void apply(RecordCodec.PayloadReader record) {
        byte kind = record.getByte();
        RepositoryId small = new RepositoryId(record.getInt());
        RepositoryId large = new RepositoryId(record.getInt());
        SyncConfigVersion version = new SyncConfigVersion(record.getRequiredString());
        String smallHex = record.getString();
        ChangesetId largeId = new ChangesetId(record.getRequiredString());
        if (kind == MAPPING) {
            SyncedCommitEntry e = new SyncedCommitEntry(small, new ChangesetId(smallHex), large, largeId, version);
            bySmall.put(smallKey(e), e);
            byLarge.put(largeKey(e), e);
            latestBySmall.put(new PairKey(small, large, e.smallId()), e);
            latestByLarge.put(new PairKey(small, large, largeId), e);
        } else if (kind == EQUIVALENCE) {
            Optional<ChangesetId> smallId = Optional.ofNullable(smallHex).map(ChangesetId::new);
            equivalences.put(new PairKey(small, large, largeId),
                    new WorkingCopyEquivalence(large, largeId, small, smallId, version));
        } else {
            throw new IllegalStateException("unknown mapping record kind: " + kind);
        }
    }

    @Override
    public Optional<SyncedCommitEntry> getLarge(RepositoryId smallRepo, RepositoryId largeRepo,
                                                SyncConfigVersion version, ChangesetId smallId) {
        return Optional.ofNullable(bySmall.get(new VersionedKey(smallRepo, largeRepo, version, smallId)));
    }

    @Override
    public Optional<SyncedCommitEntry> getSmall(RepositoryId smallRepo, RepositoryId largeRepo,
                                                SyncConfigVersion version, ChangesetId largeId) {
        return Optional.ofNullable(byLarge.get(new VersionedKey(smallRepo, largeRepo, version, largeId)));
    }

    @Override
    public Optional<SyncedCommitEntry> findBySmall(RepositoryId smallRepo, RepositoryId largeRepo, ChangesetId smallId) {
        return Optional.ofNullable(latestBySmall.get(new PairKey(smallRepo, largeRepo, smallId)));
    }

    @Override
    public Optional<SyncedCommitEntry> findByLarge(RepositoryId smallRepo, RepositoryId largeRepo, ChangesetId largeId) {
        return Optional.ofNullable(latestByLarge.get(new PairKey(smallRepo, largeRepo, largeId)));
    }

    @Override
    public Optional<WorkingCopyEquivalence> getEquivalentWorkingCopy(RepositoryId smallRepo, RepositoryId largeRepo,
                                                                     ChangesetId largeId) {
        return Optional.ofNullable(equivalences.get(new PairKey(smallRepo, largeRepo, largeId)));
    }

    private static VersionedKey smallKey(SyncedCommitEntry e) {
        return new VersionedKey(e.smallRepo(), e.largeRepo(), e.version(), e.smallId());
    }

    private static VersionedKey largeKey(SyncedCommitEntry e) {
        return new VersionedKey(e.smallRepo(), e.largeRepo(), e.version(), e.largeId());
    }
}
