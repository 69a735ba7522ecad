// file: storage/src/main/java/io/monosync/storage/DurableChangesetStore.java
package io.monosync.storage;

import io.monosync.core.Changeset;
import io.monosync.core.ChangesetCodec;
import io.monosync.core.ChangesetId;
import io.monosync.core.InvalidChangesetException;
import io.monosync.core.NotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WAL-backed {@link ChangesetStore}.
 * <p>
 * Record payload: the changeset's canonical bytes. The id is recomputed on
 * replay, so a record can never claim an id its content does not hash to.
 */
public class DurableChangesetStore extends WalBackedStore implements ChangesetStore {

    private record Entry(Changeset changeset, long generation) {}

    private final Map<ChangesetId, Entry> mem = new ConcurrentHashMap<>();

    public DurableChangesetStore(Wal wal) {
        super(wal);
        recover();
    }

    @Override
    public synchronized ChangesetId put(Changeset changeset) {
        ChangesetId id = changeset.id();
        if (mem.containsKey(id)) {
            return id;
        }
        for (ChangesetId p : changeset.parents()) {
            if (!mem.containsKey(p)) {
                throw new InvalidChangesetException(id, List.of("parent " + p + " is not stored"));
            }
        }
        logAndApply(new RecordCodec.PayloadWriter().putBytes(ChangesetCodec.encode(changeset)).toByteArray());
        return id;
    }

    @Override
    protected void apply(RecordCodec.PayloadReader record) {
        Changeset cs = ChangesetCodec.decode(record.getBytes());
        long gen = 1;
        for (ChangesetId p : cs.parents()) {
            Entry parent = mem.get(p);
            if (parent == null) {
                throw new IllegalStateException("changeset " + cs.id() + " replayed before its parent " + p);
            }
            gen = Math.max(gen, parent.generation() + 1);
        }
        mem.putIfAbsent(cs.id(), new Entry(cs, gen));
    }

    @Override
    public Optional<Changeset> get(ChangesetId id) {
        Entry e = mem.get(id);
        return e == null ? Optional.empty() : Optional.of(e.changeset());
    }

    @Override
    public Changeset load(ChangesetId id) {
        return get(id).orElseThrow(() -> new NotFoundException(id.hex()));
    }

    @Override
    public boolean exists(ChangesetId id) {
        return mem.containsKey(id);
    }

    @Override
    public List<ChangesetId> parents(ChangesetId id) {
        return load(id).parents();
    }

    @Override
    public long generation(ChangesetId id) {
        Entry e = mem.get(id);
        if (e == null) throw new NotFoundException(id.hex());
        return e.generation();
    }

    @Override
    public Set<ChangesetId> ids() {
        return Set.copyOf(mem.keySet());
    }
}
