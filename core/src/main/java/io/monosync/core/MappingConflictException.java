// file: core/src/main/java/io/monosync/core/MappingConflictException.java
package io.monosync.core;

import java.util.Map;

/**
 * Two different counterparts were claimed for the same commit.
 * Never resolved automatically: it means the two histories would fork.
 */
public final class MappingConflictException extends MonosyncException {
    private final ChangesetId source;
    private final ChangesetId existingTarget;
    private final ChangesetId rejectedTarget;

    public MappingConflictException(ChangesetId source, ChangesetId existingTarget, ChangesetId rejectedTarget) {
        super("commit " + source + " is already mapped to " + existingTarget + ", refusing to map it to " + rejectedTarget);
        this.source = source;
        this.existingTarget = existingTarget;
        this.rejectedTarget = rejectedTarget;
    }

    public ChangesetId source() { return source; }

    public ChangesetId existingTarget() { return existingTarget; }

    public ChangesetId rejectedTarget() { return rejectedTarget; }

    @Override
    public String kind() { return "MappingConflict"; }

    @Override
    public Map<String, Object> context() {
        return Map.of(
                "source", source.hex(),
                "existingTarget", existingTarget.hex(),
                "rejectedTarget", rejectedTarget.hex()
        );
    }
}
