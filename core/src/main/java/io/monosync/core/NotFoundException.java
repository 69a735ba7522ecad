// file: core/src/main/java/io/monosync/core/NotFoundException.java
package io.monosync.core;

import java.util.Map;

/** A well-formed identifier that resolves to nothing. */
public final class NotFoundException extends MonosyncException {
    private final String identifier;

    public NotFoundException(String identifier) {
        super("not found: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() { return identifier; }

    @Override
    public String kind() { return "NotFound"; }

    @Override
    public Map<String, Object> context() {
        return Map.of("identifier", identifier);
    }
}
