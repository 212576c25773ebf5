package io.provtrack.persistence;

import io.provtrack.ProvTrackException;

public final class DuplicateIdentifierException extends ProvTrackException {
    private final String identifier;

    public DuplicateIdentifierException(String identifier) {
        super("A different object already has the identifier: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
