package io.provtrack.persistence;

import io.provtrack.ProvTrackException;

public final class UnknownTypeException extends ProvTrackException {
    public UnknownTypeException(String typeName) {
        super("Objects of type '" + typeName + "' are not allowed");
    }
}
