package io.provtrack.storage;

import io.provtrack.ProvTrackException;

public final class StorageException extends ProvTrackException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
