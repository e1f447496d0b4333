package io.amprelay.storage;

public final class AmpStorageException extends RuntimeException {
    public AmpStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
