package com.redhat.cdsync.engine.error;

public class ConflictException extends SyncException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFLICT;
    }
}
