package com.redhat.cdsync.engine.error;

public class TransientIOException extends SyncException {

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSIENT_IO;
    }
}
