package com.redhat.cdsync.engine.error;

public class FatalException extends SyncException {

    public FatalException(String message) {
        super(message);
    }

    public FatalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.FATAL;
    }
}
