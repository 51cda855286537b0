package com.redhat.cdsync.cli;

import com.redhat.cdsync.engine.error.SyncException;

public final class ExitCodes {

    public static final int SUCCESS = 0;
    /**
     * Bad arguments, or an application or run that does not exist.
     */
    public static final int USER_ERROR = 1;
    public static final int SYNC_FAILURE = 2;

    private ExitCodes() {
    }

    public static int forError(SyncException e) {
        switch (e.getKind()) {
            case NOT_FOUND:
            case VALIDATION:
            case CONFLICT:
                return USER_ERROR;
            default:
                return SYNC_FAILURE;
        }
    }
}
