package com.redhat.cdsync.engine.store;

import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.FatalException;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.SyncException;
import com.redhat.cdsync.engine.error.TransientIOException;
import com.redhat.cdsync.engine.error.ValidationException;

import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Maps API server failures onto the sync error taxonomy.
 */
public final class KubernetesErrors {

    private KubernetesErrors() {
    }

    public static SyncException translate(String operation, KubernetesClientException e) {
        String message = operation + " failed: " + e.getMessage();
        switch (e.getCode()) {
            case 404:
                return new NotFoundException(message, e);
            case 409:
                return new ConflictException(message, e);
            case 400:
            case 422:
                return new ValidationException(message, e);
            case 401:
            case 403:
                return new FatalException(message, e);
            default:
                return new TransientIOException(message, e);
        }
    }
}
