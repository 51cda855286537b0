package com.redhat.cdsync.controller;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import com.redhat.cdsync.engine.error.SyncException;

import io.quarkus.logging.Log;

@Provider
public class SyncExceptionMapper implements ExceptionMapper<SyncException> {

    @Override
    public Response toResponse(SyncException exception) {
        int status = status(exception);
        if (status >= 500) {
            Log.errorf(exception, "Request failed");
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(exception.getKind().getDisplayName(), exception.getMessage()))
                .build();
    }

    static int status(SyncException exception) {
        switch (exception.getKind()) {
            case NOT_FOUND:
                return 404;
            case VALIDATION:
                return 400;
            case CONFLICT:
                return 409;
            case TRANSIENT_IO:
                return 503;
            default:
                return 500;
        }
    }
}
