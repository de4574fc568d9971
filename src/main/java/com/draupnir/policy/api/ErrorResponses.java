package com.draupnir.policy.api;

import com.draupnir.policy.corpus.CorpusFileNotFoundException;
import com.draupnir.policy.sandbox.PathAccessDeniedException;
import com.draupnir.policy.yaml.PolicyParseException;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.util.Map;

/**
 * Maps service failures to HTTP responses with an {@code {"error": message}} body.
 * The body is always JSON, also on endpoints that produce other media types.
 */
final class ErrorResponses {

    /**
     * Unprocessable Entity; not in {@link Response.Status}
     */
    static final int UNPROCESSABLE_ENTITY = 422;

    private ErrorResponses() {
    }

    static Response of(Exception e) {
        return error(statusOf(e), e.getMessage());
    }

    static int statusOf(Exception e) {
        if (e instanceof PathAccessDeniedException) {
            return Response.Status.FORBIDDEN.getStatusCode();
        }
        if (e instanceof CorpusFileNotFoundException || e instanceof UnsupportedOperationException) {
            return Response.Status.NOT_FOUND.getStatusCode();
        }
        if (e instanceof PolicyParseException) {
            return UNPROCESSABLE_ENTITY;
        }
        if (e instanceof IllegalArgumentException) {
            return Response.Status.BAD_REQUEST.getStatusCode();
        }
        return Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
    }

    static Response badRequest(String message) {
        return error(Response.Status.BAD_REQUEST.getStatusCode(), message);
    }

    static Response notFound(String message) {
        return error(Response.Status.NOT_FOUND.getStatusCode(), message);
    }

    private static Response error(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message == null ? "Unknown error" : message))
                .build();
    }
}
