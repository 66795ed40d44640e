package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;
import java.util.Set;

/**
 * Exception thrown when an RPC to storage nodes fails at the transport level.
 * Keeps the gRPC status code reported by the transport.
 */
public class RpcFailureException extends KvException {

    /** Codes that indicate a transient condition on the target node or network. */
    public static final Set<Status.Code> TRANSIENT_CODES =
            Set.of(Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED, Status.Code.RESOURCE_EXHAUSTED);

    private final Status.Code code;

    public RpcFailureException(Status.Code code, String message) {
        super(message);
        this.code = code;
    }

    public RpcFailureException(Status.Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Maps a gRPC status to a transport failure.
     */
    public static RpcFailureException fromStatus(Status status, String target) {
        String description = status.getDescription() != null ? status.getDescription() : status.getCode().name();
        return new RpcFailureException(status.getCode(), target + ": " + description, status.getCause());
    }

    @Override
    public Status.Code getGrpcStatusCode() {
        // OK never describes a failure
        return code == Status.Code.OK ? Status.Code.UNKNOWN : code;
    }

    @Override
    public boolean isRetryable() {
        return TRANSIENT_CODES.contains(code);
    }
}
