package org.tessera.runtime.exceptions;

import lombok.Getter;
import org.tessera.util.Host;

import javax.annotation.Nullable;

/**
 * Thrown when a server (or every seed of a cluster) cannot be reached.
 *
 * <p>Created by the tend thread and by connection pools.
 */
public class ConnectionException extends ClusterException {

    /** Endpoint which failed, null for aggregate failures. */
    @Getter
    @Nullable
    private final Host host;

    public ConnectionException(String message) {
        super(ResultCode.SERVER_NOT_AVAILABLE, message);
        this.host = null;
    }

    public ConnectionException(int resultCode, String message) {
        super(resultCode, message);
        this.host = null;
    }

    public ConnectionException(@Nullable Host host, String message, Throwable cause) {
        super(ResultCode.SERVER_NOT_AVAILABLE,
                host == null ? message : message + " [endpoint=" + host.toEndpointUrl() + "]", cause);
        this.host = host;
    }

    public ConnectionException(@Nullable Host host, String message) {
        super(ResultCode.SERVER_NOT_AVAILABLE,
                host == null ? message : message + " [endpoint=" + host.toEndpointUrl() + "]");
        this.host = host;
    }
}
