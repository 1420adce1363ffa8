package com.dburyak.proxybase.mcp.err;

import lombok.Getter;

/**
 * ProxyBase API call failed: transport error, unparseable body or non-2xx status.
 */
@Getter
public class BackendException extends ToolCallException {
    public static final int NO_STATUS = -1;

    private final int httpStatusCode;

    /**
     * Constructor for failures without an HTTP status (connection errors, timeouts, unparseable bodies, etc.).
     */
    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = NO_STATUS;
    }

    public BackendException(int httpStatusCode, String message) {
        super(message);
        this.httpStatusCode = httpStatusCode;
    }
}
