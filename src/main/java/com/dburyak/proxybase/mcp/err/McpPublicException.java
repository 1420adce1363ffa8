package com.dburyak.proxybase.mcp.err;

import lombok.Getter;

/**
 * Root exception for all protocol-level failures that are converted and propagated to the calling client as a
 * JSON-RPC error envelope.
 */
@Getter
public class McpPublicException extends RuntimeException {
    private final int jsonRpcErrorCode;
    private final String jsonRpcErrorMessage;
    private final Object jsonRpcErrorData;

    public McpPublicException(int jsonRpcErrorCode, String jsonRpcErrorMessage, Object jsonRpcErrorData,
            Throwable cause) {
        super(jsonRpcErrorMessage, cause);
        this.jsonRpcErrorCode = jsonRpcErrorCode;
        this.jsonRpcErrorMessage = jsonRpcErrorMessage;
        this.jsonRpcErrorData = jsonRpcErrorData;
    }

    public McpPublicException(int jsonRpcErrorCode, String jsonRpcErrorMessage) {
        this(jsonRpcErrorCode, jsonRpcErrorMessage, null, null);
    }
}
