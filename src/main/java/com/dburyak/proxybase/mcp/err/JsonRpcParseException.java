package com.dburyak.proxybase.mcp.err;

import com.dburyak.proxybase.mcp.JsonRpcResponse;

/**
 * The incoming line could not be decoded into a JSON-RPC request. Always answered with a null id since no id could be
 * trusted.
 */
public class JsonRpcParseException extends McpPublicException {

    public JsonRpcParseException(String detail, Throwable cause) {
        super(JsonRpcResponse.Error.PARSE_ERROR, "Parse error: " + detail, null, cause);
    }

    public JsonRpcParseException(String detail) {
        this(detail, null);
    }
}
