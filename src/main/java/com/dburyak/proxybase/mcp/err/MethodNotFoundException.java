package com.dburyak.proxybase.mcp.err;

import com.dburyak.proxybase.mcp.JsonRpcResponse;

public class MethodNotFoundException extends McpPublicException {

    public MethodNotFoundException(String method) {
        super(JsonRpcResponse.Error.METHOD_NOT_FOUND, "Method not found: " + method);
    }
}
