package com.dburyak.proxybase.mcp.err;

public class UnsupportedJsonRpcVersionException extends JsonRpcParseException {

    public UnsupportedJsonRpcVersionException(Object badVersion) {
        super("unsupported JSON-RPC version: " + badVersion);
    }
}
