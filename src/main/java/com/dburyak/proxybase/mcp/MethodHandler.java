package com.dburyak.proxybase.mcp;

import io.reactivex.rxjava3.core.Maybe;

import java.util.List;

/**
 * Handles one or more JSON-RPC methods. An empty result maps to a JSON {@code null} result.
 */
public interface MethodHandler {
    List<String> methods();

    Maybe<Object> handle(JsonRpcRequest req);
}
