package com.dburyak.proxybase.mcp.handlers;

import com.dburyak.proxybase.mcp.JsonRpcRequest;
import com.dburyak.proxybase.mcp.MethodHandler;
import com.dburyak.proxybase.mcp.tools.ToolRegistry;
import io.reactivex.rxjava3.core.Maybe;
import io.vertx.core.json.JsonObject;

import java.util.List;

public class ToolsListHandler implements MethodHandler {
    public static final String METHOD = "tools/list";

    @Override
    public List<String> methods() {
        return List.of(METHOD);
    }

    @Override
    public Maybe<Object> handle(JsonRpcRequest req) {
        return Maybe.fromSupplier(() -> new JsonObject().put("tools", ToolRegistry.toJson()));
    }
}
