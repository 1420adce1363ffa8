package com.dburyak.proxybase.mcp.handlers;

import com.dburyak.proxybase.mcp.JsonRpcRequest;
import com.dburyak.proxybase.mcp.MethodHandler;
import com.dburyak.proxybase.mcp.err.ToolCallException;
import com.dburyak.proxybase.mcp.tools.ToolExecutor;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Executes a tool and shapes the outcome into MCP content. Tool failures are data for the agent, not protocol faults,
 * so both outcomes are successful JSON-RPC responses; failures only carry {@code "isError": true}.
 */
@Log4j2
@RequiredArgsConstructor
public class ToolsCallHandler implements MethodHandler {
    public static final String METHOD = "tools/call";
    public static final String PARAM_NAME = "name";
    public static final String PARAM_ARGUMENTS = "arguments";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_IS_ERROR = "isError";

    private final ToolExecutor toolExecutor;

    @Override
    public List<String> methods() {
        return List.of(METHOD);
    }

    @Override
    public Maybe<Object> handle(JsonRpcRequest req) {
        var params = req.getParamsObject();
        var nameValue = params.getValue(PARAM_NAME);
        var toolName = nameValue instanceof String ? (String) nameValue : "";
        var argsValue = params.getValue(PARAM_ARGUMENTS);
        var args = argsValue instanceof JsonObject ? (JsonObject) argsValue : new JsonObject();
        return toolExecutor.execute(toolName, args)
                .map(ToolsCallHandler::successContent)
                .defaultIfEmpty(successContent(null))
                .onErrorResumeNext(err -> {
                    if (err instanceof ToolCallException) {
                        log.info("tool call failed: tool={}, error={}", toolName, err.getMessage());
                        return Single.just(errorContent(err.getMessage()));
                    }
                    return Single.error(err);
                })
                .map(Object.class::cast)
                .toMaybe();
    }

    static JsonObject successContent(Object value) {
        return new JsonObject()
                .put(FIELD_CONTENT, new JsonArray().add(textBlock(Json.encodePrettily(value))));
    }

    static JsonObject errorContent(String message) {
        return new JsonObject()
                .put(FIELD_CONTENT, new JsonArray().add(textBlock(message)))
                .put(FIELD_IS_ERROR, true);
    }

    private static JsonObject textBlock(String text) {
        return new JsonObject()
                .put("type", "text")
                .put("text", text);
    }
}
