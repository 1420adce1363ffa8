package com.dburyak.proxybase.mcp;

import com.dburyak.proxybase.mcp.err.JsonRpcParseException;
import com.dburyak.proxybase.mcp.err.UnsupportedJsonRpcVersionException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import lombok.Value;

/**
 * Immutable representation of a single JSON-RPC request read from the protocol stream.
 */
@Value
public class JsonRpcRequest {
    public static final String FIELD_VERSION = "jsonrpc";
    public static final String VERSION_2_0 = "2.0";
    public static final String FIELD_METHOD = "method";
    public static final String FIELD_ID = "id";
    public static final String FIELD_PARAMS = "params";

    JsonObject fullRequest;
    String method;
    Object id; // can be String, Number or null
    Object params; // any JSON value, normally a JsonObject
    // absent "id" member, an explicit null id is still a request that expects an answer
    boolean notification;

    public JsonRpcRequest(JsonObject fullRequest) {
        var versionValue = fullRequest.getValue(FIELD_VERSION);
        if (!VERSION_2_0.equals(versionValue)) {
            throw new UnsupportedJsonRpcVersionException(versionValue);
        }
        var methodValue = fullRequest.getValue(FIELD_METHOD);
        if (!(methodValue instanceof String)) {
            throw new JsonRpcParseException("\"" + FIELD_METHOD + "\" must be a string");
        }
        this.fullRequest = fullRequest;
        this.method = (String) methodValue;
        this.id = fullRequest.getValue(FIELD_ID);
        this.params = fullRequest.getValue(FIELD_PARAMS);
        this.notification = !fullRequest.containsKey(FIELD_ID);
    }

    public static JsonRpcRequest parse(String line) {
        Object decoded;
        try {
            decoded = Json.decodeValue(line);
        } catch (DecodeException e) {
            throw new JsonRpcParseException(e.getMessage(), e);
        }
        if (!(decoded instanceof JsonObject)) {
            throw new JsonRpcParseException("request must be a JSON object");
        }
        return new JsonRpcRequest((JsonObject) decoded);
    }

    /**
     * Params as an object, or an empty object when params are absent or of any other shape.
     */
    public JsonObject getParamsObject() {
        return params instanceof JsonObject ? (JsonObject) params : new JsonObject();
    }
}
