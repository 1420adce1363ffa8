package com.dburyak.proxybase.mcp;

import com.dburyak.proxybase.mcp.err.McpPublicException;
import io.vertx.core.json.JsonObject;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable representation of a JSON-RPC response. Either {@link #success(Object, Object)} with a result (which may be
 * JSON null) or {@link #failed(Object, Error)} with an error, never both. The optional-field wire shape exists only in
 * {@link #toJson()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JsonRpcResponse {
    public static final String FIELD_VERSION = "jsonrpc";
    public static final String VERSION_2_0 = "2.0";
    public static final String FIELD_RESULT = "result";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_ID = "id";

    Object id; // can be String, Number or null
    Object result;
    Error error;

    public static JsonRpcResponse success(Object id, Object result) {
        return new JsonRpcResponse(id, result, null);
    }

    public static JsonRpcResponse failed(Object id, Error error) {
        if (error == null) {
            throw new IllegalArgumentException("error must be provided");
        }
        return new JsonRpcResponse(id, null, error);
    }

    public static JsonRpcResponse failed(Object id, McpPublicException err) {
        return failed(id, new Error(err.getJsonRpcErrorCode(), err.getJsonRpcErrorMessage(),
                err.getJsonRpcErrorData()));
    }

    public static JsonRpcResponse fromJson(JsonObject json) {
        var id = json.getValue(FIELD_ID);
        var errObj = json.getJsonObject(FIELD_ERROR);
        if (errObj != null) {
            var code = errObj.getValue(Error.FIELD_CODE);
            if (!(code instanceof Integer)) {
                throw new IllegalArgumentException("error has no integer code: " + json.encode());
            }
            return failed(id, new Error(
                    (Integer) code,
                    errObj.getString(Error.FIELD_MESSAGE),
                    errObj.getValue(Error.FIELD_DATA)));
        }
        if (!json.containsKey(FIELD_RESULT)) {
            throw new IllegalArgumentException("response has neither result nor error: " + json.encode());
        }
        return success(id, json.getValue(FIELD_RESULT));
    }

    public boolean isSuccessful() {
        return error == null;
    }

    public JsonObject toJson() {
        var json = new JsonObject()
                .put(FIELD_VERSION, VERSION_2_0)
                .put(FIELD_ID, id);
        if (error != null) {
            json.put(FIELD_ERROR, error.toJson());
        } else {
            json.put(FIELD_RESULT, result);
        }
        return json;
    }

    @Value
    public static class Error {
        public static final String FIELD_CODE = "code";
        public static final String FIELD_MESSAGE = "message";
        public static final String FIELD_DATA = "data";

        public static final int PARSE_ERROR = -32700;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INTERNAL_ERROR = -32603;

        int code;
        String message;
        Object data;

        public Error(int code, String message, Object data) {
            this.code = code;
            this.message = message;
            this.data = data;
        }

        public Error(int code, String message) {
            this(code, message, null);
        }

        public JsonObject toJson() {
            var json = new JsonObject()
                    .put(FIELD_CODE, code)
                    .put(FIELD_MESSAGE, message);
            if (data != null) {
                json.put(FIELD_DATA, data);
            }
            return json;
        }
    }
}
