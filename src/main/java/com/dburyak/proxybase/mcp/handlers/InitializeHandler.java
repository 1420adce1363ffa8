package com.dburyak.proxybase.mcp.handlers;

import com.dburyak.proxybase.mcp.Config;
import com.dburyak.proxybase.mcp.JsonRpcRequest;
import com.dburyak.proxybase.mcp.MethodHandler;
import io.reactivex.rxjava3.core.Maybe;
import io.vertx.core.json.JsonObject;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * MCP lifecycle handshake. The answer is static, client params (protocol version, capabilities) are only logged.
 */
@Log4j2
public class InitializeHandler implements MethodHandler {
    public static final String METHOD = "initialize";
    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "proxybase-mcp";

    private final String serverVersion;

    public InitializeHandler(Config cfg) {
        this.serverVersion = cfg.getServerVersion();
    }

    @Override
    public List<String> methods() {
        return List.of(METHOD);
    }

    @Override
    public Maybe<Object> handle(JsonRpcRequest req) {
        return Maybe.fromSupplier(() -> {
            var clientInfo = req.getParamsObject().getValue("clientInfo");
            log.info("client initializing: clientInfo={}", clientInfo);
            return new JsonObject()
                    .put("protocolVersion", PROTOCOL_VERSION)
                    .put("capabilities", new JsonObject()
                            .put("tools", new JsonObject()))
                    .put("serverInfo", new JsonObject()
                            .put("name", SERVER_NAME)
                            .put("version", serverVersion));
        });
    }
}
