package com.dburyak.proxybase.mcp;

import com.dburyak.proxybase.mcp.backend.FakeProxyBaseBackend;
import com.dburyak.proxybase.mcp.backend.ProxyBaseClient;
import com.dburyak.proxybase.mcp.handlers.InitializeHandler;
import com.dburyak.proxybase.mcp.handlers.NotificationHandler;
import com.dburyak.proxybase.mcp.handlers.ToolsCallHandler;
import com.dburyak.proxybase.mcp.handlers.ToolsListHandler;
import com.dburyak.proxybase.mcp.tools.ToolExecutor;
import com.dburyak.proxybase.mcp.tools.ToolRegistry;
import io.reactivex.rxjava3.core.Maybe;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.rxjava3.core.Vertx;
import io.vertx.rxjava3.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class McpDispatcherTest {
    private static Vertx vertx;
    private static WebClient webClient;

    private FakeProxyBaseBackend backend;
    private McpDispatcher dispatcher;

    @BeforeAll
    static void startVertx() {
        vertx = Vertx.vertx();
        webClient = WebClient.create(vertx);
    }

    @AfterAll
    static void stopVertx() {
        webClient.close();
        vertx.rxClose().blockingAwait();
    }

    @BeforeEach
    void setUp() {
        backend = FakeProxyBaseBackend.start(vertx);
        var cfg = new Config(new JsonObject()
                .put(Config.API_URL_ENV, backend.url())
                .put(Config.SERVER_VERSION_ENV, "9.9.9"));
        var client = new ProxyBaseClient(cfg, webClient);
        dispatcher = new McpDispatcher(List.of(
                new InitializeHandler(cfg),
                new ToolsListHandler(),
                new ToolsCallHandler(new ToolExecutor(client)),
                new NotificationHandler()));
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void initializeReturnsStaticHandshake() {
        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"initialize\"}");

        var result = (JsonObject) resp.getResult();
        assertThat(resp.getId()).isEqualTo(2);
        assertThat(result.getString("protocolVersion")).isEqualTo("2024-11-05");
        assertThat(result.getJsonObject("capabilities").getJsonObject("tools")).isNotNull();
        assertThat(result.getJsonObject("serverInfo").getString("name")).isEqualTo("proxybase-mcp");
        assertThat(result.getJsonObject("serverInfo").getString("version")).isEqualTo("9.9.9");
    }

    @Test
    void initializeIgnoresClientParams() {
        var plain = dispatch("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}");
        var withParams = dispatch("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":"
                + "{\"protocolVersion\":\"2025-03-26\",\"capabilities\":{},\"clientInfo\":{\"name\":\"host\"}}}");

        assertThat(withParams.getResult()).isEqualTo(plain.getResult());
    }

    @Test
    void toolsListReturnsCatalog() {
        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/list\",\"params\":{\"cursor\":\"x\"}}");

        var tools = ((JsonObject) resp.getResult()).getJsonArray("tools");
        assertThat(tools).isEqualTo(ToolRegistry.toJson());
    }

    @Test
    void unknownMethodIsMethodNotFound() {
        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"resources/list\"}");

        assertThat(resp.isSuccessful()).isFalse();
        assertThat(resp.getError().getCode()).isEqualTo(-32601);
        assertThat(resp.getError().getMessage()).isEqualTo("Method not found: resources/list");
        assertThat(resp.toJson().containsKey("result")).isFalse();
    }

    @Test
    void missingToolArgumentIsFlaggedContentNotProtocolError() {
        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"list_packages\",\"arguments\":{}}}");

        assertThat(resp.isSuccessful()).isTrue();
        var result = (JsonObject) resp.getResult();
        assertThat(result.getBoolean("isError")).isTrue();
        var block = result.getJsonArray("content").getJsonObject(0);
        assertThat(block.getString("type")).isEqualTo("text");
        assertThat(block.getString("text")).contains("Missing required argument: api_key");
    }

    @Test
    void missingArgumentsDefaultToEmptyObject() {
        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"rotate_proxy\",\"arguments\":\"api_key=pk_1\"}}");

        assertThat(textOf(resp)).isEqualTo("Missing required argument: api_key");
    }

    @Test
    void callWithoutToolNameIsUnknownTool() {
        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\"}");

        assertThat(resp.isSuccessful()).isTrue();
        assertThat(((JsonObject) resp.getResult()).getBoolean("isError")).isTrue();
        assertThat(textOf(resp)).isEqualTo("Unknown tool: ");
    }

    @Test
    void successfulToolCallReturnsPrettyJsonText() {
        var packages = new JsonObject().put("packages", new JsonArray()
                .add(new JsonObject().put("id", "us_residential_1gb").put("price_usd", 10)));
        backend.respond(HttpMethod.GET, "/v1/packages", 200, packages.encode());

        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"list_packages\",\"arguments\":{\"api_key\":\"pk_1\"}}}");

        var result = (JsonObject) resp.getResult();
        assertThat(result.containsKey("isError")).isFalse();
        var text = textOf(resp);
        assertThat(text).contains("\n");
        assertThat(new JsonObject(text)).isEqualTo(packages);
    }

    @Test
    void backendFailureIsFlaggedContent() {
        backend.respond(HttpMethod.GET, "/v1/orders/ord_1/status", 403, "{\"error\":\"forbidden\"}");

        var resp = dispatch("{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"tools/call\",\"params\":{\"name\":"
                + "\"check_order_status\",\"arguments\":{\"api_key\":\"pk_1\",\"order_id\":\"ord_1\"}}}");

        assertThat(resp.isSuccessful()).isTrue();
        assertThat(((JsonObject) resp.getResult()).getBoolean("isError")).isTrue();
        assertThat(textOf(resp)).isEqualTo("API error (403 Forbidden): {\"error\":\"forbidden\"}");
    }

    @Test
    void notificationsGetNullResult() {
        var initialized = dispatch("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");
        var cancelled = dispatch("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/cancelled\","
                + "\"params\":{\"requestId\":3}}");

        assertThat(initialized.isSuccessful()).isTrue();
        assertThat(initialized.getResult()).isNull();
        assertThat(cancelled.isSuccessful()).isTrue();
        assertThat(cancelled.getResult()).isNull();
    }

    @Test
    void unexpectedHandlerFailureIsInternalError() {
        var broken = new MethodHandler() {
            @Override
            public List<String> methods() {
                return List.of("broken");
            }

            @Override
            public Maybe<Object> handle(JsonRpcRequest req) {
                return Maybe.error(new IllegalStateException("boom"));
            }
        };
        var brokenDispatcher = new McpDispatcher(List.of(broken));

        var resp = brokenDispatcher.dispatch(JsonRpcRequest.parse("{\"jsonrpc\":\"2.0\",\"id\":8,\"method\":\"broken\"}"))
                .blockingGet();

        assertThat(resp.getId()).isEqualTo(8);
        assertThat(resp.getError().getCode()).isEqualTo(-32603);
        assertThat(resp.getError().getMessage()).contains("boom");
    }

    @Test
    void duplicateMethodRegistrationIsRejected() {
        assertThatThrownBy(() -> new McpDispatcher(List.of(new ToolsListHandler(), new ToolsListHandler())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tools/list");
    }

    private JsonRpcResponse dispatch(String line) {
        return dispatcher.dispatch(JsonRpcRequest.parse(line)).blockingGet();
    }

    private static String textOf(JsonRpcResponse resp) {
        return ((JsonObject) resp.getResult()).getJsonArray("content").getJsonObject(0).getString("text");
    }
}
