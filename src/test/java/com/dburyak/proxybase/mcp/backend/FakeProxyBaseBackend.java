package com.dburyak.proxybase.mcp.backend;

import io.vertx.core.http.HttpMethod;
import io.vertx.rxjava3.core.Vertx;
import io.vertx.rxjava3.core.http.HttpServer;
import io.vertx.rxjava3.ext.web.Router;
import io.vertx.rxjava3.ext.web.RoutingContext;
import io.vertx.rxjava3.ext.web.handler.BodyHandler;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for the ProxyBase API. Answers canned responses per method and path, records every request.
 * Unknown routes get a JSON 404.
 */
public class FakeProxyBaseBackend implements AutoCloseable {
    private final HttpServer server;
    private final Map<String, CannedResponse> responses = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    private FakeProxyBaseBackend(Vertx vertx) {
        var router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.route().handler(this::handle);
        this.server = vertx.createHttpServer()
                .requestHandler(router)
                .rxListen(0)
                .blockingGet();
    }

    public static FakeProxyBaseBackend start(Vertx vertx) {
        return new FakeProxyBaseBackend(vertx);
    }

    public String url() {
        return "http://localhost:" + server.actualPort();
    }

    public FakeProxyBaseBackend respond(HttpMethod method, String path, int status, String body) {
        responses.put(key(method, path), new CannedResponse(status, body));
        return this;
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public void close() {
        server.rxClose().blockingAwait();
    }

    private void handle(RoutingContext ctx) {
        var req = ctx.request();
        var body = ctx.body().asString();
        requests.add(new RecordedRequest(req.method(), req.path(), req.getHeader(ProxyBaseClient.API_KEY_HEADER),
                req.getHeader("content-type"), body));
        var canned = responses.getOrDefault(key(req.method(), req.path()),
                new CannedResponse(404, "{\"error\":\"route not found\"}"));
        var resp = ctx.response().setStatusCode(canned.getStatus());
        if (canned.getBody() == null) {
            resp.rxEnd().subscribe();
        } else {
            resp.putHeader("content-type", "application/json").rxEnd(canned.getBody()).subscribe();
        }
    }

    private static String key(HttpMethod method, String path) {
        return method.name() + " " + path;
    }

    @Value
    private static class CannedResponse {
        int status;
        String body;
    }

    @Value
    public static class RecordedRequest {
        HttpMethod method;
        String path;
        String apiKey;
        String contentType;
        String body;
    }
}
