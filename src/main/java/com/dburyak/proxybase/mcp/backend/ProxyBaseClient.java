package com.dburyak.proxybase.mcp.backend;

import com.dburyak.proxybase.mcp.AsyncCloseable;
import com.dburyak.proxybase.mcp.Config;
import com.dburyak.proxybase.mcp.err.BackendException;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.rxjava3.core.buffer.Buffer;
import io.vertx.rxjava3.ext.web.client.HttpRequest;
import io.vertx.rxjava3.ext.web.client.HttpResponse;
import io.vertx.rxjava3.ext.web.client.WebClient;
import io.vertx.rxjava3.uritemplate.UriTemplate;
import lombok.extern.log4j.Log4j2;

/**
 * Thin client of the ProxyBase REST API. Each method issues exactly one HTTP request and emits the decoded JSON body
 * untouched. The body shape is owned by the backend, so values are the raw Vert.x JSON tree ({@link JsonObject},
 * {@link io.vertx.core.json.JsonArray} or a scalar). A JSON {@code null} body completes the {@link Maybe} empty.
 * <p>
 * Every failure is signalled as a {@link BackendException}. There are no retries and no timeouts beyond the
 * {@link WebClient} defaults.
 */
@Log4j2
public class ProxyBaseClient implements AsyncCloseable {
    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String FIELD_PACKAGE_ID = "package_id";
    public static final String FIELD_PAY_CURRENCY = "pay_currency";
    public static final String FIELD_CALLBACK_URL = "callback_url";

    private static final String AGENTS_PATH = "/v1/agents";
    private static final String PACKAGES_PATH = "/v1/packages";
    private static final String CURRENCIES_PATH = "/v1/currencies";
    private static final String ORDERS_PATH = "/v1/orders";
    private static final String PARAM_ORDER_ID = "order_id";
    private static final String ORDER_STATUS_PATH = ORDERS_PATH + "/{" + PARAM_ORDER_ID + "}/status";
    private static final String ORDER_TOPUP_PATH = ORDERS_PATH + "/{" + PARAM_ORDER_ID + "}/topup";
    private static final String ORDER_ROTATE_PATH = ORDERS_PATH + "/{" + PARAM_ORDER_ID + "}/rotate";

    private final WebClient webClient;
    private final String apiUrl;

    public ProxyBaseClient(Config cfg, WebClient webClient) {
        this.webClient = webClient;
        this.apiUrl = cfg.getApiUrl();
    }

    public Maybe<Object> registerAgent() {
        return send(HttpMethod.POST, AGENTS_PATH, null, null, null);
    }

    public Maybe<Object> listPackages(String apiKey) {
        return send(HttpMethod.GET, PACKAGES_PATH, null, apiKey, null);
    }

    public Maybe<Object> listCurrencies(String apiKey) {
        return send(HttpMethod.GET, CURRENCIES_PATH, null, apiKey, null);
    }

    public Maybe<Object> createOrder(String apiKey, String packageId, String payCurrency, String callbackUrl) {
        var body = new JsonObject().put(FIELD_PACKAGE_ID, packageId);
        if (payCurrency != null) {
            body.put(FIELD_PAY_CURRENCY, payCurrency);
        }
        if (callbackUrl != null) {
            body.put(FIELD_CALLBACK_URL, callbackUrl);
        }
        return send(HttpMethod.POST, ORDERS_PATH, null, apiKey, body);
    }

    public Maybe<Object> checkOrderStatus(String apiKey, String orderId) {
        return send(HttpMethod.GET, ORDER_STATUS_PATH, orderId, apiKey, null);
    }

    public Maybe<Object> topupOrder(String apiKey, String orderId, String packageId, String payCurrency) {
        var body = new JsonObject().put(FIELD_PACKAGE_ID, packageId);
        if (payCurrency != null) {
            body.put(FIELD_PAY_CURRENCY, payCurrency);
        }
        return send(HttpMethod.POST, ORDER_TOPUP_PATH, orderId, apiKey, body);
    }

    public Maybe<Object> rotateProxy(String apiKey, String orderId) {
        return send(HttpMethod.POST, ORDER_ROTATE_PATH, orderId, apiKey, null);
    }

    @Override
    public Completable closeAsync() {
        return Completable.fromAction(webClient::close);
    }

    /**
     * Path templates are expanded by the {@link WebClient}, so the order id is percent-encoded as a single path segment
     * ({@code "a/b"} becomes {@code a%2Fb}).
     */
    private Maybe<Object> send(HttpMethod method, String pathTemplate, String orderId, String apiKey,
            JsonObject body) {
        // deferred so that a template that can't be parsed lands in the error channel
        return Single.defer(() -> {
                    var req = webClient.requestAbs(method, UriTemplate.of(apiUrl + pathTemplate));
                    if (orderId != null) {
                        req.setTemplateParam(PARAM_ORDER_ID, orderId);
                    }
                    if (apiKey != null) {
                        req.putHeader(API_KEY_HEADER, apiKey);
                    }
                    log.debug("calling backend: method={}, path={}, orderId={}", method, pathTemplate, orderId);
                    return sendWithBody(req, body);
                })
                .onErrorResumeNext(err -> Single.error(new BackendException("HTTP error: " + err.getMessage(), err)))
                .flatMapMaybe(resp -> classify(method, pathTemplate, resp));
    }

    private static Single<HttpResponse<Buffer>> sendWithBody(HttpRequest<Buffer> req, JsonObject body) {
        return body != null ? req.rxSendJsonObject(body) : req.rxSend();
    }

    private static Maybe<Object> classify(HttpMethod method, String path, HttpResponse<Buffer> resp) {
        var status = resp.statusCode();
        log.debug("backend responded: method={}, path={}, status={}", method, path, status);
        var bodyStr = resp.bodyAsString();
        if (bodyStr == null || bodyStr.isBlank()) {
            return Maybe.error(new BackendException("Parse error: empty response body (HTTP " + status + ")",
                    null));
        }
        Object body;
        try {
            body = Json.decodeValue(bodyStr);
        } catch (DecodeException e) {
            return Maybe.error(new BackendException("Parse error: " + e.getMessage(), e));
        }
        if (status < 200 || status >= 300) {
            return Maybe.error(new BackendException(status,
                    "API error (" + status + " " + resp.statusMessage() + "): " + Json.encode(body)));
        }
        return body != null ? Maybe.just(body) : Maybe.empty();
    }
}
