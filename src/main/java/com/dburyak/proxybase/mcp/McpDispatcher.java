package com.dburyak.proxybase.mcp;

import com.dburyak.proxybase.mcp.err.McpPublicException;
import com.dburyak.proxybase.mcp.err.MethodNotFoundException;
import io.reactivex.rxjava3.core.Single;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.dburyak.proxybase.mcp.JsonRpcResponse.Error.INTERNAL_ERROR;

/**
 * Routes parsed requests to method handlers by method name and wraps the outcome into a response envelope. Stateless
 * between calls, the response is computed for notifications too and it's up to the transport to drop it.
 */
@Log4j2
public class McpDispatcher {
    private final Map<String, MethodHandler> handlersByMethod;

    public McpDispatcher(List<MethodHandler> handlers) {
        var byMethod = new HashMap<String, MethodHandler>();
        for (var handler : handlers) {
            for (var method : handler.methods()) {
                if (byMethod.putIfAbsent(method, handler) != null) {
                    throw new IllegalArgumentException("multiple handlers registered for method: " + method);
                }
            }
        }
        this.handlersByMethod = Map.copyOf(byMethod);
    }

    public Single<JsonRpcResponse> dispatch(JsonRpcRequest req) {
        var startedAt = Instant.now();
        var handler = handlersByMethod.get(req.getMethod());
        if (handler == null) {
            log.debug("method not found: method={}, id={}", req.getMethod(), req.getId());
            return Single.just(JsonRpcResponse.failed(req.getId(), new MethodNotFoundException(req.getMethod())));
        }
        return Single.defer(() -> handler.handle(req)
                        .map(result -> JsonRpcResponse.success(req.getId(), result))
                        .defaultIfEmpty(JsonRpcResponse.success(req.getId(), null)))
                .onErrorReturn(err -> toErrorResponse(req, err))
                .doOnSuccess(resp -> log.debug("request handled: method={}, id={}, successful={}, duration={}",
                        req::getMethod, req::getId, resp::isSuccessful,
                        () -> Duration.between(startedAt, Instant.now())));
    }

    private static JsonRpcResponse toErrorResponse(JsonRpcRequest req, Throwable err) {
        if (err instanceof McpPublicException publicErr) {
            log.debug("request processing failed: method={}", req.getMethod(), publicErr);
            return JsonRpcResponse.failed(req.getId(), publicErr);
        }
        log.error("unexpected error while handling request: method={}, id={}", req.getMethod(), req.getId(), err);
        return JsonRpcResponse.failed(req.getId(),
                new JsonRpcResponse.Error(INTERNAL_ERROR, "Internal error: " + err.getMessage()));
    }
}
