package com.dburyak.proxybase.mcp.handlers;

import com.dburyak.proxybase.mcp.JsonRpcRequest;
import com.dburyak.proxybase.mcp.MethodHandler;
import io.reactivex.rxjava3.core.Maybe;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Absorbs client notifications. Cancellation is acknowledged but can't abort a backend call already in flight.
 */
@Log4j2
public class NotificationHandler implements MethodHandler {
    public static final String INITIALIZED = "notifications/initialized";
    public static final String CANCELLED = "notifications/cancelled";

    @Override
    public List<String> methods() {
        return List.of(INITIALIZED, CANCELLED);
    }

    @Override
    public Maybe<Object> handle(JsonRpcRequest req) {
        return Maybe.fromAction(() -> {
            if (CANCELLED.equals(req.getMethod())) {
                log.debug("cancellation requested, ignoring: params={}", req.getParams());
            } else {
                log.info("client initialized");
            }
        });
    }
}
