package com.dburyak.proxybase.mcp.tools;

import com.dburyak.proxybase.mcp.backend.ProxyBaseClient;
import com.dburyak.proxybase.mcp.err.ToolCallException;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.util.List;

import static com.dburyak.proxybase.mcp.tools.ToolRegistry.ARG_API_KEY;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.ARG_CALLBACK_URL;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.ARG_ORDER_ID;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.ARG_PACKAGE_ID;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.ARG_PAY_CURRENCY;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.CHECK_ORDER_STATUS;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.CREATE_ORDER;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.LIST_CURRENCIES;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.LIST_PACKAGES;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.REGISTER_AGENT;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.ROTATE_PROXY;
import static com.dburyak.proxybase.mcp.tools.ToolRegistry.TOPUP_ORDER;

/**
 * Validates tool arguments and maps each tool onto {@link ProxyBaseClient} calls. All failures, including argument
 * validation, are emitted as {@link ToolCallException} through the error channel.
 */
@Log4j2
@RequiredArgsConstructor
public class ToolExecutor {
    private static final String FIELD_CURRENCIES = "currencies";

    private final ProxyBaseClient client;

    public Maybe<Object> execute(String toolName, JsonObject args) {
        return Maybe.defer(() -> {
            log.debug("executing tool: name={}", toolName);
            var tool = ToolRegistry.find(toolName)
                    .orElseThrow(() -> ToolCallException.unknownTool(toolName));
            // declared order, so the first missing one is reported
            tool.getRequiredArguments().forEach(argName -> requireString(args, argName));
            return dispatch(toolName, args);
        });
    }

    /**
     * Expects the arguments the tool's schema requires to be validated already.
     */
    private Maybe<Object> dispatch(String toolName, JsonObject args) {
        var apiKey = optionalString(args, ARG_API_KEY);
        var orderId = optionalString(args, ARG_ORDER_ID);
        var packageId = optionalString(args, ARG_PACKAGE_ID);
        var payCurrency = optionalString(args, ARG_PAY_CURRENCY);
        switch (toolName) {
            case REGISTER_AGENT:
                return client.registerAgent();
            case LIST_PACKAGES:
                return client.listPackages(apiKey);
            case LIST_CURRENCIES:
                return client.listCurrencies(apiKey);
            case CREATE_ORDER: {
                var callbackUrl = optionalString(args, ARG_CALLBACK_URL);
                return validateCurrency(apiKey, payCurrency)
                        .andThen(Maybe.defer(() -> client.createOrder(apiKey, packageId, payCurrency, callbackUrl)));
            }
            case CHECK_ORDER_STATUS:
                return client.checkOrderStatus(apiKey, orderId);
            case TOPUP_ORDER:
                return validateCurrency(apiKey, payCurrency)
                        .andThen(Maybe.defer(() -> client.topupOrder(apiKey, orderId, packageId, payCurrency)));
            case ROTATE_PROXY:
                return client.rotateProxy(apiKey, orderId);
            default:
                throw new IllegalStateException("tool is registered, but has no executor: " + toolName);
        }
    }

    /**
     * Checks the currency against the backend's current list. Not atomic with the order call that follows: the list may
     * change in between, the backend has the final word.
     */
    private Completable validateCurrency(String apiKey, String payCurrency) {
        if (payCurrency == null) {
            return Completable.complete();
        }
        return client.listCurrencies(apiKey)
                .flatMapCompletable(currencies -> {
                    var supported = supportedCurrencies(currencies);
                    if (supported == null) {
                        log.debug("currencies response has no \"{}\" array, skipping pay_currency validation",
                                FIELD_CURRENCIES);
                        return Completable.complete();
                    }
                    var isSupported = supported.stream().anyMatch(payCurrency::equalsIgnoreCase);
                    if (!isSupported) {
                        return Completable.error(new ToolCallException("Invalid pay_currency: '" + payCurrency
                                + "'. Supported currencies: " + String.join(", ", supported)));
                    }
                    return Completable.complete();
                });
    }

    private static List<String> supportedCurrencies(Object currenciesResp) {
        if (!(currenciesResp instanceof JsonObject)) {
            return null;
        }
        var currencies = ((JsonObject) currenciesResp).getValue(FIELD_CURRENCIES);
        if (!(currencies instanceof JsonArray)) {
            return null;
        }
        return ((JsonArray) currencies).stream()
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .toList();
    }

    private static String requireString(JsonObject args, String argName) {
        var value = args.getValue(argName);
        if (!(value instanceof String)) {
            throw ToolCallException.missingArgument(argName);
        }
        return (String) value;
    }

    private static String optionalString(JsonObject args, String argName) {
        var value = args.getValue(argName);
        return value instanceof String ? (String) value : null;
    }
}
