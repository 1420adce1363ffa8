package com.dburyak.proxybase.mcp.tools;

import io.vertx.core.json.JsonArray;

import java.util.List;
import java.util.Optional;

/**
 * Static catalog of the tools this server exposes. Names and schemas are the contract with every MCP client, so any
 * change here is a breaking change for callers.
 */
public final class ToolRegistry {
    public static final String REGISTER_AGENT = "register_agent";
    public static final String LIST_PACKAGES = "list_packages";
    public static final String LIST_CURRENCIES = "list_currencies";
    public static final String CREATE_ORDER = "create_order";
    public static final String CHECK_ORDER_STATUS = "check_order_status";
    public static final String TOPUP_ORDER = "topup_order";
    public static final String ROTATE_PROXY = "rotate_proxy";

    public static final String ARG_API_KEY = "api_key";
    public static final String ARG_PACKAGE_ID = "package_id";
    public static final String ARG_ORDER_ID = "order_id";
    public static final String ARG_PAY_CURRENCY = "pay_currency";
    public static final String ARG_CALLBACK_URL = "callback_url";

    private static final String API_KEY_DESCRIPTION = "Your ProxyBase API key (starts with pk_)";
    private static final String PAY_CURRENCY_DESCRIPTION = "Cryptocurrency to pay with. Use list_currencies to get "
            + "valid values. Defaults to 'usdttrc20'.";

    public static final List<ToolDefinition> TOOLS = List.of(
            ToolDefinition.builder(REGISTER_AGENT)
                    .description("Register a new AI agent with ProxyBase and receive an API key. This is the first "
                            + "step: you need an API key to use all other tools. The API key should be saved and "
                            + "reused for subsequent requests.")
                    .build(),
            ToolDefinition.builder(LIST_PACKAGES)
                    .description("List all available proxy bandwidth packages with pricing. Each package includes a "
                            + "bandwidth allocation (in bytes), price (in USD), proxy type, and target country.")
                    .requiredString(ARG_API_KEY, API_KEY_DESCRIPTION)
                    .build(),
            ToolDefinition.builder(LIST_CURRENCIES)
                    .description("List all available payment currencies (cryptocurrencies) that can be used for the "
                            + "pay_currency field when creating an order or topping up. These are the coins enabled "
                            + "on the payment provider's merchant account. You MUST call this before creating an "
                            + "order to know which pay_currency values are valid.")
                    .requiredString(ARG_API_KEY, API_KEY_DESCRIPTION)
                    .build(),
            ToolDefinition.builder(CREATE_ORDER)
                    .description("Create a new proxy order. This generates a cryptocurrency payment invoice. Once "
                            + "payment is confirmed via the blockchain, your SOCKS5 proxy credentials will be "
                            + "provisioned automatically. Poll check_order_status to monitor payment and get "
                            + "credentials.")
                    .requiredString(ARG_API_KEY, API_KEY_DESCRIPTION)
                    .requiredString(ARG_PACKAGE_ID, "The package ID to purchase (e.g., 'us_residential_1gb')")
                    .optionalString(ARG_PAY_CURRENCY, PAY_CURRENCY_DESCRIPTION)
                    .optionalString(ARG_CALLBACK_URL, "Optional webhook URL to receive status notifications "
                            + "(payment confirmed, bandwidth 80%/95%, exhausted)")
                    .build(),
            ToolDefinition.builder(CHECK_ORDER_STATUS)
                    .description("Check the current status of an order. Returns payment status, bandwidth usage, "
                            + "and SOCKS5 proxy credentials (host:port:username:password) once the proxy is active. "
                            + "Statuses: payment_pending → confirming → paid → proxy_active → bandwidth_exhausted.")
                    .requiredString(ARG_API_KEY, API_KEY_DESCRIPTION)
                    .requiredString(ARG_ORDER_ID, "The order ID returned from create_order")
                    .build(),
            ToolDefinition.builder(TOPUP_ORDER)
                    .description("Add more bandwidth to an existing order. Creates a new payment invoice for the "
                            + "additional bandwidth. The proxy credentials remain the same, only the bandwidth "
                            + "allowance increases. Can also reactivate an exhausted proxy.")
                    .requiredString(ARG_API_KEY, API_KEY_DESCRIPTION)
                    .requiredString(ARG_ORDER_ID, "The order ID to top up")
                    .requiredString(ARG_PACKAGE_ID, "The bandwidth package to add (e.g., 'us_residential_1gb')")
                    .optionalString(ARG_PAY_CURRENCY, PAY_CURRENCY_DESCRIPTION)
                    .build(),
            ToolDefinition.builder(ROTATE_PROXY)
                    .description("Rotate the proxy to get a fresh IP address. This calls the upstream partner's "
                            + "reset endpoint to invalidate the current session and assign a new IP. Only works on "
                            + "orders with proxy_active status. After rotation, your next SOCKS5 connection will use "
                            + "a new IP.")
                    .requiredString(ARG_API_KEY, API_KEY_DESCRIPTION)
                    .requiredString(ARG_ORDER_ID, "The order ID whose proxy should be rotated")
                    .build()
    );

    private ToolRegistry() {
    }

    public static Optional<ToolDefinition> find(String name) {
        return TOOLS.stream()
                .filter(tool -> tool.getName().equals(name))
                .findFirst();
    }

    /**
     * Fresh JSON rendering of the catalog, safe for callers to mutate.
     */
    public static JsonArray toJson() {
        var tools = new JsonArray();
        TOOLS.forEach(tool -> tools.add(tool.toJson()));
        return tools;
    }
}
