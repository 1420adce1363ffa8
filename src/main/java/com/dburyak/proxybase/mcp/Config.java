package com.dburyak.proxybase.mcp;

import io.vertx.core.json.JsonObject;
import lombok.Value;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

@Value
public class Config {
    public static final String CFG_PREFIX_ENV = "PROXYBASE_MCP_";
    // kept without the prefix, this is the name agent hosts already put into their MCP server definitions
    public static final String API_URL_ENV = "PROXYBASE_API_URL";
    public static final String SERVER_VERSION_ENV = CFG_PREFIX_ENV + "SERVER_VERSION";
    public static final String GRACEFUL_SHUTDOWN_TIMEOUT_ENV = CFG_PREFIX_ENV + "GRACEFUL_SHUTDOWN_TIMEOUT";
    public static final List<String> ALL_ENV_VARS = List.of(
            API_URL_ENV,
            SERVER_VERSION_ENV,
            GRACEFUL_SHUTDOWN_TIMEOUT_ENV
    );

    private static final String CFG_PREFIX = "proxybase";
    private static final String API_URL = "apiUrl";
    private static final String API_URL_DEFAULT = "https://api.proxybase.xyz";
    private static final String SERVER_VERSION = "serverVersion";
    private static final String SERVER_VERSION_DEFAULT = "0.1.0";
    private static final String GRACEFUL_SHUTDOWN_TIMEOUT = "gracefulShutdownTimeout";
    private static final String GRACEFUL_SHUTDOWN_TIMEOUT_DEFAULT_STR = "10s";

    String apiUrl;
    String serverVersion;
    Duration gracefulShutdownTimeout;

    public Config(JsonObject cfgRootJson) {
        var cfgProxyBaseJson = cfgRootJson.getJsonObject(CFG_PREFIX);
        this.apiUrl = normalizeApiUrl(getString(API_URL_ENV, cfgRootJson, API_URL, cfgProxyBaseJson,
                () -> API_URL_DEFAULT));
        this.serverVersion = getString(SERVER_VERSION_ENV, cfgRootJson, SERVER_VERSION, cfgProxyBaseJson,
                () -> SERVER_VERSION_DEFAULT);
        var gracefulShutdownTimeoutStr = getString(GRACEFUL_SHUTDOWN_TIMEOUT_ENV, cfgRootJson,
                GRACEFUL_SHUTDOWN_TIMEOUT, cfgProxyBaseJson, () -> GRACEFUL_SHUTDOWN_TIMEOUT_DEFAULT_STR);
        this.gracefulShutdownTimeout = parseDuration(gracefulShutdownTimeoutStr);
        if (gracefulShutdownTimeout.isNegative() || gracefulShutdownTimeout.isZero()) {
            throw new IllegalArgumentException(GRACEFUL_SHUTDOWN_TIMEOUT + " must be > 0");
        }
    }

    private static String normalizeApiUrl(String rawUrl) {
        var url = rawUrl.strip();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid ProxyBase API URL provided via env var " + API_URL_ENV
                    + ": " + rawUrl, e);
        }
        var scheme = uri.getScheme();
        if (!uri.isAbsolute() || uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("ProxyBase API URL must be an absolute http(s) URL, got: " + rawUrl);
        }
        return url;
    }

    private static String getString(String envVarName, JsonObject cfgJson, String cfgName, JsonObject subCfgJson,
            Supplier<String> defaultValue) {
        if (envVarName != null) {
            // env store parses values as JSON where it can, so "1.0" may arrive as a number
            var envValue = cfgJson.getValue(envVarName);
            if (envValue != null) {
                return envValue.toString();
            }
        }
        if (subCfgJson != null && cfgName != null) {
            var cfgValue = subCfgJson.getValue(cfgName);
            if (cfgValue != null) {
                return cfgValue.toString();
            }
        }
        return defaultValue.get();
    }

    private static Duration parseDuration(String durationStr) {
        // for simple cases this should work, e.g. "60s", "5m", "1h", "2h30m", "1h15m10s"
        try {
            return Duration.parse("PT" + durationStr);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid duration: " + durationStr, e);
        }
    }
}
