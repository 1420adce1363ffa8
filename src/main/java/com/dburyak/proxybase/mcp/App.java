package com.dburyak.proxybase.mcp;

import com.dburyak.proxybase.mcp.backend.ProxyBaseClient;
import com.dburyak.proxybase.mcp.handlers.InitializeHandler;
import com.dburyak.proxybase.mcp.handlers.NotificationHandler;
import com.dburyak.proxybase.mcp.handlers.ToolsCallHandler;
import com.dburyak.proxybase.mcp.handlers.ToolsListHandler;
import com.dburyak.proxybase.mcp.tools.ToolExecutor;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.plugins.RxJavaPlugins;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.rxjava3.config.ConfigRetriever;
import io.vertx.rxjava3.core.RxHelper;
import io.vertx.rxjava3.core.Vertx;
import io.vertx.rxjava3.ext.web.client.WebClient;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Log4j2
public class App {
    private static final String VERTX_LOGGER_FACTORY_PROP = "vertx.logger-delegate-factory-class-name";
    private static final String VERTX_LOG4J2_LOGGER_FACTORY = "io.vertx.core.logging.Log4j2LogDelegateFactory";

    private volatile Vertx vertx;
    private volatile List<AsyncCloseable> closeables = List.of();
    private final AtomicBoolean isShuttingDown = new AtomicBoolean(false);

    public static void main(String[] args) {
        // must be set before the first Vertx class is touched
        System.setProperty(VERTX_LOGGER_FACTORY_PROP, VERTX_LOG4J2_LOGGER_FACTORY);
        var app = new App();
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
        var isServed = app.run();
        app.shutdown();
        if (!isServed) {
            System.exit(1);
        }
    }

    /**
     * Serves the protocol on stdin/stdout until stdin is closed.
     *
     * @return false if the server failed to start (bad configuration, etc.)
     */
    public boolean run() {
        var startupStartedAt = Instant.now();
        log.debug("starting");
        vertx = Vertx.vertx();
        initRxSchedulers(vertx);
        return configRetriever(vertx).rxGetConfig()
                .map(Config::new)
                .flatMapCompletable(cfg -> {
                    var webClient = buildWebClient(vertx);
                    var backendClient = new ProxyBaseClient(cfg, webClient);
                    var dispatcher = new McpDispatcher(buildMethodHandlers(cfg, backendClient));
                    var transport = new StdioTransport(System.in, System.out, dispatcher,
                            cfg.getGracefulShutdownTimeout());
                    // closed in this order on shutdown
                    closeables = List.of(transport, backendClient);
                    log.info("ProxyBase MCP server started: backend={}, version={}, startupTime={}",
                            cfg::getApiUrl, cfg::getServerVersion,
                            () -> Duration.between(startupStartedAt, Instant.now()));
                    return transport.run();
                })
                .doOnError(err -> log.error("failed to start", err))
                .toSingleDefault(true)
                .onErrorReturnItem(false)
                .blockingGet();
    }

    public void shutdown() {
        // called both after the input ends and from the shutdown hook
        if (!isShuttingDown.compareAndSet(false, true)) {
            log.debug("multiple shutdown calls, shutdown already in progress, ignoring");
            return;
        }
        var shutdownStartedAt = Instant.now();
        log.info("shutting down");
        var closeVertx = (vertx != null) ? vertx.rxClose() : Completable.complete();
        Observable.fromIterable(closeables)
                .concatMapCompletable(AsyncCloseable::closeAsync)
                .doOnComplete(() -> log.debug("transport and backend client closed, closing vertx"))
                .andThen(closeVertx)
                .doOnError(err -> log.error("failed to shutdown cleanly", err))
                .onErrorComplete()
                .blockingAwait();
        log.info("shutdown complete: shutdownTime={}", () -> Duration.between(shutdownStartedAt, Instant.now()));
    }

    private static void initRxSchedulers(Vertx vertx) {
        var elScheduler = RxHelper.scheduler(vertx);
        var workerScheduler = RxHelper.blockingScheduler(vertx, false);
        RxJavaPlugins.setComputationSchedulerHandler(ignr -> elScheduler);
        RxJavaPlugins.setIoSchedulerHandler(ignr -> workerScheduler);
        RxJavaPlugins.setNewThreadSchedulerHandler(ignr -> elScheduler);
    }

    private static ConfigRetriever configRetriever(Vertx vertx) {
        return ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .addStore(new ConfigStoreOptions()
                        .setType("file")
                        .setFormat("yaml")
                        .setConfig(new JsonObject()
                                .put("path", "config.yaml"))) // matches to the name of src/main/resources/config.yaml
                .addStore(new ConfigStoreOptions()
                        .setType("env")
                        .setConfig(new JsonObject()
                                .put("keys", new JsonArray(Config.ALL_ENV_VARS))))
        );
    }

    private static List<MethodHandler> buildMethodHandlers(Config cfg, ProxyBaseClient backendClient) {
        return List.of(
                new InitializeHandler(cfg),
                new ToolsListHandler(),
                new ToolsCallHandler(new ToolExecutor(backendClient)),
                new NotificationHandler()
        );
    }

    private static WebClient buildWebClient(Vertx vertx) {
        return WebClient.create(vertx, new WebClientOptions()
                .setUserAgent("proxybase-mcp"));
    }
}
