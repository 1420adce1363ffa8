package com.dburyak.proxybase.mcp;

import com.dburyak.proxybase.mcp.err.JsonRpcParseException;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import lombok.extern.log4j.Log4j2;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Line-delimited JSON-RPC over a pair of streams (stdin/stdout in production). One request per line in, one response
 * per line out.
 * <p>
 * Lines are handled strictly one at a time: the next line isn't taken before the response for the previous one is
 * written, so responses always come out in request order. Reading blocks, so it happens on a dedicated daemon thread
 * instead of the Vertx worker pool (an idle stdin would otherwise be reported as a blocked worker).
 */
@Log4j2
public class StdioTransport implements AsyncCloseable {
    private final InputStream in;
    private final PrintStream out;
    private final McpDispatcher dispatcher;
    private final Duration gracefulShutdownTimeout;
    private final ExecutorService readerExecutor = Executors.newSingleThreadExecutor(r -> {
        var thread = new Thread(r, "mcp-stdio-reader");
        thread.setDaemon(true);
        return thread;
    });
    private final Scheduler readerScheduler = Schedulers.from(readerExecutor);

    // written on the reader thread, may be read from the shutdown hook thread
    private final AtomicInteger inFlightRequests = new AtomicInteger();

    public StdioTransport(InputStream in, OutputStream out, McpDispatcher dispatcher, Duration gracefulShutdownTimeout) {
        this.in = in;
        this.out = new PrintStream(out, false, StandardCharsets.UTF_8);
        this.dispatcher = dispatcher;
        this.gracefulShutdownTimeout = gracefulShutdownTimeout;
    }

    /**
     * Completes when the input stream ends. A read failure is logged and also ends the loop, there's no way to resync
     * a line-delimited stream that can't be read.
     */
    public Completable run() {
        return Flowable.<String, BufferedReader>generate(
                        () -> new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)),
                        (reader, emitter) -> {
                            var line = reader.readLine();
                            if (line == null) {
                                log.info("input stream closed");
                                emitter.onComplete();
                            } else {
                                emitter.onNext(line);
                            }
                        },
                        BufferedReader::close)
                .subscribeOn(readerScheduler)
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .concatMapMaybe(this::handleLine, 1)
                .doOnNext(this::write)
                .ignoreElements()
                .doOnError(err -> log.error("failed to read input stream, stopping", err))
                .onErrorComplete();
    }

    @Override
    public Completable closeAsync() {
        log.debug("closing, inFlightRequests={}", inFlightRequests::get);
        var awaitInFlight = inFlightRequests.get() <= 0
                ? Completable.complete()
                : Flowable.interval(0, 50, MILLISECONDS)
                        .filter(ignr -> inFlightRequests.get() <= 0)
                        .take(1)
                        .ignoreElements()
                        .timeout(gracefulShutdownTimeout.toMillis(), MILLISECONDS, Completable.complete());
        return awaitInFlight.doFinally(readerExecutor::shutdownNow);
    }

    private Maybe<JsonRpcResponse> handleLine(String line) {
        JsonRpcRequest req;
        try {
            req = JsonRpcRequest.parse(line);
        } catch (JsonRpcParseException e) {
            log.warn("failed to parse request line: {}", e.getMessage());
            return Maybe.just(JsonRpcResponse.failed(null, e));
        }
        inFlightRequests.incrementAndGet();
        return dispatcher.dispatch(req)
                .doFinally(inFlightRequests::decrementAndGet)
                // notifications are fully processed, but never answered
                .filter(resp -> !req.isNotification());
    }

    private void write(JsonRpcResponse resp) {
        // compact encoding never contains a raw newline, so one response is exactly one line
        out.print(resp.toJson().encode());
        out.print('\n');
        out.flush();
    }
}
