package com.mk.fx.qa.ws.benchmark.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link StreamTransport} backed by the JDK {@link java.net.http.WebSocket} client. All connections
 * of a run share one {@link HttpClient} and a small I/O pool; each connection is driven by async
 * callbacks, no thread is dedicated to a single session. This implementation does not retry.
 */
@Slf4j
public class WebSocketStreamTransport implements StreamTransport {

    /** Default number of I/O threads shared by all connections. */
    public static final int DEFAULT_IO_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());

    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final Duration connectTimeout;

    public WebSocketStreamTransport(Duration connectTimeout) {
        this(connectTimeout, DEFAULT_IO_THREADS);
    }

    public WebSocketStreamTransport(Duration connectTimeout, int ioThreads) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("Connect timeout must be positive");
        }
        this.executor = Executors.newFixedThreadPool(Math.max(1, ioThreads), ioThreadFactory());
        this.httpClient =
                HttpClient.newBuilder().connectTimeout(connectTimeout).executor(executor).build();

        log.info(
                "WebSocket transport initialised - Connect timeout: {}ms, I/O threads: {}",
                connectTimeout.toMillis(),
                ioThreads);
    }

    @Override
    public CompletableFuture<StreamConnection> connect(URI endpoint, FrameListener listener) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(listener, "listener");

        var adapter = new ListenerAdapter(listener);
        try {
            return httpClient
                    .newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(endpoint, adapter)
                    .thenApply(JdkStreamConnection::new);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.debug("WebSocket I/O threads still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory ioThreadFactory() {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("ws-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /** Reassembles partial text frames and applies one-message-at-a-time flow control. */
    private static final class ListenerAdapter implements WebSocket.Listener {

        private final FrameListener delegate;
        private final StringBuilder partial = new StringBuilder();

        ListenerAdapter(FrameListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            // demand is signalled by JdkStreamConnection#startReceiving
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                var text = partial.toString();
                partial.setLength(0);
                delegate.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            delegate.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            delegate.onError(error);
        }
    }

    /** Serialises sends, since the JDK client rejects a send while the previous one is pending. */
    private static final class JdkStreamConnection implements StreamConnection {

        private final WebSocket webSocket;
        private final AtomicBoolean receiving = new AtomicBoolean(false);
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        JdkStreamConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public void startReceiving() {
            if (receiving.compareAndSet(false, true)) {
                webSocket.request(1);
            }
        }

        @Override
        public synchronized CompletableFuture<Void> sendText(String text) {
            CompletableFuture<Void> next =
                    tail.handle((ignored, error) -> null)
                            .thenCompose(ignored -> webSocket.sendText(text, true))
                            .thenApply(ws -> null);
            tail = next;
            return next;
        }

        @Override
        public synchronized CompletableFuture<Void> close(int statusCode, String reason) {
            CompletableFuture<Void> next =
                    tail.handle((ignored, error) -> null)
                            .thenCompose(ignored -> webSocket.sendClose(statusCode, reason))
                            .thenApply(ws -> null);
            tail = next;
            return next;
        }

        @Override
        public void abort() {
            webSocket.abort();
        }

        @Override
        public boolean isOpen() {
            return !webSocket.isInputClosed() && !webSocket.isOutputClosed();
        }
    }
}
