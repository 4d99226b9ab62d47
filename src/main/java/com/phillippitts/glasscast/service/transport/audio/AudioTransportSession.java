package com.phillippitts.glasscast.service.transport.audio;

import com.phillippitts.glasscast.config.transport.AudioGatewayProperties;
import com.phillippitts.glasscast.domain.AdtsFrame;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.exception.TransportExceptionBuilder;
import com.phillippitts.glasscast.service.transport.StreamingStatsTracker;
import com.phillippitts.glasscast.util.LogSanitizer;
import com.phillippitts.glasscast.util.TimeUtils;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket session to the audio gateway.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING (start)
 * CONNECTING → CONNECTED (first inbound message)
 * CONNECTING | CONNECTED → ERROR (write rejected, socket failure, remote close)
 * any → DISCONNECTED (stop)
 * </pre>
 *
 * <p>Sends are fire-and-forget: each ADTS frame becomes one JSON text message queued on the
 * socket. Once in ERROR every further send is dropped until the session is stopped and started
 * again. There is no reconnect.
 *
 * <p>Chunk indices start at 0 on every {@link #start(Listener)} and increase by one per frame
 * accepted by {@link #sendAudio(AdtsFrame)}.
 */
public class AudioTransportSession {

    private static final Logger LOG = LogManager.getLogger(AudioTransportSession.class);

    private static final int NORMAL_CLOSURE = 1000;

    /** Status callbacks. Invoked on OkHttp or caller threads, never while holding the session lock. */
    public interface Listener {
        void onStatusChanged(TransportStatus status);

        void onTransportError(TransportException error);
    }

    private final OkHttpClient client;
    private final AudioGatewayProperties props;
    private final Clock clock;
    private final StreamingStatsTracker stats;

    private final Object lock = new Object();
    private final AtomicLong chunkIndex = new AtomicLong();
    private TransportStatus status = TransportStatus.DISCONNECTED;
    private WebSocket socket;
    private GatewayListener socketListener;
    private Listener listener;
    private int generation;

    public AudioTransportSession(OkHttpClient client, AudioGatewayProperties props) {
        this(client, props, Clock.systemUTC(), new StreamingStatsTracker());
    }

    public AudioTransportSession(OkHttpClient client,
                                 AudioGatewayProperties props,
                                 Clock clock,
                                 StreamingStatsTracker stats) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
    }

    /**
     * Opens the socket. A previous connection, if any, is stopped first.
     *
     * @throws TransportException if no gateway URL is configured
     */
    public void start(Listener newListener) {
        Objects.requireNonNull(newListener, "listener must not be null");
        stop();
        if (props.getUrl() == null) {
            throw TransportExceptionBuilder.create("No audio gateway URL configured")
                    .metadata("property", "stream.audio-gateway.url")
                    .build();
        }
        Request request = GatewayEndpoint.buildRequest(props.getUrl(), props.getToken(), props.isTokenInHeader());
        String endpoint = LogSanitizer.redactCredentials(request.url().toString());

        synchronized (lock) {
            chunkIndex.set(0);
            stats.reset();
            listener = newListener;
            status = TransportStatus.CONNECTING;
            socketListener = new GatewayListener(++generation, endpoint);
            socket = client.newWebSocket(request, socketListener);
        }
        LOG.info("Connecting to audio gateway {}", endpoint);
        newListener.onStatusChanged(TransportStatus.CONNECTING);
    }

    /**
     * Assigns the next chunk index to the frame and sends it.
     *
     * @return {@code true} if the message was queued on the socket
     */
    public synchronized boolean sendAudio(AdtsFrame frame) {
        if (!getStatus().acceptsSends()) {
            LOG.debug("Dropping audio frame of {} bytes: status={}", frame.length(), getStatus());
            return false;
        }
        return send(frame, chunkIndex.getAndIncrement());
    }

    /**
     * Sends one frame with an explicit chunk index.
     *
     * @return {@code true} if the message was queued on the socket
     */
    public boolean send(AdtsFrame frame, long index) {
        WebSocket ws;
        GatewayListener owner;
        synchronized (lock) {
            if (!status.acceptsSends() || socket == null) {
                LOG.debug("Dropping audio chunk {}: status={}", index, status);
                return false;
            }
            ws = socket;
            owner = socketListener;
        }

        String json = AudioEnvelopeCodec.toJson(AudioEnvelopeCodec.audioEnvelope(frame, index, clock.instant()));
        if (!ws.send(json)) {
            ws.cancel();
            fail(owner.generation, TransportExceptionBuilder.create("Audio gateway rejected write")
                    .endpoint(owner.endpoint)
                    .metadata("chunkIndex", index)
                    .metadata("bytes", json.length())
                    .build());
            return false;
        }
        stats.record(frame.length());
        LOG.debug("Sent audio chunk {} ({} bytes)", index, frame.length());
        return true;
    }

    /**
     * Closes the socket with a normal-closure handshake, waiting at most
     * {@code close-timeout-ms} before cancelling it. Safe from any status and idempotent.
     */
    public void stop() {
        stop(Duration.ofMillis(props.getCloseTimeoutMs()));
    }

    /**
     * Like {@link #stop()}, but waits for the close handshake no longer than {@code budget}
     * when that is shorter than {@code close-timeout-ms}.
     */
    public void stop(Duration budget) {
        long waitMs = Math.max(0L, Math.min(props.getCloseTimeoutMs(), budget.toMillis()));
        WebSocket ws;
        GatewayListener owner;
        Listener currentListener;
        synchronized (lock) {
            ws = socket;
            owner = socketListener;
            currentListener = listener;
            socket = null;
            socketListener = null;
            generation++;
            status = TransportStatus.DISCONNECTED;
        }
        stats.reset();
        if (ws == null) {
            return;
        }

        long startNanos = System.nanoTime();
        if (ws.close(NORMAL_CLOSURE, "client stopping")) {
            try {
                if (!owner.closed.await(waitMs, TimeUnit.MILLISECONDS)) {
                    LOG.warn("Audio gateway did not complete close handshake within {}ms; cancelling socket",
                            waitMs);
                    ws.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ws.cancel();
            }
        } else {
            ws.cancel();
        }
        LOG.info("Audio gateway session stopped in {}ms", TimeUtils.elapsedMillis(startNanos));
        if (currentListener != null) {
            currentListener.onStatusChanged(TransportStatus.DISCONNECTED);
        }
    }

    public TransportStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    /** Index the next accepted frame will carry. */
    public long nextChunkIndex() {
        return chunkIndex.get();
    }

    public StreamingStats recomputeStats() {
        return stats.recompute();
    }

    private void markConnected(int gen) {
        Listener current;
        synchronized (lock) {
            if (gen != generation || status != TransportStatus.CONNECTING) {
                return;
            }
            status = TransportStatus.CONNECTED;
            current = listener;
        }
        stats.markConnected();
        LOG.info("Audio gateway connected");
        current.onStatusChanged(TransportStatus.CONNECTED);
    }

    private void fail(int gen, TransportException error) {
        Listener current;
        synchronized (lock) {
            if (gen != generation || !status.acceptsSends()) {
                return;
            }
            status = TransportStatus.ERROR;
            current = listener;
        }
        LOG.error("Audio gateway transport failed: {}", error.getMessage());
        current.onStatusChanged(TransportStatus.ERROR);
        current.onTransportError(error);
    }

    private final class GatewayListener extends WebSocketListener {

        final int generation;
        final String endpoint;
        final CountDownLatch closed = new CountDownLatch(1);
        final long openedAtNanos = System.nanoTime();

        GatewayListener(int generation, String endpoint) {
            this.generation = generation;
            this.endpoint = endpoint;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            LOG.info("Audio gateway socket open (HTTP {}), awaiting first message", response.code());
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            markConnected(generation);
            InboundMessageLogger.log(text);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            markConnected(generation);
            LOG.debug("Gateway sent {} binary bytes", bytes.size());
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
            fail(generation, TransportExceptionBuilder.create("Audio gateway closed the connection")
                    .endpoint(endpoint)
                    .closeCode(code)
                    .metadata("reason", LogSanitizer.truncate(reason, 120))
                    .build());
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            closed.countDown();
            LOG.debug("Audio gateway socket closed: code={}", code);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            closed.countDown();
            TransportExceptionBuilder builder = TransportExceptionBuilder.create("Audio gateway socket failure")
                    .endpoint(endpoint)
                    .cause(t)
                    .durationMs(TimeUtils.elapsedMillis(openedAtNanos));
            if (response != null) {
                builder.metadata("httpStatus", response.code());
            }
            fail(generation, builder.build());
        }
    }
}
