package com.acme.chatcore.gateway;

import com.acme.chatcore.ratelimit.Permit;
import com.acme.chatcore.telemetry.ClientMetrics;
import com.acme.chatcore.telemetry.NoopClientMetrics;
import com.acme.chatcore.transport.GatewayTransport;
import com.acme.chatcore.transport.TransportEvent;
import com.acme.chatcore.transport.TransportFactory;
import com.acme.chatcore.util.ClientDefaults;
import com.acme.chatcore.util.Deadlines;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.DataFormatException;

/**
 * One gateway connection and its lifecycle: connect, identify or resume, heartbeat,
 * and reconnect according to how the previous connection ended.
 *
 * <p>A runner thread owns the connect/read/reconnect loop. Each open transport also gets
 * a heartbeat thread, and an identify thread while it waits for its identify slot.
 * {@link #close()} interrupts the runner, and ending a connection interrupts its own
 * threads, so no wait outlives the shard.</p>
 */
public final class Shard implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Shard.class.getName());
    static final int RESUMABLE_CLOSE_CODE = 4000;
    static final int NORMAL_CLOSE_CODE = 1000;
    private static final long FALLBACK_HEARTBEAT_INTERVAL_MS = 41_250L;

    private final int shardId;
    private final int shardCount;
    private final URI gatewayUri;
    private final ShardManagerOptions options;
    private final TransportFactory transports;
    private final IdentifyThrottle throttle;
    private final GatewayEventListener listener;
    private final ClientMetrics metrics;
    private final CountDownLatch startup = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean();

    private volatile ShardState state = ShardState.DISCONNECTED;
    private volatile String sessionId;
    private volatile Long sequence;
    private volatile URI resumeUri;
    private volatile long latencyNanos = -1L;
    private volatile Connection current;
    private volatile Thread runner;
    private volatile boolean closing;

    public Shard(int shardId,
                 int shardCount,
                 URI gatewayUri,
                 ShardManagerOptions options,
                 TransportFactory transports,
                 IdentifyThrottle throttle,
                 GatewayEventListener listener,
                 ClientMetrics metrics) {
        if (shardId < 0 || shardId >= shardCount) {
            throw new IllegalArgumentException("shardId " + shardId + " outside 0.." + (shardCount - 1));
        }
        this.shardId = shardId;
        this.shardCount = shardCount;
        this.gatewayUri = Objects.requireNonNull(gatewayUri, "gatewayUri");
        this.options = Objects.requireNonNull(options, "options");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.listener = listener == null ? GatewayEventListener.NOOP : listener;
        this.metrics = metrics == null ? NoopClientMetrics.INSTANCE : metrics;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Shard " + shardId + " already started");
        }
        Thread t = new Thread(this::run, "gateway-shard-" + shardId);
        t.setDaemon(true);
        runner = t;
        t.start();
    }

    /**
     * Waits until the first connection has left {@link ShardState#CONNECTING}, failed to
     * connect, or the shard stopped.
     */
    public boolean awaitStartup(Duration timeout) throws InterruptedException {
        return startup.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Sends a command on the current connection.
     */
    public CompletableFuture<Void> send(GatewayPayload payload) {
        Connection c = current;
        if (c == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Shard " + shardId + " is not connected"));
        }
        return c.send(payload);
    }

    public CompletableFuture<Void> send(GatewayOpcode op, JsonNode data) {
        return send(GatewayPayload.of(op, data));
    }

    /**
     * Drops the current connection and reconnects, resuming when {@code resumable} and a
     * session exists.
     */
    public void requestReconnect(boolean resumable) {
        Connection c = current;
        if (c == null) {
            return;
        }
        CloseAction action = resumable ? CloseAction.RESUME : CloseAction.IDENTIFY;
        c.requestClose(new DisconnectEvent(closeCodeFor(action), "reconnect requested", action, Optional.empty()));
    }

    private void run() {
        GatewayException terminal = null;
        int attempt = 0;
        Duration minDelay = Duration.ZERO;
        Throwable lastFailure = null;
        try {
            while (!closing) {
                if (attempt > 0) {
                    if (!options.reconnectPolicy().allowReconnect(shardId, attempt)) {
                        throw new ReconnectCheckFailedException(shardId, attempt, lastFailure);
                    }
                    metrics.incReconnects(shardId);
                    Duration backoff = options.reconnectPolicy().backoff(attempt);
                    Duration delay = backoff.compareTo(minDelay) >= 0 ? backoff : minDelay;
                    int currentAttempt = attempt;
                    LOG.fine(() -> "Shard " + shardId + " reconnect attempt=" + currentAttempt
                        + " delayMs=" + delay.toMillis());
                    Deadlines.sleep(delay);
                }
                Ended ended = connectOnce();
                if (closing) {
                    break;
                }
                DisconnectEvent event = ended.event();
                notifyListener(l -> l.onDisconnected(shardId, event));
                if (event.action() == CloseAction.FATAL) {
                    metrics.incFatalDisconnects(event.closeCode());
                    throw event.error().orElseGet(() -> new GatewayException("Fatal disconnect code=" + event.closeCode()));
                }
                if (event.action() == CloseAction.IDENTIFY) {
                    clearSession();
                }
                attempt = ended.reachedReady() ? 1 : attempt + 1;
                minDelay = ended.delay();
                lastFailure = ended.failure();
                transition(ShardState.RECONNECTING);
            }
        } catch (InterruptedException e) {
            if (!closing) {
                LOG.warning(() -> "Shard " + shardId + " interrupted, stopping");
            }
        } catch (GatewayException e) {
            terminal = e;
        } finally {
            Connection c = current;
            if (c != null) {
                c.transport.close(NORMAL_CLOSE_CODE, "shutdown");
            }
            current = null;
            transition(ShardState.DISCONNECTED);
            startup.countDown();
        }
        if (terminal != null && !closing) {
            GatewayException cause = terminal;
            LOG.log(Level.SEVERE, "Shard " + shardId + " stopped", cause);
            notifyListener(l -> l.onTerminated(shardId, cause));
        }
    }

    private Ended connectOnce() throws InterruptedException {
        transition(ShardState.CONNECTING);
        URI base = canResume() && resumeUri != null ? resumeUri : gatewayUri;
        URI target = connectionUri(base, options.compress());
        GatewayTransport transport;
        try {
            transport = transports.connect(target, options.connectTimeout());
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Shard " + shardId + " failed to connect to " + target, e);
            startup.countDown();
            return new Ended(new DisconnectEvent(TransportEvent.Closed.NO_CLOSE_CODE, e.getMessage(),
                CloseAction.RESUME, Optional.empty()), false, Duration.ZERO, e);
        }
        Connection connection = new Connection(transport);
        current = connection;
        try {
            if (closing) {
                return new Ended(new DisconnectEvent(NORMAL_CLOSE_CODE, "shutdown", CloseAction.IDENTIFY,
                    Optional.empty()), false, Duration.ZERO, null);
            }
            LOG.fine(() -> "Shard " + shardId + " connected to " + target);
            notifyListener(l -> l.onConnected(shardId));
            return connection.run();
        } finally {
            current = null;
            connection.release();
        }
    }

    static URI connectionUri(URI base, boolean compress) {
        String raw = base.toString();
        if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
            int q = raw.indexOf('?');
            raw = q < 0 ? raw + "/" : raw.substring(0, q) + "/" + raw.substring(q);
        }
        StringBuilder sb = new StringBuilder(raw)
            .append(raw.indexOf('?') < 0 ? '?' : '&')
            .append("v=").append(ClientDefaults.GATEWAY_API_VERSION)
            .append("&encoding=").append(ClientDefaults.GATEWAY_ENCODING);
        if (compress) {
            sb.append("&compress=zlib-stream");
        }
        return URI.create(sb.toString());
    }

    private boolean canResume() {
        return sessionId != null && sequence != null;
    }

    private void clearSession() {
        sessionId = null;
        sequence = null;
        resumeUri = null;
    }

    private static int closeCodeFor(CloseAction action) {
        return action == CloseAction.RESUME ? RESUMABLE_CLOSE_CODE : NORMAL_CLOSE_CODE;
    }

    private void transition(ShardState to) {
        ShardState from = state;
        if (from == to) {
            return;
        }
        state = to;
        LOG.fine(() -> "Shard " + shardId + " " + from + " -> " + to);
        notifyListener(l -> l.onStateChanged(shardId, from, to));
    }

    private void notifyListener(Consumer<GatewayEventListener> callback) {
        try {
            callback.accept(listener);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Gateway listener failed for shard " + shardId, e);
        }
    }

    public int shardId() {
        return shardId;
    }

    public int shardCount() {
        return shardCount;
    }

    public ShardState state() {
        return state;
    }

    public String sessionId() {
        return sessionId;
    }

    public Long sequence() {
        return sequence;
    }

    /**
     * Round trip of the last acknowledged heartbeat.
     */
    public Optional<Duration> latency() {
        long nanos = latencyNanos;
        return nanos < 0 ? Optional.empty() : Optional.of(Duration.ofNanos(nanos));
    }

    public boolean isRunning() {
        Thread t = runner;
        return t != null && t.isAlive();
    }

    /**
     * Stops the shard and waits briefly for its threads. No terminal notification is sent.
     */
    @Override
    public void close() {
        closing = true;
        Connection c = current;
        if (c != null) {
            c.transport.close(NORMAL_CLOSE_CODE, "shutdown");
        }
        Thread t = runner;
        if (t == null) {
            return;
        }
        t.interrupt();
        if (t != Thread.currentThread()) {
            try {
                t.join(ClientDefaults.SHARD_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String toString() {
        return "Shard{" + shardId + "/" + shardCount + ", state=" + state + '}';
    }

    /**
     * How a connection ended.
     *
     * @param delay minimum wait before the next attempt
     */
    private record Ended(DisconnectEvent event, boolean reachedReady, Duration delay, Throwable failure) {
    }

    /**
     * State scoped to one transport: decompression context, heartbeat thread and the
     * reason for a close this side initiated.
     */
    private final class Connection {
        private final GatewayTransport transport;
        private final ZlibStreamDecompressor decompressor;
        private final AtomicBoolean heartbeatAcked = new AtomicBoolean(true);
        private final AtomicReference<DisconnectEvent> localClose = new AtomicReference<>();
        private volatile long lastHeartbeatNanos;
        private Thread heartbeatThread;
        private volatile Thread identifyThread;
        private boolean reachedReady;

        Connection(GatewayTransport transport) {
            this.transport = transport;
            this.decompressor = options.compress() ? new ZlibStreamDecompressor() : null;
        }

        Ended run() throws InterruptedException {
            while (true) {
                TransportEvent event = transport.receive();
                if (event instanceof TransportEvent.Closed closed) {
                    return closedBy(closed);
                }
                List<byte[]> payloads;
                try {
                    payloads = decode((TransportEvent.Message) event);
                } catch (DataFormatException e) {
                    LOG.log(Level.WARNING, "Shard " + shardId + " received a corrupt zlib stream", e);
                    return endLocally(CloseAction.RESUME, "corrupt compressed stream", Duration.ZERO);
                }
                for (byte[] raw : payloads) {
                    Ended ended = handle(raw);
                    if (ended != null) {
                        return ended;
                    }
                }
            }
        }

        private List<byte[]> decode(TransportEvent.Message message) throws DataFormatException {
            if (message.binary() && decompressor != null) {
                return decompressor.feed(message.data());
            }
            return List.of(message.data());
        }

        private Ended handle(byte[] raw) throws InterruptedException {
            GatewayPayload payload;
            try {
                payload = GatewayPayload.parse(raw);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Shard " + shardId + " dropped a malformed payload", e);
                return null;
            }
            if (payload.s() != null) {
                sequence = payload.s();
            }
            GatewayOpcode op = payload.opcode();
            if (op == null) {
                LOG.fine(() -> "Shard " + shardId + " ignoring unknown opcode " + payload.op());
                return null;
            }
            switch (op) {
                case HELLO -> onHello(payload);
                case HEARTBEAT -> sendHeartbeat();
                case HEARTBEAT_ACK -> {
                    heartbeatAcked.set(true);
                    latencyNanos = System.nanoTime() - lastHeartbeatNanos;
                }
                case RECONNECT -> {
                    LOG.info(() -> "Shard " + shardId + " asked to reconnect");
                    return endLocally(CloseAction.RESUME, "reconnect requested by server", Duration.ZERO);
                }
                case INVALID_SESSION -> {
                    if (payload.d().asBoolean(false)) {
                        LOG.info(() -> "Shard " + shardId + " session invalidated, resumable");
                        return endLocally(CloseAction.RESUME, "invalid session", Duration.ZERO);
                    }
                    long delayMs = ThreadLocalRandom.current().nextLong(
                        ClientDefaults.INVALID_SESSION_MIN_DELAY_MS, ClientDefaults.INVALID_SESSION_MAX_DELAY_MS + 1);
                    LOG.info(() -> "Shard " + shardId + " session invalidated, identifying in " + delayMs + "ms");
                    return endLocally(CloseAction.IDENTIFY, "invalid session", Duration.ofMillis(delayMs));
                }
                case DISPATCH -> onDispatch(payload);
                default -> LOG.fine(() -> "Shard " + shardId + " ignoring opcode " + op);
            }
            return null;
        }

        private void onHello(GatewayPayload payload) {
            long interval = payload.d().path("heartbeat_interval").asLong(0L);
            if (interval <= 0L) {
                LOG.warning(() -> "Shard " + shardId + " HELLO without heartbeat_interval");
                interval = FALLBACK_HEARTBEAT_INTERVAL_MS;
            }
            startHeartbeat(interval);
            if (canResume()) {
                transition(ShardState.RESUMING);
                startup.countDown();
                send(GatewayPayload.resume(options.token(), sessionId, sequence));
                return;
            }
            transition(ShardState.IDENTIFYING);
            startIdentify();
        }

        /**
         * Waits for the identify slot off the reader thread, so acks and server ops are
         * still consumed while the shard is queued.
         */
        private void startIdentify() {
            stopIdentify();
            Thread t = new Thread(this::identifyWhenAllowed, "gateway-identify-" + shardId);
            t.setDaemon(true);
            identifyThread = t;
            t.start();
        }

        private void identifyWhenAllowed() {
            startup.countDown();
            try (Permit ignored = throttle.acquire(shardId)) {
                if (!transport.isOpen() || localClose.get() != null) {
                    return;
                }
                send(GatewayPayload.identify(options.token(), options.intents(), shardId, shardCount,
                    options.presence(), options.largeThreshold()));
                metrics.incIdentifies(shardId);
                LOG.fine(() -> "Shard " + shardId + " identify sent");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void stopIdentify() {
            Thread t = identifyThread;
            identifyThread = null;
            if (t == null || t == Thread.currentThread()) {
                return;
            }
            t.interrupt();
            try {
                t.join(ClientDefaults.SHARD_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void onDispatch(GatewayPayload payload) {
            if ("READY".equals(payload.t())) {
                String session = payload.d().path("session_id").asText(null);
                String resumeUrl = payload.d().path("resume_gateway_url").asText(null);
                sessionId = session;
                resumeUri = resumeUrl == null || resumeUrl.isBlank() ? null : URI.create(resumeUrl);
                reachedReady = true;
                transition(ShardState.READY);
                LOG.info(() -> "Shard " + shardId + "/" + shardCount + " ready session=" + session);
                notifyListener(l -> l.onIdentified(shardId, session));
            } else if ("RESUMED".equals(payload.t())) {
                reachedReady = true;
                transition(ShardState.READY);
                metrics.incResumes(shardId);
                LOG.info(() -> "Shard " + shardId + " resumed session=" + sessionId);
                notifyListener(l -> l.onResumed(shardId));
            }
            notifyListener(l -> l.onDispatch(shardId, payload));
        }

        private Ended closedBy(TransportEvent.Closed closed) {
            DisconnectEvent local = localClose.get();
            if (local != null) {
                return new Ended(local, reachedReady, Duration.ZERO, null);
            }
            GatewayCloseCode.Classification c = GatewayCloseCode.classify(closed.code(), closed.reason());
            if (c.error() instanceof UnhandledCloseCodeException) {
                LOG.warning(() -> "Shard " + shardId + " closed with unhandled code=" + closed.code()
                    + " reason=" + closed.reason());
            } else {
                LOG.info(() -> "Shard " + shardId + " closed code=" + closed.code()
                    + " reason=" + closed.reason() + " action=" + c.action());
            }
            DisconnectEvent event = new DisconnectEvent(closed.code(), closed.reason(), c.action(),
                Optional.ofNullable(c.error()));
            return new Ended(event, reachedReady, Duration.ZERO, c.error());
        }

        private Ended endLocally(CloseAction action, String reason, Duration delay) {
            DisconnectEvent event = new DisconnectEvent(closeCodeFor(action), reason, action, Optional.empty());
            localClose.compareAndSet(null, event);
            transport.close(event.closeCode(), reason);
            return new Ended(localClose.get(), reachedReady, delay, null);
        }

        void requestClose(DisconnectEvent event) {
            if (localClose.compareAndSet(null, event)) {
                transport.close(event.closeCode(), event.reason());
            }
        }

        CompletableFuture<Void> send(GatewayPayload payload) {
            String json;
            try {
                json = payload.toJson();
            } catch (JsonProcessingException e) {
                return CompletableFuture.failedFuture(e);
            }
            return transport.send(json).whenComplete((ignored, error) -> {
                if (error != null) {
                    LOG.log(Level.FINE, "Shard " + shardId + " send failed op=" + payload.op(), error);
                }
            });
        }

        private void sendHeartbeat() {
            lastHeartbeatNanos = System.nanoTime();
            send(GatewayPayload.heartbeat(sequence));
        }

        private void startHeartbeat(long intervalMs) {
            stopHeartbeat();
            heartbeatAcked.set(true);
            Thread t = new Thread(() -> heartbeatLoop(intervalMs), "gateway-heartbeat-" + shardId);
            t.setDaemon(true);
            heartbeatThread = t;
            t.start();
        }

        private void heartbeatLoop(long intervalMs) {
            try {
                Deadlines.sleep(Duration.ofMillis((long) (intervalMs * ThreadLocalRandom.current().nextDouble())));
                while (transport.isOpen()) {
                    if (!heartbeatAcked.getAndSet(false)) {
                        LOG.warning(() -> "Shard " + shardId + " missed heartbeat ack, reconnecting");
                        requestClose(new DisconnectEvent(RESUMABLE_CLOSE_CODE, "heartbeat ack missed",
                            CloseAction.RESUME, Optional.empty()));
                        return;
                    }
                    sendHeartbeat();
                    Deadlines.sleep(Duration.ofMillis(intervalMs));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void stopHeartbeat() {
            Thread t = heartbeatThread;
            heartbeatThread = null;
            if (t != null) {
                t.interrupt();
            }
        }

        void release() {
            stopHeartbeat();
            stopIdentify();
            if (transport.isOpen()) {
                transport.close(NORMAL_CLOSE_CODE, "shutdown");
            }
            if (decompressor != null) {
                decompressor.close();
            }
        }
    }
}
