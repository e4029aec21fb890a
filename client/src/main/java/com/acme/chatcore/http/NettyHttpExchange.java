package com.acme.chatcore.http;

import com.acme.chatcore.util.ClientDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.pool.ChannelPoolHandler;
import io.netty.channel.pool.SimpleChannelPool;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.FutureListener;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Netty HTTP/1.1 client with per-host keep-alive pools, a bounded number of in-flight
 * exchanges and a response timeout.
 */
public final class NettyHttpExchange implements HttpExchange {
    private static final String RESPONSE_HANDLER = "rest-response";

    private final EventLoopGroup ioGroup;
    private final Bootstrap bootstrap;
    private final SslContext sslContext;
    private final Semaphore inFlight;
    private final int responseTimeoutMillis;
    private final ConcurrentHashMap<String, SimpleChannelPool> pools = new ConcurrentHashMap<>();

    public NettyHttpExchange() {
        this(ClientDefaults.DEFAULT_MAX_INFLIGHT, ClientDefaults.DEFAULT_RESPONSE_TIMEOUT_MS,
            ClientDefaults.DEFAULT_HTTP_IO_THREADS);
    }

    public NettyHttpExchange(int maxInFlight, int responseTimeoutMillis) {
        this(maxInFlight, responseTimeoutMillis, ClientDefaults.DEFAULT_HTTP_IO_THREADS);
    }

    public NettyHttpExchange(int maxInFlight, int responseTimeoutMillis, int ioThreads) {
        this.inFlight = new Semaphore(Math.max(1, maxInFlight));
        this.responseTimeoutMillis = Math.max(1, responseTimeoutMillis);
        this.ioGroup = new NioEventLoopGroup(Math.max(1, ioThreads));
        this.bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, ClientDefaults.DEFAULT_CONNECT_TIMEOUT_MS);
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }
    }

    @Override
    public CompletableFuture<RestResponse> execute(RestRequest request) {
        Objects.requireNonNull(request, "request");
        URI target = request.uri();
        CompletableFuture<RestResponse> result = new CompletableFuture<>();
        if (!inFlight.tryAcquire()) {
            result.completeExceptionally(new IllegalStateException("too many in-flight requests"));
            return result;
        }
        AtomicReference<ScheduledFuture<?>> timeoutFutureRef = new AtomicReference<>();
        String host = Objects.requireNonNull(target.getHost(), "target host required");
        int port = resolvePort(target);
        boolean https = isHttps(target);
        SimpleChannelPool pool = poolFor(host, port, https);

        result.whenComplete((ignored, error) -> {
            ScheduledFuture<?> timeoutFuture = timeoutFutureRef.getAndSet(null);
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            inFlight.release();
        });

        pool.acquire().addListener((FutureListener<Channel>) acquireFuture -> {
            if (!acquireFuture.isSuccess()) {
                result.completeExceptionally(acquireFuture.cause());
                return;
            }
            Channel ch = acquireFuture.getNow();
            ch.pipeline().addLast(RESPONSE_HANDLER, new ResponseHandler(result, pool, ch));

            ScheduledFuture<?> timeoutFuture = ch.eventLoop().schedule(() -> {
                if (result.completeExceptionally(new TimeoutException("response timeout"))) {
                    ch.close();
                }
            }, responseTimeoutMillis, TimeUnit.MILLISECONDS);
            timeoutFutureRef.set(timeoutFuture);
            if (result.isDone() && timeoutFutureRef.compareAndSet(timeoutFuture, null)) {
                timeoutFuture.cancel(false);
            }

            ByteBuf content = Unpooled.wrappedBuffer(request.body());
            FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.valueOf(request.method()),
                pathAndQuery(target),
                content
            );
            req.headers().set(HttpHeaderNames.HOST, hostHeader(target));
            req.headers().set(HttpHeaderNames.CONNECTION, "keep-alive");
            req.headers().set(HttpHeaderNames.USER_AGENT, ClientDefaults.USER_AGENT);
            req.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, request.body().length);
            for (Map.Entry<String, String> e : request.headers().entrySet()) {
                req.headers().set(e.getKey(), e.getValue());
            }
            ch.writeAndFlush(req).addListener((ChannelFutureListener) writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    ReferenceCountUtil.safeRelease(req);
                    result.completeExceptionally(writeFuture.cause());
                    writeFuture.channel().close();
                }
            });
        });
        return result;
    }

    private SimpleChannelPool poolFor(String host, int port, boolean https) {
        String key = (https ? "https://" : "http://") + host + ":" + port;
        return pools.computeIfAbsent(key, k -> {
            Bootstrap perHost = bootstrap.clone().remoteAddress(host, port);
            return new SimpleChannelPool(perHost, new RestChannelPoolHandler(host, port, https));
        });
    }

    @Override
    public void close() {
        for (SimpleChannelPool pool : pools.values()) {
            pool.close();
        }
        pools.clear();
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private final class RestChannelPoolHandler implements ChannelPoolHandler {
        private final String host;
        private final int port;
        private final boolean https;

        RestChannelPoolHandler(String host, int port, boolean https) {
            this.host = host;
            this.port = port;
            this.https = https;
        }

        @Override
        public void channelCreated(Channel ch) {
            ChannelPipeline p = ch.pipeline();
            if (https) {
                p.addLast(sslContext.newHandler(ch.alloc(), host, port));
            }
            p.addLast(new HttpClientCodec());
            p.addLast(new HttpObjectAggregator(ClientDefaults.HTTP_RESPONSE_LIMIT));
        }

        @Override
        public void channelAcquired(Channel ch) {
            // pipeline is prepared per request in execute()
        }

        @Override
        public void channelReleased(Channel ch) {
            if (ch.pipeline().get(RESPONSE_HANDLER) != null) {
                ch.pipeline().remove(RESPONSE_HANDLER);
            }
        }
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<RestResponse> result;
        private final SimpleChannelPool pool;
        private final Channel channel;

        private ResponseHandler(CompletableFuture<RestResponse> result, SimpleChannelPool pool, Channel channel) {
            this.result = result;
            this.pool = pool;
            this.channel = channel;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            Map<String, String> headers = new HashMap<>();
            for (Map.Entry<String, String> e : msg.headers()) {
                headers.put(e.getKey(), e.getValue());
            }
            byte[] body = ByteBufUtil.getBytes(msg.content());
            RestResponse response = new RestResponse(msg.status().code(), headers, body);
            // pooled again before the caller sees the response
            if (HttpUtil.isKeepAlive(msg)) {
                pool.release(channel);
            } else {
                channel.close();
            }
            result.complete(response);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!result.isDone()) {
                result.completeExceptionally(new IllegalStateException("connection closed before response"));
            }
            ctx.fireChannelInactive();
        }
    }

    private static boolean isHttps(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    private static int resolvePort(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return isHttps(uri) ? ClientDefaults.HTTPS_DEFAULT_PORT : ClientDefaults.HTTP_DEFAULT_PORT;
    }

    private static String pathAndQuery(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            return path + "?" + uri.getRawQuery();
        }
        return path;
    }

    private static String hostHeader(URI uri) {
        int port = resolvePort(uri);
        if ((isHttps(uri) && port == ClientDefaults.HTTPS_DEFAULT_PORT)
            || (!isHttps(uri) && port == ClientDefaults.HTTP_DEFAULT_PORT)) {
            return uri.getHost();
        }
        return uri.getHost() + ":" + port;
    }
}
