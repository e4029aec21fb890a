package com.acme.chatcore.transport;

import com.acme.chatcore.util.ClientDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens gateway websockets on a shared Netty event loop.
 *
 * <p>Inbound frames are queued for the shard's reader thread; the I/O thread never runs
 * protocol logic.</p>
 */
public final class NettyWebSocketTransportFactory implements TransportFactory, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(NettyWebSocketTransportFactory.class.getName());
    private static final int HANDSHAKE_RESPONSE_LIMIT = 64 * 1024;

    private final EventLoopGroup ioGroup;
    private final SslContext sslContext;

    public NettyWebSocketTransportFactory() {
        this(ClientDefaults.DEFAULT_HTTP_IO_THREADS);
    }

    public NettyWebSocketTransportFactory(int ioThreads) {
        this.ioGroup = new NioEventLoopGroup(Math.max(1, ioThreads), new DefaultThreadFactory("gateway-io", true));
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }
    }

    @Override
    public GatewayTransport connect(URI uri, Duration timeout) throws IOException, InterruptedException {
        Objects.requireNonNull(uri, "uri");
        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        String host = Objects.requireNonNull(uri.getHost(), "uri host required");
        int port = uri.getPort() != -1 ? uri.getPort()
            : (secure ? ClientDefaults.HTTPS_DEFAULT_PORT : ClientDefaults.HTTP_DEFAULT_PORT);
        long deadline = System.nanoTime() + timeout.toNanos();

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), ClientDefaults.MAX_FRAME_PAYLOAD);
        NettyTransport transport = new NettyTransport(handshaker);

        Bootstrap bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1L, timeout.toMillis()))
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline p = ch.pipeline();
                    if (secure) {
                        p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }
                    p.addLast(new HttpClientCodec());
                    p.addLast(new HttpObjectAggregator(HANDSHAKE_RESPONSE_LIMIT));
                    p.addLast(new WebSocketFrameAggregator(ClientDefaults.MAX_FRAME_PAYLOAD));
                    p.addLast(transport);
                }
            });

        ChannelFuture connectFuture = bootstrap.connect(host, port);
        try {
            awaitStep(connectFuture, deadline, "connect to " + host + ":" + port);
            awaitStep(transport.handshakeFuture(), deadline, "websocket handshake with " + uri);
        } catch (IOException | InterruptedException | RuntimeException e) {
            connectFuture.channel().close();
            throw e;
        }
        return transport;
    }

    private static void awaitStep(ChannelFuture future, long deadline, String what)
        throws IOException, InterruptedException {
        long remaining = Math.max(1L, deadline - System.nanoTime());
        if (!future.await(remaining, TimeUnit.NANOSECONDS)) {
            throw new IOException("Timed out waiting for " + what);
        }
        if (!future.isSuccess()) {
            throw new IOException("Failed to " + what, future.cause());
        }
    }

    @Override
    public void close() {
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private static final class NettyTransport extends SimpleChannelInboundHandler<Object> implements GatewayTransport {
        private final WebSocketClientHandshaker handshaker;
        private final LinkedBlockingQueue<TransportEvent> events = new LinkedBlockingQueue<>();
        private final AtomicBoolean closedEmitted = new AtomicBoolean();
        private volatile Channel channel;
        private volatile ChannelPromise handshakeFuture;
        private volatile int closeCode = TransportEvent.Closed.NO_CLOSE_CODE;
        private volatile String closeReason = "";

        NettyTransport(WebSocketClientHandshaker handshaker) {
            this.handshaker = handshaker;
        }

        ChannelFuture handshakeFuture() {
            return handshakeFuture;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            channel = ctx.channel();
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(new IOException("Connection closed during handshake"));
            }
            emitClosed();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                        handshakeFuture.setSuccess();
                    } catch (WebSocketHandshakeException e) {
                        handshakeFuture.setFailure(e);
                    }
                }
                return;
            }
            if (!(msg instanceof WebSocketFrame frame)) {
                LOG.warning(() -> "Unexpected message after handshake: " + msg.getClass().getSimpleName());
                return;
            }
            if (frame instanceof TextWebSocketFrame) {
                events.offer(new TransportEvent.Message(ByteBufUtil.getBytes(frame.content()), false));
            } else if (frame instanceof BinaryWebSocketFrame) {
                events.offer(new TransportEvent.Message(ByteBufUtil.getBytes(frame.content()), true));
            } else if (frame instanceof PingWebSocketFrame) {
                ch.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            } else if (frame instanceof CloseWebSocketFrame close) {
                closeCode = close.statusCode();
                closeReason = close.reasonText();
                ch.close();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.FINE, "Gateway transport error", cause);
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
            }
            ctx.close();
        }

        private void emitClosed() {
            if (closedEmitted.compareAndSet(false, true)) {
                events.offer(new TransportEvent.Closed(closeCode, closeReason));
            }
        }

        @Override
        public CompletableFuture<Void> send(String text) {
            CompletableFuture<Void> result = new CompletableFuture<>();
            Channel ch = channel;
            if (ch == null || !ch.isActive()) {
                result.completeExceptionally(new IOException("Transport is closed"));
                return result;
            }
            ch.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    result.complete(null);
                } else {
                    result.completeExceptionally(f.cause());
                }
            });
            return result;
        }

        @Override
        public TransportEvent receive() throws InterruptedException {
            TransportEvent event = events.take();
            if (event instanceof TransportEvent.Closed) {
                events.offer(event);
            }
            return event;
        }

        @Override
        public void close(int code, String reason) {
            Channel ch = channel;
            if (ch == null) {
                return;
            }
            if (ch.isActive() && handshaker.isHandshakeComplete()) {
                ch.writeAndFlush(new CloseWebSocketFrame(code, reason == null ? "" : reason))
                    .addListener(ChannelFutureListener.CLOSE);
            } else {
                ch.close();
            }
        }

        @Override
        public boolean isOpen() {
            Channel ch = channel;
            return ch != null && ch.isActive() && !closedEmitted.get();
        }
    }
}
