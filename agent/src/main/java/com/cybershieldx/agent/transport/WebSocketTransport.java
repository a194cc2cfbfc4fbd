package com.cybershieldx.agent.transport;

import com.cybershieldx.agent.handler.WebSocketClientHandler;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Locale;

/**
 * WebSocket client transport over Netty, with TLS for wss:// endpoints
 */
public class WebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    /** Default maximum inbound frame size */
    public static final int DEFAULT_MAX_FRAME_SIZE = 1024 * 1024;
    public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000;

    private final EventLoopGroup group;
    private final int maxFrameSize;
    private SslContext sslContext;

    public WebSocketTransport() {
        this(DEFAULT_MAX_FRAME_SIZE);
    }

    public WebSocketTransport(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("cybershieldx-ws", true));
    }

    @Override
    public TransportConnection connect(URI uri, TransportListener listener) {
        WebSocketConnection connection = new WebSocketConnection(listener);

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            connection.connectionClosed("unsupported scheme",
                    new IllegalArgumentException("Server URL must use ws:// or wss://: " + uri));
            return connection;
        }
        boolean secure = "wss".equals(scheme);
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            // java.net.URI leaves the host null for names with underscores
            connection.connectionClosed("invalid host",
                    new IllegalArgumentException("Server URL has no valid host name: " + uri));
            return connection;
        }
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        SslContext ssl = null;
        if (secure) {
            try {
                ssl = clientSslContext();
            } catch (SSLException e) {
                connection.connectionClosed("TLS setup failed", e);
                return connection;
            }
        }

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), maxFrameSize);
        SslContext tls = ssl;

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, DEFAULT_CONNECT_TIMEOUT_MILLIS)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();

                    if (tls != null) {
                        pipeline.addLast(tls.newHandler(ch.alloc(), host, port));
                    }

                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(65536));
                    pipeline.addLast(new WebSocketClientProtocolHandler(handshaker));
                    pipeline.addLast(new WebSocketClientHandler(connection));
                }
            });

        log.debug("Opening WebSocket connection to {}:{}", host, port);
        bootstrap.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                connection.attach(future.channel());
            } else {
                connection.connectionClosed("connect failed", future.cause());
            }
        });
        return connection;
    }

    private synchronized SslContext clientSslContext() throws SSLException {
        if (sslContext == null) {
            sslContext = SslContextBuilder.forClient().build();
        }
        return sslContext;
    }

    @Override
    public void close() {
        group.shutdownGracefully();
    }
}
