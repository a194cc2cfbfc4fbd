package com.cybershieldx.agent.transport;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A WebSocket connection backed by a Netty channel.
 * Channel events are forwarded to the listener; onClosed is delivered once.
 */
public class WebSocketConnection implements TransportConnection {

    private final TransportListener listener;
    private final AtomicBoolean opened = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Channel channel;
    private volatile boolean closeRequested;

    WebSocketConnection(TransportListener listener) {
        this.listener = listener;
    }

    void attach(Channel channel) {
        this.channel = channel;
        if (closeRequested) {
            channel.close();
        }
    }

    @Override
    public CompletableFuture<Void> send(String text) {
        Channel ch = channel;
        if (ch == null || !ch.isActive() || !opened.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Channel not active"));
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        ch.writeAndFlush(new TextWebSocketFrame(text)).addListener(future -> {
            if (future.isSuccess()) {
                result.complete(null);
            } else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    @Override
    public void close() {
        closeRequested = true;
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (ch.isActive() && opened.get()) {
            ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    /**
     * WebSocket handshake finished
     */
    public void handshakeComplete() {
        if (!closed.get() && opened.compareAndSet(false, true)) {
            listener.onOpen(this);
        }
    }

    public void textReceived(String text) {
        if (!closed.get()) {
            listener.onMessage(text);
        }
    }

    public void connectionClosed(String reason, Throwable cause) {
        if (closed.compareAndSet(false, true)) {
            listener.onClosed(reason, cause);
        }
    }
}
