package com.cybershieldx.agent.api;

import com.cybershieldx.agent.auth.CredentialManager;
import com.cybershieldx.agent.handler.LocalApiHandler;
import com.cybershieldx.agent.model.AgentState;
import com.cybershieldx.agent.scan.TaskRunner;
import com.cybershieldx.agent.store.ConfigStore;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Local status API, reachable only from the loopback interface
 */
public class LocalApiServer {
    private static final Logger log = LoggerFactory.getLogger(LocalApiServer.class);

    public static final String LOOPBACK = "127.0.0.1";

    private final int port;
    private final AgentState agentState;
    private final ConfigStore store;
    private final CredentialManager credentials;
    private final TaskRunner taskRunner;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public LocalApiServer(int port, AgentState agentState, ConfigStore store,
            CredentialManager credentials, TaskRunner taskRunner) {
        this.port = port;
        this.agentState = agentState;
        this.store = store;
        this.credentials = credentials;
        this.taskRunner = taskRunner;
    }

    /**
     * Start the server
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("cybershieldx-api-boss", true));
        workerGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("cybershieldx-api", true));

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    pipeline.addLast(new HttpServerCodec());
                    pipeline.addLast(new HttpObjectAggregator(65536));
                    pipeline.addLast(new LocalApiHandler(agentState, store, credentials, taskRunner));
                }
            })
            .option(ChannelOption.SO_BACKLOG, 16);

        ChannelFuture bound = bootstrap.bind(LOOPBACK, port).await();
        if (!bound.isSuccess()) {
            shutdownGroups();
            throw new IllegalStateException("Could not bind local API to " + LOOPBACK + ":" + port, bound.cause());
        }
        serverChannel = bound.channel();
        log.info("Local API listening on http://{}:{}/", LOOPBACK, getBoundPort());
    }

    /**
     * Port actually bound, useful when started on port 0
     */
    public synchronized int getBoundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Stop the server
     */
    public synchronized void stop() {
        if (serverChannel != null) {
            serverChannel.close();
            serverChannel = null;
            log.info("Local API stopped");
        }
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }
}
