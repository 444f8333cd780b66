package adlab.orchestrator.server;

import adlab.orchestrator.config.Dependencies;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty HTTP server for the public API.
 * One server per process; request handling runs on the worker event loops
 * and never waits for task execution.
 */
public final class OrchestratorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;

    private OrchestratorNettyServer() {
    }

    /** HTTP pipeline */
    static ChannelInitializer<SocketChannel> pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind the API on the given port. Port 0 picks a free port, see {@link #port()}.
     *
     * @return true if the server is running
     */
    public static synchronized boolean start(int port, Dependencies deps) {
        if (running) return true;
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps.routerHandler()));

            serverChannel = b.bind(deps.config().serverHost(), port).syncUninterruptibly().channel();
            running = true;
            log.info("Orchestrator API listening on port {}", port());
            return true;
        } catch (Exception e) {
            log.error("Failed to start server on port {}", port, e);
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) { workerGroup.shutdownGracefully(); workerGroup = null; }
            if (bossGroup != null)   { bossGroup.shutdownGracefully();   bossGroup = null;   }
            if (running) {
                log.info("Orchestrator API stopped");
            }
            running = false;
        }
    }

    public static boolean isRunning() { return running; }

    /** Actual bound port, or -1 when stopped. */
    public static synchronized int port() {
        if (serverChannel == null) return -1;
        return ((java.net.InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}
