package site.respkv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.command.CommandDispatcher;
import site.respkv.core.KeyspaceStore;
import site.respkv.core.KeyspaceStoreImpl;
import site.respkv.protocol.handler.RespDecoder;
import site.respkv.protocol.handler.RespEncoder;
import site.respkv.server.config.RespServerConfig;
import site.respkv.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * 基于Netty的RESP服务器实现。
 *
 * <p>组成：
 * <ul>
 *   <li>boss/worker事件循环组，按平台选择Epoll、KQueue或NIO
 *   <li>独立的命令执行线程池，命令处理不占用I/O线程
 *   <li>进程内唯一的键值存储，由所有连接共享
 * </ul>
 *
 * <p>每个连接的pipeline依次为 {@link RespDecoder}、{@link RespEncoder}、{@link RespCommandHandler}。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RespMiniServer implements RespServer {

    /** 服务器配置 */
    private final RespServerConfig config;

    /** 服务器Channel类型，根据操作系统自动选择最优实现 */
    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    /** 服务器Channel */
    private Channel serverChannel;

    /** 键值存储 */
    private final KeyspaceStore keyspaceStore;

    /** 命令分发器，无状态，所有连接共享 */
    private final CommandDispatcher dispatcher;

    public RespMiniServer(final RespServerConfig config) {
        this(config, new KeyspaceStoreImpl());
    }

    /**
     * @param config 服务器配置
     * @param keyspaceStore 键值存储，停止服务器时一并关闭
     * @throws IllegalArgumentException 配置不合法
     */
    public RespMiniServer(final RespServerConfig config, final KeyspaceStore keyspaceStore) {
        config.validate();
        this.config = config;
        this.keyspaceStore = keyspaceStore;
        this.dispatcher = new CommandDispatcher(keyspaceStore);

        // 1. 初始化事件循环组和命令执行器
        initializeEventLoopGroups();
        initializeCommandExecutor();
    }

    @Override
    public void start() {
        if (serverChannel != null) {
            throw new IllegalStateException("服务器已经启动");
        }

        // 1. 启动过期清理
        if (config.isExpirySweepEnabled()) {
            keyspaceStore.startExpirySweeper(Duration.ofMillis(config.getExpirySweepIntervalMillis()));
        }

        // 2. 配置并绑定
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("RESP server started at {}:{}", config.getHost(), getBoundPort());
        } catch (InterruptedException e) {
            log.error("RESP server start interrupted", e);
            stop();
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            // bind失败时 sync() 直接抛出 BindException 等受检异常
            log.error("RESP server start error on {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw new IllegalStateException("无法绑定 " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    @Override
    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
        } catch (InterruptedException e) {
            log.error("RESP server stop interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            keyspaceStore.shutdown();
        }
        log.info("RESP server stopped");
    }

    @Override
    public int getBoundPort() {
        if (serverChannel == null || !(serverChannel.localAddress() instanceof InetSocketAddress)) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        // 同一连接的事件固定在同一个执行器上，保证流水线命令按序执行
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("respkv-cmd"));
    }
}
