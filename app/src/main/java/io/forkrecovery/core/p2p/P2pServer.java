package io.forkrecovery.core.p2p;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.forkrecovery.core.protocol.Block;
import io.forkrecovery.core.protocol.BlockCodec;
import io.forkrecovery.core.protocol.Hash;
import io.forkrecovery.core.protocol.ProtocolLimits;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.AttributeKey;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Netty transport between nodes: length-prefixed JSON frames carrying {@link P2pMessage}.
 * Serves get_block requests from a local block lookup and correlates block replies
 * with outstanding {@link #requestBlock} futures.
 */
public final class P2pServer {
    public interface PeerListener {
        void onPeerConnected(Peer peer);
        void onPeerDisconnected(Peer peer);
        void onMessage(Peer peer, P2pMessage message);
    }

    public record Peer(String nodeId, String remoteAddress) {}

    private static final Logger LOG = Logger.getLogger(P2pServer.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AttributeKey<PeerContext> CTX_KEY = AttributeKey.valueOf("peer-context");

    private static final long DEFAULT_PING_INTERVAL_MS = 10_000L;
    private static final long DEFAULT_IDLE_TIMEOUT_MS = 30_000L;

    private final String nodeId;
    private final int port;
    private final Function<Hash, Optional<Block>> blockLookup;
    private final PeerListener listener;
    private final long pingIntervalMillis;
    private final long idleTimeoutMillis;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final NioEventLoopGroup clientGroup = new NioEventLoopGroup();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Map<String, PeerContext> peersById = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Optional<Block>>> pendingRequests = new ConcurrentHashMap<>();

    private ScheduledExecutorService housekeeping;
    private Channel serverChannel;

    public P2pServer(String nodeId, int port, Function<Hash, Optional<Block>> blockLookup) {
        this(nodeId, port, blockLookup, new LoggingPeerListener());
    }

    public P2pServer(String nodeId, int port, Function<Hash, Optional<Block>> blockLookup, PeerListener listener) {
        this(nodeId, port, blockLookup, listener, DEFAULT_PING_INTERVAL_MS, DEFAULT_IDLE_TIMEOUT_MS);
    }

    public P2pServer(String nodeId, int port, Function<Hash, Optional<Block>> blockLookup, PeerListener listener,
                     long pingIntervalMillis, long idleTimeoutMillis) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.port = port;
        this.blockLookup = Objects.requireNonNull(blockLookup, "blockLookup");
        this.listener = listener == null ? new LoggingPeerListener() : listener;
        this.pingIntervalMillis = Math.max(100L, pingIntervalMillis);
        this.idleTimeoutMillis = Math.max(this.pingIntervalMillis, idleTimeoutMillis);
    }

    public String nodeId() {
        return nodeId;
    }

    public int port() {
        return port;
    }

    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            configurePipeline(ch.pipeline());
                        }
                    });

            serverChannel = bootstrap.bind(port).sync().channel();
            channels.add(serverChannel);
            LOG.info(() -> "P2P server listening on port " + port + " (nodeId=" + nodeId + ")");
            startHousekeeping();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting P2P server", e);
        }
    }

    public void connect(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return;
        }
        String[] parts = endpoint.split(":", 2);
        if (parts.length != 2) {
            LOG.warning(() -> "Invalid peer endpoint: " + endpoint);
            return;
        }
        String host = parts[0].trim();
        int targetPort;
        try {
            targetPort = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Invalid peer port in endpoint: " + endpoint);
            return;
        }
        connect(host, targetPort);
    }

    public void connect(Collection<String> endpoints) {
        if (endpoints == null) {
            return;
        }
        for (String endpoint : endpoints) {
            connect(endpoint);
        }
    }

    public void connect(String host, int targetPort) {
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(clientGroup)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                });

        bootstrap.connect(host, targetPort).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channels.add(future.channel());
                LOG.info(() -> "Connected to peer " + host + ':' + targetPort);
            } else {
                LOG.log(Level.WARNING, "Failed to connect to peer " + host + ':' + targetPort, future.cause());
            }
        });
    }

    /**
     * Ask one peer for a block. Completes with empty when the peer is unknown, disconnects,
     * or answers "not found". Callers bound the wait themselves.
     */
    public CompletableFuture<Optional<Block>> requestBlock(String peerNodeId, Hash hash) {
        PeerContext context = peerNodeId == null ? null : peersById.get(peerNodeId);
        if (context == null || !context.channel.isActive()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String requestId = UUID.randomUUID().toString();
        CompletableFuture<Optional<Block>> future = new CompletableFuture<>();
        pendingRequests.put(requestId, future);
        future.whenComplete((r, e) -> pendingRequests.remove(requestId));
        context.channel.writeAndFlush(P2pMessage.getBlock(requestId, hash)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                LOG.log(Level.FINE, "get_block send to " + peerNodeId + " failed", f.cause());
                future.complete(Optional.empty());
            }
        });
        return future;
    }

    /** Announce a new tip to every connected peer. */
    public void announce(Block block) {
        broadcast(P2pMessage.newBlock(block));
    }

    public void broadcast(P2pMessage message) {
        if (message == null) {
            return;
        }
        for (PeerContext context : peersById.values()) {
            context.channel.writeAndFlush(message);
        }
    }

    public Collection<Peer> peers() {
        List<Peer> peers = new ArrayList<>();
        for (PeerContext context : peersById.values()) {
            peers.add(new Peer(context.nodeId, remoteAddress(context.channel)));
        }
        return peers;
    }

    public void stop() {
        stopHousekeeping();
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        clientGroup.shutdownGracefully();
        peersById.clear();
        for (CompletableFuture<Optional<Block>> pending : pendingRequests.values()) {
            pending.complete(Optional.empty());
        }
        LOG.info("P2P server stopped");
    }

    private void startHousekeeping() {
        stopHousekeeping();
        housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "p2p-heartbeat-" + nodeId);
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleAtFixedRate(this::runHousekeeping, pingIntervalMillis, pingIntervalMillis, TimeUnit.MILLISECONDS);
    }

    private void stopHousekeeping() {
        if (housekeeping != null) {
            housekeeping.shutdownNow();
            housekeeping = null;
        }
    }

    private void runHousekeeping() {
        try {
            long now = System.currentTimeMillis();
            for (PeerContext context : peersById.values()) {
                Channel channel = context.channel;
                if (channel == null || !channel.isActive() || context.nodeId == null) {
                    continue;
                }
                if (context.lastSeen > 0 && now - context.lastSeen > idleTimeoutMillis) {
                    LOG.fine(() -> "Closing stale peer " + context.nodeId);
                    channel.close();
                    continue;
                }
                if (now - context.lastPingSent >= pingIntervalMillis) {
                    context.lastPingSent = now;
                    channel.writeAndFlush(P2pMessage.ping());
                }
            }
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "P2P housekeeping failed", e);
        }
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(ProtocolLimits.MAX_FRAME_BYTES, 0, 4, 0, 4));
        pipeline.addLast(new LengthFieldPrepender(4));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new JsonCodec());
        pipeline.addLast(new PeerChannelHandler());
    }

    private void serveBlock(ChannelHandlerContext ctx, P2pMessage msg) {
        String requestId = String.valueOf(msg.payload().get("requestId"));
        Block found = null;
        try {
            Hash hash = Hash.fromHex(String.valueOf(msg.payload().get("hash")));
            found = blockLookup.apply(hash).orElse(null);
        } catch (IllegalArgumentException e) {
            LOG.fine(() -> "Bad get_block request: " + e.getMessage());
        }
        ctx.writeAndFlush(P2pMessage.blockResponse(requestId, found));
    }

    private void completeRequest(String fromPeer, P2pMessage msg) {
        Object requestId = msg.payload().get("requestId");
        CompletableFuture<Optional<Block>> future = requestId == null ? null : pendingRequests.get(requestId.toString());
        if (future == null) {
            return;
        }
        Object body = msg.payload().get("block");
        if (body == null) {
            future.complete(Optional.empty());
            return;
        }
        try {
            future.complete(Optional.of(BlockCodec.fromObject(body)));
        } catch (IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Malformed block from peer " + fromPeer, e);
            future.complete(Optional.empty());
        }
    }

    private final class PeerChannelHandler extends SimpleChannelInboundHandler<P2pMessage> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            PeerContext context = new PeerContext(ctx.channel());
            ctx.channel().attr(CTX_KEY).set(context);
            channels.add(ctx.channel());
            ctx.writeAndFlush(P2pMessage.handshake(nodeId));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            PeerContext context = ctx.channel().attr(CTX_KEY).get();
            if (context != null && context.nodeId != null) {
                peersById.remove(context.nodeId, context);
                listener.onPeerDisconnected(new Peer(context.nodeId, remoteAddress(ctx.channel())));
            }
            channels.remove(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, P2pMessage msg) {
            PeerContext context = ctx.channel().attr(CTX_KEY).get();
            if (context == null) {
                return;
            }
            if (P2pMessage.HANDSHAKE.equals(msg.type())) {
                Object nodeIdObj = msg.payload().get("nodeId");
                if (nodeIdObj instanceof String id) {
                    context.nodeId = id;
                    context.lastSeen = System.currentTimeMillis();
                    context.lastPingSent = 0L;
                    peersById.put(id, context);
                    listener.onPeerConnected(new Peer(id, remoteAddress(ctx.channel())));
                }
                return;
            }
            if (context.nodeId == null) {
                return;
            }
            context.lastSeen = System.currentTimeMillis();
            switch (msg.type()) {
                case P2pMessage.PING -> ctx.writeAndFlush(P2pMessage.pong());
                case P2pMessage.GET_BLOCK -> serveBlock(ctx, msg);
                case P2pMessage.BLOCK -> completeRequest(context.nodeId, msg);
                default -> { }
            }
            listener.onMessage(new Peer(context.nodeId, remoteAddress(ctx.channel())), msg);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "P2P channel error", cause);
            ctx.close();
        }
    }

    private static final class JsonCodec extends MessageToMessageCodec<String, P2pMessage> {
        @Override
        protected void encode(ChannelHandlerContext ctx, P2pMessage msg, List<Object> out) throws Exception {
            out.add(MAPPER.writeValueAsString(msg));
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) throws Exception {
            out.add(MAPPER.readValue(msg, P2pMessage.class));
        }
    }

    private static String remoteAddress(Channel channel) {
        InetSocketAddress address = (InetSocketAddress) channel.remoteAddress();
        if (address == null) {
            return "unknown";
        }
        String host = address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
        return host + ':' + address.getPort();
    }

    private static final class PeerContext {
        final Channel channel;
        volatile String nodeId;
        volatile long lastSeen;
        volatile long lastPingSent;

        PeerContext(Channel channel) {
            this.channel = channel;
            this.lastSeen = System.currentTimeMillis();
            this.lastPingSent = 0L;
        }
    }

    private static final class LoggingPeerListener implements PeerListener {
        @Override
        public void onPeerConnected(Peer peer) {
            LOG.info(() -> "Peer connected: " + peer);
        }

        @Override
        public void onPeerDisconnected(Peer peer) {
            LOG.info(() -> "Peer disconnected: " + peer);
        }

        @Override
        public void onMessage(Peer peer, P2pMessage message) {
            LOG.fine(() -> "Received " + message.type() + " from " + peer.nodeId());
        }
    }
}
