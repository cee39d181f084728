package com.dendo.renkei.protocol.transport.tcp.netty;

import com.dendo.renkei.protocol.config.RenkeiClientConfig;
import com.dendo.renkei.protocol.transport.StreamEndpoint;
import com.dendo.renkei.protocol.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames the byte
 * stream into newline-terminated lines and reports socket lifecycle. It does not
 * parse JSON, track commands or decide when to reconnect.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound lines are copied into {@code byte[]}.
 *
 * <h2>Socket options</h2>
 * {@code TCP_NODELAY} is set because every command is a small line the motor
 * should see immediately. Connect attempts are bounded by the configured
 * connect timeout.
 *
 * <h2>Framing</h2>
 * {@link LineBasedFrameDecoder} splits on {@code \n} (and strips a preceding
 * {@code \r}). A line longer than the maximum is discarded up to the next
 * newline and reported via {@link StreamEndpointListener#onLineDiscarded}; the
 * connection stays open.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private final String host;
    private final int port;
    private final int maxLineLength;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile StreamEndpointListener listener;
    private volatile ChannelFuture currentAttempt;
    private volatile Channel channel;

    public NettyTcpStreamEndpoint(RenkeiClientConfig config)
    {
        this(config.host(), config.port(), config.timingPolicy().connectTimeout(), config.maxLineLength());
    }

    public NettyTcpStreamEndpoint(String host, int port, Duration connectTimeout, int maxLineLength)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.maxLineLength = maxLineLength;
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect(long generation)
    {
        StreamEndpointListener l = requireListener();
        close();

        Bootstrap attempt = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch)
            {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new LineBasedFrameDecoder(maxLineLength, true, true));
                p.addLast(new InboundHandler(generation));
            }
        });

        ChannelFuture f = attempt.connect(host, port);
        currentAttempt = f;
        f.addListener((ChannelFutureListener) future -> {
            if (currentAttempt != future) {
                // Superseded by close() or a newer connect().
                future.channel().close();
                if (!future.isSuccess()) {
                    l.onConnectFailed(generation, future.cause());
                }
                return;
            }
            if (future.isSuccess()) {
                channel = future.channel();
                if (currentAttempt != future) {
                    // close() ran between the check above and the assignment.
                    if (channel == future.channel()) {
                        channel = null;
                    }
                    future.channel().close();
                    return;
                }
                l.onTransportUp(generation);
            }
            else {
                l.onConnectFailed(generation, future.cause());
            }
        });
    }

    @Override
    public void close()
    {
        ChannelFuture attempt = currentAttempt;
        currentAttempt = null;
        Channel ch = channel;
        channel = null;

        if (ch != null) {
            ch.close();
        }
        if (attempt != null) {
            attempt.channel().close();
        }
    }

    @Override
    public boolean send(byte[] line)
    {
        Objects.requireNonNull(line, "line");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return false;
        }

        // A failed write surfaces through exceptionCaught, which closes the channel.
        ch.writeAndFlush(Unpooled.wrappedBuffer(line))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        return true;
    }

    @Override
    public void shutdown()
    {
        close();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before connect()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards framed lines and the channel's end of life to the port listener.
     * One instance per connection, bound to that connection's generation.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final long generation;
        private Throwable failure;

        private InboundHandler(long generation)
        {
            this.generation = generation;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf line)
        {
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }

            byte[] bytes = new byte[line.readableBytes()];
            line.getBytes(line.readerIndex(), bytes);
            l.onLine(generation, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(generation, failure);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException) {
                StreamEndpointListener l = listener;
                if (l != null) {
                    l.onLineDiscarded(generation, cause.getMessage());
                }
                return;
            }
            if (failure == null) {
                failure = cause;
            }
            ctx.close();
        }
    }
}
