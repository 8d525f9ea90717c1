package org.tessera.runtime.clients;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import lombok.extern.slf4j.Slf4j;
import org.tessera.protocols.wireprotocol.NettyInfoMessageDecoder;
import org.tessera.protocols.wireprotocol.NettyInfoMessageEncoder;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.runtime.exceptions.unrecoverable.UnrecoverableTesseraInterruptedError;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Opens {@link NettyConnection}s on a shared event loop group owned by this factory.
 */
@Slf4j
public class NettyConnectionFactory implements ConnectionFactory {

    /** Largest info response accepted. */
    private static final int MAX_PAYLOAD_SIZE = 128 * 1024 * 1024;

    private final EventLoopGroup eventLoopGroup;

    @Nullable
    private final SslContext sslContext;

    public NettyConnectionFactory(int eventLoopThreads, @Nullable SslContext sslContext) {
        this.eventLoopGroup = new NioEventLoopGroup(eventLoopThreads, new ThreadFactoryBuilder()
                .setNameFormat("tessera-io-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((thread, throwable) ->
                        log.error("Error in event loop thread {}", thread.getName(), throwable))
                .build());
        this.sslContext = sslContext;
    }

    @Override
    public Connection connect(InetSocketAddress address, @Nullable String tlsName, Duration timeout) {
        NettyConnection connection = new NettyConnection(address, timeout);

        Bootstrap b = new Bootstrap();
        b.group(eventLoopGroup);
        b.channel(NioSocketChannel.class);
        b.option(ChannelOption.TCP_NODELAY, true);
        b.option(ChannelOption.SO_KEEPALIVE, true);
        b.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis());
        b.handler(getChannelInitializer(connection, address, tlsName));

        ChannelFuture f = b.connect(address);
        try {
            if (!f.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                f.cancel(true);
                throw new ConnectionException("Connect to " + address + " timed out");
            }
        } catch (InterruptedException ie) {
            f.cancel(true);
            throw new UnrecoverableTesseraInterruptedError("Interrupted while connecting", ie);
        }

        if (!f.isSuccess()) {
            throw new ConnectionException(null, "Failed to connect to " + address, f.cause());
        }

        Channel channel = f.channel();
        SslHandler sslHandler = channel.pipeline().get(SslHandler.class);
        if (sslHandler != null) {
            awaitHandshake(channel, sslHandler, address, timeout);
        }

        connection.attach(channel);
        log.debug("connect: Channel connected to {}", address);
        return connection;
    }

    private ChannelInitializer<Channel> getChannelInitializer(NettyConnection connection,
                                                              InetSocketAddress address,
                                                              @Nullable String tlsName) {
        return new ChannelInitializer<Channel>() {
            @Override
            protected void initChannel(@Nonnull Channel ch) {
                if (sslContext != null) {
                    String peerHost = tlsName != null ? tlsName : address.getHostString();
                    SslHandler sslHandler = sslContext.newHandler(ch.alloc(), peerHost, address.getPort());
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    // Certificate subject must match the expected tls name.
                    sslParameters.setEndpointIdentificationAlgorithm("HTTPS");
                    engine.setSSLParameters(sslParameters);
                    ch.pipeline().addLast("ssl", sslHandler);
                }
                ch.pipeline().addLast(new NettyInfoMessageDecoder(MAX_PAYLOAD_SIZE));
                ch.pipeline().addLast(new NettyInfoMessageEncoder());
                ch.pipeline().addLast(connection);
            }
        };
    }

    private void awaitHandshake(Channel channel, SslHandler sslHandler, InetSocketAddress address,
                                Duration timeout) {
        try {
            boolean done = sslHandler.handshakeFuture().await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!done || !sslHandler.handshakeFuture().isSuccess()) {
                channel.close();
                throw new ConnectionException(null, "TLS handshake with " + address + " failed",
                        sslHandler.handshakeFuture().cause());
            }
        } catch (InterruptedException ie) {
            channel.close();
            throw new UnrecoverableTesseraInterruptedError("Interrupted during TLS handshake", ie);
        }
    }

    @Override
    public void shutdown() {
        log.debug("shutdown: Shutting down event loop group");
        eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
}
