package org.tessera.runtime.clients;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.tessera.protocols.wireprotocol.InfoMessage;
import org.tessera.runtime.exceptions.ConnectionException;
import org.tessera.runtime.exceptions.ResultCode;
import org.tessera.runtime.exceptions.unrecoverable.UnrecoverableTesseraInterruptedError;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A {@link Connection} backed by a Netty channel. Requests are strictly sequential: at most one
 * info request is outstanding per connection, and callers block until it completes.
 */
@Slf4j
public class NettyConnection extends SimpleChannelInboundHandler<InfoMessage> implements Connection {

    @Getter
    private final InetSocketAddress address;

    private final Duration requestTimeout;

    private volatile Channel channel;

    private volatile CompletableFuture<InfoMessage> outstanding;

    @Getter
    private volatile long lastUsed = System.nanoTime();

    public NettyConnection(InetSocketAddress address, Duration requestTimeout) {
        this.address = address;
        this.requestTimeout = requestTimeout;
    }

    void attach(Channel channel) {
        this.channel = channel;
    }

    @Override
    public synchronized Map<String, String> info(String... commands) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new ConnectionException("Connection to " + address + " is closed");
        }

        CompletableFuture<InfoMessage> future = new CompletableFuture<>();
        outstanding = future;
        ch.writeAndFlush(InfoMessage.request(Arrays.asList(commands)));

        try {
            InfoMessage response = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            lastUsed = System.nanoTime();
            return response.parseResponse();
        } catch (InterruptedException ie) {
            close();
            throw new UnrecoverableTesseraInterruptedError("Interrupted while waiting for info response", ie);
        } catch (TimeoutException te) {
            // The late response would be matched to the next request, the channel is unusable.
            close();
            throw new ConnectionException(ResultCode.TIMEOUT,
                    "Info request to " + address + " timed out after " + requestTimeout.toMillis() + "ms");
        } catch (ExecutionException ee) {
            close();
            if (ee.getCause() instanceof ConnectionException) {
                throw (ConnectionException) ee.getCause();
            }
            throw new ConnectionException(null, "Info request to " + address + " failed", ee.getCause());
        } finally {
            outstanding = null;
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, InfoMessage msg) {
        CompletableFuture<InfoMessage> future = outstanding;
        if (future == null) {
            log.warn("channelRead0[{}]: Dropping unsolicited info response", address);
            return;
        }
        future.complete(msg);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        CompletableFuture<InfoMessage> future = outstanding;
        if (future != null) {
            future.completeExceptionally(new ConnectionException("Disconnected from " + address));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("exceptionCaught[{}]: Exception during channel handling.", address, cause);
        CompletableFuture<InfoMessage> future = outstanding;
        if (future != null) {
            future.completeExceptionally(cause);
        }
        ctx.close();
    }

    @Override
    public boolean isOpen() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public String toString() {
        return "NettyConnection[" + address + "]";
    }
}
