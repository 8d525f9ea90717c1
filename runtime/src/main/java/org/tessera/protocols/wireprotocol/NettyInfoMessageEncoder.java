package org.tessera.protocols.wireprotocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes {@link InfoMessage}s as header + payload frames.
 */
@Slf4j
public class NettyInfoMessageEncoder extends MessageToByteEncoder<InfoMessage> {

    @Override
    protected void encode(ChannelHandlerContext channelHandlerContext, InfoMessage message, ByteBuf byteBuf) {
        byte[] payload = message.getPayload();
        long header = ((long) (message.getVersion() & 0xFF) << 56)
                | ((long) (message.getType() & 0xFF) << 48)
                | (payload.length & InfoMessage.MAX_PAYLOAD_SIZE);

        byteBuf.writeLong(header);
        byteBuf.writeBytes(payload);

        if (log.isTraceEnabled()) {
            log.trace("encode: wrote {} payload bytes", payload.length);
        }
    }
}
