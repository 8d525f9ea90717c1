package org.tessera.protocols.wireprotocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Reassembles {@link InfoMessage}s from the inbound byte stream.
 */
@Slf4j
public class NettyInfoMessageDecoder extends ByteToMessageDecoder {

    private final int maxPayloadSize;

    public NettyInfoMessageDecoder(int maxPayloadSize) {
        this.maxPayloadSize = maxPayloadSize;
    }

    /**
     * Decodes one frame once both its header and its whole payload have arrived.
     *
     * @param channelHandlerContext   the Netty channel handler context
     * @param byteBuf                 the underlying ByteBuf
     * @param list                    a list of decoded objects given to the
     *                                next pipeline handler
     */
    @Override
    protected void decode(ChannelHandlerContext channelHandlerContext, ByteBuf byteBuf, List<Object> list) {
        if (byteBuf.readableBytes() < InfoMessage.HEADER_SIZE) {
            return;
        }

        long header = byteBuf.getLong(byteBuf.readerIndex());
        int version = (int) (header >>> 56) & 0xFF;
        int type = (int) (header >>> 48) & 0xFF;
        long size = header & InfoMessage.MAX_PAYLOAD_SIZE;

        if (version != InfoMessage.PROTOCOL_VERSION) {
            log.warn("decode[{}]: Unsupported protocol version {}", channelHandlerContext.channel(), version);
            throw new CorruptedFrameException("decode: Unsupported protocol version " + version);
        }
        if (size > maxPayloadSize) {
            log.warn("decode[{}]: Payload of {} bytes exceeds {}", channelHandlerContext.channel(), size,
                    maxPayloadSize);
            throw new TooLongFrameException("decode: Payload of " + size + " bytes exceeds " + maxPayloadSize);
        }
        if (byteBuf.readableBytes() < InfoMessage.HEADER_SIZE + size) {
            return;
        }

        byteBuf.skipBytes(InfoMessage.HEADER_SIZE);
        byte[] payload = new byte[(int) size];
        byteBuf.readBytes(payload);
        list.add(new InfoMessage(version, type, payload));
    }
}
