package org.tessera.protocols.wireprotocol;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NettyInfoMessageCodecTest {

    private static final int MAX_PAYLOAD = 1024;

    private final Logger decoderLog = (Logger) LoggerFactory.getLogger(NettyInfoMessageDecoder.class);

    private final ListAppender<ILoggingEvent> logged = new ListAppender<>();

    @Before
    public void setUp() {
        logged.start();
        decoderLog.addAppender(logged);
    }

    @After
    public void tearDown() {
        decoderLog.detachAppender(logged);
        logged.stop();
    }

    @Test
    public void requestIsFramedWithHeader() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyInfoMessageEncoder());
        channel.writeOutbound(InfoMessage.request(Arrays.asList("node", "partition-generation")));

        ByteBuf frame = channel.readOutbound();
        long header = frame.readLong();

        assertThat(header >>> 56).isEqualTo(InfoMessage.PROTOCOL_VERSION);
        assertThat((header >>> 48) & 0xFF).isEqualTo(InfoMessage.INFO_TYPE);
        assertThat(header & InfoMessage.MAX_PAYLOAD_SIZE).isEqualTo(frame.readableBytes());
        assertThat(frame.toString(StandardCharsets.UTF_8)).isEqualTo("node\npartition-generation\n");
        frame.release();
    }

    @Test
    public void responseIsDecodedOnceComplete() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyInfoMessageDecoder(MAX_PAYLOAD));
        ByteBuf frame = frame(InfoMessage.PROTOCOL_VERSION, "node\tBB9\npartition-generation\t4\n");

        // Header and part of the payload first.
        assertThat(channel.writeInbound(frame.readRetainedSlice(12))).isFalse();
        assertThat(channel.writeInbound(frame)).isTrue();

        InfoMessage message = channel.readInbound();
        Map<String, String> response = message.parseResponse();

        assertThat(response).containsEntry("node", "BB9").containsEntry("partition-generation", "4");
        assertThat(response.keySet()).containsExactly("node", "partition-generation");
    }

    @Test
    public void lineWithoutTabMapsToEmptyValue() {
        InfoMessage message = new InfoMessage(InfoMessage.PROTOCOL_VERSION, InfoMessage.INFO_TYPE,
                "features\n".getBytes(StandardCharsets.UTF_8));

        assertThat(message.parseResponse()).containsEntry("features", "");
    }

    @Test
    public void unsupportedVersionIsRejected() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyInfoMessageDecoder(MAX_PAYLOAD));

        assertThatThrownBy(() -> channel.writeInbound(frame(1, "node\tBB9\n")))
                .isInstanceOf(CorruptedFrameException.class);

        assertThat(logged.list).hasSize(1);
        assertThat(logged.list.get(0).getLevel()).isEqualTo(Level.WARN);
        assertThat(logged.list.get(0).getFormattedMessage()).contains("Unsupported protocol version 1");
    }

    @Test
    public void oversizedPayloadIsRejected() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyInfoMessageDecoder(4));

        assertThatThrownBy(() -> channel.writeInbound(frame(InfoMessage.PROTOCOL_VERSION, "node\tBB9\n")))
                .isInstanceOf(TooLongFrameException.class);

        assertThat(logged.list).hasSize(1);
        assertThat(logged.list.get(0).getFormattedMessage()).contains("Payload of 9 bytes exceeds 4");
    }

    private static ByteBuf frame(int version, String text) {
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        ByteBuf buf = Unpooled.buffer();
        buf.writeLong(((long) version << 56) | ((long) InfoMessage.INFO_TYPE << 48) | payload.length);
        buf.writeBytes(payload);
        return buf;
    }
}
