package com.yuubin.relay.core.protocol;

import com.yuubin.relay.core.exceptions.ProtocolException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameCodecTest {

    private final FrameCodec codec = new FrameCodec();

    @Test
    void encode_writesTagThenBigEndianLengthThenPayload() {
        byte[] encoded = codec.encode(0x11, "abc".getBytes(StandardCharsets.US_ASCII));

        assertThat(encoded).containsExactly(0x11, 0, 0, 0, 3, 'a', 'b', 'c');
    }

    @Test
    void encode_nullPayloadIsZeroLength() {
        assertThat(codec.encode(0x02, null)).containsExactly(0x02, 0, 0, 0, 0);
    }

    @Test
    void encode_rejectsTagOutsideByteRange() {
        assertThatThrownBy(() -> codec.encode(256, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.encode(-1, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void write_emitsWholeFrame() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.write(out, 0x01, new byte[] { 9, 8 });

        assertThat(out.toByteArray()).containsExactly(0x01, 0, 0, 0, 2, 9, 8);
    }

    @Test
    void read_decodesConsecutiveFrames() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.write(out, 0x01, "task".getBytes(StandardCharsets.UTF_8));
        codec.write(out, 0x02, null);
        ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());

        assertThat(codec.read(in)).isEqualTo(new Frame(0x01, "task".getBytes(StandardCharsets.UTF_8)));
        assertThat(codec.read(in)).isEqualTo(Frame.empty(0x02));
    }

    @Test
    void read_returnsUnknownTagsAsFrames() throws Exception {
        byte[] bytes = codec.encode(0xEE, new byte[] { 1 });

        Frame frame = codec.read(new ByteArrayInputStream(bytes));

        assertThat(frame.tag()).isEqualTo(0xEE);
        assertThat(frame.payload()).containsExactly(1);
    }

    @Test
    void read_endOfStreamBeforeTag_isEof() {
        assertThatThrownBy(() -> codec.read(new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(EOFException.class);
    }

    @Test
    void read_truncatedLength_isProtocolError() {
        assertThatThrownBy(() -> codec.read(new ByteArrayInputStream(new byte[] { 0x01, 0, 0 })))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("length");
    }

    @Test
    void read_truncatedPayload_isProtocolError() {
        byte[] bytes = { 0x01, 0, 0, 0, 4, 'a', 'b' };

        assertThatThrownBy(() -> codec.read(new ByteArrayInputStream(bytes)))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("payload");
    }

    @Test
    void read_lengthAboveLimit_isProtocolError() {
        FrameCodec small = new FrameCodec(8);
        byte[] bytes = { 0x01, 0, 0, 0, 9 };

        assertThatThrownBy(() -> small.read(new ByteArrayInputStream(bytes)))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("exceeds");
    }

    @Test
    void read_lengthIsUnsigned() {
        // 0xFFFFFFFF must not be read as -1
        byte[] bytes = { 0x01, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };

        assertThatThrownBy(() -> codec.read(new ByteArrayInputStream(bytes)))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("4294967295");
    }

    @Test
    void encode_payloadAboveLimit_isRejected() {
        FrameCodec small = new FrameCodec(2);

        assertThatThrownBy(() -> small.encode(0x01, new byte[3])).isInstanceOf(ProtocolException.class);
    }

    @Test
    void frame_copiesPayloadAndComparesByContent() {
        byte[] payload = { 1, 2 };
        Frame frame = new Frame(0x01, payload);
        payload[0] = 7;

        assertThat(frame.payload()).containsExactly(1, 2);
        assertThat(frame).isEqualTo(new Frame(0x01, new byte[] { 1, 2 }));
        assertThat(frame.length()).isEqualTo(2);
    }
}
