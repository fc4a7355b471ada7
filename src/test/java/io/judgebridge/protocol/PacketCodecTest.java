package io.judgebridge.protocol;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.Deflater;

final class PacketCodecTest {

    @Test
    void framesAreLengthPrefixedZlib() throws IOException {
        PacketCodec codec = new PacketCodec();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.write(out, "{\"name\":\"ping\",\"when\":1.0}");
        codec.write(out, "{\"name\":\"disconnect\"}");
        byte[] bytes = out.toByteArray();

        int firstLength = ((bytes[0] & 0xff) << 24) | ((bytes[1] & 0xff) << 16) | ((bytes[2] & 0xff) << 8) | (bytes[3] & 0xff);
        Assertions.assertEquals(0x78, bytes[4] & 0xff, "zlib header");
        Assertions.assertTrue(firstLength > 0 && firstLength < bytes.length);

        ByteArrayInputStream in = new ByteArrayInputStream(bytes);
        Assertions.assertEquals("{\"name\":\"ping\",\"when\":1.0}", codec.read(in));
        Assertions.assertEquals("{\"name\":\"disconnect\"}", codec.read(in));
        Assertions.assertNull(codec.read(in));
    }

    @Test
    void readsFramesProducedByPlainDeflater() throws IOException {
        byte[] body = "{\"name\":\"handshake\",\"id\":\"été\"}".getBytes(StandardCharsets.UTF_8);
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        deflater.setInput(body);
        deflater.finish();
        byte[] buf = new byte[256];
        int n = deflater.deflate(buf);
        deflater.end();

        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        DataOutputStream data = new DataOutputStream(raw);
        data.writeInt(n);
        data.write(buf, 0, n);
        Assertions.assertEquals(new String(body, StandardCharsets.UTF_8),
                new PacketCodec().read(new ByteArrayInputStream(raw.toByteArray())));
    }

    @Test
    void rejectsBadLengthAndBadBody() throws IOException {
        PacketCodec codec = new PacketCodec(1024);
        Assertions.assertThrows(PacketCodec.FrameException.class,
                () -> codec.read(new ByteArrayInputStream(frame(-1, new byte[0]))));
        Assertions.assertThrows(PacketCodec.FrameException.class,
                () -> codec.read(new ByteArrayInputStream(frame(4096, new byte[0]))));
        Assertions.assertThrows(PacketCodec.FrameException.class,
                () -> codec.read(new ByteArrayInputStream(frame(4, new byte[]{1, 2, 3, 4}))));
    }

    @Test
    void rejectsDecompressionBomb() throws IOException {
        PacketCodec writer = new PacketCodec();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(out, "a".repeat(100_000));
        PacketCodec reader = new PacketCodec(4_096);
        Assertions.assertThrows(PacketCodec.FrameException.class,
                () -> reader.read(new ByteArrayInputStream(out.toByteArray())));
    }

    @Test
    void truncatedFrameIsAnError() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new PacketCodec().write(out, "{\"name\":\"grading-end\",\"submission-id\":\"1\"}");
        byte[] bytes = out.toByteArray();
        byte[] cut = Arrays.copyOf(bytes, bytes.length - 3);
        Assertions.assertThrows(IOException.class, () -> new PacketCodec().read(new ByteArrayInputStream(cut)));
    }

    private static byte[] frame(int length, byte[] body) throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        DataOutputStream data = new DataOutputStream(raw);
        data.writeInt(length);
        data.write(body);
        return raw.toByteArray();
    }
}
