package io.judgebridge.protocol;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

// 4-byte big-endian length, then a zlib-compressed UTF-8 body.
public final class PacketCodec {
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final int maxFrameBytes;

    public PacketCodec() {
        this(DEFAULT_MAX_FRAME_BYTES);
    }

    public PacketCodec(int maxFrameBytes) {
        this.maxFrameBytes = Math.max(16, maxFrameBytes);
    }

    public void write(OutputStream out, String body) throws IOException {
        byte[] compressed = compress(body.getBytes(StandardCharsets.UTF_8));
        DataOutputStream data = new DataOutputStream(out);
        data.writeInt(compressed.length);
        data.write(compressed);
        data.flush();
    }

    /**
     * Reads one frame.
     *
     * @return the decompressed body, or {@code null} on clean end of stream before a frame starts
     * @throws FrameException if the frame is oversized or not valid zlib
     */
    public String read(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        int length;
        try {
            length = data.readInt();
        } catch (EOFException eof) {
            return null;
        }
        if (length <= 0 || length > maxFrameBytes) {
            throw new FrameException("invalid frame length: " + length);
        }
        byte[] compressed = new byte[length];
        data.readFully(compressed);
        return new String(decompress(compressed), StandardCharsets.UTF_8);
    }

    private static byte[] compress(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            byte[] buf = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private byte[] decompress(byte[] compressed) throws FrameException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 2);
            byte[] buf = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new FrameException("truncated zlib body");
                }
                out.write(buf, 0, n);
                // Decompression bombs are bounded by the same limit as frames.
                if (out.size() > maxFrameBytes) {
                    throw new FrameException("decompressed body exceeds " + maxFrameBytes + " bytes");
                }
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new FrameException("invalid zlib body: " + e.getMessage());
        } finally {
            inflater.end();
        }
    }

    public static final class FrameException extends IOException {
        public FrameException(String message) {
            super(message);
        }
    }
}
