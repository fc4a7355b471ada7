package io.judgebridge.server;

import io.judgebridge.protocol.PacketCodec;
import io.judgebridge.session.JudgeSession;
import io.judgebridge.session.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class SocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

    private final Socket socket;
    private final PacketCodec codec;
    private final InputStream in;
    private final OutputStream out;
    private final Object writeLock;
    private final AtomicBoolean closed;
    private final String remoteAddress;

    public SocketTransport(Socket socket, PacketCodec codec) throws IOException {
        this.socket = socket;
        this.codec = codec;
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = new BufferedOutputStream(socket.getOutputStream());
        this.writeLock = new Object();
        this.closed = new AtomicBoolean(false);
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void send(String message) {
        synchronized (writeLock) {
            try {
                codec.write(out, message);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to send to judge at " + remoteAddress, e);
            }
        }
    }

    @Override
    public void setTimeout(long timeoutMs) {
        try {
            socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeoutMs)));
        } catch (SocketException e) {
            log.warn("Could not set timeout for {}: {}", remoteAddress, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", remoteAddress, e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !socket.isClosed();
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    // Always ends with exactly one onDisconnect().
    public void serve(JudgeSession session) {
        try {
            session.onConnect();
            while (isOpen()) {
                String frame;
                try {
                    frame = codec.read(in);
                } catch (SocketTimeoutException timeout) {
                    session.onTimeout();
                    break;
                }
                if (frame == null) {
                    break;
                }
                session.onPacket(frame);
            }
        } catch (PacketCodec.FrameException e) {
            log.warn("Unreadable frame from {}, closing: {}", remoteAddress, e.getMessage());
        } catch (IOException e) {
            if (isOpen()) {
                log.info("Connection to {} lost: {}", remoteAddress, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Read loop for {} failed", remoteAddress, e);
        } finally {
            close();
            session.onDisconnect();
        }
    }
}
