package io.judgebridge.server;

import io.judgebridge.protocol.PacketCodec;
import io.judgebridge.session.JudgeSession;
import io.judgebridge.session.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class JudgeServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JudgeServer.class);

    private final String host;
    private final int port;
    private final SessionContext context;
    private final PacketCodec codec;
    private final Set<JudgeSession> live;
    private volatile ServerSocket serverSocket;
    private volatile boolean running;

    public JudgeServer(String host, int port, SessionContext context) {
        this(host, port, context, new PacketCodec());
    }

    public JudgeServer(String host, int port, SessionContext context, PacketCodec codec) {
        this.host = host;
        this.port = port;
        this.context = context;
        this.codec = codec;
        this.live = ConcurrentHashMap.newKeySet();
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(host, port));
        serverSocket = socket;
        running = true;
        Thread acceptor = new Thread(this::acceptLoop, "judge-accept");
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("Judge server listening on {}", socket.getLocalSocketAddress());
    }

    public int localPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public List<JudgeSession> liveSessions() {
        return List.copyOf(live);
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    log.error("Accept failed", e);
                    continue;
                }
                return;
            }
            Thread reader = new Thread(() -> handle(socket), "judge-conn-" + socket.getRemoteSocketAddress());
            reader.setDaemon(true);
            reader.start();
        }
    }

    private void handle(Socket socket) {
        SocketTransport transport;
        try {
            socket.setTcpNoDelay(true);
            transport = new SocketTransport(socket, codec);
        } catch (IOException e) {
            log.warn("Could not set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
            closeQuietly(socket);
            return;
        }
        JudgeSession session = new JudgeSession(transport, context);
        live.add(session);
        try {
            transport.serve(session);
        } finally {
            live.remove(session);
        }
    }

    @Override
    public synchronized void close() {
        running = false;
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Server socket close failed: {}", e.getMessage());
            }
        }
        for (JudgeSession session : List.copyOf(live)) {
            session.disconnect(true);
        }
        log.info("Judge server stopped");
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Socket close failed: {}", e.getMessage());
        }
    }
}
