package io.judgebridge.session;

public interface Transport {
    /**
     * Sends one encoded message.
     *
     * @throws java.io.UncheckedIOException if the write fails
     */
    void send(String message);

    void setTimeout(long timeoutMs);

    // Idempotent.
    void close();

    boolean isOpen();

    String remoteAddress();
}
