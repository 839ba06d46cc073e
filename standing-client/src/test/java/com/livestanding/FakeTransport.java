package com.livestanding;

import com.livestanding.connection.FeedTransport;
import com.livestanding.connection.TransportConnection;
import com.livestanding.connection.TransportListener;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport: each open() is recorded as an attempt the test drives by hand.
 */
class FakeTransport implements FeedTransport {

    private final List<Attempt> attempts = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failNextOpen;
    private volatile boolean shutdown;

    @Override
    public void open(URI endpoint, TransportListener listener) {
        RuntimeException failure = failNextOpen;
        if (failure != null) {
            failNextOpen = null;
            throw failure;
        }
        attempts.add(new Attempt(endpoint, listener));
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    void failNextOpen(RuntimeException failure) {
        this.failNextOpen = failure;
    }

    int openCount() {
        return attempts.size();
    }

    Attempt attempt(int index) {
        return attempts.get(index);
    }

    Attempt last() {
        return attempts.get(attempts.size() - 1);
    }

    boolean isShutdown() {
        return shutdown;
    }

    static class Attempt {

        final URI endpoint;
        final TransportListener listener;
        final FakeConnection connection = new FakeConnection();

        Attempt(URI endpoint, TransportListener listener) {
            this.endpoint = endpoint;
            this.listener = listener;
        }

        /** Transport opened, then the server accepted the credential. */
        void openAndAuthenticate() {
            open();
            text("{\"code\":201}");
        }

        void open() {
            listener.onOpen(connection);
        }

        void text(String frame) {
            listener.onText(frame);
        }

        void payload(String data) {
            listener.onText("{\"code\":200,\"data\":" + quote(data) + "}");
        }

        void closed() {
            listener.onClosed();
        }

        void error(Throwable cause) {
            listener.onError(cause);
        }

        private static String quote(String data) {
            return "\"" + data.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
    }

    static class FakeConnection implements TransportConnection {

        final List<String> sent = new ArrayList<>();
        volatile boolean closed;

        @Override
        public synchronized void send(String text) {
            if (closed) {
                throw new IllegalStateException("Connection is not open");
            }
            sent.add(text);
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public boolean isActive() {
            return !closed;
        }
    }
}
