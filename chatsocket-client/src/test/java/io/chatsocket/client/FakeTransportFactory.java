package io.chatsocket.client;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * TransportFactory for tests, handing out {@link FakeTransport}s which the test then plays the server side of.
 */
class FakeTransportFactory implements Transport.TransportFactory {
    private static final ObjectMapper JSON = JsonMapper.builder().build();

    private final List<FakeTransport> _transports = new ArrayList<>();

    @Override
    public synchronized Transport open(URI uri, Transport.TransportListener listener) {
        FakeTransport transport = new FakeTransport(listener);
        _transports.add(transport);
        return transport;
    }

    synchronized int count() {
        return _transports.size();
    }

    synchronized FakeTransport get(int index) {
        return _transports.get(index);
    }

    synchronized FakeTransport last() {
        return _transports.get(_transports.size() - 1);
    }

    static class FakeTransport implements Transport {
        private final Transport.TransportListener _listener;
        private final List<String> _sent = new ArrayList<>();
        private boolean _open;
        private boolean _closed;
        private boolean _failSends;
        private Integer _closeCode;
        private String _closeReason;

        FakeTransport(Transport.TransportListener listener) {
            _listener = listener;
        }

        // :: Transport

        @Override
        public synchronized boolean isOpen() {
            return _open && !_closed;
        }

        @Override
        public synchronized void sendText(String text) throws IOException {
            if (!isOpen()) {
                throw new IOException("Not open");
            }
            if (_failSends) {
                throw new IOException("Simulated send failure");
            }
            _sent.add(text);
        }

        @Override
        public synchronized void close(int code, String reason) {
            if (_closed) {
                return;
            }
            _closed = true;
            _closeCode = code;
            _closeReason = reason;
        }

        // :: Playing the server side

        void open() {
            synchronized (this) {
                _open = true;
            }
            _listener.transportOpened();
        }

        void serverSends(String text) {
            _listener.textReceived(text);
        }

        void serverCloses(int code, String reason) {
            synchronized (this) {
                _closed = true;
            }
            _listener.transportClosed(code, reason);
        }

        void fail(Throwable throwable) {
            _listener.transportError(throwable);
        }

        synchronized void setFailSends(boolean failSends) {
            _failSends = failSends;
        }

        // :: Inspection

        synchronized boolean isClosed() {
            return _closed;
        }

        synchronized Integer getCloseCode() {
            return _closeCode;
        }

        synchronized String getCloseReason() {
            return _closeReason;
        }

        synchronized List<String> getSent() {
            return new ArrayList<>(_sent);
        }

        @SuppressWarnings("unchecked")
        synchronized List<Map<String, Object>> getSentFrames() {
            List<Map<String, Object>> frames = new ArrayList<>();
            for (String text : _sent) {
                frames.add(JSON.readValue(text, Map.class));
            }
            return frames;
        }

        List<String> getSentTypes() {
            List<String> types = new ArrayList<>();
            for (Map<String, Object> frame : getSentFrames()) {
                types.add((String) frame.get("type"));
            }
            return types;
        }
    }
}
