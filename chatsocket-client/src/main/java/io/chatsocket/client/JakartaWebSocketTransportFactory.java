package io.chatsocket.client;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import jakarta.websocket.ClientEndpointConfig;
import jakarta.websocket.CloseReason;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.DeploymentException;
import jakarta.websocket.Endpoint;
import jakarta.websocket.EndpointConfig;
import jakarta.websocket.Session;
import jakarta.websocket.WebSocketContainer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ChatSocketServer.ChatSocketCloseCodes;

/**
 * {@link Transport.TransportFactory} using a JSR 356 {@link WebSocketContainer}, by default the one found by
 * {@link ContainerProvider#getWebSocketContainer()}. Since <code>connectToServer(..)</code> blocks until the handshake
 * is done, each open runs on its own short-lived daemon thread.
 */
public class JakartaWebSocketTransportFactory implements Transport.TransportFactory, ClientStatics {
    private static final Logger log = LoggerFactory.getLogger(JakartaWebSocketTransportFactory.class);

    private final WebSocketContainer _webSocketContainer;

    public JakartaWebSocketTransportFactory() {
        this(ContainerProvider.getWebSocketContainer());
    }

    public JakartaWebSocketTransportFactory(WebSocketContainer webSocketContainer) {
        _webSocketContainer = webSocketContainer;
    }

    @Override
    public Transport open(URI uri, Transport.TransportListener listener) {
        JakartaWebSocketTransport transport = new JakartaWebSocketTransport(uri, listener);
        Thread thread = new Thread(transport::connect, THREAD_PREFIX + "Connect {" + uri + '}');
        thread.setDaemon(true);
        thread.start();
        return transport;
    }

    private class JakartaWebSocketTransport extends Endpoint implements Transport {
        private final URI _uri;
        private final TransportListener _listener;
        private final Object _webSocketSendSyncObject = new Object();

        private volatile Session _webSocketSession;
        private volatile boolean _closeRequested;
        private volatile int _closeCode;
        private volatile String _closeReason;

        JakartaWebSocketTransport(URI uri, TransportListener listener) {
            _uri = uri;
            _listener = listener;
        }

        void connect() {
            log.debug("Connecting to [" + _uri + "].");
            try {
                _webSocketContainer.connectToServer(this, ClientEndpointConfig.Builder.create().build(), _uri);
            }
            catch (DeploymentException | IOException | RuntimeException e) {
                // ?: Were we closed while connecting?
                if (_closeRequested) {
                    // -> Yes, so nobody cares about the failure.
                    log.debug("Connect to [" + _uri + "] failed after close was requested, ignoring.", e);
                    return;
                }
                log.info("Could not connect to [" + _uri + "]: " + e.getMessage());
                _listener.transportError(e);
            }
        }

        @Override
        public void onOpen(Session session, EndpointConfig config) {
            _webSocketSession = session;
            // ?: Was close requested while we were connecting?
            if (_closeRequested) {
                // -> Yes, so close right away.
                closeWebSocket(session, _closeCode, _closeReason);
                return;
            }
            session.addMessageHandler(String.class, _listener::textReceived);
            _listener.transportOpened();
        }

        @Override
        public void onClose(Session session, CloseReason closeReason) {
            _listener.transportClosed(closeReason.getCloseCode().getCode(), closeReason.getReasonPhrase());
        }

        @Override
        public void onError(Session session, Throwable thr) {
            _listener.transportError(thr);
        }

        @Override
        public boolean isOpen() {
            Session session = _webSocketSession;
            return (session != null) && session.isOpen();
        }

        @Override
        public void sendText(String text) throws IOException {
            Session session = _webSocketSession;
            if ((session == null) || !session.isOpen()) {
                throw new IOException("WebSocket to [" + _uri + "] is not open.");
            }
            synchronized (_webSocketSendSyncObject) {
                session.getBasicRemote().sendText(text);
            }
        }

        @Override
        public void close(int code, String reason) {
            _closeCode = code;
            _closeReason = reason;
            _closeRequested = true;
            Session session = _webSocketSession;
            if ((session != null) && session.isOpen()) {
                closeWebSocket(session, code, reason);
            }
        }

        private void closeWebSocket(Session session, int code, String reasonPhrase) {
            // The close frame's reason can max be 123 bytes.
            while (reasonPhrase != null
                    && reasonPhrase.getBytes(StandardCharsets.UTF_8).length > MAX_CLOSE_REASON_BYTES) {
                reasonPhrase = reasonPhrase.substring(0, reasonPhrase.length() - 1);
            }
            try {
                session.close(new CloseReason(ChatSocketCloseCodes.getCloseCode(code), reasonPhrase));
            }
            catch (IOException e) {
                log.warn("Got Exception when trying to close WebSocket to [" + _uri + "], ignoring.", e);
            }
        }
    }
}
